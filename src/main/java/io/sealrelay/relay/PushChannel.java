package io.sealrelay.relay;

import io.sealrelay.model.Delivery;

/**
 * Long-lived server-to-client channel owned by one connected identity.
 */
public interface PushChannel {
    String clientId();

    /**
     * Returns only after the delivery was written to the transport. The relay calls this while holding
     * the recipient's queue lock, so a client that stops reading without closing its socket stalls
     * submits to that recipient until the underlying write fails.
     * Implementations may fail a write instead of blocking; the entry then stays queued.
     *
     * @throws TransportFailureException if the delivery was not written; the channel may remain open
     */
    void send(Delivery delivery) throws TransportFailureException;

    void close(String reason);

    boolean isOpen();
}
