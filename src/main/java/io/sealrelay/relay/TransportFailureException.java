package io.sealrelay.relay;

/**
 * A push over an open channel did not complete. Handled inside the relay; the affected entry stays
 * undelivered.
 */
public final class TransportFailureException extends Exception {
    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
