package io.sealrelay.protocol;

/**
 * The peer presented an identity key different from the one recorded on first contact.
 */
public final class UntrustedPeerException extends SessionProtocolException {
    private final String peerId;

    public UntrustedPeerException(String peerId, Throwable cause) {
        super("Identity key of " + peerId + " does not match the key recorded on first contact", cause);
        this.peerId = peerId;
    }

    public String peerId() {
        return peerId;
    }
}
