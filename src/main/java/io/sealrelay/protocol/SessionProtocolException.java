package io.sealrelay.protocol;

/**
 * A session could not be established, or a message could not be encrypted or decrypted. The session
 * library's checked exception is kept as the cause.
 */
public class SessionProtocolException extends RuntimeException {
    public SessionProtocolException(String message) {
        super(message);
    }

    public SessionProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
