package io.sealrelay.relay;

/**
 * Request-level relay failure mapped onto an HTTP status by {@link RelayHttpServer}.
 */
public abstract class RelayException extends RuntimeException {
    private final int status;

    protected RelayException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
