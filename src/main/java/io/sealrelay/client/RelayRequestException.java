package io.sealrelay.client;

import java.io.IOException;

/**
 * Non-2xx relay response. {@link #getMessage()} carries the relay's {@code error} field when present.
 */
public final class RelayRequestException extends IOException {
    private final int status;

    public RelayRequestException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
