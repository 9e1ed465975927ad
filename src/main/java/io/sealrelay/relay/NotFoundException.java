package io.sealrelay.relay;

public final class NotFoundException extends RelayException {
    public NotFoundException(String message) {
        super(404, message);
    }
}
