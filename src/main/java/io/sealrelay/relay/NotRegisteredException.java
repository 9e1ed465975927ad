package io.sealrelay.relay;

public final class NotRegisteredException extends RelayException {
    public NotRegisteredException(String message) {
        super(404, message);
    }
}
