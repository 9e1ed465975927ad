package io.sealrelay.relay;

/**
 * A push channel was requested for an identity the relay does not know.
 */
public final class UnauthorizedException extends RelayException {
    public UnauthorizedException(String message) {
        super(401, message);
    }
}
