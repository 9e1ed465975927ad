package io.sealrelay.model;

/**
 * Malformed request or wire record. Raised before any state is touched.
 */
public final class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
