package io.sealrelay.security;

/**
 * Raised when a sealed record fails authentication. Either the passphrase is wrong or the stored
 * bytes were modified; the two cases are indistinguishable by construction.
 */
public final class TamperOrWrongPassphraseException extends RuntimeException {
    public TamperOrWrongPassphraseException(String message) {
        super(message);
    }

    public TamperOrWrongPassphraseException(String message, Throwable cause) {
        super(message, cause);
    }
}
