package io.sealrelay.security;

import org.bouncycastle.crypto.generators.SCrypt;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Persisted scrypt parameters for a record store. The salt is generated once on first open and
 * reused by every later open of the same file.
 */
public record KdfParams(String salt, int n, int r, int p, int keyLen) {
    public static final int DEFAULT_N = 16_384;
    public static final int DEFAULT_R = 8;
    public static final int DEFAULT_P = 1;
    public static final int DEFAULT_KEY_LEN = 32;
    public static final int SALT_BYTES = 16;

    public static KdfParams generate(SecureRandom random) {
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        return new KdfParams(Base64.getEncoder().encodeToString(salt), DEFAULT_N, DEFAULT_R, DEFAULT_P, DEFAULT_KEY_LEN);
    }

    public byte[] deriveKey(String passphrase) {
        validate();
        if (passphrase == null) {
            throw new IllegalArgumentException("passphrase must not be null");
        }
        byte[] saltBytes = Base64.getDecoder().decode(salt);
        return SCrypt.generate(passphrase.getBytes(StandardCharsets.UTF_8), saltBytes, n, r, p, keyLen);
    }

    private void validate() {
        if (salt == null || salt.isBlank()) {
            throw new IllegalStateException("KDF salt is missing");
        }
        if (n < 2 || (n & (n - 1)) != 0) {
            throw new IllegalStateException("KDF cost n must be a power of two, got " + n);
        }
        if (r < 1 || p < 1) {
            throw new IllegalStateException("KDF parameters r/p must be positive");
        }
        if (keyLen != 16 && keyLen != 24 && keyLen != 32) {
            throw new IllegalStateException("KDF keyLen must be an AES key size, got " + keyLen);
        }
    }
}
