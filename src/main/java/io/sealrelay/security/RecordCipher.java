package io.sealrelay.security;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-GCM sealing of individual record values. Blob layout is {@code iv(12) | tag(16) | ciphertext}.
 */
public final class RecordCipher {
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_TAG_BYTES = GCM_TAG_BITS / 8;
    private static final int GCM_IV_BYTES = 12;

    private final SecretKeySpec key;
    private final SecureRandom secureRandom;

    public RecordCipher(byte[] rawKey, SecureRandom secureRandom) {
        this.key = new SecretKeySpec(rawKey, "AES");
        this.secureRandom = secureRandom;
    }

    public byte[] seal(byte[] plaintext) {
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to encrypt record", e);
        }
        // JCA appends the tag; the stored layout puts it before the ciphertext.
        int ctLen = sealed.length - GCM_TAG_BYTES;
        byte[] out = new byte[GCM_IV_BYTES + sealed.length];
        System.arraycopy(iv, 0, out, 0, GCM_IV_BYTES);
        System.arraycopy(sealed, ctLen, out, GCM_IV_BYTES, GCM_TAG_BYTES);
        System.arraycopy(sealed, 0, out, GCM_IV_BYTES + GCM_TAG_BYTES, ctLen);
        return out;
    }

    public byte[] open(byte[] blob) {
        if (blob == null || blob.length < GCM_IV_BYTES + GCM_TAG_BYTES) {
            throw new TamperOrWrongPassphraseException("Sealed record is truncated");
        }
        int ctLen = blob.length - GCM_IV_BYTES - GCM_TAG_BYTES;
        byte[] joined = new byte[ctLen + GCM_TAG_BYTES];
        System.arraycopy(blob, GCM_IV_BYTES + GCM_TAG_BYTES, joined, 0, ctLen);
        System.arraycopy(blob, GCM_IV_BYTES, joined, ctLen, GCM_TAG_BYTES);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, blob, 0, GCM_IV_BYTES));
            return cipher.doFinal(joined);
        } catch (AEADBadTagException e) {
            throw new TamperOrWrongPassphraseException("Record authentication failed: wrong passphrase or tampered data", e);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to decrypt record", e);
        }
    }
}
