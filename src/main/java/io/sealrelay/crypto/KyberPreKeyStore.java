package io.sealrelay.crypto;

import java.util.OptionalInt;

/**
 * Storage contract for post-quantum prekeys. Each one is issued together with a signed prekey; a
 * prekey message names only the signed prekey, so the pairing is kept to find the post-quantum prekey
 * that message consumed.
 */
public interface KyberPreKeyStore {
    /**
     * Throws an unchecked not-found exception naming {@code kyberPreKeyId} when it is absent.
     */
    KyberPreKeyRecord loadKyberPreKey(int kyberPreKeyId);

    void storeKyberPreKey(int kyberPreKeyId, KyberPreKeyRecord record);

    void pairWithSignedPreKey(int kyberPreKeyId, int signedPreKeyId);

    OptionalInt pairedKyberPreKey(int signedPreKeyId);

    void markKyberPreKeyUsed(int kyberPreKeyId, int signedPreKeyId, byte[] baseKey);

    boolean isKyberPreKeyUsed(int kyberPreKeyId);
}
