package io.sealrelay.crypto;

import io.sealrelay.util.Jsons;
import org.whispersystems.libsignal.IdentityKey;
import org.whispersystems.libsignal.IdentityKeyPair;
import org.whispersystems.libsignal.InvalidKeyException;
import org.whispersystems.libsignal.ecc.Curve;

import java.security.SecureRandom;

/**
 * Post-quantum prekey: an ML-KEM key pair whose public half is signed by the identity key, the same
 * way a signed prekey is.
 */
public final class KyberPreKeyRecord {
    private final int id;
    private final long timestamp;
    private final KemKeyPair keyPair;
    private final byte[] signature;

    public KyberPreKeyRecord(int id, long timestamp, KemKeyPair keyPair, byte[] signature) {
        this.id = id;
        this.timestamp = timestamp;
        this.keyPair = keyPair;
        this.signature = signature.clone();
    }

    public static KyberPreKeyRecord create(int id, long timestamp, IdentityKeyPair identity, SecureRandom random) {
        KemKeyPair keyPair = KemKeyPair.generate(random);
        try {
            byte[] signature = Curve.calculateSignature(identity.getPrivateKey(), keyPair.publicKey());
            return new KyberPreKeyRecord(id, timestamp, keyPair, signature);
        } catch (InvalidKeyException e) {
            throw new IllegalStateException("Identity key cannot sign post-quantum prekey " + id, e);
        }
    }

    /**
     * Checks a published post-quantum public key against the signature made by {@code identityKey}.
     */
    public static boolean verify(IdentityKey identityKey, byte[] publicKey, byte[] signature) {
        if (!KemKeyPair.isPublicKey(publicKey)) {
            return false;
        }
        try {
            return Curve.verifySignature(identityKey.getPublicKey(), publicKey, signature);
        } catch (InvalidKeyException e) {
            return false;
        }
    }

    public static KyberPreKeyRecord deserialize(byte[] serialized) {
        Stored stored = Jsons.fromJson(serialized, Stored.class);
        return new KyberPreKeyRecord(
                stored.id(),
                stored.timestamp(),
                KemKeyPair.fromPrivateKey(stored.privateKey()),
                stored.signature()
        );
    }

    public int id() {
        return id;
    }

    public long timestamp() {
        return timestamp;
    }

    public KemKeyPair keyPair() {
        return keyPair;
    }

    public byte[] signature() {
        return signature.clone();
    }

    public byte[] serialize() {
        return Jsons.toJsonBytes(new Stored(id, timestamp, keyPair.privateKey(), signature));
    }

    private record Stored(int id, long timestamp, byte[] privateKey, byte[] signature) {
    }
}
