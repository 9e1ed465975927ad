package io.sealrelay.model;

/**
 * Publishable public key material of one identity. All keys and signatures are base64.
 */
public record Bundle(
        String id,
        int deviceId,
        int registrationId,
        String identityKey,
        SignedPreKey signedPreKey,
        PreKey preKey,
        KyberPreKey kyberPreKey
) {
    public record SignedPreKey(int keyId, String publicKey, String signature) {
    }

    public record PreKey(int keyId, String publicKey) {
    }

    public record KyberPreKey(int keyId, String publicKey, String signature) {
    }
}
