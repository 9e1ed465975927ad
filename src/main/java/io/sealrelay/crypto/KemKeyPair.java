package io.sealrelay.crypto;

import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPublicKeyParameters;

import java.security.SecureRandom;

/**
 * ML-KEM-1024 key pair backing the post-quantum prekey.
 */
public final class KemKeyPair {
    private static final MLKEMParameters PARAMETERS = MLKEMParameters.ml_kem_1024;

    private final MLKEMPrivateKeyParameters privateKey;

    private KemKeyPair(MLKEMPrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
    }

    public static KemKeyPair generate(SecureRandom random) {
        MLKEMKeyPairGenerator generator = new MLKEMKeyPairGenerator();
        generator.init(new MLKEMKeyGenerationParameters(random, PARAMETERS));
        return new KemKeyPair((MLKEMPrivateKeyParameters) generator.generateKeyPair().getPrivate());
    }

    public static KemKeyPair fromPrivateKey(byte[] encoded) {
        return new KemKeyPair(new MLKEMPrivateKeyParameters(PARAMETERS, encoded));
    }

    /**
     * True when {@code encoded} parses as an ML-KEM-1024 public key.
     */
    public static boolean isPublicKey(byte[] encoded) {
        try {
            new MLKEMPublicKeyParameters(PARAMETERS, encoded);
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    public byte[] publicKey() {
        return privateKey.getPublicKeyParameters().getEncoded();
    }

    public byte[] privateKey() {
        return privateKey.getEncoded();
    }
}
