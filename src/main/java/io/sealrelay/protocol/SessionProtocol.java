package io.sealrelay.protocol;

import io.sealrelay.crypto.KyberPreKeyRecord;
import io.sealrelay.material.MaterialCategory;
import io.sealrelay.material.MaterialProtocolStore;
import io.sealrelay.material.MaterialStore;
import io.sealrelay.model.Bundle;
import io.sealrelay.model.Envelope;
import io.sealrelay.model.ValidationException;
import org.whispersystems.libsignal.DuplicateMessageException;
import org.whispersystems.libsignal.IdentityKey;
import org.whispersystems.libsignal.InvalidKeyException;
import org.whispersystems.libsignal.InvalidKeyIdException;
import org.whispersystems.libsignal.InvalidMessageException;
import org.whispersystems.libsignal.InvalidVersionException;
import org.whispersystems.libsignal.LegacyMessageException;
import org.whispersystems.libsignal.NoSessionException;
import org.whispersystems.libsignal.SessionBuilder;
import org.whispersystems.libsignal.SessionCipher;
import org.whispersystems.libsignal.SignalProtocolAddress;
import org.whispersystems.libsignal.UntrustedIdentityException;
import org.whispersystems.libsignal.ecc.Curve;
import org.whispersystems.libsignal.ecc.ECPublicKey;
import org.whispersystems.libsignal.protocol.CiphertextMessage;
import org.whispersystems.libsignal.protocol.PreKeySignalMessage;
import org.whispersystems.libsignal.protocol.SignalMessage;
import org.whispersystems.libsignal.state.PreKeyBundle;
import org.whispersystems.libsignal.state.PreKeyRecord;
import org.whispersystems.libsignal.state.SignedPreKeyRecord;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.OptionalInt;

/**
 * Bundle export and session handling for one {@link MaterialStore}. Key agreement, the ratchet and
 * message encryption are delegated to {@link SessionBuilder} and {@link SessionCipher}.
 */
public final class SessionProtocol {

    /**
     * Snapshot of the latest issued signed, one-time and post-quantum prekeys plus the identity key.
     */
    public Bundle exportBundle(MaterialStore store) {
        MaterialStore.LocalIdentity identity = store.requireLocalIdentity();
        MaterialProtocolStore keys = store.protocolStore();
        PreKeyRecord preKey = keys.loadPreKey(latest(store, MaterialCategory.PRE_KEY));
        SignedPreKeyRecord signed = keys.loadSignedPreKey(latest(store, MaterialCategory.SIGNED_PRE_KEY));
        KyberPreKeyRecord kyber = keys.loadKyberPreKey(latest(store, MaterialCategory.KYBER_PRE_KEY));
        return new Bundle(
                identity.localId(),
                identity.deviceId(),
                identity.registrationId(),
                b64(identity.publicKey().serialize()),
                new Bundle.SignedPreKey(
                        signed.getId(),
                        b64(signed.getKeyPair().getPublicKey().serialize()),
                        b64(signed.getSignature())
                ),
                new Bundle.PreKey(preKey.getId(), b64(preKey.getKeyPair().getPublicKey().serialize())),
                new Bundle.KyberPreKey(kyber.id(), b64(kyber.keyPair().publicKey()), b64(kyber.signature()))
        );
    }

    /**
     * Establishes an initiating session with the bundle owner. Returns false without touching the store
     * when a session with that address already exists.
     */
    public boolean initSession(MaterialStore store, Bundle bundle) {
        SignalProtocolAddress address = new SignalProtocolAddress(bundle.id(), bundle.deviceId());
        MaterialProtocolStore keys = store.protocolStore();
        if (keys.containsSession(address)) {
            return false;
        }
        PreKeyBundle preKeyBundle = toPreKeyBundle(bundle);
        boolean kyberSigned = KyberPreKeyRecord.verify(
                preKeyBundle.getIdentityKey(),
                decode(bundle.kyberPreKey().publicKey(), "bundle.kyberPreKey.publicKey"),
                decode(bundle.kyberPreKey().signature(), "bundle.kyberPreKey.signature")
        );
        if (!kyberSigned) {
            throw new SessionProtocolException("Invalid post-quantum prekey signature in bundle for " + bundle.id());
        }
        try {
            new SessionBuilder(keys, address).process(preKeyBundle);
        } catch (UntrustedIdentityException e) {
            throw new UntrustedPeerException(bundle.id(), e);
        } catch (InvalidKeyException e) {
            throw new SessionProtocolException("Invalid bundle for " + bundle.id() + ": " + e.getMessage(), e);
        }
        return true;
    }

    public boolean hasSession(MaterialStore store, String peerId) {
        return store.protocolStore().containsSession(address(peerId));
    }

    public Envelope encryptMessage(MaterialStore store, String recipientId, String plaintext) {
        MaterialStore.LocalIdentity local = store.requireLocalIdentity();
        SignalProtocolAddress address = address(recipientId);
        MaterialProtocolStore keys = store.protocolStore();
        if (!keys.containsSession(address)) {
            throw new SessionProtocolException("No session with " + recipientId + ". Run 'sealrelay session-init' first.");
        }
        CiphertextMessage message;
        try {
            message = new SessionCipher(keys, address).encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
        } catch (UntrustedIdentityException e) {
            throw new UntrustedPeerException(recipientId, e);
        }
        int messageType = message.getType();
        CiphertextType type = CiphertextType.fromWire(messageType)
                .orElseThrow(() -> new SessionProtocolException("Unexpected ciphertext type " + messageType));
        return new Envelope(
                Envelope.CURRENT_VERSION,
                local.localId(),
                recipientId,
                Envelope.sessionId(local.localId(), recipientId),
                type.wireValue(),
                b64(message.serialize()),
                Instant.now().toEpochMilli()
        );
    }

    public String decryptMessage(MaterialStore store, Envelope envelope) {
        CiphertextType type = CiphertextType.fromWire(envelope.type())
                .orElseThrow(() -> new ValidationException("Unsupported envelope type: " + envelope.type()));
        byte[] body = decode(envelope.body(), "envelope.body");
        String sender = envelope.senderId();
        MaterialProtocolStore keys = store.protocolStore();
        SessionCipher cipher = new SessionCipher(keys, address(sender));
        byte[] plaintext;
        try {
            plaintext = switch (type) {
                case PREKEY -> decryptPreKeyMessage(keys, cipher, new PreKeySignalMessage(body));
                case ESTABLISHED -> cipher.decrypt(new SignalMessage(body));
            };
        } catch (UntrustedIdentityException e) {
            throw new UntrustedPeerException(sender, e);
        } catch (DuplicateMessageException e) {
            throw new SessionProtocolException("Duplicate message from " + sender, e);
        } catch (NoSessionException e) {
            throw new SessionProtocolException("No session with " + sender, e);
        } catch (InvalidMessageException | InvalidVersionException | LegacyMessageException
                 | InvalidKeyException | InvalidKeyIdException e) {
            throw new SessionProtocolException("Invalid message from " + sender + ": " + e.getMessage(), e);
        }
        return new String(plaintext, StandardCharsets.UTF_8);
    }

    private static byte[] decryptPreKeyMessage(MaterialProtocolStore keys, SessionCipher cipher, PreKeySignalMessage message)
            throws DuplicateMessageException, LegacyMessageException, InvalidMessageException,
            InvalidKeyIdException, InvalidKeyException, UntrustedIdentityException {
        byte[] plaintext = cipher.decrypt(message);
        int signedPreKeyId = message.getSignedPreKeyId();
        byte[] baseKey = message.getBaseKey().serialize();
        keys.pairedKyberPreKey(signedPreKeyId)
                .ifPresent(kyberId -> keys.markKyberPreKeyUsed(kyberId, signedPreKeyId, baseKey));
        return plaintext;
    }

    static PreKeyBundle toPreKeyBundle(Bundle bundle) {
        try {
            return new PreKeyBundle(
                    bundle.registrationId(),
                    bundle.deviceId(),
                    bundle.preKey().keyId(),
                    point(bundle.preKey().publicKey(), "bundle.preKey.publicKey"),
                    bundle.signedPreKey().keyId(),
                    point(bundle.signedPreKey().publicKey(), "bundle.signedPreKey.publicKey"),
                    decode(bundle.signedPreKey().signature(), "bundle.signedPreKey.signature"),
                    new IdentityKey(decode(bundle.identityKey(), "bundle.identityKey"), 0)
            );
        } catch (InvalidKeyException e) {
            throw new ValidationException("bundle.identityKey is not a valid identity key", e);
        }
    }

    private static ECPublicKey point(String value, String field) {
        try {
            return Curve.decodePoint(decode(value, field), 0);
        } catch (InvalidKeyException e) {
            throw new ValidationException(field + " is not a valid public key", e);
        }
    }

    private static SignalProtocolAddress address(String peerId) {
        return new SignalProtocolAddress(peerId, MaterialStore.DEFAULT_DEVICE_ID);
    }

    private static int latest(MaterialStore store, MaterialCategory category) {
        OptionalInt id = store.latestId(category);
        if (id.isEmpty()) {
            throw new IllegalStateException("No " + category.displayName() + " generated yet. Run 'sealrelay prekey-generate'.");
        }
        return id.getAsInt();
    }

    private static String b64(byte[] raw) {
        return Base64.getEncoder().encodeToString(raw);
    }

    private static byte[] decode(String value, String field) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field + " must be base64", e);
        }
    }
}
