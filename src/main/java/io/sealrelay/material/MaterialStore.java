package io.sealrelay.material;

import com.fasterxml.jackson.databind.JsonNode;
import io.sealrelay.crypto.KyberPreKeyRecord;
import io.sealrelay.model.InboxMessage;
import io.sealrelay.storage.EncryptedRecordStore;
import org.whispersystems.libsignal.IdentityKey;
import org.whispersystems.libsignal.IdentityKeyPair;
import org.whispersystems.libsignal.InvalidKeyException;
import org.whispersystems.libsignal.ecc.Curve;
import org.whispersystems.libsignal.ecc.ECKeyPair;
import org.whispersystems.libsignal.state.PreKeyRecord;
import org.whispersystems.libsignal.state.SignedPreKeyRecord;
import org.whispersystems.libsignal.util.KeyHelper;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Local identity and private key material of one identity, kept in an {@link EncryptedRecordStore}.
 *
 * <p>Single writer per store: prekey counters are read and then incremented without cross-process
 * coordination.
 */
public final class MaterialStore implements AutoCloseable {
    public static final int DEFAULT_DEVICE_ID = 1;
    static final String IDENTITY_KEY_PAIR = "local:identityKeyPair";
    static final String META_LOCAL_ID = "localId";
    static final String META_DEVICE_ID = "deviceId";
    static final String META_REGISTRATION_ID = "registrationId";
    private static final String INBOX_PREFIX = "inbox:";

    private final EncryptedRecordStore records;
    private final SecureRandom random;
    private final StorePreKeyStore preKeys;
    private final StoreSignedPreKeyStore signedPreKeys;
    private final StoreKyberPreKeyStore kyberPreKeys;
    private final MaterialProtocolStore protocolStore;

    public MaterialStore(EncryptedRecordStore records, PreKeyRetention retention) {
        this.records = records;
        this.random = new SecureRandom();
        this.preKeys = new StorePreKeyStore(records, retention);
        this.signedPreKeys = new StoreSignedPreKeyStore(records);
        this.kyberPreKeys = new StoreKyberPreKeyStore(records);
        this.protocolStore = new MaterialProtocolStore(
                new StoreIdentityKeyStore(this, records),
                new StoreSessionStore(records),
                preKeys,
                signedPreKeys,
                kyberPreKeys
        );
    }

    public static MaterialStore open(Path path, String passphrase) {
        return open(path, passphrase, PreKeyRetention.RETAIN);
    }

    public static MaterialStore open(Path path, String passphrase, PreKeyRetention retention) {
        return new MaterialStore(EncryptedRecordStore.open(path, passphrase), retention);
    }

    /**
     * Creates a fresh identity key pair and registration id. Overwrites any existing identity.
     */
    public LocalIdentity initializeIdentity(String localId, int deviceId) {
        if (localId == null || localId.isBlank()) {
            throw new IllegalArgumentException("localId must not be blank");
        }
        if (deviceId < 1) {
            throw new IllegalArgumentException("deviceId must be positive");
        }
        int registrationId = KeyHelper.generateRegistrationId(false);
        IdentityKeyPair identity = KeyHelper.generateIdentityKeyPair();
        records.setMeta(META_LOCAL_ID, localId);
        records.setMeta(META_DEVICE_ID, deviceId);
        records.setMeta(META_REGISTRATION_ID, registrationId);
        records.set(IDENTITY_KEY_PAIR, identity.serialize());
        return new LocalIdentity(localId, deviceId, registrationId, identity.getPublicKey());
    }

    public boolean hasIdentity() {
        return records.getMeta(META_LOCAL_ID).isPresent() && records.contains(IDENTITY_KEY_PAIR);
    }

    public Optional<LocalIdentity> localIdentity() {
        Optional<JsonNode> localId = records.getMeta(META_LOCAL_ID);
        if (localId.isEmpty() || !records.contains(IDENTITY_KEY_PAIR)) {
            return Optional.empty();
        }
        return Optional.of(new LocalIdentity(
                localId.get().asText(),
                records.getMeta(META_DEVICE_ID).map(JsonNode::asInt).orElse(DEFAULT_DEVICE_ID),
                records.getMeta(META_REGISTRATION_ID).map(JsonNode::asInt).orElse(0),
                identityKeyPair().getPublicKey()
        ));
    }

    public LocalIdentity requireLocalIdentity() {
        return localIdentity().orElseThrow(MaterialStore::notInitialized);
    }

    public IdentityKeyPair identityKeyPair() {
        byte[] raw = records.getBytes(IDENTITY_KEY_PAIR).orElseThrow(MaterialStore::notInitialized);
        try {
            return new IdentityKeyPair(raw);
        } catch (InvalidKeyException e) {
            throw new IllegalStateException("Stored identity key pair is corrupt", e);
        }
    }

    /**
     * Issues {@code count} one-time prekeys plus one signed prekey and one post-quantum prekey, all
     * signed by the local identity.
     */
    public GeneratedPreKeys generatePreKeys(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        IdentityKeyPair identity = identityKeyPair();
        long now = Instant.now().toEpochMilli();
        List<Integer> preKeyIds = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int id = nextId(MaterialCategory.PRE_KEY);
            preKeys.storePreKey(id, new PreKeyRecord(id, Curve.generateKeyPair()));
            preKeyIds.add(id);
        }
        int signedId = nextId(MaterialCategory.SIGNED_PRE_KEY);
        signedPreKeys.storeSignedPreKey(signedId, signedPreKey(signedId, now, identity));
        int kyberId = nextId(MaterialCategory.KYBER_PRE_KEY);
        kyberPreKeys.storeKyberPreKey(kyberId, KyberPreKeyRecord.create(kyberId, now, identity, random));
        kyberPreKeys.pairWithSignedPreKey(kyberId, signedId);
        return new GeneratedPreKeys(List.copyOf(preKeyIds), signedId, kyberId);
    }

    /**
     * Most recently issued id in {@code category}, empty when none was ever issued.
     */
    public OptionalInt latestId(MaterialCategory category) {
        Optional<Long> next = records.get(category.counterKey(), Long.class);
        if (next.isEmpty() || next.get() <= 1L) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) (next.get() - 1L));
    }

    public boolean isPreKeyUsed(int preKeyId) {
        return preKeys.isUsed(preKeyId);
    }

    public boolean isKyberPreKeyUsed(int kyberPreKeyId) {
        return kyberPreKeys.isKyberPreKeyUsed(kyberPreKeyId);
    }

    public MaterialProtocolStore protocolStore() {
        return protocolStore;
    }

    public void saveInboxMessage(InboxMessage message) {
        records.set(INBOX_PREFIX + message.id(), message);
    }

    public List<InboxMessage> listInboxMessages() {
        List<InboxMessage> out = new ArrayList<>();
        for (String key : records.listKeysByPrefix(INBOX_PREFIX)) {
            records.get(key, InboxMessage.class).ifPresent(out::add);
        }
        out.sort(Comparator.comparingLong(InboxMessage::timestamp));
        return out;
    }

    public Path path() {
        return records.path();
    }

    @Override
    public void close() {
        records.close();
    }

    private int nextId(MaterialCategory category) {
        long current = records.get(category.counterKey(), Long.class).orElse(1L);
        records.set(category.counterKey(), current + 1L);
        return (int) current;
    }

    private static SignedPreKeyRecord signedPreKey(int id, long timestamp, IdentityKeyPair identity) {
        ECKeyPair keyPair = Curve.generateKeyPair();
        try {
            byte[] signature = Curve.calculateSignature(identity.getPrivateKey(), keyPair.getPublicKey().serialize());
            return new SignedPreKeyRecord(id, timestamp, keyPair, signature);
        } catch (InvalidKeyException e) {
            throw new IllegalStateException("Identity key cannot sign signed prekey " + id, e);
        }
    }

    private static IllegalStateException notInitialized() {
        return new IllegalStateException("Identity key pair not found. Run 'sealrelay init'.");
    }

    public record LocalIdentity(String localId, int deviceId, int registrationId, IdentityKey publicKey) {
    }

    public record GeneratedPreKeys(List<Integer> preKeyIds, int signedPreKeyId, int kyberPreKeyId) {
    }
}
