package io.sealrelay.material;

import io.sealrelay.crypto.KyberPreKeyRecord;
import io.sealrelay.crypto.KyberPreKeyStore;
import io.sealrelay.storage.EncryptedRecordStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

final class StoreKyberPreKeyStore implements KyberPreKeyStore {
    private static final MaterialCategory CATEGORY = MaterialCategory.KYBER_PRE_KEY;
    private static final String PAIRING_PREFIX = "kyberprekey:signed:";

    private final EncryptedRecordStore records;

    StoreKyberPreKeyStore(EncryptedRecordStore records) {
        this.records = records;
    }

    @Override
    public KyberPreKeyRecord loadKyberPreKey(int kyberPreKeyId) {
        return records.getBytes(CATEGORY.recordKey(kyberPreKeyId))
                .map(KyberPreKeyRecord::deserialize)
                .orElseThrow(() -> new MaterialNotFoundException(CATEGORY, kyberPreKeyId));
    }

    @Override
    public void storeKyberPreKey(int kyberPreKeyId, KyberPreKeyRecord record) {
        records.set(CATEGORY.recordKey(kyberPreKeyId), record.serialize());
    }

    @Override
    public void pairWithSignedPreKey(int kyberPreKeyId, int signedPreKeyId) {
        records.set(PAIRING_PREFIX + signedPreKeyId, kyberPreKeyId);
    }

    @Override
    public OptionalInt pairedKyberPreKey(int signedPreKeyId) {
        return records.get(PAIRING_PREFIX + signedPreKeyId, Integer.class)
                .map(OptionalInt::of)
                .orElse(OptionalInt.empty());
    }

    // Post-quantum prekeys are last-resort keys: marked, never deleted, whatever the one-time policy.
    @Override
    public void markKyberPreKeyUsed(int kyberPreKeyId, int signedPreKeyId, byte[] baseKey) {
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("signedPreKeyId", signedPreKeyId);
        marker.put("baseKey", baseKey);
        marker.put("usedAt", Instant.now().toEpochMilli());
        records.set(CATEGORY.usedKey(kyberPreKeyId), marker);
    }

    @Override
    public boolean isKyberPreKeyUsed(int kyberPreKeyId) {
        return records.contains(CATEGORY.usedKey(kyberPreKeyId));
    }
}
