package io.sealrelay.material;

import io.sealrelay.storage.EncryptedRecordStore;
import org.whispersystems.libsignal.state.PreKeyRecord;
import org.whispersystems.libsignal.state.PreKeyStore;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

final class StorePreKeyStore implements PreKeyStore {
    private static final MaterialCategory CATEGORY = MaterialCategory.PRE_KEY;

    private final EncryptedRecordStore records;
    private final PreKeyRetention retention;

    StorePreKeyStore(EncryptedRecordStore records, PreKeyRetention retention) {
        this.records = records;
        this.retention = retention;
    }

    @Override
    public PreKeyRecord loadPreKey(int preKeyId) {
        byte[] raw = records.getBytes(CATEGORY.recordKey(preKeyId))
                .orElseThrow(() -> new MaterialNotFoundException(CATEGORY, preKeyId));
        try {
            return new PreKeyRecord(raw);
        } catch (IOException e) {
            throw new IllegalStateException("Stored " + CATEGORY.displayName() + " " + preKeyId + " is corrupt", e);
        }
    }

    @Override
    public void storePreKey(int preKeyId, PreKeyRecord record) {
        records.set(CATEGORY.recordKey(preKeyId), record.serialize());
    }

    @Override
    public boolean containsPreKey(int preKeyId) {
        return records.contains(CATEGORY.recordKey(preKeyId));
    }

    // Called by the session library once a prekey message has consumed the prekey.
    @Override
    public void removePreKey(int preKeyId) {
        if (retention == PreKeyRetention.DELETE) {
            records.delete(CATEGORY.recordKey(preKeyId));
            return;
        }
        records.set(CATEGORY.usedKey(preKeyId), Map.of("usedAt", Instant.now().toEpochMilli()));
    }

    boolean isUsed(int preKeyId) {
        return records.contains(CATEGORY.usedKey(preKeyId));
    }
}
