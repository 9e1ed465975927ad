package io.sealrelay.material;

import io.sealrelay.storage.EncryptedRecordStore;
import org.whispersystems.libsignal.state.SignedPreKeyRecord;
import org.whispersystems.libsignal.state.SignedPreKeyStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

final class StoreSignedPreKeyStore implements SignedPreKeyStore {
    private static final MaterialCategory CATEGORY = MaterialCategory.SIGNED_PRE_KEY;

    private final EncryptedRecordStore records;

    StoreSignedPreKeyStore(EncryptedRecordStore records) {
        this.records = records;
    }

    @Override
    public SignedPreKeyRecord loadSignedPreKey(int signedPreKeyId) {
        byte[] raw = records.getBytes(CATEGORY.recordKey(signedPreKeyId))
                .orElseThrow(() -> new MaterialNotFoundException(CATEGORY, signedPreKeyId));
        return decode(signedPreKeyId, raw);
    }

    @Override
    public List<SignedPreKeyRecord> loadSignedPreKeys() {
        List<SignedPreKeyRecord> out = new ArrayList<>();
        for (String key : records.listKeysByPrefix(CATEGORY.recordPrefix())) {
            OptionalInt id = CATEGORY.parseRecordKey(key);
            if (id.isPresent()) {
                out.add(loadSignedPreKey(id.getAsInt()));
            }
        }
        return out;
    }

    @Override
    public void storeSignedPreKey(int signedPreKeyId, SignedPreKeyRecord record) {
        records.set(CATEGORY.recordKey(signedPreKeyId), record.serialize());
    }

    @Override
    public boolean containsSignedPreKey(int signedPreKeyId) {
        return records.contains(CATEGORY.recordKey(signedPreKeyId));
    }

    @Override
    public void removeSignedPreKey(int signedPreKeyId) {
        records.delete(CATEGORY.recordKey(signedPreKeyId));
    }

    private static SignedPreKeyRecord decode(int signedPreKeyId, byte[] raw) {
        try {
            return new SignedPreKeyRecord(raw);
        } catch (IOException e) {
            throw new IllegalStateException("Stored " + CATEGORY.displayName() + " " + signedPreKeyId + " is corrupt", e);
        }
    }
}
