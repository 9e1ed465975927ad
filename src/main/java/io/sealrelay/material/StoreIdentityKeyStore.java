package io.sealrelay.material;

import io.sealrelay.storage.EncryptedRecordStore;
import org.whispersystems.libsignal.IdentityKey;
import org.whispersystems.libsignal.IdentityKeyPair;
import org.whispersystems.libsignal.InvalidKeyException;
import org.whispersystems.libsignal.SignalProtocolAddress;
import org.whispersystems.libsignal.state.IdentityKeyStore;

import java.util.Optional;

/**
 * Trust on first use: the first key seen for an address is stored, later keys must match it.
 */
final class StoreIdentityKeyStore implements IdentityKeyStore {
    private final MaterialStore material;
    private final EncryptedRecordStore records;

    StoreIdentityKeyStore(MaterialStore material, EncryptedRecordStore records) {
        this.material = material;
        this.records = records;
    }

    @Override
    public IdentityKeyPair getIdentityKeyPair() {
        return material.identityKeyPair();
    }

    @Override
    public int getLocalRegistrationId() {
        return material.requireLocalIdentity().registrationId();
    }

    @Override
    public boolean saveIdentity(SignalProtocolAddress address, IdentityKey identityKey) {
        return recordIdentity(address, identityKey) == IdentityChange.CHANGED;
    }

    IdentityChange recordIdentity(SignalProtocolAddress address, IdentityKey identityKey) {
        Optional<IdentityKey> existing = storedIdentity(address);
        if (existing.isPresent() && existing.get().equals(identityKey)) {
            return IdentityChange.UNCHANGED;
        }
        records.set(key(address), identityKey.serialize());
        return existing.isPresent() ? IdentityChange.CHANGED : IdentityChange.NEW;
    }

    @Override
    public boolean isTrustedIdentity(SignalProtocolAddress address, IdentityKey identityKey, Direction direction) {
        return storedIdentity(address).map(stored -> stored.equals(identityKey)).orElse(true);
    }

    @Override
    public IdentityKey getIdentity(SignalProtocolAddress address) {
        return storedIdentity(address).orElse(null);
    }

    Optional<IdentityKey> storedIdentity(SignalProtocolAddress address) {
        return records.getBytes(key(address)).map(raw -> {
            try {
                return new IdentityKey(raw, 0);
            } catch (InvalidKeyException e) {
                throw new IllegalStateException("Stored identity key for " + address + " is corrupt", e);
            }
        });
    }

    private static String key(SignalProtocolAddress address) {
        return "identity:" + address.getName() + "." + address.getDeviceId();
    }
}
