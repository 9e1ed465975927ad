package io.sealrelay.material;

import io.sealrelay.storage.EncryptedRecordStore;
import org.whispersystems.libsignal.SignalProtocolAddress;
import org.whispersystems.libsignal.state.SessionRecord;
import org.whispersystems.libsignal.state.SessionStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

final class StoreSessionStore implements SessionStore {
    private static final String PREFIX = "session:";

    private final EncryptedRecordStore records;

    StoreSessionStore(EncryptedRecordStore records) {
        this.records = records;
    }

    @Override
    public SessionRecord loadSession(SignalProtocolAddress address) {
        return records.getBytes(key(address)).map(raw -> {
            try {
                return new SessionRecord(raw);
            } catch (IOException e) {
                throw new IllegalStateException("Stored session for " + address + " is corrupt", e);
            }
        }).orElseGet(SessionRecord::new);
    }

    /**
     * Device ids other than the primary device that hold a session with {@code name}.
     */
    @Override
    public List<Integer> getSubDeviceSessions(String name) {
        List<Integer> deviceIds = new ArrayList<>();
        for (String key : records.listKeysByPrefix(PREFIX + name + ".")) {
            String address = key.substring(PREFIX.length());
            int dot = address.lastIndexOf('.');
            if (!address.substring(0, dot).equals(name)) {
                continue;
            }
            int deviceId = Integer.parseInt(address.substring(dot + 1));
            if (deviceId != MaterialStore.DEFAULT_DEVICE_ID) {
                deviceIds.add(deviceId);
            }
        }
        return deviceIds;
    }

    @Override
    public void storeSession(SignalProtocolAddress address, SessionRecord record) {
        records.set(key(address), record.serialize());
    }

    @Override
    public boolean containsSession(SignalProtocolAddress address) {
        return records.contains(key(address));
    }

    @Override
    public void deleteSession(SignalProtocolAddress address) {
        records.delete(key(address));
    }

    @Override
    public void deleteAllSessions(String name) {
        for (int deviceId : getSubDeviceSessions(name)) {
            deleteSession(new SignalProtocolAddress(name, deviceId));
        }
        deleteSession(new SignalProtocolAddress(name, MaterialStore.DEFAULT_DEVICE_ID));
    }

    private static String key(SignalProtocolAddress address) {
        return PREFIX + address.getName() + "." + address.getDeviceId();
    }
}
