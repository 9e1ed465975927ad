package io.sealrelay.material;

import io.sealrelay.crypto.KyberPreKeyRecord;
import io.sealrelay.crypto.KyberPreKeyStore;
import org.whispersystems.libsignal.IdentityKey;
import org.whispersystems.libsignal.IdentityKeyPair;
import org.whispersystems.libsignal.SignalProtocolAddress;
import org.whispersystems.libsignal.state.PreKeyRecord;
import org.whispersystems.libsignal.state.SessionRecord;
import org.whispersystems.libsignal.state.SignalProtocolStore;
import org.whispersystems.libsignal.state.SignedPreKeyRecord;

import java.util.List;
import java.util.OptionalInt;

/**
 * Everything the session library and the post-quantum prekey lifecycle need from one material store,
 * routed to the record-store adapters. Loads of absent material throw {@link MaterialNotFoundException}.
 */
public final class MaterialProtocolStore implements SignalProtocolStore, KyberPreKeyStore {
    private final StoreIdentityKeyStore identities;
    private final StoreSessionStore sessions;
    private final StorePreKeyStore preKeys;
    private final StoreSignedPreKeyStore signedPreKeys;
    private final StoreKyberPreKeyStore kyberPreKeys;

    MaterialProtocolStore(
            StoreIdentityKeyStore identities,
            StoreSessionStore sessions,
            StorePreKeyStore preKeys,
            StoreSignedPreKeyStore signedPreKeys,
            StoreKyberPreKeyStore kyberPreKeys
    ) {
        this.identities = identities;
        this.sessions = sessions;
        this.preKeys = preKeys;
        this.signedPreKeys = signedPreKeys;
        this.kyberPreKeys = kyberPreKeys;
    }

    @Override
    public IdentityKeyPair getIdentityKeyPair() {
        return identities.getIdentityKeyPair();
    }

    @Override
    public int getLocalRegistrationId() {
        return identities.getLocalRegistrationId();
    }

    @Override
    public boolean saveIdentity(SignalProtocolAddress address, IdentityKey identityKey) {
        return identities.saveIdentity(address, identityKey);
    }

    /**
     * Trust-on-first-use save that reports whether the key is new, unchanged or replaced.
     */
    public IdentityChange recordIdentity(SignalProtocolAddress address, IdentityKey identityKey) {
        return identities.recordIdentity(address, identityKey);
    }

    @Override
    public boolean isTrustedIdentity(SignalProtocolAddress address, IdentityKey identityKey, Direction direction) {
        return identities.isTrustedIdentity(address, identityKey, direction);
    }

    @Override
    public IdentityKey getIdentity(SignalProtocolAddress address) {
        return identities.getIdentity(address);
    }

    @Override
    public SessionRecord loadSession(SignalProtocolAddress address) {
        return sessions.loadSession(address);
    }

    @Override
    public List<Integer> getSubDeviceSessions(String name) {
        return sessions.getSubDeviceSessions(name);
    }

    @Override
    public void storeSession(SignalProtocolAddress address, SessionRecord record) {
        sessions.storeSession(address, record);
    }

    @Override
    public boolean containsSession(SignalProtocolAddress address) {
        return sessions.containsSession(address);
    }

    @Override
    public void deleteSession(SignalProtocolAddress address) {
        sessions.deleteSession(address);
    }

    @Override
    public void deleteAllSessions(String name) {
        sessions.deleteAllSessions(name);
    }

    @Override
    public PreKeyRecord loadPreKey(int preKeyId) {
        return preKeys.loadPreKey(preKeyId);
    }

    @Override
    public void storePreKey(int preKeyId, PreKeyRecord record) {
        preKeys.storePreKey(preKeyId, record);
    }

    @Override
    public boolean containsPreKey(int preKeyId) {
        return preKeys.containsPreKey(preKeyId);
    }

    @Override
    public void removePreKey(int preKeyId) {
        preKeys.removePreKey(preKeyId);
    }

    @Override
    public SignedPreKeyRecord loadSignedPreKey(int signedPreKeyId) {
        return signedPreKeys.loadSignedPreKey(signedPreKeyId);
    }

    @Override
    public List<SignedPreKeyRecord> loadSignedPreKeys() {
        return signedPreKeys.loadSignedPreKeys();
    }

    @Override
    public void storeSignedPreKey(int signedPreKeyId, SignedPreKeyRecord record) {
        signedPreKeys.storeSignedPreKey(signedPreKeyId, record);
    }

    @Override
    public boolean containsSignedPreKey(int signedPreKeyId) {
        return signedPreKeys.containsSignedPreKey(signedPreKeyId);
    }

    @Override
    public void removeSignedPreKey(int signedPreKeyId) {
        signedPreKeys.removeSignedPreKey(signedPreKeyId);
    }

    @Override
    public KyberPreKeyRecord loadKyberPreKey(int kyberPreKeyId) {
        return kyberPreKeys.loadKyberPreKey(kyberPreKeyId);
    }

    @Override
    public void storeKyberPreKey(int kyberPreKeyId, KyberPreKeyRecord record) {
        kyberPreKeys.storeKyberPreKey(kyberPreKeyId, record);
    }

    @Override
    public void pairWithSignedPreKey(int kyberPreKeyId, int signedPreKeyId) {
        kyberPreKeys.pairWithSignedPreKey(kyberPreKeyId, signedPreKeyId);
    }

    @Override
    public OptionalInt pairedKyberPreKey(int signedPreKeyId) {
        return kyberPreKeys.pairedKyberPreKey(signedPreKeyId);
    }

    @Override
    public void markKyberPreKeyUsed(int kyberPreKeyId, int signedPreKeyId, byte[] baseKey) {
        kyberPreKeys.markKyberPreKeyUsed(kyberPreKeyId, signedPreKeyId, baseKey);
    }

    @Override
    public boolean isKyberPreKeyUsed(int kyberPreKeyId) {
        return kyberPreKeys.isKyberPreKeyUsed(kyberPreKeyId);
    }
}
