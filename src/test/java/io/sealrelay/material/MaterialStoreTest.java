package io.sealrelay.material;

import io.sealrelay.crypto.KyberPreKeyRecord;
import io.sealrelay.model.Envelope;
import io.sealrelay.model.InboxMessage;
import io.sealrelay.security.TamperOrWrongPassphraseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.whispersystems.libsignal.IdentityKey;
import org.whispersystems.libsignal.IdentityKeyPair;
import org.whispersystems.libsignal.SignalProtocolAddress;
import org.whispersystems.libsignal.ecc.Curve;
import org.whispersystems.libsignal.state.IdentityKeyStore;
import org.whispersystems.libsignal.state.PreKeyRecord;
import org.whispersystems.libsignal.state.SessionRecord;
import org.whispersystems.libsignal.state.SignedPreKeyRecord;
import org.whispersystems.libsignal.util.KeyHelper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class MaterialStoreTest {

    @Test
    void identitySurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-material-identity-");
        try {
            Path db = root.resolve("alice.db");
            MaterialStore.LocalIdentity created;
            try (MaterialStore store = MaterialStore.open(db, "pw")) {
                Assertions.assertFalse(store.hasIdentity());
                Assertions.assertTrue(store.localIdentity().isEmpty());
                created = store.initializeIdentity("alice", 1);
            }
            Assertions.assertTrue(created.registrationId() >= 1 && created.registrationId() <= 16380);

            try (MaterialStore store = MaterialStore.open(db, "pw")) {
                Assertions.assertTrue(store.hasIdentity());
                MaterialStore.LocalIdentity loaded = store.requireLocalIdentity();
                Assertions.assertEquals(created, loaded);
                IdentityKeyPair pair = store.identityKeyPair();
                Assertions.assertEquals(created.publicKey(), pair.getPublicKey());
            }
            try (MaterialStore store = MaterialStore.open(db, "not-pw")) {
                Assertions.assertThrows(TamperOrWrongPassphraseException.class, store::identityKeyPair);
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingIdentityPointsAtInit() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-material-missing-");
        try (MaterialStore store = MaterialStore.open(root.resolve("empty.db"), "pw")) {
            IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, store::requireLocalIdentity);
            Assertions.assertTrue(e.getMessage().contains("sealrelay init"));
            Assertions.assertThrows(IllegalStateException.class, () -> store.generatePreKeys(1));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.initializeIdentity(" ", 1));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.initializeIdentity("alice", 0));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void preKeyIdsAreMonotonicPerCategory() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-material-counters-");
        try {
            Path db = root.resolve("alice.db");
            try (MaterialStore store = MaterialStore.open(db, "pw")) {
                store.initializeIdentity("alice", 1);
                Assertions.assertTrue(store.latestId(MaterialCategory.PRE_KEY).isEmpty());

                MaterialStore.GeneratedPreKeys first = store.generatePreKeys(3);
                Assertions.assertEquals(List.of(1, 2, 3), first.preKeyIds());
                Assertions.assertEquals(1, first.signedPreKeyId());
                Assertions.assertEquals(1, first.kyberPreKeyId());
            }
            try (MaterialStore store = MaterialStore.open(db, "pw")) {
                MaterialStore.GeneratedPreKeys second = store.generatePreKeys(1);
                Assertions.assertEquals(List.of(4), second.preKeyIds());
                Assertions.assertEquals(2, second.signedPreKeyId());
                Assertions.assertEquals(2, second.kyberPreKeyId());
                Assertions.assertEquals(4, store.latestId(MaterialCategory.PRE_KEY).getAsInt());
                Assertions.assertEquals(2, store.latestId(MaterialCategory.SIGNED_PRE_KEY).getAsInt());

                PreKeyRecord loaded = store.protocolStore().loadPreKey(4);
                Assertions.assertEquals(4, loaded.getId());
                Assertions.assertEquals(2, store.protocolStore().pairedKyberPreKey(2).getAsInt());
                Assertions.assertEquals(2, store.protocolStore().loadSignedPreKeys().size());
                Assertions.assertThrows(IllegalArgumentException.class, () -> store.generatePreKeys(0));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void consumedPreKeyFollowsRetentionPolicy() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-material-retention-");
        try {
            try (MaterialStore store = MaterialStore.open(root.resolve("retain.db"), "pw", PreKeyRetention.RETAIN)) {
                store.initializeIdentity("bob", 1);
                store.generatePreKeys(1);
                store.protocolStore().removePreKey(1);
                Assertions.assertTrue(store.isPreKeyUsed(1));
                Assertions.assertEquals(1, store.protocolStore().loadPreKey(1).getId());
            }
            try (MaterialStore store = MaterialStore.open(root.resolve("delete.db"), "pw", PreKeyRetention.DELETE)) {
                store.initializeIdentity("bob", 1);
                store.generatePreKeys(1);
                store.protocolStore().removePreKey(1);
                MaterialNotFoundException e = Assertions.assertThrows(MaterialNotFoundException.class,
                        () -> store.protocolStore().loadPreKey(1));
                Assertions.assertEquals(MaterialCategory.PRE_KEY, e.category());
                Assertions.assertEquals(1, e.keyId());
            }
            Assertions.assertEquals(PreKeyRetention.DELETE, PreKeyRetention.parse(" delete "));
            Assertions.assertEquals(PreKeyRetention.RETAIN, PreKeyRetention.parse(null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void publishedKeysAreSignedByIdentity() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-material-signatures-");
        try (MaterialStore store = MaterialStore.open(root.resolve("alice.db"), "pw")) {
            store.initializeIdentity("alice", 1);
            store.generatePreKeys(1);
            IdentityKey identity = store.identityKeyPair().getPublicKey();

            SignedPreKeyRecord signed = store.protocolStore().loadSignedPreKey(1);
            Assertions.assertTrue(Curve.verifySignature(
                    identity.getPublicKey(), signed.getKeyPair().getPublicKey().serialize(), signed.getSignature()));

            KyberPreKeyRecord kyber = store.protocolStore().loadKyberPreKey(1);
            Assertions.assertTrue(KyberPreKeyRecord.verify(identity, kyber.keyPair().publicKey(), kyber.signature()));
            IdentityKey other = KeyHelper.generateIdentityKeyPair().getPublicKey();
            Assertions.assertFalse(KyberPreKeyRecord.verify(other, kyber.keyPair().publicKey(), kyber.signature()));

            MaterialNotFoundException e = Assertions.assertThrows(MaterialNotFoundException.class,
                    () -> store.protocolStore().loadKyberPreKey(9));
            Assertions.assertEquals(MaterialCategory.KYBER_PRE_KEY, e.category());
            Assertions.assertTrue(e.getMessage().contains("9"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void identityTrustIsFirstUse() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-material-tofu-");
        try (MaterialStore store = MaterialStore.open(root.resolve("alice.db"), "pw")) {
            store.initializeIdentity("alice", 1);
            MaterialProtocolStore keys = store.protocolStore();
            SignalProtocolAddress bob = new SignalProtocolAddress("bob", 1);
            IdentityKey first = KeyHelper.generateIdentityKeyPair().getPublicKey();
            IdentityKey second = KeyHelper.generateIdentityKeyPair().getPublicKey();

            Assertions.assertNull(keys.getIdentity(bob));
            Assertions.assertTrue(keys.isTrustedIdentity(bob, first, IdentityKeyStore.Direction.SENDING));
            Assertions.assertEquals(IdentityChange.NEW, keys.recordIdentity(bob, first));
            Assertions.assertEquals(IdentityChange.UNCHANGED, keys.recordIdentity(bob, first));
            Assertions.assertEquals(first, keys.getIdentity(bob));
            Assertions.assertFalse(keys.isTrustedIdentity(bob, second, IdentityKeyStore.Direction.RECEIVING));
            Assertions.assertTrue(keys.saveIdentity(bob, second));
            Assertions.assertEquals(second, keys.getIdentity(bob));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sessionsAreKeyedByNameAndDevice() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-material-sessions-");
        try (MaterialStore store = MaterialStore.open(root.resolve("alice.db"), "pw")) {
            MaterialProtocolStore keys = store.protocolStore();
            SignalProtocolAddress primary = new SignalProtocolAddress("bob", 1);
            SignalProtocolAddress second = new SignalProtocolAddress("bob", 2);
            SignalProtocolAddress lookalike = new SignalProtocolAddress("bob.2", 3);

            Assertions.assertFalse(keys.containsSession(primary));
            Assertions.assertNotNull(keys.loadSession(primary));
            keys.storeSession(primary, new SessionRecord());
            keys.storeSession(second, new SessionRecord());
            keys.storeSession(lookalike, new SessionRecord());

            Assertions.assertTrue(keys.containsSession(primary));
            Assertions.assertEquals(List.of(2), keys.getSubDeviceSessions("bob"));
            keys.deleteAllSessions("bob");
            Assertions.assertFalse(keys.containsSession(primary));
            Assertions.assertFalse(keys.containsSession(second));
            Assertions.assertTrue(keys.containsSession(lookalike));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void inboxListsByTimestamp() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-material-inbox-");
        try (MaterialStore store = MaterialStore.open(root.resolve("bob.db"), "pw")) {
            Envelope envelope = new Envelope(1, "alice", "bob", "alice::bob", 3, "AAAA", 20L);
            store.saveInboxMessage(new InboxMessage("20:alice:z", "alice", 20L, "later", envelope));
            store.saveInboxMessage(new InboxMessage("10:alice:a", "alice", 10L, "earlier", envelope));

            List<InboxMessage> inbox = store.listInboxMessages();
            Assertions.assertEquals(2, inbox.size());
            Assertions.assertEquals("earlier", inbox.get(0).plaintext());
            Assertions.assertEquals("later", inbox.get(1).plaintext());
            Assertions.assertEquals(envelope, inbox.get(1).envelope());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
