package io.sealrelay.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.sealrelay.security.TamperOrWrongPassphraseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class EncryptedRecordStoreTest {

    @Test
    void valuesSurviveReopenWithSamePassphrase() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-record-reopen-");
        try {
            Path db = root.resolve("nested").resolve("store.db");
            Map<String, Object> value = new LinkedHashMap<>();
            value.put("keyId", 7);
            value.put("publicKey", new byte[]{1, 2, 3, 4});
            try (EncryptedRecordStore store = EncryptedRecordStore.open(db, "correct horse")) {
                store.set("preKey:7", value);
                store.setMeta("localId", "alice");
            }
            try (EncryptedRecordStore store = EncryptedRecordStore.open(db, "correct horse")) {
                JsonNode tree = store.getTree("preKey:7").orElseThrow();
                Assertions.assertEquals(7, tree.path("keyId").asInt());
                Assertions.assertTrue(tree.path("publicKey").isBinary());
                Assertions.assertArrayEquals(new byte[]{1, 2, 3, 4}, tree.path("publicKey").binaryValue());
                Assertions.assertEquals("alice", store.getMeta("localId").orElseThrow().asText());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void wrongPassphraseFailsOnFirstSealedRead() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-record-wrong-pass-");
        try {
            Path db = root.resolve("store.db");
            try (EncryptedRecordStore store = EncryptedRecordStore.open(db, "right")) {
                store.set("session:bob.1", Map.of("state", "x"));
            }
            try (EncryptedRecordStore store = EncryptedRecordStore.open(db, "wrong")) {
                Assertions.assertTrue(store.contains("session:bob.1"));
                Assertions.assertThrows(TamperOrWrongPassphraseException.class, () -> store.getTree("session:bob.1"));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperedBlobIsRejected() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-record-tamper-");
        try {
            Path db = root.resolve("store.db");
            try (EncryptedRecordStore store = EncryptedRecordStore.open(db, "pw")) {
                store.set("inbox:1", Map.of("plaintext", "hi"));
            }
            try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath())) {
                byte[] blob;
                try (PreparedStatement ps = c.prepareStatement("SELECT value FROM kv WHERE key='inbox:1'");
                     ResultSet rs = ps.executeQuery()) {
                    Assertions.assertTrue(rs.next());
                    blob = rs.getBytes(1);
                }
                blob[blob.length - 1] ^= 0x01;
                try (PreparedStatement ps = c.prepareStatement("UPDATE kv SET value=? WHERE key='inbox:1'")) {
                    ps.setBytes(1, blob);
                    ps.executeUpdate();
                }
            }
            try (EncryptedRecordStore store = EncryptedRecordStore.open(db, "pw")) {
                Assertions.assertThrows(TamperOrWrongPassphraseException.class, () -> store.getTree("inbox:1"));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void prefixListingIsCaseSensitiveAndEscapesWildcards() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-record-prefix-");
        try (EncryptedRecordStore store = EncryptedRecordStore.open(root.resolve("store.db"), "pw")) {
            store.set("inbox:a", 1);
            store.set("inbox:b", 2);
            store.set("INBOX:c", 3);
            store.set("in_box:d", 4);
            store.set("session:x", 5);

            Assertions.assertEquals(List.of("inbox:a", "inbox:b"), store.listKeysByPrefix("inbox:"));
            Assertions.assertEquals(List.of("in_box:d"), store.listKeysByPrefix("in_"));

            store.delete("inbox:a");
            Assertions.assertFalse(store.contains("inbox:a"));
            Assertions.assertTrue(store.get("inbox:a").isEmpty());
            Assertions.assertEquals(2, store.get("inbox:b", Integer.class).orElseThrow());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void emptyPassphraseAndClosedStoreAreRejected() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-record-closed-");
        try {
            Path db = root.resolve("store.db");
            Assertions.assertThrows(IllegalArgumentException.class, () -> EncryptedRecordStore.open(db, ""));
            EncryptedRecordStore store = EncryptedRecordStore.open(db, "pw");
            store.close();
            store.close();
            Assertions.assertThrows(IllegalStateException.class, () -> store.set("k", 1));
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
