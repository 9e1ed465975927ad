package io.sealrelay.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.sealrelay.security.KdfParams;
import io.sealrelay.security.RecordCipher;
import io.sealrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Passphrase-protected key/value table in a single SQLite file.
 *
 * <p>The {@code meta} table holds plain JSON bookkeeping (KDF parameters, local identity ids).
 * The {@code kv} table holds one AES-GCM sealed blob per key. The symmetric key is derived once per
 * {@link #open(Path, String)} with scrypt; a wrong passphrase surfaces as
 * {@link io.sealrelay.security.TamperOrWrongPassphraseException} on the first read of a sealed value.
 *
 * <p>One instance is expected per owning process. Methods are synchronized on the instance.
 */
public final class EncryptedRecordStore implements AutoCloseable {
    public static final String META_KDF = "kdf";

    private final Path path;
    private final Connection connection;
    private final RecordCipher cipher;
    private final RecordCodec codec;
    private boolean closed;

    private EncryptedRecordStore(Path path, Connection connection, RecordCipher cipher) {
        this.path = path;
        this.connection = connection;
        this.cipher = cipher;
        this.codec = new RecordCodec();
    }

    public static EncryptedRecordStore open(Path path, String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("passphrase must not be empty");
        }
        Path absolute = path.toAbsolutePath().normalize();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to create store directory: " + absolute.getParent(), e);
        }
        Connection conn = null;
        try {
            conn = DriverManager.getConnection("jdbc:sqlite:" + absolute);
            initSchema(conn);
            SecureRandom random = new SecureRandom();
            KdfParams params = loadOrCreateKdf(conn, random);
            byte[] key = params.deriveKey(passphrase);
            try {
                return new EncryptedRecordStore(absolute, conn, new RecordCipher(key, random));
            } finally {
                Arrays.fill(key, (byte) 0);
            }
        } catch (SQLException e) {
            RuntimeException failure = new RuntimeException("Failed to open record store: " + absolute, e);
            closeAfterFailure(conn, failure);
            throw failure;
        } catch (RuntimeException e) {
            closeAfterFailure(conn, e);
            throw e;
        }
    }

    private static void initSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA busy_timeout=5000");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS meta (
                        key TEXT PRIMARY KEY,
                        value TEXT NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS kv (
                        key TEXT PRIMARY KEY,
                        value BLOB NOT NULL
                    )
                    """);
        }
    }

    private static KdfParams loadOrCreateKdf(Connection conn, SecureRandom random) throws SQLException {
        Optional<String> stored = readMeta(conn, META_KDF);
        if (stored.isPresent()) {
            return Jsons.fromJson(stored.get(), KdfParams.class);
        }
        KdfParams created = KdfParams.generate(random);
        writeMeta(conn, META_KDF, Jsons.toCompactJson(created));
        return created;
    }

    public Path path() {
        return path;
    }

    public synchronized Optional<Object> get(String key) {
        return readSealed(key).map(codec::decode);
    }

    public synchronized <T> Optional<T> get(String key, Class<T> type) {
        return readSealed(key).map(raw -> codec.decode(raw, type));
    }

    public synchronized Optional<JsonNode> getTree(String key) {
        return readSealed(key).map(codec::decodeTree);
    }

    public Optional<byte[]> getBytes(String key) {
        return get(key, byte[].class);
    }

    public synchronized void set(String key, Object value) {
        requireKey(key);
        byte[] sealed = cipher.seal(codec.encode(value));
        try (PreparedStatement ps = connection().prepareStatement(
                "INSERT INTO kv(key, value) VALUES(?, ?) ON CONFLICT(key) DO UPDATE SET value=excluded.value")) {
            ps.setString(1, key);
            ps.setBytes(2, sealed);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write record: " + key, e);
        }
    }

    public synchronized void delete(String key) {
        requireKey(key);
        try (PreparedStatement ps = connection().prepareStatement("DELETE FROM kv WHERE key=?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete record: " + key, e);
        }
    }

    public synchronized boolean contains(String key) {
        requireKey(key);
        try (PreparedStatement ps = connection().prepareStatement("SELECT 1 FROM kv WHERE key=? LIMIT 1")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check record: " + key, e);
        }
    }

    public synchronized List<String> listKeysByPrefix(String prefix) {
        String safePrefix = prefix == null ? "" : prefix;
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = connection().prepareStatement(
                "SELECT key FROM kv WHERE key LIKE ? ESCAPE '\\' ORDER BY key")) {
            ps.setString(1, escapeLike(safePrefix) + "%");
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String key = rs.getString(1);
                    // LIKE is case-insensitive for ASCII in SQLite.
                    if (key.startsWith(safePrefix)) {
                        out.add(key);
                    }
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list records with prefix: " + safePrefix, e);
        }
    }

    public synchronized Optional<JsonNode> getMeta(String key) {
        try {
            return readMeta(connection(), key).map(Jsons::readTree);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read meta: " + key, e);
        }
    }

    public synchronized void setMeta(String key, Object value) {
        requireKey(key);
        try {
            writeMeta(connection(), key, Jsons.toCompactJson(value));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write meta: " + key, e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to close record store: " + path, e);
        }
    }

    private Optional<byte[]> readSealed(String key) {
        requireKey(key);
        byte[] blob;
        try (PreparedStatement ps = connection().prepareStatement("SELECT value FROM kv WHERE key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                blob = rs.getBytes(1);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read record: " + key, e);
        }
        return Optional.of(cipher.open(blob));
    }

    private Connection connection() {
        if (closed) {
            throw new IllegalStateException("Record store is closed: " + path);
        }
        return connection;
    }

    private static Optional<String> readMeta(Connection conn, String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT value FROM meta WHERE key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    private static void writeMeta(Connection conn, String key, String json) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO meta(key, value) VALUES(?, ?) ON CONFLICT(key) DO UPDATE SET value=excluded.value")) {
            ps.setString(1, key);
            ps.setString(2, json);
            ps.executeUpdate();
        }
    }

    private static String escapeLike(String raw) {
        return raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("record key must not be blank");
        }
    }

    private static void closeAfterFailure(Connection conn, RuntimeException failure) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException closeError) {
            failure.addSuppressed(closeError);
        }
    }
}
