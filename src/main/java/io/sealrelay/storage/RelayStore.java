package io.sealrelay.storage;

import io.sealrelay.model.Bundle;
import io.sealrelay.model.Envelope;
import io.sealrelay.model.QueueEntry;
import io.sealrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relay persistence: registered identities, latest published bundles and the per-recipient envelope
 * queue.
 */
public final class RelayStore {
    private final Database database;

    public RelayStore(Database database) {
        this.database = database;
    }

    /**
     * Returns true when the id was newly inserted.
     */
    public boolean registerUser(String id, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("INSERT OR IGNORE INTO users(id,created_at) VALUES(?,?)")) {
            ps.setString(1, id);
            ps.setLong(2, nowMs);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to register user: " + id, e);
        }
    }

    public boolean isRegistered(String id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM users WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up user: " + id, e);
        }
    }

    public void upsertBundle(String id, Bundle bundle, long nowMs) {
        String sql = """
                INSERT INTO prekeys(id,bundle_json,updated_at) VALUES(?,?,?)
                ON CONFLICT(id) DO UPDATE SET bundle_json=excluded.bundle_json, updated_at=excluded.updated_at
                """;
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, id);
            ps.setString(2, Jsons.toCompactJson(bundle));
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store bundle: " + id, e);
        }
    }

    public Optional<Bundle> findBundle(String id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT bundle_json FROM prekeys WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(Jsons.fromJson(rs.getString(1), Bundle.class));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load bundle: " + id, e);
        }
    }

    public void enqueue(QueueEntry entry) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO messages(id,to_id,from_id,envelope_json,created_at,delivered) VALUES(?,?,?,?,?,0)")) {
            ps.setString(1, entry.id());
            ps.setString(2, entry.toId());
            ps.setString(3, entry.fromId());
            ps.setString(4, Jsons.toCompactJson(entry.envelope()));
            ps.setLong(5, entry.createdAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to enqueue message: " + entry.id(), e);
        }
    }

    public void markDelivered(String messageId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE messages SET delivered=1 WHERE id=?")) {
            ps.setString(1, messageId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark message delivered: " + messageId, e);
        }
    }

    /**
     * Undelivered entries for {@code toId} in enqueue order; equal timestamps keep insertion order.
     */
    public List<QueueEntry> listUndelivered(String toId) {
        String sql = """
                SELECT id,to_id,from_id,envelope_json,created_at,delivered
                FROM messages
                WHERE to_id=? AND delivered=0
                ORDER BY created_at ASC, rowid ASC
                """;
        List<QueueEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, toId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapEntry(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list queued messages for: " + toId, e);
        }
    }

    public Optional<QueueEntry> findEntry(String messageId) {
        String sql = "SELECT id,to_id,from_id,envelope_json,created_at,delivered FROM messages WHERE id=?";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapEntry(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load message: " + messageId, e);
        }
    }

    public int countUsers() {
        return count("SELECT COUNT(1) FROM users", "users");
    }

    public int countBundles() {
        return count("SELECT COUNT(1) FROM prekeys", "prekeys");
    }

    public int countUndelivered() {
        return count("SELECT COUNT(1) FROM messages WHERE delivered=0", "queued messages");
    }

    /**
     * Undelivered entry count per recipient, only for recipients with at least one.
     */
    public Map<String, Integer> undeliveredByRecipient() {
        Map<String, Integer> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT to_id,COUNT(1) AS c FROM messages WHERE delivered=0 GROUP BY to_id ORDER BY to_id")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("to_id"), rs.getInt("c"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count queued messages by recipient", e);
        }
    }

    private static QueueEntry mapEntry(ResultSet rs) throws SQLException {
        return new QueueEntry(
                rs.getString("id"),
                rs.getString("to_id"),
                rs.getString("from_id"),
                Jsons.fromJson(rs.getString("envelope_json"), Envelope.class),
                rs.getLong("created_at"),
                rs.getInt("delivered") != 0
        );
    }

    private int count(String sql, String what) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return 0;
            }
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count " + what, e);
        }
    }
}
