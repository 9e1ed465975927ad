package io.sealrelay.relay;

import io.sealrelay.config.RelayConfig;
import io.sealrelay.model.Bundle;
import io.sealrelay.model.Delivery;
import io.sealrelay.model.Envelope;
import io.sealrelay.model.QueueEntry;
import io.sealrelay.observability.AuditLogger;
import io.sealrelay.observability.PrometheusFormatter;
import io.sealrelay.storage.Database;
import io.sealrelay.storage.RelayStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Relay core: registration, bundle directory, durable per-recipient queue and push delivery.
 *
 * <p>All queue mutation for one recipient (submit-time push, supersession, replay) runs under that
 * recipient's lock, so pushes to a recipient are never interleaved and always leave in enqueue order.
 */
public final class RelayService implements AutoCloseable {
    public static final String SUPERSEDED = "superseded";

    private final RelayConfig config;
    private final Database database;
    private final RelayStore store;
    private final ConnectionRegistry connections;
    private final AuditLogger auditLogger;
    private final ConcurrentHashMap<String, ReentrantLock> recipientLocks = new ConcurrentHashMap<>();
    private final long startedAtMs;
    private volatile HostMetrics latestMetrics;

    public RelayService(RelayConfig config) {
        this.config = config;
        this.database = new Database(config);
        this.store = new RelayStore(database);
        this.connections = new ConnectionRegistry();
        this.auditLogger = new AuditLogger(config.auditLog(), config.settings().auditSigningSecret());
        this.startedAtMs = Instant.now().toEpochMilli();
    }

    public void init() {
        database.init();
    }

    public RelayConfig config() {
        return config;
    }

    /**
     * Idempotent. Returns true when the id was not registered before.
     */
    public boolean register(String id) {
        boolean created = store.registerUser(id, Instant.now().toEpochMilli());
        audit("relay.register", id, "users/" + id, created ? "created" : "exists", Map.of());
        return created;
    }

    public void publishBundle(String id, Bundle bundle) {
        if (!store.isRegistered(id)) {
            throw new NotRegisteredException("User not registered.");
        }
        store.upsertBundle(id, bundle, Instant.now().toEpochMilli());
        audit("relay.bundle.publish", id, "prekeys/" + id, "ok", Map.of(
                "signedPreKeyId", bundle.signedPreKey().keyId(),
                "preKeyId", bundle.preKey().keyId(),
                "kyberPreKeyId", bundle.kyberPreKey().keyId()
        ));
    }

    public Bundle fetchBundle(String id) {
        return store.findBundle(id).orElseThrow(() -> new NotFoundException("Prekeys not found."));
    }

    /**
     * Persists the envelope, then drains the recipient's queue in enqueue order if it holds a live
     * channel, so the new entry never overtakes an earlier one still waiting after a failed push. The
     * drain stops at the first failed push; that entry and everything after it stay queued and are not
     * reported as an error.
     */
    public SubmitOutcome submit(String from, String to, Envelope envelope) {
        if (!store.isRegistered(to)) {
            throw new NotRegisteredException("Recipient not registered.");
        }
        QueueEntry entry = new QueueEntry(
                UUID.randomUUID().toString(), to, from, envelope, Instant.now().toEpochMilli(), false);
        ReentrantLock lock = lockFor(to);
        lock.lock();
        try {
            store.enqueue(entry);
            boolean delivered = false;
            Optional<PushChannel> channel = connections.find(to).filter(PushChannel::isOpen);
            if (channel.isPresent()) {
                delivered = drain(channel.get(), to).contains(entry.id());
            }
            audit("relay.message.submit", from, "messages/" + entry.id(), delivered ? "delivered" : "queued", Map.of(
                    "to", to,
                    "type", envelope.type()
            ));
            return new SubmitOutcome(entry.id(), true, delivered);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Installs {@code channel} for its client, closes any channel it supersedes, then replays every
     * undelivered entry in enqueue order. Replay stops at the first failed push; the rest stay queued.
     *
     * @return number of entries replayed
     */
    public int connect(PushChannel channel) {
        String clientId = channel.clientId();
        requireStreamClient(clientId);
        ReentrantLock lock = lockFor(clientId);
        lock.lock();
        try {
            Optional<PushChannel> previous = connections.attach(channel, SUPERSEDED);
            int pending = store.listUndelivered(clientId).size();
            int replayed = drain(channel, clientId).size();
            audit("relay.stream.connect", clientId, "stream/" + clientId, "ok", Map.of(
                    "superseded", previous.isPresent(),
                    "pending", pending,
                    "replayed", replayed
            ));
            return replayed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects push-channel requests from identities the relay does not know.
     */
    public void requireStreamClient(String clientId) {
        if (!store.isRegistered(clientId)) {
            throw new UnauthorizedException("Client not registered.");
        }
    }

    public void disconnect(PushChannel channel) {
        if (connections.detach(channel)) {
            audit("relay.stream.disconnect", channel.clientId(), "stream/" + channel.clientId(), "ok", Map.of());
        }
    }

    public void pushHostMetrics(HostMetrics metrics) {
        latestMetrics = metrics;
    }

    public DiagnosticsSnapshot diagnostics() {
        Map<String, Integer> histogram = new LinkedHashMap<>();
        histogram.put("0", 0);
        histogram.put("1-5", 0);
        histogram.put("6-20", 0);
        histogram.put("21+", 0);
        for (int depth : store.undeliveredByRecipient().values()) {
            histogram.merge(bucket(depth), 1, Integer::sum);
        }
        return new DiagnosticsSnapshot(
                (Instant.now().toEpochMilli() - startedAtMs) / 1000L,
                database.location(),
                new DiagnosticsSnapshot.Counts(
                        store.countUsers(),
                        store.countBundles(),
                        store.countUndelivered(),
                        connections.size()
                ),
                histogram,
                latestMetrics
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(diagnostics());
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    @Override
    public void close() {
        connections.closeAll("shutdown");
    }

    static String bucket(int depth) {
        if (depth <= 0) {
            return "0";
        }
        if (depth <= 5) {
            return "1-5";
        }
        if (depth <= 20) {
            return "6-20";
        }
        return "21+";
    }

    /**
     * Pushes undelivered entries for {@code recipientId} in enqueue order until one fails. Caller holds the
     * recipient lock. Returns the ids delivered.
     */
    private Set<String> drain(PushChannel channel, String recipientId) {
        Set<String> delivered = new LinkedHashSet<>();
        for (QueueEntry entry : store.listUndelivered(recipientId)) {
            if (!push(channel, entry)) {
                break;
            }
            delivered.add(entry.id());
        }
        return delivered;
    }

    private boolean push(PushChannel channel, QueueEntry entry) {
        try {
            channel.send(Delivery.of(entry));
        } catch (TransportFailureException e) {
            audit("relay.push.failed", "system", "messages/" + entry.id(), "failed", Map.of(
                    "to", entry.toId(),
                    "error", String.valueOf(e.getMessage())
            ));
            return false;
        }
        store.markDelivered(entry.id());
        return true;
    }

    private ReentrantLock lockFor(String recipientId) {
        return recipientLocks.computeIfAbsent(recipientId, ignored -> new ReentrantLock());
    }

    private void audit(String action, String actor, String resource, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, actor, resource, result, details));
    }

    public record SubmitOutcome(String messageId, boolean queued, boolean delivered) {
    }
}
