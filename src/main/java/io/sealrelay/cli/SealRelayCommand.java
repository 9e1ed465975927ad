package io.sealrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.sealrelay.client.RelayClient;
import io.sealrelay.config.RelayConfig;
import io.sealrelay.material.MaterialStore;
import io.sealrelay.material.PreKeyRetention;
import io.sealrelay.model.Bundle;
import io.sealrelay.model.Delivery;
import io.sealrelay.model.Envelope;
import io.sealrelay.model.InboxMessage;
import io.sealrelay.model.WireValidator;
import io.sealrelay.protocol.SessionProtocol;
import io.sealrelay.relay.HostMetrics;
import io.sealrelay.relay.RelayHttpServer;
import io.sealrelay.relay.RelayService;
import io.sealrelay.util.Hashing;
import io.sealrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.Console;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

@Command(
        name = "sealrelay",
        mixinStandardHelpOptions = true,
        description = "End-to-end encrypted messaging client and relay server",
        subcommands = {
                SealRelayCommand.InitCommand.class,
                SealRelayCommand.IdentityShowCommand.class,
                SealRelayCommand.PreKeyGenerateCommand.class,
                SealRelayCommand.BundleExportCommand.class,
                SealRelayCommand.SessionInitCommand.class,
                SealRelayCommand.EncryptCommand.class,
                SealRelayCommand.DecryptCommand.class,
                SealRelayCommand.InboxCommand.class,
                SealRelayCommand.RegisterCommand.class,
                SealRelayCommand.PreKeysUploadCommand.class,
                SealRelayCommand.PreKeysFetchCommand.class,
                SealRelayCommand.SendCommand.class,
                SealRelayCommand.ListenCommand.class,
                SealRelayCommand.ServeCommand.class,
                SealRelayCommand.DiagnosticsCommand.class,
                SealRelayCommand.PushMetricsCommand.class,
                SealRelayCommand.AuditVerifyCommand.class
        }
)
public final class SealRelayCommand implements Runnable {
    public static final String ENV_PASSPHRASE = "SEALRELAY_PASSPHRASE";

    @Option(names = {"--db"}, description = "Local encrypted store (default: ~/.sealrelay/sealrelay.db)")
    String db;

    @Option(names = {"--passphrase"}, description = "Store passphrase (default: $" + ENV_PASSPHRASE + " or prompt)")
    String passphrase;

    @Option(names = {"--server"}, defaultValue = "http://localhost:8080", description = "Relay base URL")
    String server;

    @Option(names = {"--root"}, defaultValue = "data", description = "Relay data root directory")
    String root;

    @Option(names = {"--prekey-retention"}, defaultValue = "retain",
            description = "What to do with a consumed one-time prekey: retain|delete")
    String preKeyRetention;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | identity-show | prekey-generate | bundle-export | session-init | encrypt | decrypt | inbox | register | prekeys-upload | prekeys-fetch | send | listen | serve | diagnostics | push-metrics | audit-verify");
    }

    Path dbPath() {
        if (db != null && !db.isBlank()) {
            return Paths.get(db);
        }
        return Paths.get(System.getProperty("user.home"), ".sealrelay", "sealrelay.db");
    }

    String resolvePassphrase() {
        if (passphrase != null && !passphrase.isEmpty()) {
            return passphrase;
        }
        String env = System.getenv(ENV_PASSPHRASE);
        if (env != null && !env.isEmpty()) {
            return env;
        }
        Console console = System.console();
        if (console != null) {
            char[] typed = console.readPassword("Passphrase: ");
            if (typed != null && typed.length > 0) {
                return new String(typed);
            }
        }
        throw new IllegalStateException("Passphrase required. Use --passphrase or $" + ENV_PASSPHRASE + ".");
    }

    MaterialStore openStore() {
        return MaterialStore.open(dbPath(), resolvePassphrase(), PreKeyRetention.parse(preKeyRetention));
    }

    SessionProtocol protocol() {
        return new SessionProtocol();
    }

    RelayClient client() {
        return new RelayClient(server);
    }

    RelayConfig relayConfig() {
        return RelayConfig.fromRoot(root);
    }

    @Command(name = "init", description = "Initialize local identity and storage")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--id"}, required = true, description = "Local identity id")
        String id;

        @Option(names = {"--device"}, defaultValue = "1", description = "Device id")
        int device;

        @Override
        public Integer call() {
            try (MaterialStore store = parent.openStore()) {
                store.initializeIdentity(id, device);
                store.generatePreKeys(1);
                System.out.println("Initialized identity '" + id + "' in " + store.path());
            }
            return 0;
        }
    }

    @Command(name = "identity-show", description = "Show local identity info")
    static final class IdentityShowCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Override
        public Integer call() {
            try (MaterialStore store = parent.openStore()) {
                MaterialStore.LocalIdentity identity = store.requireLocalIdentity();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("id", identity.localId());
                out.put("registrationId", identity.registrationId());
                out.put("deviceId", identity.deviceId());
                out.put("fingerprint", Hashing.fingerprint(identity.publicKey().serialize()));
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "prekey-generate", description = "Generate new prekeys")
    static final class PreKeyGenerateCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--count"}, defaultValue = "1", description = "Number of one-time prekeys")
        int count;

        @Override
        public Integer call() {
            try (MaterialStore store = parent.openStore()) {
                MaterialStore.GeneratedPreKeys generated = store.generatePreKeys(count);
                System.out.println("Generated " + generated.preKeyIds().size() + " prekeys (signed="
                        + generated.signedPreKeyId() + ", kyber=" + generated.kyberPreKeyId() + ").");
            }
            return 0;
        }
    }

    @Command(name = "bundle-export", description = "Export local bundle")
    static final class BundleExportCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--out"}, required = true, description = "Output file")
        String out;

        @Override
        public Integer call() throws IOException {
            try (MaterialStore store = parent.openStore()) {
                Bundle bundle = parent.protocol().exportBundle(store);
                writeText(out, Jsons.toJson(bundle));
                System.out.println("Bundle exported to " + out);
            }
            return 0;
        }
    }

    @Command(name = "session-init", description = "Initialize a session from a peer bundle")
    static final class SessionInitCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--their-bundle"}, required = true, description = "Path to peer bundle JSON")
        String theirBundle;

        @Override
        public Integer call() throws IOException {
            Bundle bundle = WireValidator.bundle(Jsons.readTree(readText(theirBundle)));
            try (MaterialStore store = parent.openStore()) {
                if (parent.protocol().initSession(store, bundle)) {
                    System.out.println("Session initialized with " + bundle.id());
                } else {
                    System.out.println("Session with " + bundle.id() + " already exists");
                }
            }
            return 0;
        }
    }

    @Command(name = "encrypt", description = "Encrypt a message into an envelope")
    static final class EncryptCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--to"}, required = true, description = "Recipient id")
        String to;

        @Option(names = {"--in"}, description = "Input file (default: stdin)")
        String in;

        @Option(names = {"--out"}, description = "Output file (default: stdout)")
        String out;

        @Override
        public Integer call() throws IOException {
            String plaintext = readText(in);
            try (MaterialStore store = parent.openStore()) {
                Envelope envelope = parent.protocol().encryptMessage(store, to, plaintext);
                writeText(out, Jsons.toJson(envelope));
            }
            return 0;
        }
    }

    @Command(name = "decrypt", description = "Decrypt a message envelope")
    static final class DecryptCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--in"}, description = "Input file (default: stdin)")
        String in;

        @Option(names = {"--out"}, description = "Output file (default: stdout)")
        String out;

        @Override
        public Integer call() throws IOException {
            JsonNode payload = Jsons.readTree(readText(in));
            JsonNode envelopeNode = payload.has("envelope") ? payload.get("envelope") : payload;
            Envelope envelope = WireValidator.envelope(envelopeNode);
            try (MaterialStore store = parent.openStore()) {
                writeText(out, parent.protocol().decryptMessage(store, envelope));
            }
            return 0;
        }
    }

    @Command(name = "inbox", description = "List decrypted inbox messages stored locally")
    static final class InboxCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max messages to show")
        int limit;

        @Option(names = {"--since"}, description = "Only show messages after this epoch ms")
        Long since;

        @Option(names = {"--json"}, description = "Output as JSON")
        boolean json;

        @Override
        public Integer call() {
            List<InboxMessage> messages;
            try (MaterialStore store = parent.openStore()) {
                messages = new ArrayList<>(store.listInboxMessages());
            }
            if (since != null) {
                messages.removeIf(m -> m.timestamp() <= since);
            }
            if (limit > 0 && messages.size() > limit) {
                messages = messages.subList(messages.size() - limit, messages.size());
            }
            if (json) {
                System.out.println(Jsons.toJson(messages));
                return 0;
            }
            if (messages.isEmpty()) {
                System.out.println("Inbox empty.");
                return 0;
            }
            for (InboxMessage m : messages) {
                System.out.println("[" + Instant.ofEpochMilli(m.timestamp()) + "] " + m.senderId() + ": " + m.plaintext());
            }
            return 0;
        }
    }

    @Command(name = "register", description = "Register an identity with the relay")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--id"}, required = true, description = "Identity id")
        String id;

        @Override
        public Integer call() throws Exception {
            parent.client().register(id);
            System.out.println("Registered " + id + " at " + parent.server);
            return 0;
        }
    }

    @Command(name = "prekeys-upload", description = "Upload the local bundle to the relay")
    static final class PreKeysUploadCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Override
        public Integer call() throws Exception {
            Bundle bundle;
            try (MaterialStore store = parent.openStore()) {
                bundle = parent.protocol().exportBundle(store);
            }
            parent.client().uploadBundle(bundle.id(), bundle);
            System.out.println("Uploaded prekeys for " + bundle.id() + " to " + parent.server);
            return 0;
        }
    }

    @Command(name = "prekeys-fetch", description = "Fetch a peer bundle from the relay")
    static final class PreKeysFetchCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--id"}, required = true, description = "Peer identity id")
        String id;

        @Option(names = {"--out"}, description = "Output file (default: stdout)")
        String out;

        @Override
        public Integer call() throws Exception {
            Bundle bundle = parent.client().fetchBundle(id).orElse(null);
            if (bundle == null) {
                System.err.println("Prekeys not found for " + id);
                return 1;
            }
            writeText(out, Jsons.toJson(bundle));
            if (out != null && !"-".equals(out)) {
                System.out.println("Fetched prekeys for " + id + " from " + parent.server);
            }
            return 0;
        }
    }

    @Command(name = "send", description = "Encrypt and send a message via the relay")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--to"}, required = true, description = "Recipient id")
        String to;

        @Option(names = {"--in"}, description = "Input file (default: stdin)")
        String in;

        @Override
        public Integer call() throws Exception {
            String plaintext = readText(in);
            RelayClient client = parent.client();
            SessionProtocol protocol = parent.protocol();
            try (MaterialStore store = parent.openStore()) {
                String localId = store.requireLocalIdentity().localId();
                if (!protocol.hasSession(store, to)) {
                    Bundle bundle = client.fetchBundle(to)
                            .orElseThrow(() -> new IllegalStateException("Prekeys not found for " + to));
                    protocol.initSession(store, bundle);
                }
                Envelope envelope = protocol.encryptMessage(store, to, plaintext);
                RelayClient.SendResult result = client.sendMessage(localId, to, envelope);
                System.out.println("Sent message from " + localId + " to " + to + " via " + parent.server
                        + (result.delivered() ? " (delivered)" : " (queued)"));
            }
            return 0;
        }
    }

    @Command(name = "listen", description = "Receive, decrypt and store pushed messages")
    static final class ListenCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--id"}, description = "Identity id (default: local identity)")
        String id;

        @Option(names = {"--max-messages"}, defaultValue = "0", description = "Stop after this many messages; 0 runs until the stream ends")
        int maxMessages;

        @Override
        public Integer call() throws Exception {
            SessionProtocol protocol = parent.protocol();
            AtomicInteger received = new AtomicInteger();
            try (MaterialStore store = parent.openStore()) {
                String clientId = id == null || id.isBlank() ? store.requireLocalIdentity().localId() : id;
                System.out.println("Listening for messages on " + parent.server + " as " + clientId);
                parent.client().listen(clientId, new RelayClient.StreamListener() {
                    @Override
                    public boolean onDelivery(Delivery delivery) {
                        receive(store, protocol, delivery.envelope(), System.out, System.err);
                        return maxMessages <= 0 || received.incrementAndGet() < maxMessages;
                    }

                    @Override
                    public boolean onControl(String event, JsonNode data) {
                        if ("superseded".equals(event)) {
                            System.out.println("Stream superseded by another connection.");
                            return false;
                        }
                        return true;
                    }
                });
            }
            System.out.println("Stream closed.");
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the relay server")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--host"}, description = "Bind host (default: settings or $" + RelayConfig.ENV_HOST + ")")
        String host;

        @Option(names = {"--port"}, description = "Bind port (default: settings or $" + RelayConfig.ENV_PORT + ")")
        Integer port;

        @Override
        public Integer call() throws Exception {
            RelayConfig config = parent.relayConfig();
            RelayConfig.RelaySettings settings = config.settings();
            String bindHost = host == null || host.isBlank() ? settings.host() : host;
            int bindPort = port == null ? settings.port() : port;
            RelayService service = new RelayService(config);
            service.init();
            RelayHttpServer server = RelayHttpServer.start(service, bindHost, bindPort, settings.serverThreads());
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.close();
                stopped.countDown();
            }, "sealrelay-shutdown"));
            System.out.println("Relay server listening on http://" + bindHost + ":" + server.port());
            System.out.println("SQLite DB at " + config.dbFile());
            stopped.await();
            return 0;
        }
    }

    @Command(name = "diagnostics", description = "Fetch the relay diagnostics snapshot")
    static final class DiagnosticsCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--json"}, description = "Output raw JSON")
        boolean json;

        @Override
        public Integer call() throws Exception {
            JsonNode payload = parent.client().diagnostics();
            if (json) {
                System.out.println(Jsons.toJson(payload));
                return 0;
            }
            printDiagnostics(payload, System.out);
            return 0;
        }
    }

    @Command(name = "push-metrics", description = "Push a host metrics sample to the relay")
    static final class PushMetricsCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Option(names = {"--cpu"}, required = true, description = "CPU usage percent")
        double cpu;

        @Option(names = {"--mem"}, required = true, description = "Memory usage percent")
        double mem;

        @Option(names = {"--swap"}, defaultValue = "0", description = "Swap usage percent")
        double swap;

        @Option(names = {"--net-in"}, defaultValue = "0", description = "Network bytes received")
        double netIn;

        @Option(names = {"--net-out"}, defaultValue = "0", description = "Network bytes sent")
        double netOut;

        @Option(names = {"--load"}, split = ",", defaultValue = "0,0,0", description = "Load averages 1m,5m,15m")
        List<Double> load;

        @Override
        public Integer call() throws Exception {
            HostMetrics metrics = new HostMetrics(cpu, mem, swap, netIn, netOut, load, Instant.now().toEpochMilli());
            parent.client().pushMetrics(metrics);
            System.out.println("Pushed host metrics to " + parent.server);
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the relay audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        SealRelayCommand parent;

        @Override
        public Integer call() {
            RelayConfig config = parent.relayConfig();
            RelayService service = new RelayService(config);
            int broken = service.auditLogger().verifyChain();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("ok", broken == 0);
            out.put("file", config.auditLog().toString());
            out.put("brokenLine", broken);
            out.put("head", service.auditLogger().currentHash());
            System.out.println(Jsons.toJson(out));
            return broken == 0 ? 0 : 1;
        }
    }

    /**
     * Decrypts one pushed envelope into the inbox. Failures are reported and do not end the stream.
     */
    static boolean receive(MaterialStore store, SessionProtocol protocol, Envelope envelope, PrintStream out, PrintStream err) {
        try {
            String plaintext = protocol.decryptMessage(store, envelope);
            store.saveInboxMessage(new InboxMessage(
                    envelope.timestamp() + ":" + envelope.senderId() + ":" + UUID.randomUUID(),
                    envelope.senderId(),
                    envelope.timestamp(),
                    plaintext,
                    envelope
            ));
            out.println("[" + envelope.senderId() + "] " + plaintext);
            return true;
        } catch (RuntimeException e) {
            err.println("Failed to decrypt message from " + envelope.senderId() + ": " + e.getMessage());
            return false;
        }
    }

    static void printDiagnostics(JsonNode payload, PrintStream out) {
        JsonNode counts = payload.path("counts");
        JsonNode hist = payload.path("queueDepthHistogram");
        out.println("Uptime: " + formatDuration(payload.path("uptimeSec").asLong()));
        out.println("DB: " + payload.path("dbPath").asText(""));
        out.println("Counts: users=" + counts.path("users").asInt()
                + " prekeys=" + counts.path("prekeys").asInt()
                + " queued=" + counts.path("queuedMessages").asInt()
                + " active=" + counts.path("activeConnections").asInt());
        out.println("Queue histogram: 0=" + hist.path("0").asInt()
                + " 1-5=" + hist.path("1-5").asInt()
                + " 6-20=" + hist.path("6-20").asInt()
                + " 21+=" + hist.path("21+").asInt());
        JsonNode metrics = payload.path("metrics");
        if (metrics.isMissingNode() || metrics.isNull()) {
            out.println("Metrics: none (no host sample pushed)");
            return;
        }
        out.println(String.format(Locale.ROOT, "Metrics: cpu=%.1f%% mem=%.1f%% swap=%.1f%% net_in=%d net_out=%d",
                metrics.path("cpuPct").asDouble(),
                metrics.path("memPct").asDouble(),
                metrics.path("swapPct").asDouble(),
                metrics.path("netInBytes").asLong(),
                metrics.path("netOutBytes").asLong()));
        StringBuilder load = new StringBuilder();
        for (JsonNode v : metrics.path("load")) {
            if (load.length() > 0) {
                load.append(' ');
            }
            load.append(String.format(Locale.ROOT, "%.2f", v.asDouble()));
        }
        out.println("Load: " + load + " updated_at=" + Instant.ofEpochMilli(metrics.path("updatedAt").asLong()));
    }

    static String formatDuration(long seconds) {
        long hrs = seconds / 3600;
        long mins = (seconds % 3600) / 60;
        long secs = seconds % 60;
        return hrs + "h " + mins + "m " + secs + "s";
    }

    private static String readText(String source) throws IOException {
        if (source == null || "-".equals(source)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Paths.get(source), StandardCharsets.UTF_8);
    }

    private static void writeText(String target, String text) throws IOException {
        if (target == null || "-".equals(target)) {
            System.out.print(text);
            System.out.flush();
            return;
        }
        Path path = Paths.get(target);
        if (path.toAbsolutePath().getParent() != null) {
            Files.createDirectories(path.toAbsolutePath().getParent());
        }
        Files.writeString(path, text, StandardCharsets.UTF_8);
    }
}
