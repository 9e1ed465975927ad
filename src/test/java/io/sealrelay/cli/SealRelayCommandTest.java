package io.sealrelay.cli;

import io.sealrelay.config.RelayConfig;
import io.sealrelay.material.MaterialStore;
import io.sealrelay.model.Envelope;
import io.sealrelay.model.InboxMessage;
import io.sealrelay.protocol.SessionProtocol;
import io.sealrelay.relay.RelayHttpServer;
import io.sealrelay.relay.RelayService;
import io.sealrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class SealRelayCommandTest {

    @Test
    void offlineBundleExchangeThroughFiles() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-cli-offline-");
        try {
            String aliceDb = root.resolve("alice.db").toString();
            String bobDb = root.resolve("bob.db").toString();
            Assertions.assertEquals(0, run(aliceDb, "init", "--id", "alice"));
            Assertions.assertEquals(0, run(bobDb, "init", "--id", "bob"));
            Assertions.assertEquals(0, run(bobDb, "prekey-generate", "--count", "3"));

            Path bobBundle = root.resolve("out").resolve("bob-bundle.json");
            Assertions.assertEquals(0, run(bobDb, "bundle-export", "--out", bobBundle.toString()));
            Assertions.assertEquals(4, Jsons.readTree(Files.readString(bobBundle)).path("preKey").path("keyId").asInt());
            Assertions.assertEquals(0, run(aliceDb, "session-init", "--their-bundle", bobBundle.toString()));

            Path message = root.resolve("message.txt");
            Files.writeString(message, "hello from docker phase zero e2e", StandardCharsets.UTF_8);
            Path envelope = root.resolve("envelope.json");
            Path decrypted = root.resolve("decrypted.txt");
            Assertions.assertEquals(0, run(aliceDb, "encrypt", "--to", "bob", "--in", message.toString(), "--out", envelope.toString()));
            Assertions.assertFalse(Files.readString(envelope).contains("hello"));
            Assertions.assertEquals(0, run(bobDb, "decrypt", "--in", envelope.toString(), "--out", decrypted.toString()));
            Assertions.assertEquals("hello from docker phase zero e2e", Files.readString(decrypted, StandardCharsets.UTF_8));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sendListenAndInboxAgainstLiveRelay() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-cli-relay-");
        RelayService service = new RelayService(RelayConfig.fromRoot(root.resolve("relay").toString(), Map.of()));
        service.init();
        try (RelayHttpServer server = RelayHttpServer.start(service, "127.0.0.1", 0, 0, 200L)) {
            String url = "http://127.0.0.1:" + server.port();
            String aliceDb = root.resolve("alice.db").toString();
            String bobDb = root.resolve("bob.db").toString();
            Assertions.assertEquals(0, run(aliceDb, "init", "--id", "alice"));
            Assertions.assertEquals(0, run(bobDb, "init", "--id", "bob"));
            Assertions.assertEquals(0, run(aliceDb, "--server", url, "register", "--id", "alice"));
            Assertions.assertEquals(0, run(bobDb, "--server", url, "register", "--id", "bob"));
            Assertions.assertEquals(0, run(bobDb, "--server", url, "prekeys-upload"));

            Path message = root.resolve("message.txt");
            Files.writeString(message, "queued while offline", StandardCharsets.UTF_8);
            Assertions.assertEquals(0, run(aliceDb, "--server", url, "send", "--to", "bob", "--in", message.toString()));
            Assertions.assertEquals(1, service.diagnostics().counts().queuedMessages());

            Assertions.assertEquals(0, run(bobDb, "--server", url, "listen", "--max-messages", "1"));
            Assertions.assertEquals(0, service.diagnostics().counts().queuedMessages());

            try (MaterialStore bob = MaterialStore.open(Path.of(bobDb), "pw")) {
                List<InboxMessage> inbox = bob.listInboxMessages();
                Assertions.assertEquals(1, inbox.size());
                Assertions.assertEquals("alice", inbox.get(0).senderId());
                Assertions.assertEquals("queued while offline", inbox.get(0).plaintext());
                Assertions.assertTrue(inbox.get(0).id().startsWith(inbox.get(0).timestamp() + ":alice:"));
            }
            Assertions.assertEquals(0, run(bobDb, "inbox", "--json", "--limit", "5"));
            Assertions.assertEquals(1, run(bobDb, "--server", url, "prekeys-fetch", "--id", "nobody"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void receiveReportsUndecryptableEnvelopeAndKeepsGoing() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-cli-receive-");
        try (MaterialStore bob = MaterialStore.open(root.resolve("bob.db"), "pw")) {
            bob.initializeIdentity("bob", 1);
            SessionProtocol protocol = new SessionProtocol();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteArrayOutputStream err = new ByteArrayOutputStream();
            Envelope garbage = new Envelope(1, "mallory", "bob", "mallory::bob", 2, "AAAA", 5L);

            boolean ok = SealRelayCommand.receive(bob, protocol, garbage,
                    new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
            Assertions.assertFalse(ok);
            Assertions.assertEquals("", out.toString(StandardCharsets.UTF_8));
            Assertions.assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Failed to decrypt message from mallory"));
            Assertions.assertTrue(bob.listInboxMessages().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void diagnosticsRenderForHumans() {
        String payload = """
                {"uptimeSec":3725,"dbPath":"/data/relay.db",
                 "counts":{"users":2,"prekeys":1,"queuedMessages":4,"activeConnections":1},
                 "queueDepthHistogram":{"0":0,"1-5":1,"6-20":0,"21+":0},
                 "metrics":null}
                """;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        SealRelayCommand.printDiagnostics(Jsons.readTree(payload), new PrintStream(buffer, true, StandardCharsets.UTF_8));
        String text = buffer.toString(StandardCharsets.UTF_8);

        Assertions.assertTrue(text.contains("Uptime: 1h 2m 5s"));
        Assertions.assertTrue(text.contains("Counts: users=2 prekeys=1 queued=4 active=1"));
        Assertions.assertTrue(text.contains("Queue histogram: 0=0 1-5=1 6-20=0 21+=0"));
        Assertions.assertTrue(text.contains("Metrics: none"));
        Assertions.assertEquals("0h 0m 0s", SealRelayCommand.formatDuration(0));
    }

    private static int run(String db, String... args) {
        String[] full = new String[args.length + 4];
        full[0] = "--db";
        full[1] = db;
        full[2] = "--passphrase";
        full[3] = "pw";
        System.arraycopy(args, 0, full, 4, args.length);
        return new CommandLine(new SealRelayCommand()).execute(full);
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
