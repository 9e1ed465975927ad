package io.sealrelay.relay;

import com.fasterxml.jackson.databind.JsonNode;
import io.sealrelay.client.RelayClient;
import io.sealrelay.client.RelayRequestException;
import io.sealrelay.model.Delivery;
import io.sealrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class RelayHttpServerTest {
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Test
    void queuedMessagesAreStreamedInOrderAfterConnect() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-http-stream-");
        RelayService service = RelayServiceTest.newService(root);
        ExecutorService listeners = Executors.newCachedThreadPool();
        try (RelayHttpServer server = RelayHttpServer.start(service, "127.0.0.1", 0, 0, 200L)) {
            RelayClient client = new RelayClient("http://127.0.0.1:" + server.port() + "/");
            client.register("alice");
            client.register("bob");
            client.uploadBundle("bob", RelayServiceTest.bundle("bob", 9));
            Assertions.assertEquals(9, client.fetchBundle("bob").orElseThrow().preKey().keyId());
            Assertions.assertTrue(client.fetchBundle("nobody").isEmpty());

            RelayClient.SendResult first = client.sendMessage("alice", "bob", RelayServiceTest.envelope("alice", "bob", "Zmlyc3Q="));
            client.sendMessage("alice", "bob", RelayServiceTest.envelope("alice", "bob", "c2Vjb25k"));
            Assertions.assertTrue(first.queued());
            Assertions.assertFalse(first.delivered());
            Assertions.assertFalse(first.id().isBlank());

            List<Delivery> received = new CopyOnWriteArrayList<>();
            Future<?> bob = listeners.submit(() -> {
                client.listen("bob", new RelayClient.StreamListener() {
                    @Override
                    public boolean onDelivery(Delivery delivery) {
                        received.add(delivery);
                        return received.size() < 3;
                    }
                });
                return null;
            });
            waitFor(() -> received.size() == 2);
            Assertions.assertEquals(List.of("Zmlyc3Q=", "c2Vjb25k"), received.stream().map(d -> d.envelope().body()).toList());

            RelayClient.SendResult live = client.sendMessage("alice", "bob", RelayServiceTest.envelope("alice", "bob", "bGl2ZQ=="));
            Assertions.assertTrue(live.delivered());
            bob.get(10, TimeUnit.SECONDS);
            Assertions.assertEquals("bGl2ZQ==", received.get(2).envelope().body());
            Assertions.assertEquals(0, client.diagnostics().path("counts").path("queuedMessages").asInt());
        } finally {
            listeners.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void secondStreamSupersedesFirst() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-http-supersede-");
        RelayService service = RelayServiceTest.newService(root);
        ExecutorService listeners = Executors.newCachedThreadPool();
        try (RelayHttpServer server = RelayHttpServer.start(service, "127.0.0.1", 0, 0, 200L)) {
            RelayClient client = new RelayClient("http://127.0.0.1:" + server.port());
            client.register("bob");

            CountDownLatch superseded = new CountDownLatch(1);
            Future<?> first = listeners.submit(() -> {
                client.listen("bob", new RelayClient.StreamListener() {
                    @Override
                    public boolean onDelivery(Delivery delivery) {
                        return true;
                    }

                    @Override
                    public boolean onControl(String event, JsonNode data) {
                        if (SsePushChannel.EVENT_SUPERSEDED.equals(event)) {
                            superseded.countDown();
                            return false;
                        }
                        return true;
                    }
                });
                return null;
            });
            waitFor(() -> service.diagnostics().counts().activeConnections() == 1);

            List<Delivery> secondReceived = new CopyOnWriteArrayList<>();
            listeners.submit(() -> {
                client.listen("bob", delivery -> {
                    secondReceived.add(delivery);
                    return false;
                });
                return null;
            });
            Assertions.assertTrue(superseded.await(10, TimeUnit.SECONDS));
            first.get(10, TimeUnit.SECONDS);

            client.register("alice");
            Assertions.assertTrue(client.sendMessage("alice", "bob", RelayServiceTest.envelope("alice", "bob", "AAAA")).delivered());
            waitFor(() -> secondReceived.size() == 1);
        } finally {
            listeners.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void errorsMapToStatusCodes() throws Exception {
        Path root = Files.createTempDirectory("sealrelay-test-http-errors-");
        RelayService service = RelayServiceTest.newService(root);
        try (RelayHttpServer server = RelayHttpServer.start(service, "127.0.0.1", 0, 2)) {
            String base = "http://127.0.0.1:" + server.port();
            RelayClient client = new RelayClient(base);

            Assertions.assertEquals(200, get(base + "/health").statusCode());
            Assertions.assertEquals("ok", get(base + "/health").body());

            HttpResponse<String> badJson = post(base + "/v1/register", "{nope");
            Assertions.assertEquals(400, badJson.statusCode());
            Assertions.assertEquals("Invalid JSON body.", Jsons.readTree(badJson.body()).path("error").asText());

            HttpResponse<String> badId = post(base + "/v1/register", "{\"id\":42}");
            Assertions.assertEquals(400, badId.statusCode());
            JsonNode invalid = Jsons.readTree(badId.body());
            Assertions.assertEquals("Invalid request.", invalid.path("error").asText());
            Assertions.assertEquals("id must be a non-empty string", invalid.path("details").asText());

            HttpResponse<String> register = post(base + "/v1/register", "{\"id\":\"alice\"}");
            Assertions.assertEquals(200, register.statusCode());
            Assertions.assertEquals("alice", Jsons.readTree(register.body()).path("id").asText());

            RelayRequestException notRegistered = Assertions.assertThrows(RelayRequestException.class,
                    () -> client.uploadBundle("ghost", RelayServiceTest.bundle("ghost", 1)));
            Assertions.assertEquals(404, notRegistered.status());
            Assertions.assertEquals("User not registered.", notRegistered.getMessage());

            RelayRequestException noRecipient = Assertions.assertThrows(RelayRequestException.class,
                    () -> client.sendMessage("alice", "ghost", RelayServiceTest.envelope("alice", "ghost", "AAAA")));
            Assertions.assertEquals("Recipient not registered.", noRecipient.getMessage());

            Assertions.assertEquals(400, get(base + "/v1/stream").statusCode());
            HttpResponse<String> stranger = get(base + "/v1/stream?client_id=stranger");
            Assertions.assertEquals(401, stranger.statusCode());
            Assertions.assertEquals("Client not registered.", Jsons.readTree(stranger.body()).path("error").asText());

            HttpResponse<String> unknown = get(base + "/v2/anything");
            Assertions.assertEquals(404, unknown.statusCode());
            Assertions.assertEquals("Not found.", Jsons.readTree(unknown.body()).path("error").asText());

            HttpResponse<String> badMetrics = post(base + "/diagnostics/metrics", "{\"cpuPct\":1}");
            Assertions.assertEquals(400, badMetrics.statusCode());
            client.pushMetrics(new HostMetrics(1, 2, 3, 4, 5, List.of(0.1, 0.2, 0.3), 123L));

            JsonNode diagnostics = client.diagnostics();
            Assertions.assertEquals(1, diagnostics.path("counts").path("users").asInt());
            Assertions.assertEquals(0, diagnostics.path("queueDepthHistogram").path("21+").asInt());
            Assertions.assertEquals(123L, diagnostics.path("metrics").path("updatedAt").asLong());

            HttpResponse<String> metrics = get(base + "/metrics");
            Assertions.assertTrue(metrics.headers().firstValue("Content-Type").orElse("").startsWith("text/plain; version=0.0.4"));
            Assertions.assertTrue(metrics.body().contains("sealrelay_users_total 1"));
        } finally {
            deleteRecursively(root);
        }
    }

    private HttpResponse<String> get(String url) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url)).timeout(Duration.ofSeconds(10)).GET().build();
        return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private HttpResponse<String> post(String url, String body) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000L;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("condition not reached within 10s");
            }
            Thread.sleep(20L);
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
