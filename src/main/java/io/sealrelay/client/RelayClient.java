package io.sealrelay.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.sealrelay.model.Bundle;
import io.sealrelay.model.Delivery;
import io.sealrelay.model.Envelope;
import io.sealrelay.model.WireValidator;
import io.sealrelay.relay.HostMetrics;
import io.sealrelay.util.Jsons;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed client for the relay HTTP API.
 */
public final class RelayClient {
    private final String baseUrl;
    private final HttpClient http;

    public RelayClient(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public String baseUrl() {
        return baseUrl;
    }

    public void register(String id) throws IOException, InterruptedException {
        post("/v1/register", Map.of("id", id));
    }

    public void uploadBundle(String id, Bundle bundle) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", id);
        body.put("bundle", bundle);
        post("/v1/prekeys", body);
    }

    /**
     * Empty when the relay holds no bundle for {@code id}.
     */
    public Optional<Bundle> fetchBundle(String id) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uri("/v1/prekeys/" + URLEncoder.encode(id, StandardCharsets.UTF_8)
                        .replace("+", "%20")))
                .timeout(Duration.ofSeconds(20))
                .GET()
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        JsonNode body = checked(resp);
        return Optional.of(WireValidator.bundle(body.get("bundle")));
    }

    public SendResult sendMessage(String from, String to, Envelope envelope) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", from);
        body.put("to", to);
        body.put("envelope", envelope);
        JsonNode resp = post("/v1/messages", body);
        return new SendResult(
                resp.path("id").asText(""),
                resp.path("queued").asBoolean(false),
                resp.path("delivered").asBoolean(false)
        );
    }

    public JsonNode diagnostics() throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uri("/diagnostics"))
                .timeout(Duration.ofSeconds(20))
                .GET()
                .build();
        return checked(http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)));
    }

    public void pushMetrics(HostMetrics metrics) throws IOException, InterruptedException {
        post("/diagnostics/metrics", metrics);
    }

    /**
     * Opens the push stream for {@code clientId} and hands every event to {@code listener} until the
     * relay ends the stream or the listener returns false.
     */
    public void listen(String clientId, StreamListener listener) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uri("/v1/stream?client_id=" + URLEncoder.encode(clientId, StandardCharsets.UTF_8)))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<InputStream> resp = http.send(req, HttpResponse.BodyHandlers.ofInputStream());
        if (resp.statusCode() / 100 != 2) {
            String raw;
            try (InputStream in = resp.body()) {
                raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            throw failure(resp.statusCode(), raw);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resp.body(), StandardCharsets.UTF_8))) {
            String event = "message";
            StringBuilder data = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    if (data.length() > 0 && !dispatch(listener, event, data.toString())) {
                        return;
                    }
                    event = "message";
                    data.setLength(0);
                } else if (line.startsWith("event:")) {
                    event = line.substring("event:".length()).trim();
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    data.append(line.substring("data:".length()).trim());
                }
            }
        }
    }

    private static boolean dispatch(StreamListener listener, String event, String data) {
        JsonNode node = Jsons.readTree(data);
        if ("message".equals(event)) {
            Delivery delivery = new Delivery(
                    WireValidator.identityId(node, "from"),
                    WireValidator.identityId(node, "to"),
                    WireValidator.envelope(node.get("envelope"))
            );
            return listener.onDelivery(delivery);
        }
        return listener.onControl(event, node);
    }

    private JsonNode post(String path, Object body) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(20))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8))
                .build();
        return checked(http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)));
    }

    private JsonNode checked(HttpResponse<String> resp) throws RelayRequestException {
        if (resp.statusCode() / 100 != 2) {
            throw failure(resp.statusCode(), resp.body());
        }
        return Jsons.readTree(resp.body());
    }

    private static RelayRequestException failure(int status, String raw) {
        String message = "relay request failed status=" + status;
        if (raw != null && !raw.isBlank()) {
            try {
                String error = Jsons.readTree(raw).path("error").asText("");
                if (!error.isBlank()) {
                    message = error;
                }
            } catch (IllegalArgumentException e) {
                message = message + " body=" + raw.strip();
            }
        }
        return new RelayRequestException(status, message);
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    /**
     * Receives push-stream events. Returning false ends the stream.
     */
    public interface StreamListener {
        boolean onDelivery(Delivery delivery);

        default boolean onControl(String event, JsonNode data) {
            return !"superseded".equals(event);
        }
    }

    public record SendResult(String id, boolean queued, boolean delivered) {
    }
}
