package io.sealrelay.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.sealrelay.model.Bundle;
import io.sealrelay.model.Envelope;
import io.sealrelay.model.ValidationException;
import io.sealrelay.model.WireValidator;
import io.sealrelay.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * HTTP surface of a {@link RelayService}. Push channels are Server-Sent Events streams on
 * {@code /v1/stream}; each stream occupies one executor thread for its lifetime.
 */
public final class RelayHttpServer implements AutoCloseable {
    public static final long DEFAULT_HEARTBEAT_MS = 15_000L;
    private static final String PREKEYS_PREFIX = "/v1/prekeys/";

    private final RelayService service;
    private final HttpServer server;
    private final ExecutorService executor;
    private final long heartbeatMs;

    private RelayHttpServer(RelayService service, HttpServer server, ExecutorService executor, long heartbeatMs) {
        this.service = service;
        this.server = server;
        this.executor = executor;
        this.heartbeatMs = heartbeatMs;
    }

    public static RelayHttpServer start(RelayService service, String host, int port, int threads) throws IOException {
        return start(service, host, port, threads, DEFAULT_HEARTBEAT_MS);
    }

    public static RelayHttpServer start(RelayService service, String host, int port, int threads, long heartbeatMs) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(host, port), 0);
        ExecutorService executor = threads > 0
                ? Executors.newFixedThreadPool(threads)
                : Executors.newCachedThreadPool();
        RelayHttpServer relay = new RelayHttpServer(service, server, executor, Math.max(100L, heartbeatMs));
        server.createContext("/", relay::handle);
        server.setExecutor(executor);
        server.start();
        return relay;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        service.close();
        server.stop(0);
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            route(exchange);
        } catch (InvalidJsonException e) {
            writeJson(exchange, Map.of("error", "Invalid JSON body."), 400);
        } catch (ValidationException e) {
            writeJson(exchange, Map.of("error", "Invalid request.", "details", e.getMessage()), 400);
        } catch (RelayException e) {
            writeJson(exchange, Map.of("error", e.getMessage()), e.status());
        } catch (RuntimeException e) {
            System.err.println("Relay request failed: " + exchange.getRequestMethod() + " "
                    + exchange.getRequestURI().getPath() + ": " + e);
            writeJson(exchange, Map.of("error", "Internal server error."), 500);
        }
    }

    private void route(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();

        if ("GET".equals(method) && "/health".equals(path)) {
            writeText(exchange, "ok", "text/plain; charset=utf-8", 200);
            return;
        }
        if ("GET".equals(method) && "/diagnostics".equals(path)) {
            writeJson(exchange, service.diagnostics(), 200);
            return;
        }
        if ("POST".equals(method) && "/diagnostics/metrics".equals(path)) {
            service.pushHostMetrics(HostMetrics.parse(readJson(exchange)));
            writeJson(exchange, Map.of("ok", true), 200);
            return;
        }
        if ("GET".equals(method) && "/metrics".equals(path)) {
            writeText(exchange, service.metricsText(), "text/plain; version=0.0.4; charset=utf-8", 200);
            return;
        }
        if ("POST".equals(method) && "/v1/register".equals(path)) {
            String id = WireValidator.identityId(readJson(exchange), "id");
            service.register(id);
            writeJson(exchange, Map.of("id", id), 200);
            return;
        }
        if ("POST".equals(method) && "/v1/prekeys".equals(path)) {
            JsonNode body = readJson(exchange);
            String id = WireValidator.identityId(body, "id");
            Bundle bundle = WireValidator.bundle(body.get("bundle"));
            service.publishBundle(id, bundle);
            writeJson(exchange, Map.of("ok", true), 200);
            return;
        }
        if ("GET".equals(method) && path.startsWith(PREKEYS_PREFIX) && path.length() > PREKEYS_PREFIX.length()) {
            String id = path.substring(PREKEYS_PREFIX.length());
            Bundle bundle = service.fetchBundle(id);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("id", id);
            payload.put("bundle", bundle);
            writeJson(exchange, payload, 200);
            return;
        }
        if ("POST".equals(method) && "/v1/messages".equals(path)) {
            JsonNode body = readJson(exchange);
            String from = WireValidator.identityId(body, "from");
            String to = WireValidator.identityId(body, "to");
            Envelope envelope = WireValidator.envelope(body.get("envelope"));
            RelayService.SubmitOutcome outcome = service.submit(from, to, envelope);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("ok", true);
            payload.put("id", outcome.messageId());
            payload.put("queued", outcome.queued());
            payload.put("delivered", outcome.delivered());
            writeJson(exchange, payload, 200);
            return;
        }
        if ("GET".equals(method) && "/v1/stream".equals(path)) {
            stream(exchange);
            return;
        }
        writeJson(exchange, Map.of("error", "Not found."), 404);
    }

    private void stream(HttpExchange exchange) throws IOException {
        String clientId = parseQueryString(exchange.getRequestURI().getRawQuery()).get("client_id");
        if (clientId == null || clientId.isBlank()) {
            throw new ValidationException("client_id must be a non-empty string");
        }
        service.requireStreamClient(clientId);
        SsePushChannel channel = SsePushChannel.open(clientId, exchange);
        try {
            service.connect(channel);
        } catch (RuntimeException e) {
            // Headers are already sent; the only way to report is to end the stream.
            System.err.println("Relay stream setup failed for " + clientId + ": " + e);
            service.disconnect(channel);
            channel.close("error");
            return;
        }
        try {
            while (!channel.awaitClosed(heartbeatMs)) {
                if (!channel.heartbeat()) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            service.disconnect(channel);
            channel.close(null);
        }
    }

    private static JsonNode readJson(HttpExchange exchange) throws IOException {
        byte[] raw;
        try (InputStream in = exchange.getRequestBody()) {
            raw = in.readAllBytes();
        }
        if (raw.length == 0) {
            return Jsons.compact().createObjectNode();
        }
        try {
            return Jsons.compact().readTree(raw);
        } catch (IOException e) {
            throw new InvalidJsonException(e);
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        writeText(exchange, Jsons.toCompactJson(body), "application/json; charset=utf-8", status);
    }

    private static void writeText(HttpExchange exchange, String body, String contentType, int status) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Map<String, String> parseQueryString(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }

    private static final class InvalidJsonException extends RuntimeException {
        InvalidJsonException(Throwable cause) {
            super("Invalid JSON body.", cause);
        }
    }
}
