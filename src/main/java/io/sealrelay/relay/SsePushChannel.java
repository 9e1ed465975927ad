package io.sealrelay.relay;

import com.sun.net.httpserver.HttpExchange;
import io.sealrelay.model.Delivery;
import io.sealrelay.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Push channel over a Server-Sent Events response. Every delivery is one {@code event: message} frame;
 * supersession writes an {@code event: superseded} frame before the stream ends.
 */
public final class SsePushChannel implements PushChannel {
    public static final String EVENT_MESSAGE = "message";
    public static final String EVENT_SUPERSEDED = "superseded";

    private final String clientId;
    private final HttpExchange exchange;
    private final OutputStream out;
    private final CountDownLatch closed = new CountDownLatch(1);

    private SsePushChannel(String clientId, HttpExchange exchange) {
        this.clientId = clientId;
        this.exchange = exchange;
        this.out = exchange.getResponseBody();
    }

    /**
     * Sends the stream response headers and wraps the exchange.
     */
    public static SsePushChannel open(String clientId, HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.sendResponseHeaders(200, 0);
        return new SsePushChannel(clientId, exchange);
    }

    @Override
    public String clientId() {
        return clientId;
    }

    @Override
    public synchronized void send(Delivery delivery) throws TransportFailureException {
        if (!isOpen()) {
            throw new TransportFailureException("Push channel closed for " + clientId, null);
        }
        try {
            writeFrame(EVENT_MESSAGE, Jsons.toCompactJson(delivery));
        } catch (IOException e) {
            markClosed();
            throw new TransportFailureException("Failed to push to " + clientId, e);
        }
    }

    /**
     * Comment frame used to notice dead clients between deliveries. Returns false once the stream is gone.
     */
    public synchronized boolean heartbeat() {
        if (!isOpen()) {
            return false;
        }
        return tryWrite(": ping\n\n");
    }

    /**
     * Ends the stream. A non-null reason is announced first; an {@code event: superseded} frame for
     * supersession, an {@code event: close} frame otherwise.
     */
    @Override
    public synchronized void close(String reason) {
        if (!isOpen()) {
            return;
        }
        if (reason != null) {
            String event = EVENT_SUPERSEDED.equals(reason) ? EVENT_SUPERSEDED : "close";
            tryWrite(frame(event, Jsons.toCompactJson(Map.of("reason", reason))));
        }
        markClosed();
    }

    @Override
    public boolean isOpen() {
        return closed.getCount() > 0;
    }

    /**
     * Blocks the stream handler until the channel closes or the timeout elapses.
     */
    public boolean awaitClosed(long timeoutMs) throws InterruptedException {
        return closed.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private void writeFrame(String event, String json) throws IOException {
        out.write(frame(event, json).getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private boolean tryWrite(String frame) {
        try {
            out.write(frame.getBytes(StandardCharsets.UTF_8));
            out.flush();
            return true;
        } catch (IOException e) {
            markClosed();
            return false;
        }
    }

    private static String frame(String event, String json) {
        String data = json.replace("\r", " ").replace("\n", " ");
        return "event: " + event + "\ndata: " + data + "\n\n";
    }

    private void markClosed() {
        if (closed.getCount() == 0) {
            return;
        }
        closed.countDown();
        exchange.close();
    }
}
