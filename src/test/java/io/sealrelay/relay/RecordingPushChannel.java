package io.sealrelay.relay;

import io.sealrelay.model.Delivery;

import java.util.ArrayList;
import java.util.List;

final class RecordingPushChannel implements PushChannel {
    private final String clientId;
    private final List<Delivery> received = new ArrayList<>();
    private final List<String> closeReasons = new ArrayList<>();
    private int failAfter = Integer.MAX_VALUE;
    private int failNext;
    private Runnable onClose = () -> { };
    private boolean open = true;

    RecordingPushChannel(String clientId) {
        this.clientId = clientId;
    }

    /**
     * Accepts {@code count} more deliveries, then every send fails.
     */
    RecordingPushChannel failAfter(int count) {
        this.failAfter = count;
        return this;
    }

    /**
     * Fails the next {@code count} sends while staying open, then accepts again.
     */
    RecordingPushChannel failNext(int count) {
        this.failNext = count;
        return this;
    }

    RecordingPushChannel onClose(Runnable action) {
        this.onClose = action;
        return this;
    }

    List<Delivery> received() {
        return received;
    }

    List<String> closeReasons() {
        return closeReasons;
    }

    @Override
    public String clientId() {
        return clientId;
    }

    @Override
    public synchronized void send(Delivery delivery) throws TransportFailureException {
        if (failNext > 0) {
            failNext--;
            throw new TransportFailureException("simulated write failure", null);
        }
        if (received.size() >= failAfter) {
            throw new TransportFailureException("simulated write failure", null);
        }
        received.add(delivery);
    }

    @Override
    public synchronized void close(String reason) {
        onClose.run();
        closeReasons.add(reason);
        open = false;
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }
}
