package io.sealrelay.model;

/**
 * Payload pushed to a connected recipient for each queued envelope.
 */
public record Delivery(String from, String to, Envelope envelope) {
    public static Delivery of(QueueEntry entry) {
        return new Delivery(entry.fromId(), entry.toId(), entry.envelope());
    }
}
