package io.sealrelay.model;

public record QueueEntry(
        String id,
        String toId,
        String fromId,
        Envelope envelope,
        long createdAtMs,
        boolean delivered
) {
}
