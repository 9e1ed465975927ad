package io.sealrelay.model;

public record InboxMessage(
        String id,
        String senderId,
        long timestamp,
        String plaintext,
        Envelope envelope
) {
}
