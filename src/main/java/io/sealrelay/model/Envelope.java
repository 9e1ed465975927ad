package io.sealrelay.model;

/**
 * Wire record carrying one ciphertext plus routing metadata. The relay stores and forwards it verbatim.
 */
public record Envelope(
        int version,
        String senderId,
        String recipientId,
        String sessionId,
        int type,
        String body,
        long timestamp
) {
    public static final int CURRENT_VERSION = 1;

    public static String sessionId(String senderId, String recipientId) {
        return senderId + "::" + recipientId;
    }
}
