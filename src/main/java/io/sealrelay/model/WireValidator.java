package io.sealrelay.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Base64;

/**
 * Shape checks for the JSON records that cross the wire. Every method either returns a fully populated
 * record or throws {@link ValidationException} naming the offending field.
 */
public final class WireValidator {
    private WireValidator() {
    }

    public static String identityId(JsonNode parent, String field) {
        return text(parent, field, field);
    }

    public static Envelope envelope(JsonNode node) {
        requireObject(node, "envelope");
        return new Envelope(
                (int) integer(node, "version", 1, "envelope.version"),
                text(node, "senderId", "envelope.senderId"),
                text(node, "recipientId", "envelope.recipientId"),
                text(node, "sessionId", "envelope.sessionId"),
                (int) integer(node, "type", 0, "envelope.type"),
                base64(node, "body", "envelope.body"),
                integer(node, "timestamp", 1, "envelope.timestamp")
        );
    }

    public static Bundle bundle(JsonNode node) {
        requireObject(node, "bundle");
        JsonNode signed = node.get("signedPreKey");
        requireObject(signed, "bundle.signedPreKey");
        JsonNode oneTime = node.get("preKey");
        requireObject(oneTime, "bundle.preKey");
        JsonNode kyber = node.get("kyberPreKey");
        requireObject(kyber, "bundle.kyberPreKey");
        return new Bundle(
                text(node, "id", "bundle.id"),
                (int) integer(node, "deviceId", 1, "bundle.deviceId"),
                (int) integer(node, "registrationId", 1, "bundle.registrationId"),
                base64(node, "identityKey", "bundle.identityKey"),
                new Bundle.SignedPreKey(
                        (int) integer(signed, "keyId", 0, "bundle.signedPreKey.keyId"),
                        base64(signed, "publicKey", "bundle.signedPreKey.publicKey"),
                        base64(signed, "signature", "bundle.signedPreKey.signature")
                ),
                new Bundle.PreKey(
                        (int) integer(oneTime, "keyId", 0, "bundle.preKey.keyId"),
                        base64(oneTime, "publicKey", "bundle.preKey.publicKey")
                ),
                new Bundle.KyberPreKey(
                        (int) integer(kyber, "keyId", 0, "bundle.kyberPreKey.keyId"),
                        base64(kyber, "publicKey", "bundle.kyberPreKey.publicKey"),
                        base64(kyber, "signature", "bundle.kyberPreKey.signature")
                )
        );
    }

    private static void requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new ValidationException(path + " must be an object");
        }
    }

    private static String text(JsonNode parent, String field, String path) {
        JsonNode value = parent == null ? null : parent.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new ValidationException(path + " must be a non-empty string");
        }
        return value.asText();
    }

    private static long integer(JsonNode parent, String field, long min, String path) {
        JsonNode value = parent.get(field);
        if (value == null || !value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new ValidationException(path + " must be an integer");
        }
        long v = value.asLong();
        if (v < min) {
            throw new ValidationException(path + " must be >= " + min);
        }
        if (!"timestamp".equals(field) && v > Integer.MAX_VALUE) {
            throw new ValidationException(path + " is out of range");
        }
        return v;
    }

    private static String base64(JsonNode parent, String field, String path) {
        String value = text(parent, field, path);
        try {
            Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(path + " must be base64", e);
        }
        return value;
    }
}
