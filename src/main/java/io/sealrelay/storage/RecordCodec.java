package io.sealrelay.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sealrelay.util.Jsons;

import java.io.IOException;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;

/**
 * JSON encoding of record values. Binary leaves are written as {@code {"__type":"bin","data":<base64>}}
 * so that key material survives the trip through JSON and comes back as {@code byte[]}.
 */
final class RecordCodec {
    static final String TYPE_FIELD = "__type";
    static final String BINARY_TYPE = "bin";
    static final String DATA_FIELD = "data";

    private final ObjectMapper mapper;

    RecordCodec() {
        this.mapper = Jsons.compact();
    }

    byte[] encode(Object value) {
        JsonNode tree = value instanceof JsonNode ? (JsonNode) value : mapper.valueToTree(value);
        return Jsons.toJsonBytes(tag(tree));
    }

    JsonNode decodeTree(byte[] raw) {
        try {
            return untag(mapper.readTree(raw));
        } catch (IOException e) {
            throw new IllegalStateException("Stored record is not valid JSON", e);
        }
    }

    Object decode(byte[] raw) {
        return convert(decodeTree(raw), Object.class);
    }

    <T> T decode(byte[] raw, Class<T> type) {
        return convert(decodeTree(raw), type);
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (IOException e) {
            throw new IllegalStateException("Stored record does not match " + type.getSimpleName(), e);
        }
    }

    private JsonNode tag(JsonNode node) {
        if (node == null) {
            return mapper.nullNode();
        }
        if (node.isBinary()) {
            ObjectNode tagged = mapper.createObjectNode();
            tagged.put(TYPE_FIELD, BINARY_TYPE);
            tagged.put(DATA_FIELD, Base64.getEncoder().encodeToString(((BinaryNode) node).binaryValue()));
            return tagged;
        }
        if (node.isObject()) {
            ObjectNode out = mapper.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                out.set(entry.getKey(), tag(entry.getValue()));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = mapper.createArrayNode();
            for (JsonNode item : node) {
                out.add(tag(item));
            }
            return out;
        }
        return node;
    }

    private JsonNode untag(JsonNode node) {
        if (node == null) {
            return mapper.nullNode();
        }
        if (node.isObject()) {
            if (isBinaryTag(node)) {
                return BinaryNode.valueOf(Base64.getDecoder().decode(node.get(DATA_FIELD).asText()));
            }
            ObjectNode out = mapper.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                out.set(entry.getKey(), untag(entry.getValue()));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = mapper.createArrayNode();
            for (JsonNode item : node) {
                out.add(untag(item));
            }
            return out;
        }
        return node;
    }

    private static boolean isBinaryTag(JsonNode node) {
        return node.size() == 2
                && BINARY_TYPE.equals(node.path(TYPE_FIELD).asText(null))
                && node.path(DATA_FIELD).isTextual();
    }
}
