package io.sealrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.sealrelay.security.SensitiveDataMasker;
import io.sealrelay.util.Hashing;
import io.sealrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail. Each row carries the hash of the previous row, so truncation or edits
 * in the middle of the file break the chain; with a signing secret every row hash is also HMAC-signed.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes every row hash and link. Returns the 1-based line number of the first broken row, or 0
     * when the whole chain verifies.
     */
    public synchronized int verifyChain() {
        List<String> lines = readLines();
        String expectedPrev = "";
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.readTree(line);
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return lineNo;
            }
            Map<String, Object> unsigned = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> {
                if (!"hash".equals(e.getKey()) && !"signature".equals(e.getKey())) {
                    unsigned.put(e.getKey(), e.getValue());
                }
            });
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(unsigned)))) {
                return lineNo;
            }
            expectedPrev = hash;
        }
        return 0;
    }

    private String loadLastHash() {
        String last = "";
        for (String line : readLines()) {
            if (!line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        return Jsons.readTree(last).path("hash").asText("");
    }

    private List<String> readLines() {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.compact().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.compact().convertValue(masked, Map.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }
}
