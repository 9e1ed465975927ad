package io.sealrelay.relay;

import com.fasterxml.jackson.databind.JsonNode;
import io.sealrelay.model.ValidationException;

import java.util.List;

/**
 * Latest host telemetry sample pushed to the relay. Kept in memory only.
 */
public record HostMetrics(
        double cpuPct,
        double memPct,
        double swapPct,
        double netInBytes,
        double netOutBytes,
        List<Double> load,
        long updatedAt
) {
    public HostMetrics {
        requireNonNegative(cpuPct, "cpuPct");
        requireNonNegative(memPct, "memPct");
        requireNonNegative(swapPct, "swapPct");
        requireNonNegative(netInBytes, "netInBytes");
        requireNonNegative(netOutBytes, "netOutBytes");
        if (load == null || load.size() != 3) {
            throw new ValidationException("load must hold exactly 3 numbers");
        }
        load = List.copyOf(load);
        if (updatedAt <= 0) {
            throw new ValidationException("updatedAt must be a positive integer");
        }
    }

    public static HostMetrics parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("metrics must be an object");
        }
        JsonNode load = node.get("load");
        if (load == null || !load.isArray() || load.size() != 3) {
            throw new ValidationException("load must hold exactly 3 numbers");
        }
        Double[] values = new Double[3];
        for (int i = 0; i < 3; i++) {
            if (!load.get(i).isNumber()) {
                throw new ValidationException("load[" + i + "] must be a number");
            }
            values[i] = load.get(i).asDouble();
        }
        JsonNode updatedAt = node.get("updatedAt");
        if (updatedAt == null || !updatedAt.isIntegralNumber()) {
            throw new ValidationException("updatedAt must be a positive integer");
        }
        return new HostMetrics(
                number(node, "cpuPct"),
                number(node, "memPct"),
                number(node, "swapPct"),
                number(node, "netInBytes"),
                number(node, "netOutBytes"),
                List.of(values),
                updatedAt.asLong()
        );
    }

    private static double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new ValidationException(field + " must be a number");
        }
        return value.asDouble();
    }

    private static void requireNonNegative(double value, String field) {
        if (Double.isNaN(value) || value < 0) {
            throw new ValidationException(field + " must be >= 0");
        }
    }
}
