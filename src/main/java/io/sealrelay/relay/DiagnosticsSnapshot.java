package io.sealrelay.relay;

import java.util.Map;

/**
 * Point-in-time relay counters. {@code metrics} is null until a host sample was pushed.
 */
public record DiagnosticsSnapshot(
        long uptimeSec,
        String dbPath,
        Counts counts,
        Map<String, Integer> queueDepthHistogram,
        HostMetrics metrics
) {
    public record Counts(int users, int prekeys, int queuedMessages, int activeConnections) {
    }
}
