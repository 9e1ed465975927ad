package io.sealrelay.observability;

import io.sealrelay.relay.DiagnosticsSnapshot;
import io.sealrelay.relay.HostMetrics;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(DiagnosticsSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "sealrelay_uptime_seconds", "Seconds since the relay started", null, null, snapshot.uptimeSec());
        appendGauge(sb, "sealrelay_users_total", "Registered identities", null, null, snapshot.counts().users());
        appendGauge(sb, "sealrelay_bundles_total", "Identities with a published bundle", null, null, snapshot.counts().prekeys());
        appendGauge(sb, "sealrelay_queued_messages", "Undelivered queue entries", null, null, snapshot.counts().queuedMessages());
        appendGauge(sb, "sealrelay_active_connections", "Live push channels", null, null, snapshot.counts().activeConnections());
        appendMapGauge(sb, "sealrelay_queue_depth_recipients", "Recipients grouped by undelivered queue depth", "depth",
                snapshot.queueDepthHistogram());
        HostMetrics metrics = snapshot.metrics();
        if (metrics != null) {
            appendSample(sb, "sealrelay_host_cpu_percent", "Host CPU usage percent", null, null, metrics.cpuPct());
            appendSample(sb, "sealrelay_host_memory_percent", "Host memory usage percent", null, null, metrics.memPct());
            appendSample(sb, "sealrelay_host_swap_percent", "Host swap usage percent", null, null, metrics.swapPct());
            appendSample(sb, "sealrelay_host_network_bytes", "Host network bytes", "direction", "in", metrics.netInBytes());
            appendSample(sb, "sealrelay_host_network_bytes", "Host network bytes", "direction", "out", metrics.netOutBytes());
            String[] windows = {"1m", "5m", "15m"};
            for (int i = 0; i < windows.length; i++) {
                appendSample(sb, "sealrelay_host_load", "Host load average", "window", windows[i], metrics.load().get(i));
            }
            appendGauge(sb, "sealrelay_host_metrics_updated_at_ms", "Timestamp of the latest host sample", null, null, metrics.updatedAt());
        }
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendSample(sb, metric, help, label, labelValue, Long.toString(value));
    }

    private static void appendSample(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        appendSample(sb, metric, help, label, labelValue, Double.toString(value));
    }

    private static void appendSample(StringBuilder sb, String metric, String help, String label, String labelValue, String value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
