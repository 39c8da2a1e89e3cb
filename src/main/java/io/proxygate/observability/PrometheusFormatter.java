package io.proxygate.observability;

import io.proxygate.runtime.ProxyGateRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(ProxyGateRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "proxygate_credentials", "Credential records grouped by status", "status", stats.credentialStatus());

        appendCounter(sb, "proxygate_events_total", "Membership events applied", "type", "join", stats.joins());
        appendCounter(sb, "proxygate_events_total", "Membership events applied", "type", "leave", stats.leaves());
        appendCounter(sb, "proxygate_provisioned_total", "Secrets provisioned on the proxy server", null, null, stats.provisioned());
        appendCounter(sb, "proxygate_revoked_total", "Secrets revoked on the proxy server", null, null, stats.revoked());
        appendCounter(sb, "proxygate_errors_total", "Remote and store failures observed by the engine", null, null, stats.errors());
        appendCounter(sb, "proxygate_rate_limited_total", "Join events dropped by the per-user rate limit", null, null, stats.rateLimited());
        appendCounter(sb, "proxygate_stale_events_total", "Events older than the user's watermark", null, null, stats.stale());
        appendCounter(sb, "proxygate_notification_failures_total", "Notifications that could not be delivered", null, null, stats.notificationFailures());
        appendCounter(sb, "proxygate_sweep_runs_total", "Recovery sweeps executed", null, null, stats.sweepRuns());

        appendGauge(sb, "proxygate_remote_calls", "Remote management calls by state", "state", "in_flight", stats.remoteInFlight());
        appendGauge(sb, "proxygate_remote_calls", "Remote management calls by state", "state", "waiting", stats.remoteWaiting());
        appendCounter(sb, "proxygate_remote_rejected_total", "Remote calls rejected by the bounded channel pool", null, null, stats.remoteRejected());

        appendGauge(sb, "proxygate_event_queue_depth", "Events waiting for a worker", null, null, stats.eventQueueDepth());
        appendCounter(sb, "proxygate_events_rejected_total", "Events rejected because the queue was full", null, null, stats.eventsRejected());
        appendCounter(sb, "proxygate_events_requeued_total", "Events re-queued after a store failure", null, null, stats.eventsRequeued());
        appendCounter(sb, "proxygate_events_crashed_total", "Events whose processing threw unexpectedly", null, null, stats.eventsCrashed());
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
        append(sb, metric, "gauge", help, label, labelValue, value);
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        append(sb, metric, "counter", help, label, labelValue, value);
    }

    private static void append(StringBuilder sb, String metric, String type, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
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
