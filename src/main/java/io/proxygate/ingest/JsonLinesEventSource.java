package io.proxygate.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.proxygate.config.ProxyGateSettings;
import io.proxygate.model.ChatMemberStatus;
import io.proxygate.model.MembershipEvent;
import io.proxygate.model.MembershipEventType;
import io.proxygate.observability.AuditLogger;
import io.proxygate.util.Jsons;

import java.io.BufferedReader;
import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reads membership events, one JSON object per line. Two shapes are accepted:
 * <pre>
 * {"type":"join","user_id":"42","username":"bob","timestamp_ms":1700000000000}
 * {"old_status":"left","new_status":"member","user_id":42,"chat_id":"@club"}
 * </pre>
 * Status transitions that are neither a join nor a leave, and updates for other chats, are skipped.
 * Malformed lines are audited and skipped.
 */
public final class JsonLinesEventSource implements MembershipEventSource {
    private final BufferedReader reader;
    private final String channelId;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final AtomicLong rejectedLines = new AtomicLong();
    private long lineNumber;

    public JsonLinesEventSource(BufferedReader reader, String channelId, AuditLogger auditLogger, Clock clock) {
        this.reader = reader;
        this.channelId = ProxyGateSettings.normalizeChannelId(channelId);
        this.auditLogger = auditLogger;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Optional<MembershipEvent> next() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                Optional<MembershipEvent> event = parseLine(line, channelId, clock.millis());
                if (event.isPresent()) {
                    return event;
                }
            } catch (IllegalArgumentException e) {
                rejectedLines.incrementAndGet();
                if (auditLogger != null) {
                    auditLogger.log(AuditLogger.AuditEvent.of(
                            "event.parse",
                            "ingest",
                            "line/" + lineNumber,
                            "rejected",
                            Map.of("reason", String.valueOf(e.getMessage()))
                    ));
                }
            }
        }
        return Optional.empty();
    }

    public long rejectedLines() {
        return rejectedLines.get();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    /**
     * Parses one line. Returns empty for lines that are valid but not relevant to the gated channel.
     */
    public static Optional<MembershipEvent> parseLine(String line, String channelId, long nowMs) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("event line must be a JSON object");
        }
        String chat = text(node, "chat_id");
        if (channelId != null && chat != null && !channelId.equals(ProxyGateSettings.normalizeChannelId(chat))) {
            return Optional.empty();
        }
        String userId = text(node, "user_id");
        if (userId == null) {
            throw new IllegalArgumentException("user_id is required");
        }
        Optional<MembershipEventType> type;
        String rawType = text(node, "type");
        if (rawType != null) {
            type = Optional.of(MembershipEventType.fromString(rawType));
        } else {
            String oldStatus = text(node, "old_status");
            String newStatus = text(node, "new_status");
            if (oldStatus == null || newStatus == null) {
                throw new IllegalArgumentException("either type or old_status/new_status is required");
            }
            type = ChatMemberStatus.classify(ChatMemberStatus.fromString(oldStatus), ChatMemberStatus.fromString(newStatus));
        }
        if (type.isEmpty()) {
            return Optional.empty();
        }
        JsonNode ts = node.get("timestamp_ms");
        long timestampMs;
        if (ts == null || ts.isNull()) {
            timestampMs = nowMs;
        } else if (ts.canConvertToLong()) {
            timestampMs = ts.asLong();
        } else {
            throw new IllegalArgumentException("timestamp_ms must be an integer");
        }
        return Optional.of(new MembershipEvent(type.get(), userId, text(node, "username"), timestampMs));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText("").trim();
        return text.isEmpty() ? null : text;
    }
}
