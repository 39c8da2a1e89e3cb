package io.proxygate.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.proxygate.security.SensitiveDataMasker;
import io.proxygate.util.Hashing;
import io.proxygate.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row, so a removed
 * or edited line breaks the chain reported by {@link #verify()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
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

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Returns the newest {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        List<JsonNode> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(1, limit));
        return new ArrayList<>(rows.subList(from, rows.size()));
    }

    /**
     * Recomputes the hash chain from the first row.
     */
    public synchronized VerifyOutcome verify() {
        List<JsonNode> rows = readRows();
        String expectedPrev = "";
        int index = 0;
        for (JsonNode row : rows) {
            index++;
            String prev = row.path("prev_hash").asText("");
            String hash = row.path("hash").asText("");
            if (!prev.equals(expectedPrev)) {
                return new VerifyOutcome(false, rows.size(), index, "prev_hash mismatch");
            }
            Map<String, Object> unhashed = new LinkedHashMap<>();
            row.fields().forEachRemaining(e -> {
                if (!"hash".equals(e.getKey())) {
                    unhashed.put(e.getKey(), e.getValue());
                }
            });
            if (!Hashing.sha256Hex(Jsons.toCompactJson(unhashed)).equals(hash)) {
                return new VerifyOutcome(false, rows.size(), index, "hash mismatch");
            }
            expectedPrev = hash;
        }
        return new VerifyOutcome(true, rows.size(), -1, "ok");
    }

    private List<JsonNode> readRows() {
        List<JsonNode> rows = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    rows.add(Jsons.mapper().readTree(line));
                }
            }
            return rows;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        try {
            if (!Files.exists(auditFile)) {
                return "";
            }
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
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

        public static AuditEvent forUser(String action, String actor, String userId, String result, Map<String, Object> details) {
            return of(action, actor, "user/" + userId, result, details);
        }
    }

    public record VerifyOutcome(boolean valid, int rows, int firstBadRow, String message) {
    }
}
