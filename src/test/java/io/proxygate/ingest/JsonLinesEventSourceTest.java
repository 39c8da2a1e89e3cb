package io.proxygate.ingest;

import io.proxygate.model.MembershipEvent;
import io.proxygate.model.MembershipEventType;
import io.proxygate.observability.AuditLogger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

final class JsonLinesEventSourceTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void readsBothLineShapesAndSkipsIrrelevantOnes() throws Exception {
        Path root = Files.createTempDirectory("proxygate-ingest-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"));
            String input = String.join("\n",
                    "{\"type\":\"join\",\"user_id\":\"42\",\"username\":\"bob\",\"timestamp_ms\":1000}",
                    "",
                    "{\"old_status\":\"member\",\"new_status\":\"administrator\",\"user_id\":7}",
                    "{\"old_status\":\"member\",\"new_status\":\"kicked\",\"user_id\":7,\"chat_id\":\"t.me/club\"}",
                    "{\"type\":\"join\",\"user_id\":\"9\",\"chat_id\":\"@elsewhere\"}",
                    "not json",
                    "{\"type\":\"leave\"}",
                    "{\"type\":\"leave\",\"user_id\":\"42\"}"
            );
            List<MembershipEvent> events = new ArrayList<>();
            try (JsonLinesEventSource source = new JsonLinesEventSource(
                    new BufferedReader(new StringReader(input)), "@club", audit, fixedClock())) {
                Optional<MembershipEvent> next;
                while ((next = source.next()).isPresent()) {
                    events.add(next.get());
                }
                Assertions.assertEquals(2L, source.rejectedLines());
            }

            Assertions.assertEquals(3, events.size());
            Assertions.assertEquals(MembershipEvent.join("42", "bob", 1000L), events.get(0));
            Assertions.assertEquals(MembershipEvent.leave("7", NOW), events.get(1));
            Assertions.assertEquals(MembershipEvent.leave("42", NOW), events.get(2));

            String auditText = Files.readString(audit.auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(auditText.contains("event.parse"));
            Assertions.assertTrue(auditText.contains("line/6"));
            Assertions.assertTrue(auditText.contains("line/7"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectsBadTimestampAndUnknownType() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> JsonLinesEventSource.parseLine(
                "{\"type\":\"join\",\"user_id\":\"1\",\"timestamp_ms\":\"soon\"}", null, NOW));
        Assertions.assertThrows(IllegalArgumentException.class, () -> JsonLinesEventSource.parseLine(
                "{\"type\":\"promote\",\"user_id\":\"1\"}", null, NOW));
        Assertions.assertThrows(IllegalArgumentException.class, () -> JsonLinesEventSource.parseLine(
                "[1,2]", null, NOW));
    }

    @Test
    void statusTransitionIntoChannelIsJoin() {
        Optional<MembershipEvent> event = JsonLinesEventSource.parseLine(
                "{\"old_status\":\"left\",\"new_status\":\"member\",\"user_id\":42,\"username\":\"bob\",\"timestamp_ms\":5}",
                null,
                NOW
        );
        Assertions.assertTrue(event.isPresent());
        Assertions.assertEquals(MembershipEventType.JOIN, event.get().type());
        Assertions.assertEquals("42", event.get().userId());
        Assertions.assertEquals(5L, event.get().timestampMs());
    }

    private static Clock fixedClock() {
        return Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
