package io.proxygate.notify;

import io.proxygate.model.Notification;
import io.proxygate.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one JSON object per notification, for a bot front end or a test harness to pick up.
 */
public final class JsonLinesNotifier implements Notifier {
    static final String ADMIN_KIND = "ADMIN_ALERT";

    private final Writer out;
    private final String adminUserId;
    private final Clock clock;

    public JsonLinesNotifier(OutputStream out, String adminUserId) {
        this(new OutputStreamWriter(out, StandardCharsets.UTF_8), adminUserId, Clock.systemUTC());
    }

    JsonLinesNotifier(Writer out, String adminUserId, Clock clock) {
        this.out = out;
        this.adminUserId = adminUserId == null || adminUserId.isBlank() ? null : adminUserId.trim();
        this.clock = clock;
    }

    @Override
    public void notify(String userId, Notification notification) throws NotificationException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp_ms", clock.millis());
        row.put("user_id", userId);
        row.put("kind", notification.kind().name());
        if (notification.link() != null) {
            row.put("link", notification.link());
        }
        if (notification.detail() != null) {
            row.put("detail", notification.detail());
        }
        write(row);
    }

    @Override
    public void notifyAdmin(String detail) throws NotificationException {
        if (adminUserId == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp_ms", clock.millis());
        row.put("user_id", adminUserId);
        row.put("kind", ADMIN_KIND);
        row.put("detail", detail);
        write(row);
    }

    private synchronized void write(Map<String, Object> row) throws NotificationException {
        try {
            out.write(Jsons.toCompactJson(row));
            out.write(System.lineSeparator());
            out.flush();
        } catch (IOException e) {
            throw new NotificationException("Failed to write notification for " + row.get("user_id"), e);
        }
    }
}
