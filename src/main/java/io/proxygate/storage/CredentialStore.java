package io.proxygate.storage;

import io.proxygate.model.CredentialOperation;
import io.proxygate.model.CredentialRecord;
import io.proxygate.model.CredentialStatus;
import io.proxygate.model.MembershipEventType;
import io.proxygate.util.Hashing;

import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable credential table. {@link #upsert} is atomic per user id; callers serialize writers for
 * the same user with the engine's per-user lock.
 */
public final class CredentialStore {
    private static final String SALT_KEY = "secret_salt";
    private static final String RECORD_COLUMNS = """
            user_id,username,status,secret,proxy_link,generation,failure_count,failed_operation,
            last_error,next_attempt_at_ms,created_at_ms,updated_at_ms
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO credentials(user_id,username,status,secret,proxy_link,generation,failure_count,
                failed_operation,last_error,next_attempt_at_ms,created_at_ms,updated_at_ms)
            VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
            ON CONFLICT(user_id) DO UPDATE SET
                username=excluded.username,
                status=excluded.status,
                secret=excluded.secret,
                proxy_link=excluded.proxy_link,
                generation=excluded.generation,
                failure_count=excluded.failure_count,
                failed_operation=excluded.failed_operation,
                last_error=excluded.last_error,
                next_attempt_at_ms=excluded.next_attempt_at_ms,
                updated_at_ms=excluded.updated_at_ms
            """;
    private static final String WATERMARK_SQL = """
            INSERT INTO membership_watermarks(user_id,last_event_at_ms,last_event_type,updated_at_ms)
            VALUES(?,?,?,?)
            ON CONFLICT(user_id) DO UPDATE SET
                last_event_at_ms=excluded.last_event_at_ms,
                last_event_type=excluded.last_event_type,
                updated_at_ms=excluded.updated_at_ms
            WHERE excluded.last_event_at_ms >= membership_watermarks.last_event_at_ms
            """;

    private final Database database;

    public CredentialStore(Database database) {
        this.database = database;
    }

    public Optional<CredentialRecord> get(String userId) {
        String sql = "SELECT " + RECORD_COLUMNS + " FROM credentials WHERE user_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readRecord(rs));
            }
        } catch (SQLException e) {
            throw new StoreIoException("Failed to read credential: " + userId, e);
        }
    }

    public void upsert(CredentialRecord r) {
        exec(UPSERT_SQL, ps -> bindRecord(ps, r), "Failed to upsert credential: " + r.userId());
    }

    /**
     * Writes the record and advances the user's event watermark in one transaction, so an event is
     * never marked applied unless the state change it caused was stored.
     */
    public void upsertWithWatermark(CredentialRecord r, long eventAtMs, MembershipEventType type, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement upsert = c.prepareStatement(UPSERT_SQL);
                 PreparedStatement watermark = c.prepareStatement(WATERMARK_SQL)) {
                bindRecord(upsert, r);
                upsert.executeUpdate();
                bindWatermark(watermark, r.userId(), eventAtMs, type, nowMs);
                watermark.executeUpdate();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreIoException("Failed to upsert credential with watermark: " + r.userId(), e);
        }
    }

    public List<CredentialRecord> listByStatus(CredentialStatus status, int limit) {
        String sql = "SELECT " + RECORD_COLUMNS + " FROM credentials WHERE status=? ORDER BY updated_at_ms ASC, user_id ASC LIMIT ?";
        return query(sql, ps -> {
            ps.setString(1, status.name());
            ps.setInt(2, Math.max(1, limit));
        }, "Failed to list credentials by status: " + status);
    }

    /**
     * Pending records the recovery sweep should re-drive: a scheduled retry that is due, or a
     * record nobody has touched since {@code staleBeforeMs} (crash mid-operation).
     */
    public List<CredentialRecord> listDuePending(long nowMs, long staleBeforeMs, int limit) {
        String sql = "SELECT " + RECORD_COLUMNS + """
                 FROM credentials
                WHERE status IN ('PENDING_PROVISION','PENDING_REVOKE')
                  AND ((next_attempt_at_ms > 0 AND next_attempt_at_ms <= ?) OR updated_at_ms <= ?)
                ORDER BY updated_at_ms ASC, user_id ASC
                LIMIT ?
                """;
        return query(sql, ps -> {
            ps.setLong(1, nowMs);
            ps.setLong(2, staleBeforeMs);
            ps.setInt(3, Math.max(1, limit));
        }, "Failed to list due pending credentials");
    }

    public Map<String, Integer> countByStatus() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (CredentialStatus status : CredentialStatus.values()) {
            out.put(status.name(), 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) AS n FROM credentials GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("status"), rs.getInt("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreIoException("Failed to count credentials", e);
        }
    }

    /**
     * Returns the installation salt used for secret derivation, creating it on first use. Concurrent
     * first calls converge on one value through {@code INSERT OR IGNORE}.
     */
    public String loadOrCreateSalt() {
        Optional<String> existing = installationValue(SALT_KEY);
        if (existing.isPresent()) {
            return existing.get();
        }
        byte[] random = new byte[32];
        new SecureRandom().nextBytes(random);
        String generated = Hashing.toHex(random);
        exec("INSERT OR IGNORE INTO installation_state(state_key,state_value,updated_at_ms) VALUES(?,?,?)", ps -> {
            ps.setString(1, SALT_KEY);
            ps.setString(2, generated);
            ps.setLong(3, System.currentTimeMillis());
        }, "Failed to persist secret salt");
        return installationValue(SALT_KEY)
                .orElseThrow(() -> new IllegalStateException("secret salt missing after insert"));
    }

    public Optional<EventWatermark> eventWatermark(String userId) {
        String sql = "SELECT user_id,last_event_at_ms,last_event_type FROM membership_watermarks WHERE user_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new EventWatermark(
                        rs.getString("user_id"),
                        rs.getLong("last_event_at_ms"),
                        MembershipEventType.valueOf(rs.getString("last_event_type"))
                ));
            }
        } catch (SQLException e) {
            throw new StoreIoException("Failed to read event watermark: " + userId, e);
        }
    }

    public void recordEventWatermark(String userId, long eventAtMs, MembershipEventType type, long nowMs) {
        exec(WATERMARK_SQL, ps -> bindWatermark(ps, userId, eventAtMs, type, nowMs),
                "Failed to record event watermark: " + userId);
    }

    private Optional<String> installationValue(String key) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT state_value FROM installation_state WHERE state_key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.ofNullable(rs.getString("state_value"));
            }
        } catch (SQLException e) {
            throw new StoreIoException("Failed to read installation state: " + key, e);
        }
    }

    private List<CredentialRecord> query(String sql, SqlBinder binder, String errorMessage) {
        List<CredentialRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRecord(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreIoException(errorMessage, e);
        }
    }

    private void exec(String sql, SqlBinder binder, String errorMessage) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreIoException(errorMessage, e);
        }
    }

    private static void bindRecord(PreparedStatement ps, CredentialRecord r) throws SQLException {
        ps.setString(1, r.userId());
        ps.setString(2, r.username());
        ps.setString(3, r.status().name());
        ps.setString(4, r.secret());
        ps.setString(5, r.proxyLink());
        ps.setLong(6, r.generation());
        ps.setInt(7, r.failureCount());
        ps.setString(8, r.failedOperation() == null ? null : r.failedOperation().name());
        ps.setString(9, r.lastError());
        ps.setLong(10, r.nextAttemptAtMs());
        ps.setLong(11, r.createdAtMs());
        ps.setLong(12, r.updatedAtMs());
    }

    private static void bindWatermark(PreparedStatement ps, String userId, long eventAtMs, MembershipEventType type, long nowMs)
            throws SQLException {
        ps.setString(1, userId);
        ps.setLong(2, eventAtMs);
        ps.setString(3, type.name());
        ps.setLong(4, nowMs);
    }

    private CredentialRecord readRecord(ResultSet rs) throws SQLException {
        String failedOperation = rs.getString("failed_operation");
        return new CredentialRecord(
                rs.getString("user_id"),
                rs.getString("username"),
                CredentialStatus.valueOf(rs.getString("status")),
                rs.getString("secret"),
                rs.getString("proxy_link"),
                rs.getLong("generation"),
                rs.getInt("failure_count"),
                failedOperation == null ? null : CredentialOperation.valueOf(failedOperation),
                rs.getString("last_error"),
                rs.getLong("next_attempt_at_ms"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    @FunctionalInterface
    private interface SqlBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public record EventWatermark(String userId, long lastEventAtMs, MembershipEventType lastEventType) {
    }
}
