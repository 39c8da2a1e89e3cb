package io.proxygate.runtime;

import io.proxygate.model.CredentialOperation;
import io.proxygate.model.CredentialRecord;
import io.proxygate.model.CredentialStatus;
import io.proxygate.model.MembershipEvent;
import io.proxygate.model.MembershipEventType;
import io.proxygate.model.Notification;
import io.proxygate.notify.NotificationException;
import io.proxygate.notify.Notifier;
import io.proxygate.observability.AuditLogger;
import io.proxygate.provision.ProvisioningException;
import io.proxygate.provision.RemoteProvisioner;
import io.proxygate.storage.CredentialStore;
import io.proxygate.storage.StoreIoException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives each user's credential toward what the latest membership event asks for.
 *
 * <p>The stored status is the only progress marker: a PENDING record always means "repeat the
 * remote operation", and both remote operations are idempotent, so re-driving after a crash, a
 * timeout or a duplicate event converges on one secret per generation. All work for one user runs
 * under that user's lock; different users proceed in parallel.
 */
public final class ReconciliationEngine {
    private static final String ACTOR = "engine";
    private static final int MAX_ERROR_CHARS = 512;

    private final CredentialStore store;
    private final RemoteProvisioner provisioner;
    private final Notifier notifier;
    private final AuditLogger auditLogger;
    private final UserLockRegistry locks;
    private final RetryPolicy retryPolicy;
    private final EventRateLimiter rateLimiter;
    private final long staleAfterMs;
    private final int sweepLimit;
    private final Clock clock;

    private final AtomicLong joins = new AtomicLong();
    private final AtomicLong leaves = new AtomicLong();
    private final AtomicLong provisioned = new AtomicLong();
    private final AtomicLong revoked = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong stale = new AtomicLong();
    private final AtomicLong notificationFailures = new AtomicLong();
    private final AtomicLong sweepRuns = new AtomicLong();

    public ReconciliationEngine(
            CredentialStore store,
            RemoteProvisioner provisioner,
            Notifier notifier,
            AuditLogger auditLogger,
            RetryPolicy retryPolicy,
            EventRateLimiter rateLimiter,
            long staleAfterMs,
            int sweepLimit,
            Clock clock
    ) {
        this.store = store;
        this.provisioner = provisioner;
        this.notifier = notifier;
        this.auditLogger = auditLogger;
        this.locks = new UserLockRegistry();
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.staleAfterMs = Math.max(0L, staleAfterMs);
        this.sweepLimit = Math.max(1, sweepLimit);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public EventOutcome handle(MembershipEvent event) {
        String userId = event.userId();
        try (UserLockRegistry.Handle ignored = locks.acquire(userId)) {
            Optional<CredentialStore.EventWatermark> watermark = store.eventWatermark(userId);
            if (watermark.isPresent() && event.timestampMs() < watermark.get().lastEventAtMs()) {
                stale.incrementAndGet();
                audit("event.stale", userId, "ignored", Map.of(
                        "event", event.type().name(),
                        "event_at_ms", event.timestampMs(),
                        "watermark_ms", watermark.get().lastEventAtMs(),
                        "watermark_event", watermark.get().lastEventType().name()
                ));
                return outcome(event, Result.STALE, store.get(userId).orElse(null), "older than last applied event");
            }
            if (event.type() == MembershipEventType.JOIN && !rateLimiter.tryAcquire(userId)) {
                rateLimited.incrementAndGet();
                audit("event.rate_limited", userId, "dropped", Map.of("event", event.type().name()));
                return outcome(event, Result.RATE_LIMITED, store.get(userId).orElse(null), "join rate limit reached");
            }
            long nowMs = clock.millis();
            Optional<CredentialRecord> current = store.get(userId);
            if (event.type() == MembershipEventType.JOIN) {
                joins.incrementAndGet();
                return applyJoin(event, current.orElse(null), nowMs);
            }
            leaves.incrementAndGet();
            return applyLeave(event, current.orElse(null), nowMs);
        } catch (StoreIoException e) {
            errors.incrementAndGet();
            audit("event.store_unavailable", userId, "aborted", Map.of(
                    "event", event.type().name(),
                    "error", errorText(e)
            ));
            return new EventOutcome(userId, event.type().name(), Result.STORE_UNAVAILABLE, null, 0L, errorText(e));
        }
    }

    // The watermark commits with the first state change an event causes; paths that change nothing,
    // or whose record is already PENDING, record it on its own.
    private EventOutcome applyJoin(MembershipEvent event, CredentialRecord current, long nowMs) {
        String trigger = event.type().name();
        if (current == null) {
            CredentialRecord pending = CredentialRecord.pendingProvision(event.userId(), event.username(), 1L, nowMs);
            store.upsertWithWatermark(pending, event.timestampMs(), event.type(), nowMs);
            return drive(pending, trigger, true);
        }
        CredentialRecord record = current.withUsername(event.username());
        return switch (record.status()) {
            case ACTIVE -> {
                if (!Objects.equals(record.username(), current.username())) {
                    store.upsertWithWatermark(record, event.timestampMs(), event.type(), nowMs);
                } else {
                    recordWatermark(event, nowMs);
                }
                sendToUser(record.userId(), Notification.accessGranted(record.proxyLink()));
                yield outcome(event, Result.NOOP, record, "already active, link re-sent");
            }
            case PENDING_PROVISION -> {
                recordWatermark(event, nowMs);
                yield drive(record, trigger, true);
            }
            case REVOKED -> {
                CredentialRecord pending = record.startCycle(record.generation() + 1L, nowMs);
                store.upsertWithWatermark(pending, event.timestampMs(), event.type(), nowMs);
                yield drive(pending, trigger, true);
            }
            case PENDING_REVOKE -> {
                // A JOIN watermark on a PENDING_REVOKE record tells the sweep to provision after the revoke.
                recordWatermark(event, nowMs);
                yield finishRevokeThenProvision(record, trigger, nowMs);
            }
            case FAILED -> {
                if (record.failedOperation() == CredentialOperation.REVOKE) {
                    CredentialRecord pending = record.pending(CredentialOperation.REVOKE, nowMs);
                    store.upsertWithWatermark(pending, event.timestampMs(), event.type(), nowMs);
                    yield finishRevokeThenProvision(pending, trigger, nowMs);
                }
                CredentialRecord pending = record.pending(CredentialOperation.PROVISION, nowMs);
                store.upsertWithWatermark(pending, event.timestampMs(), event.type(), nowMs);
                yield drive(pending, trigger, true);
            }
        };
    }

    private EventOutcome applyLeave(MembershipEvent event, CredentialRecord current, long nowMs) {
        if (current == null) {
            recordWatermark(event, nowMs);
            return outcome(event, Result.NOOP, null, "no credential");
        }
        return switch (current.status()) {
            case REVOKED -> {
                recordWatermark(event, nowMs);
                yield outcome(event, Result.NOOP, current, "already revoked");
            }
            case PENDING_REVOKE -> {
                recordWatermark(event, nowMs);
                yield drive(current, event.type().name(), true);
            }
            case ACTIVE, PENDING_PROVISION, FAILED -> {
                CredentialRecord pending = current.pending(CredentialOperation.REVOKE, nowMs);
                store.upsertWithWatermark(pending, event.timestampMs(), event.type(), nowMs);
                yield drive(pending, event.type().name(), true);
            }
        };
    }

    private void recordWatermark(MembershipEvent event, long nowMs) {
        store.recordEventWatermark(event.userId(), event.timestampMs(), event.type(), nowMs);
    }

    /**
     * The user rejoined while the previous secret was still being removed. The old secret is
     * removed first so the next generation never coexists with it. No revocation notice is sent.
     */
    private EventOutcome finishRevokeThenProvision(CredentialRecord pendingRevoke, String trigger, long nowMs) {
        EventOutcome revokeOutcome = drive(pendingRevoke, trigger, false);
        if (revokeOutcome.result() != Result.APPLIED) {
            return revokeOutcome;
        }
        CredentialRecord revokedRecord = store.get(pendingRevoke.userId())
                .orElseThrow(() -> new StoreIoException("credential vanished after revoke: " + pendingRevoke.userId(), null));
        CredentialRecord pending = revokedRecord.startCycle(revokedRecord.generation() + 1L, nowMs);
        store.upsert(pending);
        return drive(pending, trigger, true);
    }

    /**
     * True when the last applied event for the user was a JOIN, meaning a pending revoke is only
     * clearing the old secret before a new one is issued.
     */
    private boolean rejoinPending(String userId) {
        Optional<CredentialStore.EventWatermark> watermark = store.eventWatermark(userId);
        return watermark.isPresent() && watermark.get().lastEventType() == MembershipEventType.JOIN;
    }

    /**
     * Runs the remote operation a PENDING record stands for and persists the result.
     */
    private EventOutcome drive(CredentialRecord record, String trigger, boolean notifyUser) {
        if (record.status() == CredentialStatus.PENDING_PROVISION) {
            return driveProvision(record, trigger);
        }
        if (record.status() == CredentialStatus.PENDING_REVOKE) {
            return driveRevoke(record, trigger, notifyUser);
        }
        throw new IllegalStateException("record is not pending: " + record.userId() + " " + record.status());
    }

    private EventOutcome driveProvision(CredentialRecord record, String trigger) {
        String secret;
        try {
            secret = provisioner.provision(record.userId(), record.generation());
        } catch (ProvisioningException e) {
            return onFailure(record, CredentialOperation.PROVISION, e, trigger);
        }
        CredentialRecord active = record.activated(secret, provisioner.linkFor(secret), clock.millis());
        store.upsert(active);
        provisioned.incrementAndGet();
        audit("credential.provision", record.userId(), "active", Map.of(
                "trigger", trigger,
                "generation", active.generation(),
                "attempts", record.failureCount() + 1
        ));
        sendToUser(active.userId(), Notification.accessGranted(active.proxyLink()));
        return new EventOutcome(active.userId(), trigger, Result.APPLIED, active.status(), active.generation(), null);
    }

    private EventOutcome driveRevoke(CredentialRecord record, String trigger, boolean notifyUser) {
        String secret = record.secret() != null ? record.secret() : provisioner.secretFor(record.userId(), record.generation());
        try {
            provisioner.revoke(secret);
        } catch (ProvisioningException e) {
            return onFailure(record, CredentialOperation.REVOKE, e, trigger);
        }
        CredentialRecord revokedRecord = record.revoked(clock.millis());
        store.upsert(revokedRecord);
        revoked.incrementAndGet();
        audit("credential.revoke", record.userId(), "revoked", Map.of(
                "trigger", trigger,
                "generation", revokedRecord.generation(),
                "attempts", record.failureCount() + 1
        ));
        if (notifyUser) {
            sendToUser(revokedRecord.userId(), Notification.accessRevoked());
        }
        return new EventOutcome(revokedRecord.userId(), trigger, Result.APPLIED, revokedRecord.status(), revokedRecord.generation(), null);
    }

    private EventOutcome onFailure(CredentialRecord record, CredentialOperation operation, ProvisioningException e, String trigger) {
        errors.incrementAndGet();
        long nowMs = clock.millis();
        String error = errorText(e);
        int attempts = record.failureCount() + 1;
        if (e.retryable() && !retryPolicy.exhausted(attempts)) {
            long nextAttemptAtMs = nowMs + retryPolicy.backoffMs(attempts);
            CredentialRecord retry = record.retryScheduled(error, nextAttemptAtMs, nowMs);
            store.upsert(retry);
            audit("credential." + operation.name().toLowerCase(), record.userId(), "retry_scheduled", Map.of(
                    "trigger", trigger,
                    "attempts", attempts,
                    "next_attempt_at_ms", nextAttemptAtMs,
                    "error_type", e.getClass().getSimpleName(),
                    "error", error
            ));
            return new EventOutcome(record.userId(), trigger, Result.RETRY_SCHEDULED, retry.status(), retry.generation(), error);
        }
        CredentialRecord failed = record.failed(operation, error, nowMs);
        store.upsert(failed);
        audit("credential." + operation.name().toLowerCase(), record.userId(), "failed", Map.of(
                "trigger", trigger,
                "attempts", attempts,
                "error_type", e.getClass().getSimpleName(),
                "error", error
        ));
        if (operation == CredentialOperation.PROVISION) {
            sendToUser(record.userId(), Notification.provisioningFailed("access could not be issued, the operator has been notified"));
        }
        sendToAdmin(operation.name().toLowerCase() + " failed for user " + record.userId() + " after " + attempts
                + " attempt(s): " + error);
        return new EventOutcome(failed.userId(), trigger, Result.FAILED, failed.status(), failed.generation(), error);
    }

    /**
     * Re-drives PENDING records whose retry is due or that nobody has touched for
     * {@code staleAfterMs}, which is what a crash mid-operation leaves behind.
     */
    public SweepOutcome sweep() {
        sweepRuns.incrementAndGet();
        long nowMs = clock.millis();
        List<CredentialRecord> due;
        try {
            due = store.listDuePending(nowMs, nowMs - staleAfterMs, sweepLimit);
        } catch (StoreIoException e) {
            errors.incrementAndGet();
            audit("sweep.run", "-", "store_unavailable", Map.of("error", errorText(e)));
            return new SweepOutcome(0, 0, 0, 0, 1, List.of());
        }
        int applied = 0;
        int retryScheduled = 0;
        int failed = 0;
        int storeErrors = 0;
        List<EventOutcome> outcomes = new ArrayList<>();
        for (CredentialRecord candidate : due) {
            EventOutcome out = redrive(candidate.userId(), "sweep", false);
            outcomes.add(out);
            switch (out.result()) {
                case APPLIED -> applied++;
                case RETRY_SCHEDULED -> retryScheduled++;
                case FAILED -> failed++;
                case STORE_UNAVAILABLE -> storeErrors++;
                default -> {
                }
            }
        }
        if (!due.isEmpty()) {
            audit("sweep.run", "-", "ok", Map.of(
                    "scanned", due.size(),
                    "applied", applied,
                    "retry_scheduled", retryScheduled,
                    "failed", failed,
                    "store_errors", storeErrors
            ));
        }
        rateLimiter.prune();
        return new SweepOutcome(due.size(), applied, retryScheduled, failed, storeErrors, outcomes);
    }

    /**
     * Operator action: puts a FAILED record back on its failed operation with a fresh attempt budget.
     */
    public EventOutcome retryFailed(String userId) {
        return redrive(userId, "operator_retry", true);
    }

    private EventOutcome redrive(String userId, String trigger, boolean fromFailed) {
        try (UserLockRegistry.Handle ignored = locks.acquire(userId)) {
            Optional<CredentialRecord> current = store.get(userId);
            if (current.isEmpty()) {
                return new EventOutcome(userId, trigger, Result.NOOP, null, 0L, "no credential");
            }
            CredentialRecord record = current.get();
            if (fromFailed) {
                if (record.status() != CredentialStatus.FAILED) {
                    return new EventOutcome(userId, trigger, Result.NOOP, record.status(), record.generation(),
                            "not failed: " + record.status());
                }
                CredentialOperation operation = record.failedOperation() == null
                        ? CredentialOperation.PROVISION
                        : record.failedOperation();
                long nowMs = clock.millis();
                record = record.pending(operation, nowMs);
                store.upsert(record);
                audit("credential.retry_failed", userId, "requeued", Map.of("operation", operation.name()));
                if (operation == CredentialOperation.REVOKE && rejoinPending(userId)) {
                    return finishRevokeThenProvision(record, trigger, nowMs);
                }
                return drive(record, trigger, true);
            }
            // Someone else may have finished it while this sweep waited for the lock.
            if (!record.status().isPending()) {
                return new EventOutcome(userId, trigger, Result.NOOP, record.status(), record.generation(), "no longer pending");
            }
            if (record.status() == CredentialStatus.PENDING_REVOKE && rejoinPending(userId)) {
                return finishRevokeThenProvision(record, trigger, clock.millis());
            }
            return drive(record, trigger, true);
        } catch (StoreIoException e) {
            errors.incrementAndGet();
            audit("credential.redrive", userId, "store_unavailable", Map.of("trigger", trigger, "error", errorText(e)));
            return new EventOutcome(userId, trigger, Result.STORE_UNAVAILABLE, null, 0L, errorText(e));
        }
    }

    public Optional<CredentialRecord> credential(String userId) {
        return store.get(userId);
    }

    public EngineCounters counters() {
        return new EngineCounters(
                joins.get(),
                leaves.get(),
                provisioned.get(),
                revoked.get(),
                errors.get(),
                rateLimited.get(),
                stale.get(),
                notificationFailures.get(),
                sweepRuns.get(),
                locks.size()
        );
    }

    private void sendToUser(String userId, Notification notification) {
        try {
            notifier.notify(userId, notification);
        } catch (NotificationException | RuntimeException e) {
            notificationFailures.incrementAndGet();
            audit("notify.user", userId, "failed", Map.of(
                    "kind", notification.kind().name(),
                    "error", errorText(e)
            ));
        }
    }

    private void sendToAdmin(String detail) {
        try {
            notifier.notifyAdmin(detail);
        } catch (NotificationException | RuntimeException e) {
            notificationFailures.incrementAndGet();
            audit("notify.admin", "-", "failed", Map.of("error", errorText(e)));
        }
    }

    private void audit(String action, String userId, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.forUser(action, ACTOR, userId, result, new LinkedHashMap<>(details)));
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            System.err.println("WARN audit write failed for " + action + ": " + e.getMessage());
        }
    }

    private static EventOutcome outcome(MembershipEvent event, Result result, CredentialRecord record, String detail) {
        return new EventOutcome(
                event.userId(),
                event.type().name(),
                result,
                record == null ? null : record.status(),
                record == null ? 0L : record.generation(),
                detail
        );
    }

    private static String errorText(Throwable e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        String normalized = message.replace("\r", " ").replace("\n", " ").trim();
        return normalized.length() <= MAX_ERROR_CHARS ? normalized : normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    public enum Result {
        APPLIED,
        NOOP,
        STALE,
        RATE_LIMITED,
        RETRY_SCHEDULED,
        FAILED,
        STORE_UNAVAILABLE
    }

    public record EventOutcome(
            String userId,
            String trigger,
            Result result,
            CredentialStatus status,
            long generation,
            String detail
    ) {
    }

    public record SweepOutcome(
            int scanned,
            int applied,
            int retryScheduled,
            int failed,
            int storeErrors,
            List<EventOutcome> outcomes
    ) {
    }

    public record EngineCounters(
            long joins,
            long leaves,
            long provisioned,
            long revoked,
            long errors,
            long rateLimited,
            long stale,
            long notificationFailures,
            long sweepRuns,
            int lockedUsers
    ) {
    }
}
