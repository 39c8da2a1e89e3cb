package io.proxygate.runtime;

import io.proxygate.model.MembershipEvent;
import io.proxygate.model.MembershipEventType;
import io.proxygate.observability.AuditLogger;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands events to a bounded worker pool so ingestion never waits on remote calls, and runs the
 * recovery sweep on a fixed delay. Events that hit an unavailable store are re-queued with backoff;
 * joins give up after the requeue budget, leaves never do.
 */
public final class MembershipEventDispatcher implements AutoCloseable {
    private final ReconciliationEngine engine;
    private final AuditLogger auditLogger;
    private final RetryPolicy requeuePolicy;
    private final long sweepIntervalMs;
    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong rejectedTotal = new AtomicLong();
    private final AtomicLong requeuedTotal = new AtomicLong();
    private final AtomicLong crashedTotal = new AtomicLong();

    public MembershipEventDispatcher(
            ReconciliationEngine engine,
            AuditLogger auditLogger,
            RetryPolicy requeuePolicy,
            int coreThreads,
            int maxThreads,
            int queueCapacity,
            long sweepIntervalMs
    ) {
        this.engine = engine;
        this.auditLogger = auditLogger;
        this.requeuePolicy = requeuePolicy;
        this.sweepIntervalMs = Math.max(100L, sweepIntervalMs);
        int core = Math.max(1, coreThreads);
        this.workers = new ThreadPoolExecutor(
                core,
                Math.max(core, maxThreads),
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                threadFactory("proxygate-worker-"),
                new ThreadPoolExecutor.AbortPolicy()
        );
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("proxygate-sweep-"));
    }

    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        scheduler.scheduleWithFixedDelay(this::sweepSafely, sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Queues an event for processing. Returns {@code false} when the queue is full or the dispatcher
     * is shut down; the caller keeps ownership of the event in that case.
     */
    public boolean submit(MembershipEvent event) {
        return submit(event, 0);
    }

    private boolean submit(MembershipEvent event, int attempt) {
        if (stopped.get()) {
            return false;
        }
        try {
            workers.execute(() -> process(event, attempt));
            return true;
        } catch (RejectedExecutionException e) {
            rejectedTotal.incrementAndGet();
            log("event.rejected", event.userId(), "queue_full", Map.of(
                    "event", event.type().name(),
                    "queue_depth", workers.getQueue().size()
            ));
            return false;
        }
    }

    private void process(MembershipEvent event, int attempt) {
        try {
            ReconciliationEngine.EventOutcome outcome = engine.handle(event);
            if (outcome.result() == ReconciliationEngine.Result.STORE_UNAVAILABLE) {
                requeue(event, attempt + 1);
            }
        } catch (RuntimeException e) {
            crashedTotal.incrementAndGet();
            log("event.crashed", event.userId(), "error", Map.of(
                    "event", event.type().name(),
                    "error_type", e.getClass().getSimpleName(),
                    "error", String.valueOf(e.getMessage())
            ));
        }
    }

    private void requeue(MembershipEvent event, int attempt) {
        if (stopped.get()) {
            return;
        }
        if (event.type() == MembershipEventType.JOIN && requeuePolicy.exhausted(attempt)) {
            log("event.requeue", event.userId(), "given_up", Map.of("event", event.type().name(), "attempts", attempt));
            return;
        }
        long delayMs = requeuePolicy.backoffMs(attempt);
        requeuedTotal.incrementAndGet();
        try {
            scheduler.schedule(() -> {
                if (!submit(event, attempt)) {
                    log("event.requeue", event.userId(), "dropped", Map.of("event", event.type().name(), "attempts", attempt));
                }
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log("event.requeue", event.userId(), "dropped", Map.of("event", event.type().name(), "attempts", attempt));
        }
    }

    private void sweepSafely() {
        try {
            engine.sweep();
        } catch (RuntimeException e) {
            crashedTotal.incrementAndGet();
            log("sweep.run", "-", "error", Map.of(
                    "error_type", e.getClass().getSimpleName(),
                    "error", String.valueOf(e.getMessage())
            ));
        }
    }

    /**
     * Waits for every queued event to finish. Only meaningful once no more events are submitted.
     */
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        while (workers.getActiveCount() > 0 || !workers.getQueue().isEmpty()) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            Thread.sleep(10L);
        }
        return true;
    }

    @Override
    public void close() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30L, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public DispatcherCounters counters() {
        return new DispatcherCounters(
                workers.getQueue().size(),
                workers.getActiveCount(),
                rejectedTotal.get(),
                requeuedTotal.get(),
                crashedTotal.get()
        );
    }

    private void log(String action, String userId, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.forUser(action, "dispatcher", userId, result, details));
        } catch (RuntimeException e) {
            System.err.println("WARN audit write failed for " + action + ": " + e.getMessage());
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record DispatcherCounters(
            int queued,
            int active,
            long rejected,
            long requeued,
            long crashed
    ) {
    }
}
