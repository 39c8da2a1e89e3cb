package io.proxygate.provision;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounds concurrent calls against the management channel. Callers beyond {@code maxConcurrent}
 * wait in FIFO order, at most {@code maxQueueDepth} of them; anyone past that fails fast with a
 * retryable error instead of piling up on the proxy server.
 */
public final class BoundedChannelPool {
    private final Semaphore permits;
    private final int maxConcurrent;
    private final int maxQueueDepth;
    private final long acquireTimeoutMs;
    private final AtomicInteger waiting = new AtomicInteger();
    private final AtomicLong rejectedTotal = new AtomicLong();

    public BoundedChannelPool(int maxConcurrent, int maxQueueDepth, long acquireTimeoutMs) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1");
        }
        this.maxConcurrent = maxConcurrent;
        this.maxQueueDepth = Math.max(0, maxQueueDepth);
        this.acquireTimeoutMs = Math.max(1L, acquireTimeoutMs);
        this.permits = new Semaphore(maxConcurrent, true);
    }

    public <T> T execute(String operation, RemoteCall<T> call) throws ProvisioningException {
        acquire(operation);
        try {
            return call.call();
        } finally {
            permits.release();
        }
    }

    private void acquire(String operation) throws RetryableTransportException {
        if (permits.tryAcquire()) {
            return;
        }
        int depth = waiting.incrementAndGet();
        try {
            if (depth > maxQueueDepth) {
                rejectedTotal.incrementAndGet();
                throw new RetryableTransportException(
                        "remote channel saturated: " + operation + " rejected at queue depth " + maxQueueDepth);
            }
            if (!permits.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
                rejectedTotal.incrementAndGet();
                throw new RetryableTransportException(
                        "remote channel busy: " + operation + " waited " + acquireTimeoutMs + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryableTransportException("interrupted waiting for remote channel: " + operation, e);
        } finally {
            waiting.decrementAndGet();
        }
    }

    public int inFlight() {
        return maxConcurrent - permits.availablePermits();
    }

    public int waiting() {
        return waiting.get();
    }

    public long rejectedTotal() {
        return rejectedTotal.get();
    }

    @FunctionalInterface
    public interface RemoteCall<T> {
        T call() throws ProvisioningException;
    }
}
