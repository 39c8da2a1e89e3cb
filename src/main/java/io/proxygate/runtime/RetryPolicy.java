package io.proxygate.runtime;

import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseBackoffMs < 1L || maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("backoff bounds invalid: base=" + baseBackoffMs + ", max=" + maxBackoffMs);
        }
    }

    public boolean exhausted(int attempts) {
        return attempts >= maxAttempts;
    }

    /**
     * Doubles the base per attempt up to the cap, plus up to 250ms of jitter. Never exceeds the cap.
     */
    public long backoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }
}
