package io.proxygate.runtime;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding one-minute window of accepted joins per user. A limit of zero disables it.
 */
public final class EventRateLimiter {
    private static final long WINDOW_MILLIS = 60_000L;

    private final int maxPerMinute;
    private final Clock clock;
    private final Map<String, Deque<Long>> timestampsByUser = new ConcurrentHashMap<>();

    public EventRateLimiter(int maxPerMinute, Clock clock) {
        this.maxPerMinute = Math.max(0, maxPerMinute);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public boolean tryAcquire(String userId) {
        if (maxPerMinute == 0 || userId == null) {
            return true;
        }
        Deque<Long> timestamps = timestampsByUser.computeIfAbsent(userId, ignored -> new ArrayDeque<>());
        long now = clock.millis();
        long cutoff = now - WINDOW_MILLIS;
        synchronized (timestamps) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.removeFirst();
            }
            if (timestamps.size() >= maxPerMinute) {
                return false;
            }
            timestamps.addLast(now);
            return true;
        }
    }

    /**
     * Drops users whose window has emptied.
     */
    public void prune() {
        long cutoff = clock.millis() - WINDOW_MILLIS;
        timestampsByUser.entrySet().removeIf(e -> {
            Deque<Long> timestamps = e.getValue();
            synchronized (timestamps) {
                while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                    timestamps.removeFirst();
                }
                return timestamps.isEmpty();
            }
        });
    }

    public int trackedUsers() {
        return timestampsByUser.size();
    }
}
