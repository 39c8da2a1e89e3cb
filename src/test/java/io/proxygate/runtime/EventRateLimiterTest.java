package io.proxygate.runtime;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class EventRateLimiterTest {
    @Test
    void slidingWindowAdmitsAgainAfterAMinute() {
        MutableClock clock = new MutableClock(1_000_000L);
        EventRateLimiter limiter = new EventRateLimiter(2, clock);

        Assertions.assertTrue(limiter.tryAcquire("u1"));
        clock.advance(30_000L);
        Assertions.assertTrue(limiter.tryAcquire("u1"));
        Assertions.assertFalse(limiter.tryAcquire("u1"));
        Assertions.assertTrue(limiter.tryAcquire("u2"));

        clock.advance(30_000L);
        Assertions.assertTrue(limiter.tryAcquire("u1"));
        Assertions.assertFalse(limiter.tryAcquire("u1"));
    }

    @Test
    void zeroDisablesLimiting() {
        EventRateLimiter limiter = new EventRateLimiter(0, new MutableClock(0L));
        for (int i = 0; i < 100; i++) {
            Assertions.assertTrue(limiter.tryAcquire("u1"));
        }
        Assertions.assertEquals(0, limiter.trackedUsers());
    }

    @Test
    void pruneDropsIdleUsers() {
        MutableClock clock = new MutableClock(0L);
        EventRateLimiter limiter = new EventRateLimiter(5, clock);
        limiter.tryAcquire("u1");
        limiter.tryAcquire("u2");
        Assertions.assertEquals(2, limiter.trackedUsers());

        clock.advance(60_001L);
        limiter.prune();
        Assertions.assertEquals(0, limiter.trackedUsers());
    }
}
