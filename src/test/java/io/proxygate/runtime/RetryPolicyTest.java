package io.proxygate.runtime;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RetryPolicyTest {
    @Test
    void backoffDoublesWithinJitterAndStaysUnderCap() {
        RetryPolicy policy = new RetryPolicy(5, 1_000L, 60_000L);
        for (int i = 0; i < 20; i++) {
            long first = policy.backoffMs(1);
            long third = policy.backoffMs(3);
            Assertions.assertTrue(first >= 1_000L && first <= 1_250L, "first=" + first);
            Assertions.assertTrue(third >= 4_000L && third <= 4_250L, "third=" + third);
            Assertions.assertEquals(60_000L, policy.backoffMs(30));
        }
    }

    @Test
    void exhaustedAtMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(3, 10L, 100L);
        Assertions.assertFalse(policy.exhausted(2));
        Assertions.assertTrue(policy.exhausted(3));
        Assertions.assertTrue(policy.exhausted(4));
    }

    @Test
    void rejectsInvalidBounds() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 10L, 100L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 100L, 10L));
    }
}
