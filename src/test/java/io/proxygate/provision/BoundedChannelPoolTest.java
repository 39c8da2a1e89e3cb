package io.proxygate.provision;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class BoundedChannelPoolTest {

    @Test
    void saturatedPoolFailsFastBeyondQueueDepth() throws Exception {
        BoundedChannelPool pool = new BoundedChannelPool(1, 0, 5_000L);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> holder = holdPermit(pool, entered, release);
        try {
            Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));
            long start = System.currentTimeMillis();
            RetryableTransportException e = Assertions.assertThrows(RetryableTransportException.class,
                    () -> pool.execute("add_secret", () -> "never"));
            Assertions.assertTrue(System.currentTimeMillis() - start < 2_000L);
            Assertions.assertTrue(e.getMessage().contains("saturated"));
            Assertions.assertEquals(1L, pool.rejectedTotal());
            Assertions.assertEquals(1, pool.inFlight());
        } finally {
            release.countDown();
        }
        Assertions.assertEquals("held", holder.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(0, pool.inFlight());
    }

    @Test
    void waiterGivesUpAfterAcquireTimeout() throws Exception {
        BoundedChannelPool pool = new BoundedChannelPool(1, 1, 100L);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> holder = holdPermit(pool, entered, release);
        try {
            Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));
            RetryableTransportException e = Assertions.assertThrows(RetryableTransportException.class,
                    () -> pool.execute("remove_secret", () -> "never"));
            Assertions.assertTrue(e.getMessage().contains("busy"));
            Assertions.assertEquals(0, pool.waiting());
        } finally {
            release.countDown();
        }
        holder.get(5, TimeUnit.SECONDS);
    }

    @Test
    void queuedCallerRunsOnceThePermitFrees() throws Exception {
        BoundedChannelPool pool = new BoundedChannelPool(1, 4, 5_000L);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> holder = holdPermit(pool, entered, release);
        Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));

        CompletableFuture<String> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return pool.execute("add_secret", () -> "second");
            } catch (ProvisioningException e) {
                throw new IllegalStateException(e);
            }
        });
        release.countDown();

        Assertions.assertEquals("held", holder.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals("second", waiter.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(0L, pool.rejectedTotal());
    }

    @Test
    void failingCallReleasesPermit() throws Exception {
        BoundedChannelPool pool = new BoundedChannelPool(1, 0, 1_000L);
        Assertions.assertThrows(FatalRemoteException.class, () -> pool.execute("add_secret", () -> {
            throw new FatalRemoteException("systemctl exit=1");
        }));
        Assertions.assertEquals(0, pool.inFlight());
        Assertions.assertEquals("ok", pool.execute("add_secret", () -> "ok"));
    }

    private static CompletableFuture<String> holdPermit(BoundedChannelPool pool, CountDownLatch entered, CountDownLatch release) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return pool.execute("hold", () -> {
                    entered.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "held";
                });
            } catch (ProvisioningException e) {
                throw new IllegalStateException(e);
            }
        });
    }
}
