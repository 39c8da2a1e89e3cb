package io.proxygate.runtime;

import io.proxygate.config.ProxyGateConfig;
import io.proxygate.model.CredentialRecord;
import io.proxygate.model.CredentialStatus;
import io.proxygate.model.MembershipEvent;
import io.proxygate.observability.AuditLogger;
import io.proxygate.provision.BoundedChannelPool;
import io.proxygate.provision.InMemorySecretChannel;
import io.proxygate.provision.MtProxyProvisioner;
import io.proxygate.provision.ProvisioningException;
import io.proxygate.provision.ProxyLinkBuilder;
import io.proxygate.provision.SecretChannel;
import io.proxygate.provision.SecretDeriver;
import io.proxygate.storage.CredentialStore;
import io.proxygate.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class MembershipEventDispatcherTest {
    private static final long T0 = 1_700_000_000_000L;
    private static final String SALT = "ffeeddccbbaa99887766554433221100ffeeddccbbaa99887766554433221100";

    @Test
    void processesQueuedEventsForManyUsers() throws Exception {
        Path root = Files.createTempDirectory("proxygate-dispatch-");
        try {
            CredentialStore store = initStore(root);
            InMemorySecretChannel channel = new InMemorySecretChannel();
            ReconciliationEngine engine = engine(root, store, channel, new MutableClock(T0));
            try (MembershipEventDispatcher dispatcher = new MembershipEventDispatcher(
                    engine, null, new RetryPolicy(3, 10L, 100L), 4, 4, 100, 60_000L)) {
                dispatcher.start();
                for (int i = 0; i < 30; i++) {
                    Assertions.assertTrue(dispatcher.submit(MembershipEvent.join("u" + i, null, T0)));
                }
                Assertions.assertTrue(dispatcher.awaitIdle(20_000L));
            }
            for (int i = 0; i < 30; i++) {
                Assertions.assertEquals(CredentialStatus.ACTIVE, store.get("u" + i).orElseThrow().status());
            }
            Assertions.assertEquals(30, channel.activeSecrets().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fullQueueRejectsInsteadOfBlocking() throws Exception {
        Path root = Files.createTempDirectory("proxygate-dispatch-full-");
        BlockingChannel channel = new BlockingChannel();
        try {
            CredentialStore store = initStore(root);
            ReconciliationEngine engine = engine(root, store, channel, new MutableClock(T0));
            try (MembershipEventDispatcher dispatcher = new MembershipEventDispatcher(
                    engine, new AuditLogger(ProxyGateConfig.fromRoot(root.toString()).auditFile()),
                    new RetryPolicy(3, 10L, 100L), 1, 1, 1, 60_000L)) {
                dispatcher.start();
                Assertions.assertTrue(dispatcher.submit(MembershipEvent.join("a", null, T0)));
                Assertions.assertTrue(channel.entered.await(10, TimeUnit.SECONDS));
                Assertions.assertTrue(dispatcher.submit(MembershipEvent.join("b", null, T0)));
                Assertions.assertFalse(dispatcher.submit(MembershipEvent.join("c", null, T0)));
                Assertions.assertEquals(1L, dispatcher.counters().rejected());

                channel.release.countDown();
                Assertions.assertTrue(dispatcher.awaitIdle(10_000L));
            }
            Assertions.assertTrue(store.get("c").isEmpty());
            Assertions.assertEquals(CredentialStatus.ACTIVE, store.get("b").orElseThrow().status());
        } finally {
            channel.release.countDown();
            deleteRecursively(root);
        }
    }

    @Test
    void storeOutageRequeuesUntilAttemptsRunOut() throws Exception {
        Path root = Files.createTempDirectory("proxygate-dispatch-outage-");
        try {
            ProxyGateConfig config = ProxyGateConfig.fromRoot(root.toString());
            Files.createDirectories(config.dbFile());
            CredentialStore store = new CredentialStore(new Database(config));
            AuditLogger audit = new AuditLogger(config.auditFile());
            ReconciliationEngine engine = engine(root, store, new InMemorySecretChannel(), new MutableClock(T0));
            try (MembershipEventDispatcher dispatcher = new MembershipEventDispatcher(
                    engine, audit, new RetryPolicy(3, 10L, 20L), 1, 1, 10, 60_000L)) {
                dispatcher.start();
                Assertions.assertTrue(dispatcher.submit(MembershipEvent.join("42", null, T0)));
                Assertions.assertTrue(waitFor(() -> auditContains(config.auditFile(), "given_up"), 10_000L));
                Assertions.assertEquals(2L, dispatcher.counters().requeued());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void leaveIsRequeuedPastTheBudgetUntilTheStoreRecovers() throws Exception {
        Path root = Files.createTempDirectory("proxygate-dispatch-leave-");
        try {
            ProxyGateConfig config = ProxyGateConfig.fromRoot(root.toString());
            Database database = new Database(config);
            database.init();
            CredentialStore store = new CredentialStore(database);
            InMemorySecretChannel channel = new InMemorySecretChannel();
            ReconciliationEngine engine = engine(root, store, channel, new MutableClock(T0));
            engine.handle(MembershipEvent.join("42", "bob", T0));
            try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
                st.execute("CREATE TRIGGER reject_revoke BEFORE INSERT ON credentials "
                        + "WHEN NEW.status = 'PENDING_REVOKE' BEGIN SELECT RAISE(ABORT, 'disk I/O error'); END");
                st.execute("CREATE TRIGGER reject_revoke_update BEFORE UPDATE ON credentials "
                        + "WHEN NEW.status = 'PENDING_REVOKE' BEGIN SELECT RAISE(ABORT, 'disk I/O error'); END");
            }
            try (MembershipEventDispatcher dispatcher = new MembershipEventDispatcher(
                    engine, new AuditLogger(config.auditFile()), new RetryPolicy(3, 10L, 20L), 1, 1, 10, 60_000L)) {
                dispatcher.start();
                Assertions.assertTrue(dispatcher.submit(MembershipEvent.leave("42", T0 + 1)));
                Assertions.assertTrue(waitFor(() -> dispatcher.counters().requeued() >= 6L, 10_000L));
                Assertions.assertFalse(auditContains(config.auditFile(), "given_up"));
                Assertions.assertEquals(CredentialStatus.ACTIVE, store.get("42").orElseThrow().status());

                try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
                    st.execute("DROP TRIGGER reject_revoke");
                    st.execute("DROP TRIGGER reject_revoke_update");
                }
                Assertions.assertTrue(waitFor(() -> store.get("42").orElseThrow().status() == CredentialStatus.REVOKED, 10_000L));
            }
            Assertions.assertTrue(channel.activeSecrets().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void periodicSweepRecoversStalePendingRecord() throws Exception {
        Path root = Files.createTempDirectory("proxygate-dispatch-sweep-");
        try {
            CredentialStore store = initStore(root);
            store.upsert(CredentialRecord.pendingProvision("42", "bob", 1L, T0 - 120_000L));
            ReconciliationEngine engine = engine(root, store, new InMemorySecretChannel(), new MutableClock(T0));
            try (MembershipEventDispatcher dispatcher = new MembershipEventDispatcher(
                    engine, null, new RetryPolicy(3, 10L, 100L), 1, 1, 10, 100L)) {
                dispatcher.start();
                Assertions.assertTrue(waitFor(() -> {
                    Optional<CredentialRecord> record = store.get("42");
                    return record.isPresent() && record.get().status() == CredentialStatus.ACTIVE;
                }, 10_000L));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void closedDispatcherRefusesEvents() throws Exception {
        Path root = Files.createTempDirectory("proxygate-dispatch-closed-");
        try {
            CredentialStore store = initStore(root);
            ReconciliationEngine engine = engine(root, store, new InMemorySecretChannel(), new MutableClock(T0));
            MembershipEventDispatcher dispatcher = new MembershipEventDispatcher(
                    engine, null, new RetryPolicy(3, 10L, 100L), 1, 1, 10, 60_000L);
            dispatcher.start();
            dispatcher.close();
            Assertions.assertFalse(dispatcher.submit(MembershipEvent.join("42", null, T0)));
        } finally {
            deleteRecursively(root);
        }
    }

    private static CredentialStore initStore(Path root) {
        Database database = new Database(ProxyGateConfig.fromRoot(root.toString()));
        database.init();
        return new CredentialStore(database);
    }

    private static ReconciliationEngine engine(Path root, CredentialStore store, SecretChannel channel, MutableClock clock) {
        MtProxyProvisioner provisioner = new MtProxyProvisioner(
                new SecretDeriver(SALT),
                new ProxyLinkBuilder("proxy.example.org", 443, "www.cloudflare.com"),
                channel,
                new BoundedChannelPool(2, 256, 30_000L)
        );
        return new ReconciliationEngine(
                store,
                provisioner,
                new RecordingNotifier(),
                new AuditLogger(ProxyGateConfig.fromRoot(root.toString()).auditFile()),
                new RetryPolicy(3, 10L, 100L),
                new EventRateLimiter(0, clock),
                60_000L,
                16,
                clock
        );
    }

    private static boolean auditContains(Path auditFile, String needle) {
        try {
            return Files.exists(auditFile) && Files.readString(auditFile, StandardCharsets.UTF_8).contains(needle);
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean waitFor(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20L);
        }
        return condition.getAsBoolean();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class BlockingChannel implements SecretChannel {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        private final InMemorySecretChannel delegate = new InMemorySecretChannel();

        @Override
        public void addSecret(String secret) throws ProvisioningException {
            entered.countDown();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delegate.addSecret(secret);
        }

        @Override
        public void removeSecret(String secret) throws ProvisioningException {
            delegate.removeSecret(secret);
        }

        @Override
        public Set<String> activeSecrets() throws ProvisioningException {
            return delegate.activeSecrets();
        }
    }
}
