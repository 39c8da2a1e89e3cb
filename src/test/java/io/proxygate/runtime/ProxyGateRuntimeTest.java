package io.proxygate.runtime;

import io.proxygate.config.ProxyGateConfig;
import io.proxygate.config.ProxyGateSettings;
import io.proxygate.model.CredentialStatus;
import io.proxygate.model.MembershipEvent;
import io.proxygate.provision.InMemorySecretChannel;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class ProxyGateRuntimeTest {
    private static final long T0 = 1_700_000_000_000L;

    @Test
    void viewsHideLinksUnlessAskedAndStatsTrackTransitions() throws Exception {
        Path root = Files.createTempDirectory("proxygate-runtime-");
        InMemorySecretChannel channel = new InMemorySecretChannel();
        ProxyGateRuntime runtime = new ProxyGateRuntime(
                ProxyGateConfig.fromRoot(root.toString()),
                ProxyGateSettings.defaults(),
                channel,
                new RecordingNotifier(),
                new MutableClock(T0)
        );
        try {
            runtime.init();
            runtime.handle(MembershipEvent.join("1", "ann", T0));
            runtime.handle(MembershipEvent.join("2", "ben", T0));
            runtime.handle(MembershipEvent.leave("2", T0 + 1));

            ProxyGateRuntime.CredentialView hidden = runtime.credential("1", false).orElseThrow();
            Assertions.assertEquals(CredentialStatus.ACTIVE, hidden.status());
            Assertions.assertTrue(hidden.hasSecret());
            Assertions.assertNull(hidden.proxyLink());
            Assertions.assertTrue(runtime.credential("1", true).orElseThrow().proxyLink().startsWith("https://t.me/proxy?server=127.0.0.1&port=443&secret=ee"));
            Assertions.assertTrue(runtime.credential("3", false).isEmpty());

            List<ProxyGateRuntime.CredentialView> revoked = runtime.listCredentials(CredentialStatus.REVOKED, 10, false);
            Assertions.assertEquals(1, revoked.size());
            Assertions.assertEquals("2", revoked.get(0).userId());
            Assertions.assertEquals(2, runtime.listCredentials(null, 10, false).size());
            Assertions.assertEquals(1, runtime.listCredentials(null, 1, false).size());

            channel.addSecret("0123456789abcdef0123456789abcdef");
            ProxyGateRuntime.RemoteSecretsOutcome secrets = runtime.remoteSecrets();
            Assertions.assertEquals(2, secrets.remoteSecrets());
            Assertions.assertEquals(1, secrets.ownedByActiveUsers());
            Assertions.assertEquals(1, secrets.unowned());

            ProxyGateRuntime.StatsOutcome stats = runtime.stats();
            Assertions.assertEquals(2L, stats.joins());
            Assertions.assertEquals(1L, stats.leaves());
            Assertions.assertEquals(2L, stats.provisioned());
            Assertions.assertEquals(1L, stats.revoked());
            Assertions.assertEquals(1, stats.credentialStatus().get("ACTIVE"));
            Assertions.assertEquals(1, stats.credentialStatus().get("REVOKED"));

            String metrics = runtime.metricsText();
            Assertions.assertTrue(metrics.contains("proxygate_events_total{type=\"join\"} 2"));
            Assertions.assertTrue(metrics.contains("proxygate_revoked_total 1"));
            Assertions.assertTrue(runtime.auditLogger().verify().valid());
        } finally {
            runtime.close();
            deleteRecursively(root);
        }
    }

    @Test
    void saltSurvivesRestartSoSecretsStayStable() throws Exception {
        Path root = Files.createTempDirectory("proxygate-runtime-salt-");
        try {
            String first;
            try (ProxyGateRuntime runtime = newRuntime(root, new InMemorySecretChannel())) {
                runtime.init();
                runtime.handle(MembershipEvent.join("1", null, T0));
                first = runtime.credential("1", true).orElseThrow().proxyLink();
            }
            InMemorySecretChannel fresh = new InMemorySecretChannel();
            try (ProxyGateRuntime runtime = newRuntime(root, fresh)) {
                runtime.init();
                runtime.handle(MembershipEvent.leave("1", T0 + 1));
                runtime.handle(MembershipEvent.join("1", null, T0 + 2));
                Assertions.assertEquals(2L, runtime.credential("1", false).orElseThrow().generation());
                Assertions.assertNotEquals(first, runtime.credential("1", true).orElseThrow().proxyLink());
                Assertions.assertEquals(1, fresh.removeCalls());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void usingRuntimeBeforeInitFails() throws Exception {
        Path root = Files.createTempDirectory("proxygate-runtime-uninit-");
        try (ProxyGateRuntime runtime = newRuntime(root, new InMemorySecretChannel())) {
            Assertions.assertThrows(IllegalStateException.class, () -> runtime.handle(MembershipEvent.join("1", null, T0)));
            Assertions.assertThrows(IllegalStateException.class, runtime::stats);
        } finally {
            deleteRecursively(root);
        }
    }

    private static ProxyGateRuntime newRuntime(Path root, InMemorySecretChannel channel) {
        return new ProxyGateRuntime(
                ProxyGateConfig.fromRoot(root.toString()),
                ProxyGateSettings.defaults(),
                channel,
                new RecordingNotifier(),
                new MutableClock(T0)
        );
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
}
