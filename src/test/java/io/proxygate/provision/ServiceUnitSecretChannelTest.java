package io.proxygate.provision;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class ServiceUnitSecretChannelTest {
    private static final String UNIT_PATH = "/etc/systemd/system/MTProxy.service";

    @Test
    void addWritesUnitReloadsAndRestartsOnce() throws Exception {
        FakeRunner runner = new FakeRunner(ProxyServiceUnitTest.UNIT);
        ServiceUnitSecretChannel channel = channel(runner, 0L);

        channel.addSecret(ProxyServiceUnitTest.SECRET_C);

        Assertions.assertEquals(List.of(
                "cat " + UNIT_PATH,
                "tee " + UNIT_PATH,
                "systemctl daemon-reload",
                "systemctl restart MTProxy"
        ), runner.commands);
        Assertions.assertTrue(ProxyServiceUnit.parse(runner.unit).contains(ProxyServiceUnitTest.SECRET_C));
        Assertions.assertEquals(1, runner.restarts);
    }

    @Test
    void addingPresentSecretOrRemovingAbsentOneOnlyReads() throws Exception {
        FakeRunner runner = new FakeRunner(ProxyServiceUnitTest.UNIT);
        ServiceUnitSecretChannel channel = channel(runner, 0L);

        channel.addSecret(ProxyServiceUnitTest.SECRET_A);
        channel.removeSecret(ProxyServiceUnitTest.SECRET_C);

        Assertions.assertEquals(List.of("cat " + UNIT_PATH, "cat " + UNIT_PATH), runner.commands);
        Assertions.assertEquals(0, runner.restarts);
        Assertions.assertEquals(ProxyServiceUnitTest.UNIT, runner.unit);
    }

    @Test
    void removeDropsSecretFromUnit() throws Exception {
        FakeRunner runner = new FakeRunner(ProxyServiceUnitTest.UNIT);
        ServiceUnitSecretChannel channel = channel(runner, 0L);

        channel.removeSecret(ProxyServiceUnitTest.SECRET_A);

        Assertions.assertEquals(Set.of(ProxyServiceUnitTest.SECRET_B), channel.activeSecrets());
        Assertions.assertEquals(1, runner.restarts);
    }

    @Test
    void sshTransportFailureIsRetryable() {
        FakeRunner runner = new FakeRunner(ProxyServiceUnitTest.UNIT);
        runner.override.put("cat", CommandRunner.CommandResult.exit(255, "ssh: connect to host 10.0.0.1 port 22: Connection refused"));
        ServiceUnitSecretChannel channel = channel(runner, 0L);

        ProvisioningException e = Assertions.assertThrows(RetryableTransportException.class,
                () -> channel.addSecret(ProxyServiceUnitTest.SECRET_C));
        Assertions.assertTrue(e.retryable());
        Assertions.assertEquals(0, runner.restarts);
    }

    @Test
    void timeoutWhileWritingIsAmbiguousButWhileReadingIsRetryable() {
        FakeRunner writeTimeout = new FakeRunner(ProxyServiceUnitTest.UNIT);
        writeTimeout.override.put("systemctl", CommandRunner.CommandResult.timeout());
        Assertions.assertThrows(AmbiguousTimeoutException.class,
                () -> channel(writeTimeout, 0L).addSecret(ProxyServiceUnitTest.SECRET_C));

        FakeRunner readTimeout = new FakeRunner(ProxyServiceUnitTest.UNIT);
        readTimeout.override.put("cat", CommandRunner.CommandResult.timeout());
        Assertions.assertThrows(RetryableTransportException.class,
                () -> channel(readTimeout, 0L).addSecret(ProxyServiceUnitTest.SECRET_C));
    }

    @Test
    void rejectedCommandsAndBrokenUnitsAreFatal() {
        FakeRunner failingRestart = new FakeRunner(ProxyServiceUnitTest.UNIT);
        failingRestart.override.put("systemctl", CommandRunner.CommandResult.exit(1, "Failed to restart MTProxy.service"));
        ProvisioningException e = Assertions.assertThrows(FatalRemoteException.class,
                () -> channel(failingRestart, 0L).addSecret(ProxyServiceUnitTest.SECRET_C));
        Assertions.assertFalse(e.retryable());

        FakeRunner brokenUnit = new FakeRunner("[Service]\nType=simple\n");
        Assertions.assertThrows(FatalRemoteException.class,
                () -> channel(brokenUnit, 0L).addSecret(ProxyServiceUnitTest.SECRET_C));
    }

    @Test
    void malformedSecretNeverReachesTheServer() {
        FakeRunner runner = new FakeRunner(ProxyServiceUnitTest.UNIT);
        Assertions.assertThrows(FatalRemoteException.class, () -> channel(runner, 0L).addSecret("-S; rm -rf /"));
        Assertions.assertTrue(runner.commands.isEmpty());
    }

    @Test
    void consecutiveRestartsHonourCooldown() throws Exception {
        FakeRunner runner = new FakeRunner(ProxyServiceUnitTest.UNIT);
        ServiceUnitSecretChannel channel = channel(runner, 300L);

        channel.addSecret(ProxyServiceUnitTest.SECRET_C);
        long firstRestartAt = runner.restartTimes.get(0);
        channel.removeSecret(ProxyServiceUnitTest.SECRET_C);
        long secondRestartAt = runner.restartTimes.get(1);

        Assertions.assertTrue(secondRestartAt - firstRestartAt >= 250L,
                "restart gap was " + (secondRestartAt - firstRestartAt) + "ms");
    }

    private static ServiceUnitSecretChannel channel(FakeRunner runner, long cooldownMs) {
        return new ServiceUnitSecretChannel(runner, UNIT_PATH, "MTProxy", 5_000L, cooldownMs);
    }

    private static final class FakeRunner implements CommandRunner {
        private final List<String> commands = new ArrayList<>();
        private final List<Long> restartTimes = new ArrayList<>();
        private final Map<String, CommandResult> override = new HashMap<>();
        private String unit;
        private int restarts;

        private FakeRunner(String unit) {
            this.unit = unit;
        }

        @Override
        public CommandResult run(List<String> command, String stdin, long timeoutMs) {
            commands.add(String.join(" ", command));
            CommandResult forced = override.get(command.get(0));
            if (forced != null) {
                return forced;
            }
            switch (command.get(0)) {
                case "cat":
                    return CommandResult.ok(unit);
                case "tee":
                    unit = stdin;
                    return CommandResult.ok(stdin);
                case "systemctl":
                    if ("restart".equals(command.get(1))) {
                        restarts++;
                        restartTimes.add(System.currentTimeMillis());
                    }
                    return CommandResult.ok("");
                default:
                    return CommandResult.exit(127, "command not found: " + command.get(0));
            }
        }
    }
}
