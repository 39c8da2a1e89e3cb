package io.proxygate.provision;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Edits the {@code -S} secret flags of the MTProxy systemd unit and restarts the service. A change
 * is read-modify-write of one file, so mutations are serialized here regardless of pool size.
 */
public final class ServiceUnitSecretChannel implements SecretChannel {
    private static final int MAX_ERROR_CHARS = 512;

    private final CommandRunner runner;
    private final String unitPath;
    private final String serviceName;
    private final long timeoutMs;
    private final long restartCooldownMs;
    private final Object mutationLock = new Object();
    private long lastRestartAtMs;

    public ServiceUnitSecretChannel(
            CommandRunner runner,
            String unitPath,
            String serviceName,
            long timeoutMs,
            long restartCooldownMs
    ) {
        this.runner = runner;
        this.unitPath = unitPath;
        this.serviceName = serviceName;
        this.timeoutMs = timeoutMs;
        this.restartCooldownMs = Math.max(0L, restartCooldownMs);
        this.lastRestartAtMs = 0L;
    }

    @Override
    public void addSecret(String secret) throws ProvisioningException {
        requireWellFormed(secret);
        synchronized (mutationLock) {
            ProxyServiceUnit unit = readUnit();
            if (unit.contains(secret)) {
                return;
            }
            applyUnit(unit.withSecret(secret));
        }
    }

    @Override
    public void removeSecret(String secret) throws ProvisioningException {
        requireWellFormed(secret);
        synchronized (mutationLock) {
            ProxyServiceUnit unit = readUnit();
            if (!unit.contains(secret)) {
                return;
            }
            applyUnit(unit.withoutSecret(secret));
        }
    }

    @Override
    public Set<String> activeSecrets() throws ProvisioningException {
        return readUnit().secrets();
    }

    private ProxyServiceUnit readUnit() throws ProvisioningException {
        CommandRunner.CommandResult result = run(List.of("cat", unitPath), null, "read unit", false);
        try {
            return ProxyServiceUnit.parse(result.output());
        } catch (IllegalArgumentException e) {
            throw new FatalRemoteException("unusable service unit " + unitPath + ": " + e.getMessage(), e);
        }
    }

    private void applyUnit(ProxyServiceUnit unit) throws ProvisioningException {
        run(List.of("tee", unitPath), unit.render(), "write unit", true);
        run(List.of("systemctl", "daemon-reload"), null, "daemon-reload", true);
        awaitRestartCooldown();
        try {
            run(List.of("systemctl", "restart", serviceName), null, "restart " + serviceName, true);
        } finally {
            lastRestartAtMs = System.currentTimeMillis();
        }
    }

    private void awaitRestartCooldown() throws RetryableTransportException {
        long waitMs = lastRestartAtMs + restartCooldownMs - System.currentTimeMillis();
        if (waitMs <= 0L) {
            return;
        }
        try {
            Thread.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryableTransportException("interrupted during restart cooldown", e);
        }
    }

    /**
     * Maps a command outcome onto the failure taxonomy. A timeout of a mutating step leaves the
     * remote state unknown; a timeout while only reading does not.
     */
    private CommandRunner.CommandResult run(List<String> command, String stdin, String step, boolean mutating)
            throws ProvisioningException {
        CommandRunner.CommandResult result;
        try {
            result = runner.run(command, stdin, timeoutMs);
        } catch (IOException e) {
            throw new RetryableTransportException(step + " failed to run: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (mutating) {
                throw new AmbiguousTimeoutException(step + " interrupted");
            }
            throw new RetryableTransportException(step + " interrupted", e);
        }
        if (result.timedOut()) {
            if (mutating) {
                throw new AmbiguousTimeoutException(step + " timed out after " + timeoutMs + "ms");
            }
            throw new RetryableTransportException(step + " timed out after " + timeoutMs + "ms");
        }
        if (result.exitCode() == ProcessCommandRunner.SSH_TRANSPORT_EXIT) {
            throw new RetryableTransportException(step + " transport failure: " + truncate(result.output()));
        }
        if (result.exitCode() != 0) {
            throw new FatalRemoteException(step + " exit=" + result.exitCode() + " output=" + truncate(result.output()));
        }
        return result;
    }

    private static void requireWellFormed(String secret) throws FatalRemoteException {
        if (!SecretDeriver.isWellFormed(secret)) {
            throw new FatalRemoteException("secret rejected: expected 32 lowercase hex chars");
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
