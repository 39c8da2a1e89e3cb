package io.proxygate.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ProxyGateConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "proxygate-settings.json";

    public static final int DEFAULT_MAX_ATTEMPTS = 8;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_STALE_AFTER_MS = 60_000L;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 5_000L;
    public static final int DEFAULT_SWEEP_LIMIT = 64;
    public static final int DEFAULT_THREAD_POOL_CORE = 4;
    public static final int DEFAULT_THREAD_POOL_MAX = 8;
    public static final int DEFAULT_QUEUE_CAPACITY = 1_000;
    public static final int DEFAULT_REMOTE_PARALLEL_LIMIT = 1;
    public static final int DEFAULT_REMOTE_QUEUE_DEPTH = 50;
    public static final long DEFAULT_REMOTE_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_RESTART_COOLDOWN_MS = 5_000L;
    public static final int DEFAULT_JOIN_RATE_LIMIT_PER_MIN = 5;

    private final Path rootDir;

    public ProxyGateConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ProxyGateConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new ProxyGateConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("proxygate.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
