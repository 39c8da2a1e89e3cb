package io.proxygate.config;

import io.proxygate.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tunables read from {@code proxygate-settings.json}. Every field of the file is optional; missing or
 * out-of-range values fall back to the defaults.
 */
public record ProxyGateSettings(
        String channelId,
        String adminUserId,
        String remoteHost,
        String remoteUser,
        String sshKeyPath,
        int sshPort,
        String serviceUnitPath,
        String serviceName,
        String publicHost,
        int proxyPort,
        String tlsDomain,
        long remoteTimeoutMs,
        long restartCooldownMs,
        int remoteParallelLimit,
        int remoteQueueDepth,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long staleAfterMs,
        long sweepIntervalMs,
        int sweepLimit,
        int dispatcherCoreThreads,
        int dispatcherMaxThreads,
        int eventQueueCapacity,
        int joinRateLimitPerMin
) {
    private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1", "::1");

    public static ProxyGateSettings defaults() {
        return new ProxyGateSettings(
                null,
                null,
                "",
                "root",
                null,
                22,
                "/etc/systemd/system/MTProxy.service",
                "MTProxy",
                "127.0.0.1",
                443,
                "www.cloudflare.com",
                ProxyGateConfig.DEFAULT_REMOTE_TIMEOUT_MS,
                ProxyGateConfig.DEFAULT_RESTART_COOLDOWN_MS,
                ProxyGateConfig.DEFAULT_REMOTE_PARALLEL_LIMIT,
                ProxyGateConfig.DEFAULT_REMOTE_QUEUE_DEPTH,
                ProxyGateConfig.DEFAULT_MAX_ATTEMPTS,
                ProxyGateConfig.DEFAULT_BASE_BACKOFF_MS,
                ProxyGateConfig.DEFAULT_MAX_BACKOFF_MS,
                ProxyGateConfig.DEFAULT_STALE_AFTER_MS,
                ProxyGateConfig.DEFAULT_SWEEP_INTERVAL_MS,
                ProxyGateConfig.DEFAULT_SWEEP_LIMIT,
                ProxyGateConfig.DEFAULT_THREAD_POOL_CORE,
                ProxyGateConfig.DEFAULT_THREAD_POOL_MAX,
                ProxyGateConfig.DEFAULT_QUEUE_CAPACITY,
                ProxyGateConfig.DEFAULT_JOIN_RATE_LIMIT_PER_MIN
        );
    }

    public static ProxyGateSettings load(Path settingsFile) {
        ProxyGateSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load settings: " + settingsFile, e);
        }
    }

    static ProxyGateSettings fromFile(SettingsFile file, ProxyGateSettings defaults) {
        if (file == null) {
            return defaults;
        }
        String remoteHost = sanitizeString(file.remoteHost(), defaults.remoteHost());
        String publicHost = sanitizeString(file.publicHost(), null);
        if (publicHost == null) {
            publicHost = remoteHost.isBlank() || LOCAL_HOSTS.contains(remoteHost) ? defaults.publicHost() : remoteHost;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        int coreThreads = sanitizeInt(file.dispatcherCoreThreads(), defaults.dispatcherCoreThreads(), 1);
        int maxThreads = sanitizeInt(file.dispatcherMaxThreads(), defaults.dispatcherMaxThreads(), coreThreads);
        if (maxThreads < coreThreads) {
            maxThreads = coreThreads;
        }
        return new ProxyGateSettings(
                normalizeChannelId(file.channelId()),
                sanitizeString(file.adminUserId(), defaults.adminUserId()),
                remoteHost,
                sanitizeString(file.remoteUser(), defaults.remoteUser()),
                sanitizeString(file.sshKeyPath(), defaults.sshKeyPath()),
                sanitizePort(file.sshPort(), defaults.sshPort()),
                sanitizeString(file.serviceUnitPath(), defaults.serviceUnitPath()),
                sanitizeString(file.serviceName(), defaults.serviceName()),
                publicHost,
                sanitizePort(file.proxyPort(), defaults.proxyPort()),
                file.tlsDomain() == null ? defaults.tlsDomain() : file.tlsDomain().trim(),
                sanitizeLong(file.remoteTimeoutMs(), defaults.remoteTimeoutMs(), 1_000L),
                sanitizeLong(file.restartCooldownMs(), defaults.restartCooldownMs(), 0L),
                sanitizeInt(file.remoteParallelLimit(), defaults.remoteParallelLimit(), 1),
                sanitizeInt(file.remoteQueueDepth(), defaults.remoteQueueDepth(), 0),
                sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1),
                baseBackoff,
                maxBackoff,
                sanitizeLong(file.staleAfterMs(), defaults.staleAfterMs(), 1_000L),
                sanitizeLong(file.sweepIntervalMs(), defaults.sweepIntervalMs(), 100L),
                sanitizeInt(file.sweepLimit(), defaults.sweepLimit(), 1),
                coreThreads,
                maxThreads,
                sanitizeInt(file.eventQueueCapacity(), defaults.eventQueueCapacity(), 1),
                sanitizeInt(file.joinRateLimitPerMin(), defaults.joinRateLimitPerMin(), 0)
        );
    }

    public boolean isRemote() {
        return remoteHost != null && !remoteHost.isBlank() && !LOCAL_HOSTS.contains(remoteHost);
    }

    /**
     * Reports every setting problem at once; an empty list means the settings are usable.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (isRemote() && (sshKeyPath == null || sshKeyPath.isBlank())) {
            problems.add("sshKeyPath is required when remoteHost is " + remoteHost);
        }
        if (serviceUnitPath == null || serviceUnitPath.isBlank()) {
            problems.add("serviceUnitPath must not be blank");
        }
        if (serviceName == null || serviceName.isBlank()) {
            problems.add("serviceName must not be blank");
        }
        if (publicHost == null || publicHost.isBlank()) {
            problems.add("publicHost must not be blank");
        }
        return problems;
    }

    public ProxyGateSettings requireValid() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid settings: " + String.join("; ", problems));
        }
        return this;
    }

    /**
     * Accepts {@code https://t.me/name}, {@code t.me/name}, {@code @name} and {@code name}, all
     * normalized to {@code @name}. Numeric chat ids such as {@code -1001234567890} are kept as-is.
     */
    public static String normalizeChannelId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (value.startsWith("-") && value.length() > 1 && value.substring(1).chars().allMatch(Character::isDigit)) {
            return value;
        }
        int scheme = value.indexOf("://");
        if (scheme >= 0) {
            value = value.substring(scheme + 3);
        }
        if (value.startsWith("t.me/")) {
            value = value.substring(5);
        }
        if (value.startsWith("@")) {
            value = value.substring(1);
        }
        if (value.isBlank()) {
            throw new IllegalArgumentException("Invalid channel id: " + raw);
        }
        return "@" + value;
    }

    private static String sanitizeString(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizePort(Integer raw, int fallback) {
        if (raw == null || raw < 1 || raw > 65_535) {
            return fallback;
        }
        return raw;
    }

    record SettingsFile(
            String channelId,
            String adminUserId,
            String remoteHost,
            String remoteUser,
            String sshKeyPath,
            Integer sshPort,
            String serviceUnitPath,
            String serviceName,
            String publicHost,
            Integer proxyPort,
            String tlsDomain,
            Long remoteTimeoutMs,
            Long restartCooldownMs,
            Integer remoteParallelLimit,
            Integer remoteQueueDepth,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long staleAfterMs,
            Long sweepIntervalMs,
            Integer sweepLimit,
            Integer dispatcherCoreThreads,
            Integer dispatcherMaxThreads,
            Integer eventQueueCapacity,
            Integer joinRateLimitPerMin
    ) {
    }
}
