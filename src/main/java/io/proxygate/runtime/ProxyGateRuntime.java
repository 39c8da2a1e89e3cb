package io.proxygate.runtime;

import io.proxygate.config.ProxyGateConfig;
import io.proxygate.config.ProxyGateSettings;
import io.proxygate.model.CredentialRecord;
import io.proxygate.model.CredentialStatus;
import io.proxygate.model.MembershipEvent;
import io.proxygate.notify.Notifier;
import io.proxygate.observability.AuditLogger;
import io.proxygate.observability.PrometheusFormatter;
import io.proxygate.provision.BoundedChannelPool;
import io.proxygate.provision.MtProxyProvisioner;
import io.proxygate.provision.ProcessCommandRunner;
import io.proxygate.provision.ProvisioningException;
import io.proxygate.provision.ProxyLinkBuilder;
import io.proxygate.provision.SecretChannel;
import io.proxygate.provision.SecretDeriver;
import io.proxygate.provision.ServiceUnitSecretChannel;
import io.proxygate.storage.CredentialStore;
import io.proxygate.storage.Database;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class ProxyGateRuntime implements AutoCloseable {
    private final ProxyGateConfig config;
    private final ProxyGateSettings settings;
    private final Database database;
    private final CredentialStore store;
    private final AuditLogger auditLogger;
    private final SecretChannel channel;
    private final Notifier notifier;
    private final Clock clock;

    private BoundedChannelPool pool;
    private MtProxyProvisioner provisioner;
    private ReconciliationEngine engine;
    private MembershipEventDispatcher dispatcher;

    public ProxyGateRuntime(ProxyGateConfig config, ProxyGateSettings settings, Notifier notifier) {
        this(config, settings, null, notifier, Clock.systemUTC());
    }

    /**
     * @param channel management channel of the proxy server; {@code null} edits the configured
     *                systemd unit, locally or over ssh
     */
    public ProxyGateRuntime(
            ProxyGateConfig config,
            ProxyGateSettings settings,
            SecretChannel channel,
            Notifier notifier,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings.requireValid();
        this.database = new Database(config);
        this.store = new CredentialStore(database);
        this.auditLogger = new AuditLogger(config.auditFile());
        this.channel = channel != null ? channel : new ServiceUnitSecretChannel(
                ProcessCommandRunner.forSettings(settings),
                settings.serviceUnitPath(),
                settings.serviceName(),
                settings.remoteTimeoutMs(),
                settings.restartCooldownMs()
        );
        this.notifier = notifier;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public synchronized void init() {
        if (engine != null) {
            return;
        }
        database.init();
        SecretDeriver deriver = new SecretDeriver(store.loadOrCreateSalt());
        ProxyLinkBuilder linkBuilder = new ProxyLinkBuilder(settings.publicHost(), settings.proxyPort(), settings.tlsDomain());
        this.pool = new BoundedChannelPool(settings.remoteParallelLimit(), settings.remoteQueueDepth(), settings.remoteTimeoutMs());
        this.provisioner = new MtProxyProvisioner(deriver, linkBuilder, channel, pool);
        this.engine = new ReconciliationEngine(
                store,
                provisioner,
                notifier,
                auditLogger,
                retryPolicy(),
                new EventRateLimiter(settings.joinRateLimitPerMin(), clock),
                settings.staleAfterMs(),
                settings.sweepLimit(),
                clock
        );
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("channel_id", settings.channelId());
        details.put("remote_host", settings.isRemote() ? settings.remoteHost() : "local");
        details.put("service_name", settings.serviceName());
        details.put("max_attempts", settings.maxAttempts());
        details.put("remote_parallel_limit", settings.remoteParallelLimit());
        details.put("join_rate_limit_per_min", settings.joinRateLimitPerMin());
        auditLogger.log(AuditLogger.AuditEvent.of("runtime.settings.load", "runtime", "settings", "ok", details));
    }

    public ReconciliationEngine.EventOutcome handle(MembershipEvent event) {
        return engine().handle(event);
    }

    public ReconciliationEngine.SweepOutcome sweep() {
        return engine().sweep();
    }

    public ReconciliationEngine.EventOutcome retryFailed(String userId) {
        return engine().retryFailed(userId);
    }

    public Optional<CredentialView> credential(String userId, boolean includeLink) {
        return engine().credential(userId).map(r -> CredentialView.of(r, includeLink));
    }

    public List<CredentialView> listCredentials(CredentialStatus status, int limit, boolean includeLink) {
        engine();
        List<CredentialView> out = new ArrayList<>();
        List<CredentialStatus> statuses = status == null ? List.of(CredentialStatus.values()) : List.of(status);
        for (CredentialStatus s : statuses) {
            int remaining = limit - out.size();
            if (remaining <= 0) {
                break;
            }
            for (CredentialRecord r : store.listByStatus(s, remaining)) {
                out.add(CredentialView.of(r, includeLink));
            }
        }
        return out;
    }

    /**
     * Secrets the proxy server currently holds, with the users they belong to where known.
     */
    public RemoteSecretsOutcome remoteSecrets() throws ProvisioningException {
        engine();
        Set<String> active = provisioner.activeSecrets();
        int owned = 0;
        for (CredentialRecord r : store.listByStatus(CredentialStatus.ACTIVE, Integer.MAX_VALUE)) {
            if (active.contains(r.secret())) {
                owned++;
            }
        }
        return new RemoteSecretsOutcome(active.size(), owned, active.size() - owned);
    }

    /**
     * Starts the worker pool and periodic sweep. Events go through {@link MembershipEventDispatcher#submit}.
     */
    public synchronized MembershipEventDispatcher startDispatcher() {
        if (dispatcher == null) {
            dispatcher = new MembershipEventDispatcher(
                    engine(),
                    auditLogger,
                    retryPolicy(),
                    settings.dispatcherCoreThreads(),
                    settings.dispatcherMaxThreads(),
                    settings.eventQueueCapacity(),
                    settings.sweepIntervalMs()
            );
            dispatcher.start();
        }
        return dispatcher;
    }

    public StatsOutcome stats() {
        ReconciliationEngine.EngineCounters counters = engine().counters();
        MembershipEventDispatcher.DispatcherCounters dispatch = dispatcher == null
                ? new MembershipEventDispatcher.DispatcherCounters(0, 0, 0L, 0L, 0L)
                : dispatcher.counters();
        return new StatsOutcome(
                store.countByStatus(),
                counters.joins(),
                counters.leaves(),
                counters.provisioned(),
                counters.revoked(),
                counters.errors(),
                counters.rateLimited(),
                counters.stale(),
                counters.notificationFailures(),
                counters.sweepRuns(),
                pool.inFlight(),
                pool.waiting(),
                pool.rejectedTotal(),
                dispatch.queued(),
                dispatch.rejected(),
                dispatch.requeued(),
                dispatch.crashed()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public ProxyGateSettings settings() {
        return settings;
    }

    public ProxyGateConfig config() {
        return config;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        engine();
        return database.listSchemaMigrations();
    }

    @Override
    public synchronized void close() {
        if (dispatcher != null) {
            dispatcher.close();
            dispatcher = null;
        }
    }

    private RetryPolicy retryPolicy() {
        return new RetryPolicy(settings.maxAttempts(), settings.baseBackoffMs(), settings.maxBackoffMs());
    }

    private synchronized ReconciliationEngine engine() {
        if (engine == null) {
            throw new IllegalStateException("runtime not initialized, call init() first");
        }
        return engine;
    }

    public record CredentialView(
            String userId,
            String username,
            CredentialStatus status,
            long generation,
            boolean hasSecret,
            String proxyLink,
            int failureCount,
            String failedOperation,
            String lastError,
            long nextAttemptAtMs,
            long createdAtMs,
            long updatedAtMs
    ) {
        static CredentialView of(CredentialRecord r, boolean includeLink) {
            return new CredentialView(
                    r.userId(),
                    r.username(),
                    r.status(),
                    r.generation(),
                    r.secret() != null,
                    includeLink ? r.proxyLink() : null,
                    r.failureCount(),
                    r.failedOperation() == null ? null : r.failedOperation().name(),
                    r.lastError(),
                    r.nextAttemptAtMs(),
                    r.createdAtMs(),
                    r.updatedAtMs()
            );
        }
    }

    public record RemoteSecretsOutcome(int remoteSecrets, int ownedByActiveUsers, int unowned) {
    }

    public record StatsOutcome(
            Map<String, Integer> credentialStatus,
            long joins,
            long leaves,
            long provisioned,
            long revoked,
            long errors,
            long rateLimited,
            long stale,
            long notificationFailures,
            long sweepRuns,
            int remoteInFlight,
            int remoteWaiting,
            long remoteRejected,
            int eventQueueDepth,
            long eventsRejected,
            long eventsRequeued,
            long eventsCrashed
    ) {
    }
}
