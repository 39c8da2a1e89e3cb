package io.proxygate.cli;

import io.proxygate.config.ProxyGateConfig;
import io.proxygate.config.ProxyGateSettings;
import io.proxygate.ingest.JsonLinesEventSource;
import io.proxygate.model.CredentialStatus;
import io.proxygate.model.MembershipEvent;
import io.proxygate.model.MembershipEventType;
import io.proxygate.notify.JsonLinesNotifier;
import io.proxygate.notify.Notifier;
import io.proxygate.observability.AuditLogger;
import io.proxygate.runtime.MembershipEventDispatcher;
import io.proxygate.runtime.ProxyGateRuntime;
import io.proxygate.runtime.ReconciliationEngine;
import io.proxygate.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "proxygate",
        mixinStandardHelpOptions = true,
        description = "Channel-membership driven proxy credential manager",
        subcommands = {
                ProxyGateCommand.InitCommand.class,
                ProxyGateCommand.RunCommand.class,
                ProxyGateCommand.EventCommand.class,
                ProxyGateCommand.SweepCommand.class,
                ProxyGateCommand.UserCommand.class,
                ProxyGateCommand.UsersCommand.class,
                ProxyGateCommand.RetryCommand.class,
                ProxyGateCommand.SecretsCommand.class,
                ProxyGateCommand.StatsCommand.class,
                ProxyGateCommand.MetricsCommand.class,
                ProxyGateCommand.SettingsCommand.class,
                ProxyGateCommand.AuditTailCommand.class,
                ProxyGateCommand.AuditVerifyCommand.class,
                ProxyGateCommand.SchemaMigrationsCommand.class
        }
)
public final class ProxyGateCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--settings"}, description = "Settings file (default: <root>/proxygate-settings.json)")
    String settingsFile;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | event | sweep | user | users | retry | secrets | stats | metrics | settings | audit-tail | audit-verify | schema-migrations");
    }

    ProxyGateConfig config() {
        return ProxyGateConfig.fromRoot(root);
    }

    ProxyGateSettings settings() {
        Path path = settingsFile == null || settingsFile.isBlank() ? config().settingsFile() : Path.of(settingsFile);
        return ProxyGateSettings.load(path);
    }

    ProxyGateRuntime runtime() {
        ProxyGateSettings settings = settings();
        return runtime(settings, new JsonLinesNotifier(System.out, settings.adminUserId()));
    }

    ProxyGateRuntime runtime(ProxyGateSettings settings, Notifier notifier) {
        ProxyGateRuntime runtime = new ProxyGateRuntime(config(), settings, notifier);
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize data directory, SQLite schema and secret salt")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Override
        public Integer call() {
            parent.runtime();
            System.out.println("Initialized ProxyGate at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "run", description = "Consume JSON-lines membership events and reconcile credentials")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Option(names = {"--events"}, defaultValue = "-", description = "Event file, '-' for stdin")
        String events;

        @Option(names = {"--notify-file"}, description = "Append notifications to this file instead of stdout")
        String notifyFile;

        @Option(names = {"--drain-timeout-ms"}, defaultValue = "30000",
                description = "How long to wait for queued events once the input ends")
        long drainTimeoutMs;

        @Override
        public Integer call() throws Exception {
            ProxyGateSettings settings = parent.settings();
            OutputStream notifyOut = notifyFile == null
                    ? System.out
                    : Files.newOutputStream(Path.of(notifyFile), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            ProxyGateRuntime runtime = parent.runtime(settings, new JsonLinesNotifier(notifyOut, settings.adminUserId()));
            BufferedReader reader = "-".equals(events)
                    ? new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
                    : Files.newBufferedReader(Path.of(events), StandardCharsets.UTF_8);
            AtomicBoolean running = new AtomicBoolean(true);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> running.set(false), "proxygate-shutdown-hook"));

            long submitted = 0L;
            try (JsonLinesEventSource source = new JsonLinesEventSource(
                    reader, settings.channelId(), runtime.auditLogger(), Clock.systemUTC())) {
                MembershipEventDispatcher dispatcher = runtime.startDispatcher();
                // Initial pass picks up whatever a previous run left pending.
                runtime.sweep();
                while (running.get()) {
                    Optional<MembershipEvent> next = source.next();
                    if (next.isEmpty()) {
                        break;
                    }
                    while (!dispatcher.submit(next.get())) {
                        Thread.sleep(50L);
                    }
                    submitted++;
                }
                boolean drained = dispatcher.awaitIdle(drainTimeoutMs);
                Map<String, Object> summary = new LinkedHashMap<>();
                summary.put("submitted", submitted);
                summary.put("rejected_lines", source.rejectedLines());
                summary.put("drained", drained);
                summary.put("stats", runtime.stats());
                System.out.println(Jsons.toJson(summary));
            } finally {
                runtime.close();
                if (notifyOut != System.out) {
                    notifyOut.close();
                }
            }
            return 0;
        }
    }

    @Command(name = "event", description = "Apply one membership event synchronously")
    static final class EventCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Option(names = {"--type"}, required = true, description = "join|leave")
        String type;

        @Option(names = {"--user"}, required = true, description = "User id")
        String userId;

        @Option(names = {"--username"}, description = "Optional user handle")
        String username;

        @Option(names = {"--timestamp-ms"}, description = "Event time in epoch millis (default: now)")
        Long timestampMs;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            long ts = timestampMs == null ? Instant.now().toEpochMilli() : timestampMs;
            MembershipEvent event = new MembershipEvent(MembershipEventType.fromString(type), userId, username, ts);
            ReconciliationEngine.EventOutcome outcome = runtime.handle(event);
            System.out.println(Jsons.toJson(outcome));
            return outcome.result() == ReconciliationEngine.Result.STORE_UNAVAILABLE ? 2 : 0;
        }
    }

    @Command(name = "sweep", description = "Re-drive pending credentials that are due or stale")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.sweep()));
            return 0;
        }
    }

    @Command(name = "user", description = "Show one user's credential state")
    static final class UserCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Parameters(index = "0", description = "User id")
        String userId;

        @Option(names = {"--show-link"}, defaultValue = "false", description = "Include the proxy link")
        boolean showLink;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            Optional<ProxyGateRuntime.CredentialView> view = runtime.credential(userId, showLink);
            if (view.isEmpty()) {
                System.out.println("User not found: " + userId);
                return 1;
            }
            System.out.println(Jsons.toJson(view.get()));
            return 0;
        }
    }

    @Command(name = "users", description = "List credentials, optionally filtered by status")
    static final class UsersCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Option(names = {"--status"}, description = "active|revoked|pending_provision|pending_revoke|failed")
        String status;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Maximum rows")
        int limit;

        @Option(names = {"--show-link"}, defaultValue = "false", description = "Include proxy links")
        boolean showLink;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            CredentialStatus filter = status == null ? null : CredentialStatus.fromString(status);
            List<ProxyGateRuntime.CredentialView> rows = runtime.listCredentials(filter, Math.max(1, limit), showLink);
            System.out.println(Jsons.toJson(rows));
            return 0;
        }
    }

    @Command(name = "retry", description = "Re-drive a FAILED credential with a fresh attempt budget")
    static final class RetryCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Parameters(index = "0", description = "User id")
        String userId;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            ReconciliationEngine.EventOutcome outcome = runtime.retryFailed(userId);
            System.out.println(Jsons.toJson(outcome));
            return outcome.result() == ReconciliationEngine.Result.NOOP ? 1 : 0;
        }
    }

    @Command(name = "secrets", description = "Compare secrets on the proxy server with active users")
    static final class SecretsCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Override
        public Integer call() throws Exception {
            ProxyGateRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.remoteSecrets()));
            return 0;
        }
    }

    @Command(name = "stats", description = "Show credential counts and engine counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.stats()));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            System.out.print(runtime.metricsText());
            return 0;
        }
    }

    @Command(name = "settings", description = "Print effective settings and validation problems")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Override
        public Integer call() {
            ProxyGateSettings settings = parent.settings();
            List<String> problems = settings.validate();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("settings", settings);
            out.put("problems", problems);
            System.out.println(Jsons.toJson(out));
            return problems.isEmpty() ? 0 : 1;
        }
    }

    @Command(name = "audit-tail", description = "Show the newest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Rows to show")
        int limit;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.auditLogger().tail(limit)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            AuditLogger.VerifyOutcome outcome = runtime.auditLogger().verify();
            System.out.println(Jsons.toJson(outcome));
            return outcome.valid() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        ProxyGateCommand parent;

        @Override
        public Integer call() {
            ProxyGateRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.schemaMigrations()));
            return 0;
        }
    }
}
