package io.proxygate.provision;

import io.proxygate.config.ProxyGateSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs management commands as local processes. With a remote host configured each command is sent
 * through {@code ssh} in batch mode, so an ssh-level failure shows up as exit code 255.
 */
public final class ProcessCommandRunner implements CommandRunner {
    public static final int SSH_TRANSPORT_EXIT = 255;
    private static final int MAX_OUTPUT_CHARS = 64 * 1024;

    private final List<String> prefix;
    private final boolean remote;

    private ProcessCommandRunner(List<String> prefix, boolean remote) {
        this.prefix = List.copyOf(prefix);
        this.remote = remote;
    }

    public static ProcessCommandRunner local() {
        return new ProcessCommandRunner(List.of(), false);
    }

    public static ProcessCommandRunner ssh(String host, String user, int port, String keyPath, long connectTimeoutMs) {
        long connectTimeoutSec = Math.max(1L, connectTimeoutMs / 1_000L);
        List<String> prefix = new ArrayList<>();
        prefix.add("ssh");
        if (keyPath != null && !keyPath.isBlank()) {
            prefix.add("-i");
            prefix.add(keyPath);
        }
        prefix.add("-p");
        prefix.add(Integer.toString(port));
        prefix.add("-o");
        prefix.add("BatchMode=yes");
        prefix.add("-o");
        prefix.add("ConnectTimeout=" + connectTimeoutSec);
        prefix.add((user == null || user.isBlank() ? "root" : user) + "@" + host);
        prefix.add("--");
        return new ProcessCommandRunner(prefix, true);
    }

    public static ProcessCommandRunner forSettings(ProxyGateSettings settings) {
        if (!settings.isRemote()) {
            return local();
        }
        return ssh(settings.remoteHost(), settings.remoteUser(), settings.sshPort(), settings.sshKeyPath(),
                settings.remoteTimeoutMs());
    }

    List<String> commandLine(List<String> command) {
        if (!remote) {
            return new ArrayList<>(command);
        }
        List<String> out = new ArrayList<>(prefix);
        for (String arg : command) {
            out.add(shellQuote(arg));
        }
        return out;
    }

    @Override
    public CommandResult run(List<String> command, String stdin, long timeoutMs) throws IOException, InterruptedException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        ProcessBuilder pb = new ProcessBuilder(commandLine(command));
        pb.redirectErrorStream(true);
        Process process = pb.start();
        // Output is drained while the process runs: a full pipe blocks the child.
        CompletableFuture<String> output = CompletableFuture.supplyAsync(
                () -> readOutput(process.getInputStream()), ProcessCommandRunner::drainThread);
        try {
            try (OutputStream in = process.getOutputStream()) {
                if (stdin != null) {
                    in.write(stdin.getBytes(StandardCharsets.UTF_8));
                }
            }
            boolean finished = process.waitFor(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return CommandResult.timeout();
            }
            return CommandResult.exit(process.exitValue(), awaitOutput(output));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    /**
     * Unwraps the drain result; a failed read surfaces as {@link IOException} like a failed start.
     */
    static String awaitOutput(CompletableFuture<String> output) throws IOException {
        try {
            return output.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            throw new IOException("Failed to read command output: " + cause.getMessage(), cause);
        }
    }

    private static void drainThread(Runnable task) {
        Thread thread = new Thread(task, "proxygate-command-output");
        thread.setDaemon(true);
        thread.start();
    }

    private static String readOutput(InputStream stream) {
        try {
            String combined = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            if (combined.length() <= MAX_OUTPUT_CHARS) {
                return combined;
            }
            return combined.substring(0, MAX_OUTPUT_CHARS);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read command output", e);
        }
    }

    static String shellQuote(String arg) {
        if (arg.matches("[A-Za-z0-9_./:=@%+-]+")) {
            return arg;
        }
        return "'" + arg.replace("'", "'\"'\"'") + "'";
    }
}
