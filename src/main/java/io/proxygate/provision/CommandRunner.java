package io.proxygate.provision;

import java.io.IOException;
import java.util.List;

/**
 * Runs one command of the management channel and waits for it, up to {@code timeoutMs}.
 */
@FunctionalInterface
public interface CommandRunner {
    CommandResult run(List<String> command, String stdin, long timeoutMs) throws IOException, InterruptedException;

    record CommandResult(int exitCode, String output, boolean timedOut) {
        public static CommandResult ok(String output) {
            return new CommandResult(0, output, false);
        }

        public static CommandResult exit(int exitCode, String output) {
            return new CommandResult(exitCode, output, false);
        }

        public static CommandResult timeout() {
            return new CommandResult(-1, "", true);
        }

        public boolean success() {
            return !timedOut && exitCode == 0;
        }
    }
}
