package io.proxygate;

import io.proxygate.cli.ProxyGateCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ProxyGateCommand()).execute(args);
        System.exit(code);
    }
}
