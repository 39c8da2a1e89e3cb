package io.proxygate.provision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The MTProxy systemd unit. The active secret set is the list of {@code -S <secret>} flags on the
 * {@code ExecStart} line; everything else in the unit is preserved verbatim on render.
 */
public final class ProxyServiceUnit {
    private static final Pattern EXEC_START = Pattern.compile("(?m)^ExecStart=(.*)$");

    private final String unitText;
    private final List<String> execTokens;
    private final Set<String> secrets;

    private ProxyServiceUnit(String unitText, List<String> execTokens, Set<String> secrets) {
        this.unitText = unitText;
        this.execTokens = List.copyOf(execTokens);
        this.secrets = Collections.unmodifiableSet(new LinkedHashSet<>(secrets));
    }

    public static ProxyServiceUnit parse(String unitText) {
        if (unitText == null || unitText.isBlank()) {
            throw new IllegalArgumentException("service unit is empty");
        }
        Matcher m = EXEC_START.matcher(unitText);
        if (!m.find()) {
            throw new IllegalArgumentException("service unit has no ExecStart line");
        }
        String[] raw = m.group(1).trim().split("\\s+");
        List<String> tokens = new ArrayList<>();
        Set<String> secrets = new LinkedHashSet<>();
        for (int i = 0; i < raw.length; i++) {
            if ("-S".equals(raw[i]) && i + 1 < raw.length) {
                String candidate = raw[i + 1].toLowerCase();
                if (!SecretDeriver.isWellFormed(candidate)) {
                    throw new IllegalArgumentException("malformed secret in ExecStart at token " + (i + 1));
                }
                secrets.add(candidate);
                i++;
                continue;
            }
            tokens.add(raw[i]);
        }
        if (tokens.isEmpty() || tokens.get(0).isBlank()) {
            throw new IllegalArgumentException("ExecStart has no command");
        }
        return new ProxyServiceUnit(unitText, tokens, secrets);
    }

    public Set<String> secrets() {
        return secrets;
    }

    public boolean contains(String secret) {
        return secrets.contains(secret);
    }

    public String port() {
        return flagValue("-H", "8888");
    }

    public String tlsDomain() {
        return flagValue("-D", "");
    }

    public String tag() {
        return flagValue("-P", "");
    }

    public String workers() {
        return flagValue("-M", "1");
    }

    public ProxyServiceUnit withSecret(String secret) {
        requireWellFormed(secret);
        if (secrets.contains(secret)) {
            return this;
        }
        Set<String> next = new LinkedHashSet<>(secrets);
        next.add(secret);
        return new ProxyServiceUnit(unitText, execTokens, next);
    }

    public ProxyServiceUnit withoutSecret(String secret) {
        requireWellFormed(secret);
        if (!secrets.contains(secret)) {
            return this;
        }
        Set<String> next = new LinkedHashSet<>(secrets);
        next.remove(secret);
        return new ProxyServiceUnit(unitText, execTokens, next);
    }

    /**
     * Unit text with the secret flags placed right after the {@code -H <port>} pair, or at the end
     * of the command when there is no port flag.
     */
    public String render() {
        List<String> out = new ArrayList<>();
        boolean inserted = false;
        for (int i = 0; i < execTokens.size(); i++) {
            out.add(execTokens.get(i));
            if (!inserted && "-H".equals(execTokens.get(i)) && i + 1 < execTokens.size()) {
                out.add(execTokens.get(++i));
                appendSecrets(out);
                inserted = true;
            }
        }
        if (!inserted) {
            appendSecrets(out);
        }
        String execLine = "ExecStart=" + String.join(" ", out);
        return EXEC_START.matcher(unitText).replaceFirst(Matcher.quoteReplacement(execLine));
    }

    private void appendSecrets(List<String> out) {
        for (String secret : secrets) {
            out.add("-S");
            out.add(secret);
        }
    }

    private String flagValue(String flag, String fallback) {
        for (int i = 0; i < execTokens.size() - 1; i++) {
            if (flag.equals(execTokens.get(i))) {
                return execTokens.get(i + 1);
            }
        }
        return fallback;
    }

    private static void requireWellFormed(String secret) {
        if (!SecretDeriver.isWellFormed(secret)) {
            throw new IllegalArgumentException("secret must be 32 lowercase hex chars");
        }
    }
}
