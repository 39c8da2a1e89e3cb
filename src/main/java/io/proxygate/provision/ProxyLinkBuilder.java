package io.proxygate.provision;

import io.proxygate.util.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Builds {@code https://t.me/proxy} links. With a fake-TLS domain the secret is {@code ee} + secret +
 * hex(domain), otherwise {@code dd} + secret.
 */
public final class ProxyLinkBuilder {
    private final String host;
    private final int port;
    private final String tlsDomain;

    public ProxyLinkBuilder(String host, int port, String tlsDomain) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("proxy host must not be blank");
        }
        this.host = host.trim();
        this.port = port;
        this.tlsDomain = tlsDomain == null ? "" : tlsDomain.trim();
    }

    public String linkFor(String secret) {
        if (!SecretDeriver.isWellFormed(secret)) {
            throw new IllegalArgumentException("secret must be 32 lowercase hex chars");
        }
        return "https://t.me/proxy?server=" + host + "&port=" + port + "&secret=" + clientSecret(secret);
    }

    String clientSecret(String secret) {
        if (tlsDomain.isEmpty() || "\"\"".equals(tlsDomain)) {
            return "dd" + secret;
        }
        return "ee" + secret + Hashing.toHex(tlsDomain.getBytes(StandardCharsets.UTF_8));
    }
}
