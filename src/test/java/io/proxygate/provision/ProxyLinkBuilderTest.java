package io.proxygate.provision;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ProxyLinkBuilderTest {
    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @Test
    void fakeTlsLinkCarriesHexDomain() {
        ProxyLinkBuilder builder = new ProxyLinkBuilder("proxy.example.org", 443, "www.cloudflare.com");
        Assertions.assertEquals(
                "https://t.me/proxy?server=proxy.example.org&port=443&secret=ee" + SECRET + "7777772e636c6f7564666c6172652e636f6d",
                builder.linkFor(SECRET)
        );
    }

    @Test
    void withoutDomainUsesPaddedSecret() {
        ProxyLinkBuilder builder = new ProxyLinkBuilder("1.2.3.4", 8443, "");
        Assertions.assertEquals("https://t.me/proxy?server=1.2.3.4&port=8443&secret=dd" + SECRET, builder.linkFor(SECRET));
        Assertions.assertEquals("dd" + SECRET, new ProxyLinkBuilder("h", 1, null).clientSecret(SECRET));
    }

    @Test
    void rejectsMalformedSecretAndBlankHost() {
        ProxyLinkBuilder builder = new ProxyLinkBuilder("h", 443, "");
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.linkFor("not-a-secret"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ProxyLinkBuilder(" ", 443, ""));
    }
}
