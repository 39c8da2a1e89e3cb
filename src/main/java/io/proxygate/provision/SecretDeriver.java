package io.proxygate.provision;

import io.proxygate.util.Hashing;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Derives proxy secrets from the installation salt, so a retried provisioning call always lands on
 * the secret the first attempt pushed.
 */
public final class SecretDeriver {
    public static final Pattern SECRET_PATTERN = Pattern.compile("^[0-9a-f]{32}$");
    private static final int SECRET_BYTES = 16;

    private final byte[] salt;

    public SecretDeriver(String saltHex) {
        if (saltHex == null || saltHex.isBlank()) {
            throw new IllegalArgumentException("salt must not be blank");
        }
        this.salt = Hashing.fromHex(saltHex.trim());
        if (salt.length < 16) {
            throw new IllegalArgumentException("salt must be at least 16 bytes");
        }
    }

    public String derive(String userId, long generation) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (generation < 1L) {
            throw new IllegalArgumentException("generation must be >= 1: " + generation);
        }
        byte[] mac = Hashing.hmacSha256(salt, userId.trim() + ":" + generation);
        return Hashing.toHex(Arrays.copyOf(mac, SECRET_BYTES));
    }

    public static boolean isWellFormed(String secret) {
        return secret != null && SECRET_PATTERN.matcher(secret).matches();
    }
}
