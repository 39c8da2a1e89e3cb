package io.proxygate.model;

/**
 * Durable per-user credential state. Instances are immutable; transitions produce new records.
 */
public record CredentialRecord(
        String userId,
        String username,
        CredentialStatus status,
        String secret,
        String proxyLink,
        long generation,
        int failureCount,
        CredentialOperation failedOperation,
        String lastError,
        long nextAttemptAtMs,
        long createdAtMs,
        long updatedAtMs
) {
    public CredentialRecord {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if ((status == CredentialStatus.REVOKED) && (secret != null || proxyLink != null)) {
            throw new IllegalArgumentException("REVOKED record must not carry a secret: " + userId);
        }
        if (status == CredentialStatus.ACTIVE && (secret == null || secret.isBlank())) {
            throw new IllegalArgumentException("ACTIVE record requires a secret: " + userId);
        }
    }

    public static CredentialRecord pendingProvision(String userId, String username, long generation, long nowMs) {
        return new CredentialRecord(userId, username, CredentialStatus.PENDING_PROVISION, null, null,
                generation, 0, null, null, 0L, nowMs, nowMs);
    }

    public CredentialRecord withUsername(String newUsername) {
        if (newUsername == null || newUsername.isBlank()) {
            return this;
        }
        return new CredentialRecord(userId, newUsername, status, secret, proxyLink, generation, failureCount,
                failedOperation, lastError, nextAttemptAtMs, createdAtMs, updatedAtMs);
    }

    public CredentialRecord startCycle(long newGeneration, long nowMs) {
        return new CredentialRecord(userId, username, CredentialStatus.PENDING_PROVISION, null, null,
                newGeneration, 0, null, null, 0L, createdAtMs, nowMs);
    }

    public CredentialRecord activated(String newSecret, String newLink, long nowMs) {
        return new CredentialRecord(userId, username, CredentialStatus.ACTIVE, newSecret, newLink,
                generation, 0, null, null, 0L, createdAtMs, nowMs);
    }

    public CredentialRecord pending(CredentialOperation operation, long nowMs) {
        return new CredentialRecord(userId, username, operation.pendingStatus(), secret, proxyLink,
                generation, 0, null, null, 0L, createdAtMs, nowMs);
    }

    public CredentialRecord revoked(long nowMs) {
        return new CredentialRecord(userId, username, CredentialStatus.REVOKED, null, null,
                generation, 0, null, null, 0L, createdAtMs, nowMs);
    }

    public CredentialRecord retryScheduled(String error, long nextAttemptAt, long nowMs) {
        return new CredentialRecord(userId, username, status, secret, proxyLink, generation, failureCount + 1,
                null, error, nextAttemptAt, createdAtMs, nowMs);
    }

    public CredentialRecord failed(CredentialOperation operation, String error, long nowMs) {
        return new CredentialRecord(userId, username, CredentialStatus.FAILED, secret, proxyLink, generation,
                failureCount, operation, error, 0L, createdAtMs, nowMs);
    }
}
