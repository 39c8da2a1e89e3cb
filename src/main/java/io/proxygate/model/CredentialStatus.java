package io.proxygate.model;

public enum CredentialStatus {
    PENDING_PROVISION,
    ACTIVE,
    PENDING_REVOKE,
    REVOKED,
    FAILED;

    public boolean isPending() {
        return this == PENDING_PROVISION || this == PENDING_REVOKE;
    }

    public static CredentialStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        for (CredentialStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.name().replace('_', '-').equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown credential status: " + raw);
    }
}
