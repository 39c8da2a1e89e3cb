package io.proxygate.model;

/**
 * Remote operation a pending or failed record is waiting on.
 */
public enum CredentialOperation {
    PROVISION,
    REVOKE;

    public CredentialStatus pendingStatus() {
        return this == PROVISION ? CredentialStatus.PENDING_PROVISION : CredentialStatus.PENDING_REVOKE;
    }
}
