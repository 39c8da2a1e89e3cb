package io.proxygate.provision;

/**
 * Base of the remote provisioning failure taxonomy. Subclasses decide how the engine reacts:
 * retry, fail the record, or treat the outcome as unknown.
 */
public abstract class ProvisioningException extends Exception {
    protected ProvisioningException(String message) {
        super(message);
    }

    protected ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean retryable();
}
