package io.proxygate.provision;

/**
 * The remote call timed out; it may or may not have been applied. Only an idempotent retry resolves it.
 */
public class AmbiguousTimeoutException extends ProvisioningException {
    public AmbiguousTimeoutException(String message) {
        super(message);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
