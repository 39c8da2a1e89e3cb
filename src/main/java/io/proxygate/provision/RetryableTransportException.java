package io.proxygate.provision;

/**
 * Transport or authentication towards the management channel failed before the operation could run.
 */
public class RetryableTransportException extends ProvisioningException {
    public RetryableTransportException(String message) {
        super(message);
    }

    public RetryableTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
