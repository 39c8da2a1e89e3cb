package io.proxygate.provision;

/**
 * The proxy server rejected the operation. Retrying would fail the same way.
 */
public class FatalRemoteException extends ProvisioningException {
    public FatalRemoteException(String message) {
        super(message);
    }

    public FatalRemoteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
