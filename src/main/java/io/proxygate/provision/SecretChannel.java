package io.proxygate.provision;

import java.util.Set;

/**
 * Management channel of the proxy server. Both mutations are idempotent.
 */
public interface SecretChannel {
    void addSecret(String secret) throws ProvisioningException;

    void removeSecret(String secret) throws ProvisioningException;

    Set<String> activeSecrets() throws ProvisioningException;
}
