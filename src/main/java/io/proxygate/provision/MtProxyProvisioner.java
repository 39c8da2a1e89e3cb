package io.proxygate.provision;

import java.util.Set;

/**
 * Provisioner for an MTProxy server: deterministic secrets, pushed through a bounded management channel.
 */
public final class MtProxyProvisioner implements RemoteProvisioner {
    private final SecretDeriver deriver;
    private final ProxyLinkBuilder linkBuilder;
    private final SecretChannel channel;
    private final BoundedChannelPool pool;

    public MtProxyProvisioner(SecretDeriver deriver, ProxyLinkBuilder linkBuilder, SecretChannel channel, BoundedChannelPool pool) {
        this.deriver = deriver;
        this.linkBuilder = linkBuilder;
        this.channel = channel;
        this.pool = pool;
    }

    @Override
    public String provision(String userId, long generation) throws ProvisioningException {
        String secret = deriver.derive(userId, generation);
        return pool.execute("add_secret", () -> {
            channel.addSecret(secret);
            return secret;
        });
    }

    @Override
    public void revoke(String secret) throws ProvisioningException {
        if (!SecretDeriver.isWellFormed(secret)) {
            throw new FatalRemoteException("cannot revoke malformed secret");
        }
        pool.execute("remove_secret", () -> {
            channel.removeSecret(secret);
            return null;
        });
    }

    /**
     * Secrets the proxy server currently serves, read through the same bounded channel as edits.
     */
    public Set<String> activeSecrets() throws ProvisioningException {
        return pool.execute("list_secrets", channel::activeSecrets);
    }

    @Override
    public String secretFor(String userId, long generation) {
        return deriver.derive(userId, generation);
    }

    @Override
    public String linkFor(String secret) {
        return linkBuilder.linkFor(secret);
    }
}
