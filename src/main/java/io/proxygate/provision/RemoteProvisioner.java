package io.proxygate.provision;

/**
 * The only component allowed to change the proxy server's active secret set.
 */
public interface RemoteProvisioner {

    /**
     * Derives the secret for {@code (userId, generation)} and makes sure the proxy server accepts it.
     * Calling again for the same pair returns the same secret without adding a duplicate.
     */
    String provision(String userId, long generation) throws ProvisioningException;

    /**
     * Removes {@code secret} from the proxy server. An absent secret counts as removed.
     */
    void revoke(String secret) throws ProvisioningException;

    /**
     * Secret that {@link #provision} issues for the pair, computed locally.
     */
    String secretFor(String userId, long generation);

    String linkFor(String secret);
}
