package com.fleetgate.channel.credential;

/**
 * Mints and caches short-lived provider credentials.
 */
public interface CredentialProvider {

    /**
     * Return a token valid for at least the cache skew, minting one if needed.
     *
     * @throws CredentialMintException when the provider rejects the mint
     */
    CredentialEnvelope getCredential(CredentialRequest request);

    /** Drop every cached token of an installation. */
    void invalidate(long installationId);
}
