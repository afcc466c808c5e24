package com.fleetgate.channel.credential;

import java.time.Instant;

/**
 * Short-lived access token. Held in memory only.
 */
public record CredentialEnvelope(String token, Instant expiresAt, CredentialSource source) {

    public CredentialEnvelope withSource(CredentialSource newSource) {
        return new CredentialEnvelope(token, expiresAt, newSource);
    }

    @Override
    public String toString() {
        return "CredentialEnvelope[expiresAt=" + expiresAt + ", source=" + source + "]";
    }
}
