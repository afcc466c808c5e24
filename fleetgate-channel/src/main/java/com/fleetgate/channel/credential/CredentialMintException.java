package com.fleetgate.channel.credential;

import com.fleetgate.common.error.FleetGateException;
import lombok.Getter;

/**
 * Provider refused to mint a token. Not retried automatically.
 */
@Getter
public class CredentialMintException extends FleetGateException {

    /** HTTP status, or 0 when the request never got a response. */
    private final int status;
    private final String documentationUrl;

    public CredentialMintException(int status, String message, String documentationUrl) {
        super("Failed to mint GitHub token (" + status + "): " + message);
        this.status = status;
        this.documentationUrl = documentationUrl;
    }

    public CredentialMintException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.documentationUrl = null;
    }
}
