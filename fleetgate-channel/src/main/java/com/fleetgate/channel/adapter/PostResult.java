package com.fleetgate.channel.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of posting a reply back to a channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostResult {
    private boolean success;
    /** sent | skipped | failed */
    private String outcome;
    private boolean retryable;
    /** Provider's id for the posted message. */
    private String providerRef;
    private String error;

    public static PostResult sent(String providerRef) {
        return new PostResult(true, "sent", false, providerRef, null);
    }

    public static PostResult failed(String error, boolean retryable) {
        return new PostResult(false, "failed", retryable, null, error);
    }

    /** Retry on throttling and server errors. */
    public static boolean isRetryableStatus(int status) {
        return status == 429 || status >= 500;
    }
}
