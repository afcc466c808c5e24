package com.fleetgate.gateway.queue;

import java.util.Locale;

/**
 * What happens to a lane's pending buffer once it holds {@code maxQueued} messages.
 */
public enum OverflowPolicy {
    /** Drop the arriving message. */
    DROP_NEWEST("queue_full"),
    /** Evict the oldest pending message and keep the arrival. */
    DROP_OLDEST("evicted");

    private final String dropReason;

    OverflowPolicy(String dropReason) {
        this.dropReason = dropReason;
    }

    public String dropReason() {
        return dropReason;
    }

    /** Unknown values fall back to {@link #DROP_NEWEST}. */
    public static OverflowPolicy parse(String raw) {
        if (raw != null && "drop_oldest".equals(raw.trim().toLowerCase(Locale.ROOT))) {
            return DROP_OLDEST;
        }
        return DROP_NEWEST;
    }
}
