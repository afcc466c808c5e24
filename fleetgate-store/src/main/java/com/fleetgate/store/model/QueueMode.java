package com.fleetgate.store.model;

import java.util.Locale;

/**
 * Dispatch policy of a queue lane.
 */
public enum QueueMode {
    /** Coalesce everything that arrives within the debounce window into one run. */
    COLLECT,
    /** One run per message, strictly serial. */
    FOLLOWUP,
    /** Feed new messages into the active run; collect otherwise. */
    STEER;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a configured mode name.
     *
     * @return the mode, or {@code null} when the value is blank or unknown
     */
    public static QueueMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "collect":
                return COLLECT;
            case "followup":
                return FOLLOWUP;
            case "steer":
                return STEER;
            default:
                return null;
        }
    }
}
