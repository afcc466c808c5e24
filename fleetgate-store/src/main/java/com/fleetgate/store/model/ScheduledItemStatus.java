package com.fleetgate.store.model;

import java.util.Locale;

public enum ScheduledItemStatus {
    PENDING,
    FIRING,
    FIRED,
    CANCELLED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScheduledItemStatus fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
