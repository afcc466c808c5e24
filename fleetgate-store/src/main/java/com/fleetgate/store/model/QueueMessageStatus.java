package com.fleetgate.store.model;

import java.util.Locale;

public enum QueueMessageStatus {
    PENDING,
    DISPATCHED,
    DROPPED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static QueueMessageStatus fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
