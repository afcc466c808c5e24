package com.fleetgate.gateway.queue;

import com.fleetgate.store.model.QueueMode;

/**
 * Effective lane settings after agent, instance and default resolution.
 */
public record QueueSettings(QueueMode mode, long debounceMs, int maxQueued, long maxDebounceWaitMs,
        OverflowPolicy overflowPolicy) {

    public QueueSettings withDebounceMs(long newDebounceMs) {
        return new QueueSettings(mode, newDebounceMs, maxQueued, maxDebounceWaitMs, overflowPolicy);
    }
}
