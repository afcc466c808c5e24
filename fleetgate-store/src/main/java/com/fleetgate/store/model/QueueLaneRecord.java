package com.fleetgate.store.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted identity and policy of a queue lane.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueLaneRecord {
    private String queueKey;
    private String sessionKey;
    private String agentId;
    private String pluginInstanceId;
    private QueueMode mode;
    private long debounceMs;
    private int maxQueued;
}
