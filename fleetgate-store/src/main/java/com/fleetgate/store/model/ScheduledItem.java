package com.fleetgate.store.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A timer owned by an agent. Times are epoch seconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledItem {
    private String id;
    private String agentId;
    private String sessionKey;
    private String type;
    /** JSON text. */
    private String payload;
    private long runAt;
    private String recurrence;
    private ScheduledItemStatus status;
    private String sourceRef;
    private String pluginInstanceId;
    /** JSON text. */
    private String responseContext;
    private String routineId;
    private String routineRunId;
    private long createdAt;
    private Long firedAt;
    private Long cancelledAt;
}
