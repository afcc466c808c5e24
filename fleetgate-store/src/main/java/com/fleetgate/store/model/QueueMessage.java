package com.fleetgate.store.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One inbound message routed into a lane.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueMessage {
    private String id;
    private String queueKey;
    private String workItemId;
    private String pluginInstanceId;
    /** JSON text. */
    private String responseContext;
    private String text;
    private String senderName;
    /** Epoch millis. */
    private long arrivedAt;
    private QueueMessageStatus status;
    private String dispatchId;
    private String dropReason;
}
