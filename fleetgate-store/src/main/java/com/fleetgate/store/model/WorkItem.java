package com.fleetgate.store.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical unit of inbound work derived from a webhook, a timer or another agent's turn.
 * {@code sourceRef} is unique per {@code source}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkItem {
    private String id;
    private String source;
    private String sourceRef;
    private String pluginInstanceId;
    private String sessionKey;
    private WorkItemStatus status;
    private String title;
    /** JSON text. */
    private String payload;
    private long createdAt;
    private long updatedAt;
}
