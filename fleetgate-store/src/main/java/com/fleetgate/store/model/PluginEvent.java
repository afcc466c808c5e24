package com.fleetgate.store.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit trail entry for a plugin (ingress decisions, auto-disable).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginEvent {
    private String id;
    private String pluginId;
    private String pluginInstanceId;
    private String kind;
    private String status;
    private String workItemId;
    /** JSON text. */
    private String detail;
    private long createdAt;
}
