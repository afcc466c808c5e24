package com.fleetgate.store.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An agent of the fleet. {@code config} is JSON and may carry a {@code queue} override.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRecord {
    private String id;
    private String handle;
    private String name;
    private String status;
    private String config;
}
