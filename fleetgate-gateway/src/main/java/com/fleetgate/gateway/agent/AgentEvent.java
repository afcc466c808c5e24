package com.fleetgate.gateway.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Progress event emitted during a run ({@code steer}, {@code tool}, {@code text}, ...).
 */
public record AgentEvent(String type, JsonNode data) {

    public static final String STEER = "steer";
}
