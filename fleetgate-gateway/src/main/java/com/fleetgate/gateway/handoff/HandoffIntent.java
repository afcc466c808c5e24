package com.fleetgate.gateway.handoff;

/**
 * A mention of another agent found in a reply. Only {@code explicit} intents
 * transfer work.
 */
public record HandoffIntent(String handle, boolean explicit, String reason) {
}
