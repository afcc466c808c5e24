package com.fleetgate.gateway.handoff;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.common.json.JsonMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per plugin instance handoff settings, read from the instance config.
 * Handoffs are off unless {@code agentMentionHandoffs} is true.
 */
@Data
@Slf4j
@JsonIgnoreProperties(ignoreUnknown = true)
public class HandoffPolicy {

    public static final int DEFAULT_MAX_DEPTH = 3;

    private boolean agentMentionHandoffs;
    /** When non-empty, only these handles may receive handoffs. */
    private List<String> handoffAllow = new ArrayList<>();
    private List<String> handoffDeny = new ArrayList<>();
    private int handoffMaxDepth = DEFAULT_MAX_DEPTH;

    public static HandoffPolicy fromInstanceConfig(String configJson) {
        if (configJson == null || configJson.isBlank()) {
            return new HandoffPolicy();
        }
        try {
            JsonNode config = JsonMapper.read(configJson);
            HandoffPolicy policy = JsonMapper.convert(config, HandoffPolicy.class);
            return policy != null ? policy : new HandoffPolicy();
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unreadable handoff settings: {}", e.getMessage());
            return new HandoffPolicy();
        }
    }

    public boolean allows(String handle) {
        String normalized = normalize(handle);
        if (handoffDeny != null && handoffDeny.stream().map(HandoffPolicy::normalize).anyMatch(normalized::equals)) {
            return false;
        }
        if (handoffAllow == null || handoffAllow.isEmpty()) {
            return true;
        }
        return handoffAllow.stream().map(HandoffPolicy::normalize).anyMatch(normalized::equals);
    }

    public int effectiveMaxDepth() {
        return handoffMaxDepth > 0 ? handoffMaxDepth : DEFAULT_MAX_DEPTH;
    }

    private static String normalize(String handle) {
        String trimmed = handle == null ? "" : handle.trim();
        if (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
