package com.fleetgate.gateway.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.common.json.JsonMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * {@code agentRelay} section of a plugin instance config.
 */
@Data
@Slf4j
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentRelaySettings {

    public static final int DEFAULT_MAX_DEPTH = 12;
    public static final String DEFAULT_STOP_MARKER = "(stop)";

    private boolean enabled;
    private int maxRelayDepth = DEFAULT_MAX_DEPTH;
    /** A reply containing this marker is posted but not relayed. */
    private String relayStopMarker = DEFAULT_STOP_MARKER;

    public static AgentRelaySettings fromInstanceConfig(String configJson) {
        if (configJson == null || configJson.isBlank()) {
            return new AgentRelaySettings();
        }
        try {
            JsonNode section = JsonMapper.read(configJson).get("agentRelay");
            if (section == null || !section.isObject()) {
                return new AgentRelaySettings();
            }
            return JsonMapper.convert(section, AgentRelaySettings.class);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unreadable agentRelay settings: {}", e.getMessage());
            return new AgentRelaySettings();
        }
    }

    public boolean halts(String content) {
        return relayStopMarker != null && !relayStopMarker.isEmpty() && content.contains(relayStopMarker);
    }
}
