package com.fleetgate.gateway.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.model.QueueMode;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves lane settings: agent {@code queue} override, then plugin instance
 * {@code queue} override, then the configured defaults.
 */
@Slf4j
public class QueueSettingsResolver {

    private final FleetConfig.QueueConfig defaults;

    public QueueSettingsResolver(FleetConfig.QueueConfig defaults) {
        this.defaults = defaults;
    }

    /**
     * @param agentConfig    agent config JSON text (may be null)
     * @param instanceConfig plugin instance config JSON text (may be null)
     */
    public QueueSettings resolve(String agentConfig, String instanceConfig) {
        JsonNode agentQueue = queueSection(agentConfig);
        JsonNode instanceQueue = queueSection(instanceConfig);

        QueueMode mode = firstMode(agentQueue, instanceQueue);
        long debounceMs = firstNonNegativeLong("debounceMs", agentQueue, instanceQueue, defaults.getDebounceMs());
        long maxQueued = firstPositiveLong("maxQueued", agentQueue, instanceQueue, defaults.getMaxQueued());
        long maxWait = firstNonNegativeLong("maxDebounceWaitMs", agentQueue, instanceQueue,
                defaults.getMaxDebounceWaitMs());
        String overflow = firstText("overflowPolicy", agentQueue, instanceQueue, defaults.getOverflowPolicy());

        return new QueueSettings(mode, debounceMs, (int) Math.min(Integer.MAX_VALUE, maxQueued), maxWait,
                OverflowPolicy.parse(overflow));
    }

    /**
     * Settings for the {@code index}-th agent of a fan-out: debounce grows by
     * {@code index * agentStaggerMs} so agents answer one after another.
     */
    public QueueSettings staggered(QueueSettings base, int index) {
        if (index <= 0) {
            return base;
        }
        return base.withDebounceMs(base.debounceMs() + index * defaults.getAgentStaggerMs());
    }

    /**
     * Timer lanes: strictly serial, no debounce, one message per dispatch. Fired timers
     * are never shed, so the overflow policy has no effect on these lanes.
     */
    public QueueSettings schedulerSettings() {
        return new QueueSettings(QueueMode.FOLLOWUP, 0, 1, defaults.getMaxDebounceWaitMs(),
                OverflowPolicy.parse(defaults.getOverflowPolicy()));
    }

    private QueueMode firstMode(JsonNode agentQueue, JsonNode instanceQueue) {
        for (JsonNode section : new JsonNode[]{agentQueue, instanceQueue}) {
            String raw = JsonMapper.text(section, "mode");
            if (raw != null) {
                QueueMode mode = QueueMode.parse(raw);
                if (mode != null) {
                    return mode;
                }
                log.warn("Ignoring unknown queue mode '{}'", raw);
            }
        }
        QueueMode fallback = QueueMode.parse(defaults.getMode());
        return fallback != null ? fallback : QueueMode.STEER;
    }

    private static long firstNonNegativeLong(String field, JsonNode agentQueue, JsonNode instanceQueue, long fallback) {
        for (JsonNode section : new JsonNode[]{agentQueue, instanceQueue}) {
            JsonNode value = section != null ? section.get(field) : null;
            if (value != null && value.isNumber() && value.asLong() >= 0) {
                return value.asLong();
            }
        }
        return fallback;
    }

    private static long firstPositiveLong(String field, JsonNode agentQueue, JsonNode instanceQueue, long fallback) {
        for (JsonNode section : new JsonNode[]{agentQueue, instanceQueue}) {
            JsonNode value = section != null ? section.get(field) : null;
            if (value != null && value.isNumber() && value.asLong() > 0) {
                return value.asLong();
            }
        }
        return fallback;
    }

    private static String firstText(String field, JsonNode agentQueue, JsonNode instanceQueue, String fallback) {
        String agentValue = JsonMapper.text(agentQueue, field);
        if (agentValue != null) {
            return agentValue;
        }
        String instanceValue = JsonMapper.text(instanceQueue, field);
        return instanceValue != null ? instanceValue : fallback;
    }

    private static JsonNode queueSection(String configJson) {
        if (configJson == null || configJson.isBlank()) {
            return null;
        }
        try {
            JsonNode queue = JsonMapper.read(configJson).get("queue");
            return queue != null && queue.isObject() ? queue : null;
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unparseable config while resolving queue settings: {}", e.getMessage());
            return null;
        }
    }
}
