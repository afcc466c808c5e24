package com.fleetgate.gateway.queue;

import com.fleetgate.store.model.QueueLaneRecord;

/**
 * Lane records for the two lane namespaces.
 */
public final class Lanes {

    private Lanes() {
    }

    public static QueueLaneRecord conversational(String pluginInstanceId, String sessionKey, String agentId,
            QueueSettings settings) {
        return QueueLaneRecord.builder()
                .queueKey(QueueKeys.conversational(pluginInstanceId, sessionKey, agentId))
                .sessionKey(sessionKey)
                .agentId(agentId)
                .pluginInstanceId(pluginInstanceId)
                .mode(settings.mode())
                .debounceMs(settings.debounceMs())
                .maxQueued(settings.maxQueued())
                .build();
    }

    public static QueueLaneRecord scheduler(String sessionKey, String agentId, String pluginInstanceId,
            QueueSettings settings) {
        return QueueLaneRecord.builder()
                .queueKey(QueueKeys.scheduler(sessionKey, agentId))
                .sessionKey(sessionKey)
                .agentId(agentId)
                .pluginInstanceId(pluginInstanceId)
                .mode(settings.mode())
                .debounceMs(settings.debounceMs())
                .maxQueued(settings.maxQueued())
                .build();
    }
}
