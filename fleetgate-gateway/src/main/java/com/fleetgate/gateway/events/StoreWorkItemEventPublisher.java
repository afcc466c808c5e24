package com.fleetgate.gateway.events;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.WorkItemRepository;
import com.fleetgate.store.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends the envelope to {@code work_item_events}, where routine rules and
 * other consumers read it.
 */
@Slf4j
public class StoreWorkItemEventPublisher implements WorkItemEventPublisher {

    private final WorkItemRepository workItems;

    public StoreWorkItemEventPublisher(WorkItemRepository workItems) {
        this.workItems = workItems;
    }

    @Override
    public void publish(WorkItem item, String kind) {
        workItems.appendEvent(item.getId(), kind, JsonMapper.write(envelope(item, kind)));
        log.debug("Published {} for work item {}", kind, item.getId());
    }

    static ObjectNode envelope(WorkItem item, String kind) {
        ObjectNode envelope = JsonMapper.object();
        envelope.put("kind", kind);
        envelope.put("workItemId", item.getId());
        envelope.put("source", item.getSource());
        envelope.put("sourceRef", item.getSourceRef());
        envelope.put("sessionKey", item.getSessionKey());
        envelope.put("pluginInstanceId", item.getPluginInstanceId());
        envelope.put("title", item.getTitle());
        if (item.getPayload() != null) {
            envelope.set("payload", JsonMapper.read(item.getPayload()));
        }
        envelope.put("publishedAt", System.currentTimeMillis());
        return envelope;
    }
}
