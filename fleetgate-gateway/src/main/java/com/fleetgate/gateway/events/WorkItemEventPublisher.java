package com.fleetgate.gateway.events;

import com.fleetgate.store.model.WorkItem;

/**
 * Downstream sink for work item envelopes (routine triggers, audit consumers).
 * Publishing happens after commit and is best effort.
 */
@FunctionalInterface
public interface WorkItemEventPublisher {

    String KIND_CREATED = "work_item.created";

    void publish(WorkItem item, String kind) throws Exception;
}
