package com.fleetgate.gateway.events;

import com.fleetgate.common.infra.BackgroundTaskQueue;
import com.fleetgate.store.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands post-commit publishes to the background task queue.
 */
@Slf4j
public class EventPublication {

    private final WorkItemEventPublisher publisher;
    private final BackgroundTaskQueue tasks;

    public EventPublication(WorkItemEventPublisher publisher, BackgroundTaskQueue tasks) {
        this.publisher = publisher;
        this.tasks = tasks;
    }

    /**
     * Submit one publish of the created-item envelope.
     *
     * @return false when the task queue is full or closed; the item itself is unaffected
     */
    public boolean publishCreated(WorkItem item) {
        boolean submitted = tasks.submit("publish:" + item.getId(),
                () -> publisher.publish(item, WorkItemEventPublisher.KIND_CREATED));
        if (!submitted) {
            log.warn("Could not queue envelope publish for work item {}", item.getId());
        }
        return submitted;
    }
}
