package com.fleetgate.gateway.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.events.EventPublication;
import com.fleetgate.gateway.queue.Lanes;
import com.fleetgate.gateway.queue.QueueSettings;
import com.fleetgate.gateway.queue.SessionQueueManager;
import com.fleetgate.store.Database;
import com.fleetgate.store.QueueRepository;
import com.fleetgate.store.WorkItemRepository;
import com.fleetgate.store.model.AgentRecord;
import com.fleetgate.store.model.QueueMessage;
import com.fleetgate.store.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates a work item produced by an agent turn and enqueues it to its target lanes
 * in one transaction. A {@code source_ref} that already exists means the work was
 * produced before and nothing is written.
 */
@Slf4j
public class SyntheticDispatch {

    public record Target(AgentRecord agent, QueueSettings settings) {
    }

    private record Admission(QueueRepository.LaneEnqueue stored, QueueSettings settings) {
    }

    private final Database database;
    private final WorkItemRepository workItems;
    private final QueueRepository queues;
    private final SessionQueueManager queueManager;
    private final EventPublication publication;

    public SyntheticDispatch(Database database, WorkItemRepository workItems, QueueRepository queues,
            SessionQueueManager queueManager, EventPublication publication) {
        this.database = database;
        this.workItems = workItems;
        this.queues = queues;
        this.queueManager = queueManager;
        this.publication = publication;
    }

    /**
     * @return the created item, or empty when its {@code source_ref} already existed
     */
    public Optional<WorkItem> create(WorkItem item, List<Target> targets, String text, String senderName,
            JsonNode responseContext) {
        String context = responseContext != null ? JsonMapper.write(responseContext) : null;
        List<Admission> admissions = new ArrayList<>();
        boolean created = database.transaction(conn -> {
            if (workItems.findBySourceRef(conn, item.getSource(), item.getSourceRef()).isPresent()) {
                return false;
            }
            workItems.create(conn, item);
            for (Target target : targets) {
                QueueMessage message = QueueMessage.builder()
                        .workItemId(item.getId())
                        .pluginInstanceId(item.getPluginInstanceId())
                        .responseContext(context)
                        .text(text)
                        .senderName(senderName)
                        .arrivedAt(System.currentTimeMillis())
                        .build();
                QueueRepository.LaneEnqueue stored = queues.enqueueToLane(conn, Lanes.conversational(
                        item.getPluginInstanceId(), item.getSessionKey(), target.agent().getId(), target.settings()),
                        message);
                admissions.add(new Admission(stored, target.settings()));
            }
            return true;
        });
        if (!created) {
            log.info("Skipping {} {}: already produced", item.getSource(), item.getSourceRef());
            return Optional.empty();
        }
        for (Admission admission : admissions) {
            queueManager.accept(admission.stored().lane(), admission.stored().message(), admission.settings());
        }
        publication.publishCreated(item);
        return Optional.of(item);
    }
}
