package com.fleetgate.gateway.dispatch;

import com.fleetgate.channel.adapter.ActorKind;
import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.channel.adapter.PluginHandler;
import com.fleetgate.channel.registry.PluginHandlerRegistry;
import com.fleetgate.channel.routing.RouteResult;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.queue.Lanes;
import com.fleetgate.gateway.queue.QueueSettings;
import com.fleetgate.gateway.queue.QueueSettingsResolver;
import com.fleetgate.gateway.queue.SessionQueueManager;
import com.fleetgate.store.AgentRepository;
import com.fleetgate.store.WorkItemRepository;
import com.fleetgate.store.model.AgentRecord;
import com.fleetgate.store.model.PluginInstance;
import com.fleetgate.store.model.QueueMessage;
import com.fleetgate.store.model.WorkItemStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fans a newly created inbound work item out to the agents of its plugin instance.
 * The authoring agent of an agent-originated item is never a target.
 */
@Slf4j
public class InboundDispatcher {

    public enum Outcome {
        ENQUEUED,
        NO_AGENTS,
        ORIGIN_ONLY,
        NOT_DISPATCHABLE
    }

    public record Result(Outcome outcome, List<String> queueKeys) {
    }

    private final AgentRepository agents;
    private final WorkItemRepository workItems;
    private final PluginHandlerRegistry handlers;
    private final SessionQueueManager queueManager;
    private final QueueSettingsResolver settingsResolver;

    public InboundDispatcher(AgentRepository agents, WorkItemRepository workItems, PluginHandlerRegistry handlers,
            SessionQueueManager queueManager, QueueSettingsResolver settingsResolver) {
        this.agents = agents;
        this.workItems = workItems;
        this.handlers = handlers;
        this.queueManager = queueManager;
        this.settingsResolver = settingsResolver;
    }

    public Result dispatch(RouteResult routed) {
        if (!routed.shouldDispatch() || routed.getInstance() == null) {
            return new Result(Outcome.NOT_DISPATCHABLE, List.of());
        }
        PluginInstance instance = routed.getInstance();
        String workItemId = routed.getWorkItemId();

        List<AgentRecord> assigned = agents.listForPluginInstance(instance.getId());
        if (assigned.isEmpty()) {
            log.warn("No agents assigned to plugin instance {}; work item {} failed", instance.getId(), workItemId);
            workItems.updateStatus(workItemId, WorkItemStatus.FAILED);
            return new Result(Outcome.NO_AGENTS, List.of());
        }

        String originAgentId = originAgentId(routed.getActor());
        List<AgentRecord> targets = assigned.stream()
                .filter(agent -> !agent.getId().equals(originAgentId))
                .toList();
        if (targets.isEmpty()) {
            log.info("Work item {} came from the only assigned agent {}; nothing to dispatch",
                    workItemId, originAgentId);
            workItems.updateStatus(workItemId, WorkItemStatus.DONE);
            return new Result(Outcome.ORIGIN_ONLY, List.of());
        }

        acknowledge(instance, routed);

        String responseContext = routed.getResponseContext() != null
                ? JsonMapper.write(routed.getResponseContext()) : null;
        long arrivedAt = System.currentTimeMillis();
        List<String> queueKeys = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            AgentRecord agent = targets.get(i);
            QueueSettings settings = settingsResolver.staggered(
                    settingsResolver.resolve(agent.getConfig(), instance.getConfig()), i);
            QueueMessage message = QueueMessage.builder()
                    .workItemId(workItemId)
                    .pluginInstanceId(instance.getId())
                    .responseContext(responseContext)
                    .text(routed.getMessageText())
                    .senderName(routed.getSenderName())
                    .arrivedAt(arrivedAt)
                    .build();
            queueManager.enqueue(Lanes.conversational(instance.getId(), routed.getSessionKey(), agent.getId(),
                    settings), message, settings);
            queueKeys.add(message.getQueueKey());
        }
        log.info("Enqueued work item {} for {} agent(s) on {}", workItemId, targets.size(), instance.getId());
        return new Result(Outcome.ENQUEUED, List.copyOf(queueKeys));
    }

    private void acknowledge(PluginInstance instance, RouteResult routed) {
        Optional<PluginHandler> handler = handlers.get(instance.getType());
        if (handler.isEmpty()) {
            return;
        }
        try {
            handler.get().acknowledgeReceipt(instance, routed.getResponseContext());
        } catch (RuntimeException e) {
            log.warn("Receipt acknowledgement failed on {}: {}", instance.getId(), e.getMessage());
        }
    }

    private static String originAgentId(InboundActor actor) {
        if (actor == null || actor.getKind() != ActorKind.AGENT) {
            return null;
        }
        return actor.getAgentId();
    }
}
