package com.fleetgate.gateway.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.channel.adapter.ActorKind;
import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.channel.adapter.PluginHandler;
import com.fleetgate.channel.adapter.PostOptions;
import com.fleetgate.channel.adapter.PostResult;
import com.fleetgate.channel.registry.PluginHandlerRegistry;
import com.fleetgate.common.error.PluginRuntimeException;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.agent.AgentEvent;
import com.fleetgate.gateway.agent.AgentRunOptions;
import com.fleetgate.gateway.agent.AgentRunResult;
import com.fleetgate.gateway.agent.AgentRunner;
import com.fleetgate.gateway.agent.SteeringInbox;
import com.fleetgate.gateway.queue.LaneRun;
import com.fleetgate.gateway.queue.LaneRunHandler;
import com.fleetgate.gateway.queue.MessageCoalescer;
import com.fleetgate.plugin.runtime.CrashGuard;
import com.fleetgate.store.AgentRepository;
import com.fleetgate.store.PluginRepository;
import com.fleetgate.store.WorkItemRepository;
import com.fleetgate.store.model.AgentRecord;
import com.fleetgate.store.model.PluginInstance;
import com.fleetgate.store.model.QueueMessage;
import com.fleetgate.store.model.WorkItem;
import com.fleetgate.store.model.WorkItemStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs one lane dispatch: invokes the agent, posts its final response through the
 * channel handler and notifies turn listeners. Messages authored by the lane's own
 * agent are never handed back to it.
 */
@Slf4j
public class RunDispatcher implements LaneRunHandler {

    private final WorkItemRepository workItems;
    private final AgentRepository agents;
    private final PluginRepository plugins;
    private final PluginHandlerRegistry handlers;
    private final AgentRunner runner;
    private final CrashGuard crashGuard;
    private final List<TurnListener> listeners;
    private final ZoneId zone;

    public RunDispatcher(WorkItemRepository workItems, AgentRepository agents, PluginRepository plugins,
            PluginHandlerRegistry handlers, AgentRunner runner, CrashGuard crashGuard, List<TurnListener> listeners) {
        this(workItems, agents, plugins, handlers, runner, crashGuard, listeners, ZoneId.systemDefault());
    }

    public RunDispatcher(WorkItemRepository workItems, AgentRepository agents, PluginRepository plugins,
            PluginHandlerRegistry handlers, AgentRunner runner, CrashGuard crashGuard, List<TurnListener> listeners,
            ZoneId zone) {
        this.workItems = workItems;
        this.agents = agents;
        this.plugins = plugins;
        this.handlers = handlers;
        this.runner = runner;
        this.crashGuard = crashGuard;
        this.listeners = List.copyOf(listeners);
        this.zone = zone;
    }

    @Override
    public void runLane(LaneRun run) {
        String agentId = run.lane().getAgentId();
        Map<String, WorkItem> items = loadItems(run.messages());

        List<QueueMessage> eligible = new ArrayList<>();
        for (QueueMessage message : run.messages()) {
            WorkItem item = items.get(message.getWorkItemId());
            if (item != null && authoredBy(item, agentId)) {
                log.debug("Not routing {} back to its author {}", item.getId(), agentId);
                continue;
            }
            eligible.add(message);
        }
        if (eligible.isEmpty()) {
            log.warn("Dispatch {} on {} has no eligible messages", run.dispatchId(), run.lane().getQueueKey());
            return;
        }

        Optional<AgentRecord> agent = agents.findById(agentId);
        if (agent.isEmpty()) {
            log.warn("Agent {} no longer exists; failing dispatch {}", agentId, run.dispatchId());
            setStatus(eligible, WorkItemStatus.FAILED);
            return;
        }

        QueueMessage latest = eligible.get(eligible.size() - 1);
        String input = eligible.size() == run.messages().size()
                ? run.input() : MessageCoalescer.coalesce(eligible, zone);
        setStatus(eligible, WorkItemStatus.RUNNING);

        Consumer<AgentEvent> onEvent = event -> {
            log.debug("Run {} event: {}", run.dispatchId(), event.type());
            if (AgentEvent.STEER.equals(event.type())) {
                String steeredItem = event.data().path("workItemId").asText(null);
                if (steeredItem != null) {
                    workItems.updateStatus(steeredItem, WorkItemStatus.RUNNING);
                }
            }
        };
        run.steering().onOffer(onEvent);
        AgentRunResult result;
        try {
            result = runner.runAgent(agentId, latest.getWorkItemId(), AgentRunOptions.builder()
                    .input(input)
                    .sessionKey(run.lane().getSessionKey())
                    .dispatchId(run.dispatchId())
                    .onEvent(onEvent)
                    .steering(run.steering())
                    .build());
        } catch (RuntimeException e) {
            log.error("Agent {} failed on dispatch {}", agentId, run.dispatchId(), e);
            closeSteering(run.steering());
            setStatus(eligible, WorkItemStatus.FAILED);
            setSteeredStatus(run.steering(), WorkItemStatus.FAILED);
            return;
        }
        // Later arrivals wait for the next dispatch instead of this finished agent.
        closeSteering(run.steering());

        String content = result != null ? result.getFinalResponse() : null;
        PostResult post = null;
        Optional<PluginInstance> instance = instanceFor(latest, run);
        if (instance.isPresent() && content != null && !content.isBlank()) {
            post = deliver(instance.get(), latest, content, result.isHitLimit(), run.dispatchId());
        }
        setStatus(eligible, WorkItemStatus.DONE);
        setSteeredStatus(run.steering(), WorkItemStatus.DONE);

        WorkItem sourceItem = items.get(latest.getWorkItemId());
        if (post != null && post.isSuccess() && sourceItem != null) {
            CompletedTurn turn = new CompletedTurn(instance.get(), agent.get(), sourceItem, run, content, post);
            for (TurnListener listener : listeners) {
                try {
                    listener.onReplyPosted(turn);
                } catch (RuntimeException e) {
                    log.error("Turn listener failed after dispatch {}", run.dispatchId(), e);
                }
            }
        }
    }

    private PostResult deliver(PluginInstance instance, QueueMessage latest, String content, boolean hitLimit,
            String dispatchId) {
        Optional<PluginHandler> handler = handlers.get(instance.getType());
        if (handler.isEmpty()) {
            log.warn("No handler for {}; reply to dispatch {} not posted", instance.getType(), dispatchId);
            return null;
        }
        if (crashGuard.isDisabled(instance.getPluginId()) || !plugins.isPluginEnabled(instance.getPluginId())) {
            log.warn("Plugin {} is disabled; reply to dispatch {} not posted", instance.getPluginId(), dispatchId);
            return null;
        }
        JsonNode responseContext = latest.getResponseContext() != null
                ? JsonMapper.read(latest.getResponseContext()) : null;
        PostResult post;
        try {
            post = handler.get().postResponse(instance, latest.getWorkItemId(), content, responseContext,
                    PostOptions.builder().hitLimit(hitLimit).idempotencyKey(dispatchId).build());
        } catch (RuntimeException e) {
            PluginRuntimeException failure = new PluginRuntimeException(instance.getType(),
                    "Posting reply failed: " + e.getMessage(), e);
            log.error("Reply to dispatch {} on {} failed", dispatchId, instance.getId(), failure);
            post = PostResult.failed(e.getMessage(), false);
        }
        if (post.isSuccess()) {
            crashGuard.recordSuccess(instance.getPluginId());
        } else {
            log.warn("Reply to dispatch {} on {} not delivered: {}", dispatchId, instance.getId(), post.getError());
            if (crashGuard.recordFailure(instance.getPluginId())) {
                log.warn("Plugin {} is disabled after repeated failures", instance.getPluginId());
            }
        }
        try {
            handler.get().dismissReceipt(instance, responseContext);
        } catch (RuntimeException e) {
            log.debug("Dismissing receipt on {} failed: {}", instance.getId(), e.getMessage());
        }
        return post;
    }

    private Optional<PluginInstance> instanceFor(QueueMessage latest, LaneRun run) {
        String instanceId = latest.getPluginInstanceId() != null
                ? latest.getPluginInstanceId() : run.lane().getPluginInstanceId();
        return instanceId != null ? plugins.findInstance(instanceId) : Optional.empty();
    }

    private Map<String, WorkItem> loadItems(List<QueueMessage> messages) {
        Map<String, WorkItem> items = new LinkedHashMap<>();
        for (QueueMessage message : messages) {
            items.computeIfAbsent(message.getWorkItemId(), id -> workItems.findById(id).orElse(null));
        }
        return items;
    }

    private void setStatus(List<QueueMessage> messages, WorkItemStatus status) {
        messages.stream().map(QueueMessage::getWorkItemId).distinct()
                .forEach(id -> workItems.updateStatus(id, status));
    }

    /**
     * Refuse further steering. Messages the agent never read go back to {@code NEW}; the
     * queue manager returns them to the lane.
     */
    private void closeSteering(SteeringInbox steering) {
        steering.close();
        steering.unread().stream().map(SteeringInbox.SteeringMessage::workItemId).filter(Objects::nonNull)
                .distinct().forEach(id -> workItems.updateStatus(id, WorkItemStatus.NEW));
    }

    private void setSteeredStatus(SteeringInbox steering, WorkItemStatus status) {
        steering.consumed().stream().map(SteeringInbox.SteeringMessage::workItemId).filter(Objects::nonNull)
                .distinct().forEach(id -> workItems.updateStatus(id, status));
    }

    static boolean authoredBy(WorkItem item, String agentId) {
        if (item.getPayload() == null || agentId == null) {
            return false;
        }
        InboundActor actor = InboundActor.fromPayload(JsonMapper.read(item.getPayload()));
        return actor.getKind() == ActorKind.AGENT && agentId.equals(actor.getAgentId());
    }
}
