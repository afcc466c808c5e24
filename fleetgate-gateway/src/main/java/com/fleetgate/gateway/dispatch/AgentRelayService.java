package com.fleetgate.gateway.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.queue.QueueSettingsResolver;
import com.fleetgate.store.AgentRepository;
import com.fleetgate.store.model.AgentRecord;
import com.fleetgate.store.model.PluginInstance;
import com.fleetgate.store.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Public agent relay: a reply an agent posted to a shared channel is handed to the
 * other agents of the instance, so agents can hold a conversation. Bounded by
 * relay depth and stopped by the stop marker.
 */
@Slf4j
public class AgentRelayService implements TurnListener {

    public static final String SOURCE_TYPE = "agent_public_relay";
    public static final String SOURCE_REF_PREFIX = "agent_relay:";

    private final AgentRepository agents;
    private final QueueSettingsResolver settingsResolver;
    private final SyntheticDispatch synthetic;

    public AgentRelayService(AgentRepository agents, QueueSettingsResolver settingsResolver,
            SyntheticDispatch synthetic) {
        this.agents = agents;
        this.settingsResolver = settingsResolver;
        this.synthetic = synthetic;
    }

    @Override
    public void onReplyPosted(CompletedTurn turn) {
        relay(turn);
    }

    /**
     * @return whether a relay work item was created
     */
    public boolean relay(CompletedTurn turn) {
        PluginInstance instance = turn.instance();
        AgentRelaySettings settings = AgentRelaySettings.fromInstanceConfig(instance.getConfig());
        if (!settings.isEnabled() || !"sent".equals(turn.post().getOutcome())) {
            return false;
        }
        String content = turn.content();
        if (content == null || content.isBlank()) {
            return false;
        }
        if (settings.halts(content)) {
            log.info("Relay stopped by marker after dispatch {}", turn.dispatchId());
            return false;
        }
        int depth = turn.sourcePayload().path("relayDepth").asInt(0);
        if (depth >= settings.getMaxRelayDepth()) {
            log.info("Relay depth {} reached after dispatch {}", depth, turn.dispatchId());
            return false;
        }

        AgentRecord origin = turn.agent();
        List<SyntheticDispatch.Target> targets = new ArrayList<>();
        for (AgentRecord agent : agents.listForPluginInstance(instance.getId())) {
            if (agent.getId().equals(origin.getId())) {
                continue;
            }
            targets.add(new SyntheticDispatch.Target(agent, settingsResolver.staggered(
                    settingsResolver.resolve(agent.getConfig(), instance.getConfig()), targets.size())));
        }
        if (targets.isEmpty()) {
            return false;
        }

        WorkItem item = relayItem(turn, depth + 1);
        boolean created = synthetic.create(item, targets, content, senderName(origin), turn.responseContext())
                .isPresent();
        if (created) {
            log.info("Relayed reply of @{} to {} agent(s) (depth={})", origin.getHandle(), targets.size(),
                    depth + 1);
        }
        return created;
    }

    private static WorkItem relayItem(CompletedTurn turn, int depth) {
        AgentRecord origin = turn.agent();
        WorkItem source = turn.sourceItem();
        ObjectNode payload = JsonMapper.object();
        payload.put("body", turn.content());
        payload.put("source_type", SOURCE_TYPE);
        payload.put("relayDepth", depth);
        payload.put("relayFromWorkItemId", source.getId());
        payload.set("actor", InboundActor.agent(origin.getId(), origin.getHandle(), origin.getName()).toJson());
        payload.put("senderName", senderName(origin));
        JsonNode responseContext = turn.responseContext();
        if (responseContext != null) {
            payload.set("responseContext", responseContext);
        }
        return WorkItem.builder()
                .source(source.getSource())
                .sourceRef(SOURCE_REF_PREFIX + turn.dispatchId())
                .pluginInstanceId(source.getPluginInstanceId())
                .sessionKey(source.getSessionKey())
                .title("@" + origin.getHandle() + " replied")
                .payload(JsonMapper.write(payload))
                .build();
    }

    private static String senderName(AgentRecord agent) {
        return agent.getName() != null && !agent.getName().isBlank() ? agent.getName() : agent.getHandle();
    }
}
