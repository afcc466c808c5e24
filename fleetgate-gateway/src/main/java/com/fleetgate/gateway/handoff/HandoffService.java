package com.fleetgate.gateway.handoff;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.dispatch.CompletedTurn;
import com.fleetgate.gateway.dispatch.SyntheticDispatch;
import com.fleetgate.gateway.dispatch.TurnListener;
import com.fleetgate.gateway.queue.QueueSettings;
import com.fleetgate.gateway.queue.QueueSettingsResolver;
import com.fleetgate.store.AgentRepository;
import com.fleetgate.store.model.AgentRecord;
import com.fleetgate.store.model.PluginInstance;
import com.fleetgate.store.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns explicit {@code @handle} requests in a posted reply into work for the
 * mentioned agents. Disabled unless the plugin instance enables
 * {@code agentMentionHandoffs}.
 */
@Slf4j
public class HandoffService implements TurnListener {

    public static final String SOURCE_TYPE = "inter_agent";

    private final AgentRepository agents;
    private final QueueSettingsResolver settingsResolver;
    private final SyntheticDispatch synthetic;
    private final HandoffIntentExtractor extractor;

    public HandoffService(AgentRepository agents, QueueSettingsResolver settingsResolver,
            SyntheticDispatch synthetic) {
        this(agents, settingsResolver, synthetic, new HandoffIntentExtractor());
    }

    public HandoffService(AgentRepository agents, QueueSettingsResolver settingsResolver,
            SyntheticDispatch synthetic, HandoffIntentExtractor extractor) {
        this.agents = agents;
        this.settingsResolver = settingsResolver;
        this.synthetic = synthetic;
        this.extractor = extractor;
    }

    @Override
    public void onReplyPosted(CompletedTurn turn) {
        handoff(turn);
    }

    /**
     * @return number of handoff work items created
     */
    public int handoff(CompletedTurn turn) {
        PluginInstance instance = turn.instance();
        HandoffPolicy policy = HandoffPolicy.fromInstanceConfig(instance.getConfig());
        if (!policy.isAgentMentionHandoffs()) {
            return 0;
        }
        JsonNode sourcePayload = turn.sourcePayload();
        int depth = sourcePayload.path("handoffDepth").asInt(0);
        if (depth >= policy.effectiveMaxDepth()) {
            log.info("Handoff depth {} reached on work item {}", depth, turn.sourceItem().getId());
            return 0;
        }

        AgentRecord origin = turn.agent();
        Map<String, AgentRecord> candidates = new LinkedHashMap<>();
        for (AgentRecord agent : agents.listForPluginInstance(instance.getId())) {
            if (!agent.getId().equals(origin.getId())) {
                candidates.put(agent.getHandle().toLowerCase(Locale.ROOT), agent);
            }
        }
        List<HandoffIntent> intents = extractor.extract(turn.content(),
                candidates.values().stream().map(AgentRecord::getHandle).toList());

        int created = 0;
        for (HandoffIntent intent : intents) {
            if (!intent.explicit()) {
                log.debug("Mention of @{} by @{} is not a handoff: {}", intent.handle(), origin.getHandle(),
                        intent.reason());
                continue;
            }
            if (!policy.allows(intent.handle())) {
                log.info("Handoff @{} -> @{} blocked by instance policy", origin.getHandle(), intent.handle());
                continue;
            }
            AgentRecord target = candidates.get(intent.handle().toLowerCase(Locale.ROOT));
            if (target == null) {
                continue;
            }
            WorkItem item = handoffItem(turn, target, intent, depth + 1);
            QueueSettings settings = settingsResolver.resolve(target.getConfig(), instance.getConfig());
            if (synthetic.create(item, List.of(new SyntheticDispatch.Target(target, settings)), turn.content(),
                    displayName(origin), turn.responseContext()).isPresent()) {
                created++;
                log.info("Handoff @{} -> @{} (depth={}) as work item {}", origin.getHandle(), target.getHandle(),
                        depth + 1, item.getId());
            }
        }
        return created;
    }

    static String sourceRef(String originHandle, String targetHandle, String workItemId) {
        return SOURCE_TYPE + ":" + originHandle + "->@" + targetHandle + ":" + workItemId;
    }

    private static WorkItem handoffItem(CompletedTurn turn, AgentRecord target, HandoffIntent intent, int depth) {
        AgentRecord origin = turn.agent();
        WorkItem source = turn.sourceItem();
        ObjectNode payload = JsonMapper.object();
        payload.put("body", turn.content());
        payload.put("source_type", SOURCE_TYPE);
        payload.put("triggered_by", origin.getHandle());
        payload.set("actor", InboundActor.agent(origin.getId(), origin.getHandle(), origin.getName()).toJson());
        payload.put("senderName", displayName(origin));
        payload.put("handoffDepth", depth);
        ObjectNode transfer = payload.putObject("transfer_intent");
        transfer.put("explicit", intent.explicit());
        transfer.put("reason", intent.reason());
        JsonNode responseContext = turn.responseContext();
        if (responseContext != null) {
            payload.set("responseContext", responseContext);
        }
        return WorkItem.builder()
                .source(source.getSource())
                .sourceRef(sourceRef(origin.getHandle(), target.getHandle(), source.getId()))
                .pluginInstanceId(source.getPluginInstanceId())
                .sessionKey(source.getSessionKey())
                .title("@" + origin.getHandle() + " handed off to @" + target.getHandle())
                .payload(JsonMapper.write(payload))
                .build();
    }

    static String displayName(AgentRecord agent) {
        return agent.getName() != null && !agent.getName().isBlank() ? agent.getName() : agent.getHandle();
    }
}
