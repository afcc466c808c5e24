package com.fleetgate.channel.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.common.json.JsonMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Actor envelope carried in every work item payload under {@code actor}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundActor {

    @Builder.Default
    private ActorKind kind = ActorKind.HUMAN;
    private String externalId;
    private String handle;
    private String displayName;
    /** Set when the actor is one of our agents. */
    private String agentId;
    private String source;

    public static InboundActor agent(String agentId, String handle, String displayName) {
        return InboundActor.builder()
                .kind(ActorKind.AGENT)
                .agentId(agentId)
                .handle(handle)
                .displayName(displayName)
                .source("agent")
                .build();
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonMapper.object();
        node.put("kind", kind.wireValue());
        putIfPresent(node, "externalId", externalId);
        putIfPresent(node, "handle", handle);
        putIfPresent(node, "displayName", displayName);
        putIfPresent(node, "agentId", agentId);
        putIfPresent(node, "source", source);
        return node;
    }

    /**
     * Read the envelope from a work item payload; a missing envelope yields a human actor.
     */
    public static InboundActor fromPayload(JsonNode payload) {
        JsonNode actor = payload != null ? payload.get("actor") : null;
        if (actor == null || !actor.isObject()) {
            return InboundActor.builder().build();
        }
        return InboundActor.builder()
                .kind(ActorKind.parse(JsonMapper.text(actor, "kind")))
                .externalId(JsonMapper.text(actor, "externalId"))
                .handle(JsonMapper.text(actor, "handle"))
                .displayName(JsonMapper.text(actor, "displayName"))
                .agentId(JsonMapper.text(actor, "agentId"))
                .source(JsonMapper.text(actor, "source"))
                .build();
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
