package com.fleetgate.channel.adapter;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Channel-neutral work item produced by a handler, before it is stored.
 * The payload carries at least {@code body}, {@code senderName} and {@code actor}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkItemDraft {
    private String source;
    private String sourceRef;
    private String sessionKey;
    private String title;
    private ObjectNode payload;
    private InboundActor actor;

    public String getText() {
        return payload != null && payload.hasNonNull("body") ? payload.get("body").asText() : "";
    }

    public String getSenderName() {
        return payload != null && payload.hasNonNull("senderName") ? payload.get("senderName").asText() : null;
    }
}
