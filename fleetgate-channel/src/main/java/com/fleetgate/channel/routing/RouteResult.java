package com.fleetgate.channel.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.model.PluginInstance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * HTTP answer for a webhook plus, for newly created work items, what the
 * inbound dispatcher needs to fan the item out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteResult {
    private int status;
    private ObjectNode body;

    private boolean created;
    private boolean duplicate;
    private String workItemId;
    private PluginInstance instance;
    private String sessionKey;
    private String senderName;
    private String messageText;
    private String command;
    private JsonNode responseContext;
    private InboundActor actor;

    static RouteResult error(int status, String message) {
        ObjectNode body = JsonMapper.object();
        body.put("error", message);
        return RouteResult.builder().status(status).body(body).build();
    }

    static RouteResult ignored(String reason) {
        ObjectNode body = JsonMapper.object();
        body.put("ignored", true);
        if (reason != null) {
            body.put("reason", reason);
        }
        return RouteResult.builder().status(200).body(body).build();
    }

    /** Whether the dispatcher should pick this result up. */
    public boolean shouldDispatch() {
        return created && workItemId != null;
    }
}
