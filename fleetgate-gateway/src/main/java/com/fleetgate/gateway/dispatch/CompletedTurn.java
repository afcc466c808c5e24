package com.fleetgate.gateway.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.channel.adapter.PostResult;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.queue.LaneRun;
import com.fleetgate.store.model.AgentRecord;
import com.fleetgate.store.model.PluginInstance;
import com.fleetgate.store.model.WorkItem;

/**
 * An agent turn whose reply was posted to its channel.
 *
 * @param sourceItem the work item of the latest message in the run
 */
public record CompletedTurn(PluginInstance instance, AgentRecord agent, WorkItem sourceItem, LaneRun run,
        String content, PostResult post) {

    public String dispatchId() {
        return run.dispatchId();
    }

    public JsonNode responseContext() {
        String raw = run.latest().getResponseContext();
        return raw != null ? JsonMapper.read(raw) : null;
    }

    public JsonNode sourcePayload() {
        String raw = sourceItem.getPayload();
        return raw != null ? JsonMapper.read(raw) : JsonMapper.object();
    }
}
