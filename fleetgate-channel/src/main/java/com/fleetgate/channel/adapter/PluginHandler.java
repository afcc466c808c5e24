package com.fleetgate.channel.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.store.model.PluginInstance;

import java.util.List;

/**
 * Channel integration: parses inbound webhooks into work items and posts agent
 * replies back. One implementation per channel type.
 */
public interface PluginHandler {

    /** Channel type, matched against the webhook path (e.g. "telegram"). */
    String type();

    /** Config fields that must never be logged or echoed back. */
    default List<String> sensitiveFields() {
        return List.of();
    }

    ConfigValidation validateConfig(JsonNode config);

    /**
     * Verify and parse an inbound webhook. Expected rejections are returned as
     * {@code shouldProcess=false} results; only unexpected failures throw.
     */
    WebhookParseResult parseWebhook(WebhookRequest request, PluginInstance instance);

    PostResult postResponse(PluginInstance instance, String workItemId, String content,
            JsonNode responseContext, PostOptions options);

    /** Show a presence indicator (typing, reaction) for a received message. */
    default void acknowledgeReceipt(PluginInstance instance, JsonNode responseContext) {
    }

    /** Clear the presence indicator shown by {@link #acknowledgeReceipt}. */
    default void dismissReceipt(PluginInstance instance, JsonNode responseContext) {
    }

    /** Check credentials against the provider; defaults to static validation. */
    default ConfigValidation testConnection(JsonNode config) {
        return validateConfig(config);
    }
}
