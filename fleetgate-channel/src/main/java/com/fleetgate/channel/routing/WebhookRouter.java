package com.fleetgate.channel.routing;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.channel.adapter.PluginHandler;
import com.fleetgate.channel.adapter.WebhookParseResult;
import com.fleetgate.channel.adapter.WebhookRequest;
import com.fleetgate.channel.adapter.WorkItemDraft;
import com.fleetgate.channel.registry.PluginHandlerRegistry;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.plugin.runtime.CrashGuard;
import com.fleetgate.store.Database;
import com.fleetgate.store.PluginRepository;
import com.fleetgate.store.StoreException;
import com.fleetgate.store.WorkItemRepository;
import com.fleetgate.store.model.PluginEvent;
import com.fleetgate.store.model.PluginInstance;
import com.fleetgate.store.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for channel webhooks: resolves the plugin instance, lets its
 * handler verify and parse the request, and turns accepted events into
 * de-duplicated work items.
 */
@Slf4j
public class WebhookRouter {

    static final String EVENT_KIND = "ingress";
    static final String ACCEPTED = "accepted";
    static final String DUPLICATE = "duplicate";
    static final String SKIPPED = "skipped";
    static final String REJECTED = "rejected";

    private final Database database;
    private final PluginRepository plugins;
    private final WorkItemRepository workItems;
    private final PluginHandlerRegistry handlers;
    private final CrashGuard crashGuard;

    public WebhookRouter(Database database, PluginRepository plugins, WorkItemRepository workItems,
            PluginHandlerRegistry handlers, CrashGuard crashGuard) {
        this.database = database;
        this.plugins = plugins;
        this.workItems = workItems;
        this.handlers = handlers;
        this.crashGuard = crashGuard;
    }

    public RouteResult route(String pluginType, String pluginInstanceId, WebhookRequest request) {
        Optional<PluginInstance> found = plugins.findInstance(pluginInstanceId);
        if (found.isEmpty()) {
            return RouteResult.error(404, "Plugin instance not found");
        }
        PluginInstance instance = found.get();
        if (instance.getType() == null || !instance.getType().equalsIgnoreCase(pluginType)) {
            return RouteResult.error(400, "Plugin type mismatch");
        }
        Optional<PluginHandler> handler = handlers.get(pluginType);
        if (handler.isEmpty()) {
            return RouteResult.error(400, "No handler registered for plugin type " + pluginType);
        }

        String pluginId = instance.getPluginId();
        if (crashGuard.isDisabled(pluginId) || !plugins.isPluginEnabled(pluginId)) {
            recordEvent(instance, REJECTED, null, detail("plugin_disabled", null));
            return RouteResult.error(503, "Plugin is disabled");
        }

        WebhookParseResult parsed;
        try {
            parsed = handler.get().parseWebhook(request, instance);
        } catch (RuntimeException e) {
            boolean disabled = crashGuard.recordFailure(pluginId);
            log.error("Webhook parse failed for plugin {} instance {}{}", pluginId, instance.getId(),
                    disabled ? " (plugin disabled)" : "", e);
            recordEvent(instance, REJECTED, null, detail("handler_error", e.getMessage()));
            return RouteResult.error(500, "Webhook processing failed");
        }
        crashGuard.recordSuccess(pluginId);

        if (!parsed.isShouldProcess()) {
            return skipped(instance, parsed);
        }
        if (!instance.isEnabled()) {
            recordEvent(instance, SKIPPED, null, detail("instance_disabled", null));
            return RouteResult.ignored("instance_disabled");
        }
        WorkItemDraft draft = parsed.getWorkItem();
        if (draft == null) {
            recordEvent(instance, SKIPPED, null, detail("no_work_item", null));
            return RouteResult.ignored("no_work_item");
        }

        List<String> keys = parsed.normalizedIdempotencyKeys();
        Optional<String> existing = workItems.findWorkItemIdByIdempotencyKeys(keys);
        if (existing.isPresent()) {
            return duplicate(instance, parsed, existing.get());
        }

        WorkItem item = toWorkItem(instance, draft, parsed);
        Optional<String> conflict;
        try {
            conflict = database.transaction(conn -> {
                Optional<WorkItem> bySourceRef = workItems.findBySourceRef(conn, item.getSource(), item.getSourceRef());
                if (bySourceRef.isPresent()) {
                    return Optional.of(bySourceRef.get().getId());
                }
                workItems.create(conn, item);
                workItems.insertIdempotencyKeys(conn, item.getId(), keys);
                return Optional.<String>empty();
            });
        } catch (StoreException e) {
            // A concurrent delivery may have won the unique index.
            Optional<WorkItem> winner = workItems.findBySourceRef(item.getSource(), item.getSourceRef());
            if (winner.isEmpty()) {
                throw e;
            }
            conflict = Optional.of(winner.get().getId());
        }
        if (conflict.isPresent()) {
            return duplicate(instance, parsed, conflict.get());
        }

        recordEvent(instance, ACCEPTED, item.getId(), detail(null, null));
        log.info("Accepted {} webhook as work item {} ({})", instance.getType(), item.getId(), draft.getSourceRef());

        ObjectNode body = parsed.getImmediateResponse();
        int status = 200;
        if (body == null) {
            body = JsonMapper.object();
            body.put("created", true);
            body.put("workItemId", item.getId());
            status = 201;
        }
        InboundActor actor = draft.getActor() != null ? draft.getActor() : InboundActor.builder().build();
        return RouteResult.builder()
                .status(status)
                .body(body)
                .created(true)
                .workItemId(item.getId())
                .instance(instance)
                .sessionKey(draft.getSessionKey())
                .senderName(draft.getSenderName())
                .messageText(draft.getText())
                .command(parsed.getCommand())
                .responseContext(parsed.getResponseContext())
                .actor(actor)
                .build();
    }

    private RouteResult skipped(PluginInstance instance, WebhookParseResult parsed) {
        if (parsed.isAuthFailure()) {
            recordEvent(instance, REJECTED, null, detail(parsed.getReasonCode(), parsed.getReasonText()));
            log.warn("Rejected {} webhook for instance {}: {}", instance.getType(), instance.getId(),
                    parsed.getReasonCode());
            RouteResult result = RouteResult.error(401, "Unauthorized");
            result.getBody().put("reason", parsed.getReasonCode());
            return result;
        }
        if (parsed.getImmediateResponse() != null) {
            return RouteResult.builder().status(200).body(parsed.getImmediateResponse()).build();
        }
        recordEvent(instance, SKIPPED, null, detail(parsed.getReasonCode(), parsed.getReasonText()));
        log.debug("Skipped {} webhook for instance {}: {}", instance.getType(), instance.getId(),
                parsed.getReasonCode());
        return RouteResult.ignored(parsed.getReasonCode());
    }

    private RouteResult duplicate(PluginInstance instance, WebhookParseResult parsed, String workItemId) {
        recordEvent(instance, DUPLICATE, workItemId, detail(null, null));
        log.info("Duplicate {} delivery for work item {}", instance.getType(), workItemId);
        ObjectNode body = parsed.getImmediateResponse();
        if (body == null) {
            body = JsonMapper.object();
            body.put("duplicate", true);
            body.put("workItemId", workItemId);
        }
        return RouteResult.builder()
                .status(200)
                .body(body)
                .duplicate(true)
                .workItemId(workItemId)
                .instance(instance)
                .build();
    }

    private static WorkItem toWorkItem(PluginInstance instance, WorkItemDraft draft, WebhookParseResult parsed) {
        ObjectNode payload = draft.getPayload() != null ? draft.getPayload().deepCopy() : JsonMapper.object();
        if (parsed.getResponseContext() != null) {
            payload.set("responseContext", parsed.getResponseContext());
        }
        InboundActor actor = draft.getActor() != null ? draft.getActor() : InboundActor.builder().build();
        payload.set("actor", actor.toJson());
        if (parsed.getCommand() != null) {
            payload.put("command", parsed.getCommand());
        }
        return WorkItem.builder()
                .source(draft.getSource() != null ? draft.getSource() : instance.getType())
                .sourceRef(draft.getSourceRef())
                .pluginInstanceId(instance.getId())
                .sessionKey(draft.getSessionKey())
                .title(draft.getTitle())
                .payload(JsonMapper.write(payload))
                .build();
    }

    private void recordEvent(PluginInstance instance, String status, String workItemId, ObjectNode detail) {
        try {
            plugins.createEvent(PluginEvent.builder()
                    .pluginId(instance.getPluginId())
                    .pluginInstanceId(instance.getId())
                    .kind(EVENT_KIND)
                    .status(status)
                    .workItemId(workItemId)
                    .detail(JsonMapper.write(detail))
                    .build());
        } catch (StoreException e) {
            log.warn("Failed to record {} ingress event for instance {}: {}", status, instance.getId(), e.getMessage());
        }
    }

    private static ObjectNode detail(String reason, String message) {
        ObjectNode detail = JsonMapper.object();
        if (reason != null) {
            detail.put("reason", reason);
        }
        if (message != null) {
            detail.put("message", message);
        }
        return detail;
    }
}
