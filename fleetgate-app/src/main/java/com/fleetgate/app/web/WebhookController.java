package com.fleetgate.app.web;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.channel.adapter.WebhookRequest;
import com.fleetgate.channel.routing.RouteResult;
import com.fleetgate.channel.routing.WebhookRouter;
import com.fleetgate.gateway.dispatch.InboundDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Channel webhook ingress. The body is read as raw bytes so signature checks see exactly
 * what the provider signed.
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

    private final WebhookRouter router;
    private final InboundDispatcher dispatcher;

    public WebhookController(WebhookRouter router, InboundDispatcher dispatcher) {
        this.router = router;
        this.dispatcher = dispatcher;
    }

    @PostMapping("/plugins/{type}/{instanceId}")
    public ResponseEntity<ObjectNode> receive(
            @PathVariable String type,
            @PathVariable String instanceId,
            @RequestHeader Map<String, String> headers,
            @RequestBody(required = false) byte[] body) {
        String raw = body != null ? new String(body, StandardCharsets.UTF_8) : "";
        RouteResult result = router.route(type, instanceId, new WebhookRequest(headers, raw));
        if (result.shouldDispatch()) {
            try {
                InboundDispatcher.Result dispatched = dispatcher.dispatch(result);
                log.debug("Work item {} dispatch outcome: {}", result.getWorkItemId(), dispatched.outcome());
            } catch (RuntimeException e) {
                // The work item is committed; answering with an error would only make the provider redeliver.
                log.error("Failed to dispatch work item {}", result.getWorkItemId(), e);
            }
        }
        return ResponseEntity.status(result.getStatus()).body(result.getBody());
    }
}
