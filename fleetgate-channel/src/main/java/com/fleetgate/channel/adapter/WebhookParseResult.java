package com.fleetgate.channel.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link PluginHandler#parseWebhook}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookParseResult {

    public static final String REASON_INVALID_SIGNATURE = "invalid_signature";
    public static final String REASON_STALE_REQUEST = "stale_request";
    public static final String REASON_MISSING_SECRET = "missing_secret";
    public static final String REASON_INVALID_CONFIG = "invalid_config";
    public static final String REASON_INVALID_JSON = "invalid_json";
    public static final String REASON_UNSUPPORTED_EVENT = "unsupported_event";
    public static final String REASON_EMPTY_TEXT = "empty_text";
    public static final String REASON_BOT_OR_SELF = "bot_or_self_message";
    public static final String REASON_NOT_ALLOWED = "not_allowed";
    public static final String REASON_POLICY_FILTERED = "inbound_policy_filtered";

    private boolean shouldProcess;
    private WorkItemDraft workItem;
    private String idempotencyKey;
    private List<String> idempotencyKeys;
    private JsonNode responseContext;
    private String command;
    /** Body the channel expects synchronously (URL challenge, interaction ack). */
    private ObjectNode immediateResponse;
    private String reasonCode;
    private String reasonText;

    public static WebhookParseResult skip(String reasonCode, String reasonText) {
        return WebhookParseResult.builder()
                .shouldProcess(false)
                .reasonCode(reasonCode)
                .reasonText(reasonText)
                .build();
    }

    public static WebhookParseResult respond(ObjectNode immediateResponse) {
        return WebhookParseResult.builder()
                .shouldProcess(false)
                .immediateResponse(immediateResponse)
                .build();
    }

    /** Signature, secret or timestamp check failed. */
    public boolean isAuthFailure() {
        return REASON_INVALID_SIGNATURE.equals(reasonCode) || REASON_STALE_REQUEST.equals(reasonCode);
    }

    /**
     * Trimmed, de-duplicated union of {@code idempotencyKey} and {@code idempotencyKeys}.
     */
    public List<String> normalizedIdempotencyKeys() {
        Set<String> keys = new LinkedHashSet<>();
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            keys.add(idempotencyKey.trim());
        }
        if (idempotencyKeys != null) {
            for (String key : idempotencyKeys) {
                if (key != null && !key.isBlank()) {
                    keys.add(key.trim());
                }
            }
        }
        return List.copyOf(keys);
    }
}
