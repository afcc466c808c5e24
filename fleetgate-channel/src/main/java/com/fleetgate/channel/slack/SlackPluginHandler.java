package com.fleetgate.channel.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.channel.adapter.ActorKind;
import com.fleetgate.channel.adapter.ConfigValidation;
import com.fleetgate.channel.adapter.HttpPluginHandler;
import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.channel.adapter.PostOptions;
import com.fleetgate.channel.adapter.PostResult;
import com.fleetgate.channel.adapter.WebhookParseResult;
import com.fleetgate.channel.adapter.WebhookRequest;
import com.fleetgate.channel.adapter.WorkItemDraft;
import com.fleetgate.channel.security.WebhookSignatures;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.model.PluginInstance;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slack Events API integration.
 */
@Slf4j
public class SlackPluginHandler extends HttpPluginHandler {

    public static final String TYPE = "slack";
    static final String SIGNATURE_HEADER = "X-Slack-Signature";
    static final String TIMESTAMP_HEADER = "X-Slack-Request-Timestamp";

    private static final Set<String> IGNORED_SUBTYPES = Set.of("bot_message", "message_changed", "message_deleted");
    private static final Pattern COMMAND = Pattern.compile("^/(\\w+)");

    public SlackPluginHandler() {
        this(defaultClient(), "https://slack.com/api", Clock.systemUTC());
    }

    public SlackPluginHandler(OkHttpClient httpClient, String apiBaseUrl, Clock clock) {
        super(httpClient, apiBaseUrl, clock);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<String> sensitiveFields() {
        return List.of("botToken", "signingSecret");
    }

    @Override
    public ConfigValidation validateConfig(JsonNode config) {
        SlackConfig cfg = JsonMapper.convert(config, SlackConfig.class);
        List<String> errors = new ArrayList<>();
        if (isBlank(cfg.getBotToken())) {
            errors.add("botToken is required");
        }
        if (isBlank(cfg.getSigningSecret())) {
            errors.add("signingSecret is required");
        }
        String policy = cfg.getInboundPolicy();
        if (policy != null && !policy.equals("mentions") && !policy.equals("all")) {
            errors.add("inboundPolicy must be 'mentions' or 'all'");
        }
        return ConfigValidation.of(errors);
    }

    @Override
    public WebhookParseResult parseWebhook(WebhookRequest request, PluginInstance instance) {
        SlackConfig cfg = bindConfig(instance, SlackConfig.class);
        if (isBlank(cfg.getSigningSecret())) {
            return WebhookParseResult.skip("missing_signing_secret", "signingSecret is not configured");
        }
        WebhookSignatures.Verdict verdict = WebhookSignatures.verifySlack(cfg.getSigningSecret(),
                request.header(TIMESTAMP_HEADER), request.getBody(), request.header(SIGNATURE_HEADER), clock);
        if (verdict == WebhookSignatures.Verdict.STALE) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_STALE_REQUEST, "Request timestamp outside window");
        }
        if (verdict != WebhookSignatures.Verdict.VALID) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_INVALID_SIGNATURE, "Slack signature mismatch");
        }

        JsonNode envelope;
        try {
            envelope = JsonMapper.read(request.getBody());
        } catch (IllegalArgumentException e) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_INVALID_JSON, "Body is not JSON");
        }

        if ("url_verification".equals(JsonMapper.text(envelope, "type"))) {
            ObjectNode challenge = JsonMapper.object();
            challenge.put("challenge", envelope.path("challenge").asText());
            return WebhookParseResult.respond(challenge);
        }

        JsonNode event = envelope.path("event");
        String eventType = JsonMapper.text(event, "type");
        if (!"event_callback".equals(JsonMapper.text(envelope, "type"))
                || !("message".equals(eventType) || "app_mention".equals(eventType))) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_UNSUPPORTED_EVENT, "Unsupported Slack event");
        }

        String text = JsonMapper.text(event, "text");
        if (isBlank(text)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_EMPTY_TEXT, "Message has no text");
        }
        String user = JsonMapper.text(event, "user");
        String subtype = JsonMapper.text(event, "subtype");
        if (event.hasNonNull("bot_id")
                || (subtype != null && IGNORED_SUBTYPES.contains(subtype))
                || (user != null && user.equals(cfg.getBotUserId()))) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_BOT_OR_SELF, "Bot or self message");
        }

        String channel = JsonMapper.text(event, "channel");
        if (!cfg.getAllowedChannels().isEmpty() && !cfg.getAllowedChannels().contains(channel)) {
            return WebhookParseResult.skip("disallowed_channel", "Channel " + channel + " not allowed");
        }
        String channelType = JsonMapper.text(event, "channel_type");
        if (!passesInboundPolicy(cfg, eventType, channelType, text)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_POLICY_FILTERED, "Not addressed to the bot");
        }

        String ts = JsonMapper.text(event, "ts");
        String threadTs = event.hasNonNull("thread_ts") ? event.get("thread_ts").asText() : ts;
        String teamId = JsonMapper.text(envelope, "team_id");
        String senderName = user != null ? user : "unknown";

        InboundActor actor = InboundActor.builder()
                .kind(ActorKind.HUMAN)
                .externalId(user)
                .handle(user)
                .displayName(senderName)
                .source(TYPE)
                .build();

        ObjectNode payload = JsonMapper.object();
        payload.put("body", text);
        payload.put("senderName", senderName);
        payload.put("channel", channel);
        payload.put("ts", ts);
        payload.put("threadTs", threadTs);

        ObjectNode responseContext = JsonMapper.object();
        responseContext.put("channel", channel);
        responseContext.put("threadTs", threadTs);
        responseContext.put("messageTs", ts);
        responseContext.put("channelType", channelType);
        responseContext.put("teamId", teamId);
        responseContext.put("eventType", eventType);

        List<String> keys = new ArrayList<>();
        keys.add("slack:v1:msg:" + (teamId != null ? teamId : "unknown") + ":" + channel + ":" + ts);
        String eventId = JsonMapper.text(envelope, "event_id");
        if (eventId != null) {
            keys.add("slack:event:" + eventId);
        }

        return WebhookParseResult.builder()
                .shouldProcess(true)
                .workItem(WorkItemDraft.builder()
                        .source(TYPE)
                        .sourceRef("slack:" + channel + ":" + ts)
                        .sessionKey("slack:" + channel + ":" + threadTs)
                        .title(truncate(text, 120))
                        .payload(payload)
                        .actor(actor)
                        .build())
                .idempotencyKeys(keys)
                .responseContext(responseContext)
                .command(command(text, cfg.getBotUserId()))
                .build();
    }

    @Override
    public PostResult postResponse(PluginInstance instance, String workItemId, String content,
            JsonNode responseContext, PostOptions options) {
        SlackConfig cfg = bindConfig(instance, SlackConfig.class);
        if (isBlank(cfg.getBotToken())) {
            return PostResult.failed("botToken is not configured", false);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", JsonMapper.text(responseContext, "channel"));
        body.put("text", withLimitNotice(content, options));
        String threadTs = JsonMapper.text(responseContext, "threadTs");
        if (threadTs != null) {
            body.put("thread_ts", threadTs);
        }
        try {
            ApiResponse response = postJson(apiBaseUrl + "/chat.postMessage", auth(cfg), body);
            if (!response.ok()) {
                return PostResult.failed("Slack error " + response.status(), PostResult.isRetryableStatus(response.status()));
            }
            if (!response.body().path("ok").asBoolean(false)) {
                String error = response.body().path("error").asText("unknown_error");
                log.error("Slack chat.postMessage rejected: {}", error);
                return PostResult.failed(error, "ratelimited".equals(error));
            }
            return PostResult.sent(response.body().path("ts").asText(null));
        } catch (IOException e) {
            log.error("Slack chat.postMessage failed: {}", e.getMessage());
            return PostResult.failed(e.getMessage(), true);
        }
    }

    @Override
    public void acknowledgeReceipt(PluginInstance instance, JsonNode responseContext) {
        reaction(instance, responseContext, "reactions.add");
    }

    @Override
    public void dismissReceipt(PluginInstance instance, JsonNode responseContext) {
        reaction(instance, responseContext, "reactions.remove");
    }

    @Override
    public ConfigValidation testConnection(JsonNode config) {
        ConfigValidation validation = validateConfig(config);
        if (!validation.valid()) {
            return validation;
        }
        SlackConfig cfg = JsonMapper.convert(config, SlackConfig.class);
        try {
            ApiResponse response = postJson(apiBaseUrl + "/auth.test", auth(cfg), Map.of());
            if (response.ok() && response.body().path("ok").asBoolean(false)) {
                return ConfigValidation.ok();
            }
            return ConfigValidation.invalid(List.of("auth.test failed: " + response.body().path("error").asText(
                    String.valueOf(response.status()))));
        } catch (IOException e) {
            return ConfigValidation.invalid(List.of("auth.test failed: " + e.getMessage()));
        }
    }

    private void reaction(PluginInstance instance, JsonNode responseContext, String method) {
        SlackConfig cfg = bindConfig(instance, SlackConfig.class);
        String channel = JsonMapper.text(responseContext, "channel");
        String ts = JsonMapper.text(responseContext, "messageTs");
        if (isBlank(cfg.getBotToken()) || isBlank(cfg.getAckReaction()) || channel == null || ts == null) {
            return;
        }
        try {
            ApiResponse response = postJson(apiBaseUrl + "/" + method, auth(cfg),
                    Map.of("channel", channel, "timestamp", ts, "name", cfg.getAckReaction()));
            if (!response.body().path("ok").asBoolean(false)) {
                log.debug("Slack {} rejected: {}", method, response.body().path("error").asText());
            }
        } catch (IOException e) {
            log.debug("Slack {} failed: {}", method, e.getMessage());
        }
    }

    private static Map<String, String> auth(SlackConfig cfg) {
        return Map.of("Authorization", "Bearer " + cfg.getBotToken());
    }

    static boolean passesInboundPolicy(SlackConfig cfg, String eventType, String channelType, String text) {
        if ("all".equals(cfg.getInboundPolicy())) {
            return true;
        }
        if ("im".equals(channelType) || "app_mention".equals(eventType)) {
            return true;
        }
        return cfg.getBotUserId() != null && text.contains("<@" + cfg.getBotUserId() + ">");
    }

    static String command(String text, String botUserId) {
        String stripped = text.strip();
        if (botUserId != null) {
            String mention = "<@" + botUserId + ">";
            if (stripped.startsWith(mention)) {
                stripped = stripped.substring(mention.length()).strip();
            }
        }
        Matcher matcher = COMMAND.matcher(stripped);
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }
}
