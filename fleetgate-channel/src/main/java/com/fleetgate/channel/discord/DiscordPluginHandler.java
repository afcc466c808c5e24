package com.fleetgate.channel.discord;

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
import java.util.Map;

/**
 * Discord integration. Accepts signed interactions (slash commands) and signed
 * {@code MESSAGE_CREATE} payloads forwarded by a gateway bridge.
 */
@Slf4j
public class DiscordPluginHandler extends HttpPluginHandler {

    public static final String TYPE = "discord";
    static final String SIGNATURE_HEADER = "X-Signature-Ed25519";
    static final String TIMESTAMP_HEADER = "X-Signature-Timestamp";
    static final int MAX_MESSAGE_LENGTH = 2000;

    // Interaction types
    static final int PING = 1;
    static final int APPLICATION_COMMAND = 2;
    static final int MESSAGE_COMPONENT = 3;

    // Interaction callback types
    static final int PONG = 1;
    static final int CHANNEL_MESSAGE = 4;
    static final int DEFERRED_CHANNEL_MESSAGE = 5;
    static final int DEFERRED_UPDATE_MESSAGE = 6;
    static final int EPHEMERAL = 64;

    public DiscordPluginHandler() {
        this(defaultClient(), "https://discord.com/api/v10", Clock.systemUTC());
    }

    public DiscordPluginHandler(OkHttpClient httpClient, String apiBaseUrl, Clock clock) {
        super(httpClient, apiBaseUrl, clock);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<String> sensitiveFields() {
        return List.of("botToken");
    }

    @Override
    public ConfigValidation validateConfig(JsonNode config) {
        DiscordConfig cfg = JsonMapper.convert(config, DiscordConfig.class);
        List<String> errors = new ArrayList<>();
        if (isBlank(cfg.getApplicationId())) {
            errors.add("applicationId is required");
        }
        if (isBlank(cfg.getPublicKey()) || !cfg.getPublicKey().trim().matches("[0-9a-fA-F]{64}")) {
            errors.add("publicKey must be a 64-character hex string");
        }
        return ConfigValidation.of(errors);
    }

    @Override
    public WebhookParseResult parseWebhook(WebhookRequest request, PluginInstance instance) {
        DiscordConfig cfg = bindConfig(instance, DiscordConfig.class);
        if (isBlank(cfg.getPublicKey())) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_MISSING_SECRET, "publicKey is not configured");
        }
        WebhookSignatures.Verdict verdict = WebhookSignatures.verifyDiscord(cfg.getPublicKey(),
                request.header(TIMESTAMP_HEADER), request.getBody(), request.header(SIGNATURE_HEADER), clock);
        if (verdict == WebhookSignatures.Verdict.STALE) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_STALE_REQUEST, "Request timestamp outside window");
        }
        if (verdict != WebhookSignatures.Verdict.VALID) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_INVALID_SIGNATURE, "Discord signature mismatch");
        }

        JsonNode body;
        try {
            body = JsonMapper.read(request.getBody());
        } catch (IllegalArgumentException e) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_INVALID_JSON, "Body is not JSON");
        }

        if (isForwardedMessage(body)) {
            return parseForwardedMessage(body.has("d") ? body.get("d") : body, cfg);
        }

        int type = body.path("type").asInt(-1);
        return switch (type) {
            case PING -> WebhookParseResult.respond(callback(PONG));
            case MESSAGE_COMPONENT -> WebhookParseResult.respond(callback(DEFERRED_UPDATE_MESSAGE));
            case APPLICATION_COMMAND -> parseCommand(body, cfg);
            default -> {
                ObjectNode unsupported = callback(CHANNEL_MESSAGE);
                ObjectNode data = unsupported.putObject("data");
                data.put("content", "Unsupported interaction type.");
                data.put("flags", EPHEMERAL);
                yield WebhookParseResult.respond(unsupported);
            }
        };
    }

    private WebhookParseResult parseCommand(JsonNode interaction, DiscordConfig cfg) {
        String interactionId = JsonMapper.text(interaction, "id");
        String channelId = JsonMapper.text(interaction, "channel_id");
        String guildId = interaction.hasNonNull("guild_id") ? interaction.get("guild_id").asText() : "dm";
        if (!cfg.getAllowedChannelIds().isEmpty() && !cfg.getAllowedChannelIds().contains(channelId)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_NOT_ALLOWED, "Channel " + channelId + " not allowed");
        }
        JsonNode data = interaction.path("data");
        String commandName = JsonMapper.text(data, "name");
        String text = commandText(commandName, data.path("options"));

        JsonNode member = interaction.path("member");
        JsonNode user = member.has("user") ? member.get("user") : interaction.path("user");
        if (user.path("bot").asBoolean(false)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_BOT_OR_SELF, "Interaction from a bot");
        }
        String senderName = firstNonBlank(JsonMapper.text(member, "nick"), JsonMapper.text(user, "global_name"),
                JsonMapper.text(user, "username"), "unknown");

        ObjectNode payload = JsonMapper.object();
        payload.put("body", text);
        payload.put("senderName", senderName);
        payload.put("command", commandName);
        payload.put("channelId", channelId);
        payload.put("guildId", guildId);

        ObjectNode responseContext = JsonMapper.object();
        responseContext.put("applicationId", firstNonBlank(JsonMapper.text(interaction, "application_id"),
                cfg.getApplicationId()));
        responseContext.put("interactionId", interactionId);
        responseContext.put("interactionToken", JsonMapper.text(interaction, "token"));
        responseContext.put("guildId", guildId);
        responseContext.put("channelId", channelId);

        return WebhookParseResult.builder()
                .shouldProcess(true)
                .workItem(WorkItemDraft.builder()
                        .source(TYPE)
                        .sourceRef("discord:" + guildId + ":" + channelId + ":" + interactionId)
                        .sessionKey("discord:" + guildId + ":" + channelId)
                        .title(truncate(text, 100))
                        .payload(payload)
                        .actor(actor(user, senderName))
                        .build())
                .idempotencyKey("discord:" + interactionId)
                .responseContext(responseContext)
                .command(commandName)
                .immediateResponse(callback(DEFERRED_CHANNEL_MESSAGE))
                .build();
    }

    private WebhookParseResult parseForwardedMessage(JsonNode message, DiscordConfig cfg) {
        JsonNode author = message.path("author");
        if (author.path("bot").asBoolean(false)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_BOT_OR_SELF, "Message from a bot");
        }
        String content = JsonMapper.text(message, "content");
        if (isBlank(content)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_EMPTY_TEXT, "Message has no content");
        }
        String channelId = JsonMapper.text(message, "channel_id");
        if (!cfg.getAllowedChannelIds().isEmpty() && !cfg.getAllowedChannelIds().contains(channelId)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_NOT_ALLOWED, "Channel " + channelId + " not allowed");
        }
        String guildId = message.hasNonNull("guild_id") ? message.get("guild_id").asText() : "dm";
        String messageId = JsonMapper.text(message, "id");
        String threadId = JsonMapper.text(message, "thread_id");
        String sessionKey = "discord:" + guildId + ":" + channelId + (threadId != null ? ":thread:" + threadId : "");
        String senderName = firstNonBlank(JsonMapper.text(message.path("member"), "nick"),
                JsonMapper.text(author, "global_name"), JsonMapper.text(author, "username"), "unknown");

        ObjectNode payload = JsonMapper.object();
        payload.put("body", content);
        payload.put("senderName", senderName);
        payload.put("channelId", channelId);
        payload.put("guildId", guildId);
        payload.put("messageId", messageId);

        ObjectNode responseContext = JsonMapper.object();
        responseContext.put("channelId", threadId != null ? threadId : channelId);
        responseContext.put("messageId", messageId);
        responseContext.put("guildId", guildId);

        return WebhookParseResult.builder()
                .shouldProcess(true)
                .workItem(WorkItemDraft.builder()
                        .source(TYPE)
                        .sourceRef(sessionKey + ":" + messageId)
                        .sessionKey(sessionKey)
                        .title(truncate(content, 100))
                        .payload(payload)
                        .actor(actor(author, senderName))
                        .build())
                .idempotencyKey("discord:msg:" + messageId)
                .responseContext(responseContext)
                .build();
    }

    @Override
    public PostResult postResponse(PluginInstance instance, String workItemId, String content,
            JsonNode responseContext, PostOptions options) {
        DiscordConfig cfg = bindConfig(instance, DiscordConfig.class);
        String text = truncate(withLimitNotice(content, options), MAX_MESSAGE_LENGTH);
        String interactionToken = JsonMapper.text(responseContext, "interactionToken");
        try {
            ApiResponse response;
            if (interactionToken != null) {
                String applicationId = firstNonBlank(JsonMapper.text(responseContext, "applicationId"),
                        cfg.getApplicationId());
                response = sendJson("PATCH", apiBaseUrl + "/webhooks/" + applicationId + "/" + interactionToken
                        + "/messages/@original", Map.of(), Map.of("content", text));
            } else {
                if (isBlank(cfg.getBotToken())) {
                    return PostResult.failed("botToken is not configured", false);
                }
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("content", text);
                String replyTo = JsonMapper.text(responseContext, "messageId");
                if (replyTo != null) {
                    body.put("message_reference", Map.of("message_id", replyTo));
                }
                response = postJson(apiBaseUrl + "/channels/" + JsonMapper.text(responseContext, "channelId")
                        + "/messages", Map.of("Authorization", "Bot " + cfg.getBotToken()), body);
            }
            if (!response.ok()) {
                log.error("Discord post failed {}: {}", response.status(), response.body().path("message").asText());
                return PostResult.failed("Discord error " + response.status(),
                        PostResult.isRetryableStatus(response.status()));
            }
            return PostResult.sent(response.body().path("id").asText(null));
        } catch (IOException e) {
            log.error("Discord post failed: {}", e.getMessage());
            return PostResult.failed(e.getMessage(), true);
        }
    }

    private static boolean isForwardedMessage(JsonNode body) {
        if ("MESSAGE_CREATE".equals(JsonMapper.text(body, "t"))) {
            return true;
        }
        return body.has("author") && body.has("channel_id") && !body.has("type");
    }

    private static String commandText(String name, JsonNode options) {
        StringBuilder text = new StringBuilder("/").append(name);
        if (options.isArray()) {
            for (JsonNode option : options) {
                if (option.has("value")) {
                    text.append(' ').append(option.get("value").asText());
                }
            }
        }
        return text.toString();
    }

    private static InboundActor actor(JsonNode user, String senderName) {
        return InboundActor.builder()
                .kind(ActorKind.HUMAN)
                .externalId(JsonMapper.text(user, "id"))
                .handle(JsonMapper.text(user, "username"))
                .displayName(senderName)
                .source(TYPE)
                .build();
    }

    private static ObjectNode callback(int type) {
        ObjectNode node = JsonMapper.object();
        node.put("type", type);
        return node;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }
}
