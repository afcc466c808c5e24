package com.fleetgate.channel.telegram;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Telegram Bot API integration.
 */
@Slf4j
public class TelegramPluginHandler extends HttpPluginHandler {

    public static final String TYPE = "telegram";
    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";
    static final int MAX_MESSAGE_LENGTH = 4096;
    private static final Pattern COMMAND = Pattern.compile("^/(\\w+)");

    public TelegramPluginHandler() {
        this(defaultClient(), "https://api.telegram.org", Clock.systemUTC());
    }

    public TelegramPluginHandler(OkHttpClient httpClient, String apiBaseUrl, Clock clock) {
        super(httpClient, apiBaseUrl, clock);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<String> sensitiveFields() {
        return List.of("botToken", "webhookSecret");
    }

    @Override
    public ConfigValidation validateConfig(JsonNode config) {
        TelegramConfig cfg = JsonMapper.convert(config, TelegramConfig.class);
        List<String> errors = new ArrayList<>();
        if (isBlank(cfg.getBotToken())) {
            errors.add("botToken is required");
        }
        if (isBlank(cfg.getWebhookSecret())) {
            errors.add("webhookSecret is required");
        }
        return ConfigValidation.of(errors);
    }

    @Override
    public WebhookParseResult parseWebhook(WebhookRequest request, PluginInstance instance) {
        TelegramConfig cfg = bindConfig(instance, TelegramConfig.class);
        if (isBlank(cfg.getWebhookSecret())) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_MISSING_SECRET, "webhookSecret is not configured");
        }
        if (!WebhookSignatures.verifyTelegram(cfg.getWebhookSecret(), request.header(SECRET_HEADER))) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_INVALID_SIGNATURE, "Secret token mismatch");
        }

        JsonNode update;
        try {
            update = JsonMapper.read(request.getBody());
        } catch (IllegalArgumentException e) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_INVALID_JSON, "Body is not JSON");
        }
        JsonNode message = update.hasNonNull("message") ? update.get("message") : update.get("edited_message");
        if (message == null || !message.isObject()) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_UNSUPPORTED_EVENT, "No message in update");
        }

        String text = JsonMapper.text(message, "text");
        if (text == null) {
            text = JsonMapper.text(message, "caption");
        }
        if (isBlank(text)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_EMPTY_TEXT, "Message has no text");
        }
        JsonNode from = message.path("from");
        if (from.path("is_bot").asBoolean(false)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_BOT_OR_SELF, "Message from a bot");
        }
        String chatId = message.path("chat").path("id").asText();
        if (!cfg.getAllowedChatIds().isEmpty() && !cfg.getAllowedChatIds().contains(chatId)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_NOT_ALLOWED, "Chat " + chatId + " not allowed");
        }

        String messageId = message.path("message_id").asText();
        String threadId = JsonMapper.text(message, "message_thread_id");
        String sessionKey = threadId != null
                ? "telegram:" + chatId + ":thread:" + threadId
                : "telegram:" + chatId;
        String sourceRef = threadId != null
                ? "telegram:" + chatId + ":" + threadId + ":" + messageId
                : "telegram:" + chatId + ":" + messageId;
        String senderName = senderName(from);

        InboundActor actor = InboundActor.builder()
                .kind(ActorKind.HUMAN)
                .externalId(from.path("id").asText(null))
                .handle(JsonMapper.text(from, "username"))
                .displayName(senderName)
                .source(TYPE)
                .build();

        ObjectNode payload = JsonMapper.object();
        payload.put("body", text);
        payload.put("senderName", senderName);
        payload.put("chatId", chatId);
        payload.put("messageId", messageId);
        payload.put("chatType", JsonMapper.text(message.path("chat"), "type"));

        ObjectNode responseContext = JsonMapper.object();
        responseContext.put("chatId", chatId);
        responseContext.put("messageId", messageId);
        if (threadId != null) {
            responseContext.put("threadId", threadId);
        }

        String updateId = update.path("update_id").asText();
        return WebhookParseResult.builder()
                .shouldProcess(true)
                .workItem(WorkItemDraft.builder()
                        .source(TYPE)
                        .sourceRef(sourceRef)
                        .sessionKey(sessionKey)
                        .title(truncate(text, 100))
                        .payload(payload)
                        .actor(actor)
                        .build())
                .idempotencyKey("telegram:" + updateId)
                .responseContext(responseContext)
                .command(command(text))
                .build();
    }

    @Override
    public PostResult postResponse(PluginInstance instance, String workItemId, String content,
            JsonNode responseContext, PostOptions options) {
        TelegramConfig cfg = bindConfig(instance, TelegramConfig.class);
        if (isBlank(cfg.getBotToken())) {
            return PostResult.failed("botToken is not configured", false);
        }
        String chatId = JsonMapper.text(responseContext, "chatId");
        if (chatId == null) {
            return PostResult.failed("responseContext.chatId is missing", false);
        }

        String providerRef = null;
        for (String chunk : chunk(withLimitNotice(content, options), MAX_MESSAGE_LENGTH)) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("chat_id", chatId);
            body.put("text", chunk);
            String threadId = JsonMapper.text(responseContext, "threadId");
            if (threadId != null) {
                body.put("message_thread_id", Long.parseLong(threadId));
            }
            String replyTo = JsonMapper.text(responseContext, "messageId");
            if (replyTo != null && providerRef == null) {
                body.put("reply_to_message_id", Long.parseLong(replyTo));
            }
            try {
                ApiResponse response = postJson(methodUrl(cfg, "sendMessage"), Map.of(), body);
                if (!response.ok()) {
                    log.error("Telegram sendMessage failed {}: {}", response.status(), response.body().path("description").asText());
                    return PostResult.failed("Telegram error " + response.status(),
                            PostResult.isRetryableStatus(response.status()));
                }
                providerRef = response.body().path("result").path("message_id").asText(null);
            } catch (IOException e) {
                log.error("Telegram sendMessage failed: {}", e.getMessage());
                return PostResult.failed(e.getMessage(), true);
            }
        }
        return PostResult.sent(providerRef);
    }

    @Override
    public void acknowledgeReceipt(PluginInstance instance, JsonNode responseContext) {
        TelegramConfig cfg = bindConfig(instance, TelegramConfig.class);
        String chatId = JsonMapper.text(responseContext, "chatId");
        if (isBlank(cfg.getBotToken()) || chatId == null) {
            return;
        }
        try {
            ApiResponse response = postJson(methodUrl(cfg, "sendChatAction"), Map.of(),
                    Map.of("chat_id", chatId, "action", "typing"));
            if (!response.ok()) {
                log.debug("Telegram typing indicator rejected: {}", response.status());
            }
        } catch (IOException e) {
            log.debug("Telegram typing indicator failed: {}", e.getMessage());
        }
    }

    @Override
    public ConfigValidation testConnection(JsonNode config) {
        ConfigValidation validation = validateConfig(config);
        if (!validation.valid()) {
            return validation;
        }
        TelegramConfig cfg = JsonMapper.convert(config, TelegramConfig.class);
        try {
            ApiResponse response = get(methodUrl(cfg, "getMe"), Map.of());
            return response.ok()
                    ? ConfigValidation.ok()
                    : ConfigValidation.invalid(List.of("getMe returned " + response.status()));
        } catch (IOException e) {
            return ConfigValidation.invalid(List.of("getMe failed: " + e.getMessage()));
        }
    }

    private String methodUrl(TelegramConfig cfg, String method) {
        return apiBaseUrl + "/bot" + cfg.getBotToken() + "/" + method;
    }

    static String senderName(JsonNode from) {
        String first = JsonMapper.text(from, "first_name");
        String last = JsonMapper.text(from, "last_name");
        String username = JsonMapper.text(from, "username");
        StringBuilder name = new StringBuilder();
        if (first != null) {
            name.append(first);
        }
        if (last != null) {
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(last);
        }
        if (name.length() == 0) {
            return username != null ? "@" + username : "unknown";
        }
        if (username != null) {
            name.append(" (@").append(username).append(')');
        }
        return name.toString();
    }

    static String command(String text) {
        Matcher matcher = COMMAND.matcher(text.strip());
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }

    static List<String> chunk(String content, int max) {
        List<String> chunks = new ArrayList<>();
        String remaining = content == null ? "" : content;
        while (remaining.length() > max) {
            int cut = remaining.lastIndexOf('\n', max);
            if (cut <= 0) {
                cut = max;
            }
            chunks.add(remaining.substring(0, cut));
            remaining = remaining.substring(cut).stripLeading();
        }
        chunks.add(remaining);
        return chunks;
    }
}
