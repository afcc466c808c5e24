package com.fleetgate.channel.github;

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
import com.fleetgate.channel.credential.CredentialEnvelope;
import com.fleetgate.channel.credential.CredentialMintException;
import com.fleetgate.channel.credential.CredentialRequest;
import com.fleetgate.channel.security.WebhookSignatures;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.error.ConfigurationException;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.model.PluginInstance;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * GitHub App integration: issue and issue-comment webhooks in, issue comments out.
 */
@Slf4j
public class GitHubPluginHandler extends HttpPluginHandler {

    public static final String TYPE = "github";
    static final String EVENT_HEADER = "X-GitHub-Event";
    static final String DELIVERY_HEADER = "X-GitHub-Delivery";
    static final String SIGNATURE_HEADER = "X-Hub-Signature-256";

    private final FleetConfig.CredentialsConfig credentialSettings;
    private final Map<String, GitHubConfig> latestConfigs = new ConcurrentHashMap<>();
    private final Map<String, GitHubCredentialProvider> providers = new ConcurrentHashMap<>();

    public GitHubPluginHandler(FleetConfig.CredentialsConfig credentialSettings) {
        this(defaultClient(), credentialSettings.getGithubApiBaseUrl(), Clock.systemUTC(), credentialSettings);
    }

    public GitHubPluginHandler(OkHttpClient httpClient, String apiBaseUrl, Clock clock,
            FleetConfig.CredentialsConfig credentialSettings) {
        super(httpClient, apiBaseUrl, clock);
        this.credentialSettings = credentialSettings;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<String> sensitiveFields() {
        return List.of("privateKey", "webhookSecret");
    }

    @Override
    public ConfigValidation validateConfig(JsonNode config) {
        GitHubConfig cfg = JsonMapper.convert(config, GitHubConfig.class);
        List<String> errors = new ArrayList<>();
        if (isBlank(cfg.getAppId())) {
            errors.add("appId is required");
        }
        if (isBlank(cfg.getPrivateKey())) {
            errors.add("privateKey is required");
        }
        if (isBlank(cfg.getWebhookSecret())) {
            errors.add("webhookSecret is required");
        }
        return ConfigValidation.of(errors);
    }

    @Override
    public WebhookParseResult parseWebhook(WebhookRequest request, PluginInstance instance) {
        String event = request.header(EVENT_HEADER);
        if (isBlank(event)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_UNSUPPORTED_EVENT, "Missing X-GitHub-Event");
        }
        GitHubConfig cfg = bindConfig(instance, GitHubConfig.class);
        if (isBlank(cfg.getWebhookSecret())) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_MISSING_SECRET, "webhookSecret is not configured");
        }
        if (!WebhookSignatures.verifyGitHub(cfg.getWebhookSecret(), request.getBody(), request.header(SIGNATURE_HEADER))) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_INVALID_SIGNATURE, "GitHub signature mismatch");
        }
        String deliveryId = request.header(DELIVERY_HEADER);
        if (isBlank(deliveryId)) {
            return WebhookParseResult.skip("missing_delivery_id", "Missing X-GitHub-Delivery");
        }

        JsonNode payload;
        try {
            payload = JsonMapper.read(request.getBody());
        } catch (IllegalArgumentException e) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_INVALID_JSON, "Body is not JSON");
        }

        return switch (event) {
            case "issue_comment" -> parseIssueComment(payload, deliveryId, cfg);
            case "issues" -> parseIssue(payload, deliveryId, cfg);
            default -> WebhookParseResult.skip(WebhookParseResult.REASON_UNSUPPORTED_EVENT, "Ignored event " + event);
        };
    }

    private WebhookParseResult parseIssueComment(JsonNode payload, String deliveryId, GitHubConfig cfg) {
        if (!"created".equals(JsonMapper.text(payload, "action"))) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_UNSUPPORTED_EVENT, "Ignored comment action");
        }
        if (isBot(payload)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_BOT_OR_SELF, "Comment from a bot");
        }
        String fullName = payload.path("repository").path("full_name").asText();
        if (!isRepoAllowed(cfg, fullName)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_NOT_ALLOWED, "Repository " + fullName + " not allowed");
        }
        JsonNode comment = payload.path("comment");
        String body = comment.path("body").asText("");
        if (!"all".equals(cfg.getCommentPolicy()) && !mentions(body, cfg.getMentionHandle())) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_POLICY_FILTERED, "Comment does not mention "
                    + cfg.getMentionHandle());
        }
        if (isBlank(body)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_EMPTY_TEXT, "Comment has no body");
        }

        JsonNode issue = payload.path("issue");
        String sourceRef = issueRef(payload) + "#comment:" + comment.path("id").asText();
        ObjectNode item = basePayload(payload, "issue_comment", body, comment.path("user"));
        item.put("commentId", comment.path("id").asLong());
        item.put("commentUrl", JsonMapper.text(comment, "html_url"));
        return processed(payload, issue, sourceRef, item, deliveryId, comment.path("user"));
    }

    private WebhookParseResult parseIssue(JsonNode payload, String deliveryId, GitHubConfig cfg) {
        String action = JsonMapper.text(payload, "action");
        if (!"opened".equals(action) && !"reopened".equals(action)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_UNSUPPORTED_EVENT, "Ignored issue action");
        }
        if (isBot(payload)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_BOT_OR_SELF, "Issue from a bot");
        }
        String fullName = payload.path("repository").path("full_name").asText();
        if (!isRepoAllowed(cfg, fullName)) {
            return WebhookParseResult.skip(WebhookParseResult.REASON_NOT_ALLOWED, "Repository " + fullName + " not allowed");
        }
        JsonNode issue = payload.path("issue");
        String text = issue.path("title").asText("");
        String issueBody = JsonMapper.text(issue, "body");
        if (!isBlank(issueBody)) {
            text = text + "\n\n" + issueBody;
        }
        String sourceRef = issueRef(payload) + "#issue:" + action + ":" + deliveryId;
        ObjectNode item = basePayload(payload, "issues", text, issue.path("user"));
        item.put("action", action);
        return processed(payload, issue, sourceRef, item, deliveryId, issue.path("user"));
    }

    private WebhookParseResult processed(JsonNode payload, JsonNode issue, String sourceRef, ObjectNode item,
            String deliveryId, JsonNode user) {
        JsonNode repository = payload.path("repository");
        String owner = repository.path("owner").path("login").asText();
        String repo = repository.path("name").asText();
        int number = issue.path("number").asInt();

        ObjectNode responseContext = JsonMapper.object();
        responseContext.put("owner", owner);
        responseContext.put("repo", repo);
        responseContext.put("issueNumber", number);
        if (payload.path("installation").hasNonNull("id")) {
            responseContext.put("installationId", payload.path("installation").path("id").asLong());
        }

        InboundActor actor = InboundActor.builder()
                .kind(ActorKind.HUMAN)
                .externalId(user.path("id").asText(null))
                .handle(JsonMapper.text(user, "login"))
                .displayName(JsonMapper.text(user, "login"))
                .source(TYPE)
                .build();

        return WebhookParseResult.builder()
                .shouldProcess(true)
                .workItem(WorkItemDraft.builder()
                        .source(TYPE)
                        .sourceRef(sourceRef)
                        .sessionKey("github:" + owner + "/" + repo + "#" + number)
                        .title(truncate("[" + owner + "/" + repo + "#" + number + "] " + issue.path("title").asText(""), 200))
                        .payload(item)
                        .actor(actor)
                        .build())
                .idempotencyKey("github:" + deliveryId)
                .responseContext(responseContext)
                .build();
    }

    @Override
    public PostResult postResponse(PluginInstance instance, String workItemId, String content,
            JsonNode responseContext, PostOptions options) {
        String owner = JsonMapper.text(responseContext, "owner");
        String repo = JsonMapper.text(responseContext, "repo");
        String issueNumber = JsonMapper.text(responseContext, "issueNumber");
        if (owner == null || repo == null || issueNumber == null) {
            return PostResult.failed("Missing response context", false);
        }
        if (responseContext.path("installationId").isMissingNode()) {
            return PostResult.failed("Missing GitHub App installation context", false);
        }
        long installationId = responseContext.path("installationId").asLong();

        GitHubCredentialProvider provider = credentialProvider(instance);
        try {
            CredentialEnvelope credential = provider.getCredential(CredentialRequest.builder()
                    .installationId(installationId)
                    .build());
            ApiResponse response = postJson(apiBaseUrl + "/repos/" + owner + "/" + repo + "/issues/" + issueNumber
                            + "/comments",
                    Map.of("Authorization", "Bearer " + credential.token(), "Accept", "application/vnd.github+json"),
                    Map.of("body", withLimitNotice(content, options)));
            if (response.status() == 401) {
                provider.invalidate(installationId);
                return PostResult.failed("GitHub rejected the installation token", true);
            }
            if (!response.ok()) {
                log.error("GitHub comment failed {}: {}", response.status(), response.body().path("message").asText());
                return PostResult.failed("GitHub error " + response.status(),
                        PostResult.isRetryableStatus(response.status()));
            }
            return PostResult.sent(response.body().path("id").asText(null));
        } catch (ConfigurationException | CredentialMintException e) {
            return PostResult.failed(e.getMessage(), false);
        } catch (IOException e) {
            log.error("GitHub comment failed: {}", e.getMessage());
            return PostResult.failed(e.getMessage(), true);
        }
    }

    @Override
    public ConfigValidation testConnection(JsonNode config) {
        GitHubConfig cfg = JsonMapper.convert(config, GitHubConfig.class);
        ConfigValidation validation = validateConfig(config);
        if (!validation.valid()) {
            return validation;
        }
        try {
            GitHubAppJwt.create(cfg.getAppId(), cfg.getPrivateKey(), clock.instant());
            return ConfigValidation.ok();
        } catch (ConfigurationException e) {
            return ConfigValidation.invalid(List.of(e.getMessage()));
        }
    }

    /**
     * Token provider for an instance; it always reads the instance's most recently seen config.
     */
    GitHubCredentialProvider credentialProvider(PluginInstance instance) {
        latestConfigs.put(instance.getId(), bindConfig(instance, GitHubConfig.class));
        return providers.computeIfAbsent(instance.getId(), id -> new GitHubCredentialProvider(
                () -> latestConfigs.get(id), httpClient, apiBaseUrl,
                credentialSettings.getSkewSeconds(), credentialSettings.getDefaultTtlSeconds(), clock));
    }

    private static ObjectNode basePayload(JsonNode payload, String type, String text, JsonNode user) {
        JsonNode repository = payload.path("repository");
        JsonNode issue = payload.path("issue");
        ObjectNode item = JsonMapper.object();
        item.put("type", type);
        item.put("body", text);
        item.put("senderName", user.path("login").asText("unknown"));
        item.put("owner", repository.path("owner").path("login").asText());
        item.put("repo", repository.path("name").asText());
        item.put("issueNumber", issue.path("number").asInt());
        item.put("issueTitle", issue.path("title").asText(""));
        item.put("issueUrl", JsonMapper.text(issue, "html_url"));
        return item;
    }

    private static String issueRef(JsonNode payload) {
        return payload.path("repository").path("full_name").asText() + "#" + payload.path("issue").path("number").asText();
    }

    private static boolean isBot(JsonNode payload) {
        return "Bot".equals(payload.path("sender").path("type").asText());
    }

    private static boolean isRepoAllowed(GitHubConfig cfg, String fullName) {
        return cfg.getAllowedRepos().isEmpty() || cfg.getAllowedRepos().contains(fullName);
    }

    static boolean mentions(String body, String handle) {
        if (isBlank(handle)) {
            return true;
        }
        return body.toLowerCase(Locale.ROOT).contains(handle.toLowerCase(Locale.ROOT));
    }
}
