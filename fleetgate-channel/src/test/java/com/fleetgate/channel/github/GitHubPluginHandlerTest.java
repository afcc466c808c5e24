package com.fleetgate.channel.github;

import com.fleetgate.channel.adapter.PostOptions;
import com.fleetgate.channel.adapter.PostResult;
import com.fleetgate.channel.adapter.WebhookParseResult;
import com.fleetgate.channel.adapter.WebhookRequest;
import com.fleetgate.channel.security.WebhookSignatures;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.model.PluginInstance;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GitHubPluginHandlerTest {

    private static final String SECRET = "hook-secret";

    private MockWebServer server;
    private GitHubPluginHandler handler;
    private PluginInstance instance;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        handler = new GitHubPluginHandler(new OkHttpClient(), server.url("/").toString(), Clock.systemUTC(),
                new FleetConfig.CredentialsConfig());
        String key = GitHubTestKeys.pkcs8Pem(GitHubTestKeys.rsa()).replace("\n", "\\n");
        instance = PluginInstance.builder()
                .id("pi-gh")
                .pluginId("builtin.github")
                .type("github")
                .enabled(true)
                .config("{\"appId\":\"4242\",\"privateKey\":\"" + key + "\",\"webhookSecret\":\"" + SECRET + "\"}")
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private WebhookRequest delivery(String event, String body) {
        return new WebhookRequest(Map.of(
                "X-GitHub-Event", event,
                "X-GitHub-Delivery", "d-1",
                "X-Hub-Signature-256", "sha256=" + WebhookSignatures.hmacSha256Hex(SECRET, body)), body);
    }

    private static String comment(String body, String senderType) {
        return "{\"action\":\"created\",\"sender\":{\"type\":\"" + senderType + "\"},"
                + "\"repository\":{\"name\":\"repo\",\"full_name\":\"acme/repo\",\"owner\":{\"login\":\"acme\"}},"
                + "\"issue\":{\"number\":12,\"title\":\"Flaky build\"},"
                + "\"comment\":{\"id\":555,\"body\":\"" + body + "\",\"user\":{\"id\":1,\"login\":\"octo\"}},"
                + "\"installation\":{\"id\":99}}";
    }

    @Test
    void mentionedComment_processed() {
        WebhookParseResult result = handler.parseWebhook(delivery("issue_comment",
                comment("@FleetGate please look", "User")), instance);

        assertTrue(result.isShouldProcess());
        assertEquals("github:acme/repo#12", result.getWorkItem().getSessionKey());
        assertEquals("acme/repo#12#comment:555", result.getWorkItem().getSourceRef());
        assertEquals("[acme/repo#12] Flaky build", result.getWorkItem().getTitle());
        assertEquals("octo", result.getWorkItem().getSenderName());
        assertEquals(List.of("github:d-1"), result.normalizedIdempotencyKeys());
        assertEquals(99, result.getResponseContext().get("installationId").asLong());
    }

    @Test
    void unmentionedAndBotComments_skipped() {
        assertEquals(WebhookParseResult.REASON_POLICY_FILTERED, handler.parseWebhook(
                delivery("issue_comment", comment("just a note", "User")), instance).getReasonCode());
        assertEquals(WebhookParseResult.REASON_BOT_OR_SELF, handler.parseWebhook(
                delivery("issue_comment", comment("@fleetgate hi", "Bot")), instance).getReasonCode());
    }

    @Test
    void openedIssue_processedAndOtherActionsIgnored() {
        String opened = "{\"action\":\"opened\",\"sender\":{\"type\":\"User\"},"
                + "\"repository\":{\"name\":\"repo\",\"full_name\":\"acme/repo\",\"owner\":{\"login\":\"acme\"}},"
                + "\"issue\":{\"number\":3,\"title\":\"Crash\",\"body\":\"Stack trace\",\"user\":{\"login\":\"octo\"}}}";

        WebhookParseResult result = handler.parseWebhook(delivery("issues", opened), instance);
        assertTrue(result.isShouldProcess());
        assertEquals("Crash\n\nStack trace", result.getWorkItem().getText());

        assertFalse(handler.parseWebhook(delivery("issues", opened.replace("opened", "closed")), instance)
                .isShouldProcess());
    }

    @Test
    void badSignature_isAuthFailure() {
        String body = comment("@fleetgate hi", "User");
        WebhookRequest request = new WebhookRequest(Map.of("X-GitHub-Event", "issue_comment",
                "X-GitHub-Delivery", "d-1", "X-Hub-Signature-256", "sha256=deadbeef"), body);

        assertTrue(handler.parseWebhook(request, instance).isAuthFailure());
    }

    @Test
    void disallowedRepo_skipped() {
        instance.setConfig(instance.getConfig().replace("}", ",\"allowedRepos\":[\"acme/other\"]}"));

        assertEquals(WebhookParseResult.REASON_NOT_ALLOWED, handler.parseWebhook(
                delivery("issue_comment", comment("@fleetgate hi", "User")), instance).getReasonCode());
    }

    @Test
    void postResponse_mintsTokenAndComments() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201)
                .setBody("{\"token\":\"ghs_x\",\"expires_at\":\"" + Instant.now().plusSeconds(3_600) + "\"}"));
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"id\":777}"));

        PostResult result = handler.postResponse(instance, "wi-1", "Fixed in #13",
                JsonMapper.read("{\"owner\":\"acme\",\"repo\":\"repo\",\"issueNumber\":12,\"installationId\":99}"),
                new PostOptions());

        assertTrue(result.isSuccess());
        assertEquals("777", result.getProviderRef());
        assertEquals("/app/installations/99/access_tokens", server.takeRequest().getPath());
        RecordedRequest comment = server.takeRequest();
        assertEquals("/repos/acme/repo/issues/12/comments", comment.getPath());
        assertEquals("Bearer ghs_x", comment.getHeader("Authorization"));
    }

    @Test
    void postResponse_mintFailureNotRetryable() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"Not Found\"}"));

        PostResult result = handler.postResponse(instance, "wi-1", "hi",
                JsonMapper.read("{\"owner\":\"acme\",\"repo\":\"repo\",\"issueNumber\":12,\"installationId\":99}"),
                new PostOptions());

        assertFalse(result.isSuccess());
        assertFalse(result.isRetryable());
    }
}
