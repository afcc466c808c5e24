package com.fleetgate.app.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.error.ConfigurationException;
import com.fleetgate.common.error.FleetGateException;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.agent.AgentEvent;
import com.fleetgate.gateway.agent.AgentRunOptions;
import com.fleetgate.gateway.agent.AgentRunResult;
import com.fleetgate.gateway.agent.AgentRunner;
import com.fleetgate.gateway.agent.SteeringInbox;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * {@link AgentRunner} backed by a remote agent runtime.
 * <p>
 * A run is one blocking {@code POST {endpoint}/agents/{agentId}/runs}; the runtime answers with
 * {@code {job, finalResponse, hitLimit}} once the agent is done. Steering messages that arrive
 * meanwhile are forwarded to {@code POST {endpoint}/runs/{dispatchId}/steer}.
 */
@Slf4j
public class HttpAgentRunner implements AgentRunner {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final FleetConfig.AgentRunnerConfig config;

    public HttpAgentRunner(FleetConfig.AgentRunnerConfig config) {
        this(new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(Math.max(1, config.getTimeoutSeconds())))
                .build(), config);
    }

    public HttpAgentRunner(OkHttpClient httpClient, FleetConfig.AgentRunnerConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    @Override
    public AgentRunResult runAgent(String agentId, String workItemId, AgentRunOptions options) {
        String base = endpoint();
        ObjectNode body = JsonMapper.object();
        body.put("workItemId", workItemId);
        body.put("responseMode", options.getResponseMode());
        body.put("input", options.getInput());
        body.put("sessionKey", options.getSessionKey());
        body.put("dispatchId", options.getDispatchId());

        SteeringInbox steering = options.getSteering();
        Consumer<AgentEvent> onEvent = options.getOnEvent();
        if (steering != null && options.getDispatchId() != null) {
            steering.onOffer(event -> {
                if (onEvent != null) {
                    onEvent.accept(event);
                }
                forwardSteering(base, options.getDispatchId(), event);
                // Forwarded messages belong to the remote run now.
                steering.drain();
            });
        }

        Request request = authorized(new Request.Builder()
                .url(base + "/agents/" + agentId + "/runs")
                .post(RequestBody.create(JsonMapper.write(body), JSON)))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new FleetGateException("Agent runtime returned HTTP " + response.code()
                        + " for agent " + agentId);
            }
            JsonNode node = JsonMapper.read(raw);
            return AgentRunResult.builder()
                    .job(node.path("job").asText(null))
                    .finalResponse(node.path("finalResponse").asText(null))
                    .hitLimit(node.path("hitLimit").asBoolean(false))
                    .build();
        } catch (IOException e) {
            throw new FleetGateException("Agent runtime call failed for agent " + agentId + ": " + e.getMessage(), e);
        } finally {
            if (steering != null) {
                steering.onOffer(onEvent);
            }
        }
    }

    private void forwardSteering(String base, String dispatchId, AgentEvent event) {
        Request request = authorized(new Request.Builder()
                .url(base + "/runs/" + dispatchId + "/steer")
                .post(RequestBody.create(JsonMapper.write(event.data()), JSON)))
                .build();
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("Failed to forward steering message for dispatch {}: {}", dispatchId, e.getMessage());
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        log.warn("Agent runtime rejected steering for dispatch {} (HTTP {})",
                                dispatchId, response.code());
                    }
                }
            }
        });
    }

    private Request.Builder authorized(Request.Builder builder) {
        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private String endpoint() {
        String endpoint = config.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            throw new ConfigurationException("agentRunner.endpoint is not configured");
        }
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
