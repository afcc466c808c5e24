package com.fleetgate.app.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.error.ConfigurationException;
import com.fleetgate.common.error.FleetGateException;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.agent.AgentEvent;
import com.fleetgate.gateway.agent.AgentRunOptions;
import com.fleetgate.gateway.agent.AgentRunResult;
import com.fleetgate.gateway.agent.SteeringInbox;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpAgentRunnerTest {

    private MockWebServer server;
    private FleetConfig.AgentRunnerConfig config;
    private HttpAgentRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        config = new FleetConfig.AgentRunnerConfig();
        config.setEndpoint(server.url("/runtime/").toString());
        config.setApiKey("rt-key");
        runner = new HttpAgentRunner(new OkHttpClient(), config);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsRunAndParsesResult() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"job\":\"job-7\",\"finalResponse\":\"done\",\"hitLimit\":true}"));

        AgentRunResult result = runner.runAgent("agent-1", "wi-1", AgentRunOptions.builder()
                .input("hello")
                .sessionKey("slack:C1")
                .dispatchId("d-1")
                .build());

        assertEquals("job-7", result.getJob());
        assertEquals("done", result.getFinalResponse());
        assertTrue(result.isHitLimit());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/runtime/agents/agent-1/runs", request.getPath());
        assertEquals("Bearer rt-key", request.getHeader("Authorization"));
        JsonNode body = JsonMapper.read(request.getBody().readUtf8());
        assertEquals("wi-1", body.get("workItemId").asText());
        assertEquals("hello", body.get("input").asText());
        assertEquals("final", body.get("responseMode").asText());
        assertEquals("d-1", body.get("dispatchId").asText());
    }

    @Test
    void missingFinalResponseIsNull() {
        server.enqueue(new MockResponse().setBody("{\"job\":\"job-1\"}"));

        AgentRunResult result = runner.runAgent("agent-1", "wi-1", AgentRunOptions.builder().build());

        assertNull(result.getFinalResponse());
        assertFalse(result.isHitLimit());
    }

    @Test
    void errorStatusFailsTheRun() {
        server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));

        FleetGateException e = assertThrows(FleetGateException.class,
                () -> runner.runAgent("agent-1", "wi-1", AgentRunOptions.builder().build()));
        assertTrue(e.getMessage().contains("502"));
    }

    @Test
    void unconfiguredEndpointFailsFast() {
        config.setEndpoint(" ");

        assertThrows(ConfigurationException.class,
                () -> runner.runAgent("agent-1", "wi-1", AgentRunOptions.builder().build()));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void steeringDuringRunIsForwardedAndListenerRestored() throws Exception {
        SteeringInbox steering = new SteeringInbox();
        List<AgentEvent> events = new CopyOnWriteArrayList<>();
        server.enqueue(new MockResponse().setBody("{\"job\":\"job-1\",\"finalResponse\":\"ok\"}")
                .setBodyDelay(300, TimeUnit.MILLISECONDS));
        server.enqueue(new MockResponse().setResponseCode(202));

        Thread offerer = new Thread(() -> {
            try {
                server.takeRequest(1, TimeUnit.SECONDS);
                steering.offer(new SteeringInbox.SteeringMessage("m-2", "wi-2", "Ada", "also this", 0L));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        offerer.start();

        runner.runAgent("agent-1", "wi-1", AgentRunOptions.builder()
                .dispatchId("d-9")
                .steering(steering)
                .onEvent(events::add)
                .build());
        offerer.join(2_000);

        RecordedRequest steer = server.takeRequest(2, TimeUnit.SECONDS);
        assertNotNull(steer);
        assertEquals("/runtime/runs/d-9/steer", steer.getPath());
        assertEquals("also this", JsonMapper.read(steer.getBody().readUtf8()).get("text").asText());
        assertEquals(1, events.size());
        assertEquals(AgentEvent.STEER, events.get(0).type());
        assertEquals(0, steering.size());
        assertEquals(List.of("m-2"), steering.consumed().stream().map(SteeringInbox.SteeringMessage::messageId).toList());

        steering.offer(new SteeringInbox.SteeringMessage("m-3", "wi-3", "Ada", "after", 0L));
        assertEquals(2, events.size());
        assertEquals(2, server.getRequestCount());
    }
}
