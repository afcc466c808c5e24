package com.fleetgate.gateway.dispatch;

import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.channel.registry.PluginHandlerRegistry;
import com.fleetgate.channel.routing.RouteResult;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.queue.LaneRun;
import com.fleetgate.gateway.queue.QueueKeys;
import com.fleetgate.gateway.support.GatewayFixture;
import com.fleetgate.gateway.support.RecordingPluginHandler;
import com.fleetgate.store.model.AgentRecord;
import com.fleetgate.store.model.PluginInstance;
import com.fleetgate.store.model.WorkItem;
import com.fleetgate.store.model.WorkItemStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class InboundDispatcherTest {

    @TempDir
    Path tempDir;

    private GatewayFixture fixture;
    private RecordingPluginHandler handler;
    private InboundDispatcher dispatcher;
    private PluginInstance instance;
    private final List<LaneRun> runs = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        fixture = new GatewayFixture(tempDir);
        fixture.queueManager.setRunHandler(runs::add);
        handler = new RecordingPluginHandler();
        dispatcher = new InboundDispatcher(fixture.agents, fixture.workItems,
                new PluginHandlerRegistry(List.of(handler)), fixture.queueManager, fixture.settingsResolver);
        instance = fixture.instance("{\"queue\":{\"debounceMs\":10}}");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private RouteResult routed(InboundActor actor) {
        WorkItem item = fixture.workItem(instance, "evt-1", JsonMapper.object());
        return RouteResult.builder()
                .status(201)
                .created(true)
                .workItemId(item.getId())
                .instance(instance)
                .sessionKey("fake:room-1")
                .senderName("Ada")
                .messageText("hello agents")
                .responseContext(JsonMapper.read("{\"room\":\"room-1\"}"))
                .actor(actor)
                .build();
    }

    private WorkItemStatus statusOf(String workItemId) {
        return fixture.workItems.findById(workItemId).orElseThrow().getStatus();
    }

    @Test
    void noAssignedAgents_failsItem() {
        RouteResult routed = routed(InboundActor.builder().build());

        InboundDispatcher.Result result = dispatcher.dispatch(routed);

        assertEquals(InboundDispatcher.Outcome.NO_AGENTS, result.outcome());
        assertEquals(WorkItemStatus.FAILED, statusOf(routed.getWorkItemId()));
        assertEquals(0, handler.acknowledged.get());
    }

    @Test
    void onlyOriginAgentAssigned_completesItemWithoutDispatch() {
        AgentRecord alpha = fixture.agent("alpha", instance, 0);
        RouteResult routed = routed(InboundActor.agent(alpha.getId(), "alpha", "Alpha"));

        InboundDispatcher.Result result = dispatcher.dispatch(routed);

        assertEquals(InboundDispatcher.Outcome.ORIGIN_ONLY, result.outcome());
        assertEquals(WorkItemStatus.DONE, statusOf(routed.getWorkItemId()));
        assertEquals(0, fixture.queueManager.activeLaneCount());
    }

    @Test
    void agentOriginated_excludesOriginFromFanOut() throws Exception {
        AgentRecord alpha = fixture.agent("alpha", instance, 0);
        AgentRecord beta = fixture.agent("beta", instance, 1);
        RouteResult routed = routed(InboundActor.agent(alpha.getId(), "alpha", "Alpha"));

        InboundDispatcher.Result result = dispatcher.dispatch(routed);

        assertEquals(List.of(QueueKeys.conversational(instance.getId(), "fake:room-1", beta.getId())),
                result.queueKeys());
        assertTrue(fixture.queueManager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(1, runs.size());
        assertEquals(beta.getId(), runs.get(0).lane().getAgentId());
    }

    @Test
    void humanMessage_fansOutToAllAgentsWithStaggerAndSingleAck() throws Exception {
        AgentRecord alpha = fixture.agent("alpha", instance, 0);
        AgentRecord beta = fixture.agent("beta", instance, 1);

        InboundDispatcher.Result result = dispatcher.dispatch(routed(InboundActor.builder().build()));

        assertEquals(InboundDispatcher.Outcome.ENQUEUED, result.outcome());
        assertEquals(2, result.queueKeys().size());
        assertEquals(1, handler.acknowledged.get());
        String alphaKey = QueueKeys.conversational(instance.getId(), "fake:room-1", alpha.getId());
        String betaKey = QueueKeys.conversational(instance.getId(), "fake:room-1", beta.getId());
        assertEquals(10, fixture.queues.findLane(alphaKey).orElseThrow().getDebounceMs());
        assertEquals(5_010, fixture.queues.findLane(betaKey).orElseThrow().getDebounceMs());
        assertEquals("hello agents", fixture.queues.listByQueue(alphaKey).get(0).getText());
        assertEquals("room-1", JsonMapper.read(fixture.queues.listByQueue(betaKey).get(0).getResponseContext())
                .get("room").asText());
    }

    @Test
    void duplicateResult_isNotDispatched() {
        RouteResult duplicate = RouteResult.builder().status(200).duplicate(true).workItemId("wi-1").build();

        assertEquals(InboundDispatcher.Outcome.NOT_DISPATCHABLE, dispatcher.dispatch(duplicate).outcome());
    }
}
