package com.fleetgate.gateway.dispatch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.channel.registry.PluginHandlerRegistry;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.agent.AgentRunOptions;
import com.fleetgate.gateway.agent.AgentRunResult;
import com.fleetgate.gateway.agent.AgentRunner;
import com.fleetgate.gateway.agent.SteeringInbox;
import com.fleetgate.gateway.queue.LaneRun;
import com.fleetgate.gateway.queue.Lanes;
import com.fleetgate.gateway.queue.MessageCoalescer;
import com.fleetgate.gateway.queue.OverflowPolicy;
import com.fleetgate.gateway.queue.QueueSettings;
import com.fleetgate.gateway.support.GatewayFixture;
import com.fleetgate.gateway.support.RecordingPluginHandler;
import com.fleetgate.plugin.runtime.CrashGuard;
import com.fleetgate.store.model.AgentRecord;
import com.fleetgate.store.model.PluginInstance;
import com.fleetgate.store.model.QueueLaneRecord;
import com.fleetgate.store.model.QueueMessage;
import com.fleetgate.store.model.QueueMessageStatus;
import com.fleetgate.store.model.QueueMode;
import com.fleetgate.store.model.WorkItem;
import com.fleetgate.store.model.WorkItemStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class RunDispatcherTest {

    @TempDir
    Path tempDir;

    private GatewayFixture fixture;
    private RecordingPluginHandler handler;
    private ScriptedRunner runner;
    private CrashGuard crashGuard;
    private final List<CompletedTurn> turns = new CopyOnWriteArrayList<>();
    private RunDispatcher dispatcher;
    private PluginInstance instance;
    private AgentRecord alpha;

    @BeforeEach
    void setUp() {
        fixture = new GatewayFixture(tempDir);
        handler = new RecordingPluginHandler();
        runner = new ScriptedRunner();
        crashGuard = new CrashGuard(1, 60_000, (pluginId, count, windowMs, threshold) -> { }, fixture.tasks);
        dispatcher = new RunDispatcher(fixture.workItems, fixture.agents, fixture.plugins,
                new PluginHandlerRegistry(List.of(handler)), runner, crashGuard, List.<TurnListener>of(turns::add),
                ZoneOffset.UTC);
        instance = fixture.instance("{}");
        alpha = fixture.agent("alpha", instance, 0);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private WorkItem item(String ref, InboundActor actor) {
        ObjectNode payload = JsonMapper.object();
        payload.set("actor", actor.toJson());
        return fixture.workItem(instance, ref, payload);
    }

    private LaneRun laneRun(AgentRecord agent, WorkItem... items) {
        QueueSettings settings = fixture.settingsResolver.resolve(null, null);
        List<QueueMessage> messages = new ArrayList<>();
        for (WorkItem item : items) {
            messages.add(QueueMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .workItemId(item.getId())
                    .pluginInstanceId(instance.getId())
                    .responseContext("{\"room\":\"room-1\"}")
                    .text("text of " + item.getSourceRef())
                    .senderName("Ada")
                    .arrivedAt(System.currentTimeMillis())
                    .build());
        }
        return new LaneRun(Lanes.conversational(instance.getId(), "fake:room-1", agent.getId(), settings),
                "dispatch-1", messages, MessageCoalescer.coalesce(messages, ZoneOffset.UTC), new SteeringInbox());
    }

    private WorkItemStatus statusOf(WorkItem item) {
        return fixture.workItems.findById(item.getId()).orElseThrow().getStatus();
    }

    @Test
    void postsFinalResponse_andNotifiesListeners() {
        WorkItem item = item("evt-1", InboundActor.builder().build());

        dispatcher.runLane(laneRun(alpha, item));

        assertEquals(1, runner.calls.size());
        assertEquals("text of evt-1", runner.calls.get(0).options().getInput());
        assertEquals(1, handler.posts.size());
        RecordingPluginHandler.Post post = handler.posts.get(0);
        assertEquals("reply from " + alpha.getId(), post.content());
        assertEquals("dispatch-1", post.options().getIdempotencyKey());
        assertEquals("room-1", post.responseContext().get("room").asText());
        assertEquals(1, handler.dismissed.get());
        assertEquals(WorkItemStatus.DONE, statusOf(item));
        assertEquals(1, turns.size());
        assertEquals(item.getId(), turns.get(0).sourceItem().getId());
    }

    @Test
    void ownMessage_isNeverRoutedBackToItsAuthor() {
        WorkItem own = item("evt-1", InboundActor.agent(alpha.getId(), "alpha", "Alpha"));

        dispatcher.runLane(laneRun(alpha, own));

        assertTrue(runner.calls.isEmpty());
        assertTrue(handler.posts.isEmpty());
        assertEquals(WorkItemStatus.NEW, statusOf(own));
    }

    @Test
    void mixedBatch_keepsOnlyOtherAuthors() {
        WorkItem own = item("evt-1", InboundActor.agent(alpha.getId(), "alpha", "Alpha"));
        WorkItem human = item("evt-2", InboundActor.builder().build());

        dispatcher.runLane(laneRun(alpha, own, human));

        assertEquals(1, runner.calls.size());
        assertEquals("text of evt-2", runner.calls.get(0).options().getInput());
        assertEquals(human.getId(), runner.calls.get(0).workItemId());
    }

    @Test
    void runnerFailure_failsItemsWithoutPosting() {
        WorkItem item = item("evt-1", InboundActor.builder().build());
        runner.failure = new IllegalStateException("model unavailable");

        dispatcher.runLane(laneRun(alpha, item));

        assertEquals(WorkItemStatus.FAILED, statusOf(item));
        assertTrue(handler.posts.isEmpty());
        assertTrue(turns.isEmpty());
    }

    @Test
    void postFailure_feedsCrashGuard() {
        WorkItem item = item("evt-1", InboundActor.builder().build());
        handler.failPosts = true;

        dispatcher.runLane(laneRun(alpha, item));

        assertTrue(crashGuard.isDisabled(instance.getPluginId()));
        assertTrue(turns.isEmpty());
        assertEquals(WorkItemStatus.DONE, statusOf(item));
    }

    @Test
    void disabledPlugin_skipsPosting() {
        WorkItem item = item("evt-1", InboundActor.builder().build());
        fixture.plugins.setPluginEnabled(instance.getPluginId(), false);

        dispatcher.runLane(laneRun(alpha, item));

        assertEquals(1, runner.calls.size());
        assertTrue(handler.posts.isEmpty());
        assertTrue(turns.isEmpty());
    }

    private static SteeringInbox.SteeringMessage steering(WorkItem item) {
        return new SteeringInbox.SteeringMessage(UUID.randomUUID().toString(), item.getId(), "Ada",
                "also " + item.getSourceRef(), System.currentTimeMillis());
    }

    @Test
    void steeredItems_followTheRunToDone() {
        WorkItem item = item("evt-1", InboundActor.builder().build());
        WorkItem steered = item("evt-2", InboundActor.builder().build());
        List<WorkItemStatus> duringRun = new CopyOnWriteArrayList<>();
        runner.whileRunning = options -> {
            assertTrue(options.getSteering().offer(steering(steered)));
            duringRun.add(statusOf(steered));
            options.getSteering().drain();
        };

        dispatcher.runLane(laneRun(alpha, item));

        assertEquals(List.of(WorkItemStatus.RUNNING), duringRun);
        assertEquals(WorkItemStatus.DONE, statusOf(steered));
        assertEquals(WorkItemStatus.DONE, statusOf(item));
    }

    @Test
    void steeredItems_failWithTheRun() {
        WorkItem item = item("evt-1", InboundActor.builder().build());
        WorkItem steered = item("evt-2", InboundActor.builder().build());
        runner.whileRunning = options -> {
            options.getSteering().offer(steering(steered));
            options.getSteering().drain();
        };
        runner.failure = new IllegalStateException("model unavailable");

        dispatcher.runLane(laneRun(alpha, item));

        assertEquals(WorkItemStatus.FAILED, statusOf(steered));
    }

    @Test
    void steeringIsRefusedOnceTheAgentReturned() {
        WorkItem item = item("evt-1", InboundActor.builder().build());
        WorkItem late = item("evt-2", InboundActor.builder().build());
        LaneRun run = laneRun(alpha, item);
        AtomicBoolean acceptedDuringPost = new AtomicBoolean(true);
        handler.beforePost = () -> acceptedDuringPost.set(run.steering().offer(steering(late)));

        dispatcher.runLane(run);

        assertFalse(acceptedDuringPost.get());
        assertEquals(0, run.steering().size());
        assertEquals(WorkItemStatus.NEW, statusOf(late));
    }

    @Test
    void unreadSteering_returnsToNew() {
        WorkItem item = item("evt-1", InboundActor.builder().build());
        WorkItem unread = item("evt-2", InboundActor.builder().build());
        runner.whileRunning = options -> options.getSteering().offer(steering(unread));
        LaneRun run = laneRun(alpha, item);

        dispatcher.runLane(run);

        assertEquals(WorkItemStatus.NEW, statusOf(unread));
        assertEquals(1, run.steering().unread().size());
        assertTrue(run.steering().isClosed());
    }

    @Test
    void steerArrivalDuringReplyPost_getsItsOwnRun() throws Exception {
        WorkItem first = item("evt-1", InboundActor.builder().build());
        WorkItem second = item("evt-2", InboundActor.builder().build());
        CountDownLatch posting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        handler.beforePost = () -> {
            if (handler.posts.isEmpty()) {
                posting.countDown();
                try {
                    assertTrue(release.await(5, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        fixture.queueManager.setRunHandler(dispatcher);
        QueueSettings steer = new QueueSettings(QueueMode.STEER, 0, 10, 10_000, OverflowPolicy.DROP_NEWEST);
        QueueLaneRecord lane = Lanes.conversational(instance.getId(), "fake:room-1", alpha.getId(), steer);

        fixture.queueManager.enqueue(lane, message(first), steer);
        assertTrue(posting.await(5, TimeUnit.SECONDS));
        QueueMessage late = fixture.queueManager.enqueue(lane, message(second), steer).message();
        release.countDown();

        assertTrue(fixture.queueManager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(2, runner.calls.size());
        assertEquals(second.getId(), runner.calls.get(1).workItemId());
        assertEquals(WorkItemStatus.DONE, statusOf(second));
        QueueMessage stored = fixture.queues.listByQueue(lane.getQueueKey()).stream()
                .filter(m -> m.getId().equals(late.getId())).findFirst().orElseThrow();
        assertEquals(QueueMessageStatus.DISPATCHED, stored.getStatus());
        assertEquals(2, handler.posts.size());
    }

    private QueueMessage message(WorkItem item) {
        return QueueMessage.builder()
                .workItemId(item.getId())
                .pluginInstanceId(instance.getId())
                .responseContext("{\"room\":\"room-1\"}")
                .text("text of " + item.getSourceRef())
                .senderName("Ada")
                .arrivedAt(System.currentTimeMillis())
                .build();
    }

    static class ScriptedRunner implements AgentRunner {

        record Call(String agentId, String workItemId, AgentRunOptions options) {
        }

        final List<Call> calls = new CopyOnWriteArrayList<>();
        volatile RuntimeException failure;
        /** Runs while the agent is still working. */
        volatile Consumer<AgentRunOptions> whileRunning = options -> { };

        @Override
        public AgentRunResult runAgent(String agentId, String workItemId, AgentRunOptions options) {
            calls.add(new Call(agentId, workItemId, options));
            whileRunning.accept(options);
            if (failure != null) {
                throw failure;
            }
            return AgentRunResult.builder().job("job-" + calls.size()).finalResponse("reply from " + agentId).build();
        }
    }
}
