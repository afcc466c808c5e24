package com.fleetgate.gateway.queue;

import com.fleetgate.gateway.agent.SteeringInbox;
import com.fleetgate.store.Database;
import com.fleetgate.store.QueueRepository;
import com.fleetgate.store.WorkItemRepository;
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
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SessionQueueManagerTest {

    private static final String KEY = QueueKeys.conversational("inst-1", "telegram:42", "agent-1");

    @TempDir
    Path tempDir;

    private Database database;
    private QueueRepository queues;
    private WorkItemRepository workItems;
    private SessionQueueManager manager;
    private final List<LaneRun> runs = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        database = new Database(tempDir.resolve("queue.db"), 5_000);
        database.init();
        queues = new QueueRepository(database);
        workItems = new WorkItemRepository(database);
        manager = new SessionQueueManager(queues, 4, ZoneOffset.UTC, System::currentTimeMillis);
        manager.setRunHandler(runs::add);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private static QueueSettings settings(QueueMode mode, long debounceMs, int maxQueued, OverflowPolicy policy) {
        return new QueueSettings(mode, debounceMs, maxQueued, 10_000, policy);
    }

    private QueueMessage enqueue(String text, QueueSettings settings) {
        return enqueue(text, "wi-" + text, settings);
    }

    private QueueMessage enqueue(String text, String workItemId, QueueSettings settings) {
        QueueLaneRecord lane = Lanes.conversational("inst-1", "telegram:42", "agent-1", settings);
        QueueMessage message = QueueMessage.builder()
                .workItemId(workItemId)
                .pluginInstanceId("inst-1")
                .text(text)
                .senderName("Ada")
                .arrivedAt(System.currentTimeMillis())
                .build();
        return manager.enqueue(lane, message, settings).message();
    }

    private Map<String, QueueMessage> storedByText() {
        return queues.listByQueue(KEY).stream().collect(Collectors.toMap(QueueMessage::getText, Function.identity()));
    }

    @Test
    void collect_coalescesBurstIntoOneRun() throws Exception {
        QueueSettings collect = settings(QueueMode.COLLECT, 150, 10, OverflowPolicy.DROP_NEWEST);
        enqueue("one", collect);
        enqueue("two", collect);
        enqueue("three", collect);

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(1, runs.size());
        LaneRun run = runs.get(0);
        assertEquals(3, run.messages().size());
        assertTrue(run.input().startsWith("[3 messages arrived while you were working]"));
        assertTrue(run.input().endsWith("- Ada] three"));
        assertTrue(queues.listByQueue(KEY).stream()
                .allMatch(m -> m.getStatus() == QueueMessageStatus.DISPATCHED
                        && run.dispatchId().equals(m.getDispatchId())));
        assertEquals(0, manager.activeLaneCount());
    }

    @Test
    void followup_runsEachMessageSeriallyInOrder() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        manager.setRunHandler(run -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            Thread.sleep(30);
            runs.add(run);
            active.decrementAndGet();
        });
        QueueSettings followup = settings(QueueMode.FOLLOWUP, 50, 10, OverflowPolicy.DROP_NEWEST);
        enqueue("a", followup);
        enqueue("b", followup);
        enqueue("c", followup);

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(List.of("a", "b", "c"), runs.stream().map(LaneRun::input).toList());
        assertEquals(1, maxActive.get());
        assertEquals(3, runs.stream().map(LaneRun::dispatchId).distinct().count());
    }

    @Test
    void steer_deliversArrivalsIntoActiveRunWithoutNewDispatch() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<SteeringInbox.SteeringMessage> steered = new CopyOnWriteArrayList<>();
        manager.setRunHandler(run -> {
            runs.add(run);
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            steered.addAll(run.steering().drain());
        });
        QueueSettings steer = settings(QueueMode.STEER, 20, 10, OverflowPolicy.DROP_NEWEST);
        enqueue("start", steer);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        enqueue("also this", steer);
        enqueue("and this", steer);
        release.countDown();

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(1, runs.size());
        assertEquals(List.of("also this", "and this"), steered.stream().map(SteeringInbox.SteeringMessage::text).toList());
        String dispatchId = runs.get(0).dispatchId();
        assertTrue(queues.listByQueue(KEY).stream().allMatch(m -> dispatchId.equals(m.getDispatchId())));
    }

    @Test
    void collect_arrivalsDuringRunBecomeOneFollowUpRun() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        manager.setRunHandler(run -> {
            runs.add(run);
            if (runs.size() == 1) {
                started.countDown();
                assertTrue(release.await(5, TimeUnit.SECONDS));
            }
        });
        QueueSettings collect = settings(QueueMode.COLLECT, 20, 10, OverflowPolicy.DROP_NEWEST);
        enqueue("first", collect);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        enqueue("second", collect);
        enqueue("third", collect);
        release.countDown();

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(2, runs.size());
        assertEquals(2, runs.get(1).messages().size());
    }

    @Test
    void overflow_dropNewest_recordsQueueFull() throws Exception {
        QueueSettings capped = settings(QueueMode.FOLLOWUP, 200, 2, OverflowPolicy.DROP_NEWEST);
        enqueue("m1", capped);
        enqueue("m2", capped);
        enqueue("m3", capped);

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));

        Map<String, QueueMessage> stored = storedByText();
        assertEquals(QueueMessageStatus.DROPPED, stored.get("m3").getStatus());
        assertEquals("queue_full", stored.get("m3").getDropReason());
        assertEquals(List.of("m1", "m2"), runs.stream().map(LaneRun::input).toList());
    }

    @Test
    void overflow_dropOldest_evictsHead() throws Exception {
        QueueSettings capped = settings(QueueMode.FOLLOWUP, 200, 2, OverflowPolicy.DROP_OLDEST);
        enqueue("m1", capped);
        enqueue("m2", capped);
        enqueue("m3", capped);

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));

        Map<String, QueueMessage> stored = storedByText();
        assertEquals(QueueMessageStatus.DROPPED, stored.get("m1").getStatus());
        assertEquals("evicted", stored.get("m1").getDropReason());
        assertEquals(List.of("m2", "m3"), runs.stream().map(LaneRun::input).toList());
    }

    @Test
    void debounce_isCappedByMaxWait() throws Exception {
        QueueSettings settings = new QueueSettings(QueueMode.COLLECT, 300, 20, 500, OverflowPolicy.DROP_NEWEST);
        long startedAt = System.currentTimeMillis();
        AtomicInteger firstRunOffset = new AtomicInteger(-1);
        manager.setRunHandler(run -> {
            firstRunOffset.compareAndSet(-1, (int) (System.currentTimeMillis() - startedAt));
            runs.add(run);
        });
        for (int i = 0; i < 10; i++) {
            enqueue("m" + i, settings);
            Thread.sleep(100);
        }

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));
        assertTrue(firstRunOffset.get() >= 0 && firstRunOffset.get() < 1_000,
                "first run started at +" + firstRunOffset.get() + "ms");
        assertTrue(runs.get(0).messages().size() < 10);
        assertEquals(10, runs.stream().mapToInt(run -> run.messages().size()).sum());
    }

    @Test
    void persistedModeOfExistingLane_isKept() throws Exception {
        enqueue("one", settings(QueueMode.FOLLOWUP, 20, 10, OverflowPolicy.DROP_NEWEST));
        QueueMessage second = enqueue("two", settings(QueueMode.COLLECT, 20, 10, OverflowPolicy.DROP_NEWEST));

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(QueueMode.FOLLOWUP, queues.findLane(KEY).orElseThrow().getMode());
        assertEquals(KEY, second.getQueueKey());
    }

    @Test
    void overflow_droppedMessageCancelsItsWorkItem() throws Exception {
        WorkItem item = database.transaction(conn -> workItems.create(conn, WorkItem.builder()
                .source("telegram").sourceRef("telegram:42:9").pluginInstanceId("inst-1")
                .sessionKey("telegram:42").title("m3").build()));
        QueueSettings capped = settings(QueueMode.FOLLOWUP, 200, 2, OverflowPolicy.DROP_NEWEST);
        enqueue("m1", capped);
        enqueue("m2", capped);
        enqueue("m3", item.getId(), capped);

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(QueueMessageStatus.DROPPED, storedByText().get("m3").getStatus());
        assertEquals(WorkItemStatus.CANCELED, workItems.findById(item.getId()).orElseThrow().getStatus());
    }

    @Test
    void collect_burstBeyondMaxQueued_carriesRemainderIntoNextRun() throws Exception {
        QueueSettings collect = settings(QueueMode.COLLECT, 150, 3, OverflowPolicy.DROP_NEWEST);
        for (int i = 1; i <= 5; i++) {
            enqueue("m" + i, collect);
        }

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(List.of(3, 2), runs.stream().map(run -> run.messages().size()).toList());
        assertEquals("m1", runs.get(0).messages().get(0).getText());
        assertEquals("m4", runs.get(1).messages().get(0).getText());
        assertTrue(queues.listByQueue(KEY).stream().allMatch(m -> m.getStatus() == QueueMessageStatus.DISPATCHED));
    }

    @Test
    void steer_idleBurstBeyondMaxQueued_isNotDropped() throws Exception {
        QueueSettings steer = settings(QueueMode.STEER, 150, 2, OverflowPolicy.DROP_OLDEST);
        enqueue("a", steer);
        enqueue("b", steer);
        enqueue("c", steer);

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(List.of(2, 1), runs.stream().map(run -> run.messages().size()).toList());
        assertTrue(queues.listByQueue(KEY).stream().noneMatch(m -> m.getStatus() == QueueMessageStatus.DROPPED));
    }

    @Test
    void schedulerLane_neverShedsFiredTimers() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        manager.setRunHandler(run -> {
            runs.add(run);
            if (runs.size() == 1) {
                started.countDown();
                assertTrue(release.await(5, TimeUnit.SECONDS));
            }
        });
        QueueSettings timers = new QueueSettings(QueueMode.FOLLOWUP, 0, 1, 10_000, OverflowPolicy.DROP_NEWEST);
        QueueLaneRecord lane = Lanes.scheduler("telegram:42", "agent-1", "inst-1", timers);
        for (String text : List.of("t1", "t2", "t3")) {
            manager.enqueue(lane, QueueMessage.builder().workItemId("wi-" + text).text(text)
                    .arrivedAt(System.currentTimeMillis()).build(), timers);
            if ("t1".equals(text)) {
                assertTrue(started.await(5, TimeUnit.SECONDS));
            }
        }
        release.countDown();

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(List.of("t1", "t2", "t3"), runs.stream().map(LaneRun::input).toList());
        assertTrue(queues.listByQueue(lane.getQueueKey()).stream()
                .allMatch(m -> m.getStatus() == QueueMessageStatus.DISPATCHED));
    }

    @Test
    void steer_arrivalAfterAgentReturned_waitsForNextDispatch() throws Exception {
        CountDownLatch agentDone = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        manager.setRunHandler(run -> {
            runs.add(run);
            if (runs.size() == 1) {
                // Agent returned; the handler is still posting the reply.
                run.steering().close();
                agentDone.countDown();
                assertTrue(release.await(5, TimeUnit.SECONDS));
            }
        });
        QueueSettings steer = settings(QueueMode.STEER, 0, 10, OverflowPolicy.DROP_NEWEST);
        enqueue("first", steer);
        assertTrue(agentDone.await(5, TimeUnit.SECONDS));
        enqueue("late", steer);
        release.countDown();

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(2, runs.size());
        assertEquals("late", runs.get(1).input());
        QueueMessage late = storedByText().get("late");
        assertEquals(QueueMessageStatus.DISPATCHED, late.getStatus());
        assertEquals(runs.get(1).dispatchId(), late.getDispatchId());
    }

    @Test
    void steer_unreadSteeringIsRequeuedForNextDispatch() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        manager.setRunHandler(run -> {
            runs.add(run);
            if (runs.size() == 1) {
                started.countDown();
                assertTrue(release.await(5, TimeUnit.SECONDS));
            }
        });
        QueueSettings steer = settings(QueueMode.STEER, 0, 10, OverflowPolicy.DROP_NEWEST);
        enqueue("first", steer);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        enqueue("unread", steer);
        assertEquals(1, runs.get(0).steering().size());
        release.countDown();

        assertTrue(manager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(2, runs.size());
        assertEquals("unread", runs.get(1).input());
        assertEquals(runs.get(1).dispatchId(), storedByText().get("unread").getDispatchId());
    }
}
