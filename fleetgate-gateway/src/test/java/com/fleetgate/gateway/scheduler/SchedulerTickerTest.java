package com.fleetgate.gateway.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.queue.LaneRun;
import com.fleetgate.gateway.queue.QueueKeys;
import com.fleetgate.gateway.support.GatewayFixture;
import com.fleetgate.store.Database;
import com.fleetgate.store.ScheduledItemRepository;
import com.fleetgate.store.model.AgentRecord;
import com.fleetgate.store.model.QueueMessage;
import com.fleetgate.store.model.QueueMessageStatus;
import com.fleetgate.store.model.QueueMode;
import com.fleetgate.store.model.Routine;
import com.fleetgate.store.model.ScheduledItem;
import com.fleetgate.store.model.ScheduledItemStatus;
import com.fleetgate.store.model.WorkItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTickerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private GatewayFixture fixture;
    private final List<LaneRun> runs = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    private GatewayFixture open(Function<Database, ScheduledItemRepository> repository) {
        Database database = new Database(tempDir.resolve("ticker.db"), 5_000);
        fixture = new GatewayFixture(database, repository.apply(database));
        fixture.queueManager.setRunHandler(runs::add);
        return fixture;
    }

    private SchedulerTicker ticker(GatewayFixture f) {
        return new SchedulerTicker(f.database, f.scheduledItems, f.agents, f.workItems, f.queues, f.routines,
                f.queueManager, f.settingsResolver, f.publication, new FleetConfig.SchedulerConfig(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ScheduledItem schedule(AgentRecord agent, long runAt) {
        return fixture.scheduledItems.create(ScheduledItem.builder()
                .agentId(agent.getId())
                .sessionKey("telegram:42")
                .type("reminder")
                .payload("{\"text\":\"stand-up in 5\"}")
                .runAt(runAt)
                .pluginInstanceId("inst-1")
                .responseContext("{\"chatId\":42}")
                .build());
    }

    private ScheduledItemStatus statusOf(ScheduledItem item) {
        return fixture.scheduledItems.findById(item.getId()).orElseThrow().getStatus();
    }

    @Test
    void dueItem_becomesWorkItemOnSchedulerLane() throws Exception {
        open(ScheduledItemRepository::new);
        AgentRecord agent = fixture.agent("alpha", null, 0);
        ScheduledItem item = schedule(agent, NOW.getEpochSecond() - 5);
        ScheduledItem future = schedule(agent, NOW.getEpochSecond() + 600);

        TickReport report = ticker(fixture).tick();

        assertEquals(new TickReport(0, 1, 1, 0, 0, false), report);
        assertEquals(ScheduledItemStatus.FIRED, statusOf(item));
        assertEquals(ScheduledItemStatus.PENDING, statusOf(future));

        WorkItem workItem = fixture.workItems.findBySourceRef("scheduler", "scheduled:" + item.getId()).orElseThrow();
        assertEquals("Scheduled: reminder", workItem.getTitle());
        assertEquals("telegram:42", workItem.getSessionKey());
        JsonNode payload = JsonMapper.read(workItem.getPayload());
        assertEquals("stand-up in 5", payload.get("body").asText());
        assertEquals("system", payload.get("actor").get("kind").asText());
        assertEquals(42, payload.get("responseContext").get("chatId").asInt());

        String laneKey = QueueKeys.scheduler("telegram:42", agent.getId());
        assertEquals(QueueMode.FOLLOWUP, fixture.queues.findLane(laneKey).orElseThrow().getMode());
        List<QueueMessage> messages = fixture.queues.listByQueue(laneKey);
        assertEquals(1, messages.size());
        assertEquals("stand-up in 5", messages.get(0).getText());

        assertTrue(fixture.queueManager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(1, runs.size());
        assertTrue(fixture.tasks.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(1, fixture.workItems.countEvents(workItem.getId()));
    }

    @Test
    void dueItemsForOneAgent_allRunWhileTheLaneIsBusy() throws Exception {
        open(ScheduledItemRepository::new);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        fixture.queueManager.setRunHandler(run -> {
            runs.add(run);
            if (runs.size() == 1) {
                started.countDown();
                assertTrue(release.await(5, TimeUnit.SECONDS));
            }
        });
        AgentRecord agent = fixture.agent("alpha", null, 0);
        for (int i = 0; i < 3; i++) {
            schedule(agent, NOW.getEpochSecond() - 30 + i);
        }

        TickReport report = ticker(fixture).tick();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        release.countDown();

        assertEquals(3, report.fired());
        assertTrue(fixture.queueManager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(3, runs.size());
        assertEquals(3, runs.stream().map(LaneRun::dispatchId).distinct().count());
        String laneKey = QueueKeys.scheduler("telegram:42", agent.getId());
        assertTrue(fixture.queues.listByQueue(laneKey).stream()
                .allMatch(m -> m.getStatus() == QueueMessageStatus.DISPATCHED));
    }

    @Test
    void overlappingTickers_claimEachItemOnce() throws Exception {
        open(ScheduledItemRepository::new);
        AgentRecord agent = fixture.agent("alpha", null, 0);
        for (int i = 0; i < 20; i++) {
            schedule(agent, NOW.getEpochSecond() - 100 + i);
        }
        SchedulerTicker first = ticker(fixture);
        SchedulerTicker second = ticker(fixture);

        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<TickReport>> reports = new ArrayList<>();
        for (SchedulerTicker ticker : List.of(first, second)) {
            reports.add(pool.submit(() -> {
                go.await();
                return ticker.tick();
            }));
        }
        go.countDown();
        int fired = 0;
        int failed = 0;
        for (Future<TickReport> report : reports) {
            TickReport r = report.get(30, TimeUnit.SECONDS);
            fired += r.fired();
            failed += r.failed();
        }
        pool.shutdown();

        assertEquals(0, failed);
        assertEquals(20, fired);
        assertEquals(20, fixture.workItems.listBySource("scheduler").size());
    }

    @Test
    void confirmFindsItemNotFiring_rollsBackAndReleases() {
        open(database -> new ScheduledItemRepository(database) {
            @Override
            public Optional<ScheduledItem> confirmFired(Connection conn, String id) {
                return Optional.empty();
            }
        });
        AgentRecord agent = fixture.agent("alpha", null, 0);
        ScheduledItem item = schedule(agent, NOW.getEpochSecond() - 5);

        TickReport report = ticker(fixture).tick();

        assertEquals(1, report.failed());
        assertEquals(ScheduledItemStatus.PENDING, statusOf(item));
        assertEquals(0, fixture.workItems.count());
        assertTrue(fixture.queues.listByQueue(QueueKeys.scheduler("telegram:42", agent.getId())).isEmpty());
        assertEquals(0, fixture.queueManager.activeLaneCount());
    }

    @Test
    void staleFiringItem_isRecoveredAndFired() {
        open(ScheduledItemRepository::new);
        AgentRecord agent = fixture.agent("alpha", null, 0);
        ScheduledItem item = schedule(agent, NOW.getEpochSecond() - 3_600);
        assertTrue(fixture.scheduledItems.claim(item.getId(), NOW.getEpochSecond() - 1_000));

        TickReport report = ticker(fixture).tick();

        assertEquals(1, report.recovered());
        assertEquals(1, report.fired());
        assertEquals(ScheduledItemStatus.FIRED, statusOf(item));
    }

    @Test
    void recentFiringItem_isLeftAlone() {
        open(ScheduledItemRepository::new);
        AgentRecord agent = fixture.agent("alpha", null, 0);
        ScheduledItem item = schedule(agent, NOW.getEpochSecond() - 60);
        assertTrue(fixture.scheduledItems.claim(item.getId(), NOW.getEpochSecond() - 10));

        TickReport report = ticker(fixture).tick();

        assertEquals(new TickReport(0, 0, 0, 0, 0, false), report);
        assertEquals(ScheduledItemStatus.FIRING, statusOf(item));
    }

    @Test
    void oneShotRoutine_isLinkedAndDisabled() {
        open(ScheduledItemRepository::new);
        AgentRecord agent = fixture.agent("alpha", null, 0);
        Routine routine = fixture.routines.create(Routine.builder()
                .name("Morning brief")
                .agentId(agent.getId())
                .triggerKind(Routine.TRIGGER_ONESHOT)
                .enabled(true)
                .nextRunAt(NOW.getEpochSecond() - 5)
                .build());
        String itemId = UUID.randomUUID().toString();
        String runId = fixture.routines.createRun(routine.getId(), itemId);
        ScheduledItem linked = fixture.scheduledItems.create(ScheduledItem.builder()
                .id(itemId)
                .agentId(agent.getId())
                .sessionKey("routine:" + routine.getId())
                .type("routine")
                .payload("{\"prompt\":\"Summarize overnight alerts\"}")
                .runAt(NOW.getEpochSecond() - 5)
                .routineId(routine.getId())
                .routineRunId(runId)
                .build());

        TickReport report = ticker(fixture).tick();

        assertEquals(1, report.fired());
        WorkItem workItem = fixture.workItems
                .findBySourceRef("routine", "routine:" + routine.getId() + ":scheduled:" + linked.getId())
                .orElseThrow();
        assertEquals(Optional.of(workItem.getId()), fixture.routines.findRunWorkItemId(runId));
        Routine after = fixture.routines.findById(routine.getId()).orElseThrow();
        assertFalse(after.isEnabled());
        assertNull(after.getNextRunAt());
        assertEquals("fired", after.getLastStatus());
        assertEquals(Long.valueOf(NOW.getEpochSecond()), after.getLastFiredAt());
    }

    @Test
    void missingAgent_confirmsWithoutEnqueue() {
        open(ScheduledItemRepository::new);
        AgentRecord agent = fixture.agent("alpha", null, 0);
        ScheduledItem item = schedule(agent, NOW.getEpochSecond() - 5);
        fixture.agents.delete(agent.getId());

        TickReport report = ticker(fixture).tick();

        assertEquals(1, report.skipped());
        assertEquals(ScheduledItemStatus.FIRED, statusOf(item));
        assertEquals(0, fixture.workItems.count());
    }

    @Test
    void tick_isSkippedWhileAnotherIsRunning() throws Exception {
        open(ScheduledItemRepository::new);
        AgentRecord agent = fixture.agent("alpha", null, 0);
        schedule(agent, NOW.getEpochSecond() - 5);
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Database database = fixture.database;
        SchedulerTicker ticker = new SchedulerTicker(database, new ScheduledItemRepository(database) {
            @Override
            public int recoverStaleFiringItems(long thresholdSeconds, long nowSeconds) {
                inside.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.recoverStaleFiringItems(thresholdSeconds, nowSeconds);
            }
        }, fixture.agents, fixture.workItems, fixture.queues, fixture.routines, fixture.queueManager,
                fixture.settingsResolver, fixture.publication, new FleetConfig.SchedulerConfig(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<TickReport> slow = pool.submit(ticker::tick);
        assertTrue(inside.await(5, TimeUnit.SECONDS));

        assertTrue(ticker.tick().overlapped());

        release.countDown();
        assertEquals(1, slow.get(10, TimeUnit.SECONDS).fired());
        pool.shutdown();
    }
}
