package com.fleetgate.gateway.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.channel.adapter.ActorKind;
import com.fleetgate.channel.adapter.InboundActor;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.error.TransientDispatchException;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.events.EventPublication;
import com.fleetgate.gateway.queue.Lanes;
import com.fleetgate.gateway.queue.QueueSettings;
import com.fleetgate.gateway.queue.QueueSettingsResolver;
import com.fleetgate.gateway.queue.SessionQueueManager;
import com.fleetgate.store.AgentRepository;
import com.fleetgate.store.Database;
import com.fleetgate.store.QueueRepository;
import com.fleetgate.store.RoutineRepository;
import com.fleetgate.store.ScheduledItemRepository;
import com.fleetgate.store.WorkItemRepository;
import com.fleetgate.store.model.QueueMessage;
import com.fleetgate.store.model.Routine;
import com.fleetgate.store.model.ScheduledItem;
import com.fleetgate.store.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls due scheduled items and turns each into a work item on the agent's scheduler
 * lane. Claims are conditional updates, so several processes may tick the same store;
 * within a process an overlapping tick is skipped.
 */
@Slf4j
public class SchedulerTicker {

    private static final long MIN_INTERVAL_MS = 100;
    private static final String SENDER_NAME = "scheduler";

    private final Database database;
    private final ScheduledItemRepository scheduledItems;
    private final AgentRepository agents;
    private final WorkItemRepository workItems;
    private final QueueRepository queues;
    private final RoutineRepository routines;
    private final SessionQueueManager queueManager;
    private final QueueSettingsResolver settingsResolver;
    private final EventPublication publication;
    private final FleetConfig.SchedulerConfig config;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService executor;
    private volatile Instant lastTickAt;

    public SchedulerTicker(Database database, ScheduledItemRepository scheduledItems, AgentRepository agents,
            WorkItemRepository workItems, QueueRepository queues, RoutineRepository routines,
            SessionQueueManager queueManager, QueueSettingsResolver settingsResolver, EventPublication publication,
            FleetConfig.SchedulerConfig config, Clock clock) {
        this.database = database;
        this.scheduledItems = scheduledItems;
        this.agents = agents;
        this.workItems = workItems;
        this.queues = queues;
        this.routines = routines;
        this.queueManager = queueManager;
        this.settingsResolver = settingsResolver;
        this.publication = publication;
        this.config = config;
        this.clock = clock;
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Start ticking: one tick immediately, then every {@code tickIntervalMs}.
     */
    public synchronized void start() {
        if (!config.isEnabled()) {
            log.info("Scheduler ticker disabled by configuration");
            return;
        }
        if (executor != null) {
            return;
        }
        long interval = Math.max(MIN_INTERVAL_MS, config.getTickIntervalMs());
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scheduler-ticker");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::runScheduledTick, 0, interval, TimeUnit.MILLISECONDS);
        log.info("Scheduler ticker started with interval {}ms", interval);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
        log.info("Scheduler ticker stopped");
    }

    public synchronized boolean isStarted() {
        return executor != null;
    }

    public Instant getLastTickAt() {
        return lastTickAt;
    }

    private void runScheduledTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.warn("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    // ── Tick ────────────────────────────────────────────────────────────

    /**
     * Run one pass over due items.
     */
    public TickReport tick() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Previous scheduler tick still running; skipping");
            return TickReport.overlapping();
        }
        try {
            return doTick();
        } finally {
            lastTickAt = clock.instant();
            running.set(false);
        }
    }

    private TickReport doTick() {
        long now = clock.instant().getEpochSecond();
        int recovered = scheduledItems.recoverStaleFiringItems(config.getStaleThresholdSeconds(), now);
        if (recovered > 0) {
            log.info("Recovered {} stale firing item(s)", recovered);
        }

        List<ScheduledItem> due = scheduledItems.listDue(now);
        if (due.isEmpty()) {
            return new TickReport(recovered, 0, 0, 0, 0, false);
        }
        log.info("Processing {} due scheduled item(s)", due.size());

        int fired = 0;
        int skipped = 0;
        int failed = 0;
        for (ScheduledItem item : due) {
            switch (process(item, now)) {
                case FIRED -> fired++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        return new TickReport(recovered, due.size(), fired, skipped, failed, false);
    }

    private enum Outcome {
        FIRED,
        SKIPPED,
        FAILED
    }

    private record Fired(WorkItem workItem, QueueRepository.LaneEnqueue stored) {
    }

    private Outcome process(ScheduledItem item, long now) {
        if (!scheduledItems.claim(item.getId(), now)) {
            log.debug("Scheduled item {} already claimed", item.getId());
            return Outcome.SKIPPED;
        }

        Fired fired;
        QueueSettings settings = settingsResolver.schedulerSettings();
        try {
            if (agents.findById(item.getAgentId()).isEmpty()) {
                log.warn("Agent {} not found, skipping scheduled item {}", item.getAgentId(), item.getId());
                scheduledItems.confirmFired(item.getId());
                return Outcome.SKIPPED;
            }
            fired = fire(item, settings, now);
        } catch (RuntimeException e) {
            log.error("Failed to fire scheduled item {}", item.getId(), e);
            release(item);
            return Outcome.FAILED;
        }

        queueManager.accept(fired.stored().lane(), fired.stored().message(), settings);
        publication.publishCreated(fired.workItem());
        log.info("Fired scheduled item: {} ({}) for agent {}", item.getId(), item.getType(), item.getAgentId());
        return Outcome.FIRED;
    }

    private Fired fire(ScheduledItem item, QueueSettings settings, long now) {
        WorkItem workItem = toWorkItem(item);
        String text = messageText(item);
        return database.transaction(conn -> {
            workItems.create(conn, workItem);

            QueueMessage message = QueueMessage.builder()
                    .workItemId(workItem.getId())
                    .pluginInstanceId(item.getPluginInstanceId())
                    .responseContext(item.getResponseContext())
                    .text(text)
                    .senderName(SENDER_NAME)
                    .arrivedAt(clock.millis())
                    .build();
            QueueRepository.LaneEnqueue stored = queues.enqueueToLane(conn,
                    Lanes.scheduler(item.getSessionKey(), item.getAgentId(), item.getPluginInstanceId(), settings),
                    message);

            Optional<ScheduledItem> confirmed = scheduledItems.confirmFired(conn, item.getId());
            if (confirmed.isEmpty()) {
                throw new TransientDispatchException(
                        "Scheduled item " + item.getId() + " was not in firing state during confirm");
            }

            if (item.getRoutineRunId() != null) {
                routines.linkRunToWorkItem(conn, item.getRoutineRunId(), workItem.getId());
            }
            if (item.getRoutineId() != null) {
                Optional<Routine> routine = routines.findById(conn, item.getRoutineId());
                boolean oneShot = routine.map(r -> Routine.TRIGGER_ONESHOT.equals(r.getTriggerKind())).orElse(false);
                routines.recordFired(conn, item.getRoutineId(), now, oneShot);
            }
            return new Fired(workItem, stored);
        });
    }

    private void release(ScheduledItem item) {
        try {
            if (!scheduledItems.release(item.getId())) {
                log.warn("Scheduled item {} was no longer firing at release", item.getId());
            }
        } catch (RuntimeException e) {
            log.error("Failed to release scheduled item {}; left to stale recovery", item.getId(), e);
        }
    }

    static WorkItem toWorkItem(ScheduledItem item) {
        boolean routine = item.getRoutineId() != null;
        ObjectNode payload = JsonMapper.object();
        JsonNode original = parsePayload(item.getPayload());
        if (original.isObject()) {
            payload.setAll((ObjectNode) original);
        }
        if (!payload.hasNonNull("body")) {
            payload.put("body", messageText(item));
        }
        payload.put("senderName", SENDER_NAME);
        payload.set("actor", InboundActor.builder().kind(ActorKind.SYSTEM).handle(SENDER_NAME)
                .displayName(SENDER_NAME).source(routine ? "routine" : "scheduler").build().toJson());
        payload.put("scheduledItemId", item.getId());
        payload.put("type", item.getType());
        if (item.getResponseContext() != null) {
            payload.set("responseContext", parsePayload(item.getResponseContext()));
        }
        return WorkItem.builder()
                .source(routine ? "routine" : "scheduler")
                .sourceRef(routine
                        ? "routine:" + item.getRoutineId() + ":scheduled:" + item.getId()
                        : "scheduled:" + item.getId())
                .pluginInstanceId(item.getPluginInstanceId())
                .sessionKey(item.getSessionKey())
                .title("Scheduled: " + item.getType())
                .payload(JsonMapper.write(payload))
                .build();
    }

    /**
     * The prompt for the agent: the payload's {@code body}, {@code text} or
     * {@code prompt} field, else the raw payload.
     */
    static String messageText(ScheduledItem item) {
        JsonNode payload = parsePayload(item.getPayload());
        for (String field : new String[]{"body", "text", "prompt"}) {
            String value = JsonMapper.text(payload, field);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return item.getPayload() != null ? item.getPayload() : "";
    }

    private static JsonNode parsePayload(String raw) {
        if (raw == null || raw.isBlank()) {
            return JsonMapper.object();
        }
        try {
            return JsonMapper.read(raw);
        } catch (IllegalArgumentException e) {
            return JsonMapper.mapper().getNodeFactory().textNode(raw);
        }
    }
}
