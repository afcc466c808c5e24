package com.fleetgate.gateway.queue;

import com.fleetgate.gateway.agent.SteeringInbox;
import com.fleetgate.store.QueueRepository;
import com.fleetgate.store.model.QueueLaneRecord;
import com.fleetgate.store.model.QueueMessage;
import com.fleetgate.store.model.QueueMode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Per-conversation lanes in front of the agent runner. Messages are persisted
 * first, then admitted to the lane, which debounces, batches or steers them
 * according to its mode. At most one run per lane is active in this process.
 */
@Slf4j
public class SessionQueueManager implements AutoCloseable {

    private final QueueRepository queues;
    private final ExecutorService runners;
    private final ScheduledExecutorService timers;
    private final ZoneId zone;
    private final LongSupplier clock;
    private final Map<String, QueueLane> lanes = new ConcurrentHashMap<>();
    private volatile LaneRunHandler runHandler;

    public SessionQueueManager(QueueRepository queues, int runnerThreads) {
        this(queues, runnerThreads, ZoneId.systemDefault(), System::currentTimeMillis);
    }

    public SessionQueueManager(QueueRepository queues, int runnerThreads, ZoneId zone, LongSupplier clock) {
        this.queues = queues;
        this.runners = Executors.newFixedThreadPool(Math.max(1, runnerThreads), daemonFactory("lane-runner-"));
        this.timers = Executors.newSingleThreadScheduledExecutor(daemonFactory("lane-timer-"));
        this.zone = zone;
        this.clock = clock;
    }

    public void setRunHandler(LaneRunHandler runHandler) {
        this.runHandler = runHandler;
    }

    /**
     * Persist a message into its lane and admit it.
     */
    public QueueRepository.LaneEnqueue enqueue(QueueLaneRecord lane, QueueMessage message, QueueSettings settings) {
        QueueRepository.LaneEnqueue stored = queues.enqueueToLane(lane, message);
        accept(stored.lane(), stored.message(), settings);
        return stored;
    }

    /**
     * Admit an already persisted message to its in-process lane. Used directly by
     * callers that persisted the message inside a wider transaction.
     */
    public void accept(QueueLaneRecord lane, QueueMessage message, QueueSettings settings) {
        while (true) {
            QueueLane state = lanes.computeIfAbsent(lane.getQueueKey(), QueueLane::new);
            synchronized (state) {
                if (state.retired) {
                    continue;
                }
                state.update(lane, settings);
                admit(state, message);
                return;
            }
        }
    }

    public int activeLaneCount() {
        return lanes.size();
    }

    public boolean isRunning(String queueKey) {
        QueueLane state = lanes.get(queueKey);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            return state.state() == QueueLane.State.RUNNING;
        }
    }

    /**
     * Wait until every lane has drained and been removed.
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!lanes.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    @Override
    public void close() {
        timers.shutdownNow();
        runners.shutdown();
        try {
            if (!runners.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Lane runners still busy at shutdown: {} lanes", lanes.size());
                runners.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runners.shutdownNow();
        }
    }

    // --- lane state machine; every method below runs under the lane's monitor ---

    private void admit(QueueLane state, QueueMessage message) {
        if (state.mode() == QueueMode.STEER && state.active != null && steer(state, message)) {
            return;
        }
        if (dropsOnOverflow(state) && state.pending.size() >= state.settings.maxQueued()) {
            OverflowPolicy policy = state.settings.overflowPolicy();
            if (policy == OverflowPolicy.DROP_NEWEST) {
                drop(state, message, policy);
                return;
            }
            drop(state, state.pending.pollFirst(), policy);
        }
        state.pending.addLast(message);
        if (state.active == null) {
            scheduleFlush(state);
        }
    }

    /**
     * Only conversational followup lanes shed messages. Collect and steer lanes carry
     * overflow into later dispatches, and scheduler lanes hold timers that already fired.
     */
    private static boolean dropsOnOverflow(QueueLane state) {
        return state.mode() == QueueMode.FOLLOWUP && !QueueKeys.isScheduler(state.queueKey);
    }

    /**
     * @return false when the active run's agent already returned; the message then waits
     *         for the next dispatch
     */
    private boolean steer(QueueLane state, QueueMessage message) {
        QueueLane.ActiveRun run = state.active;
        boolean accepted = run.steering().offer(new SteeringInbox.SteeringMessage(message.getId(),
                message.getWorkItemId(), message.getSenderName(), message.getText(), message.getArrivedAt()));
        if (!accepted) {
            log.debug("Run {} on {} is finishing; queueing {} for the next dispatch",
                    run.dispatchId(), state.queueKey, message.getId());
            return false;
        }
        run.steered().put(message.getId(), message);
        queues.markDispatched(List.of(message.getId()), run.dispatchId());
        log.debug("Steered message {} into active run {} on {}", message.getId(), run.dispatchId(), state.queueKey);
        return true;
    }

    /**
     * Put steering messages the agent never read back at the head of the lane.
     */
    private void requeueUnread(QueueLane state, QueueLane.ActiveRun run) {
        List<QueueMessage> unread = new ArrayList<>();
        for (SteeringInbox.SteeringMessage steering : run.steering().reclaim()) {
            QueueMessage message = run.steered().get(steering.messageId());
            if (message != null) {
                unread.add(message);
            }
        }
        if (unread.isEmpty()) {
            return;
        }
        try {
            queues.requeue(unread.stream().map(QueueMessage::getId).toList());
        } catch (RuntimeException e) {
            log.error("Could not return {} unread message(s) to pending on {}", unread.size(), state.queueKey, e);
        }
        for (int i = unread.size() - 1; i >= 0; i--) {
            state.pending.addFirst(unread.get(i));
        }
        log.info("Requeued {} unread steering message(s) from run {} on {}",
                unread.size(), run.dispatchId(), state.queueKey);
    }

    private void drop(QueueLane state, QueueMessage message, OverflowPolicy policy) {
        queues.markDropped(message.getId(), policy.dropReason());
        log.warn("Dropped message {} on {}: {}", message.getId(), state.queueKey, policy.dropReason());
    }

    private void scheduleFlush(QueueLane state) {
        long now = clock.getAsLong();
        long debounce = state.settings.debounceMs();
        if (state.flushDeadline == 0) {
            state.flushDeadline = now + Math.max(debounce, state.settings.maxDebounceWaitMs());
        }
        long delay = Math.max(0, Math.min(debounce, state.flushDeadline - now));
        if (state.timer != null) {
            state.timer.cancel(false);
        }
        try {
            state.timer = timers.schedule(() -> flush(state), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Queue manager is shut down; leaving {} pending on {}", state.pending.size(), state.queueKey);
        }
    }

    private void flush(QueueLane state) {
        synchronized (state) {
            state.timer = null;
            if (state.retired || state.active != null) {
                return;
            }
            if (state.pending.isEmpty()) {
                retire(state);
                return;
            }
            startRun(state);
        }
    }

    private void startRun(QueueLane state) {
        int limit = state.mode() == QueueMode.FOLLOWUP ? 1 : Math.max(1, state.settings.maxQueued());
        List<QueueMessage> batch = new ArrayList<>();
        while (batch.size() < limit && !state.pending.isEmpty()) {
            batch.add(state.pending.pollFirst());
        }
        state.flushDeadline = 0;
        QueueLane.ActiveRun run = new QueueLane.ActiveRun(UUID.randomUUID().toString(), new SteeringInbox());
        state.active = run;
        LaneRun laneRun = new LaneRun(state.record, run.dispatchId(), List.copyOf(batch),
                MessageCoalescer.coalesce(batch, zone), run.steering());
        try {
            runners.execute(() -> execute(state, run, laneRun));
        } catch (RejectedExecutionException e) {
            state.active = null;
            for (int i = batch.size() - 1; i >= 0; i--) {
                state.pending.addFirst(batch.get(i));
            }
            log.warn("Queue manager is shut down; run {} on {} not started", run.dispatchId(), state.queueKey);
        }
    }

    private void execute(QueueLane state, QueueLane.ActiveRun active, LaneRun run) {
        try {
            List<String> ids = run.messages().stream().map(QueueMessage::getId).toList();
            queues.markDispatched(ids, run.dispatchId());
            LaneRunHandler handler = runHandler;
            if (handler == null) {
                log.warn("No run handler bound; dispatch {} on {} has no effect", run.dispatchId(), state.queueKey);
            } else {
                log.info("Dispatching {} message(s) on {} as {}", ids.size(), state.queueKey, run.dispatchId());
                handler.runLane(run);
            }
        } catch (Exception e) {
            log.error("Lane run {} on {} failed", run.dispatchId(), state.queueKey, e);
        } finally {
            synchronized (state) {
                state.active = null;
                requeueUnread(state, active);
                if (!state.pending.isEmpty()) {
                    startRun(state);
                } else if (state.timer == null) {
                    retire(state);
                }
            }
        }
    }

    private void retire(QueueLane state) {
        state.retired = true;
        lanes.remove(state.queueKey, state);
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
