package com.fleetgate.gateway.queue;

import com.fleetgate.gateway.agent.SteeringInbox;
import com.fleetgate.store.model.QueueLaneRecord;
import com.fleetgate.store.model.QueueMessage;
import com.fleetgate.store.model.QueueMode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * In-process runtime state of one lane. Guarded by its own monitor.
 */
final class QueueLane {

    enum State {
        IDLE,
        DEBOUNCING,
        RUNNING
    }

    /** {@code steered} maps message id to the queue message offered into the run; lane monitor only. */
    record ActiveRun(String dispatchId, SteeringInbox steering, Map<String, QueueMessage> steered) {

        ActiveRun(String dispatchId, SteeringInbox steering) {
            this(dispatchId, steering, new HashMap<>());
        }
    }

    final String queueKey;
    final Deque<QueueMessage> pending = new ArrayDeque<>();
    QueueLaneRecord record;
    QueueSettings settings;
    ScheduledFuture<?> timer;
    /** Latest instant (epoch ms) a debounce reset may push the flush to; 0 when nothing is buffered. */
    long flushDeadline;
    ActiveRun active;
    /** Removed from the lane map; callers must create a fresh lane. */
    boolean retired;

    QueueLane(String queueKey) {
        this.queueKey = queueKey;
    }

    void update(QueueLaneRecord latest, QueueSettings latestSettings) {
        this.record = latest;
        this.settings = latestSettings;
    }

    QueueMode mode() {
        if (record != null && record.getMode() != null) {
            return record.getMode();
        }
        return settings.mode();
    }

    State state() {
        if (active != null) {
            return State.RUNNING;
        }
        return timer != null ? State.DEBOUNCING : State.IDLE;
    }
}
