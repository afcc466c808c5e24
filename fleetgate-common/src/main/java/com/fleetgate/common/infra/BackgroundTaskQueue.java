package com.fleetgate.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded queue for side effects that run after a transaction has committed
 * (audit events, plugin disablement, downstream publishes).
 * <p>
 * Failed tasks are retried with exponential backoff up to {@code maxAttempts}. A task
 * failure never propagates to the submitter; exhausted tasks are logged.
 * {@link #close()} drains whatever is still queued before shutting down.
 */
@Slf4j
public class BackgroundTaskQueue implements AutoCloseable {

    /** A unit of background work. */
    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    private final int capacity;
    private final int maxAttempts;
    private final Backoff.Policy backoff;
    private final ScheduledExecutorService executor;
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BackgroundTaskQueue(int capacity, int maxAttempts, Backoff.Policy backoff) {
        this.capacity = Math.max(1, capacity);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff != null ? backoff : Backoff.Policy.DEFAULT;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "background-tasks");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue a task.
     *
     * @return {@code false} if the queue is full or closed (the task is dropped)
     */
    public boolean submit(String label, Task task) {
        if (closed.get()) {
            log.warn("Background task dropped, queue closed: {}", label);
            return false;
        }
        if (pending.incrementAndGet() > capacity) {
            pending.decrementAndGet();
            log.warn("Background task dropped, queue full ({}): {}", capacity, label);
            return false;
        }
        try {
            executor.execute(() -> attempt(label, task, 1));
            return true;
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            log.warn("Background task rejected: {}", label);
            return false;
        }
    }

    /** Number of tasks queued or awaiting a retry. */
    public int pendingCount() {
        return pending.get();
    }

    /**
     * Wait until no task is queued or retrying.
     *
     * @return {@code true} if the queue became idle within the timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    private void attempt(String label, Task task, int attempt) {
        try {
            task.run();
            pending.decrementAndGet();
        } catch (Exception e) {
            if (attempt >= maxAttempts || closed.get()) {
                pending.decrementAndGet();
                log.error("Background task failed after {} attempt(s): {}", attempt, label, e);
                return;
            }
            long delay = Backoff.compute(backoff, attempt);
            log.warn("Background task failed (attempt {}/{}), retrying in {}ms: {}: {}",
                    attempt, maxAttempts, delay, label, e.getMessage());
            try {
                executor.schedule(() -> attempt(label, task, attempt + 1), delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException rejected) {
                pending.decrementAndGet();
                log.error("Background task abandoned during shutdown: {}", label);
            }
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Background tasks still pending at shutdown: {}", pending.get());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
