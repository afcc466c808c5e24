package com.fleetgate.common.infra;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackgroundTaskQueueTest {

    private static final Backoff.Policy FAST = new Backoff.Policy(5, 20, 2.0, 0.0);

    private BackgroundTaskQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.close();
        }
    }

    @Test
    void submit_runsTask() throws Exception {
        queue = new BackgroundTaskQueue(10, 3, FAST);
        var latch = new CountDownLatch(1);

        assertTrue(queue.submit("ping", latch::countDown));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(queue.awaitIdle(Duration.ofSeconds(2)));
        assertEquals(0, queue.pendingCount());
    }

    @Test
    void failingTask_retriedUntilSuccess() throws Exception {
        queue = new BackgroundTaskQueue(10, 5, FAST);
        var calls = new AtomicInteger();

        queue.submit("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("boom");
            }
        });

        assertTrue(queue.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(3, calls.get());
    }

    @Test
    void failingTask_stopsAfterMaxAttempts() throws Exception {
        queue = new BackgroundTaskQueue(10, 2, FAST);
        var calls = new AtomicInteger();

        queue.submit("broken", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("always");
        });

        assertTrue(queue.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(2, calls.get());
    }

    @Test
    void submit_fullQueue_rejects() throws Exception {
        queue = new BackgroundTaskQueue(1, 1, FAST);
        var release = new CountDownLatch(1);

        assertTrue(queue.submit("blocker", release::await));
        assertFalse(queue.submit("overflow", () -> { }));

        release.countDown();
        assertTrue(queue.awaitIdle(Duration.ofSeconds(2)));
    }

    @Test
    void submit_afterClose_rejects() {
        queue = new BackgroundTaskQueue(10, 1, FAST);
        queue.close();
        assertFalse(queue.submit("late", () -> { }));
    }

    @Test
    void backoff_growsAndCaps() {
        var policy = new Backoff.Policy(100, 1_000, 2.0, 0.0);
        assertEquals(100, Backoff.compute(policy, 1));
        assertEquals(200, Backoff.compute(policy, 2));
        assertEquals(400, Backoff.compute(policy, 3));
        assertEquals(1_000, Backoff.compute(policy, 10));
    }
}
