package com.fleetgate.plugin.runtime;

import com.fleetgate.common.infra.BackgroundTaskQueue;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Circuit breaker for channel integrations.
 * <p>
 * Keeps a sliding window of failure timestamps per plugin. Reaching {@code threshold}
 * failures inside {@code windowMs} disables the plugin in-process at once; persisting the
 * disablement is queued as a background task and does not gate the decision. A success
 * clears the window entirely.
 */
@Slf4j
public class CrashGuard {

    private final int threshold;
    private final long windowMs;
    private final AutoDisableRecorder recorder;
    private final BackgroundTaskQueue tasks;
    private final LongSupplier clock;

    private final Map<String, Deque<Long>> failures = new HashMap<>();
    private final Set<String> disabled = new HashSet<>();

    public CrashGuard(int threshold, long windowMs, AutoDisableRecorder recorder, BackgroundTaskQueue tasks) {
        this(threshold, windowMs, recorder, tasks, System::currentTimeMillis);
    }

    /** Constructor for testing – allows injecting the millisecond clock. */
    public CrashGuard(int threshold, long windowMs, AutoDisableRecorder recorder, BackgroundTaskQueue tasks,
            LongSupplier clock) {
        this.threshold = threshold > 0 ? threshold : 5;
        this.windowMs = windowMs > 0 ? windowMs : 300_000;
        this.recorder = recorder;
        this.tasks = tasks;
        this.clock = clock;
    }

    /**
     * Record a failure for a plugin.
     *
     * @return {@code true} if the plugin is disabled (now or already)
     */
    public boolean recordFailure(String pluginId) {
        int count;
        synchronized (this) {
            if (disabled.contains(pluginId)) {
                return true;
            }
            long now = clock.getAsLong();
            Deque<Long> window = failures.computeIfAbsent(pluginId, k -> new ArrayDeque<>());
            window.addLast(now);
            long cutoff = now - windowMs;
            while (!window.isEmpty() && window.peekFirst() < cutoff) {
                window.pollFirst();
            }
            count = window.size();
            if (count < threshold) {
                return false;
            }
            disabled.add(pluginId);
            failures.remove(pluginId);
        }

        log.warn("Auto-disabling plugin {} after {} failures in {}ms window", pluginId, count, windowMs);
        final int failureCount = count;
        tasks.submit("crash-guard auto-disable " + pluginId,
                () -> recorder.recordAutoDisable(pluginId, failureCount, windowMs, threshold));
        return true;
    }

    /**
     * Record a successful execution, clearing the failure window.
     */
    public synchronized void recordSuccess(String pluginId) {
        failures.remove(pluginId);
    }

    public synchronized boolean isDisabled(String pluginId) {
        return disabled.contains(pluginId);
    }

    /**
     * Clear all state for a plugin, e.g. after an operator re-enables it.
     */
    public synchronized void resetPlugin(String pluginId) {
        disabled.remove(pluginId);
        failures.remove(pluginId);
    }

    synchronized int failureCount(String pluginId) {
        Deque<Long> window = failures.get(pluginId);
        return window == null ? 0 : window.size();
    }

    public int getThreshold() {
        return threshold;
    }

    public long getWindowMs() {
        return windowMs;
    }
}
