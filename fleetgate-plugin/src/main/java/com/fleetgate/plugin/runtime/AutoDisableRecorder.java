package com.fleetgate.plugin.runtime;

/**
 * Persists a crash-guard disablement. Called off the request path.
 */
@FunctionalInterface
public interface AutoDisableRecorder {

    void recordAutoDisable(String pluginId, int failureCount, long windowMs, int threshold) throws Exception;
}
