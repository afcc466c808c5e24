package com.fleetgate.common.config;

import lombok.Data;

/**
 * Root configuration type for FleetGate. Loaded from {@code fleetgate.json}.
 */
@Data
public class FleetConfig {

    /** Relational store settings. */
    private StoreConfig store = new StoreConfig();

    /** Session queue defaults. */
    private QueueConfig queue = new QueueConfig();

    /** Scheduler ticker settings. */
    private SchedulerConfig scheduler = new SchedulerConfig();

    /** Plugin crash guard thresholds. */
    private CrashGuardConfig crashGuard = new CrashGuardConfig();

    /** Channel credential caching. */
    private CredentialsConfig credentials = new CredentialsConfig();

    /** Post-commit background task queue. */
    private TasksConfig tasks = new TasksConfig();

    /** Agent execution collaborator endpoint. */
    private AgentRunnerConfig agentRunner = new AgentRunnerConfig();

    // --- Nested config types ---

    @Data
    public static class StoreConfig {
        /** SQLite database file. */
        private String path = "~/.fleetgate/fleetgate.db";
        private int busyTimeoutMs = 10_000;
    }

    @Data
    public static class QueueConfig {
        /** collect | followup | steer */
        private String mode = "steer";
        private long debounceMs = 2_000;
        private int maxQueued = 10;
        /** Upper bound on how long new arrivals may keep extending a debounce window. */
        private long maxDebounceWaitMs = 10_000;
        /** Extra debounce per candidate index when one event fans out to several agents. */
        private long agentStaggerMs = 5_000;
        /** drop_newest | drop_oldest */
        private String overflowPolicy = "drop_newest";
        private int runnerThreads = 8;
    }

    @Data
    public static class SchedulerConfig {
        private boolean enabled = true;
        private long tickIntervalMs = 30_000;
        private long staleThresholdSeconds = 300;
    }

    @Data
    public static class CrashGuardConfig {
        private int threshold = 5;
        private long windowMs = 300_000;
    }

    @Data
    public static class CredentialsConfig {
        private long skewSeconds = 30;
        private long defaultTtlSeconds = 3_600;
        private String githubApiBaseUrl = "https://api.github.com";
    }

    @Data
    public static class TasksConfig {
        private int capacity = 1_000;
        private int maxAttempts = 5;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 30_000;
    }

    @Data
    public static class AgentRunnerConfig {
        /** Base URL of the agent runtime; runs fail fast when unset. */
        private String endpoint;
        private String apiKey;
        private long timeoutSeconds = 600;
    }
}
