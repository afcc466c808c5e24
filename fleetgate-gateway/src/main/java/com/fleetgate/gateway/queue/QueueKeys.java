package com.fleetgate.gateway.queue;

/**
 * Lane key formats. Scheduler lanes live in their own namespace so timers never
 * share a lane with conversational traffic.
 */
public final class QueueKeys {

    public static final String SCHEDULER_PREFIX = "sched:";

    private QueueKeys() {
    }

    public static String conversational(String pluginInstanceId, String sessionKey, String agentId) {
        return pluginInstanceId + ":" + sessionKey + ":" + agentId;
    }

    public static String scheduler(String sessionKey, String agentId) {
        return SCHEDULER_PREFIX + sessionKey + ":" + agentId;
    }

    public static boolean isScheduler(String queueKey) {
        return queueKey != null && queueKey.startsWith(SCHEDULER_PREFIX);
    }
}
