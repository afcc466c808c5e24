package com.fleetgate.app.health;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.common.infra.BackgroundTaskQueue;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.gateway.queue.SessionQueueManager;
import com.fleetgate.gateway.scheduler.SchedulerTicker;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;

/**
 * Liveness probe with scheduler and queue state.
 */
@RestController
public class HealthEndpoint {

    private final SchedulerTicker ticker;
    private final SessionQueueManager queueManager;
    private final BackgroundTaskQueue tasks;

    public HealthEndpoint(SchedulerTicker ticker, SessionQueueManager queueManager, BackgroundTaskQueue tasks) {
        this.ticker = ticker;
        this.queueManager = queueManager;
        this.tasks = tasks;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        ObjectNode node = JsonMapper.object();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        ObjectNode scheduler = node.putObject("scheduler");
        scheduler.put("started", ticker.isStarted());
        Instant lastTickAt = ticker.getLastTickAt();
        if (lastTickAt != null) {
            scheduler.put("lastTickAt", lastTickAt.toString());
        } else {
            scheduler.putNull("lastTickAt");
        }

        ObjectNode queue = node.putObject("queue");
        queue.put("activeLanes", queueManager.activeLaneCount());
        queue.put("pendingTasks", tasks.pendingCount());

        Runtime rt = Runtime.getRuntime();
        ObjectNode memory = node.putObject("memory");
        memory.put("used_mb", (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024));
        memory.put("max_mb", rt.maxMemory() / (1024 * 1024));
        return node;
    }
}
