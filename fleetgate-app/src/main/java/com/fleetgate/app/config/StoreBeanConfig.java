package com.fleetgate.app.config;

import com.fleetgate.common.config.ConfigService;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.infra.Backoff;
import com.fleetgate.common.infra.BackgroundTaskQueue;
import com.fleetgate.store.AgentRepository;
import com.fleetgate.store.Database;
import com.fleetgate.store.PluginRepository;
import com.fleetgate.store.QueueRepository;
import com.fleetgate.store.RoutineRepository;
import com.fleetgate.store.ScheduledItemRepository;
import com.fleetgate.store.WorkItemRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for configuration loading, the store and the background task queue.
 */
@Configuration
public class StoreBeanConfig {

    @Value("${fleetgate.config-path:~/.fleetgate/fleetgate.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(ConfigService.expandHome(Path.of(configPath)));
    }

    @Bean
    public FleetConfig fleetConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public Database database(FleetConfig config) {
        FleetConfig.StoreConfig store = config.getStore();
        Database database = new Database(ConfigService.expandHome(Path.of(store.getPath())), store.getBusyTimeoutMs());
        database.init();
        return database;
    }

    @Bean
    public PluginRepository pluginRepository(Database database) {
        return new PluginRepository(database);
    }

    @Bean
    public AgentRepository agentRepository(Database database) {
        return new AgentRepository(database);
    }

    @Bean
    public WorkItemRepository workItemRepository(Database database) {
        return new WorkItemRepository(database);
    }

    @Bean
    public QueueRepository queueRepository(Database database) {
        return new QueueRepository(database);
    }

    @Bean
    public ScheduledItemRepository scheduledItemRepository(Database database) {
        return new ScheduledItemRepository(database);
    }

    @Bean
    public RoutineRepository routineRepository(Database database) {
        return new RoutineRepository(database);
    }

    @Bean(destroyMethod = "close")
    public BackgroundTaskQueue backgroundTaskQueue(FleetConfig config) {
        FleetConfig.TasksConfig tasks = config.getTasks();
        Backoff.Policy backoff = new Backoff.Policy(tasks.getInitialBackoffMs(), tasks.getMaxBackoffMs(),
                Backoff.Policy.DEFAULT.factor(), Backoff.Policy.DEFAULT.jitter());
        return new BackgroundTaskQueue(tasks.getCapacity(), tasks.getMaxAttempts(), backoff);
    }
}
