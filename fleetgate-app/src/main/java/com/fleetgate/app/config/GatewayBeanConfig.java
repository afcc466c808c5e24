package com.fleetgate.app.config;

import com.fleetgate.app.agent.HttpAgentRunner;
import com.fleetgate.channel.registry.PluginHandlerRegistry;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.infra.BackgroundTaskQueue;
import com.fleetgate.gateway.agent.AgentRunner;
import com.fleetgate.gateway.dispatch.AgentRelayService;
import com.fleetgate.gateway.dispatch.InboundDispatcher;
import com.fleetgate.gateway.dispatch.RunDispatcher;
import com.fleetgate.gateway.dispatch.SyntheticDispatch;
import com.fleetgate.gateway.events.EventPublication;
import com.fleetgate.gateway.events.StoreWorkItemEventPublisher;
import com.fleetgate.gateway.events.WorkItemEventPublisher;
import com.fleetgate.gateway.handoff.HandoffService;
import com.fleetgate.gateway.queue.QueueSettingsResolver;
import com.fleetgate.gateway.queue.SessionQueueManager;
import com.fleetgate.gateway.scheduler.SchedulerTicker;
import com.fleetgate.plugin.runtime.CrashGuard;
import com.fleetgate.store.AgentRepository;
import com.fleetgate.store.Database;
import com.fleetgate.store.PluginRepository;
import com.fleetgate.store.QueueRepository;
import com.fleetgate.store.RoutineRepository;
import com.fleetgate.store.ScheduledItemRepository;
import com.fleetgate.store.WorkItemRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration for the session queue, dispatch pipeline and scheduler ticker.
 */
@Configuration
public class GatewayBeanConfig {

    @Bean
    public QueueSettingsResolver queueSettingsResolver(FleetConfig config) {
        return new QueueSettingsResolver(config.getQueue());
    }

    @Bean(destroyMethod = "close")
    public SessionQueueManager sessionQueueManager(QueueRepository queues, FleetConfig config) {
        return new SessionQueueManager(queues, config.getQueue().getRunnerThreads());
    }

    @Bean
    public WorkItemEventPublisher workItemEventPublisher(WorkItemRepository workItems) {
        return new StoreWorkItemEventPublisher(workItems);
    }

    @Bean
    public EventPublication eventPublication(WorkItemEventPublisher publisher, BackgroundTaskQueue tasks) {
        return new EventPublication(publisher, tasks);
    }

    @Bean
    public SyntheticDispatch syntheticDispatch(Database database, WorkItemRepository workItems,
            QueueRepository queues, SessionQueueManager queueManager, EventPublication publication) {
        return new SyntheticDispatch(database, workItems, queues, queueManager, publication);
    }

    @Bean
    public HandoffService handoffService(AgentRepository agents, QueueSettingsResolver settingsResolver,
            SyntheticDispatch synthetic) {
        return new HandoffService(agents, settingsResolver, synthetic);
    }

    @Bean
    public AgentRelayService agentRelayService(AgentRepository agents, QueueSettingsResolver settingsResolver,
            SyntheticDispatch synthetic) {
        return new AgentRelayService(agents, settingsResolver, synthetic);
    }

    @Bean
    public AgentRunner agentRunner(FleetConfig config) {
        return new HttpAgentRunner(config.getAgentRunner());
    }

    @Bean
    public RunDispatcher runDispatcher(WorkItemRepository workItems, AgentRepository agents, PluginRepository plugins,
            PluginHandlerRegistry handlers, AgentRunner agentRunner, CrashGuard crashGuard,
            HandoffService handoffService, AgentRelayService agentRelayService, SessionQueueManager queueManager) {
        RunDispatcher dispatcher = new RunDispatcher(workItems, agents, plugins, handlers, agentRunner, crashGuard,
                List.of(handoffService, agentRelayService));
        queueManager.setRunHandler(dispatcher);
        return dispatcher;
    }

    // Lanes must not start before the run handler is installed.
    @Bean
    @DependsOn("runDispatcher")
    public InboundDispatcher inboundDispatcher(AgentRepository agents, WorkItemRepository workItems,
            PluginHandlerRegistry handlers, SessionQueueManager queueManager, QueueSettingsResolver settingsResolver) {
        return new InboundDispatcher(agents, workItems, handlers, queueManager, settingsResolver);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @DependsOn("runDispatcher")
    public SchedulerTicker schedulerTicker(Database database, ScheduledItemRepository scheduledItems,
            AgentRepository agents, WorkItemRepository workItems, QueueRepository queues, RoutineRepository routines,
            SessionQueueManager queueManager, QueueSettingsResolver settingsResolver, EventPublication publication,
            FleetConfig config) {
        return new SchedulerTicker(database, scheduledItems, agents, workItems, queues, routines, queueManager,
                settingsResolver, publication, config.getScheduler(), Clock.systemUTC());
    }
}
