package com.fleetgate.app.config;

import com.fleetgate.channel.adapter.PluginHandler;
import com.fleetgate.channel.discord.DiscordPluginHandler;
import com.fleetgate.channel.github.GitHubPluginHandler;
import com.fleetgate.channel.registry.PluginHandlerRegistry;
import com.fleetgate.channel.routing.WebhookRouter;
import com.fleetgate.channel.slack.SlackPluginHandler;
import com.fleetgate.channel.telegram.TelegramPluginHandler;
import com.fleetgate.common.config.FleetConfig;
import com.fleetgate.common.infra.BackgroundTaskQueue;
import com.fleetgate.plugin.runtime.CrashGuard;
import com.fleetgate.plugin.runtime.StoreAutoDisableRecorder;
import com.fleetgate.store.Database;
import com.fleetgate.store.PluginRepository;
import com.fleetgate.store.WorkItemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for channel handlers, the crash guard and webhook routing.
 */
@Slf4j
@Configuration
public class ChannelBeanConfig {

    @Bean
    public TelegramPluginHandler telegramPluginHandler() {
        return new TelegramPluginHandler();
    }

    @Bean
    public SlackPluginHandler slackPluginHandler() {
        return new SlackPluginHandler();
    }

    @Bean
    public DiscordPluginHandler discordPluginHandler() {
        return new DiscordPluginHandler();
    }

    @Bean
    public GitHubPluginHandler gitHubPluginHandler(FleetConfig config) {
        return new GitHubPluginHandler(config.getCredentials());
    }

    @Bean
    public PluginHandlerRegistry pluginHandlerRegistry(List<PluginHandler> handlers) {
        PluginHandlerRegistry registry = new PluginHandlerRegistry(handlers);
        log.info("Channel handlers registered: {}", registry.types());
        return registry;
    }

    @Bean
    public CrashGuard crashGuard(FleetConfig config, PluginRepository plugins, BackgroundTaskQueue tasks) {
        FleetConfig.CrashGuardConfig guard = config.getCrashGuard();
        return new CrashGuard(guard.getThreshold(), guard.getWindowMs(), new StoreAutoDisableRecorder(plugins), tasks);
    }

    @Bean
    public WebhookRouter webhookRouter(Database database, PluginRepository plugins, WorkItemRepository workItems,
            PluginHandlerRegistry handlers, CrashGuard crashGuard) {
        return new WebhookRouter(database, plugins, workItems, handlers, crashGuard);
    }
}
