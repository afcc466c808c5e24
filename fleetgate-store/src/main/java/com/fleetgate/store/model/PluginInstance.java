package com.fleetgate.store.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A configured channel connection, e.g. one Slack workspace or one Telegram bot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginInstance {
    private String id;
    private String pluginId;
    private String type;
    private String name;
    private boolean enabled;
    /** JSON text. */
    private String config;
}
