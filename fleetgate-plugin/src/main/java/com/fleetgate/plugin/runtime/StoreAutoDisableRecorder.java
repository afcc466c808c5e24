package com.fleetgate.plugin.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.PluginRepository;
import com.fleetgate.store.model.PluginEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the disabled flag and an {@code auto_disable} audit event to the store.
 */
@Slf4j
public class StoreAutoDisableRecorder implements AutoDisableRecorder {

    public static final String EVENT_KIND = "auto_disable";

    private final PluginRepository plugins;

    public StoreAutoDisableRecorder(PluginRepository plugins) {
        this.plugins = plugins;
    }

    @Override
    public void recordAutoDisable(String pluginId, int failureCount, long windowMs, int threshold) {
        plugins.setPluginEnabled(pluginId, false);

        ObjectNode detail = JsonMapper.object();
        detail.put("reason", "crash_loop");
        detail.put("failureCount", failureCount);
        detail.put("windowMs", windowMs);
        detail.put("threshold", threshold);
        plugins.createEvent(PluginEvent.builder()
                .pluginId(pluginId)
                .kind(EVENT_KIND)
                .status("error")
                .detail(JsonMapper.write(detail))
                .build());
        log.info("Plugin {} disabled in store after crash loop", pluginId);
    }
}
