package com.fleetgate.app.web;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.plugin.runtime.CrashGuard;
import com.fleetgate.store.PluginRepository;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Re-enables a plugin after the crash guard (or an operator) disabled it.
 */
@Slf4j
@RestController
@RequestMapping("/api/plugins")
public class PluginAdminController {

    private final PluginRepository plugins;
    private final CrashGuard crashGuard;
    private final AdminAuthorizer authorizer;

    public PluginAdminController(PluginRepository plugins, CrashGuard crashGuard, AdminAuthorizer authorizer) {
        this.plugins = plugins;
        this.crashGuard = crashGuard;
        this.authorizer = authorizer;
    }

    @PostMapping("/{pluginId}/enable")
    public ObjectNode enable(@PathVariable String pluginId, HttpServletRequest request) {
        authorizer.authorize(request);
        plugins.setPluginEnabled(pluginId, true);
        crashGuard.resetPlugin(pluginId);
        log.info("Plugin {} re-enabled", pluginId);

        ObjectNode body = JsonMapper.object();
        body.put("pluginId", pluginId);
        body.put("enabled", true);
        return body;
    }
}
