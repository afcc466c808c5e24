package com.fleetgate.common.error;

import lombok.Getter;

/**
 * Failure raised by a channel plugin handler while parsing or posting.
 */
@Getter
public class PluginRuntimeException extends FleetGateException {

    private final String pluginType;

    public PluginRuntimeException(String pluginType, String message) {
        super(message);
        this.pluginType = pluginType;
    }

    public PluginRuntimeException(String pluginType, String message, Throwable cause) {
        super(message, cause);
        this.pluginType = pluginType;
    }
}
