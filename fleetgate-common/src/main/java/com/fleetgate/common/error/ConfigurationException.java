package com.fleetgate.common.error;

/**
 * Missing or invalid secret/credential configuration. Never retried.
 */
public class ConfigurationException extends FleetGateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
