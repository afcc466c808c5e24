package com.fleetgate.common.error;

/**
 * Base type for FleetGate runtime failures.
 */
public class FleetGateException extends RuntimeException {

    public FleetGateException(String message) {
        super(message);
    }

    public FleetGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
