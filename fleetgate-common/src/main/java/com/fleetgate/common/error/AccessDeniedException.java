package com.fleetgate.common.error;

/**
 * Scope or permission check failed. Callers map this to a rejection, not a retry.
 */
public class AccessDeniedException extends FleetGateException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
