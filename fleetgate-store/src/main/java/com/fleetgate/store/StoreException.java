package com.fleetgate.store;

import com.fleetgate.common.error.FleetGateException;

/**
 * Unchecked wrapper for store failures.
 */
public class StoreException extends FleetGateException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
