package com.fleetgate.common.error;

/**
 * A dispatch write failed mid-transaction. The surrounding transaction is rolled back
 * and the work is retried on a later pass.
 */
public class TransientDispatchException extends FleetGateException {

    public TransientDispatchException(String message) {
        super(message);
    }

    public TransientDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
