package com.ivamare.eventbus.exception;

/**
 * Raised when declaring an exchange or queue, or binding a queue, fails.
 *
 * <p>Topology errors are not retried automatically.
 */
public class TopologyException extends EventBusException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
