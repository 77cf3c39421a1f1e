package com.ivamare.eventbus.exception;

/**
 * Raised when a session-level broker operation (ack, nack, cancel, close) fails.
 */
public class BrokerException extends EventBusException {

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
