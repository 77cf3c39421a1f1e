package com.ivamare.eventbus.exception;

/**
 * Raised when a consumer cannot be registered on a queue.
 */
public class ConsumeException extends EventBusException {

    private final String queueName;

    public ConsumeException(String queueName, String message, Throwable cause) {
        super(message, cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
