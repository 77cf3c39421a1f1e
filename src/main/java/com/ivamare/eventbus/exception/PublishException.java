package com.ivamare.eventbus.exception;

/**
 * Raised for a failed publish attempt, including the broker refusing the
 * message because its outbound buffer is full.
 */
public class PublishException extends EventBusException {

    private final String exchange;
    private final String routingKey;
    private final int attempts;

    public PublishException(String exchange, String routingKey, String message) {
        this(exchange, routingKey, message, null, 1);
    }

    public PublishException(String exchange, String routingKey, String message, Throwable cause) {
        this(exchange, routingKey, message, cause, 1);
    }

    public PublishException(String exchange, String routingKey, String message, Throwable cause, int attempts) {
        super(message, cause);
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.attempts = attempts;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public int getAttempts() {
        return attempts;
    }
}
