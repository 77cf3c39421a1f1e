package com.ivamare.eventbus.model;

import java.util.Map;

/**
 * Context provided to event handlers alongside the envelope.
 *
 * @param queueName Queue the message was consumed from
 * @param routingKey Routing key of the delivery
 * @param exchange Exchange of the delivery
 * @param headers Transport headers
 * @param redelivered Broker redelivery flag
 * @param message Raw delivery
 * @param retryCount Number of earlier failed attempts (0 on first delivery)
 * @param maxRetries Retries allowed before dead-lettering
 */
public record DeliveryContext(
    String queueName,
    String routingKey,
    String exchange,
    Map<String, Object> headers,
    boolean redelivered,
    Delivery message,
    int retryCount,
    int maxRetries
) {
    /**
     * Check if a failure on this attempt sends the message to dead-letter.
     *
     * @return true if no retries remain
     */
    public boolean isLastAttempt() {
        return retryCount >= maxRetries;
    }
}
