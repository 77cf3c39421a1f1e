package com.ivamare.eventbus.handler;

import com.ivamare.eventbus.model.DeliveryContext;
import com.ivamare.eventbus.model.EventEnvelope;

/**
 * Functional interface for event handlers.
 *
 * <p>Returning normally acknowledges the message. Throwing schedules a retry,
 * or dead-letters the message once its retries are used up.
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handle an event.
     *
     * @param envelope The decoded event envelope
     * @param context Delivery context (queue, routing key, retry count, ...)
     * @throws Exception if processing fails
     */
    void handle(EventEnvelope envelope, DeliveryContext context) throws Exception;
}
