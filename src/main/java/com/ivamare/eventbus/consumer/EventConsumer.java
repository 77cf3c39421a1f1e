package com.ivamare.eventbus.consumer;

import com.ivamare.eventbus.broker.BrokerSession;
import com.ivamare.eventbus.model.ConsumeOptions;
import com.ivamare.eventbus.model.Delivery;
import com.ivamare.eventbus.model.DeliveryState;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Consumes queues and drives each delivery to acknowledgement, retry or
 * dead-letter.
 *
 * <p>Handler failures never escape this component: they are retried by
 * republishing the message with an incremented {@code x-retry-count} header,
 * and dead-lettered once the retries are used up.
 */
public interface EventConsumer {

    /**
     * Start consuming a queue.
     *
     * @param queueName Queue to consume
     * @param options Consume options
     * @return future completing with the consumer tag
     */
    CompletableFuture<String> consume(String queueName, ConsumeOptions options);

    /**
     * Start consuming a queue with the default prefetch.
     *
     * @param queueName Queue to consume
     * @return future completing with the consumer tag
     */
    CompletableFuture<String> consume(String queueName);

    /**
     * Cancel the consumer of a queue. Handlers already running complete.
     * Failures are logged, never raised.
     *
     * @param queueName Queue whose consumer to cancel
     * @return future completing when the cancel was attempted
     */
    CompletableFuture<Void> cancelConsumer(String queueName);

    /**
     * Cancel every active consumer, one after the other.
     *
     * @return future completing when every cancel was attempted
     */
    CompletableFuture<Void> cancelAllConsumers();

    /**
     * Names of the queues with an active consumer.
     *
     * @return queue names
     */
    List<String> getActiveConsumers();

    /**
     * Run one delivery through the state machine.
     *
     * @param delivery The delivered message
     * @param session Session the message was delivered on (used to ack/nack)
     * @param queueName Queue the message was consumed from
     * @return future completing with the terminal state reached
     */
    CompletableFuture<DeliveryState> handleMessage(Delivery delivery, BrokerSession session, String queueName);

    /**
     * Number of deliveries currently being processed.
     *
     * @return in-flight count
     */
    int inFlightCount();

    /**
     * Number of retries acknowledged but not yet republished.
     *
     * @return pending retry count
     */
    int pendingRetryCount();

    /**
     * Wait until no delivery is in flight.
     *
     * @param timeout Maximum time to wait
     * @return true if idle, false on timeout or interrupt
     */
    boolean awaitIdle(Duration timeout);
}
