package com.ivamare.eventbus.topology;

import com.ivamare.eventbus.model.QueueOptions;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Declares work queues, their dead-letter queues and bindings.
 *
 * <p>All operations are idempotent against the broker: declaring the same
 * queue with the same options twice leaves one queue and one DLQ.
 */
public interface TopologyRegistrar {

    /**
     * Declare a durable work queue wired to a dead-letter queue.
     *
     * <p>The work queue is declared with {@code x-dead-letter-exchange} and
     * {@code x-dead-letter-routing-key}; then {@code <queue>.dlq} is declared
     * and bound to the dead-letter exchange under that routing key.
     *
     * @param queueName Work queue name
     * @param options Queue options (defaults apply for unset values)
     * @return future completing with the queue name
     */
    CompletableFuture<String> createQueue(String queueName, QueueOptions options);

    /**
     * Declare a work queue with default options.
     *
     * @param queueName Work queue name
     * @return future completing with the queue name
     */
    default CompletableFuture<String> createQueue(String queueName) {
        return createQueue(queueName, QueueOptions.defaults());
    }

    /**
     * Bind a queue to an exchange once per routing key. Bindings made before
     * a failure are not rolled back.
     *
     * @param queueName Queue to bind
     * @param exchange Source exchange
     * @param routingKeys Binding keys (topic patterns), at least one
     * @return future completing when every binding is in place
     */
    CompletableFuture<Void> bindQueue(String queueName, String exchange, List<String> routingKeys);

    /**
     * Bind a queue to an exchange under a single routing key.
     *
     * @param queueName Queue to bind
     * @param exchange Source exchange
     * @param routingKey Binding key
     * @return future completing when the binding is in place
     */
    default CompletableFuture<Void> bindQueue(String queueName, String exchange, String routingKey) {
        return bindQueue(queueName, exchange, List.of(routingKey));
    }

    /**
     * Check whether this registrar declared the queue (with its dead-letter
     * queue) during the lifetime of this process.
     *
     * @param queueName Queue name
     * @return true if declared through {@link #createQueue}
     */
    boolean isManaged(String queueName);
}
