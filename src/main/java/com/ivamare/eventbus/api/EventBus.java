package com.ivamare.eventbus.api;

import com.ivamare.eventbus.connection.ConnectionSupervisor;
import com.ivamare.eventbus.consumer.EventConsumer;
import com.ivamare.eventbus.handler.EventHandler;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.model.BatchEvent;
import com.ivamare.eventbus.model.BatchPublishResult;
import com.ivamare.eventbus.model.ConsumeOptions;
import com.ivamare.eventbus.model.PublishOptions;
import com.ivamare.eventbus.model.PublishResult;
import com.ivamare.eventbus.model.QueueOptions;
import com.ivamare.eventbus.publisher.EventPublisher;
import com.ivamare.eventbus.topology.TopologyRegistrar;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point owning one broker connection and the components built on it.
 *
 * <p>Instances are independent of each other; several can run in one process.
 *
 * <p>Example:
 * <pre>
 * try (EventBus bus = EventBus.builder()
 *         .url("amqp://localhost:5672")
 *         .serviceName("user-service")
 *         .build()) {
 *     bus.init().join();
 *     bus.createQueue("user-service.user.events").join();
 *     bus.bindQueue("user-service.user.events", "user.events", List.of("user.*")).join();
 *     bus.registerHandler("user.created", (envelope, context) -&gt; provision(envelope.data()));
 *     bus.consume("user-service.user.events").join();
 * }
 * </pre>
 */
public interface EventBus extends AutoCloseable {

    /**
     * Create a builder for an event bus.
     *
     * @return new builder
     */
    static EventBusBuilder builder() {
        return new EventBusBuilder();
    }

    /**
     * Perform the first connection, declaring the exchanges.
     *
     * @return future completing with this bus, or exceptionally with a
     *         {@link com.ivamare.eventbus.exception.ConnectionException}
     */
    CompletableFuture<EventBus> init();

    /**
     * Cancel all consumers, wait for in-flight handlers up to the shutdown
     * timeout, then close the broker session.
     *
     * @return future completing when the session is closed
     */
    CompletableFuture<Void> shutdown();

    /**
     * Shut down and release the threads owned by this bus.
     */
    @Override
    void close();

    /**
     * Check broker connectivity without blocking.
     *
     * @return true if the broker session is live
     */
    boolean isConnected();

    // --- Convenience operations ---

    CompletableFuture<PublishResult> publish(String eventType, Object data, PublishOptions options);

    CompletableFuture<PublishResult> publish(String eventType, Object data);

    CompletableFuture<List<BatchPublishResult>> publishBatch(List<BatchEvent> events);

    CompletableFuture<String> createQueue(String queueName, QueueOptions options);

    CompletableFuture<String> createQueue(String queueName);

    CompletableFuture<Void> bindQueue(String queueName, String exchange, List<String> routingKeys);

    void registerHandler(String eventType, EventHandler handler);

    CompletableFuture<String> consume(String queueName, ConsumeOptions options);

    CompletableFuture<String> consume(String queueName);

    CompletableFuture<Void> cancelConsumer(String queueName);

    CompletableFuture<Void> cancelAllConsumers();

    // --- Components ---

    ConnectionSupervisor supervisor();

    TopologyRegistrar topology();

    EventPublisher publisher();

    HandlerRegistry handlerRegistry();

    EventConsumer consumer();
}
