package com.ivamare.eventbus.api.impl;

import com.ivamare.eventbus.api.EventBus;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default implementation of EventBus.
 */
public class DefaultEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventBus.class);

    private static final long CLOSE_GRACE_MS = 5000;

    private final ConnectionSupervisor supervisor;
    private final TopologyRegistrar topology;
    private final EventPublisher publisher;
    private final HandlerRegistry handlerRegistry;
    private final EventConsumer consumer;
    private final Duration shutdownTimeout;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    /**
     * Creates a new DefaultEventBus.
     *
     * @param supervisor Connection supervisor
     * @param topology Topology registrar
     * @param publisher Event publisher
     * @param handlerRegistry Handler registry
     * @param consumer Event consumer
     * @param shutdownTimeout Maximum wait for in-flight handlers on shutdown
     * @param executor Executor for blocking waits
     * @param ownedExecutor Executor terminated by {@link #close()} (nullable)
     */
    public DefaultEventBus(
            ConnectionSupervisor supervisor,
            TopologyRegistrar topology,
            EventPublisher publisher,
            HandlerRegistry handlerRegistry,
            EventConsumer consumer,
            Duration shutdownTimeout,
            Executor executor,
            ExecutorService ownedExecutor) {
        this.supervisor = supervisor;
        this.topology = topology;
        this.publisher = publisher;
        this.handlerRegistry = handlerRegistry;
        this.consumer = consumer;
        this.shutdownTimeout = shutdownTimeout;
        this.executor = executor;
        this.ownedExecutor = ownedExecutor;
    }

    @Override
    public CompletableFuture<EventBus> init() {
        log.info("Initialising event bus, declaring {} exchanges", supervisor.getDeclaredExchanges().size());
        return supervisor.acquireSession().thenApply(session -> {
            log.info("Event bus initialised");
            return this;
        });
    }

    @Override
    public CompletableFuture<Void> shutdown() {
        log.info("Shutting down event bus, {} consumer(s) active, {} in-flight deliveries",
            consumer.getActiveConsumers().size(), consumer.inFlightCount());

        return consumer.cancelAllConsumers()
            .thenRunAsync(this::awaitInFlight, executor)
            .thenCompose(ignored -> supervisor.close())
            .whenComplete((ignored, ex) -> {
                if (ex != null) {
                    log.error("Event bus shutdown failed: {}", ex.getMessage());
                } else {
                    log.info("Event bus shut down");
                }
            });
    }

    @Override
    public void close() {
        try {
            shutdown().get(shutdownTimeout.toMillis() + CLOSE_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Event bus did not shut down cleanly: {}", e.getMessage());
        } finally {
            terminateOwnedExecutor();
        }
    }

    @Override
    public boolean isConnected() {
        return supervisor.isConnected();
    }

    // --- Convenience operations ---

    @Override
    public CompletableFuture<PublishResult> publish(String eventType, Object data, PublishOptions options) {
        return publisher.publish(eventType, data, options);
    }

    @Override
    public CompletableFuture<PublishResult> publish(String eventType, Object data) {
        return publisher.publish(eventType, data);
    }

    @Override
    public CompletableFuture<List<BatchPublishResult>> publishBatch(List<BatchEvent> events) {
        return publisher.publishBatch(events);
    }

    @Override
    public CompletableFuture<String> createQueue(String queueName, QueueOptions options) {
        return topology.createQueue(queueName, options);
    }

    @Override
    public CompletableFuture<String> createQueue(String queueName) {
        return topology.createQueue(queueName);
    }

    @Override
    public CompletableFuture<Void> bindQueue(String queueName, String exchange, List<String> routingKeys) {
        return topology.bindQueue(queueName, exchange, routingKeys);
    }

    @Override
    public void registerHandler(String eventType, EventHandler handler) {
        handlerRegistry.register(eventType, handler);
    }

    @Override
    public CompletableFuture<String> consume(String queueName, ConsumeOptions options) {
        return consumer.consume(queueName, options);
    }

    @Override
    public CompletableFuture<String> consume(String queueName) {
        return consumer.consume(queueName);
    }

    @Override
    public CompletableFuture<Void> cancelConsumer(String queueName) {
        return consumer.cancelConsumer(queueName);
    }

    @Override
    public CompletableFuture<Void> cancelAllConsumers() {
        return consumer.cancelAllConsumers();
    }

    // --- Components ---

    @Override
    public ConnectionSupervisor supervisor() {
        return supervisor;
    }

    @Override
    public TopologyRegistrar topology() {
        return topology;
    }

    @Override
    public EventPublisher publisher() {
        return publisher;
    }

    @Override
    public HandlerRegistry handlerRegistry() {
        return handlerRegistry;
    }

    @Override
    public EventConsumer consumer() {
        return consumer;
    }

    private void awaitInFlight() {
        if (!consumer.awaitIdle(shutdownTimeout)) {
            log.warn("Timeout waiting for {} in-flight deliveries", consumer.inFlightCount());
        }
        int pendingRetries = consumer.pendingRetryCount();
        if (pendingRetries > 0) {
            log.warn("{} scheduled retries have not been republished and will be lost", pendingRetries);
        }
    }

    private void terminateOwnedExecutor() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
