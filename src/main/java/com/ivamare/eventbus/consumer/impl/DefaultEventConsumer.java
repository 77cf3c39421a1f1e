package com.ivamare.eventbus.consumer.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbus.broker.BrokerNames;
import com.ivamare.eventbus.broker.BrokerSession;
import com.ivamare.eventbus.connection.ConnectionSupervisor;
import com.ivamare.eventbus.connection.SessionListener;
import com.ivamare.eventbus.consumer.EventConsumer;
import com.ivamare.eventbus.exception.DecodeException;
import com.ivamare.eventbus.exception.HandlerException;
import com.ivamare.eventbus.exception.TopologyException;
import com.ivamare.eventbus.handler.EventHandler;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.model.ConsumeOptions;
import com.ivamare.eventbus.model.Delivery;
import com.ivamare.eventbus.model.DeliveryContext;
import com.ivamare.eventbus.model.DeliveryState;
import com.ivamare.eventbus.model.EventEnvelope;
import com.ivamare.eventbus.model.MessageProperties;
import com.ivamare.eventbus.policy.RetryPolicy;
import com.ivamare.eventbus.publisher.EventPublisher;
import com.ivamare.eventbus.topology.TopologyRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of EventConsumer.
 *
 * <p>Deliveries are handed from the broker client's thread to the executor,
 * so up to {@code prefetch} handlers of one queue run concurrently. Every
 * delivery reaches exactly one terminal state:
 * <ul>
 *   <li>ACKED - handler succeeded, or no handler is registered</li>
 *   <li>RETRY_SCHEDULED - original acked, copy republished after a delay</li>
 *   <li>DEAD_LETTERED - nacked without requeue (retries exhausted or undecodable)</li>
 * </ul>
 *
 * <p>Registered as a {@link SessionListener}, it re-subscribes every active
 * consumer after a reconnection.
 */
public class DefaultEventConsumer implements EventConsumer, SessionListener {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventConsumer.class);

    private static final long IDLE_POLL_MS = 50;

    private final ConnectionSupervisor supervisor;
    private final TopologyRegistrar topologyRegistrar;
    private final HandlerRegistry handlerRegistry;
    private final EventPublisher publisher;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final int defaultPrefetch;
    private final boolean requireDeclaredQueues;
    private final Executor executor;

    private final Map<String, ActiveConsumer> consumers = new ConcurrentHashMap<>();
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicInteger pendingRetries = new AtomicInteger(0);

    /**
     * Creates a new DefaultEventConsumer.
     *
     * @param supervisor Supplier of the live broker session
     * @param topologyRegistrar Registrar used to validate consumed queues
     * @param handlerRegistry Registry of event handlers
     * @param publisher Publisher used to republish retries
     * @param objectMapper Mapper used to decode envelopes
     * @param retryPolicy Consumer retry policy ({@code maxRetries + 1} attempts)
     * @param defaultPrefetch Prefetch used when none is given
     * @param requireDeclaredQueues Reject queues not declared through the registrar
     * @param executor Executor running handlers and broker calls
     */
    public DefaultEventConsumer(
            ConnectionSupervisor supervisor,
            TopologyRegistrar topologyRegistrar,
            HandlerRegistry handlerRegistry,
            EventPublisher publisher,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy,
            int defaultPrefetch,
            boolean requireDeclaredQueues,
            Executor executor) {
        this.supervisor = supervisor;
        this.topologyRegistrar = topologyRegistrar;
        this.handlerRegistry = handlerRegistry;
        this.publisher = publisher;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.defaultPrefetch = defaultPrefetch;
        this.requireDeclaredQueues = requireDeclaredQueues;
        this.executor = executor;
    }

    // --- Consumer lifecycle ---

    @Override
    public CompletableFuture<String> consume(String queueName) {
        return consume(queueName, ConsumeOptions.withPrefetch(defaultPrefetch));
    }

    @Override
    public CompletableFuture<String> consume(String queueName, ConsumeOptions options) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }
        ConsumeOptions opts = options != null ? options : ConsumeOptions.withPrefetch(defaultPrefetch);

        if (!topologyRegistrar.isManaged(queueName)) {
            if (requireDeclaredQueues) {
                return CompletableFuture.failedFuture(new TopologyException(
                    "Queue " + queueName + " was not declared with a dead-letter queue; "
                        + "call createQueue before consuming"));
            }
            log.warn("Consuming {} which was not declared through createQueue; "
                + "dead-lettering relies on its existing broker configuration", queueName);
        }

        return supervisor.acquireSession()
            .thenApplyAsync(session -> subscribe(session, queueName, opts), executor);
    }

    @Override
    public CompletableFuture<Void> cancelConsumer(String queueName) {
        ActiveConsumer consumer = consumers.get(queueName);
        if (consumer == null) {
            log.warn("No consumer found for queue {}", queueName);
            return CompletableFuture.completedFuture(null);
        }

        return CompletableFuture.runAsync(() -> {
            try {
                if (consumer.session().isOpen()) {
                    consumer.session().cancel(consumer.consumerTag());
                    log.info("Cancelled consumer for {} (tag={})", queueName, consumer.consumerTag());
                } else {
                    log.debug("Session of consumer {} already closed, nothing to cancel", queueName);
                }
            } catch (RuntimeException e) {
                log.error("Error cancelling consumer for {}: {}", queueName, e.getMessage());
            } finally {
                consumers.remove(queueName, consumer);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> cancelAllConsumers() {
        List<String> queueNames = List.copyOf(consumers.keySet());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String queueName : queueNames) {
            chain = chain.thenCompose(ignored -> cancelConsumer(queueName));
        }
        return chain.thenRun(() -> log.info("Cancelled {} consumer(s)", queueNames.size()));
    }

    @Override
    public List<String> getActiveConsumers() {
        return List.copyOf(consumers.keySet());
    }

    @Override
    public void onSessionRestored(BrokerSession session) {
        if (consumers.isEmpty()) {
            return;
        }
        log.info("Restoring {} consumer(s) after reconnection", consumers.size());
        for (ActiveConsumer consumer : List.copyOf(consumers.values())) {
            try {
                subscribe(session, consumer.queueName(), consumer.options());
            } catch (RuntimeException e) {
                log.error("Failed to restore consumer for {}: {}", consumer.queueName(), e.getMessage());
            }
        }
    }

    private String subscribe(BrokerSession session, String queueName, ConsumeOptions options) {
        session.setConcurrencyLimit(options.prefetch());
        String consumerTag = session.consume(
            queueName,
            delivery -> onDelivery(delivery, session, queueName, options.autoAck()),
            options.autoAck(),
            options.consumerTag()
        );

        ActiveConsumer previous = consumers.put(queueName,
            new ActiveConsumer(queueName, options, consumerTag, session));
        if (previous != null && previous.session() == session) {
            log.warn("Queue {} already had consumer {}; now tracking {}",
                queueName, previous.consumerTag(), consumerTag);
        }

        log.info("Consumer started for {} (tag={}, prefetch={})", queueName, consumerTag, options.prefetch());
        return consumerTag;
    }

    // --- Delivery state machine ---

    private void onDelivery(Delivery delivery, BrokerSession session, String queueName, boolean autoAck) {
        try {
            dispatch(delivery, session, queueName, autoAck);
        } catch (RejectedExecutionException e) {
            // Executor is shutting down; the unacked message is redelivered by the broker
            log.warn("Dropping delivery {} from {} during shutdown", delivery.deliveryTag(), queueName);
        }
    }

    @Override
    public CompletableFuture<DeliveryState> handleMessage(Delivery delivery, BrokerSession session, String queueName) {
        return dispatch(delivery, session, queueName, false);
    }

    private CompletableFuture<DeliveryState> dispatch(Delivery delivery, BrokerSession session,
                                                      String queueName, boolean autoAck) {
        inFlightCount.incrementAndGet();
        try {
            return CompletableFuture.supplyAsync(() -> process(delivery, session, queueName, autoAck), executor)
                .whenComplete((state, ex) -> inFlightCount.decrementAndGet());
        } catch (RejectedExecutionException e) {
            inFlightCount.decrementAndGet();
            throw e;
        }
    }

    DeliveryState process(Delivery delivery, BrokerSession session, String queueName, boolean autoAck) {
        // RECEIVED
        int retryCount = Math.min(retryCountOf(delivery.properties().headers()), retryPolicy.maxRetries());
        EventEnvelope envelope;
        try {
            envelope = decode(delivery.body());
        } catch (DecodeException e) {
            log.error("Dead-lettering undecodable message from {} (deliveryTag={}): {}",
                queueName, delivery.deliveryTag(), e.getMessage());
            if (!autoAck) {
                nack(session, delivery);
            }
            return DeliveryState.DEAD_LETTERED;
        }

        log.debug("Received {} from {} (eventId={}, correlationId={}, routingKey={}, retryCount={})",
            envelope.eventType(), queueName, envelope.eventId(), envelope.correlationId(),
            delivery.routingKey(), retryCount);

        // DISPATCHED
        Optional<EventHandler> handler = handlerRegistry.get(envelope.eventType());
        if (handler.isEmpty()) {
            log.warn("No handler registered for event {} (eventId={}), acknowledging",
                envelope.eventType(), envelope.eventId());
            if (!autoAck) {
                ack(session, delivery);
            }
            return DeliveryState.ACKED;
        }

        DeliveryContext context = new DeliveryContext(
            queueName,
            delivery.routingKey(),
            delivery.exchange(),
            delivery.properties().headers(),
            delivery.redelivered(),
            delivery,
            retryCount,
            retryPolicy.maxRetries()
        );

        try {
            handler.get().handle(envelope, context);
        } catch (Exception | Error e) {
            HandlerException failure = new HandlerException(envelope.eventType(), envelope.eventId(), e);
            log.error("Error processing message from {} (retryCount={}): {}",
                queueName, retryCount, failure.getMessage(), e);
            return onHandlerFailure(delivery, session, envelope, retryCount, autoAck);
        }

        if (!autoAck) {
            ack(session, delivery);
        }
        log.info("Processed {} (eventId={}) from {}", envelope.eventType(), envelope.eventId(), queueName);
        return DeliveryState.ACKED;
    }

    private DeliveryState onHandlerFailure(Delivery delivery, BrokerSession session, EventEnvelope envelope,
                                           int retryCount, boolean autoAck) {
        if (autoAck) {
            log.warn("Failure of {} (eventId={}) not retried: consumer uses auto-ack",
                envelope.eventType(), envelope.eventId());
            return DeliveryState.ACKED;
        }

        if (retryCount < retryPolicy.maxRetries()) {
            return scheduleRetry(delivery, session, envelope, retryCount + 1);
        }

        log.error("Max retries ({}) reached for {} (eventId={}), sending to dead-letter queue",
            retryPolicy.maxRetries(), envelope.eventType(), envelope.eventId());
        nack(session, delivery);
        return DeliveryState.DEAD_LETTERED;
    }

    private DeliveryState scheduleRetry(Delivery delivery, BrokerSession session, EventEnvelope envelope,
                                        int nextRetryCount) {
        MessageProperties retryProperties;
        try {
            Map<String, Object> headers = new HashMap<>(delivery.properties().headers());
            headers.put(BrokerNames.RETRY_COUNT_HEADER, nextRetryCount);
            headers.put(BrokerNames.ORIGINAL_QUEUE_HEADER, delivery.routingKey());
            retryProperties = delivery.properties().withHeaders(headers);
        } catch (RuntimeException e) {
            log.error("Failed to prepare retry of {} (eventId={}), dead-lettering: {}",
                envelope.eventType(), envelope.eventId(), e.getMessage());
            nack(session, delivery);
            return DeliveryState.DEAD_LETTERED;
        }

        // The original must leave the queue before the copy is published
        if (!ack(session, delivery)) {
            log.warn("Retry of {} (eventId={}) left to broker redelivery", envelope.eventType(), envelope.eventId());
            return DeliveryState.RETRY_SCHEDULED;
        }

        long delay = retryPolicy.getBackoffMs(nextRetryCount);
        log.info("Retrying {} (eventId={}) attempt {} in {}ms",
            envelope.eventType(), envelope.eventId(), nextRetryCount, delay);

        pendingRetries.incrementAndGet();
        // Delay off the bus executor so a rejection still settles the pending count
        CompletableFuture.runAsync(() -> { }, CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS))
            .thenComposeAsync(ignored -> publisher.publishRaw(
                delivery.exchange(), delivery.routingKey(), delivery.body(), retryProperties), executor)
            .whenComplete((ignored, ex) -> {
                pendingRetries.decrementAndGet();
                if (ex != null) {
                    log.error("Failed to republish retry {} of {} (eventId={}): {}",
                        nextRetryCount, envelope.eventType(), envelope.eventId(), ex.getMessage());
                } else {
                    log.debug("Republished {} (eventId={}) with retry count {}",
                        envelope.eventType(), envelope.eventId(), nextRetryCount);
                }
            });

        return DeliveryState.RETRY_SCHEDULED;
    }

    private boolean ack(BrokerSession session, Delivery delivery) {
        try {
            session.ack(delivery);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to ack delivery {}, broker will redeliver: {}", delivery.deliveryTag(), e.getMessage());
            return false;
        }
    }

    private void nack(BrokerSession session, Delivery delivery) {
        try {
            session.nack(delivery, false);
        } catch (RuntimeException e) {
            log.warn("Failed to nack delivery {}, broker will redeliver: {}", delivery.deliveryTag(), e.getMessage());
        }
    }

    private EventEnvelope decode(byte[] body) {
        EventEnvelope envelope;
        try {
            envelope = objectMapper.readValue(body, EventEnvelope.class);
        } catch (IOException e) {
            throw new DecodeException("Malformed envelope: " + e.getMessage(), e);
        }
        if (envelope == null || envelope.eventType() == null || envelope.eventType().isBlank()) {
            throw new DecodeException("Envelope has no eventType", null);
        }
        return envelope;
    }

    /**
     * Read the retry count from the transport headers.
     *
     * @param headers Message headers
     * @return retry count in {@code [0, Integer.MAX_VALUE]}, 0 when absent or unreadable
     */
    static int retryCountOf(Map<String, Object> headers) {
        Object value = headers.get(BrokerNames.RETRY_COUNT_HEADER);
        long count = 0;
        if (value instanceof Number number) {
            count = number.longValue();
        } else if (value != null) {
            try {
                count = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable {} header: {}", BrokerNames.RETRY_COUNT_HEADER, value);
            }
        }
        return (int) Math.min(Math.max(count, 0), Integer.MAX_VALUE);
    }

    // --- Monitoring ---

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public int pendingRetryCount() {
        return pendingRetries.get();
    }

    @Override
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        try {
            while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(IDLE_POLL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return inFlightCount.get() == 0;
    }

    private record ActiveConsumer(
        String queueName,
        ConsumeOptions options,
        String consumerTag,
        BrokerSession session
    ) {}
}
