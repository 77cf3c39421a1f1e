package com.ivamare.eventbus.publisher.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbus.broker.BrokerNames;
import com.ivamare.eventbus.connection.ConnectionSupervisor;
import com.ivamare.eventbus.exception.PublishException;
import com.ivamare.eventbus.model.BatchEvent;
import com.ivamare.eventbus.model.BatchPublishResult;
import com.ivamare.eventbus.model.EventEnvelope;
import com.ivamare.eventbus.model.EventTypes;
import com.ivamare.eventbus.model.Exchanges;
import com.ivamare.eventbus.model.MessageProperties;
import com.ivamare.eventbus.model.PublishOptions;
import com.ivamare.eventbus.model.PublishResult;
import com.ivamare.eventbus.policy.RetryPolicy;
import com.ivamare.eventbus.publisher.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of EventPublisher.
 *
 * <p>Each attempt acquires the current session from the supervisor, so an
 * attempt made after a reconnection goes out on the new session.
 */
public class DefaultEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventPublisher.class);

    public static final String DEFAULT_VERSION = "1.0";
    public static final String UNKNOWN_SERVICE = "unknown";
    public static final String SERVICE_NAME_ENV = "SERVICE_NAME";

    /**
     * Built-in event type to exchange mapping.
     */
    public static final Map<String, String> DEFAULT_EXCHANGE_MAPPING = Map.ofEntries(
        Map.entry(EventTypes.USER_CREATED, Exchanges.USER_EVENTS),
        Map.entry(EventTypes.USER_UPDATED, Exchanges.USER_EVENTS),
        Map.entry(EventTypes.USER_DELETED, Exchanges.USER_EVENTS),
        Map.entry(EventTypes.USER_LOGIN, Exchanges.USER_EVENTS),
        Map.entry(EventTypes.USER_LOGOUT, Exchanges.USER_EVENTS),

        Map.entry(EventTypes.PAYMENT_CREATED, Exchanges.PAYMENT_EVENTS),
        Map.entry(EventTypes.PAYMENT_COMPLETED, Exchanges.PAYMENT_EVENTS),
        Map.entry(EventTypes.PAYMENT_FAILED, Exchanges.PAYMENT_EVENTS),
        Map.entry(EventTypes.ACCOUNT_CREATED, Exchanges.ACCOUNTS_EVENTS),
        Map.entry(EventTypes.ACCOUNT_UPDATED, Exchanges.ACCOUNTS_EVENTS),
        Map.entry(EventTypes.APPLICATION_STATUS_UPDATED, Exchanges.ACCOUNTS_EVENTS),
        Map.entry(EventTypes.APPLICATION_STATUS_SUBMITTED, Exchanges.ACCOUNTS_EVENTS),

        Map.entry(EventTypes.APPLICATION_CREATED, Exchanges.APPLICATION_EVENTS),
        Map.entry(EventTypes.APPLICATION_UPDATED, Exchanges.APPLICATION_EVENTS),
        Map.entry(EventTypes.APPLICATION_SUBMITTED, Exchanges.APPLICATION_EVENTS),
        Map.entry(EventTypes.APPLICATION_APPROVED, Exchanges.APPLICATION_EVENTS),
        Map.entry(EventTypes.APPLICATION_REJECTED, Exchanges.APPLICATION_EVENTS),

        Map.entry(EventTypes.PORTAL_APPLICATION_CREATED, Exchanges.PORTAL_EVENTS),
        Map.entry(EventTypes.PORTAL_APPLICATION_UPDATED, Exchanges.PORTAL_EVENTS),
        Map.entry(EventTypes.PROFILE_APPLICATION_CREATE, Exchanges.PORTAL_EVENTS),

        Map.entry(EventTypes.PROFILE_CREATED, Exchanges.PROFILE_EVENTS),
        Map.entry(EventTypes.PROFILE_UPDATED, Exchanges.PROFILE_EVENTS),
        Map.entry(EventTypes.PROFILE_DELETED, Exchanges.PROFILE_EVENTS)
    );

    private final ConnectionSupervisor supervisor;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final String serviceName;
    private final String defaultExchange;
    private final Executor executor;
    private final Map<String, String> exchangeMapping = new ConcurrentHashMap<>(DEFAULT_EXCHANGE_MAPPING);

    /**
     * Creates a new DefaultEventPublisher.
     *
     * @param supervisor Supplier of the live broker session
     * @param objectMapper Mapper used to serialize envelopes
     * @param retryPolicy Publish retry policy
     * @param serviceName Service name for envelope metadata (nullable, falls back to $SERVICE_NAME)
     * @param defaultExchange Exchange for unmapped event types (nullable)
     * @param exchangeOverrides Additional event type to exchange entries (nullable)
     * @param executor Executor for blocking broker calls
     */
    public DefaultEventPublisher(
            ConnectionSupervisor supervisor,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy,
            String serviceName,
            String defaultExchange,
            Map<String, String> exchangeOverrides,
            Executor executor) {
        this.supervisor = supervisor;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.serviceName = resolveServiceName(serviceName);
        this.defaultExchange = defaultExchange != null && !defaultExchange.isBlank()
            ? defaultExchange
            : Exchanges.APPLICATION_EVENTS;
        this.executor = executor;
        if (exchangeOverrides != null) {
            exchangeMapping.putAll(exchangeOverrides);
        }
    }

    @Override
    public CompletableFuture<PublishResult> publish(String eventType, Object data, PublishOptions options) {
        PublishOptions opts = options != null ? options : PublishOptions.none();
        String eventId = UUID.randomUUID().toString();

        if (eventType == null || eventType.isBlank()) {
            return CompletableFuture.completedFuture(
                PublishResult.failure(eventId, "Event type must not be blank"));
        }

        EventEnvelope envelope = buildEnvelope(eventId, eventType, data, opts);
        String exchange = getExchangeForEvent(eventType);
        String routingKey = opts.routingKey() != null ? opts.routingKey() : eventType;

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event {} (eventId={}): {}", eventType, eventId, e.getMessage());
            return CompletableFuture.completedFuture(
                PublishResult.failure(eventId, "Failed to serialize event: " + e.getOriginalMessage()));
        }

        MessageProperties properties = new MessageProperties(
            MessageProperties.APPLICATION_JSON,
            true,
            opts.priority(),
            envelope.timestamp(),
            eventId,
            envelope.correlationId(),
            buildHeaders(envelope, opts)
        );

        log.debug("Publishing event {} to {} with routing key {} (eventId={}, correlationId={})",
            eventType, exchange, routingKey, eventId, envelope.correlationId());

        return publishRaw(exchange, routingKey, body, properties)
            .handle((ignored, ex) -> {
                if (ex == null) {
                    log.info("Published event {} (eventId={}) to {}", eventType, eventId, exchange);
                    return PublishResult.success(envelope);
                }
                return PublishResult.failure(eventId, unwrap(ex).getMessage());
            });
    }

    @Override
    public CompletableFuture<List<BatchPublishResult>> publishBatch(List<BatchEvent> events) {
        List<CompletableFuture<PublishResult>> futures = events.stream()
            .map(event -> publish(event.eventType(), event.data(), event.options()))
            .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                List<BatchPublishResult> results = new ArrayList<>(events.size());
                for (int i = 0; i < events.size(); i++) {
                    PublishResult result = futures.get(i).join();
                    results.add(new BatchPublishResult(events.get(i).eventType(), result.success(), result));
                }
                long failed = results.stream().filter(r -> !r.success()).count();
                if (failed > 0) {
                    log.warn("Batch publish: {} of {} events failed", failed, results.size());
                }
                return results;
            });
    }

    @Override
    public CompletableFuture<Void> publishRaw(String exchange, String routingKey, byte[] body,
                                              MessageProperties properties) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        attemptPublish(exchange, routingKey, body, properties, 1, result);
        return result;
    }

    @Override
    public String getExchangeForEvent(String eventType) {
        if (eventType == null) {
            return defaultExchange;
        }
        return exchangeMapping.getOrDefault(eventType, defaultExchange);
    }

    @Override
    public void setExchangeMapping(Map<String, String> mapping) {
        exchangeMapping.putAll(mapping);
    }

    // --- Internals ---

    private void attemptPublish(String exchange, String routingKey, byte[] body, MessageProperties properties,
                                int attempt, CompletableFuture<Void> result) {
        supervisor.acquireSession()
            .thenAcceptAsync(session -> {
                if (!session.publish(exchange, routingKey, body, properties)) {
                    throw new PublishException(exchange, routingKey,
                        "Broker refused publish (outbound buffer full)");
                }
            }, executor)
            .whenComplete((ignored, ex) -> {
                if (ex == null) {
                    result.complete(null);
                    return;
                }

                Throwable cause = unwrap(ex);
                if (cause instanceof RejectedExecutionException) {
                    log.error("Publish to {} ({}) abandoned on attempt {}: executor shut down",
                        exchange, routingKey, attempt);
                    result.completeExceptionally(new PublishException(exchange, routingKey,
                        "Publish abandoned, executor shut down", cause, attempt));
                    return;
                }
                if (retryPolicy.shouldRetry(attempt)) {
                    long delay = retryPolicy.getBackoffMs(attempt);
                    log.warn("Publish to {} ({}) failed on attempt {}/{}, retrying in {}ms: {}",
                        exchange, routingKey, attempt, retryPolicy.maxAttempts(), delay, cause.getMessage());
                    scheduleAttempt(exchange, routingKey, body, properties, attempt + 1, result, delay);
                    return;
                }

                log.error("Publish to {} ({}) failed after {} attempts: {}",
                    exchange, routingKey, attempt, cause.getMessage());
                result.completeExceptionally(new PublishException(exchange, routingKey,
                    "Publish failed after " + attempt + " attempts: " + cause.getMessage(), cause, attempt));
            });
    }

    private void scheduleAttempt(String exchange, String routingKey, byte[] body, MessageProperties properties,
                                 int attempt, CompletableFuture<Void> result, long delayMs) {
        // Delay off the bus executor so a rejection reaches the result
        CompletableFuture.runAsync(() -> { }, CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS))
            .thenRunAsync(() -> attemptPublish(exchange, routingKey, body, properties, attempt, result), executor)
            .exceptionally(ex -> {
                Throwable cause = unwrap(ex);
                log.error("Publish to {} ({}) abandoned before attempt {}: {}",
                    exchange, routingKey, attempt, cause.getMessage());
                result.completeExceptionally(new PublishException(exchange, routingKey,
                    "Publish abandoned before attempt " + attempt + ": " + cause.getMessage(), cause, attempt - 1));
                return null;
            });
    }

    private EventEnvelope buildEnvelope(String eventId, String eventType, Object data, PublishOptions opts) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("service", serviceName);
        metadata.put("version", DEFAULT_VERSION);
        metadata.putAll(opts.metadata());

        return new EventEnvelope(
            eventId,
            eventType,
            Instant.now(),
            opts.correlationId() != null ? opts.correlationId() : eventId,
            opts.tenantId(),
            opts.userId(),
            data,
            metadata
        );
    }

    private Map<String, Object> buildHeaders(EventEnvelope envelope, PublishOptions opts) {
        Map<String, Object> headers = new LinkedHashMap<>();
        headers.put(BrokerNames.EVENT_TYPE_HEADER, envelope.eventType());
        headers.put(BrokerNames.CORRELATION_ID_HEADER, envelope.correlationId());
        if (envelope.tenantId() != null) {
            headers.put(BrokerNames.TENANT_ID_HEADER, envelope.tenantId());
        }
        headers.putAll(opts.headers());
        return headers;
    }

    static String resolveServiceName(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String fromEnv = System.getenv(SERVICE_NAME_ENV);
        return fromEnv != null && !fromEnv.isBlank() ? fromEnv : UNKNOWN_SERVICE;
    }

    static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
