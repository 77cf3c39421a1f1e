package com.ivamare.eventbus.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbus.api.impl.DefaultEventBus;
import com.ivamare.eventbus.broker.BrokerNames;
import com.ivamare.eventbus.broker.BrokerSessionFactory;
import com.ivamare.eventbus.broker.impl.AmqpBrokerSessionFactory;
import com.ivamare.eventbus.connection.ConnectionSettings;
import com.ivamare.eventbus.connection.impl.DefaultConnectionSupervisor;
import com.ivamare.eventbus.consumer.impl.DefaultEventConsumer;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventbus.model.ConsumeOptions;
import com.ivamare.eventbus.model.ExchangeDescriptor;
import com.ivamare.eventbus.model.Exchanges;
import com.ivamare.eventbus.policy.RetryPolicy;
import com.ivamare.eventbus.publisher.impl.DefaultEventPublisher;
import com.ivamare.eventbus.topology.impl.DefaultTopologyRegistrar;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Builder for creating EventBus instances.
 */
public class EventBusBuilder {

    /** Environment variable consulted when no URL is set */
    public static final String RABBIT_URL_ENV = "RABBIT_URL";

    private String url;
    private String serviceName;
    private int prefetch = ConsumeOptions.DEFAULT_PREFETCH;
    private final List<ExchangeDescriptor> exchanges = new ArrayList<>();
    private int maxReconnectAttempts = ConnectionSettings.DEFAULT_MAX_RECONNECT_ATTEMPTS;
    private long reconnectDelayMs = ConnectionSettings.DEFAULT_RECONNECT_DELAY_MS;
    private int errorThreshold = ConnectionSettings.DEFAULT_ERROR_THRESHOLD;
    private String deadLetterExchange = BrokerNames.DEFAULT_DEAD_LETTER_EXCHANGE;
    private int publishMaxAttempts = 3;
    private long publishRetryDelayMs = 1000;
    private String defaultExchange = Exchanges.APPLICATION_EVENTS;
    private final Map<String, String> exchangeMapping = new HashMap<>();
    private int maxRetries = 3;
    private long retryDelayMs = 5000;
    private long maxRetryDelayMs = 0;
    private boolean requireDeclaredQueues = false;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private BrokerSessionFactory sessionFactory;
    private ObjectMapper objectMapper;
    private HandlerRegistry handlerRegistry;
    private ExecutorService executor;

    /**
     * Set the broker URL. Defaults to $RABBIT_URL, then amqp://localhost:5672.
     *
     * @param url The broker URL
     * @return this builder
     */
    public EventBusBuilder url(String url) {
        this.url = url;
        return this;
    }

    /**
     * Set the service name written to envelope metadata.
     * Defaults to $SERVICE_NAME, then "unknown".
     *
     * @param serviceName The service name
     * @return this builder
     */
    public EventBusBuilder serviceName(String serviceName) {
        this.serviceName = serviceName;
        return this;
    }

    /**
     * Set the session prefetch and the default consumer prefetch.
     *
     * @param prefetch Maximum unacknowledged deliveries
     * @return this builder
     */
    public EventBusBuilder prefetch(int prefetch) {
        this.prefetch = prefetch;
        return this;
    }

    /**
     * Add an exchange declared on every connection besides the baseline set.
     *
     * @param exchange The exchange descriptor
     * @return this builder
     */
    public EventBusBuilder exchange(ExchangeDescriptor exchange) {
        this.exchanges.add(exchange);
        return this;
    }

    public EventBusBuilder exchanges(List<ExchangeDescriptor> exchanges) {
        this.exchanges.addAll(exchanges);
        return this;
    }

    public EventBusBuilder maxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
        return this;
    }

    public EventBusBuilder reconnectDelayMs(long reconnectDelayMs) {
        this.reconnectDelayMs = reconnectDelayMs;
        return this;
    }

    /**
     * Set the consecutive connection failure count from which failures log at ERROR.
     *
     * @param errorThreshold The threshold
     * @return this builder
     */
    public EventBusBuilder errorThreshold(int errorThreshold) {
        this.errorThreshold = errorThreshold;
        return this;
    }

    public EventBusBuilder deadLetterExchange(String deadLetterExchange) {
        this.deadLetterExchange = deadLetterExchange;
        return this;
    }

    public EventBusBuilder publishMaxAttempts(int publishMaxAttempts) {
        this.publishMaxAttempts = publishMaxAttempts;
        return this;
    }

    public EventBusBuilder publishRetryDelayMs(long publishRetryDelayMs) {
        this.publishRetryDelayMs = publishRetryDelayMs;
        return this;
    }

    /**
     * Set the exchange for event types without a mapping.
     *
     * @param defaultExchange The exchange name
     * @return this builder
     */
    public EventBusBuilder defaultExchange(String defaultExchange) {
        this.defaultExchange = defaultExchange;
        return this;
    }

    /**
     * Add event type to exchange entries overriding the built-in mapping.
     *
     * @param mapping The entries
     * @return this builder
     */
    public EventBusBuilder exchangeMapping(Map<String, String> mapping) {
        this.exchangeMapping.putAll(mapping);
        return this;
    }

    /**
     * Set how often a failed delivery is retried before dead-lettering.
     *
     * @param maxRetries Retries after the first delivery (0 = dead-letter on first failure)
     * @return this builder
     */
    public EventBusBuilder maxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public EventBusBuilder retryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
        return this;
    }

    /**
     * Cap the consumer retry delay.
     *
     * @param maxRetryDelayMs Maximum delay (0 = uncapped)
     * @return this builder
     */
    public EventBusBuilder maxRetryDelayMs(long maxRetryDelayMs) {
        this.maxRetryDelayMs = maxRetryDelayMs;
        return this;
    }

    /**
     * Refuse to consume queues that were not declared through createQueue.
     *
     * @param requireDeclaredQueues true to refuse
     * @return this builder
     */
    public EventBusBuilder requireDeclaredQueues(boolean requireDeclaredQueues) {
        this.requireDeclaredQueues = requireDeclaredQueues;
        return this;
    }

    public EventBusBuilder shutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
        return this;
    }

    /**
     * Set the broker session factory. Defaults to RabbitMQ.
     *
     * @param sessionFactory The session factory
     * @return this builder
     */
    public EventBusBuilder sessionFactory(BrokerSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
        return this;
    }

    public EventBusBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    public EventBusBuilder handlerRegistry(HandlerRegistry handlerRegistry) {
        this.handlerRegistry = handlerRegistry;
        return this;
    }

    /**
     * Set the executor for broker I/O and handlers. The caller keeps
     * ownership; when unset the bus creates and owns a cached pool.
     *
     * @param executor The executor
     * @return this builder
     */
    public EventBusBuilder executor(ExecutorService executor) {
        this.executor = executor;
        return this;
    }

    /**
     * Build the event bus instance. No connection is made until {@code init()}.
     *
     * @return configured EventBus
     * @throws IllegalArgumentException if a setting is out of range
     */
    public EventBus build() {
        if (objectMapper == null) {
            objectMapper = new ObjectMapper();
            objectMapper.findAndRegisterModules();
        }
        if (handlerRegistry == null) {
            handlerRegistry = new DefaultHandlerRegistry();
        }
        if (sessionFactory == null) {
            sessionFactory = new AmqpBrokerSessionFactory();
        }

        ConnectionSettings settings = new ConnectionSettings(
            resolveUrl(url),
            prefetch,
            maxReconnectAttempts,
            reconnectDelayMs,
            errorThreshold,
            deadLetterExchange,
            exchanges
        );
        RetryPolicy publishPolicy = new RetryPolicy(publishMaxAttempts, publishRetryDelayMs);
        RetryPolicy consumerPolicy = RetryPolicy.forRetries(maxRetries, retryDelayMs, maxRetryDelayMs);

        ExecutorService ownedExecutor = null;
        ExecutorService busExecutor = executor;
        if (busExecutor == null) {
            ownedExecutor = Executors.newCachedThreadPool(new CustomizableThreadFactory("eventbus-"));
            busExecutor = ownedExecutor;
        }

        var supervisor = new DefaultConnectionSupervisor(sessionFactory, settings, busExecutor);
        var topology = new DefaultTopologyRegistrar(supervisor, settings.deadLetterExchange(), busExecutor);
        var publisher = new DefaultEventPublisher(
            supervisor,
            objectMapper,
            publishPolicy,
            serviceName,
            defaultExchange,
            exchangeMapping,
            busExecutor
        );
        var consumer = new DefaultEventConsumer(
            supervisor,
            topology,
            handlerRegistry,
            publisher,
            objectMapper,
            consumerPolicy,
            prefetch,
            requireDeclaredQueues,
            busExecutor
        );
        supervisor.addSessionListener(consumer);

        return new DefaultEventBus(
            supervisor,
            topology,
            publisher,
            handlerRegistry,
            consumer,
            shutdownTimeout,
            busExecutor,
            ownedExecutor
        );
    }

    static String resolveUrl(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String fromEnv = System.getenv(RABBIT_URL_ENV);
        return fromEnv != null && !fromEnv.isBlank() ? fromEnv : ConnectionSettings.DEFAULT_URL;
    }
}
