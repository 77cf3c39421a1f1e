package com.ivamare.eventbus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbus.api.EventBus;
import com.ivamare.eventbus.broker.BrokerSessionFactory;
import com.ivamare.eventbus.broker.impl.AmqpBrokerSessionFactory;
import com.ivamare.eventbus.connection.ConnectionSupervisor;
import com.ivamare.eventbus.consumer.EventConsumer;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventbus.publisher.EventPublisher;
import com.ivamare.eventbus.topology.TopologyRegistrar;
import com.rabbitmq.client.ConnectionFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Duration;

/**
 * Auto-configuration for Event Bus.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Broker Session Factory (RabbitMQ)</li>
 *   <li>Handler Registry</li>
 *   <li>Event Bus, and its supervisor, registrar, publisher and consumer</li>
 * </ul>
 *
 * <p>The bus connects on {@code init()}, which the auto-start configuration
 * calls when {@code eventbus.consumer.auto-start=true}.
 *
 * <p>To disable auto-configuration:
 * <pre>
 * eventbus.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnClass(ConnectionFactory.class)
@ConditionalOnProperty(prefix = "eventbus", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper eventBusObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Broker ---

    @Bean
    @ConditionalOnMissingBean
    public BrokerSessionFactory brokerSessionFactory(EventBusProperties properties) {
        EventBusProperties.ConnectionProperties cp = properties.getConnection();
        return new AmqpBrokerSessionFactory(
            cp.getConnectionTimeoutMs(),
            cp.getHeartbeatSeconds(),
            cp.getConnectionName()
        );
    }

    // --- Handler Registry ---

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry() {
        return new DefaultHandlerRegistry();
    }

    // --- Event Bus ---

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventBus eventBus(
            EventBusProperties properties,
            BrokerSessionFactory brokerSessionFactory,
            ObjectMapper objectMapper,
            HandlerRegistry handlerRegistry) {
        EventBusProperties.ConnectionProperties connection = properties.getConnection();
        EventBusProperties.PublisherProperties publisher = properties.getPublisher();
        EventBusProperties.ConsumerProperties consumer = properties.getConsumer();

        return EventBus.builder()
            .url(properties.getUrl())
            .serviceName(properties.getServiceName())
            .prefetch(properties.getPrefetch())
            .shutdownTimeout(Duration.ofMillis(properties.getShutdownTimeoutMs()))
            .exchanges(properties.toExchangeDescriptors())
            .maxReconnectAttempts(connection.getMaxReconnectAttempts())
            .reconnectDelayMs(connection.getReconnectDelayMs())
            .errorThreshold(connection.getErrorThreshold())
            .deadLetterExchange(properties.getTopology().getDeadLetterExchange())
            .publishMaxAttempts(publisher.getMaxAttempts())
            .publishRetryDelayMs(publisher.getRetryDelayMs())
            .defaultExchange(publisher.getDefaultExchange())
            .exchangeMapping(publisher.getExchangeMapping())
            .maxRetries(consumer.getMaxRetries())
            .retryDelayMs(consumer.getRetryDelayMs())
            .maxRetryDelayMs(consumer.getMaxRetryDelayMs())
            .requireDeclaredQueues(consumer.isRequireDeclaredQueues())
            .sessionFactory(brokerSessionFactory)
            .objectMapper(objectMapper)
            .handlerRegistry(handlerRegistry)
            .build();
    }

    // --- Components ---

    @Bean
    @ConditionalOnMissingBean
    public ConnectionSupervisor connectionSupervisor(EventBus eventBus) {
        return eventBus.supervisor();
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyRegistrar topologyRegistrar(EventBus eventBus) {
        return eventBus.topology();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventPublisher eventPublisher(EventBus eventBus) {
        return eventBus.publisher();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventConsumer eventConsumer(EventBus eventBus) {
        return eventBus.consumer();
    }
}
