package com.ivamare.eventbus;

import com.ivamare.eventbus.api.EventBus;
import com.ivamare.eventbus.exception.EventBusException;
import com.ivamare.eventbus.model.ConsumeOptions;
import com.ivamare.eventbus.model.QueueOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Auto-start configuration for consumers.
 *
 * <p>Enable with:
 * <pre>
 * eventbus:
 *   consumer:
 *     auto-start: true
 *     subscriptions:
 *       - queue: user-service.user.events
 *         exchange: user.events
 *         routing-keys: [user.*]
 * </pre>
 *
 * <p>On application ready the bus connects, then each subscription's queue is
 * declared with its dead-letter queue, bound and consumed. A failure here
 * fails application startup.
 */
@AutoConfiguration(after = EventBusAutoConfiguration.class)
@ConditionalOnBean(EventBus.class)
@ConditionalOnProperty(prefix = "eventbus.consumer", name = "auto-start", havingValue = "true")
public class EventBusAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EventBusAutoStartConfiguration.class);

    private final List<String> startedQueues = new ArrayList<>();
    private final EventBus eventBus;
    private final EventBusProperties properties;

    public EventBusAutoStartConfiguration(EventBus eventBus, EventBusProperties properties) {
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startConsumers() {
        try {
            eventBus.init().join();

            List<EventBusProperties.SubscriptionProperties> subscriptions =
                properties.getConsumer().getSubscriptions();
            if (subscriptions.isEmpty()) {
                log.warn("No subscriptions configured, no consumers to start");
                return;
            }

            for (EventBusProperties.SubscriptionProperties subscription : subscriptions) {
                start(subscription);
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new EventBusException("Event bus auto-start failed", e.getCause());
        }
    }

    private void start(EventBusProperties.SubscriptionProperties subscription) {
        String queue = subscription.getQueue();
        QueueOptions queueOptions = QueueOptions.builder()
            .messageTtl(subscription.getMessageTtl())
            .maxLength(subscription.getMaxLength())
            .build();

        eventBus.createQueue(queue, queueOptions).join();

        if (subscription.getExchange() != null && !subscription.getRoutingKeys().isEmpty()) {
            eventBus.bindQueue(queue, subscription.getExchange(), subscription.getRoutingKeys()).join();
        }

        int prefetch = subscription.getPrefetch() != null
            ? subscription.getPrefetch()
            : properties.getPrefetch();
        eventBus.consume(queue, ConsumeOptions.withPrefetch(prefetch)).join();
        startedQueues.add(queue);

        log.info("Started consumer for queue={}", queue);
    }

    @PreDestroy
    public void stopConsumers() {
        if (startedQueues.isEmpty()) {
            return;
        }

        log.info("Stopping {} consumers...", startedQueues.size());

        eventBus.cancelAllConsumers().join();

        log.info("All consumers stopped");
    }

    /**
     * Queues consumed by auto-start.
     *
     * @return queue names
     */
    public List<String> getStartedQueues() {
        return List.copyOf(startedQueues);
    }
}
