package com.ivamare.eventbus.publisher;

import com.ivamare.eventbus.model.BatchEvent;
import com.ivamare.eventbus.model.BatchPublishResult;
import com.ivamare.eventbus.model.MessageProperties;
import com.ivamare.eventbus.model.PublishOptions;
import com.ivamare.eventbus.model.PublishResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes events wrapped in the standard envelope.
 */
public interface EventPublisher {

    /**
     * Wrap the payload in an envelope and publish it to the exchange mapped
     * for the event type, retrying transient failures.
     *
     * <p>The returned future never completes exceptionally; failures are
     * reported through {@link PublishResult#success()}.
     *
     * @param eventType Event type, also the default routing key
     * @param data Event payload (serialized as JSON)
     * @param options Publish options
     * @return future with the publish result
     */
    CompletableFuture<PublishResult> publish(String eventType, Object data, PublishOptions options);

    /**
     * Publish an event with default options.
     *
     * @param eventType Event type
     * @param data Event payload
     * @return future with the publish result
     */
    default CompletableFuture<PublishResult> publish(String eventType, Object data) {
        return publish(eventType, data, PublishOptions.none());
    }

    /**
     * Publish several events concurrently. One failure never affects the others.
     *
     * @param events Events to publish
     * @return per-event results in input order
     */
    CompletableFuture<List<BatchPublishResult>> publishBatch(List<BatchEvent> events);

    /**
     * Publish raw bytes with the same retry policy as {@link #publish}.
     *
     * @param exchange Target exchange
     * @param routingKey Routing key
     * @param body Message body
     * @param properties Message properties
     * @return future completing when the broker accepted the message, or
     *         exceptionally with {@link com.ivamare.eventbus.exception.PublishException}
     */
    CompletableFuture<Void> publishRaw(String exchange, String routingKey, byte[] body, MessageProperties properties);

    /**
     * Exchange an event type is published to.
     *
     * @param eventType Event type
     * @return mapped exchange, or the default exchange
     */
    String getExchangeForEvent(String eventType);

    /**
     * Merge entries into the event type to exchange mapping.
     *
     * @param mapping Event type to exchange entries (override existing ones)
     */
    void setExchangeMapping(Map<String, String> mapping);
}
