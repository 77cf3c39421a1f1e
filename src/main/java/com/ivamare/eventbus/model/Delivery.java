package com.ivamare.eventbus.model;

/**
 * A message delivered by the broker to a consumer.
 *
 * <p>The delivery tag is scoped to the session that delivered the message, so
 * acknowledgement must go back through that same session.
 *
 * @param consumerTag Tag of the consumer the message was delivered to
 * @param deliveryTag Session-scoped delivery tag used to ack/nack
 * @param exchange Exchange the message was published to
 * @param routingKey Routing key the message was published with
 * @param redelivered Whether the broker has delivered this message before
 * @param properties Transport properties and headers
 * @param body Raw message body
 */
public record Delivery(
    String consumerTag,
    long deliveryTag,
    String exchange,
    String routingKey,
    boolean redelivered,
    MessageProperties properties,
    byte[] body
) {}
