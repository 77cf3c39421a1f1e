package com.ivamare.eventbus.broker.impl;

import com.ivamare.eventbus.broker.BrokerSession;
import com.ivamare.eventbus.broker.DeliveryCallback;
import com.ivamare.eventbus.broker.SessionCloseListener;
import com.ivamare.eventbus.exception.BrokerException;
import com.ivamare.eventbus.exception.ConsumeException;
import com.ivamare.eventbus.exception.PublishException;
import com.ivamare.eventbus.exception.TopologyException;
import com.ivamare.eventbus.model.Delivery;
import com.ivamare.eventbus.model.ExchangeDescriptor;
import com.ivamare.eventbus.model.MessageProperties;
import com.ivamare.eventbus.model.QueueDescriptor;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RabbitMQ broker session: one connection with one channel.
 *
 * <p>Closure of either the connection or the channel that was not requested
 * by the application is reported once to the registered close listeners.
 * While the broker has blocked the connection (resource alarm), publishes are
 * refused with {@code false}.
 */
public class AmqpBrokerSession implements BrokerSession {

    private static final Logger log = LoggerFactory.getLogger(AmqpBrokerSession.class);

    private static final int PERSISTENT_DELIVERY_MODE = 2;
    private static final int TRANSIENT_DELIVERY_MODE = 1;

    private final Connection connection;
    private final Channel channel;
    private final List<SessionCloseListener> closeListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closeNotified = new AtomicBoolean(false);
    private final AtomicBoolean blocked = new AtomicBoolean(false);

    public AmqpBrokerSession(Connection connection, Channel channel) {
        this.connection = connection;
        this.channel = channel;

        connection.addShutdownListener(this::onShutdown);
        channel.addShutdownListener(this::onShutdown);
        connection.addBlockedListener(
            reason -> {
                blocked.set(true);
                log.warn("Broker blocked publishing on this connection: {}", reason);
            },
            () -> {
                blocked.set(false);
                log.info("Broker unblocked publishing on this connection");
            });
    }

    // --- Topology ---

    @Override
    public void declareExchange(ExchangeDescriptor exchange) {
        try {
            channel.exchangeDeclare(exchange.name(), exchange.type(), exchange.durable());
        } catch (IOException | RuntimeException e) {
            throw new TopologyException("Failed to declare exchange " + exchange.name(), e);
        }
    }

    @Override
    public void declareQueue(QueueDescriptor queue) {
        Map<String, Object> args = queue.arguments();
        try {
            channel.queueDeclare(queue.name(), queue.durable(), false, false, args.isEmpty() ? null : args);
        } catch (IOException | RuntimeException e) {
            throw new TopologyException("Failed to declare queue " + queue.name(), e);
        }
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) {
        try {
            channel.queueBind(queue, exchange, routingKey);
        } catch (IOException | RuntimeException e) {
            throw new TopologyException(
                "Failed to bind queue " + queue + " to " + exchange + " (" + routingKey + ")", e);
        }
    }

    // --- Publishing ---

    @Override
    public boolean publish(String exchange, String routingKey, byte[] body, MessageProperties properties) {
        if (blocked.get()) {
            return false;
        }
        try {
            channel.basicPublish(exchange, routingKey, toBasicProperties(properties), body);
            return true;
        } catch (IOException | RuntimeException e) {
            throw new PublishException(exchange, routingKey, "RabbitMQ publish failed: " + e.getMessage(), e);
        }
    }

    // --- Consuming ---

    @Override
    public void setConcurrencyLimit(int prefetch) {
        try {
            channel.basicQos(prefetch);
        } catch (IOException | RuntimeException e) {
            throw new ConsumeException(null, "Failed to set prefetch " + prefetch, e);
        }
    }

    @Override
    public String consume(String queue, DeliveryCallback callback, boolean autoAck, String consumerTag) {
        try {
            return channel.basicConsume(queue, autoAck, consumerTag != null ? consumerTag : "",
                new DefaultConsumer(channel) {
                    @Override
                    public void handleDelivery(String tag, Envelope envelope,
                                               AMQP.BasicProperties properties, byte[] body) {
                        callback.onDelivery(new Delivery(
                            tag,
                            envelope.getDeliveryTag(),
                            envelope.getExchange(),
                            envelope.getRoutingKey(),
                            envelope.isRedeliver(),
                            toMessageProperties(properties),
                            body
                        ));
                    }
                });
        } catch (IOException | RuntimeException e) {
            throw new ConsumeException(queue, "Failed to consume from " + queue, e);
        }
    }

    @Override
    public void ack(Delivery delivery) {
        try {
            channel.basicAck(delivery.deliveryTag(), false);
        } catch (IOException | RuntimeException e) {
            throw new BrokerException("Failed to ack delivery " + delivery.deliveryTag(), e);
        }
    }

    @Override
    public void nack(Delivery delivery, boolean requeue) {
        try {
            channel.basicNack(delivery.deliveryTag(), false, requeue);
        } catch (IOException | RuntimeException e) {
            throw new BrokerException("Failed to nack delivery " + delivery.deliveryTag(), e);
        }
    }

    @Override
    public void cancel(String consumerTag) {
        try {
            channel.basicCancel(consumerTag);
        } catch (IOException | RuntimeException e) {
            throw new BrokerException("Failed to cancel consumer " + consumerTag, e);
        }
    }

    // --- Lifecycle ---

    @Override
    public boolean isOpen() {
        return connection.isOpen() && channel.isOpen();
    }

    @Override
    public void addCloseListener(SessionCloseListener listener) {
        closeListeners.add(listener);
    }

    @Override
    public void close() {
        Exception failure = null;
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException e) {
            failure = e;
        } catch (ShutdownSignalException e) {
            log.debug("Channel already closed: {}", e.getMessage());
        }
        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (IOException e) {
            failure = failure != null ? failure : e;
        } catch (ShutdownSignalException e) {
            log.debug("Connection already closed: {}", e.getMessage());
        }
        if (failure != null) {
            throw new BrokerException("Error closing RabbitMQ session", failure);
        }
    }

    private void onShutdown(ShutdownSignalException cause) {
        if (cause.isInitiatedByApplication()) {
            return;
        }
        if (!closeNotified.compareAndSet(false, true)) {
            return;
        }
        log.warn("RabbitMQ {} closed: {}", cause.isHardError() ? "connection" : "channel", cause.getMessage());
        for (SessionCloseListener listener : closeListeners) {
            try {
                listener.onClose(cause);
            } catch (RuntimeException e) {
                log.error("Session close listener failed", e);
            }
        }
    }

    // --- Property mapping ---

    static AMQP.BasicProperties toBasicProperties(MessageProperties properties) {
        AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder();
        if (properties == null) {
            return builder.build();
        }
        builder.contentType(properties.contentType())
            .deliveryMode(properties.persistent() ? PERSISTENT_DELIVERY_MODE : TRANSIENT_DELIVERY_MODE)
            .priority(properties.priority())
            .messageId(properties.messageId())
            .correlationId(properties.correlationId());
        if (properties.timestamp() != null) {
            builder.timestamp(Date.from(properties.timestamp()));
        }
        if (!properties.headers().isEmpty()) {
            builder.headers(new HashMap<>(properties.headers()));
        }
        return builder.build();
    }

    static MessageProperties toMessageProperties(AMQP.BasicProperties properties) {
        if (properties == null) {
            return new MessageProperties(null, false, null, null, null, null, null);
        }
        Map<String, Object> headers = new HashMap<>();
        if (properties.getHeaders() != null) {
            properties.getHeaders().forEach((k, v) -> headers.put(k, v instanceof LongString ? v.toString() : v));
        }
        return new MessageProperties(
            properties.getContentType(),
            Integer.valueOf(PERSISTENT_DELIVERY_MODE).equals(properties.getDeliveryMode()),
            properties.getPriority(),
            properties.getTimestamp() != null ? properties.getTimestamp().toInstant() : null,
            properties.getMessageId(),
            properties.getCorrelationId(),
            headers
        );
    }
}
