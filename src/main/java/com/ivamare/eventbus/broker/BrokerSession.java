package com.ivamare.eventbus.broker;

import com.ivamare.eventbus.model.Delivery;
import com.ivamare.eventbus.model.ExchangeDescriptor;
import com.ivamare.eventbus.model.MessageProperties;
import com.ivamare.eventbus.model.QueueDescriptor;

/**
 * A live broker connection together with one logical channel.
 *
 * <p>A session is either fully usable (connection and channel open) or not
 * exposed at all. Sessions are owned by the connection supervisor; other
 * components borrow them per operation.
 *
 * <p>All methods are blocking network round-trips and must not be called from
 * a delivery callback thread.
 */
public interface BrokerSession {

    /**
     * Declare an exchange. Idempotent for identical parameters.
     *
     * @param exchange Exchange to declare
     * @throws com.ivamare.eventbus.exception.TopologyException on failure
     */
    void declareExchange(ExchangeDescriptor exchange);

    /**
     * Declare a queue. Idempotent for identical parameters.
     *
     * @param queue Queue to declare
     * @throws com.ivamare.eventbus.exception.TopologyException on failure
     */
    void declareQueue(QueueDescriptor queue);

    /**
     * Bind a queue to an exchange under a routing key.
     *
     * @param queue Queue name
     * @param exchange Exchange name
     * @param routingKey Routing key or pattern
     * @throws com.ivamare.eventbus.exception.TopologyException on failure
     */
    void bindQueue(String queue, String exchange, String routingKey);

    /**
     * Set the maximum number of unacknowledged deliveries for consumers
     * started after this call.
     *
     * @param prefetch Concurrency limit (0 = unlimited)
     * @throws com.ivamare.eventbus.exception.ConsumeException on failure
     */
    void setConcurrencyLimit(int prefetch);

    /**
     * Publish a message.
     *
     * @param exchange Target exchange
     * @param routingKey Routing key
     * @param body Message body
     * @param properties Message properties and headers
     * @return true if accepted, false if the outbound buffer is full
     * @throws com.ivamare.eventbus.exception.PublishException on failure
     */
    boolean publish(String exchange, String routingKey, byte[] body, MessageProperties properties);

    /**
     * Start consuming from a queue.
     *
     * @param queue Queue name
     * @param callback Receives deliveries on the client's dispatch thread
     * @param autoAck Whether the broker acknowledges on delivery
     * @param consumerTag Requested consumer tag (nullable)
     * @return consumer tag assigned by the broker
     * @throws com.ivamare.eventbus.exception.ConsumeException on failure
     */
    String consume(String queue, DeliveryCallback callback, boolean autoAck, String consumerTag);

    /**
     * Acknowledge a delivery.
     *
     * @param delivery Delivery received through this session
     * @throws com.ivamare.eventbus.exception.BrokerException on failure
     */
    void ack(Delivery delivery);

    /**
     * Negatively acknowledge a delivery.
     *
     * @param delivery Delivery received through this session
     * @param requeue Put back on the queue (true) or dead-letter/drop (false)
     * @throws com.ivamare.eventbus.exception.BrokerException on failure
     */
    void nack(Delivery delivery, boolean requeue);

    /**
     * Cancel a consumer.
     *
     * @param consumerTag Tag returned by {@link #consume}
     * @throws com.ivamare.eventbus.exception.BrokerException on failure
     */
    void cancel(String consumerTag);

    /**
     * @return true if both connection and channel are open
     */
    boolean isOpen();

    /**
     * Register a listener for asynchronous closure of the connection or channel.
     *
     * @param listener Listener to notify
     */
    void addCloseListener(SessionCloseListener listener);

    /**
     * Close the channel, then the connection.
     *
     * @throws com.ivamare.eventbus.exception.BrokerException on failure
     */
    void close();
}
