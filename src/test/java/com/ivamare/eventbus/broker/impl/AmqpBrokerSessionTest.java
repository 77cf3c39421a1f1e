package com.ivamare.eventbus.broker.impl;

import com.ivamare.eventbus.exception.BrokerException;
import com.ivamare.eventbus.exception.PublishException;
import com.ivamare.eventbus.exception.TopologyException;
import com.ivamare.eventbus.model.Delivery;
import com.ivamare.eventbus.model.ExchangeDescriptor;
import com.ivamare.eventbus.model.MessageProperties;
import com.ivamare.eventbus.model.QueueDescriptor;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BlockedCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.UnblockedCallback;
import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AmqpBrokerSession")
class AmqpBrokerSessionTest {

    @Mock
    private Connection connection;

    @Mock
    private Channel channel;

    private AmqpBrokerSession session;

    @BeforeEach
    void setUp() {
        session = new AmqpBrokerSession(connection, channel);
    }

    private static MessageProperties properties(Map<String, Object> headers) {
        return new MessageProperties("application/json", true, 3, Instant.parse("2024-05-01T10:00:00Z"),
            "evt-1", "corr-1", headers);
    }

    @Nested
    @DisplayName("topology")
    class TopologyTests {

        @Test
        @DisplayName("should declare exchanges with their type and durability")
        void shouldDeclareExchange() throws Exception {
            session.declareExchange(ExchangeDescriptor.topic("user.events"));

            verify(channel).exchangeDeclare("user.events", "topic", true);
        }

        @Test
        @DisplayName("should pass dead-letter arguments when declaring a queue")
        void shouldDeclareQueueWithArguments() throws Exception {
            session.declareQueue(new QueueDescriptor("orders", true, "dlx", "orders.dlq", null, null));

            verify(channel).queueDeclare("orders", true, false, false,
                Map.of("x-dead-letter-exchange", "dlx", "x-dead-letter-routing-key", "orders.dlq"));
        }

        @Test
        @DisplayName("should declare a plain queue without arguments")
        void shouldDeclarePlainQueue() throws Exception {
            session.declareQueue(QueueDescriptor.durable("orders.dlq"));

            verify(channel).queueDeclare("orders.dlq", true, false, false, null);
        }

        @Test
        @DisplayName("should wrap declaration failures")
        void shouldWrapDeclarationFailures() throws Exception {
            when(channel.queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any()))
                .thenThrow(new IOException("PRECONDITION_FAILED"));

            assertThrows(TopologyException.class, () -> session.declareQueue(QueueDescriptor.durable("orders")));
        }

        @Test
        @DisplayName("should bind queues")
        void shouldBindQueue() throws Exception {
            session.bindQueue("orders", "payment.events", "payment.*");

            verify(channel).queueBind("orders", "payment.events", "payment.*");
        }
    }

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("should map message properties")
        void shouldMapProperties() throws Exception {
            boolean accepted = session.publish("user.events", "user.created", new byte[] {1},
                properties(Map.of("x-event-type", "user.created")));

            assertTrue(accepted);
            ArgumentCaptor<AMQP.BasicProperties> captor = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
            verify(channel).basicPublish(eq("user.events"), eq("user.created"), captor.capture(), any(byte[].class));

            AMQP.BasicProperties props = captor.getValue();
            assertEquals("application/json", props.getContentType());
            assertEquals(2, props.getDeliveryMode());
            assertEquals(3, props.getPriority());
            assertEquals("evt-1", props.getMessageId());
            assertEquals("corr-1", props.getCorrelationId());
            assertEquals(Instant.parse("2024-05-01T10:00:00Z"), props.getTimestamp().toInstant());
            assertEquals("user.created", props.getHeaders().get("x-event-type"));
        }

        @Test
        @DisplayName("should wrap publish failures")
        void shouldWrapPublishFailures() throws Exception {
            doThrow(new IOException("connection reset"))
                .when(channel).basicPublish(anyString(), anyString(), any(), any(byte[].class));

            PublishException thrown = assertThrows(PublishException.class,
                () -> session.publish("user.events", "user.created", new byte[0], properties(Map.of())));
            assertEquals("user.events", thrown.getExchange());
        }

        @Test
        @DisplayName("should refuse publishing while the broker blocks the connection")
        void shouldRefuseWhileBlocked() throws Exception {
            ArgumentCaptor<BlockedCallback> blocked = ArgumentCaptor.forClass(BlockedCallback.class);
            ArgumentCaptor<UnblockedCallback> unblocked = ArgumentCaptor.forClass(UnblockedCallback.class);
            verify(connection).addBlockedListener(blocked.capture(), unblocked.capture());

            blocked.getValue().handle("low on memory");
            assertFalse(session.publish("user.events", "user.created", new byte[0], properties(Map.of())));
            verify(channel, never()).basicPublish(anyString(), anyString(), any(), any(byte[].class));

            unblocked.getValue().handle();
            assertTrue(session.publish("user.events", "user.created", new byte[0], properties(Map.of())));
        }
    }

    @Nested
    @DisplayName("consume")
    class ConsumeTests {

        @Test
        @DisplayName("should map deliveries and convert long string headers")
        void shouldMapDeliveries() throws Exception {
            ArgumentCaptor<Consumer> consumerCaptor = ArgumentCaptor.forClass(Consumer.class);
            when(channel.basicConsume(eq("orders"), eq(false), eq(""), consumerCaptor.capture()))
                .thenReturn("amq.ctag-1");
            List<Delivery> received = new CopyOnWriteArrayList<>();

            String tag = session.consume("orders", received::add, false, null);

            assertEquals("amq.ctag-1", tag);
            AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                .contentType("application/json")
                .deliveryMode(2)
                .headers(Map.of("x-retry-count", 2, "x-original-queue", LongStringHelper.asLongString("orders")))
                .build();
            consumerCaptor.getValue().handleDelivery("amq.ctag-1",
                new Envelope(42L, true, "payment.events", "payment.created"), props, new byte[] {7});

            Delivery delivery = received.get(0);
            assertEquals("amq.ctag-1", delivery.consumerTag());
            assertEquals(42L, delivery.deliveryTag());
            assertEquals("payment.events", delivery.exchange());
            assertEquals("payment.created", delivery.routingKey());
            assertTrue(delivery.redelivered());
            assertTrue(delivery.properties().persistent());
            assertEquals(2, delivery.properties().headers().get("x-retry-count"));
            assertEquals("orders", delivery.properties().headers().get("x-original-queue"));
        }

        @Test
        @DisplayName("should set the prefetch")
        void shouldSetPrefetch() throws Exception {
            session.setConcurrencyLimit(10);

            verify(channel).basicQos(10);
        }

        @Test
        @DisplayName("should ack, nack and cancel by tag")
        void shouldAckNackAndCancel() throws Exception {
            Delivery delivery = new Delivery("ctag", 7L, "e", "k", false, properties(Map.of()), new byte[0]);

            session.ack(delivery);
            session.nack(delivery, false);
            session.cancel("ctag");

            verify(channel).basicAck(7L, false);
            verify(channel).basicNack(7L, false, false);
            verify(channel).basicCancel("ctag");
        }

        @Test
        @DisplayName("should wrap ack failures")
        void shouldWrapAckFailures() throws Exception {
            doThrow(new IOException("channel closed")).when(channel).basicAck(anyLong(), anyBoolean());
            Delivery delivery = new Delivery("ctag", 7L, "e", "k", false, properties(Map.of()), new byte[0]);

            assertThrows(BrokerException.class, () -> session.ack(delivery));
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should report open only when connection and channel are open")
        void shouldReportOpen() {
            when(connection.isOpen()).thenReturn(true);
            when(channel.isOpen()).thenReturn(true, false);

            assertTrue(session.isOpen());
            assertFalse(session.isOpen());
        }

        @Test
        @DisplayName("should notify close listeners once for broker-initiated shutdown")
        void shouldNotifyCloseListenersOnce() {
            ArgumentCaptor<ShutdownListener> connectionListener = ArgumentCaptor.forClass(ShutdownListener.class);
            ArgumentCaptor<ShutdownListener> channelListener = ArgumentCaptor.forClass(ShutdownListener.class);
            verify(connection).addShutdownListener(connectionListener.capture());
            verify(channel).addShutdownListener(channelListener.capture());
            List<Throwable> causes = new CopyOnWriteArrayList<>();
            session.addCloseListener(causes::add);

            ShutdownSignalException signal = mock(ShutdownSignalException.class);
            when(signal.isInitiatedByApplication()).thenReturn(false);

            channelListener.getValue().shutdownCompleted(signal);
            connectionListener.getValue().shutdownCompleted(signal);

            assertEquals(1, causes.size());
            assertSame(signal, causes.get(0));
        }

        @Test
        @DisplayName("should not notify close listeners for application-initiated shutdown")
        void shouldIgnoreApplicationShutdown() {
            ArgumentCaptor<ShutdownListener> connectionListener = ArgumentCaptor.forClass(ShutdownListener.class);
            verify(connection).addShutdownListener(connectionListener.capture());
            List<Throwable> causes = new CopyOnWriteArrayList<>();
            session.addCloseListener(causes::add);

            ShutdownSignalException signal = mock(ShutdownSignalException.class);
            when(signal.isInitiatedByApplication()).thenReturn(true);
            connectionListener.getValue().shutdownCompleted(signal);

            assertTrue(causes.isEmpty());
        }

        @Test
        @DisplayName("should close the channel before the connection")
        void shouldCloseChannelThenConnection() throws Exception {
            when(channel.isOpen()).thenReturn(true);
            when(connection.isOpen()).thenReturn(true);

            session.close();

            var order = inOrder(channel, connection);
            order.verify(channel).close();
            order.verify(connection).close();
        }

        @Test
        @DisplayName("should still close the connection when closing the channel fails")
        void shouldCloseConnectionWhenChannelCloseFails() throws Exception {
            when(channel.isOpen()).thenReturn(true);
            when(connection.isOpen()).thenReturn(true);
            doThrow(new IOException("close failed")).when(channel).close();

            assertThrows(BrokerException.class, () -> session.close());
            verify(connection).close();
        }
    }

    @Test
    @DisplayName("should map transient delivery mode and absent properties")
    void shouldMapTransientAndAbsentProperties() {
        MessageProperties transientProps = new MessageProperties(null, false, null, null, null, null, null);
        assertEquals(1, AmqpBrokerSession.toBasicProperties(transientProps).getDeliveryMode());
        assertNull(AmqpBrokerSession.toBasicProperties(transientProps).getHeaders());

        MessageProperties absent = AmqpBrokerSession.toMessageProperties(null);
        assertFalse(absent.persistent());
        assertTrue(absent.headers().isEmpty());
    }
}
