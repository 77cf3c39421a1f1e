package com.ivamare.eventbus.topology.impl;

import com.ivamare.eventbus.connection.ConnectionSupervisor;
import com.ivamare.eventbus.exception.TopologyException;
import com.ivamare.eventbus.model.QueueDescriptor;
import com.ivamare.eventbus.model.QueueOptions;
import com.ivamare.eventbus.support.FakeBrokerSession;
import com.ivamare.eventbus.support.FakeBrokerSession.Binding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultTopologyRegistrar")
class DefaultTopologyRegistrarTest {

    @Mock
    private ConnectionSupervisor supervisor;

    private FakeBrokerSession session;
    private DefaultTopologyRegistrar registrar;

    @BeforeEach
    void setUp() {
        session = new FakeBrokerSession();
        registrar = new DefaultTopologyRegistrar(supervisor, "dlx", Runnable::run);
    }

    private void sessionAvailable() {
        when(supervisor.acquireSession()).thenReturn(CompletableFuture.completedFuture(session));
    }

    @Nested
    @DisplayName("createQueue")
    class CreateQueueTests {

        @Test
        @DisplayName("should declare the queue with its dead-letter queue and binding")
        void shouldDeclareQueueWithDeadLetterQueue() throws Exception {
            sessionAvailable();

            String name = registrar.createQueue("billing.payment.events").get();

            assertEquals("billing.payment.events", name);
            QueueDescriptor queue = session.declaredQueues().get("billing.payment.events");
            assertTrue(queue.durable());
            assertEquals("dlx", queue.deadLetterExchange());
            assertEquals("billing.payment.events.dlq", queue.deadLetterRoutingKey());
            assertEquals("dlx", queue.arguments().get("x-dead-letter-exchange"));
            assertEquals("billing.payment.events.dlq", queue.arguments().get("x-dead-letter-routing-key"));

            QueueDescriptor dlq = session.declaredQueues().get("billing.payment.events.dlq");
            assertTrue(dlq.durable());
            assertTrue(dlq.arguments().isEmpty());

            assertTrue(session.bindings().contains(
                new Binding("billing.payment.events.dlq", "dlx", "billing.payment.events.dlq")));
            assertTrue(registrar.isManaged("billing.payment.events"));
        }

        @Test
        @DisplayName("should apply queue options")
        void shouldApplyOptions() throws Exception {
            sessionAvailable();
            QueueOptions options = QueueOptions.builder()
                .durable(false)
                .deadLetterExchange("custom.dlx")
                .deadLetterRoutingKey("orders.failed")
                .messageTtl(60000L)
                .maxLength(1000L)
                .build();

            registrar.createQueue("orders", options).get();

            QueueDescriptor queue = session.declaredQueues().get("orders");
            assertFalse(queue.durable());
            assertEquals(60000L, queue.arguments().get("x-message-ttl"));
            assertEquals(1000L, queue.arguments().get("x-max-length"));
            assertTrue(session.bindings().contains(new Binding("orders.dlq", "custom.dlx", "orders.failed")));
        }

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() throws Exception {
            sessionAvailable();

            registrar.createQueue("orders").get();
            registrar.createQueue("orders").get();

            assertEquals(2, session.declaredQueues().size());
            assertEquals(1, session.bindings().size());
            assertTrue(registrar.isManaged("orders"));
        }

        @Test
        @DisplayName("should surface declaration conflicts and leave the queue unmanaged")
        void shouldSurfaceConflicts() {
            sessionAvailable();
            session.failDeclareOfQueue("orders");

            ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> registrar.createQueue("orders").get());

            assertInstanceOf(TopologyException.class, thrown.getCause());
            assertFalse(registrar.isManaged("orders"));
        }

        @Test
        @DisplayName("should reject a blank queue name")
        void shouldRejectBlankName() {
            assertThrows(IllegalArgumentException.class, () -> registrar.createQueue(" "));
            verifyNoInteractions(supervisor);
        }
    }

    @Nested
    @DisplayName("bindQueue")
    class BindQueueTests {

        @Test
        @DisplayName("should bind every routing key")
        void shouldBindEveryKey() throws Exception {
            sessionAvailable();

            registrar.bindQueue("user-service.user.events", "user.events",
                List.of("user.created", "user.*")).get();

            assertEquals(2, session.bindings().size());
            assertTrue(session.bindings().contains(
                new Binding("user-service.user.events", "user.events", "user.created")));
            assertTrue(session.bindings().contains(
                new Binding("user-service.user.events", "user.events", "user.*")));
        }

        @Test
        @DisplayName("should bind a single routing key")
        void shouldBindSingleKey() throws Exception {
            sessionAvailable();

            registrar.bindQueue("audit", "application.events", "#").get();

            assertEquals(1, session.bindings().size());
        }

        @Test
        @DisplayName("should reject missing arguments")
        void shouldRejectMissingArguments() {
            assertThrows(IllegalArgumentException.class,
                () -> registrar.bindQueue("orders", "user.events", List.of()));
            assertThrows(IllegalArgumentException.class,
                () -> registrar.bindQueue("orders", "", List.of("user.created")));
            assertThrows(IllegalArgumentException.class,
                () -> registrar.bindQueue(null, "user.events", List.of("user.created")));
            verifyNoInteractions(supervisor);
        }
    }

    @Test
    @DisplayName("should report queues it did not declare as unmanaged")
    void shouldReportUnmanagedQueues() {
        assertFalse(registrar.isManaged("legacy.queue"));
    }
}
