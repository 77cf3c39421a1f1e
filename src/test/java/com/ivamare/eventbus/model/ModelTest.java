package com.ivamare.eventbus.model;

import com.ivamare.eventbus.broker.BrokerNames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model types")
class ModelTest {

    @Nested
    @DisplayName("QueueDescriptor")
    class QueueDescriptorTests {

        @Test
        @DisplayName("should include only the options that are set")
        void shouldIncludeOnlySetArguments() {
            QueueDescriptor queue = new QueueDescriptor("orders", true, "dlx", "orders.dlq", 60000L, null);

            Map<String, Object> args = queue.arguments();

            assertEquals(3, args.size());
            assertEquals("dlx", args.get(BrokerNames.DEAD_LETTER_EXCHANGE_ARG));
            assertEquals("orders.dlq", args.get(BrokerNames.DEAD_LETTER_ROUTING_KEY_ARG));
            assertEquals(60000L, args.get(BrokerNames.MESSAGE_TTL_ARG));
        }

        @Test
        @DisplayName("should declare plain durable queues without arguments")
        void shouldDeclarePlainDurableQueue() {
            QueueDescriptor dlq = QueueDescriptor.durable("orders.dlq");

            assertTrue(dlq.durable());
            assertTrue(dlq.arguments().isEmpty());
        }
    }

    @Nested
    @DisplayName("ExchangeDescriptor")
    class ExchangeDescriptorTests {

        @Test
        @DisplayName("should default the type to topic")
        void shouldDefaultTypeToTopic() {
            assertEquals(ExchangeDescriptor.TOPIC, new ExchangeDescriptor("audit.events", null, true).type());
        }

        @Test
        @DisplayName("should reject blank names")
        void shouldRejectBlankNames() {
            assertThrows(IllegalArgumentException.class, () -> ExchangeDescriptor.topic(" "));
        }
    }

    @Nested
    @DisplayName("Options")
    class OptionsTests {

        @Test
        @DisplayName("should build queue options with unset fields as null")
        void shouldBuildQueueOptions() {
            QueueOptions options = QueueOptions.builder().maxLength(1000L).build();

            assertEquals(1000L, options.maxLength());
            assertNull(options.durable());
            assertNull(options.messageTtl());
        }

        @Test
        @DisplayName("should default consume options to manual ack and prefetch 10")
        void shouldDefaultConsumeOptions() {
            ConsumeOptions options = ConsumeOptions.defaults();

            assertEquals(10, options.prefetch());
            assertFalse(options.autoAck());
            assertNull(options.consumerTag());
        }

        @Test
        @DisplayName("should reject negative prefetch")
        void shouldRejectNegativePrefetch() {
            assertThrows(IllegalArgumentException.class, () -> ConsumeOptions.withPrefetch(-1));
        }
    }

    @Nested
    @DisplayName("DeliveryContext")
    class DeliveryContextTests {

        @Test
        @DisplayName("should report last attempt once retries are used up")
        void shouldReportLastAttempt() {
            assertFalse(context(2, 3).isLastAttempt());
            assertTrue(context(3, 3).isLastAttempt());
            assertTrue(context(0, 0).isLastAttempt());
        }

        private DeliveryContext context(int retryCount, int maxRetries) {
            return new DeliveryContext("q", "user.created", "user.events", Map.of(), false, null,
                retryCount, maxRetries);
        }
    }

    @Nested
    @DisplayName("DeliveryState")
    class DeliveryStateTests {

        @ParameterizedTest
        @EnumSource(value = DeliveryState.class, names = {"ACKED", "RETRY_SCHEDULED", "DEAD_LETTERED"})
        @DisplayName("should be terminal after a settlement")
        void shouldBeTerminal(DeliveryState state) {
            assertTrue(state.isTerminal());
        }

        @ParameterizedTest
        @EnumSource(value = DeliveryState.class, names = {"RECEIVED", "DISPATCHED"})
        @DisplayName("should not be terminal before a settlement")
        void shouldNotBeTerminal(DeliveryState state) {
            assertFalse(state.isTerminal());
        }
    }

    @Test
    @DisplayName("should carry the event id on publish failure")
    void shouldCarryEventIdOnFailure() {
        PublishResult result = PublishResult.failure("e-9", "Publish failed after 3 attempts");

        assertFalse(result.success());
        assertEquals("e-9", result.eventId());
        assertNull(result.envelope());
    }
}
