package com.ivamare.eventbus.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Nested
    @DisplayName("backoff")
    class BackoffTests {

        @Test
        @DisplayName("should grow linearly with the attempt number")
        void shouldGrowLinearly() {
            RetryPolicy policy = new RetryPolicy(4, 5000);

            assertEquals(5000, policy.getBackoffMs(1));
            assertEquals(10000, policy.getBackoffMs(2));
            assertEquals(15000, policy.getBackoffMs(3));
        }

        @Test
        @DisplayName("should treat attempt zero as the first attempt")
        void shouldTreatAttemptZeroAsFirst() {
            RetryPolicy policy = new RetryPolicy(3, 1000);

            assertEquals(1000, policy.getBackoffMs(0));
        }

        @Test
        @DisplayName("should cap the delay when a maximum is set")
        void shouldCapDelay() {
            RetryPolicy policy = new RetryPolicy(10, 5000, 12000);

            assertEquals(10000, policy.getBackoffMs(2));
            assertEquals(12000, policy.getBackoffMs(3));
            assertEquals(12000, policy.getBackoffMs(9));
        }

        @Test
        @DisplayName("should leave the delay uncapped when maximum is zero")
        void shouldLeaveUncapped() {
            RetryPolicy policy = new RetryPolicy(100, 5000, 0);

            assertEquals(250000, policy.getBackoffMs(50));
        }
    }

    @Nested
    @DisplayName("attempt accounting")
    class AttemptTests {

        @Test
        @DisplayName("should allow retries below max attempts only")
        void shouldRetryBelowMaxAttempts() {
            RetryPolicy policy = new RetryPolicy(3, 1000);

            assertTrue(policy.shouldRetry(1));
            assertTrue(policy.shouldRetry(2));
            assertFalse(policy.shouldRetry(3));
            assertFalse(policy.shouldRetry(4));
        }

        @Test
        @DisplayName("forRetries should allow one attempt more than retries")
        void forRetriesShouldAddFirstAttempt() {
            RetryPolicy policy = RetryPolicy.forRetries(3, 5000, 0);

            assertEquals(4, policy.maxAttempts());
            assertEquals(3, policy.maxRetries());
            assertTrue(policy.shouldRetry(3));
            assertFalse(policy.shouldRetry(4));
        }

        @Test
        @DisplayName("forRetries with zero retries should never retry")
        void zeroRetriesShouldNeverRetry() {
            RetryPolicy policy = RetryPolicy.forRetries(0, 5000, 0);

            assertEquals(0, policy.maxRetries());
            assertFalse(policy.shouldRetry(1));
        }

        @Test
        @DisplayName("noRetry should allow a single attempt")
        void noRetryShouldAllowSingleAttempt() {
            RetryPolicy policy = RetryPolicy.noRetry();

            assertEquals(1, policy.maxAttempts());
            assertFalse(policy.shouldRetry(1));
        }
    }

    @Test
    @DisplayName("should provide publish and consumer defaults")
    void shouldProvideDefaults() {
        RetryPolicy publish = RetryPolicy.defaultPublishPolicy();
        RetryPolicy consumer = RetryPolicy.defaultConsumerPolicy();

        assertEquals(3, publish.maxAttempts());
        assertEquals(1000, publish.baseDelayMs());
        assertEquals(3, consumer.maxRetries());
        assertEquals(5000, consumer.baseDelayMs());
    }

    @Test
    @DisplayName("should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1000));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, -1));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 1000, -5));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.forRetries(-1, 1000, 0));
    }
}
