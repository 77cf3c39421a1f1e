package com.ivamare.eventbus.policy;

/**
 * Policy for bounded retries with linear backoff.
 *
 * <p>The delay before retry {@code n} is {@code baseDelayMs * n}. A positive
 * {@code maxDelayMs} caps the delay; zero leaves it uncapped.
 *
 * @param maxAttempts Maximum number of attempts, including the first
 * @param baseDelayMs Delay unit in milliseconds
 * @param maxDelayMs Upper bound for a single delay (0 = uncapped)
 */
public record RetryPolicy(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
    }

    public RetryPolicy(int maxAttempts, long baseDelayMs) {
        this(maxAttempts, baseDelayMs, 0);
    }

    /**
     * Default publish policy: 3 attempts, 1s, 2s between them.
     *
     * @return Default publish retry policy
     */
    public static RetryPolicy defaultPublishPolicy() {
        return new RetryPolicy(3, 1000);
    }

    /**
     * Default consumer policy: 3 retries after the first delivery, 5s, 10s, 15s apart.
     *
     * @return Default consumer retry policy
     */
    public static RetryPolicy defaultConsumerPolicy() {
        return forRetries(3, 5000, 0);
    }

    /**
     * Policy allowing {@code maxRetries} retries after the first attempt.
     *
     * @param maxRetries Retries after the first attempt
     * @param baseDelayMs Delay unit in milliseconds
     * @param maxDelayMs Delay cap (0 = uncapped)
     * @return Retry policy with {@code maxRetries + 1} attempts
     */
    public static RetryPolicy forRetries(int maxRetries, long baseDelayMs, long maxDelayMs) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        return new RetryPolicy(maxRetries + 1, baseDelayMs, maxDelayMs);
    }

    /**
     * Create a policy with no retries.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0);
    }

    /**
     * Get the delay before the attempt following {@code attempt}.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return Delay in milliseconds
     */
    public long getBackoffMs(int attempt) {
        long delay = baseDelayMs * Math.max(attempt, 1);
        if (maxDelayMs > 0) {
            return Math.min(delay, maxDelayMs);
        }
        return delay;
    }

    /**
     * Check if another retry should be attempted.
     *
     * @param attempt The current attempt number (1-based)
     * @return true if more attempts are allowed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Retries allowed after the first attempt.
     *
     * @return {@code maxAttempts - 1}
     */
    public int maxRetries() {
        return maxAttempts - 1;
    }
}
