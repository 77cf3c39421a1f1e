package com.ivamare.eventbus.model;

/**
 * Options for starting a consumer.
 *
 * @param prefetch Maximum unacknowledged deliveries (concurrency limit)
 * @param autoAck Let the broker acknowledge on delivery (disables retry/dead-lettering)
 * @param consumerTag Explicit consumer tag (nullable, broker-generated when absent)
 */
public record ConsumeOptions(
    int prefetch,
    boolean autoAck,
    String consumerTag
) {
    public static final int DEFAULT_PREFETCH = 10;

    public ConsumeOptions {
        if (prefetch < 0) {
            throw new IllegalArgumentException("prefetch must be >= 0");
        }
    }

    public static ConsumeOptions defaults() {
        return new ConsumeOptions(DEFAULT_PREFETCH, false, null);
    }

    public static ConsumeOptions withPrefetch(int prefetch) {
        return new ConsumeOptions(prefetch, false, null);
    }
}
