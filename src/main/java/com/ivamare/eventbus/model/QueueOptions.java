package com.ivamare.eventbus.model;

/**
 * Options for {@code createQueue}. Unset values fall back to the registrar's defaults:
 * durable, dead-lettered to the configured dead-letter exchange under {@code <queue>.dlq}.
 *
 * @param durable Queue durability (nullable, default true)
 * @param deadLetterExchange Dead-letter exchange override (nullable)
 * @param deadLetterRoutingKey Dead-letter routing key override (nullable)
 * @param messageTtl Message TTL in milliseconds (nullable)
 * @param maxLength Maximum queue length (nullable)
 */
public record QueueOptions(
    Boolean durable,
    String deadLetterExchange,
    String deadLetterRoutingKey,
    Long messageTtl,
    Long maxLength
) {
    public static QueueOptions defaults() {
        return new QueueOptions(null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Boolean durable;
        private String deadLetterExchange;
        private String deadLetterRoutingKey;
        private Long messageTtl;
        private Long maxLength;

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder deadLetterExchange(String deadLetterExchange) {
            this.deadLetterExchange = deadLetterExchange;
            return this;
        }

        public Builder deadLetterRoutingKey(String deadLetterRoutingKey) {
            this.deadLetterRoutingKey = deadLetterRoutingKey;
            return this;
        }

        public Builder messageTtl(Long messageTtl) {
            this.messageTtl = messageTtl;
            return this;
        }

        public Builder maxLength(Long maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public QueueOptions build() {
            return new QueueOptions(durable, deadLetterExchange, deadLetterRoutingKey, messageTtl, maxLength);
        }
    }
}
