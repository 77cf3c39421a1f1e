package com.ivamare.eventbus.model;

import java.util.Map;

/**
 * Optional settings for a single publish.
 *
 * @param correlationId Correlation id (defaults to the generated event id)
 * @param tenantId Tenant id, also sent as the {@code x-tenant-id} header
 * @param userId User id
 * @param metadata Metadata merged into the envelope ("service" and "version" override defaults)
 * @param priority Message priority
 * @param routingKey Routing key override (defaults to the event type)
 * @param headers Extra headers, merged over the standard ones
 */
public record PublishOptions(
    String correlationId,
    String tenantId,
    String userId,
    Map<String, Object> metadata,
    int priority,
    String routingKey,
    Map<String, Object> headers
) {
    public PublishOptions {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public static PublishOptions none() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String correlationId;
        private String tenantId;
        private String userId;
        private Map<String, Object> metadata;
        private int priority;
        private String routingKey;
        private Map<String, Object> headers;

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers = headers;
            return this;
        }

        public PublishOptions build() {
            return new PublishOptions(correlationId, tenantId, userId, metadata, priority, routingKey, headers);
        }
    }
}
