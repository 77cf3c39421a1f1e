package com.ivamare.eventbus.model;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Transport-level properties of a message, independent of the broker client.
 *
 * @param contentType MIME type of the body
 * @param persistent Whether the broker should persist the message to disk
 * @param priority Message priority (nullable)
 * @param timestamp Time the message was produced (nullable)
 * @param messageId Message identifier (nullable)
 * @param correlationId Correlation identifier (nullable)
 * @param headers Application headers (never null, unmodifiable)
 */
public record MessageProperties(
    String contentType,
    boolean persistent,
    Integer priority,
    Instant timestamp,
    String messageId,
    String correlationId,
    Map<String, Object> headers
) {
    public static final String APPLICATION_JSON = "application/json";

    public MessageProperties {
        headers = headers == null
            ? Map.of()
            : Collections.unmodifiableMap(new HashMap<>(headers));
    }

    /**
     * Copy of these properties with the headers replaced.
     *
     * @param newHeaders Replacement headers
     * @return new properties instance
     */
    public MessageProperties withHeaders(Map<String, Object> newHeaders) {
        return new MessageProperties(contentType, persistent, priority, timestamp,
            messageId, correlationId, newHeaders);
    }
}
