package com.ivamare.eventbus.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Standardized wrapper carried in the body of every event message.
 *
 * <p>The JSON shape of this record is shared with other services and must not
 * change: {@code eventId, eventType, timestamp, correlationId, tenantId, userId,
 * data, metadata}. Absent optional fields are omitted.
 *
 * @param eventId Globally unique id assigned at publish time
 * @param eventType Dot-namespaced event type (e.g. "user.created")
 * @param timestamp Publish time, serialized as ISO-8601
 * @param correlationId Correlation id, defaults to the event id
 * @param tenantId Tenant the event belongs to (nullable)
 * @param userId User that caused the event (nullable)
 * @param data Opaque event payload
 * @param metadata Service name, schema version and free-form extras
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventEnvelope(
    String eventId,
    String eventType,
    @JsonFormat(shape = JsonFormat.Shape.STRING) Instant timestamp,
    String correlationId,
    String tenantId,
    String userId,
    Object data,
    Map<String, Object> metadata
) {
    public EventEnvelope {
        metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Map.of();
    }
}
