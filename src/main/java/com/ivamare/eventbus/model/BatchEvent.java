package com.ivamare.eventbus.model;

/**
 * One event of a batch publish.
 *
 * @param eventType Event type
 * @param data Event payload
 * @param options Publish options (nullable)
 */
public record BatchEvent(
    String eventType,
    Object data,
    PublishOptions options
) {
    public BatchEvent(String eventType, Object data) {
        this(eventType, data, null);
    }
}
