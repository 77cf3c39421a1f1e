package com.ivamare.eventbus.model;

/**
 * Per-event outcome of a batch publish.
 *
 * @param eventType Event type that was published
 * @param success Whether this event was published
 * @param result Detailed publish result
 */
public record BatchPublishResult(
    String eventType,
    boolean success,
    PublishResult result
) {}
