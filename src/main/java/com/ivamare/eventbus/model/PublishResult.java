package com.ivamare.eventbus.model;

/**
 * Outcome of a publish. Publishing never throws; callers inspect this result
 * to decide whether to compensate.
 *
 * @param success Whether the broker accepted the message
 * @param eventId Id of the event (present even on failure when the envelope was built)
 * @param envelope The envelope that was published (nullable on failure)
 * @param error Failure description (null on success)
 */
public record PublishResult(
    boolean success,
    String eventId,
    EventEnvelope envelope,
    String error
) {
    public static PublishResult success(EventEnvelope envelope) {
        return new PublishResult(true, envelope.eventId(), envelope, null);
    }

    public static PublishResult failure(String eventId, String error) {
        return new PublishResult(false, eventId, null, error);
    }
}
