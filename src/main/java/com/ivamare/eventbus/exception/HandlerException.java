package com.ivamare.eventbus.exception;

/**
 * Wraps a failure raised by a registered event handler.
 *
 * <p>Handler failures drive the retry/dead-letter state machine and never
 * escape the delivery engine.
 */
public class HandlerException extends EventBusException {

    private final String eventType;
    private final String eventId;

    public HandlerException(String eventType, String eventId, Throwable cause) {
        super("Handler for " + eventType + " failed (eventId=" + eventId + "): "
            + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.eventType = eventType;
        this.eventId = eventId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getEventId() {
        return eventId;
    }
}
