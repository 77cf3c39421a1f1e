package com.ivamare.eventbus.handler;

import java.util.List;
import java.util.Optional;

/**
 * Registry mapping event types to handlers. At most one handler per event type.
 */
public interface HandlerRegistry {

    /**
     * Register a handler for an event type, replacing any existing one.
     *
     * @param eventType The event type (e.g., "user.created")
     * @param handler The handler function
     * @throws IllegalArgumentException if eventType is blank or handler is null
     */
    void register(String eventType, EventHandler handler);

    /**
     * Remove the handler for an event type.
     *
     * @param eventType The event type
     * @return true if a handler was removed
     */
    boolean unregister(String eventType);

    /**
     * Get the handler for an event type.
     *
     * @param eventType The event type
     * @return Optional containing the handler if found
     */
    Optional<EventHandler> get(String eventType);

    /**
     * Check if a handler is registered.
     *
     * @param eventType The event type
     * @return true if handler is registered
     */
    boolean hasHandler(String eventType);

    /**
     * Get all event types with a registered handler.
     *
     * @return registered event types
     */
    List<String> registeredEventTypes();

    /**
     * Remove all handlers. Useful for testing.
     */
    void clear();

    /**
     * Scan a bean for @Handler annotated methods and register them.
     *
     * @param bean The bean to scan
     * @return event types registered from the bean
     */
    List<String> registerBean(Object bean);
}
