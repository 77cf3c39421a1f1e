package com.ivamare.eventbus.handler;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as an event handler.
 *
 * <p>Methods annotated with @Handler are automatically discovered and registered
 * by the HandlerRegistry when component scanning is enabled.
 *
 * <p>Handler methods must have the signature:
 * <pre>
 * void handleXxx(EventEnvelope envelope, DeliveryContext context)
 * </pre>
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class UserHandlers {
 *
 *     {@literal @}Handler(eventType = "user.created")
 *     public void onUserCreated(EventEnvelope envelope, DeliveryContext context) {
 *         var data = (Map&lt;String, Object&gt;) envelope.data();
 *         // Provision the user...
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Handler {

    /**
     * The event type this handler processes.
     *
     * @return event type (e.g., "user.created")
     */
    String eventType();
}
