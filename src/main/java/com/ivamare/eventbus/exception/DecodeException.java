package com.ivamare.eventbus.exception;

/**
 * Raised when a message body cannot be decoded into an event envelope.
 *
 * <p>Undecodable messages are poison messages and go straight to dead-letter.
 */
public class DecodeException extends EventBusException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
