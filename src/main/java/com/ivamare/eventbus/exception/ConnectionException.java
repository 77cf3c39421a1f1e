package com.ivamare.eventbus.exception;

/**
 * Raised when a broker session cannot be established.
 *
 * <p>Connection failures are retried by the connection supervisor up to the
 * configured reconnect ceiling. Once the ceiling is exceeded this exception
 * reaches the caller and is expected to terminate the process.
 */
public class ConnectionException extends EventBusException {

    private final int attempts;

    public ConnectionException(String message) {
        this(message, null, 0);
    }

    public ConnectionException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public ConnectionException(String message, Throwable cause, int attempts) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * @return number of connection attempts made before giving up (0 if unknown)
     */
    public int getAttempts() {
        return attempts;
    }
}
