package com.ivamare.eventbus.exception;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies broker exceptions to decide whether reconnecting can help.
 *
 * <p>Transient failures indicate temporary conditions such as:
 * <ul>
 *   <li>Connection refused or reset</li>
 *   <li>Socket and handshake timeouts</li>
 *   <li>Broker shutdown or restart (connection forced)</li>
 *   <li>Connection or channel closed underneath an operation</li>
 * </ul>
 *
 * <p>Permanent failures are configuration problems that no amount of retrying
 * fixes: rejected credentials, a malformed broker URL or a broken TLS setup.
 */
public final class BrokerExceptionClassifier {

    private BrokerExceptionClassifier() {
        // Utility class - no instantiation
    }

    /**
     * Message patterns that indicate transient broker conditions.
     * Checked case-insensitively against exception messages.
     */
    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection timed out",
        "connect timed out",
        "read timed out",
        "socket closed",
        "broken pipe",
        "connection forced",
        "channel is already closed",
        "connection is already closed",
        "network is unreachable",
        "host is unreachable",
        "no route to host",
        "broker forced connection closure",
        "resource_locked",
        "buffer full"
    };

    /**
     * Determine if the exception is a permanent (non-retryable) connection failure.
     *
     * @param ex the exception to classify
     * @return true if retrying the connection cannot succeed
     */
    public static boolean isPermanent(Throwable ex) {
        if (ex == null) {
            return false;
        }
        if (ex instanceof PossibleAuthenticationFailureException) {
            return true;
        }
        if (ex instanceof URISyntaxException) {
            return true;
        }
        if (ex instanceof GeneralSecurityException) {
            return true;
        }
        if (ex instanceof IllegalArgumentException) {
            return true;
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return isPermanent(cause);
        }
        return false;
    }

    /**
     * Determine if the exception is known to be transient.
     *
     * <p>Checks the exception hierarchy for network and AMQP shutdown types,
     * then known message patterns, then the wrapped cause (recursively).
     *
     * @param ex the exception to classify
     * @return true if the exception is transient and should be retried
     */
    public static boolean isTransient(Throwable ex) {
        if (ex == null || isPermanent(ex)) {
            return false;
        }
        return !"Unknown".equals(getTransientReason(ex));
    }

    /**
     * Get a brief description of why the exception was classified as transient.
     * Useful for logging.
     *
     * @param ex the exception to describe
     * @return a brief description of the transient condition, or "Unknown"
     */
    public static String getTransientReason(Throwable ex) {
        if (ex == null) {
            return "Unknown";
        }

        // Subclasses before parent classes
        if (ex instanceof ConnectException) {
            return "Connection refused";
        }
        if (ex instanceof SocketTimeoutException) {
            return "Socket timeout";
        }
        if (ex instanceof UnknownHostException) {
            return "Unknown host";
        }
        if (ex instanceof TimeoutException) {
            return "Broker timeout";
        }
        if (ex instanceof AlreadyClosedException) {
            return "Session already closed";
        }
        if (ex instanceof ShutdownSignalException) {
            return "AMQP shutdown signal";
        }

        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase();
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return "Message pattern: " + pattern;
                }
            }
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            String causeReason = getTransientReason(cause);
            if (!"Unknown".equals(causeReason)) {
                return causeReason;
            }
        }

        if (ex instanceof IOException) {
            return "I/O error";
        }
        return "Unknown";
    }
}
