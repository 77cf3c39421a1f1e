package com.ivamare.eventbus.broker;

/**
 * Wire-level names shared with other services.
 *
 * <p>Header and argument names are part of the compatibility surface and must
 * not change. Queue names follow the pattern {service}.{category}.events, and
 * every work queue has a dead-letter queue named {queue}.dlq.
 */
public final class BrokerNames {

    private BrokerNames() {
        // Utility class - prevent instantiation
    }

    /** Number of failed processing attempts carried by a retried message */
    public static final String RETRY_COUNT_HEADER = "x-retry-count";

    /** Routing key the retried message was originally observed with */
    public static final String ORIGINAL_QUEUE_HEADER = "x-original-queue";

    /** Event type of the enclosed envelope */
    public static final String EVENT_TYPE_HEADER = "x-event-type";

    /** Correlation id of the enclosed envelope */
    public static final String CORRELATION_ID_HEADER = "x-correlation-id";

    /** Tenant id of the enclosed envelope */
    public static final String TENANT_ID_HEADER = "x-tenant-id";

    /** Queue argument naming the dead-letter exchange */
    public static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";

    /** Queue argument naming the dead-letter routing key */
    public static final String DEAD_LETTER_ROUTING_KEY_ARG = "x-dead-letter-routing-key";

    /** Queue argument for per-message TTL in milliseconds */
    public static final String MESSAGE_TTL_ARG = "x-message-ttl";

    /** Queue argument for maximum queue length */
    public static final String MAX_LENGTH_ARG = "x-max-length";

    /** Default dead-letter exchange name */
    public static final String DEFAULT_DEAD_LETTER_EXCHANGE = "dlx";

    /** Suffix of dead-letter queues */
    public static final String DLQ_SUFFIX = ".dlq";

    /**
     * Dead-letter queue name for a queue.
     *
     * @param queueName The work queue name
     * @return Queue name in format {queue}.dlq
     */
    public static String dlq(String queueName) {
        return queueName + DLQ_SUFFIX;
    }

    /**
     * Default dead-letter routing key for a queue. Unique per queue so that
     * dead-lettered messages only reach that queue's DLQ.
     *
     * @param queueName The work queue name
     * @return Routing key in format {queue}.dlq
     */
    public static String deadLetterRoutingKey(String queueName) {
        return queueName + DLQ_SUFFIX;
    }

    /**
     * Service-specific queue name.
     *
     * @param serviceName The consuming service
     * @param eventCategory The event category (e.g. "user")
     * @return Queue name in format {service}.{category}.events
     */
    public static String serviceQueue(String serviceName, String eventCategory) {
        return serviceName + "." + eventCategory + ".events";
    }

    /**
     * Check whether a queue name denotes a dead-letter queue.
     *
     * @param queueName The queue name
     * @return true if the name ends with .dlq
     */
    public static boolean isDeadLetterQueue(String queueName) {
        return queueName != null && queueName.endsWith(DLQ_SUFFIX);
    }

    /**
     * Mask credentials in a broker URL for logging.
     *
     * @param url The broker URL
     * @return URL with user info replaced by ***
     */
    public static String maskUrl(String url) {
        if (url == null) {
            return null;
        }
        return url.replaceAll("//[^/@]*@", "//***@");
    }
}
