package com.ivamare.eventbus.model;

import com.ivamare.eventbus.broker.BrokerNames;

import java.util.HashMap;
import java.util.Map;

/**
 * Describes a queue to declare on the broker.
 *
 * @param name Queue name
 * @param durable Whether the queue survives a broker restart
 * @param deadLetterExchange Exchange rejected messages are routed to (nullable)
 * @param deadLetterRoutingKey Routing key used when dead-lettering (nullable)
 * @param messageTtl Per-message time-to-live in milliseconds (nullable)
 * @param maxLength Maximum number of ready messages (nullable)
 */
public record QueueDescriptor(
    String name,
    boolean durable,
    String deadLetterExchange,
    String deadLetterRoutingKey,
    Long messageTtl,
    Long maxLength
) {
    /**
     * Plain durable queue without dead-letter arguments (used for DLQs).
     *
     * @param name Queue name
     * @return descriptor
     */
    public static QueueDescriptor durable(String name) {
        return new QueueDescriptor(name, true, null, null, null, null);
    }

    /**
     * Broker arguments for this queue. Only the options that are set appear.
     *
     * @return mutable argument map
     */
    public Map<String, Object> arguments() {
        Map<String, Object> args = new HashMap<>();
        if (deadLetterExchange != null) {
            args.put(BrokerNames.DEAD_LETTER_EXCHANGE_ARG, deadLetterExchange);
        }
        if (deadLetterRoutingKey != null) {
            args.put(BrokerNames.DEAD_LETTER_ROUTING_KEY_ARG, deadLetterRoutingKey);
        }
        if (messageTtl != null) {
            args.put(BrokerNames.MESSAGE_TTL_ARG, messageTtl);
        }
        if (maxLength != null) {
            args.put(BrokerNames.MAX_LENGTH_ARG, maxLength);
        }
        return args;
    }
}
