package com.ivamare.eventbus.model;

/**
 * Describes an exchange to declare on the broker.
 *
 * @param name Exchange name (unique within the declared set)
 * @param type Exchange kind, "topic" for every exchange the bus declares by default
 * @param durable Whether the exchange survives a broker restart
 */
public record ExchangeDescriptor(
    String name,
    String type,
    boolean durable
) {
    public static final String TOPIC = "topic";

    public ExchangeDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Exchange name must not be blank");
        }
        type = type == null || type.isBlank() ? TOPIC : type;
    }

    /**
     * Create a durable topic exchange descriptor.
     *
     * @param name Exchange name
     * @return descriptor
     */
    public static ExchangeDescriptor topic(String name) {
        return new ExchangeDescriptor(name, TOPIC, true);
    }
}
