package com.ivamare.eventbus.model;

import java.util.List;

/**
 * Exchanges declared on every connection.
 */
public final class Exchanges {

    private Exchanges() {
    }

    public static final String USER_EVENTS = "user.events";
    public static final String PAYMENT_EVENTS = "payment.events";
    public static final String APPLICATION_EVENTS = "application.events";
    public static final String ACCOUNTS_EVENTS = "accounts.events";
    public static final String PORTAL_EVENTS = "portal.events";
    public static final String PROFILE_EVENTS = "profile.events";
    public static final String DLX = "dlx";

    /**
     * Baseline exchange set, dead-letter exchange last. All are durable topic exchanges.
     *
     * @param deadLetterExchange Name of the dead-letter exchange
     * @return descriptors in declaration order
     */
    public static List<ExchangeDescriptor> baseline(String deadLetterExchange) {
        return List.of(
            ExchangeDescriptor.topic(USER_EVENTS),
            ExchangeDescriptor.topic(PAYMENT_EVENTS),
            ExchangeDescriptor.topic(APPLICATION_EVENTS),
            ExchangeDescriptor.topic(ACCOUNTS_EVENTS),
            ExchangeDescriptor.topic(PORTAL_EVENTS),
            ExchangeDescriptor.topic(PROFILE_EVENTS),
            ExchangeDescriptor.topic(deadLetterExchange)
        );
    }
}
