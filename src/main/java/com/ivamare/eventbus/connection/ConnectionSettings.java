package com.ivamare.eventbus.connection;

import com.ivamare.eventbus.broker.BrokerNames;
import com.ivamare.eventbus.model.ConsumeOptions;
import com.ivamare.eventbus.model.ExchangeDescriptor;

import java.util.List;

/**
 * Settings for the connection supervisor.
 *
 * @param url Broker URL (may carry credentials)
 * @param prefetch Per-session concurrency limit applied on every connect
 * @param maxReconnectAttempts Retries after a failed first connect before giving up
 * @param reconnectDelayMs Fixed delay between connect attempts
 * @param errorThreshold Failures from which on connect errors log at ERROR instead of WARN
 * @param deadLetterExchange Name of the dead-letter exchange
 * @param exchanges Exchanges declared in addition to the baseline set
 */
public record ConnectionSettings(
    String url,
    int prefetch,
    int maxReconnectAttempts,
    long reconnectDelayMs,
    int errorThreshold,
    String deadLetterExchange,
    List<ExchangeDescriptor> exchanges
) {
    public static final String DEFAULT_URL = "amqp://localhost:5672";
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 10;
    public static final long DEFAULT_RECONNECT_DELAY_MS = 5000;
    public static final int DEFAULT_ERROR_THRESHOLD = 5;

    public ConnectionSettings {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Broker url must not be blank");
        }
        if (maxReconnectAttempts < 1) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 1");
        }
        if (reconnectDelayMs < 0) {
            throw new IllegalArgumentException("reconnectDelayMs must be >= 0");
        }
        deadLetterExchange = deadLetterExchange == null || deadLetterExchange.isBlank()
            ? BrokerNames.DEFAULT_DEAD_LETTER_EXCHANGE
            : deadLetterExchange;
        exchanges = exchanges != null ? List.copyOf(exchanges) : List.of();
    }

    /**
     * Default settings for a broker URL.
     *
     * @param url Broker URL
     * @return settings with default prefetch, reconnect policy and no extra exchanges
     */
    public static ConnectionSettings defaults(String url) {
        return new ConnectionSettings(url, ConsumeOptions.DEFAULT_PREFETCH,
            DEFAULT_MAX_RECONNECT_ATTEMPTS, DEFAULT_RECONNECT_DELAY_MS, DEFAULT_ERROR_THRESHOLD,
            BrokerNames.DEFAULT_DEAD_LETTER_EXCHANGE, List.of());
    }
}
