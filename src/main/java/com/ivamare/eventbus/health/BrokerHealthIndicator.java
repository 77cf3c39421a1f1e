package com.ivamare.eventbus.health;

import com.ivamare.eventbus.api.EventBus;
import com.ivamare.eventbus.model.ExchangeDescriptor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;

/**
 * Health indicator for Event Bus broker connectivity.
 *
 * <p>Reports:
 * <ul>
 *   <li>Whether the broker session is live</li>
 *   <li>Declared exchanges and active consumers</li>
 *   <li>In-flight deliveries and pending retries</li>
 * </ul>
 */
public class BrokerHealthIndicator implements HealthIndicator {

    private final EventBus eventBus;

    public BrokerHealthIndicator(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public Health health() {
        List<String> exchanges = eventBus.supervisor().getDeclaredExchanges().stream()
            .map(ExchangeDescriptor::name)
            .toList();

        boolean connected = eventBus.isConnected();
        Health.Builder builder = connected ? Health.up() : Health.down();
        if (!connected) {
            builder.withDetail("error", "Broker session not connected");
        }

        return builder
            .withDetail("exchanges", exchanges)
            .withDetail("activeConsumers", eventBus.consumer().getActiveConsumers())
            .withDetail("inFlightDeliveries", eventBus.consumer().inFlightCount())
            .withDetail("pendingRetries", eventBus.consumer().pendingRetryCount())
            .build();
    }
}
