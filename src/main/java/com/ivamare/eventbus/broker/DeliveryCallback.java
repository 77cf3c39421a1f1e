package com.ivamare.eventbus.broker;

import com.ivamare.eventbus.model.Delivery;

/**
 * Receives deliveries from a consumer registered on a {@link BrokerSession}.
 */
@FunctionalInterface
public interface DeliveryCallback {

    void onDelivery(Delivery delivery);
}
