package com.ivamare.eventbus.connection;

import com.ivamare.eventbus.broker.BrokerSession;

/**
 * Callback for components that hold broker-side state (such as active
 * consumers) which must be re-established after a reconnection.
 */
@FunctionalInterface
public interface SessionListener {

    /**
     * Called after a lost session has been replaced by a new one. Not called
     * for the first connection.
     *
     * @param session the new live session
     */
    void onSessionRestored(BrokerSession session);
}
