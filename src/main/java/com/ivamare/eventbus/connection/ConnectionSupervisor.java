package com.ivamare.eventbus.connection;

import com.ivamare.eventbus.broker.BrokerSession;
import com.ivamare.eventbus.model.ExchangeDescriptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the single live broker session and keeps it alive.
 *
 * <p>At most one connection attempt is in flight at any time; every caller
 * that needs a session while one is being established waits on that same
 * attempt. Each fresh connection re-declares the exchange topology.
 */
public interface ConnectionSupervisor {

    /**
     * Get the live session, connecting first if needed.
     *
     * <p>Completes exceptionally with {@link com.ivamare.eventbus.exception.ConnectionException}
     * once the reconnect attempts are exhausted or the failure is permanent.
     *
     * @return future completing with a live session
     */
    CompletableFuture<BrokerSession> acquireSession();

    /**
     * Gracefully close the current session. Close errors are logged, not
     * raised. A later {@link #acquireSession()} starts a fresh connection.
     *
     * @return future completing when the session is closed
     */
    CompletableFuture<Void> close();

    /**
     * Check liveness without blocking.
     *
     * @return true if a session exists and is open
     */
    boolean isConnected();

    /**
     * Exchanges declared on every fresh connection, in declaration order.
     *
     * @return declared exchanges
     */
    List<ExchangeDescriptor> getDeclaredExchanges();

    /**
     * Register a listener notified after each reconnection.
     *
     * @param listener the listener
     */
    void addSessionListener(SessionListener listener);
}
