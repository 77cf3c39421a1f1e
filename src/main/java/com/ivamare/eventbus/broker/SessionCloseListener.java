package com.ivamare.eventbus.broker;

/**
 * Notified when a session closes asynchronously, i.e. not because the
 * application closed it. Fires at most once per session.
 */
@FunctionalInterface
public interface SessionCloseListener {

    /**
     * @param cause Reason reported by the broker client (nullable)
     */
    void onClose(Throwable cause);
}
