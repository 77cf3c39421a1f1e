package com.ivamare.eventbus.model;

/**
 * States of the per-message delivery state machine.
 *
 * <pre>
 * RECEIVED -&gt; DISPATCHED -&gt; { ACKED | RETRY_SCHEDULED | DEAD_LETTERED }
 * </pre>
 */
public enum DeliveryState {
    RECEIVED,
    DISPATCHED,
    ACKED,
    RETRY_SCHEDULED,
    DEAD_LETTERED;

    public boolean isTerminal() {
        return this == ACKED || this == RETRY_SCHEDULED || this == DEAD_LETTERED;
    }
}
