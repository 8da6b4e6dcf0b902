package com.example.ordersync.domain.policy;

/**
 * Reasons an event cannot move an order from its current status.
 */
public enum TransitionRejection {

    /** The event contradicts lifecycle facts already recorded. */
    FORBIDDEN(false),

    /** The status the event leads to has already been reached. */
    REDUNDANT(false),

    /** The event belongs to a lifecycle stage the order has already passed. */
    STALE(false),

    /** The event needs a prerequisite status that has not been reached yet. */
    NOT_READY(true);

    private final boolean retryable;

    TransitionRejection(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
