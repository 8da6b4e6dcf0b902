package com.example.ordersync.application.port.out;

/**
 * Outcome of appending an event to the event store.
 */
public enum AppendResult {

    /** The event was recorded by this call. */
    APPENDED,

    /** The (order, event name) pair was already recorded. */
    DUPLICATE
}
