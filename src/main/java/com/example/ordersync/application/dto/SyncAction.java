package com.example.ordersync.application.dto;

/**
 * What the synchronization engine did for an event.
 */
public enum SyncAction {
    CREATED,
    CREATED_EVENT_REEMITTED,
    STATUS_UPDATED
}
