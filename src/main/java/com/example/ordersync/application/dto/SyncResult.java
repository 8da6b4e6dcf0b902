package com.example.ordersync.application.dto;

import com.example.ordersync.domain.model.OrderStatus;

/**
 * Result of synchronizing one event.
 *
 * @param orderId the order the event applied to
 * @param action  what the engine did
 * @param status  the order status as stored afterwards
 */
public record SyncResult(String orderId, SyncAction action, OrderStatus status) {}
