package com.example.ordersync.infrastructure.persistence.entity;

/**
 * Order status enum for persistence layer.
 */
public enum OrderStatusEnum {
    CREATED,
    STOCK_DEPLETED,
    STOCK_ALLOCATED,
    PAYMENT_REJECTED,
    PAYMENT_ACCEPTED,
    SHIPPED,
    DELIVERED,
    CANCELED
}
