package com.example.ordersync.domain.model;

/**
 * Lifecycle status of an order aggregate.
 * Exactly one status holds per aggregate at any time.
 */
public enum OrderStatus {
    CREATED("ORDER_CREATED_STATUS"),
    STOCK_DEPLETED("ORDER_STOCK_DEPLETED_STATUS"),
    STOCK_ALLOCATED("ORDER_STOCK_ALLOCATED_STATUS"),
    PAYMENT_REJECTED("ORDER_PAYMENT_REJECTED_STATUS"),
    PAYMENT_ACCEPTED("ORDER_PAYMENT_ACCEPTED_STATUS"),
    SHIPPED("ORDER_SHIPPED_STATUS"),
    DELIVERED("ORDER_DELIVERED_STATUS"),
    CANCELED("ORDER_CANCELED_STATUS");

    private final String wireName;

    OrderStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the name used for this status in published events.
     */
    public String getWireName() {
        return wireName;
    }
}
