package com.example.ordersync.domain.exception;

/**
 * Thrown by queries for an order that is not stored.
 */
public class OrderNotFoundException extends DomainException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super("Order not found: " + orderId, false);
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }

    @Override
    public String getErrorCode() {
        return "ORDER_NOT_FOUND";
    }
}
