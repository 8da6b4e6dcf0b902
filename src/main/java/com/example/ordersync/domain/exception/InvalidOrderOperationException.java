package com.example.ordersync.domain.exception;

import com.example.ordersync.domain.model.OrderEventName;

/**
 * Thrown when a lifecycle event references an order that was never placed.
 */
public class InvalidOrderOperationException extends DomainException {

    private final String orderId;
    private final OrderEventName eventName;

    public InvalidOrderOperationException(String orderId, OrderEventName eventName) {
        super(String.format("Cannot apply %s to order %s: order does not exist",
                eventName.getWireName(), orderId), false);
        this.orderId = orderId;
        this.eventName = eventName;
    }

    public String getOrderId() {
        return orderId;
    }

    public OrderEventName getEventName() {
        return eventName;
    }

    @Override
    public String getErrorCode() {
        return "INVALID_OPERATION";
    }
}
