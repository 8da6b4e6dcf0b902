package com.example.ordersync.domain.exception;

import com.example.ordersync.domain.model.OrderEventName;
import com.example.ordersync.domain.model.OrderStatus;
import com.example.ordersync.domain.policy.TransitionRejection;

/**
 * Thrown when the transition policy rejects an event for the current order status.
 * Retryability follows the rejection kind.
 */
public class OrderStatusTransitionException extends DomainException {

    private final TransitionRejection rejection;
    private final OrderStatus currentStatus;
    private final OrderEventName eventName;

    public OrderStatusTransitionException(TransitionRejection rejection,
                                          OrderStatus currentStatus,
                                          OrderEventName eventName) {
        super(String.format("%s transition: %s cannot be applied to an order in status %s",
                rejection, eventName.getWireName(), currentStatus.getWireName()), rejection.isRetryable());
        this.rejection = rejection;
        this.currentStatus = currentStatus;
        this.eventName = eventName;
    }

    public TransitionRejection getRejection() {
        return rejection;
    }

    public OrderStatus getCurrentStatus() {
        return currentStatus;
    }

    public OrderEventName getEventName() {
        return eventName;
    }

    @Override
    public String getErrorCode() {
        return rejection.name() + "_TRANSITION";
    }
}
