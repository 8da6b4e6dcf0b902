package com.example.ordersync.domain.policy;

import com.example.ordersync.domain.model.OrderStatus;

import java.util.Objects;

/**
 * Result of evaluating an event against an order status:
 * either the status to move to, or the reason the event is rejected.
 */
public final class TransitionOutcome {

    private final OrderStatus nextStatus;
    private final TransitionRejection rejection;

    private TransitionOutcome(OrderStatus nextStatus, TransitionRejection rejection) {
        this.nextStatus = nextStatus;
        this.rejection = rejection;
    }

    public static TransitionOutcome allowed(OrderStatus nextStatus) {
        return new TransitionOutcome(Objects.requireNonNull(nextStatus, "NextStatus cannot be null"), null);
    }

    public static TransitionOutcome rejected(TransitionRejection rejection) {
        return new TransitionOutcome(null, Objects.requireNonNull(rejection, "Rejection cannot be null"));
    }

    public boolean isAllowed() {
        return nextStatus != null;
    }

    /**
     * @throws IllegalStateException if the outcome is a rejection
     */
    public OrderStatus getNextStatus() {
        if (nextStatus == null) {
            throw new IllegalStateException("Rejected outcome has no next status: " + rejection);
        }
        return nextStatus;
    }

    /**
     * @throws IllegalStateException if the outcome is allowed
     */
    public TransitionRejection getRejection() {
        if (rejection == null) {
            throw new IllegalStateException("Allowed outcome has no rejection");
        }
        return rejection;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransitionOutcome that = (TransitionOutcome) o;
        return nextStatus == that.nextStatus && rejection == that.rejection;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nextStatus, rejection);
    }

    @Override
    public String toString() {
        return isAllowed() ? "Allowed(" + nextStatus + ")" : "Rejected(" + rejection + ")";
    }
}
