package com.example.ordersync.application.port.out;

import com.example.ordersync.domain.model.Order;

import java.util.Objects;

/**
 * Outcome of a conditional write against the order store.
 *
 * @param order   the aggregate as stored after the write attempt
 * @param applied true if this write took effect, false if its precondition failed
 */
public record ConditionalWriteResult(Order order, boolean applied) {

    public ConditionalWriteResult {
        Objects.requireNonNull(order, "Order cannot be null");
    }

    public static ConditionalWriteResult applied(Order order) {
        return new ConditionalWriteResult(order, true);
    }

    public static ConditionalWriteResult conflicted(Order existing) {
        return new ConditionalWriteResult(existing, false);
    }
}
