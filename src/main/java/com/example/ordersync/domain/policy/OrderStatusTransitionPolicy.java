package com.example.ordersync.domain.policy;

import com.example.ordersync.domain.exception.OrderStatusTransitionException;
import com.example.ordersync.domain.model.OrderEventName;
import com.example.ordersync.domain.model.OrderStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.example.ordersync.domain.model.OrderEventName.*;
import static com.example.ordersync.domain.policy.TransitionRejection.*;

/**
 * Lookup table deciding how each event affects an order in each status.
 *
 * <p>The table is checked for totality when the policy is built: every
 * (status, event) pair must have an outcome, otherwise construction fails.
 *
 * <p>Conventions used in the table:
 * <ul>
 *   <li>STALE: the event is consistent with the order's past, it just arrives late.</li>
 *   <li>FORBIDDEN: the event contradicts the recorded history or a branch the order did not take.</li>
 *   <li>NOT_READY: the event skips a prerequisite that may still arrive.</li>
 * </ul>
 * CANCELED is the only terminal status; a delivered order can still be canceled.
 */
public class OrderStatusTransitionPolicy {

    private final Map<OrderStatus, Map<OrderEventName, TransitionOutcome>> table;

    public OrderStatusTransitionPolicy() {
        this(defaultTable());
    }

    /**
     * Builds a policy from the given table.
     *
     * @throws IllegalStateException if any (status, event) pair has no outcome
     */
    public OrderStatusTransitionPolicy(Map<OrderStatus, Map<OrderEventName, TransitionOutcome>> table) {
        verifyTotal(table);
        this.table = copyOf(table);
    }

    /**
     * Looks up the outcome of applying an event to an order in the given status.
     */
    public TransitionOutcome evaluate(OrderStatus currentStatus, OrderEventName eventName) {
        return table.get(currentStatus).get(eventName);
    }

    /**
     * Returns the status the order moves to.
     *
     * @throws OrderStatusTransitionException if the policy rejects the event
     */
    public OrderStatus nextStatus(OrderStatus currentStatus, OrderEventName eventName) {
        TransitionOutcome outcome = evaluate(currentStatus, eventName);
        if (!outcome.isAllowed()) {
            throw new OrderStatusTransitionException(outcome.getRejection(), currentStatus, eventName);
        }
        return outcome.getNextStatus();
    }

    private static Map<OrderStatus, Map<OrderEventName, TransitionOutcome>> defaultTable() {
        Map<OrderStatus, Map<OrderEventName, TransitionOutcome>> table = new EnumMap<>(OrderStatus.class);

        table.put(OrderStatus.CREATED, row()
                .reject(STALE, PLACED)
                .reject(REDUNDANT, CREATED)
                .allow(STOCK_DEPLETED, OrderStatus.STOCK_DEPLETED)
                .allow(STOCK_ALLOCATED, OrderStatus.STOCK_ALLOCATED)
                .reject(NOT_READY, PAYMENT_REJECTED, PAYMENT_ACCEPTED, SHIPPED, DELIVERED)
                .allow(CANCELED, OrderStatus.CANCELED)
                .build());

        table.put(OrderStatus.STOCK_DEPLETED, row()
                .reject(STALE, PLACED, CREATED)
                .reject(REDUNDANT, STOCK_DEPLETED)
                .reject(FORBIDDEN, STOCK_ALLOCATED, PAYMENT_REJECTED, PAYMENT_ACCEPTED, SHIPPED, DELIVERED)
                .allow(CANCELED, OrderStatus.CANCELED)
                .build());

        table.put(OrderStatus.STOCK_ALLOCATED, row()
                .reject(STALE, PLACED, CREATED)
                .reject(FORBIDDEN, STOCK_DEPLETED)
                .reject(REDUNDANT, STOCK_ALLOCATED)
                .allow(PAYMENT_REJECTED, OrderStatus.PAYMENT_REJECTED)
                .allow(PAYMENT_ACCEPTED, OrderStatus.PAYMENT_ACCEPTED)
                .reject(NOT_READY, SHIPPED, DELIVERED)
                .allow(CANCELED, OrderStatus.CANCELED)
                .build());

        table.put(OrderStatus.PAYMENT_REJECTED, row()
                .reject(STALE, PLACED, CREATED, STOCK_ALLOCATED)
                .reject(FORBIDDEN, STOCK_DEPLETED)
                .reject(REDUNDANT, PAYMENT_REJECTED)
                .reject(FORBIDDEN, PAYMENT_ACCEPTED, SHIPPED, DELIVERED)
                .allow(CANCELED, OrderStatus.CANCELED)
                .build());

        table.put(OrderStatus.PAYMENT_ACCEPTED, row()
                .reject(STALE, PLACED, CREATED, STOCK_ALLOCATED)
                .reject(FORBIDDEN, STOCK_DEPLETED, PAYMENT_REJECTED)
                .reject(REDUNDANT, PAYMENT_ACCEPTED)
                .allow(SHIPPED, OrderStatus.SHIPPED)
                .reject(NOT_READY, DELIVERED)
                .allow(CANCELED, OrderStatus.CANCELED)
                .build());

        table.put(OrderStatus.SHIPPED, row()
                .reject(STALE, PLACED, CREATED, STOCK_ALLOCATED, PAYMENT_ACCEPTED)
                .reject(FORBIDDEN, STOCK_DEPLETED, PAYMENT_REJECTED)
                .reject(REDUNDANT, SHIPPED)
                .allow(DELIVERED, OrderStatus.DELIVERED)
                .allow(CANCELED, OrderStatus.CANCELED)
                .build());

        table.put(OrderStatus.DELIVERED, row()
                .reject(STALE, PLACED, CREATED, STOCK_ALLOCATED, PAYMENT_ACCEPTED, SHIPPED)
                .reject(FORBIDDEN, STOCK_DEPLETED, PAYMENT_REJECTED)
                .reject(REDUNDANT, DELIVERED)
                .allow(CANCELED, OrderStatus.CANCELED)
                .build());

        table.put(OrderStatus.CANCELED, row()
                .reject(STALE, PLACED, CREATED, STOCK_DEPLETED, STOCK_ALLOCATED,
                        PAYMENT_REJECTED, PAYMENT_ACCEPTED, SHIPPED, DELIVERED)
                .reject(REDUNDANT, CANCELED)
                .build());

        return table;
    }

    private static void verifyTotal(Map<OrderStatus, Map<OrderEventName, TransitionOutcome>> table) {
        List<String> missing = new ArrayList<>();
        for (OrderStatus status : OrderStatus.values()) {
            Map<OrderEventName, TransitionOutcome> row = table.get(status);
            for (OrderEventName eventName : OrderEventName.values()) {
                if (row == null || row.get(eventName) == null) {
                    missing.add(status + "/" + eventName);
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Transition table is incomplete, missing: " + missing);
        }
    }

    private static Map<OrderStatus, Map<OrderEventName, TransitionOutcome>> copyOf(
            Map<OrderStatus, Map<OrderEventName, TransitionOutcome>> table) {
        Map<OrderStatus, Map<OrderEventName, TransitionOutcome>> copy = new EnumMap<>(OrderStatus.class);
        table.forEach((status, row) -> copy.put(status, new EnumMap<>(row)));
        return copy;
    }

    private static RowBuilder row() {
        return new RowBuilder();
    }

    private static final class RowBuilder {

        private final Map<OrderEventName, TransitionOutcome> cells = new EnumMap<>(OrderEventName.class);

        RowBuilder allow(OrderEventName eventName, OrderStatus nextStatus) {
            return put(eventName, TransitionOutcome.allowed(nextStatus));
        }

        RowBuilder reject(TransitionRejection rejection, OrderEventName... eventNames) {
            for (OrderEventName eventName : eventNames) {
                put(eventName, TransitionOutcome.rejected(rejection));
            }
            return this;
        }

        private RowBuilder put(OrderEventName eventName, TransitionOutcome outcome) {
            if (cells.putIfAbsent(eventName, outcome) != null) {
                throw new IllegalStateException("Duplicate transition cell for " + eventName);
            }
            return this;
        }

        Map<OrderEventName, TransitionOutcome> build() {
            return cells;
        }
    }
}
