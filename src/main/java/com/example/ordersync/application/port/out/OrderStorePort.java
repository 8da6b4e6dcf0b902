package com.example.ordersync.application.port.out;

import com.example.ordersync.domain.model.Order;
import com.example.ordersync.domain.model.OrderStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Outbound port for the current-state order store.
 * Writes are conditional; a failed precondition returns the stored aggregate instead of an error.
 */
public interface OrderStorePort {

    /**
     * Reads an order by id.
     *
     * @param orderId the order id
     * @return the stored order, or empty if it does not exist
     */
    Optional<Order> findById(String orderId);

    /**
     * Stores the order unless an order with the same id exists.
     *
     * @param order the new order
     * @return applied with the given order, or conflicted with the order already stored
     */
    ConditionalWriteResult createIfAbsent(Order order);

    /**
     * Moves the order to the given status unless it already has that status.
     *
     * @param orderId   the order id
     * @param newStatus the status to set
     * @param updatedAt the update timestamp
     * @return applied or conflicted, both with the order as stored afterwards
     */
    ConditionalWriteResult updateStatus(String orderId, OrderStatus newStatus, Instant updatedAt);
}
