package com.example.ordersync.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Domain events that drive the order lifecycle.
 * {@link #PLACED} is the only event that originates an aggregate.
 */
public enum OrderEventName {
    PLACED("ORDER_PLACED_EVENT"),
    CREATED("ORDER_CREATED_EVENT"),
    STOCK_DEPLETED("ORDER_STOCK_DEPLETED_EVENT"),
    STOCK_ALLOCATED("ORDER_STOCK_ALLOCATED_EVENT"),
    PAYMENT_REJECTED("ORDER_PAYMENT_REJECTED_EVENT"),
    PAYMENT_ACCEPTED("ORDER_PAYMENT_ACCEPTED_EVENT"),
    SHIPPED("ORDER_SHIPPED_EVENT"),
    DELIVERED("ORDER_DELIVERED_EVENT"),
    CANCELED("ORDER_CANCELED_EVENT");

    private final String wireName;

    OrderEventName(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves an event from the name it carries on the wire.
     *
     * @param wireName the wire name, e.g. {@code ORDER_PLACED_EVENT}
     * @return the matching event, or empty if the name is unknown
     */
    public static Optional<OrderEventName> findByWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(name -> name.wireName.equals(wireName))
                .findFirst();
    }
}
