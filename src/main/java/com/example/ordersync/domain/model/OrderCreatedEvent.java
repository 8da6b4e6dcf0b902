package com.example.ordersync.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Downstream event announcing that an order aggregate exists.
 * Built from the stored aggregate so re-emission carries the original attributes.
 */
public record OrderCreatedEvent(
        String eventName,
        Snapshot eventData,
        Instant createdAt,
        Instant updatedAt
) {

    public static OrderCreatedEvent of(Order order, Instant now) {
        Snapshot snapshot = new Snapshot(
                order.getOrderId().getValue(),
                order.getStatus().getWireName(),
                order.getSku(),
                order.getUnits(),
                order.getPrice(),
                order.getUserId(),
                order.getCreatedAt(),
                order.getUpdatedAt());
        return new OrderCreatedEvent(OrderEventName.CREATED.getWireName(), snapshot, now, now);
    }

    public record Snapshot(
            String orderId,
            String orderStatus,
            String sku,
            int units,
            BigDecimal price,
            String userId,
            Instant createdAt,
            Instant updatedAt
    ) {}
}
