package com.example.ordersync.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A lifecycle event received from the delivery system, already parsed and validated.
 *
 * @param eventName the event type
 * @param eventData the order attributes carried by the event
 * @param createdAt when the event was created upstream
 * @param updatedAt when the event was last updated upstream
 */
public record IncomingOrderEvent(
        OrderEventName eventName,
        EventData eventData,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean isPlacedEvent() {
        return eventName == OrderEventName.PLACED;
    }

    /**
     * Order attributes of an event. Only {@code orderId} is guaranteed for events other than PLACED.
     */
    public record EventData(
            String orderId,
            String sku,
            Integer units,
            BigDecimal price,
            String userId
    ) {
        public static EventData ofOrderId(String orderId) {
            return new EventData(orderId, null, null, null, null);
        }
    }
}
