package com.example.ordersync.application.port.out;

import com.example.ordersync.application.dto.RecordedOrderEvent;
import com.example.ordersync.domain.model.OrderEventName;

import java.time.Instant;
import java.util.List;

/**
 * Outbound port for the append-only order event store.
 * Each (order id, event name) pair is recorded at most once.
 */
public interface EventStorePort {

    /**
     * Records an event for an order.
     *
     * @param eventName  the event type
     * @param orderId    the order the event belongs to
     * @param payload    the event body, serialized by the store
     * @param occurredAt when the event was raised
     * @return {@link AppendResult#DUPLICATE} if the pair was already recorded
     */
    AppendResult append(OrderEventName eventName, String orderId, Object payload, Instant occurredAt);

    /**
     * Returns the events recorded for an order, oldest first.
     */
    List<RecordedOrderEvent> findByOrderId(String orderId);
}
