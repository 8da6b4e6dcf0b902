package com.example.ordersync.application.port.in;

import com.example.ordersync.application.dto.RecordedOrderEvent;
import com.example.ordersync.domain.model.Order;

import java.util.List;

/**
 * Inbound port for reading orders and their event history.
 */
public interface QueryOrderUseCase {

    /**
     * @throws com.example.ordersync.domain.exception.OrderNotFoundException if the order is not stored
     */
    Order getOrder(String orderId);

    /**
     * @throws com.example.ordersync.domain.exception.OrderNotFoundException if the order is not stored
     */
    List<RecordedOrderEvent> getEventHistory(String orderId);
}
