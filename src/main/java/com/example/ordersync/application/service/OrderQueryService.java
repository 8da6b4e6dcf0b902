package com.example.ordersync.application.service;

import com.example.ordersync.application.dto.RecordedOrderEvent;
import com.example.ordersync.application.port.in.QueryOrderUseCase;
import com.example.ordersync.application.port.out.EventStorePort;
import com.example.ordersync.application.port.out.OrderStorePort;
import com.example.ordersync.domain.exception.OrderNotFoundException;
import com.example.ordersync.domain.model.Order;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only access to stored orders and their recorded events.
 */
@Service
public class OrderQueryService implements QueryOrderUseCase {

    private final OrderStorePort orderStore;
    private final EventStorePort eventStore;

    public OrderQueryService(OrderStorePort orderStore, EventStorePort eventStore) {
        this.orderStore = orderStore;
        this.eventStore = eventStore;
    }

    @Override
    public Order getOrder(String orderId) {
        return orderStore.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Override
    public List<RecordedOrderEvent> getEventHistory(String orderId) {
        getOrder(orderId);
        return eventStore.findByOrderId(orderId);
    }
}
