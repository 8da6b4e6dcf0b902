package com.example.ordersync.infrastructure.adapter.in.web.mapper;

import com.example.ordersync.application.dto.BatchSyncReport;
import com.example.ordersync.application.dto.OrderSyncMessage;
import com.example.ordersync.application.dto.RecordedOrderEvent;
import com.example.ordersync.domain.model.Order;
import com.example.ordersync.infrastructure.adapter.in.web.dto.BatchSyncRequest;
import com.example.ordersync.infrastructure.adapter.in.web.dto.BatchSyncResponse;
import com.example.ordersync.infrastructure.adapter.in.web.dto.OrderEventResponse;
import com.example.ordersync.infrastructure.adapter.in.web.dto.OrderResponse;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between web DTOs and application DTOs.
 */
@Component
public class OrderSyncWebMapper {

    public List<OrderSyncMessage> toMessages(BatchSyncRequest request) {
        return request.messages().stream()
                .map(message -> new OrderSyncMessage(message.messageId(), message.body()))
                .toList();
    }

    public BatchSyncResponse toBatchResponse(BatchSyncReport report) {
        return new BatchSyncResponse(report.batchItemFailures().stream()
                .map(failure -> new BatchSyncResponse.ItemFailure(failure.itemIdentifier()))
                .toList());
    }

    public OrderResponse toOrderResponse(Order order) {
        return new OrderResponse(
                order.getOrderId().getValue(),
                order.getStatus().getWireName(),
                order.getSku(),
                order.getUnits(),
                order.getPrice(),
                order.getUserId(),
                order.getCreatedAt(),
                order.getUpdatedAt()
        );
    }

    public OrderEventResponse toEventResponse(RecordedOrderEvent event) {
        return new OrderEventResponse(event.eventName(), event.occurredAt(), event.payload());
    }
}
