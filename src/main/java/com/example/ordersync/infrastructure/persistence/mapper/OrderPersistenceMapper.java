package com.example.ordersync.infrastructure.persistence.mapper;

import com.example.ordersync.application.dto.RecordedOrderEvent;
import com.example.ordersync.domain.model.Order;
import com.example.ordersync.domain.model.OrderId;
import com.example.ordersync.domain.model.OrderStatus;
import com.example.ordersync.infrastructure.persistence.entity.OrderEntity;
import com.example.ordersync.infrastructure.persistence.entity.OrderEventEntity;
import com.example.ordersync.infrastructure.persistence.entity.OrderStatusEnum;
import org.springframework.stereotype.Component;

/**
 * Mapper between domain Order and persistence entities.
 */
@Component
public class OrderPersistenceMapper {

    /**
     * Maps a new order to an entity that will be inserted, never merged.
     */
    public OrderEntity toNewEntity(Order order) {
        OrderEntity entity = new OrderEntity();
        entity.setId(order.getOrderId().getValue());
        entity.setStatus(toStatusEnum(order.getStatus()));
        entity.setSku(order.getSku());
        entity.setUnits(order.getUnits());
        entity.setPrice(order.getPrice());
        entity.setUserId(order.getUserId());
        entity.setCreatedAt(order.getCreatedAt());
        entity.setUpdatedAt(order.getUpdatedAt());
        entity.markNew();
        return entity;
    }

    public Order toDomain(OrderEntity entity) {
        return Order.reconstitute(
                OrderId.of(entity.getId()),
                toDomainStatus(entity.getStatus()),
                entity.getSku(),
                entity.getUnits(),
                entity.getPrice(),
                entity.getUserId(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    public RecordedOrderEvent toRecordedEvent(OrderEventEntity entity) {
        return new RecordedOrderEvent(
                entity.getEventName(),
                entity.getAggregateId(),
                entity.getPayload(),
                entity.getOccurredAt()
        );
    }

    public OrderStatusEnum toStatusEnum(OrderStatus status) {
        return switch (status) {
            case CREATED -> OrderStatusEnum.CREATED;
            case STOCK_DEPLETED -> OrderStatusEnum.STOCK_DEPLETED;
            case STOCK_ALLOCATED -> OrderStatusEnum.STOCK_ALLOCATED;
            case PAYMENT_REJECTED -> OrderStatusEnum.PAYMENT_REJECTED;
            case PAYMENT_ACCEPTED -> OrderStatusEnum.PAYMENT_ACCEPTED;
            case SHIPPED -> OrderStatusEnum.SHIPPED;
            case DELIVERED -> OrderStatusEnum.DELIVERED;
            case CANCELED -> OrderStatusEnum.CANCELED;
        };
    }

    public OrderStatus toDomainStatus(OrderStatusEnum status) {
        return switch (status) {
            case CREATED -> OrderStatus.CREATED;
            case STOCK_DEPLETED -> OrderStatus.STOCK_DEPLETED;
            case STOCK_ALLOCATED -> OrderStatus.STOCK_ALLOCATED;
            case PAYMENT_REJECTED -> OrderStatus.PAYMENT_REJECTED;
            case PAYMENT_ACCEPTED -> OrderStatus.PAYMENT_ACCEPTED;
            case SHIPPED -> OrderStatus.SHIPPED;
            case DELIVERED -> OrderStatus.DELIVERED;
            case CANCELED -> OrderStatus.CANCELED;
        };
    }
}
