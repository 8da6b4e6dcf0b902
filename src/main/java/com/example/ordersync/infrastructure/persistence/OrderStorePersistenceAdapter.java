package com.example.ordersync.infrastructure.persistence;

import com.example.ordersync.application.port.out.ConditionalWriteResult;
import com.example.ordersync.application.port.out.OrderStorePort;
import com.example.ordersync.domain.exception.InvalidOrderEventException;
import com.example.ordersync.domain.model.Order;
import com.example.ordersync.domain.model.OrderStatus;
import com.example.ordersync.infrastructure.exception.StoreUnavailableException;
import com.example.ordersync.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.ordersync.infrastructure.persistence.repository.OrderJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Order store backed by JPA.
 *
 * <p>Conditional writes map onto the database: creation relies on the primary key,
 * status updates on {@code WHERE status <> :status}. Each call runs in its own
 * transaction so a failed insert can be followed by a fresh read.
 */
@Component
public class OrderStorePersistenceAdapter implements OrderStorePort {

    private static final Logger log = LoggerFactory.getLogger(OrderStorePersistenceAdapter.class);
    private static final String STORE_NAME = "order-store";

    private final OrderJpaRepository orderRepository;
    private final OrderPersistenceMapper mapper;

    public OrderStorePersistenceAdapter(OrderJpaRepository orderRepository, OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.mapper = mapper;
    }

    @Override
    public Optional<Order> findById(String orderId) {
        try {
            return orderRepository.findById(orderId).map(mapper::toDomain);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME, "Failed to read order " + orderId, e);
        }
    }

    @Override
    public ConditionalWriteResult createIfAbsent(Order order) {
        String orderId = order.getOrderId().getValue();
        try {
            orderRepository.saveAndFlush(mapper.toNewEntity(order));
            log.debug("Created order: {}", orderId);
            return ConditionalWriteResult.applied(order);
        } catch (DataIntegrityViolationException e) {
            // No stored row means the order itself broke a column constraint.
            Order existing = findById(orderId).orElseThrow(() -> new InvalidOrderEventException(
                    "Order " + orderId + " was rejected by the order store: " + e.getMostSpecificCause().getMessage(), e));
            log.info("[CONDITION_FAILED] order {} already exists with status {}", orderId, existing.getStatus());
            return ConditionalWriteResult.conflicted(existing);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME, "Failed to create order " + orderId, e);
        }
    }

    @Override
    public ConditionalWriteResult updateStatus(String orderId, OrderStatus newStatus, Instant updatedAt) {
        int updated;
        try {
            updated = orderRepository.updateStatusIfDiffers(orderId, mapper.toStatusEnum(newStatus), updatedAt);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME, "Failed to update order " + orderId, e);
        }

        Order stored = findById(orderId).orElseThrow(() -> new StoreUnavailableException(STORE_NAME,
                "Order " + orderId + " is not stored, status update to " + newStatus + " failed"));
        if (updated == 0) {
            log.info("[CONDITION_FAILED] order {} already has status {}", orderId, stored.getStatus());
            return ConditionalWriteResult.conflicted(stored);
        }
        log.debug("Updated order {} to status {}", orderId, newStatus);
        return ConditionalWriteResult.applied(stored);
    }
}
