package com.example.ordersync.application.service;

import com.example.ordersync.application.dto.SyncAction;
import com.example.ordersync.application.dto.SyncResult;
import com.example.ordersync.application.port.in.SyncOrderUseCase;
import com.example.ordersync.application.port.out.AppendResult;
import com.example.ordersync.application.port.out.ConditionalWriteResult;
import com.example.ordersync.application.port.out.EventStorePort;
import com.example.ordersync.application.port.out.OrderStorePort;
import com.example.ordersync.application.port.out.SyncMetricsPort;
import com.example.ordersync.domain.exception.DomainException;
import com.example.ordersync.domain.exception.InvalidOrderEventException;
import com.example.ordersync.domain.exception.InvalidOrderOperationException;
import com.example.ordersync.domain.exception.UnrecognizedOrderSyncException;
import com.example.ordersync.domain.model.IncomingOrderEvent;
import com.example.ordersync.domain.model.Order;
import com.example.ordersync.domain.model.OrderCreatedEvent;
import com.example.ordersync.domain.model.OrderEventName;
import com.example.ordersync.domain.model.OrderStatus;
import com.example.ordersync.domain.policy.OrderStatusTransitionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Synchronization engine: applies one incoming lifecycle event to its order aggregate.
 *
 * <ul>
 *   <li>PLACED, order absent: create the order, then record ORDER_CREATED_EVENT.</li>
 *   <li>PLACED, order present: record ORDER_CREATED_EVENT again from the stored order.</li>
 *   <li>Other event, order present: move the order to the status given by the transition policy.</li>
 *   <li>Other event, order absent: rejected as an invalid operation.</li>
 * </ul>
 *
 * Store conflicts and duplicate events count as success. Nothing is retried here;
 * failures carry their retryability back to the caller.
 */
@Service
public class OrderSyncService implements SyncOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderSyncService.class);

    private final OrderStorePort orderStore;
    private final EventStorePort eventStore;
    private final OrderStatusTransitionPolicy transitionPolicy;
    private final SyncMetricsPort metrics;
    private final Clock clock;

    public OrderSyncService(
            OrderStorePort orderStore,
            EventStorePort eventStore,
            OrderStatusTransitionPolicy transitionPolicy,
            SyncMetricsPort metrics,
            Clock clock) {
        this.orderStore = orderStore;
        this.eventStore = eventStore;
        this.transitionPolicy = transitionPolicy;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public SyncResult syncOrder(IncomingOrderEvent event) {
        validate(event);
        String orderId = event.eventData().orderId();
        log.debug("[SYNC] start orderId={}, event={}", orderId, event.eventName().getWireName());

        SyncResult result;
        try {
            Optional<Order> existing = orderStore.findById(orderId);
            if (event.isPlacedEvent()) {
                result = existing.isPresent()
                        ? reemitCreatedEvent(existing.get())
                        : createOrder(event);
            } else {
                Order current = existing.orElseThrow(
                        () -> new InvalidOrderOperationException(orderId, event.eventName()));
                result = applyTransition(current, event.eventName());
            }
        } catch (DomainException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[SYNC_ERROR] orderId={}, event={}, error={}",
                    orderId, event.eventName().getWireName(), e.getMessage());
            throw new UnrecognizedOrderSyncException(
                    "Unexpected failure syncing order " + orderId + ": " + e.getMessage(), e);
        }

        metrics.syncCompleted(result.action());
        log.info("[SYNC] orderId={}, event={}, action={}, status={}",
                orderId, event.eventName().getWireName(), result.action(), result.status());
        return result;
    }

    private void validate(IncomingOrderEvent event) {
        if (event == null) {
            throw new InvalidOrderEventException("Order event is required");
        }
        if (event.eventName() == null) {
            throw new InvalidOrderEventException("Order event name is required");
        }
        if (event.eventData() == null) {
            throw new InvalidOrderEventException("Order event data is required");
        }
        String orderId = event.eventData().orderId();
        if (orderId == null || orderId.isBlank()) {
            throw new InvalidOrderEventException("Order event has no orderId");
        }
    }

    private SyncResult createOrder(IncomingOrderEvent event) {
        Instant now = clock.instant();
        Order order = Order.place(event, now);

        ConditionalWriteResult written = orderStore.createIfAbsent(order);
        if (!written.applied()) {
            log.info("[SYNC] orderId={} was created concurrently, using stored order", order.getOrderId());
        }

        Order stored = written.order();
        raiseCreatedEvent(stored, now);
        return new SyncResult(stored.getOrderId().getValue(), SyncAction.CREATED, stored.getStatus());
    }

    private SyncResult reemitCreatedEvent(Order existing) {
        log.info("[SYNC] orderId={} already exists, re-raising {}",
                existing.getOrderId(), OrderEventName.CREATED.getWireName());
        raiseCreatedEvent(existing, clock.instant());
        return new SyncResult(existing.getOrderId().getValue(), SyncAction.CREATED_EVENT_REEMITTED,
                existing.getStatus());
    }

    private void raiseCreatedEvent(Order order, Instant now) {
        OrderCreatedEvent createdEvent = OrderCreatedEvent.of(order, now);
        AppendResult appended = eventStore.append(
                OrderEventName.CREATED, order.getOrderId().getValue(), createdEvent, now);
        if (appended == AppendResult.DUPLICATE) {
            log.info("[SYNC] {} already recorded for orderId={}",
                    OrderEventName.CREATED.getWireName(), order.getOrderId());
        }
    }

    private SyncResult applyTransition(Order current, OrderEventName eventName) {
        OrderStatus nextStatus = transitionPolicy.nextStatus(current.getStatus(), eventName);

        ConditionalWriteResult written = orderStore.updateStatus(
                current.getOrderId().getValue(), nextStatus, clock.instant());
        if (!written.applied()) {
            log.info("[SYNC] orderId={} already in status {}, update skipped",
                    current.getOrderId(), written.order().getStatus());
        }
        return new SyncResult(current.getOrderId().getValue(), SyncAction.STATUS_UPDATED,
                written.order().getStatus());
    }
}
