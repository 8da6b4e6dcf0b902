package com.example.ordersync.integration;

import com.example.ordersync.application.port.out.AppendResult;
import com.example.ordersync.application.port.out.ConditionalWriteResult;
import com.example.ordersync.application.port.out.EventStorePort;
import com.example.ordersync.application.port.out.OrderStorePort;
import com.example.ordersync.application.dto.RecordedOrderEvent;
import com.example.ordersync.domain.exception.InvalidOrderEventException;
import com.example.ordersync.domain.model.IncomingOrderEvent;
import com.example.ordersync.domain.model.Order;
import com.example.ordersync.domain.model.OrderCreatedEvent;
import com.example.ordersync.domain.model.OrderEventName;
import com.example.ordersync.domain.model.OrderStatus;
import com.example.ordersync.infrastructure.exception.StoreUnavailableException;
import com.example.ordersync.support.IntegrationTestSupport;
import com.example.ordersync.support.OrderEvents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the JPA-backed order and event stores.
 */
@DisplayName("Persistence Adapter Integration Tests")
class PersistenceAdapterIntegrationTest extends IntegrationTestSupport {

    private static final Instant NOW = Instant.parse("2026-02-02T12:00:05Z");

    @Autowired
    private OrderStorePort orderStore;

    @Autowired
    private EventStorePort eventStore;

    @Nested
    @DisplayName("Order Store")
    class OrderStore {

        @Test
        @DisplayName("should create order once and return stored order on conflict")
        void should_create_order_once_and_return_stored_order_on_conflict() {
            // Given
            Order first = Order.place(OrderEvents.placed("order-1"), NOW);
            Order second = Order.place(OrderEvents.placed("order-1"), NOW.plusSeconds(10));

            // When
            ConditionalWriteResult created = orderStore.createIfAbsent(first);
            ConditionalWriteResult conflicted = orderStore.createIfAbsent(second);

            // Then
            assertThat(created.applied()).isTrue();
            assertThat(conflicted.applied()).isFalse();
            assertThat(conflicted.order().getCreatedAt()).isEqualTo(NOW);
            assertThat(orderRepository.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should update status only when it differs")
        void should_update_status_only_when_it_differs() {
            // Given
            orderStore.createIfAbsent(Order.place(OrderEvents.placed("order-1"), NOW));
            Instant later = NOW.plusSeconds(60);

            // When
            ConditionalWriteResult updated = orderStore.updateStatus("order-1", OrderStatus.STOCK_ALLOCATED, later);
            ConditionalWriteResult repeated = orderStore.updateStatus("order-1", OrderStatus.STOCK_ALLOCATED,
                    later.plusSeconds(60));

            // Then
            assertThat(updated.applied()).isTrue();
            assertThat(updated.order().getStatus()).isEqualTo(OrderStatus.STOCK_ALLOCATED);
            assertThat(updated.order().getUpdatedAt()).isEqualTo(later);
            assertThat(repeated.applied()).isFalse();
            assertThat(repeated.order().getUpdatedAt()).isEqualTo(later);
        }

        @Test
        @DisplayName("should read back every order attribute")
        void should_read_back_every_order_attribute() {
            // Given
            orderStore.createIfAbsent(Order.place(OrderEvents.placed("order-1"), NOW));

            // When
            Order stored = orderStore.findById("order-1").orElseThrow();

            // Then
            assertThat(stored.getStatus()).isEqualTo(OrderStatus.CREATED);
            assertThat(stored.getSku()).isEqualTo("SKU001");
            assertThat(stored.getUnits()).isEqualTo(2);
            assertThat(stored.getPrice()).isEqualByComparingTo("10.50");
            assertThat(stored.getUserId()).isEqualTo("user-1");
            assertThat(orderStore.findById("missing")).isEmpty();
        }

        @Test
        @DisplayName("should fail status update of missing order as retryable")
        void should_fail_status_update_of_missing_order_as_retryable() {
            assertThatThrownBy(() -> orderStore.updateStatus("missing", OrderStatus.SHIPPED, NOW))
                    .isInstanceOf(StoreUnavailableException.class)
                    .satisfies(e -> assertThat(((StoreUnavailableException) e).getStoreName())
                            .isEqualTo("order-store"));
        }

        @Test
        @DisplayName("should reject order exceeding column limits as non-retryable")
        void should_reject_order_exceeding_column_limits_as_non_retryable() {
            // Given
            Order longSku = placedWith("order-1", "S".repeat(100), new BigDecimal("10.50"));
            Order hugePrice = placedWith("order-2", "SKU001", new BigDecimal("100000000000000000000"));

            // When & Then
            assertThatThrownBy(() -> orderStore.createIfAbsent(longSku))
                    .isInstanceOf(InvalidOrderEventException.class)
                    .satisfies(e -> assertThat(((InvalidOrderEventException) e).isTransient()).isFalse());
            assertThatThrownBy(() -> orderStore.createIfAbsent(hugePrice))
                    .isInstanceOf(InvalidOrderEventException.class)
                    .satisfies(e -> assertThat(((InvalidOrderEventException) e).isTransient()).isFalse());
            assertThat(orderRepository.count()).isZero();

            // A valid order is still stored afterwards
            assertThat(orderStore.createIfAbsent(Order.place(OrderEvents.placed("order-3"), NOW)).applied()).isTrue();
        }

        private Order placedWith(String orderId, String sku, BigDecimal price) {
            IncomingOrderEvent event = new IncomingOrderEvent(
                    OrderEventName.PLACED,
                    new IncomingOrderEvent.EventData(orderId, sku, 2, price, "user-1"),
                    OrderEvents.EVENT_TIME,
                    OrderEvents.EVENT_TIME);
            return Order.place(event, NOW);
        }
    }

    @Nested
    @DisplayName("Event Store")
    class EventStore {

        @Test
        @DisplayName("should append event once per order and event name")
        void should_append_event_once_per_order_and_event_name() {
            // Given
            Order order = Order.place(OrderEvents.placed("order-1"), NOW);
            OrderCreatedEvent payload = OrderCreatedEvent.of(order, NOW);

            // When
            AppendResult first = eventStore.append(OrderEventName.CREATED, "order-1", payload, NOW);
            AppendResult second = eventStore.append(OrderEventName.CREATED, "order-1", payload, NOW.plusSeconds(1));
            AppendResult otherOrder = eventStore.append(OrderEventName.CREATED, "order-2", payload, NOW);

            // Then
            assertThat(first).isEqualTo(AppendResult.APPENDED);
            assertThat(second).isEqualTo(AppendResult.DUPLICATE);
            assertThat(otherOrder).isEqualTo(AppendResult.APPENDED);
            assertThat(eventRepository.count()).isEqualTo(2);
        }

        @Test
        @DisplayName("should return recorded events with serialized payload")
        void should_return_recorded_events_with_serialized_payload() {
            // Given
            Order order = Order.place(OrderEvents.placed("order-1"), NOW);
            eventStore.append(OrderEventName.CREATED, "order-1", OrderCreatedEvent.of(order, NOW), NOW);

            // When
            List<RecordedOrderEvent> events = eventStore.findByOrderId("order-1");

            // Then
            assertThat(events).singleElement().satisfies(event -> {
                assertThat(event.eventName()).isEqualTo("ORDER_CREATED_EVENT");
                assertThat(event.orderId()).isEqualTo("order-1");
                assertThat(event.occurredAt()).isEqualTo(NOW);
                assertThat(event.payload())
                        .contains("\"eventName\":\"ORDER_CREATED_EVENT\"")
                        .contains("\"orderStatus\":\"ORDER_CREATED_STATUS\"");
            });
            assertThat(eventStore.findByOrderId("order-2")).isEmpty();
        }
    }
}
