package com.example.ordersync.unit.domain;

import com.example.ordersync.domain.exception.InvalidOrderEventException;
import com.example.ordersync.domain.model.*;
import com.example.ordersync.support.OrderEvents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Order aggregate and related domain objects.
 */
@DisplayName("Order Domain Tests")
class OrderTest {

    private static final Instant NOW = Instant.parse("2026-02-02T12:00:05Z");

    @Nested
    @DisplayName("Order Placement")
    class OrderPlacement {

        @Test
        @DisplayName("should_create_order_in_created_status_from_placed_event")
        void should_create_order_in_created_status_from_placed_event() {
            // When
            Order order = Order.place(OrderEvents.placed("order-1"), NOW);

            // Then
            assertThat(order.getOrderId()).isEqualTo(OrderId.of("order-1"));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CREATED);
            assertThat(order.getSku()).isEqualTo("SKU001");
            assertThat(order.getUnits()).isEqualTo(2);
            assertThat(order.getPrice()).isEqualByComparingTo("10.50");
            assertThat(order.getUserId()).isEqualTo("user-1");
            assertThat(order.getCreatedAt()).isEqualTo(NOW);
            assertThat(order.getUpdatedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should_reject_non_placed_event")
        void should_reject_non_placed_event() {
            // Given
            IncomingOrderEvent event = OrderEvents.lifecycle(OrderEventName.SHIPPED, "order-1");

            // When & Then
            assertThatThrownBy(() -> Order.place(event, NOW))
                    .isInstanceOf(InvalidOrderEventException.class)
                    .hasMessageContaining("ORDER_SHIPPED_EVENT");
        }

        @Test
        @DisplayName("should_list_missing_attributes")
        void should_list_missing_attributes() {
            // Given: a placed event carrying only the order id
            IncomingOrderEvent event = new IncomingOrderEvent(OrderEventName.PLACED,
                    IncomingOrderEvent.EventData.ofOrderId("order-1"),
                    OrderEvents.EVENT_TIME, OrderEvents.EVENT_TIME);

            // When & Then
            assertThatThrownBy(() -> Order.place(event, NOW))
                    .isInstanceOf(InvalidOrderEventException.class)
                    .hasMessageContaining("sku, units, price, userId");
        }

        @Test
        @DisplayName("should_reject_non_positive_units")
        void should_reject_non_positive_units() {
            // Given
            IncomingOrderEvent event = new IncomingOrderEvent(OrderEventName.PLACED,
                    new IncomingOrderEvent.EventData("order-1", "SKU001", 0, BigDecimal.TEN, "user-1"),
                    OrderEvents.EVENT_TIME, OrderEvents.EVENT_TIME);

            // When & Then
            assertThatThrownBy(() -> Order.place(event, NOW))
                    .isInstanceOf(InvalidOrderEventException.class)
                    .hasMessageContaining("Units must be positive")
                    .satisfies(e -> assertThat(((InvalidOrderEventException) e).isTransient()).isFalse());
        }

        @Test
        @DisplayName("should_reject_negative_price")
        void should_reject_negative_price() {
            // Given
            IncomingOrderEvent event = new IncomingOrderEvent(OrderEventName.PLACED,
                    new IncomingOrderEvent.EventData("order-1", "SKU001", 1, new BigDecimal("-1"), "user-1"),
                    OrderEvents.EVENT_TIME, OrderEvents.EVENT_TIME);

            // When & Then
            assertThatThrownBy(() -> Order.place(event, NOW))
                    .isInstanceOf(InvalidOrderEventException.class)
                    .hasMessageContaining("Price cannot be negative");
        }

        @Test
        @DisplayName("should_accept_free_order")
        void should_accept_free_order() {
            // Given
            IncomingOrderEvent event = new IncomingOrderEvent(OrderEventName.PLACED,
                    new IncomingOrderEvent.EventData("order-1", "SKU001", 1, BigDecimal.ZERO, "user-1"),
                    OrderEvents.EVENT_TIME, OrderEvents.EVENT_TIME);

            // When
            Order order = Order.place(event, NOW);

            // Then
            assertThat(order.getPrice()).isEqualByComparingTo(BigDecimal.ZERO);
        }
    }

    @Nested
    @DisplayName("Status Changes")
    class StatusChanges {

        @Test
        @DisplayName("should_keep_attributes_when_status_changes")
        void should_keep_attributes_when_status_changes() {
            // Given
            Order order = Order.place(OrderEvents.placed("order-1"), NOW);
            Instant later = NOW.plusSeconds(60);

            // When
            Order allocated = order.withStatus(OrderStatus.STOCK_ALLOCATED, later);

            // Then
            assertThat(allocated.getStatus()).isEqualTo(OrderStatus.STOCK_ALLOCATED);
            assertThat(allocated.getCreatedAt()).isEqualTo(NOW);
            assertThat(allocated.getUpdatedAt()).isEqualTo(later);
            assertThat(allocated.getSku()).isEqualTo(order.getSku());
            assertThat(allocated).isEqualTo(order);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CREATED);
        }
    }

    @Nested
    @DisplayName("Created Event")
    class CreatedEvent {

        @Test
        @DisplayName("should_snapshot_stored_order")
        void should_snapshot_stored_order() {
            // Given
            Order order = Order.place(OrderEvents.placed("order-1"), NOW);
            Instant emittedAt = NOW.plusSeconds(1);

            // When
            OrderCreatedEvent event = OrderCreatedEvent.of(order, emittedAt);

            // Then
            assertThat(event.eventName()).isEqualTo("ORDER_CREATED_EVENT");
            assertThat(event.createdAt()).isEqualTo(emittedAt);
            assertThat(event.eventData().orderId()).isEqualTo("order-1");
            assertThat(event.eventData().orderStatus()).isEqualTo("ORDER_CREATED_STATUS");
            assertThat(event.eventData().units()).isEqualTo(2);
            assertThat(event.eventData().createdAt()).isEqualTo(NOW);
        }
    }

    @Nested
    @DisplayName("Value Objects")
    class ValueObjects {

        @Test
        @DisplayName("should_reject_blank_order_id")
        void should_reject_blank_order_id() {
            assertThatThrownBy(() -> OrderId.of("  "))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should_resolve_event_name_from_wire_name")
        void should_resolve_event_name_from_wire_name() {
            assertThat(OrderEventName.findByWireName("ORDER_PAYMENT_ACCEPTED_EVENT"))
                    .contains(OrderEventName.PAYMENT_ACCEPTED);
            assertThat(OrderEventName.findByWireName("ORDER_REFUNDED_EVENT")).isEmpty();
            assertThat(OrderEventName.findByWireName(null)).isEmpty();
        }
    }
}
