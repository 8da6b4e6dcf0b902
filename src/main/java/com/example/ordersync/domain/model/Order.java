package com.example.ordersync.domain.model;

import com.example.ordersync.domain.exception.InvalidOrderEventException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate Root representing an order and its current lifecycle status.
 * Orders are never deleted; the status changes only through sanctioned transitions.
 */
public final class Order {

    private final OrderId orderId;
    private final OrderStatus status;
    private final String sku;
    private final int units;
    private final BigDecimal price;
    private final String userId;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Order(OrderId orderId, OrderStatus status, String sku, int units, BigDecimal price,
                  String userId, Instant createdAt, Instant updatedAt) {
        this.orderId = Objects.requireNonNull(orderId, "OrderId cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.sku = requireNonBlank(sku, "Sku");
        this.price = Objects.requireNonNull(price, "Price cannot be null");
        this.userId = requireNonBlank(userId, "UserId");
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        this.updatedAt = Objects.requireNonNull(updatedAt, "UpdatedAt cannot be null");

        if (units <= 0) {
            throw new IllegalArgumentException("Units must be positive");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("Price cannot be negative");
        }
        this.units = units;
    }

    /**
     * Creates a new Order from a placed event. The order starts in {@link OrderStatus#CREATED}.
     *
     * @param event the placed event
     * @param now   creation timestamp
     * @return new Order instance
     * @throws InvalidOrderEventException if the event is not a placed event or misses order attributes
     */
    public static Order place(IncomingOrderEvent event, Instant now) {
        if (!event.isPlacedEvent()) {
            throw new InvalidOrderEventException(
                    "Only " + OrderEventName.PLACED.getWireName() + " can create an order, got "
                            + event.eventName().getWireName());
        }

        IncomingOrderEvent.EventData data = event.eventData();
        List<String> missing = new ArrayList<>();
        if (data.sku() == null) missing.add("sku");
        if (data.units() == null) missing.add("units");
        if (data.price() == null) missing.add("price");
        if (data.userId() == null) missing.add("userId");
        if (!missing.isEmpty()) {
            throw new InvalidOrderEventException("Placed event for order " + data.orderId()
                    + " is missing " + String.join(", ", missing));
        }

        try {
            return new Order(OrderId.of(data.orderId()), OrderStatus.CREATED, data.sku(), data.units(),
                    data.price(), data.userId(), now, now);
        } catch (IllegalArgumentException e) {
            throw new InvalidOrderEventException("Placed event for order " + data.orderId()
                    + " is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * Reconstitutes an Order from persistence.
     */
    public static Order reconstitute(OrderId orderId, OrderStatus status, String sku, int units,
                                     BigDecimal price, String userId, Instant createdAt, Instant updatedAt) {
        return new Order(orderId, status, sku, units, price, userId, createdAt, updatedAt);
    }

    /**
     * Returns a copy of this order moved to the given status.
     */
    public Order withStatus(OrderStatus newStatus, Instant now) {
        return new Order(orderId, newStatus, sku, units, price, userId, createdAt, now);
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public String getSku() {
        return sku;
    }

    public int getUnits() {
        return units;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return Objects.equals(orderId, order.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId);
    }

    @Override
    public String toString() {
        return "Order{" +
                "orderId=" + orderId +
                ", status=" + status +
                ", sku='" + sku + '\'' +
                ", units=" + units +
                ", price=" + price +
                '}';
    }
}
