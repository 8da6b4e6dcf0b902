package com.example.ordersync.domain.model;

import java.util.Objects;

/**
 * Value Object for the order identifier assigned by the upstream order system.
 * Any non-blank string up to {@value #MAX_LENGTH} characters is accepted.
 */
public final class OrderId {

    public static final int MAX_LENGTH = 64;

    private final String value;

    private OrderId(String value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if value is blank or longer than {@value #MAX_LENGTH}
     */
    public static OrderId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OrderId cannot be blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "OrderId exceeds " + MAX_LENGTH + " characters: " + value.substring(0, 16) + "...");
        }
        return new OrderId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OrderId && value.equals(((OrderId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
