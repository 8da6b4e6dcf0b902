package com.example.ordersync.application.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Wire shape of an order event inside a delivery-system message.
 */
public record IncomingOrderEventRequest(
        @NotBlank(message = "eventName is required")
        String eventName,

        @NotNull(message = "eventData is required")
        @Valid
        EventDataRequest eventData,

        @NotNull(message = "createdAt is required")
        Instant createdAt,

        @NotNull(message = "updatedAt is required")
        Instant updatedAt
) {
    /**
     * Optional fields may be absent, but not blank when present.
     */
    public record EventDataRequest(
            @NotBlank(message = "orderId is required")
            @Size(max = 64, message = "orderId must be at most 64 characters")
            String orderId,

            @Pattern(regexp = "\\S.*", message = "sku cannot be blank")
            @Size(max = 64, message = "sku must be at most 64 characters")
            String sku,

            @Positive(message = "units must be positive")
            Integer units,

            @PositiveOrZero(message = "price cannot be negative")
            @Digits(integer = 17, fraction = 2, message = "price must have at most 17 integer and 2 fraction digits")
            BigDecimal price,

            @Pattern(regexp = "\\S.*", message = "userId cannot be blank")
            @Size(max = 64, message = "userId must be at most 64 characters")
            String userId
    ) {}
}
