package com.example.ordersync.infrastructure.adapter.in.web.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a stored order.
 */
public record OrderResponse(
        String orderId,
        String orderStatus,
        String sku,
        int units,
        BigDecimal price,
        String userId,
        Instant createdAt,
        Instant updatedAt
) {}
