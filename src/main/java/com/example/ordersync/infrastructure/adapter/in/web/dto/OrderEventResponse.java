package com.example.ordersync.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

/**
 * Response DTO for a recorded order event. The payload is returned as stored JSON.
 */
public record OrderEventResponse(
        String eventName,
        Instant occurredAt,
        @JsonRawValue String payload
) {}
