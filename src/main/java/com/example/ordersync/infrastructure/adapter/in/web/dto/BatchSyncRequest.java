package com.example.ordersync.infrastructure.adapter.in.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for a batch of delivery-system messages.
 */
public record BatchSyncRequest(
        @NotNull(message = "messages is required")
        @Valid
        List<MessageRequest> messages
) {
    public record MessageRequest(
            @NotBlank(message = "messageId is required")
            String messageId,

            @Schema(description = "JSON-encoded order event")
            String body
    ) {}
}
