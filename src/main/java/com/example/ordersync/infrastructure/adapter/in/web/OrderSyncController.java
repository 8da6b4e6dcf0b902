package com.example.ordersync.infrastructure.adapter.in.web;

import com.example.ordersync.application.port.in.SyncOrderBatchUseCase;
import com.example.ordersync.infrastructure.adapter.in.web.dto.BatchSyncRequest;
import com.example.ordersync.infrastructure.adapter.in.web.dto.BatchSyncResponse;
import com.example.ordersync.infrastructure.adapter.in.web.mapper.OrderSyncWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST controller receiving message batches from the delivery system.
 */
@RestController
@RequestMapping("/api/order-sync")
@Tag(name = "Order Sync", description = "Batch ingestion of order lifecycle events")
public class OrderSyncController {

    private static final Logger log = LoggerFactory.getLogger(OrderSyncController.class);

    private final SyncOrderBatchUseCase syncOrderBatchUseCase;
    private final OrderSyncWebMapper mapper;

    public OrderSyncController(SyncOrderBatchUseCase syncOrderBatchUseCase, OrderSyncWebMapper mapper) {
        this.syncOrderBatchUseCase = syncOrderBatchUseCase;
        this.mapper = mapper;
    }

    @Operation(
            summary = "Process a batch of order events",
            description = """
                    Applies each message's order event independently.
                    The response lists only the messages that must be redelivered;
                    every message absent from the list is acknowledged.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Batch processed, partial failure report returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = BatchSyncResponse.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "batchItemFailures": [
                                        { "itemIdentifier": "msg-2" },
                                        { "itemIdentifier": "msg-5" }
                                      ]
                                    }
                                    """)
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Malformed batch envelope",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "INVALID_REQUEST",
                                      "message": "messages[0].messageId: messageId is required",
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            )
    })
    @PostMapping("/batches")
    public Mono<ResponseEntity<BatchSyncResponse>> processBatch(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Messages to process",
                    required = true,
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = BatchSyncRequest.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "messages": [
                                        {
                                          "messageId": "msg-1",
                                          "body": "{\\"eventName\\":\\"ORDER_PLACED_EVENT\\",\\"eventData\\":{\\"orderId\\":\\"order-1\\",\\"sku\\":\\"SKU001\\",\\"units\\":2,\\"price\\":10.5,\\"userId\\":\\"user-1\\"},\\"createdAt\\":\\"2026-02-02T12:00:00Z\\",\\"updatedAt\\":\\"2026-02-02T12:00:00Z\\"}"
                                        }
                                      ]
                                    }
                                    """)
                    )
            )
            @Valid @RequestBody BatchSyncRequest request) {

        log.info("Received order sync batch with {} message(s)", request.messages().size());

        return Mono.fromCallable(() -> syncOrderBatchUseCase.processBatch(mapper.toMessages(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(report -> ResponseEntity.ok(mapper.toBatchResponse(report)));
    }
}
