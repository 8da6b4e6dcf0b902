package com.example.ordersync.infrastructure.adapter.in.web;

import com.example.ordersync.application.port.in.QueryOrderUseCase;
import com.example.ordersync.infrastructure.adapter.in.web.dto.OrderEventResponse;
import com.example.ordersync.infrastructure.adapter.in.web.dto.OrderResponse;
import com.example.ordersync.infrastructure.adapter.in.web.mapper.OrderSyncWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Read-only REST controller for stored orders.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "Order state and event history")
public class OrderQueryController {

    private final QueryOrderUseCase queryOrderUseCase;
    private final OrderSyncWebMapper mapper;

    public OrderQueryController(QueryOrderUseCase queryOrderUseCase, OrderSyncWebMapper mapper) {
        this.queryOrderUseCase = queryOrderUseCase;
        this.mapper = mapper;
    }

    @Operation(summary = "Get an order")
    @ApiResponse(responseCode = "200", description = "Order found")
    @ApiResponse(responseCode = "404", description = "Order not found")
    @GetMapping("/{orderId}")
    public Mono<OrderResponse> getOrder(
            @Parameter(description = "Order id", example = "order-1") @PathVariable String orderId) {
        return Mono.fromCallable(() -> mapper.toOrderResponse(queryOrderUseCase.getOrder(orderId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "List the events recorded for an order")
    @ApiResponse(responseCode = "200", description = "Events, oldest first")
    @ApiResponse(responseCode = "404", description = "Order not found")
    @GetMapping("/{orderId}/events")
    public Mono<List<OrderEventResponse>> getEventHistory(
            @Parameter(description = "Order id", example = "order-1") @PathVariable String orderId) {
        return Mono.fromCallable(() -> queryOrderUseCase.getEventHistory(orderId).stream()
                        .map(mapper::toEventResponse)
                        .toList())
                .subscribeOn(Schedulers.boundedElastic());
    }
}
