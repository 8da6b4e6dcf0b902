package com.example.ordersync.integration;

import com.example.ordersync.domain.model.OrderEventName;
import com.example.ordersync.infrastructure.persistence.entity.OrderEntity;
import com.example.ordersync.support.IntegrationTestSupport;
import com.example.ordersync.support.OrderEvents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end tests for batch ingestion and the order query endpoints.
 */
@DisplayName("Order Sync Batch Integration Tests")
class OrderSyncBatchIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private WebTestClient webTestClient;

    private WebTestClient.ResponseSpec postBatch(List<Map<String, String>> messages) {
        return webTestClient.post()
                .uri("/api/order-sync/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("messages", messages))
                .exchange();
    }

    private static Map<String, String> message(String messageId, String body) {
        return Map.of("messageId", messageId, "body", body);
    }

    @Test
    @DisplayName("should create order from placed event and acknowledge whole batch")
    void should_create_order_and_acknowledge_batch() {
        // When
        postBatch(List.of(
                message("m1", OrderEvents.placedJson("order-1")),
                message("m2", "not json"),
                message("m3", OrderEvents.lifecycleJson(OrderEventName.SHIPPED, "unknown-order"))))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.batchItemFailures").isEmpty();

        // Then
        webTestClient.get()
                .uri("/api/orders/{orderId}", "order-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.orderId").isEqualTo("order-1")
                .jsonPath("$.orderStatus").isEqualTo("ORDER_CREATED_STATUS")
                .jsonPath("$.sku").isEqualTo("SKU001")
                .jsonPath("$.units").isEqualTo(2);

        webTestClient.get()
                .uri("/api/orders/{orderId}", "unknown-order")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ORDER_NOT_FOUND");
    }

    @Test
    @DisplayName("should keep one aggregate and one created event for duplicate placed events")
    void should_keep_one_aggregate_for_duplicate_placed_events() {
        // When: the same placed event arrives three times in one batch, then again in a later batch
        postBatch(List.of(
                message("m1", OrderEvents.placedJson("order-1")),
                message("m2", OrderEvents.placedJson("order-1")),
                message("m3", OrderEvents.placedJson("order-1"))))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.batchItemFailures").isEmpty();

        postBatch(List.of(message("m4", OrderEvents.placedJson("order-1"))))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.batchItemFailures").isEmpty();

        // Then
        assertThat(orderRepository.count()).isEqualTo(1);
        assertThat(eventRepository.count()).isEqualTo(1);

        webTestClient.get()
                .uri("/api/orders/{orderId}/events", "order-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].eventName").isEqualTo("ORDER_CREATED_EVENT")
                .jsonPath("$[0].payload.eventData.orderId").isEqualTo("order-1")
                .jsonPath("$[0].payload.eventData.orderStatus").isEqualTo("ORDER_CREATED_STATUS");
    }

    @Test
    @DisplayName("should report events that arrive before their prerequisite")
    void should_report_events_arriving_before_prerequisite() {
        // Given
        postBatch(List.of(message("m1", OrderEvents.placedJson("order-1"))))
                .expectStatus().isOk();

        // When: shipping is not ready from either CREATED or STOCK_ALLOCATED
        postBatch(List.of(
                message("m2", OrderEvents.lifecycleJson(OrderEventName.SHIPPED, "order-1")),
                message("m3", OrderEvents.lifecycleJson(OrderEventName.STOCK_ALLOCATED, "order-1"))))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.batchItemFailures.length()").isEqualTo(1)
                .jsonPath("$.batchItemFailures[0].itemIdentifier").isEqualTo("m2");

        // Then
        webTestClient.get()
                .uri("/api/orders/{orderId}", "order-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.orderStatus").isEqualTo("ORDER_STOCK_ALLOCATED_STATUS");
    }

    @Test
    @DisplayName("should acknowledge permanently rejected transitions")
    void should_acknowledge_permanently_rejected_transitions() {
        // Given
        postBatch(List.of(message("m1", OrderEvents.placedJson("order-1")))).expectStatus().isOk();
        postBatch(List.of(message("m2", OrderEvents.lifecycleJson(OrderEventName.CANCELED, "order-1"))))
                .expectStatus().isOk();

        // When
        postBatch(List.of(
                message("m3", OrderEvents.lifecycleJson(OrderEventName.CANCELED, "order-1")),
                message("m4", OrderEvents.lifecycleJson(OrderEventName.STOCK_ALLOCATED, "order-1"))))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.batchItemFailures").isEmpty();

        // Then
        webTestClient.get()
                .uri("/api/orders/{orderId}", "order-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.orderStatus").isEqualTo("ORDER_CANCELED_STATUS");
    }

    @Test
    @DisplayName("should acknowledge placed events whose attributes exceed stored limits")
    void should_acknowledge_placed_events_exceeding_stored_limits() {
        // Given
        String longSku = OrderEvents.placedJson("order-1")
                .replace("\"SKU001\"", "\"" + "S".repeat(100) + "\"");
        String hugePrice = OrderEvents.placedJson("order-2").replace("10.50", "100000000000000000000");

        // When
        postBatch(List.of(
                message("long-sku", longSku),
                message("huge-price", hugePrice),
                message("valid", OrderEvents.placedJson("order-3"))))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.batchItemFailures").isEmpty();

        // Then
        assertThat(orderRepository.findAll().stream().map(OrderEntity::getId).toList())
                .containsExactly("order-3");
    }

    @Test
    @DisplayName("should reject malformed batch envelope")
    void should_reject_malformed_batch_envelope() {
        webTestClient.post()
                .uri("/api/order-sync/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        { "messages": [ { "body": "{}" } ] }
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST")
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("messageId is required"));
    }

    @Test
    @DisplayName("should report no in-flight batches once a batch completes")
    void should_report_no_in_flight_batches_once_batch_completes() {
        // Given
        postBatch(List.of(message("m1", OrderEvents.placedJson("order-1")))).expectStatus().isOk();

        // When & Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> webTestClient.get()
                .uri("/actuator/inflightbatches")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.inFlightBatches").isEqualTo(0)
                .jsonPath("$.status").isEqualTo("IDLE"));
    }
}
