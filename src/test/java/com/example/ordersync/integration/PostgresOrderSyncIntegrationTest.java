package com.example.ordersync.integration;

import com.example.ordersync.domain.model.OrderEventName;
import com.example.ordersync.support.OrderEvents;
import com.example.ordersync.support.PostgresTestContainerSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Conditional writes against a real PostgreSQL instance.
 */
@DisplayName("PostgreSQL Order Sync Integration Tests")
class PostgresOrderSyncIntegrationTest extends PostgresTestContainerSupport {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    @DisplayName("should converge concurrent duplicates to one aggregate and one created event")
    void should_converge_concurrent_duplicates() {
        // Given
        List<Map<String, String>> messages = List.of(
                Map.of("messageId", "m1", "body", OrderEvents.placedJson("order-1")),
                Map.of("messageId", "m2", "body", OrderEvents.placedJson("order-1")),
                Map.of("messageId", "m3", "body", OrderEvents.placedJson("order-1")),
                Map.of("messageId", "m4", "body", OrderEvents.placedJson("order-1")));

        // When
        webTestClient.post()
                .uri("/api/order-sync/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("messages", messages))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.batchItemFailures").isEmpty();

        // Then
        assertThat(orderRepository.count()).isEqualTo(1);
        assertThat(eventRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should apply lifecycle transitions in order")
    void should_apply_lifecycle_transitions() {
        // Given
        post("m1", OrderEvents.placedJson("order-1"));

        // When
        post("m2", OrderEvents.lifecycleJson(OrderEventName.STOCK_ALLOCATED, "order-1"));
        post("m3", OrderEvents.lifecycleJson(OrderEventName.PAYMENT_ACCEPTED, "order-1"));

        // Then
        webTestClient.get()
                .uri("/api/orders/{orderId}", "order-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.orderStatus").isEqualTo("ORDER_PAYMENT_ACCEPTED_STATUS");
    }

    private void post(String messageId, String body) {
        webTestClient.post()
                .uri("/api/order-sync/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("messages", List.of(Map.of("messageId", messageId, "body", body))))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.batchItemFailures").isEmpty();
    }
}
