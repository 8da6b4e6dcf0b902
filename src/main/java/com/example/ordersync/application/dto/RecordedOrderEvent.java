package com.example.ordersync.application.dto;

import java.time.Instant;

/**
 * An event as recorded in the event store.
 *
 * @param eventName   wire name of the event
 * @param orderId     the order it belongs to
 * @param payload     JSON payload
 * @param occurredAt  when the event was raised
 */
public record RecordedOrderEvent(String eventName, String orderId, String payload, Instant occurredAt) {}
