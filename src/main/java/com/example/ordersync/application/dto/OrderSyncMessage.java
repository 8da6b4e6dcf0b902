package com.example.ordersync.application.dto;

/**
 * One delivery-system message carrying a serialized order event.
 *
 * @param messageId identifier used by the delivery system for redelivery
 * @param body      JSON-encoded order event
 */
public record OrderSyncMessage(String messageId, String body) {}
