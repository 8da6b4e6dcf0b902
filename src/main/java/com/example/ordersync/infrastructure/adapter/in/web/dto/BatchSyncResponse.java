package com.example.ordersync.infrastructure.adapter.in.web.dto;

import java.util.List;

/**
 * Response DTO listing the messages to redeliver.
 */
public record BatchSyncResponse(List<ItemFailure> batchItemFailures) {

    public record ItemFailure(String itemIdentifier) {}
}
