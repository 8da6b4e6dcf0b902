package com.example.ordersync.application.dto;

import java.util.List;

/**
 * Partial batch failure report. Messages absent from the report are acknowledged.
 *
 * @param batchItemFailures messages to redeliver, in input order
 */
public record BatchSyncReport(List<BatchItemFailure> batchItemFailures) {

    public BatchSyncReport {
        batchItemFailures = List.copyOf(batchItemFailures);
    }

    public static BatchSyncReport empty() {
        return new BatchSyncReport(List.of());
    }

    public List<String> itemIdentifiers() {
        return batchItemFailures.stream()
                .map(BatchItemFailure::itemIdentifier)
                .toList();
    }

    public record BatchItemFailure(String itemIdentifier) {}
}
