package com.example.ordersync.application.port.out;

import com.example.ordersync.application.dto.SyncAction;

import java.time.Duration;

/**
 * Observability hooks for order synchronization.
 */
public interface SyncMetricsPort {

    void syncCompleted(SyncAction action);

    void syncFailed(String errorCode, boolean transientFailure);

    void messageDropped(String reason);

    void batchCompleted(int messageCount, int reportedCount, Duration elapsed);
}
