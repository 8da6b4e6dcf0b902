package com.example.ordersync.infrastructure.metrics;

import com.example.ordersync.application.dto.SyncAction;
import com.example.ordersync.application.port.out.SyncMetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Order synchronization metrics.
 *
 * <ul>
 *   <li>order_sync_success_total{action}: events applied</li>
 *   <li>order_sync_failure_total{error, transient}: events that failed</li>
 *   <li>order_sync_dropped_total{reason}: messages dropped before reaching the engine</li>
 *   <li>order_sync_batch_duration_seconds: batch processing time</li>
 *   <li>order_sync_batch_size: messages per batch</li>
 *   <li>order_sync_batch_redelivered: messages reported for redelivery per batch</li>
 * </ul>
 */
@Component
public class MicrometerSyncMetrics implements SyncMetricsPort {

    static final String SUCCESS_COUNTER = "order_sync_success_total";
    static final String FAILURE_COUNTER = "order_sync_failure_total";
    static final String DROPPED_COUNTER = "order_sync_dropped_total";
    static final String BATCH_TIMER = "order_sync_batch_duration_seconds";
    static final String BATCH_SIZE_SUMMARY = "order_sync_batch_size";
    static final String REDELIVERED_SUMMARY = "order_sync_batch_redelivered";

    private final MeterRegistry meterRegistry;
    private final Timer batchDurationTimer;
    private final DistributionSummary batchSizeSummary;
    private final DistributionSummary redeliveredSummary;

    public MicrometerSyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.batchDurationTimer = Timer.builder(BATCH_TIMER)
                .description("Order sync batch processing duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.batchSizeSummary = DistributionSummary.builder(BATCH_SIZE_SUMMARY)
                .description("Messages per order sync batch")
                .register(meterRegistry);

        this.redeliveredSummary = DistributionSummary.builder(REDELIVERED_SUMMARY)
                .description("Messages reported for redelivery per batch")
                .register(meterRegistry);
    }

    @Override
    public void syncCompleted(SyncAction action) {
        Counter.builder(SUCCESS_COUNTER)
                .tag("action", action.name())
                .description("Order events applied by the sync engine")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void syncFailed(String errorCode, boolean transientFailure) {
        Counter.builder(FAILURE_COUNTER)
                .tag("error", errorCode)
                .tag("transient", String.valueOf(transientFailure))
                .description("Order events that failed to sync")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void messageDropped(String reason) {
        Counter.builder(DROPPED_COUNTER)
                .tag("reason", reason)
                .description("Messages dropped before synchronization")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void batchCompleted(int messageCount, int reportedCount, Duration elapsed) {
        batchDurationTimer.record(elapsed);
        batchSizeSummary.record(messageCount);
        redeliveredSummary.record(reportedCount);
    }
}
