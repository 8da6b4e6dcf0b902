package com.example.ordersync.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds the context close until in-flight batches have returned their report,
 * or until {@code order-sync.shutdown.max-wait-seconds} elapses.
 * Batches still running after that are redelivered whole by the delivery system.
 */
@Component
public class GracefulShutdownConfig implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownConfig.class);
    private static final long POLL_INTERVAL_MS = 250;

    private final AtomicInteger inFlightBatches = new AtomicInteger();
    private final Duration maxWait;

    public GracefulShutdownConfig(@Value("${order-sync.shutdown.max-wait-seconds:25}") int maxWaitSeconds) {
        this.maxWait = Duration.ofSeconds(maxWaitSeconds);
    }

    public void batchStarted() {
        log.debug("[BATCH] in flight: {}", inFlightBatches.incrementAndGet());
    }

    public void batchFinished() {
        log.debug("[BATCH] in flight: {}", inFlightBatches.decrementAndGet());
    }

    public int getInFlightBatchCount() {
        return inFlightBatches.get();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        if (inFlightBatches.get() > 0) {
            log.info("[SHUTDOWN] waiting up to {}s for {} batch(es)", maxWait.toSeconds(), inFlightBatches.get());
        }
        try {
            while (inFlightBatches.get() > 0 && System.nanoTime() < deadline) {
                TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[SHUTDOWN] interrupted while waiting for batches");
        }

        int remaining = inFlightBatches.get();
        if (remaining > 0) {
            log.warn("[SHUTDOWN] {} batch(es) still running, they will be redelivered", remaining);
        } else {
            log.info("[SHUTDOWN] no batch in flight");
        }
    }
}
