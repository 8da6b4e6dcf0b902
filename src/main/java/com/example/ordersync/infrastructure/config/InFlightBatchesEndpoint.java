package com.example.ordersync.infrastructure.config;

import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

/**
 * {@code /actuator/inflightbatches}: batch requests currently being processed.
 */
@Component
@Endpoint(id = "inflightbatches")
public class InFlightBatchesEndpoint {

    private final GracefulShutdownConfig gracefulShutdownConfig;

    public InFlightBatchesEndpoint(GracefulShutdownConfig gracefulShutdownConfig) {
        this.gracefulShutdownConfig = gracefulShutdownConfig;
    }

    @ReadOperation
    public InFlightBatches inFlightBatches() {
        int count = gracefulShutdownConfig.getInFlightBatchCount();
        return new InFlightBatches(count, count == 0 ? "IDLE" : "BUSY");
    }

    public record InFlightBatches(int inFlightBatches, String status) {}
}
