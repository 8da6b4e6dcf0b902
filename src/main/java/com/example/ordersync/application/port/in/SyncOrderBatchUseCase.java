package com.example.ordersync.application.port.in;

import com.example.ordersync.application.dto.BatchSyncReport;
import com.example.ordersync.application.dto.OrderSyncMessage;

import java.util.List;

/**
 * Inbound port for processing a batch of delivery-system messages.
 */
public interface SyncOrderBatchUseCase {

    /**
     * Processes every message independently.
     *
     * @param messages the batch, in delivery order
     * @return the messages that failed transiently and must be redelivered
     */
    BatchSyncReport processBatch(List<OrderSyncMessage> messages);
}
