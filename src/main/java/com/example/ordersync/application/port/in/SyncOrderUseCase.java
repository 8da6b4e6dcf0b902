package com.example.ordersync.application.port.in;

import com.example.ordersync.application.dto.SyncResult;
import com.example.ordersync.domain.model.IncomingOrderEvent;

/**
 * Inbound port for applying one lifecycle event to its order.
 */
public interface SyncOrderUseCase {

    /**
     * Creates or transitions the order the event refers to.
     *
     * @param event the validated event
     * @return what was done
     * @throws com.example.ordersync.domain.exception.DomainException carrying its retryability
     */
    SyncResult syncOrder(IncomingOrderEvent event);
}
