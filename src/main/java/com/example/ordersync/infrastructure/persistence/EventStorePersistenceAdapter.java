package com.example.ordersync.infrastructure.persistence;

import com.example.ordersync.application.dto.RecordedOrderEvent;
import com.example.ordersync.application.port.out.AppendResult;
import com.example.ordersync.application.port.out.EventStorePort;
import com.example.ordersync.domain.model.OrderEventName;
import com.example.ordersync.infrastructure.exception.StoreUnavailableException;
import com.example.ordersync.infrastructure.persistence.entity.OrderEventEntity;
import com.example.ordersync.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.ordersync.infrastructure.persistence.repository.OrderEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Append-only event store backed by the {@code order_events} table.
 * A unique-key violation on (aggregate_id, event_name) is reported as {@link AppendResult#DUPLICATE}.
 */
@Component
public class EventStorePersistenceAdapter implements EventStorePort {

    private static final Logger log = LoggerFactory.getLogger(EventStorePersistenceAdapter.class);
    private static final String STORE_NAME = "event-store";

    private final OrderEventRepository eventRepository;
    private final OrderPersistenceMapper mapper;
    private final ObjectMapper objectMapper;

    public EventStorePersistenceAdapter(
            OrderEventRepository eventRepository,
            OrderPersistenceMapper mapper,
            ObjectMapper objectMapper) {
        this.eventRepository = eventRepository;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public AppendResult append(OrderEventName eventName, String orderId, Object payload, Instant occurredAt) {
        OrderEventEntity entity = new OrderEventEntity();
        entity.setAggregateId(orderId);
        entity.setEventName(eventName.getWireName());
        entity.setPayload(serializePayload(eventName, payload));
        entity.setOccurredAt(occurredAt);

        try {
            eventRepository.saveAndFlush(entity);
            log.debug("Recorded {} for order {}", eventName.getWireName(), orderId);
            return AppendResult.APPENDED;
        } catch (DataIntegrityViolationException e) {
            if (isRecorded(eventName, orderId)) {
                log.info("[DUPLICATE_EVENT] {} already recorded for order {}", eventName.getWireName(), orderId);
                return AppendResult.DUPLICATE;
            }
            throw new StoreUnavailableException(STORE_NAME,
                    "Failed to record " + eventName.getWireName() + " for order " + orderId, e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME,
                    "Failed to record " + eventName.getWireName() + " for order " + orderId, e);
        }
    }

    @Override
    public List<RecordedOrderEvent> findByOrderId(String orderId) {
        try {
            return eventRepository.findByAggregateIdOrderByRecordedAtAsc(orderId).stream()
                    .map(mapper::toRecordedEvent)
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME, "Failed to read events of order " + orderId, e);
        }
    }

    private boolean isRecorded(OrderEventName eventName, String orderId) {
        try {
            return eventRepository.existsByAggregateIdAndEventName(orderId, eventName.getWireName());
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME,
                    "Failed to check " + eventName.getWireName() + " for order " + orderId, e);
        }
    }

    private String serializePayload(OrderEventName eventName, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload of " + eventName.getWireName() + " is not serializable", e);
        }
    }
}
