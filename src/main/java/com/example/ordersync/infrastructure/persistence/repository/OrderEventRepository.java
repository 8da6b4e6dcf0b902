package com.example.ordersync.infrastructure.persistence.repository;

import com.example.ordersync.infrastructure.persistence.entity.OrderEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA Repository for recorded order events.
 */
@Repository
public interface OrderEventRepository extends JpaRepository<OrderEventEntity, String> {

    boolean existsByAggregateIdAndEventName(String aggregateId, String eventName);

    List<OrderEventEntity> findByAggregateIdOrderByRecordedAtAsc(String aggregateId);
}
