package com.example.ordersync.infrastructure.persistence.repository;

import com.example.ordersync.infrastructure.persistence.entity.OrderEntity;
import com.example.ordersync.infrastructure.persistence.entity.OrderStatusEnum;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * JPA Repository for Order entities.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    /**
     * Sets the status only if it differs from the stored one.
     *
     * @return number of rows updated, 0 if the order is missing or already has the status
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :status, o.updatedAt = :updatedAt " +
            "WHERE o.id = :id AND o.status <> :status")
    int updateStatusIfDiffers(@Param("id") String id,
                              @Param("status") OrderStatusEnum status,
                              @Param("updatedAt") Instant updatedAt);
}
