package com.riskengine.repository.jpa;

import com.riskengine.domain.enums.OrderStatus;
import com.riskengine.entity.OrderEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the orders table.
 * Status transitions are conditional on PENDING so an order can only leave PENDING once.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    /** Pending SL/TP legs whose owning position is still open. */
    @Query("SELECT o FROM OrderEntity o WHERE o.status = com.riskengine.domain.enums.OrderStatus.PENDING"
            + " AND o.positionId IS NOT NULL AND EXISTS (SELECT p.id FROM PositionEntity p"
            + " WHERE p.id = o.positionId AND p.status = com.riskengine.domain.enums.PositionStatus.OPEN)"
            + " ORDER BY o.createdAt ASC, o.id ASC")
    List<OrderEntity> findPendingForOpenPositions(Pageable pageable);

    List<OrderEntity> findByPositionId(String positionId);

    List<OrderEntity> findByPositionIdAndStatus(String positionId, OrderStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = com.riskengine.domain.enums.OrderStatus.FILLED, o.updatedAt = :now"
            + " WHERE o.id = :id AND o.status = com.riskengine.domain.enums.OrderStatus.PENDING")
    int markFilledIfPending(@Param("id") String id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = com.riskengine.domain.enums.OrderStatus.CANCELLED, o.updatedAt = :now"
            + " WHERE o.positionId = :positionId AND o.status = com.riskengine.domain.enums.OrderStatus.PENDING")
    int cancelPendingByPositionId(@Param("positionId") String positionId, @Param("now") Instant now);
}
