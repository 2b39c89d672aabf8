package com.riskengine.repository.jpa;

import com.riskengine.domain.enums.CloseReason;
import com.riskengine.domain.enums.PositionStatus;
import com.riskengine.entity.PositionEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    @Query("SELECT p FROM PositionEntity p WHERE p.status = :status ORDER BY p.createdAt ASC, p.id ASC")
    List<PositionEntity> findByStatusOrdered(@Param("status") PositionStatus status, Pageable pageable);

    List<PositionEntity> findByAccountIdAndStatus(String accountId, PositionStatus status);

    /**
     * Compare-and-swap close: only flips a position that is still OPEN.
     * Returns the number of rows changed, 0 when another close got there first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PositionEntity p SET p.status = com.riskengine.domain.enums.PositionStatus.CLOSED,"
            + " p.exitPrice = :exitPrice, p.exitTimestamp = :exitTimestamp, p.realizedPnl = :realizedPnl,"
            + " p.closeReason = :closeReason, p.totalFees = :totalFees, p.updatedAt = :exitTimestamp"
            + " WHERE p.id = :id AND p.status = com.riskengine.domain.enums.PositionStatus.OPEN")
    int closeIfOpen(
            @Param("id") String id,
            @Param("exitPrice") BigDecimal exitPrice,
            @Param("exitTimestamp") Instant exitTimestamp,
            @Param("realizedPnl") BigDecimal realizedPnl,
            @Param("closeReason") CloseReason closeReason,
            @Param("totalFees") BigDecimal totalFees);
}
