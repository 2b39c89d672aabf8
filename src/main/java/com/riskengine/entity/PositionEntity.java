package com.riskengine.entity;

import com.riskengine.domain.enums.CloseReason;
import com.riskengine.domain.enums.PositionDirection;
import com.riskengine.domain.enums.PositionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table.
 * The partial index on status backs the open-position scan that runs on every admitted tick.
 */
@Entity
@Table(
        name = "positions",
        indexes = {
            @Index(name = "idx_positions_status", columnList = "status"),
            @Index(name = "idx_positions_account", columnList = "account_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "account_id", length = 36, nullable = false)
    private String accountId;

    @Column(length = 30, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private PositionDirection direction;

    @Column(precision = 24, scale = 8, nullable = false)
    private BigDecimal quantity;

    private int leverage;

    @Column(name = "entry_price", precision = 24, scale = 8, nullable = false)
    private BigDecimal entryPrice;

    @Column(name = "isolated_margin", precision = 24, scale = 8)
    private BigDecimal isolatedMargin;

    @Column(name = "trade_fees", precision = 24, scale = 8)
    private BigDecimal tradeFees;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private PositionStatus status;

    @Column(name = "exit_price", precision = 24, scale = 8)
    private BigDecimal exitPrice;

    @Column(name = "exit_timestamp")
    private Instant exitTimestamp;

    @Column(name = "realized_pnl", precision = 24, scale = 8)
    private BigDecimal realizedPnl;

    @Enumerated(EnumType.STRING)
    @Column(name = "close_reason", columnDefinition = "varchar(20)")
    private CloseReason closeReason;

    @Column(name = "total_fees", precision = 24, scale = 8)
    private BigDecimal totalFees;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
