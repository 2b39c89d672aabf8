package com.riskengine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the equity_history table. Append-only, one row per settlement.
 */
@Entity
@Table(name = "equity_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EquityHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", length = 36, nullable = false)
    private String accountId;

    @Column(precision = 24, scale = 8)
    private BigDecimal equity;

    @Column(precision = 24, scale = 8)
    private BigDecimal pnl;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
