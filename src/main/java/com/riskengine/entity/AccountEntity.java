package com.riskengine.entity;

import com.riskengine.domain.enums.AccountStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the accounts table.
 */
@Entity
@Table(name = "accounts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "available_margin", precision = 24, scale = 8)
    private BigDecimal availableMargin;

    @Column(name = "total_margin_required", precision = 24, scale = 8)
    private BigDecimal totalMarginRequired;

    @Column(name = "net_worth", precision = 24, scale = 8)
    private BigDecimal netWorth;

    @Column(name = "total_pnl", precision = 24, scale = 8)
    private BigDecimal totalPnl;

    @Column(name = "realized_pnl", precision = 24, scale = 8)
    private BigDecimal realizedPnl;

    @Column(name = "starting_balance", precision = 24, scale = 8)
    private BigDecimal startingBalance;

    @Column(name = "day_start_balance", precision = 24, scale = 8)
    private BigDecimal dayStartBalance;

    @Column(name = "day_start_equity", precision = 24, scale = 8)
    private BigDecimal dayStartEquity;

    @Column(name = "day_start_date")
    private LocalDate dayStartDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_status", columnDefinition = "varchar(20)", nullable = false)
    private AccountStatus accountStatus;

    @Column(name = "is_active")
    private boolean active;

    @Column(name = "breach_reason", columnDefinition = "TEXT")
    private String breachReason;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
