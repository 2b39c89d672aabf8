package com.riskengine.domain.model;

import com.riskengine.domain.enums.AccountStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trading account balances and drawdown baselines.
 *
 * <p>{@code totalMarginRequired} is the sum of isolated margin over the account's open
 * positions and is floored at zero when margin is released. The day-start fields are the
 * intraday drawdown baseline, rolled once per UTC day by the daily reset job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private String id;

    private BigDecimal availableMargin;
    private BigDecimal totalMarginRequired;
    private BigDecimal netWorth;
    private BigDecimal totalPnl;
    private BigDecimal realizedPnl;

    private BigDecimal startingBalance;
    private BigDecimal dayStartBalance;
    private BigDecimal dayStartEquity;
    private LocalDate dayStartDate;

    private AccountStatus accountStatus;
    private boolean active;
    private String breachReason;

    public boolean isBreached() {
        return accountStatus == AccountStatus.BREACHED;
    }
}
