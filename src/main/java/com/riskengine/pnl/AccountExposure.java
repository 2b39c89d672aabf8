package com.riskengine.pnl;

import com.riskengine.domain.model.Account;
import java.math.BigDecimal;
import java.util.List;
import lombok.Getter;

/**
 * An account's open book marked to market: equity = net worth + unrealized P&L.
 * Computed once per account per pass and shared by the margin and drawdown checks.
 */
@Getter
public class AccountExposure {

    private final Account account;
    private final List<PositionExposure> positions;
    private final BigDecimal unrealizedPnl;
    private final BigDecimal equity;

    public AccountExposure(
            Account account, List<PositionExposure> positions, BigDecimal unrealizedPnl, BigDecimal equity) {
        this.account = account;
        this.positions = List.copyOf(positions);
        this.unrealizedPnl = unrealizedPnl;
        this.equity = equity;
    }
}
