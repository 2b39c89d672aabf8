package com.riskengine.support;

import com.riskengine.domain.enums.AccountStatus;
import com.riskengine.domain.enums.OrderStatus;
import com.riskengine.domain.enums.OrderType;
import com.riskengine.domain.enums.PositionDirection;
import com.riskengine.domain.enums.PositionStatus;
import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.Order;
import com.riskengine.domain.model.Position;
import com.riskengine.domain.model.PriceTick;
import java.math.BigDecimal;
import java.time.LocalDate;

/** Builders for the accounts, positions, orders and quotes shared across tests. */
public final class RiskFixtures {

    public static final String ACCOUNT_ID = "acc-1";

    private RiskFixtures() {}

    /** Healthy 10,000 account with no margin in use and no day baseline. */
    public static Account.AccountBuilder account(String id) {
        return Account.builder()
                .id(id)
                .availableMargin(new BigDecimal("10000"))
                .totalMarginRequired(BigDecimal.ZERO)
                .netWorth(new BigDecimal("10000"))
                .totalPnl(BigDecimal.ZERO)
                .realizedPnl(BigDecimal.ZERO)
                .startingBalance(new BigDecimal("10000"))
                .accountStatus(AccountStatus.ACTIVE)
                .active(true);
    }

    public static Account.AccountBuilder accountWithDayStart(String id, String baseline, LocalDate day) {
        return account(id)
                .dayStartBalance(new BigDecimal(baseline))
                .dayStartEquity(new BigDecimal(baseline))
                .dayStartDate(day);
    }

    public static Position.PositionBuilder position(
            String id, String symbol, PositionDirection direction, String quantity, int leverage, String entry) {
        return Position.builder()
                .id(id)
                .accountId(ACCOUNT_ID)
                .symbol(symbol)
                .direction(direction)
                .quantity(new BigDecimal(quantity))
                .leverage(leverage)
                .entryPrice(new BigDecimal(entry))
                .isolatedMargin(new BigDecimal("100"))
                .tradeFees(BigDecimal.ZERO)
                .status(PositionStatus.OPEN);
    }

    /** The BTC-USD long from the reference settlement scenario. */
    public static Position.PositionBuilder btcLong(String id) {
        return position(id, "BTC-USD", PositionDirection.LONG, "0.01", 10, "67971.44")
                .isolatedMargin(new BigDecimal("67.97"))
                .tradeFees(new BigDecimal("0.4758"));
    }

    public static Order stopLoss(String id, String positionId, String stopPrice) {
        return Order.builder()
                .id(id)
                .positionId(positionId)
                .orderType(OrderType.STOP)
                .stopPrice(new BigDecimal(stopPrice))
                .status(OrderStatus.PENDING)
                .build();
    }

    public static Order takeProfit(String id, String positionId, String price) {
        return Order.builder()
                .id(id)
                .positionId(positionId)
                .orderType(OrderType.LIMIT)
                .price(new BigDecimal(price))
                .status(OrderStatus.PENDING)
                .build();
    }

    public static PriceTick quote(String bid, String ask) {
        return PriceTick.of(bid, ask, bid);
    }
}
