package com.riskengine.pnl;

import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.Position;
import com.riskengine.domain.model.PriceTick;
import com.riskengine.domain.vo.Decimals;
import com.riskengine.risk.RiskThresholds;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * P&L and fee arithmetic for leveraged positions, shared by every risk check and by the
 * position closer so that what the monitors see is exactly what settlement books.
 *
 * <p>Exit pricing always takes the opposing side of the spread:
 * <ul>
 *   <li><b>LONG:</b> closes by selling, so exits at the <b>bid</b></li>
 *   <li><b>SHORT:</b> closes by buying, so exits at the <b>ask</b></li>
 * </ul>
 * A mid or last price is never used for exits.
 *
 * <p>P&L = directional price difference x quantity x leverage.
 * Close fee = exit price x quantity x fee rate (no leverage on the fee).
 */
@Service
public class PositionPnLCalculator {

    private final RiskThresholds riskThresholds;

    public PositionPnLCalculator(RiskThresholds riskThresholds) {
        this.riskThresholds = riskThresholds;
    }

    /** Bid for LONG, ask for SHORT. */
    public BigDecimal exitPrice(Position position, PriceTick tick) {
        return position.isLong() ? tick.getBid() : tick.getAsk();
    }

    /** exit - entry for LONG, entry - exit for SHORT. */
    public BigDecimal priceDiff(Position position, BigDecimal exitPrice) {
        BigDecimal entry = Decimals.orZero(position.getEntryPrice());
        return position.isLong() ? exitPrice.subtract(entry) : entry.subtract(exitPrice);
    }

    public BigDecimal pnlAt(Position position, BigDecimal exitPrice) {
        return priceDiff(position, exitPrice)
                .multiply(Decimals.orZero(position.getQuantity()))
                .multiply(BigDecimal.valueOf(position.getLeverage()));
    }

    public BigDecimal closeFee(Position position, BigDecimal exitPrice) {
        return exitPrice.multiply(Decimals.orZero(position.getQuantity())).multiply(riskThresholds.getFeeRate());
    }

    /**
     * Marks every position of an account to market and derives equity.
     *
     * <p>Positions whose symbol has no quote contribute zero unrealized P&L and carry no exit
     * price; they can be ranked but not closed. The returned exposures keep the input order.
     *
     * @param account   the owning account (net worth is the equity base)
     * @param positions the account's open positions, in fetch order
     * @param prices    fresh quotes keyed by symbol
     */
    public AccountExposure exposure(Account account, List<Position> positions, Map<String, PriceTick> prices) {
        List<PositionExposure> exposures = new ArrayList<>(positions.size());
        BigDecimal unrealized = BigDecimal.ZERO;

        for (Position position : positions) {
            PriceTick tick = prices.get(position.getSymbol());
            if (tick == null) {
                exposures.add(new PositionExposure(position, null, BigDecimal.ZERO));
                continue;
            }
            BigDecimal exit = exitPrice(position, tick);
            BigDecimal pnl = pnlAt(position, exit);
            unrealized = unrealized.add(pnl);
            exposures.add(new PositionExposure(position, exit, pnl));
        }

        BigDecimal equity = Decimals.orZero(account.getNetWorth()).add(unrealized);
        return new AccountExposure(account, exposures, unrealized, equity);
    }
}
