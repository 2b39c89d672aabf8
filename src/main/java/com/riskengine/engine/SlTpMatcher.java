package com.riskengine.engine;

import com.riskengine.domain.enums.CloseReason;
import com.riskengine.domain.enums.OrderType;
import com.riskengine.domain.model.CloseResult;
import com.riskengine.domain.model.Order;
import com.riskengine.domain.model.Position;
import com.riskengine.domain.model.PriceTick;
import com.riskengine.pnl.PositionPnLCalculator;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Matches pending stop-loss / take-profit legs against the current quotes and closes the
 * positions whose level has been crossed.
 *
 * <p>The comparison uses the price the position would actually exit at (bid for LONG, ask
 * for SHORT):
 * <ul>
 *   <li><b>STOP (SL):</b> LONG triggers when exit &lt;= stopPrice, SHORT when exit &gt;= stopPrice</li>
 *   <li><b>LIMIT (TP):</b> LONG triggers when exit &gt;= price, SHORT when exit &lt;= price</li>
 * </ul>
 *
 * <p>Orders whose position is not in the open list, or whose symbol has no quote, are skipped
 * silently. If both legs of one position trigger in the same pass, the first one settles and
 * the second finds the position already closed.
 */
@Service
public class SlTpMatcher {

    private static final Logger log = LoggerFactory.getLogger(SlTpMatcher.class);

    private final PositionCloser positionCloser;
    private final PositionPnLCalculator pnlCalculator;

    public SlTpMatcher(PositionCloser positionCloser, PositionPnLCalculator pnlCalculator) {
        this.positionCloser = positionCloser;
        this.pnlCalculator = pnlCalculator;
    }

    /**
     * @param openPositions  open positions at the start of the pass
     * @param pendingOrders  pending SL/TP orders linked to positions
     * @param prices         fresh quotes keyed by symbol
     * @return settlement results of every triggered order, including skipped duplicates
     */
    public List<CloseResult> match(
            List<Position> openPositions, List<Order> pendingOrders, Map<String, PriceTick> prices) {
        Map<String, Position> positionsById = new LinkedHashMap<>();
        for (Position position : openPositions) {
            positionsById.put(position.getId(), position);
        }

        List<CloseResult> results = new ArrayList<>();
        for (Order order : pendingOrders) {
            Position position = positionsById.get(order.getPositionId());
            if (position == null) {
                continue;
            }
            PriceTick tick = prices.get(position.getSymbol());
            if (tick == null) {
                continue;
            }

            BigDecimal exitPrice = pnlCalculator.exitPrice(position, tick);
            Optional<CloseReason> trigger = triggerFor(order, position, exitPrice);
            if (trigger.isEmpty()) {
                continue;
            }

            log.info(
                    "[{}] Triggered: {} {} @ {} (level {})",
                    trigger.get(),
                    position.getSymbol(),
                    position.getDirection(),
                    exitPrice.toPlainString(),
                    order.getTriggerLevel().toPlainString());
            results.add(positionCloser.close(position, exitPrice, trigger.get(), order.getId()));
        }
        return results;
    }

    /**
     * Decides whether an order fires at the given exit price.
     * Returns SL for a crossed STOP, TP for a crossed LIMIT, empty otherwise.
     */
    public Optional<CloseReason> triggerFor(Order order, Position position, BigDecimal exitPrice) {
        BigDecimal level = order.getTriggerLevel();
        if (level == null) {
            return Optional.empty();
        }
        int cmp = exitPrice.compareTo(level);

        if (order.getOrderType() == OrderType.STOP) {
            boolean crossed = position.isLong() ? cmp <= 0 : cmp >= 0;
            return crossed ? Optional.of(CloseReason.SL) : Optional.empty();
        }
        if (order.getOrderType() == OrderType.LIMIT) {
            boolean crossed = position.isLong() ? cmp >= 0 : cmp <= 0;
            return crossed ? Optional.of(CloseReason.TP) : Optional.empty();
        }
        return Optional.empty();
    }
}
