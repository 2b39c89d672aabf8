package com.riskengine.engine;

import com.riskengine.domain.enums.ActivityType;
import com.riskengine.domain.enums.CloseReason;
import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.ActivityRecord;
import com.riskengine.domain.model.CloseResult;
import com.riskengine.domain.model.EquityPoint;
import com.riskengine.domain.model.Position;
import com.riskengine.domain.model.PositionClosure;
import com.riskengine.domain.vo.Decimals;
import com.riskengine.domain.vo.Money;
import com.riskengine.event.PositionClosedEvent;
import com.riskengine.observability.RiskMetricsService;
import com.riskengine.pnl.PositionPnLCalculator;
import com.riskengine.repository.RiskDataRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Settles a single position. Shared by the SL/TP matcher, the margin stop-out and the
 * drawdown breach, so there is exactly one code path that books P&L.
 *
 * <p><b>Sequence</b> (one transaction):
 * <ol>
 *   <li>Lock the owning account row. No account: no-op.</li>
 *   <li>Compare-and-swap the position from OPEN to CLOSED with exit price, exit timestamp,
 *       realized P&L, close reason and total fees. Zero rows changed: no-op.</li>
 *   <li>Mark the triggering SL/TP order FILLED (if any), cancel every other pending order.</li>
 *   <li>Release isolated margin and book P&L and fee on the account.</li>
 *   <li>Append one activity record and one equity point.</li>
 * </ol>
 *
 * <p>Because step 2 is conditional and the account row is locked, duplicate or concurrent
 * closes of the same position settle exactly once; the loser returns a skipped result.
 * Any exception rolls back every write.
 */
@Service
public class PositionCloser {

    private static final Logger log = LoggerFactory.getLogger(PositionCloser.class);

    private final RiskDataRepository riskDataRepository;
    private final PositionPnLCalculator pnlCalculator;
    private final RiskMetricsService riskMetricsService;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public PositionCloser(
            RiskDataRepository riskDataRepository,
            PositionPnLCalculator pnlCalculator,
            RiskMetricsService riskMetricsService,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.riskDataRepository = riskDataRepository;
        this.pnlCalculator = pnlCalculator;
        this.riskMetricsService = riskMetricsService;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    @Transactional
    public CloseResult close(Position position, BigDecimal exitPrice, CloseReason closeReason) {
        return close(position, exitPrice, closeReason, null);
    }

    /**
     * @param position         the position as read at the start of the pass (may be stale)
     * @param exitPrice        bid for LONG, ask for SHORT
     * @param closeReason      SL, TP or LIQUIDATION
     * @param triggeredOrderId the SL/TP order that fired, or null for liquidations
     */
    @Transactional
    public CloseResult close(
            Position position, BigDecimal exitPrice, CloseReason closeReason, String triggeredOrderId) {
        Optional<Account> lockedAccount = riskDataRepository.lockAccount(position.getAccountId());
        if (lockedAccount.isEmpty()) {
            log.warn("[CLOSE] Account {} not found for position {}, skipping", position.getAccountId(), position.getId());
            return CloseResult.skipped(position.getId(), "account not found");
        }

        BigDecimal realizedPnl = pnlCalculator.pnlAt(position, exitPrice);
        BigDecimal closeFee = pnlCalculator.closeFee(position, exitPrice);
        BigDecimal isolatedMargin = Decimals.orZero(position.getIsolatedMargin());
        Instant now = clock.instant();

        boolean won = riskDataRepository.closePositionIfOpen(PositionClosure.builder()
                .positionId(position.getId())
                .exitPrice(exitPrice)
                .exitTimestamp(now)
                .realizedPnl(realizedPnl)
                .closeReason(closeReason)
                .totalFees(Decimals.orZero(position.getTradeFees()).add(closeFee))
                .build());
        if (!won) {
            log.info("[CLOSE] Position {} already closed, skipping", position.getId());
            return CloseResult.skipped(position.getId(), "position not open");
        }

        if (triggeredOrderId != null && !riskDataRepository.markOrderFilled(triggeredOrderId, now)) {
            log.warn("[CLOSE] Triggering order {} was no longer pending", triggeredOrderId);
        }
        int cancelled = riskDataRepository.cancelPendingOrders(position.getId(), now);

        Account account = lockedAccount.get();
        account.setAvailableMargin(Decimals.orZero(account.getAvailableMargin())
                .add(isolatedMargin)
                .add(realizedPnl)
                .subtract(closeFee));
        account.setTotalMarginRequired(Decimals.max(
                BigDecimal.ZERO, Decimals.orZero(account.getTotalMarginRequired()).subtract(isolatedMargin)));
        account.setRealizedPnl(Decimals.orZero(account.getRealizedPnl()).add(realizedPnl));
        account.setTotalPnl(Decimals.orZero(account.getTotalPnl()).add(realizedPnl));
        account.setNetWorth(Decimals.orZero(account.getNetWorth()).add(realizedPnl).subtract(closeFee));
        riskDataRepository.updateAccount(account);

        riskDataRepository.insertActivity(ActivityRecord.builder()
                .accountId(position.getAccountId())
                .type(ActivityType.CLOSED)
                .title(activityTitle(position, closeReason))
                .detail(Decimals.orZero(position.getQuantity()).stripTrailingZeros().toPlainString() + " @ "
                        + Money.usd(exitPrice).toDollars() + " | "
                        + Money.usd(realizedPnl).toSignedDollars())
                .pnl(realizedPnl)
                .occurredAt(now)
                .build());
        riskDataRepository.insertEquityPoint(EquityPoint.builder()
                .accountId(position.getAccountId())
                .equity(account.getAvailableMargin())
                .pnl(realizedPnl)
                .recordedAt(now)
                .build());

        CloseResult result = CloseResult.builder()
                .positionId(position.getId())
                .closed(true)
                .closeReason(closeReason)
                .exitPrice(exitPrice)
                .realizedPnl(realizedPnl)
                .closeFee(closeFee)
                .newNetWorth(account.getNetWorth())
                .newAvailableMargin(account.getAvailableMargin())
                .build();

        riskMetricsService.recordClose(closeReason);
        applicationEventPublisher.publishEvent(new PositionClosedEvent(this, position, result));

        log.info(
                "[CLOSE] {} {} closed @ {} | PnL: {} | Fee: {} | Reason: {} | {} orders cancelled",
                position.getSymbol(),
                position.getDirection(),
                Decimals.format(exitPrice, 2),
                Money.usd(realizedPnl).toSignedDollars(),
                closeFee.toPlainString(),
                closeReason,
                cancelled);
        return result;
    }

    private static String activityTitle(Position position, CloseReason closeReason) {
        String side = position.isLong() ? "Long" : "Short";
        return closeReason.getLabel() + " " + side + " " + position.getSymbol();
    }
}
