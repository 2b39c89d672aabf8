package com.riskengine.margin;

import com.riskengine.domain.enums.CloseReason;
import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.CloseResult;
import com.riskengine.domain.vo.Decimals;
import com.riskengine.engine.PositionCloser;
import com.riskengine.event.RiskEvent;
import com.riskengine.event.RiskEventType;
import com.riskengine.event.RiskLevel;
import com.riskengine.observability.RiskMetricsService;
import com.riskengine.pnl.AccountExposure;
import com.riskengine.pnl.PositionExposure;
import com.riskengine.risk.RiskThresholds;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Checks an account's margin level on every evaluation pass.
 *
 * <p>{@code marginLevel = equity / totalMarginRequired x 100}. Two threshold levels:
 * <ul>
 *   <li><b>MARGIN CALL (&lt;= 100%):</b> warning only. Publishes a WARNING {@link RiskEvent};
 *       account and positions are left untouched.</li>
 *   <li><b>STOP OUT (&lt;= 50%):</b> the single worst position (lowest unrealized P&L) is
 *       liquidated. Publishes a CRITICAL {@link RiskEvent}. The next tick re-evaluates with
 *       fresh state, so a deep account sheds one position per pass.</li>
 * </ul>
 *
 * <p>Every pass at or below the call level is logged at DEBUG; the WARNING event and metric
 * fire once per account (deduplication via a concurrent set). An account leaves the set when
 * its level recovers, when it is stopped out, or when it is breached ({@link #forget}).
 */
@Service
public class MarginMonitorService {

    private static final Logger log = LoggerFactory.getLogger(MarginMonitorService.class);

    private final PositionCloser positionCloser;
    private final RiskThresholds riskThresholds;
    private final RiskMetricsService riskMetricsService;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final Set<String> marginCallsRaised = ConcurrentHashMap.newKeySet();

    public MarginMonitorService(
            PositionCloser positionCloser,
            RiskThresholds riskThresholds,
            RiskMetricsService riskMetricsService,
            ApplicationEventPublisher applicationEventPublisher) {
        this.positionCloser = positionCloser;
        this.riskThresholds = riskThresholds;
        this.riskMetricsService = riskMetricsService;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public MarginCheckResult check(AccountExposure exposure) {
        Account account = exposure.getAccount();
        BigDecimal totalMarginRequired = Decimals.orZero(account.getTotalMarginRequired());
        if (!Decimals.isPositive(totalMarginRequired)) {
            return MarginCheckResult.notApplicable();
        }

        BigDecimal marginLevel = marginLevel(exposure.getEquity(), totalMarginRequired);

        if (marginLevel.compareTo(riskThresholds.getStopOutLevel()) <= 0) {
            marginCallsRaised.remove(account.getId());
            stopOut(exposure, marginLevel);
            return MarginCheckResult.of(MarginCheckResult.State.STOP_OUT, marginLevel);
        }

        if (marginLevel.compareTo(riskThresholds.getMarginCallLevel()) <= 0) {
            log.debug("[MARGIN_CALL] Account {} margin level {}%", account.getId(), Decimals.format(marginLevel, 2));
            if (marginCallsRaised.add(account.getId())) {
                raiseMarginCall(exposure, marginLevel);
            }
            return MarginCheckResult.of(MarginCheckResult.State.MARGIN_CALL, marginLevel);
        }

        marginCallsRaised.remove(account.getId());
        return MarginCheckResult.of(MarginCheckResult.State.HEALTHY, marginLevel);
    }

    /** Drops any margin-call state held for the account. */
    public void forget(String accountId) {
        marginCallsRaised.remove(accountId);
    }

    public static BigDecimal marginLevel(BigDecimal equity, BigDecimal totalMarginRequired) {
        return Decimals.divide(equity, totalMarginRequired).multiply(Decimals.HUNDRED);
    }

    /**
     * Ranks positions ascending by unrealized P&L. The sort is stable, so ties keep fetch
     * order. Unpriced positions rank at zero.
     */
    public static PositionExposure worstPosition(List<PositionExposure> positions) {
        List<PositionExposure> ranked = new ArrayList<>(positions);
        ranked.sort(Comparator.comparing(PositionExposure::getUnrealizedPnl));
        return ranked.isEmpty() ? null : ranked.get(0);
    }

    private void stopOut(AccountExposure exposure, BigDecimal marginLevel) {
        Account account = exposure.getAccount();
        String level = Decimals.format(marginLevel, 2);
        PositionExposure worst = worstPosition(exposure.getPositions());

        if (worst == null) {
            return;
        }
        if (!worst.isPriced()) {
            log.warn(
                    "[STOP_OUT] Account {} at {}%: worst position {} has no price, nothing closed",
                    account.getId(),
                    level,
                    worst.getPosition().getId());
            return;
        }

        log.error(
                "[STOP_OUT] Account {} margin level {}%: liquidating {} {} (PnL {})",
                account.getId(),
                level,
                worst.getPosition().getSymbol(),
                worst.getPosition().getDirection(),
                Decimals.format(worst.getUnrealizedPnl(), 2));

        CloseResult result = positionCloser.close(worst.getPosition(), worst.getExitPrice(), CloseReason.LIQUIDATION);
        if (!result.isClosed()) {
            log.info(
                    "[STOP_OUT] Position {} not liquidated: {}",
                    worst.getPosition().getId(),
                    result.getSkipReason());
            return;
        }
        riskMetricsService.recordStopOut();
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                account.getId(),
                RiskEventType.STOP_OUT,
                RiskLevel.CRITICAL,
                "Stop out at " + level + "% margin level. Liquidated " + worst.getPosition().getSymbol(),
                Map.of(
                        "marginLevel", marginLevel,
                        "threshold", riskThresholds.getStopOutLevel(),
                        "equity", exposure.getEquity(),
                        "positionId", worst.getPosition().getId())));
    }

    private void raiseMarginCall(AccountExposure exposure, BigDecimal marginLevel) {
        Account account = exposure.getAccount();
        String level = Decimals.format(marginLevel, 2);
        log.warn("[MARGIN_CALL] Account {} margin level {}%", account.getId(), level);

        riskMetricsService.recordMarginCall();
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                account.getId(),
                RiskEventType.MARGIN_CALL,
                RiskLevel.WARNING,
                "Margin call at " + level + "% margin level. Equity: " + Decimals.format(exposure.getEquity(), 2),
                Map.of(
                        "marginLevel", marginLevel,
                        "threshold", riskThresholds.getMarginCallLevel(),
                        "equity", exposure.getEquity())));
    }
}
