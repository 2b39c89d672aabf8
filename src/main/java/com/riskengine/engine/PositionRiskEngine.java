package com.riskengine.engine;

import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.Order;
import com.riskengine.domain.model.Position;
import com.riskengine.domain.model.PriceTick;
import com.riskengine.margin.MarginCheckResult;
import com.riskengine.margin.MarginMonitorService;
import com.riskengine.observability.RiskMetricsService;
import com.riskengine.pnl.AccountExposure;
import com.riskengine.pnl.PositionPnLCalculator;
import com.riskengine.repository.RiskDataRepository;
import com.riskengine.risk.DrawdownBreachEnforcer;
import com.riskengine.risk.RiskThresholds;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the risk engine: evaluates every open position against a price snapshot.
 *
 * <p>One admitted pass runs three phases in order:
 * <ol>
 *   <li><b>SL/TP:</b> pending stop-loss / take-profit orders are matched and fired. Positions
 *       of breached accounts are left alone.</li>
 *   <li><b>Margin:</b> open positions are re-fetched, grouped by account, and each account's
 *       margin level is checked. A stop-out ends the account's evaluation for this pass.</li>
 *   <li><b>Drawdown:</b> accounts that were not stopped out are checked for max and daily
 *       drawdown breaches.</li>
 * </ol>
 *
 * <p>Snapshots arriving within the throttle interval of the last admitted pass are dropped.
 * Quotes older than the staleness limit are treated as missing. Any failure abandons the
 * pass; nothing is carried over, the next admitted snapshot starts again from persisted state.
 */
@Service
public class PositionRiskEngine {

    private static final Logger log = LoggerFactory.getLogger(PositionRiskEngine.class);

    private final RiskDataRepository riskDataRepository;
    private final EvaluationThrottle evaluationThrottle;
    private final SlTpMatcher slTpMatcher;
    private final MarginMonitorService marginMonitorService;
    private final DrawdownBreachEnforcer drawdownBreachEnforcer;
    private final PositionPnLCalculator pnlCalculator;
    private final RiskMetricsService riskMetricsService;
    private final RiskThresholds riskThresholds;
    private final Clock clock;

    public PositionRiskEngine(
            RiskDataRepository riskDataRepository,
            EvaluationThrottle evaluationThrottle,
            SlTpMatcher slTpMatcher,
            MarginMonitorService marginMonitorService,
            DrawdownBreachEnforcer drawdownBreachEnforcer,
            PositionPnLCalculator pnlCalculator,
            RiskMetricsService riskMetricsService,
            RiskThresholds riskThresholds,
            Clock clock) {
        this.riskDataRepository = riskDataRepository;
        this.evaluationThrottle = evaluationThrottle;
        this.slTpMatcher = slTpMatcher;
        this.marginMonitorService = marginMonitorService;
        this.drawdownBreachEnforcer = drawdownBreachEnforcer;
        this.pnlCalculator = pnlCalculator;
        this.riskMetricsService = riskMetricsService;
        this.riskThresholds = riskThresholds;
        this.clock = clock;
    }

    /**
     * Evaluates a price snapshot. Never throws.
     *
     * @param prices latest quote per symbol
     * @return true if the snapshot was admitted and the pass completed
     */
    public boolean evaluate(Map<String, PriceTick> prices) {
        if (!evaluationThrottle.admit()) {
            riskMetricsService.recordThrottledTick();
            return false;
        }
        riskMetricsService.recordAdmittedTick();

        try {
            riskMetricsService.getEvaluationTimer().record(() -> runPass(prices));
            return true;
        } catch (Exception e) {
            log.error("Risk evaluation pass failed, skipping snapshot", e);
            riskMetricsService.recordFailedTick();
            return false;
        }
    }

    private void runPass(Map<String, PriceTick> snapshot) {
        Map<String, PriceTick> prices = freshPrices(snapshot);

        List<Position> openPositions = riskDataRepository.listOpenPositions();
        if (openPositions.isEmpty()) {
            return;
        }

        List<Order> pendingOrders = riskDataRepository.listPendingOrdersForOpenPositions();
        if (!pendingOrders.isEmpty()) {
            slTpMatcher.match(withoutBreachedAccounts(openPositions), pendingOrders, prices);
            openPositions = riskDataRepository.listOpenPositions();
        }

        Map<String, List<Position>> positionsByAccount = new LinkedHashMap<>();
        for (Position position : openPositions) {
            positionsByAccount
                    .computeIfAbsent(position.getAccountId(), id -> new ArrayList<>())
                    .add(position);
        }
        if (positionsByAccount.isEmpty()) {
            return;
        }

        Map<String, Account> accountsById = new HashMap<>();
        for (Account account : riskDataRepository.getAccountsByIds(positionsByAccount.keySet())) {
            accountsById.put(account.getId(), account);
        }

        for (Map.Entry<String, List<Position>> entry : positionsByAccount.entrySet()) {
            Account account = accountsById.get(entry.getKey());
            if (account == null || account.isBreached()) {
                continue;
            }

            AccountExposure exposure = pnlCalculator.exposure(account, entry.getValue(), prices);
            MarginCheckResult marginCheck = marginMonitorService.check(exposure);
            if (marginCheck.isStopOut()) {
                continue;
            }
            if (drawdownBreachEnforcer.enforce(exposure)) {
                marginMonitorService.forget(account.getId());
            }
        }
    }

    private List<Position> withoutBreachedAccounts(List<Position> positions) {
        Set<String> accountIds = new LinkedHashSet<>();
        for (Position position : positions) {
            accountIds.add(position.getAccountId());
        }
        Set<String> breached = new HashSet<>();
        for (Account account : riskDataRepository.getAccountsByIds(accountIds)) {
            if (account.isBreached()) {
                breached.add(account.getId());
            }
        }
        List<Position> eligible = new ArrayList<>(positions.size());
        for (Position position : positions) {
            if (!breached.contains(position.getAccountId())) {
                eligible.add(position);
            }
        }
        return eligible;
    }

    /** Drops quotes that are incomplete or older than the staleness limit. */
    Map<String, PriceTick> freshPrices(Map<String, PriceTick> snapshot) {
        Map<String, PriceTick> fresh = new HashMap<>();
        if (snapshot == null) {
            return fresh;
        }
        Instant now = clock.instant();
        for (Map.Entry<String, PriceTick> entry : snapshot.entrySet()) {
            PriceTick tick = entry.getValue();
            if (tick == null || tick.getBid() == null || tick.getAsk() == null) {
                continue;
            }
            if (tick.isStale(now, riskThresholds.getPriceStaleAfter())) {
                log.debug("Ignoring stale quote for {} ({})", entry.getKey(), tick.getTimestamp());
                continue;
            }
            fresh.put(entry.getKey(), tick);
        }
        return fresh;
    }
}
