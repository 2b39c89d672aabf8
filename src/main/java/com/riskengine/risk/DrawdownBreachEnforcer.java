package com.riskengine.risk;

import com.riskengine.domain.enums.AccountStatus;
import com.riskengine.domain.enums.ActivityType;
import com.riskengine.domain.enums.CloseReason;
import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.ActivityRecord;
import com.riskengine.domain.vo.Decimals;
import com.riskengine.domain.vo.Money;
import com.riskengine.engine.PositionCloser;
import com.riskengine.event.RiskEvent;
import com.riskengine.event.RiskEventType;
import com.riskengine.event.RiskLevel;
import com.riskengine.observability.RiskMetricsService;
import com.riskengine.pnl.AccountExposure;
import com.riskengine.pnl.PositionExposure;
import com.riskengine.repository.RiskDataRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Enforces the account-level drawdown limits. A breach is terminal: every open position is
 * liquidated and the account is moved to BREACHED and deactivated, after which the engine
 * never evaluates it again.
 *
 * <p>Two independent rules, checked in order:
 * <ul>
 *   <li><b>Max drawdown:</b> {@code (startingBalance - equity) / startingBalance >= maxDrawdownPct}.
 *       Skipped when the starting balance is not positive.</li>
 *   <li><b>Daily drawdown:</b> only when the day-start baseline belongs to today (UTC).
 *       {@code floor = max(dayStartBalance, dayStartEquity) x (1 - dailyDrawdownPct)};
 *       breached when equity is at or below the floor.</li>
 * </ul>
 *
 * <p>A baseline from a previous day is never used: until the daily reset job rolls it, the
 * daily rule is simply not evaluated.
 */
@Service
public class DrawdownBreachEnforcer {

    private static final Logger log = LoggerFactory.getLogger(DrawdownBreachEnforcer.class);

    private final PositionCloser positionCloser;
    private final RiskDataRepository riskDataRepository;
    private final RiskThresholds riskThresholds;
    private final RiskMetricsService riskMetricsService;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public DrawdownBreachEnforcer(
            PositionCloser positionCloser,
            RiskDataRepository riskDataRepository,
            RiskThresholds riskThresholds,
            RiskMetricsService riskMetricsService,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.positionCloser = positionCloser;
        this.riskDataRepository = riskDataRepository;
        this.riskThresholds = riskThresholds;
        this.riskMetricsService = riskMetricsService;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /**
     * Checks both drawdown rules and, on breach, liquidates and disables the account.
     *
     * @return true if the account was breached by this call
     */
    public boolean enforce(AccountExposure exposure) {
        Account account = exposure.getAccount();
        if (account.isBreached()) {
            return false;
        }

        Optional<String> reason = breachReason(account, exposure.getEquity(), LocalDate.now(clock));
        if (reason.isEmpty()) {
            return false;
        }

        breach(exposure, reason.get());
        return true;
    }

    /**
     * Evaluates the drawdown rules without side effects.
     *
     * @return the human-readable breach reason, or empty if within limits
     */
    public Optional<String> breachReason(Account account, BigDecimal equity, LocalDate today) {
        BigDecimal startingBalance = Decimals.orZero(account.getStartingBalance());
        if (Decimals.isPositive(startingBalance)) {
            BigDecimal drawdown = Decimals.divide(startingBalance.subtract(equity), startingBalance);
            if (drawdown.compareTo(riskThresholds.getMaxDrawdownPct()) >= 0) {
                return Optional.of("Max drawdown reached (" + Decimals.toPercent(drawdown).toPlainString()
                        + "%). Equity: " + Money.usd(equity).toDollars());
            }
        }

        if (!Objects.equals(account.getDayStartDate(), today)
                || account.getDayStartBalance() == null
                || account.getDayStartEquity() == null) {
            return Optional.empty();
        }

        BigDecimal dailyBase = Decimals.max(account.getDayStartBalance(), account.getDayStartEquity());
        if (!Decimals.isPositive(dailyBase)) {
            return Optional.empty();
        }

        BigDecimal dailyFloor = dailyBase.multiply(BigDecimal.ONE.subtract(riskThresholds.getDailyDrawdownPct()));
        if (equity.compareTo(dailyFloor) <= 0) {
            BigDecimal dailyLoss = Decimals.divide(dailyBase.subtract(equity), dailyBase);
            return Optional.of("Daily drawdown reached (" + Decimals.toPercent(dailyLoss).toPlainString()
                    + "% loss today). Equity: " + Money.usd(equity).toDollars()
                    + ", Floor: " + Money.usd(dailyFloor).toDollars());
        }
        return Optional.empty();
    }

    private void breach(AccountExposure exposure, String reason) {
        Account account = exposure.getAccount();
        log.error("[BREACH] Account {}: {}", account.getId(), reason);

        int closed = 0;
        for (PositionExposure position : exposure.getPositions()) {
            if (!position.isPriced()) {
                log.warn(
                        "[BREACH] No price for {} (position {}), left open",
                        position.getPosition().getSymbol(),
                        position.getPosition().getId());
                continue;
            }
            if (positionCloser
                    .close(position.getPosition(), position.getExitPrice(), CloseReason.LIQUIDATION)
                    .isClosed()) {
                closed++;
            }
        }

        Instant now = clock.instant();
        if (!riskDataRepository.markAccountBreached(account.getId(), reason, now)) {
            log.info("[BREACH] Account {} already breached", account.getId());
            return;
        }
        account.setAccountStatus(AccountStatus.BREACHED);
        account.setActive(false);
        account.setBreachReason(reason);

        riskDataRepository.insertActivity(ActivityRecord.builder()
                .accountId(account.getId())
                .type(ActivityType.BREACH)
                .title("Account Breached")
                .detail(reason)
                .occurredAt(now)
                .build());

        riskMetricsService.recordBreach();
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                account.getId(),
                RiskEventType.ACCOUNT_BREACHED,
                RiskLevel.CRITICAL,
                reason,
                Map.of(
                        "equity", exposure.getEquity(),
                        "positionsClosed", closed)));

        log.error("[BREACH] Account {} disabled, {} positions liquidated", account.getId(), closed);
    }
}
