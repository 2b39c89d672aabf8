package com.riskengine.risk;

import com.riskengine.domain.enums.AccountStatus;
import com.riskengine.domain.model.Account;
import com.riskengine.domain.vo.Decimals;
import com.riskengine.repository.RiskDataRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Rolls the intraday drawdown baseline once per UTC day.
 *
 * <p>Every minute, tradable accounts (ACTIVE, FUNDED) whose {@code dayStartDate} is missing
 * or from a previous day get {@code dayStartBalance = dayStartEquity = netWorth} and today's
 * date. Until that happens the daily drawdown rule is skipped for the account. At most one
 * batch is rolled per run; the next run picks up the rest.
 */
@Service
public class DailyBaselineResetService {

    private static final Logger log = LoggerFactory.getLogger(DailyBaselineResetService.class);

    static final Set<AccountStatus> RESETTABLE_STATUSES = EnumSet.of(AccountStatus.ACTIVE, AccountStatus.FUNDED);

    private final RiskDataRepository riskDataRepository;
    private final Clock clock;

    public DailyBaselineResetService(RiskDataRepository riskDataRepository, Clock clock) {
        this.riskDataRepository = riskDataRepository;
        this.clock = clock;
    }

    @Scheduled(
            fixedRateString = "${riskengine.daily-reset.interval:60000}",
            initialDelayString = "${riskengine.daily-reset.initial-delay:0}")
    public void scheduledReset() {
        try {
            rollStaleBaselines();
        } catch (Exception e) {
            log.error("[DAILY_RESET] Failed to roll day-start baselines", e);
        }
    }

    /**
     * @return number of accounts rolled
     */
    public int rollStaleBaselines() {
        LocalDate today = LocalDate.now(clock);
        List<Account> accounts = riskDataRepository.findAccountsNeedingDayReset(RESETTABLE_STATUSES, today);
        for (Account account : accounts) {
            riskDataRepository.rollDayStart(account.getId(), Decimals.orZero(account.getNetWorth()), today);
        }
        if (!accounts.isEmpty()) {
            log.info("[DAILY_RESET] Rolled day-start baseline for {} accounts ({})", accounts.size(), today);
        }
        return accounts.size();
    }
}
