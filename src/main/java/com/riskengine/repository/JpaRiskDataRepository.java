package com.riskengine.repository;

import com.riskengine.domain.enums.AccountStatus;
import com.riskengine.domain.enums.PositionStatus;
import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.ActivityRecord;
import com.riskengine.domain.model.EquityPoint;
import com.riskengine.domain.model.Order;
import com.riskengine.domain.model.Position;
import com.riskengine.domain.model.PositionClosure;
import com.riskengine.entity.AccountEntity;
import com.riskengine.exception.ErrorCode;
import com.riskengine.exception.SettlementException;
import com.riskengine.mapper.AccountMapper;
import com.riskengine.mapper.AuditMapper;
import com.riskengine.mapper.OrderMapper;
import com.riskengine.mapper.PositionMapper;
import com.riskengine.repository.jpa.AccountJpaRepository;
import com.riskengine.repository.jpa.ActivityJpaRepository;
import com.riskengine.repository.jpa.EquityHistoryJpaRepository;
import com.riskengine.repository.jpa.OrderJpaRepository;
import com.riskengine.repository.jpa.PositionJpaRepository;
import com.riskengine.risk.RiskThresholds;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link RiskDataRepository} backed by Spring Data JPA.
 *
 * <p>Reads are capped by {@code riskengine.scan.max-open-positions} and
 * {@code riskengine.scan.max-pending-orders} so a single pass has a bounded cost.
 * Writes join the caller's transaction (the position closer runs one transaction per
 * settlement); conditional updates return affected-row counts which are turned into booleans.
 */
@Repository
public class JpaRiskDataRepository implements RiskDataRepository {

    private final PositionJpaRepository positionJpaRepository;
    private final OrderJpaRepository orderJpaRepository;
    private final AccountJpaRepository accountJpaRepository;
    private final ActivityJpaRepository activityJpaRepository;
    private final EquityHistoryJpaRepository equityHistoryJpaRepository;
    private final PositionMapper positionMapper;
    private final OrderMapper orderMapper;
    private final AccountMapper accountMapper;
    private final AuditMapper auditMapper;
    private final RiskThresholds riskThresholds;
    private final Clock clock;

    public JpaRiskDataRepository(
            PositionJpaRepository positionJpaRepository,
            OrderJpaRepository orderJpaRepository,
            AccountJpaRepository accountJpaRepository,
            ActivityJpaRepository activityJpaRepository,
            EquityHistoryJpaRepository equityHistoryJpaRepository,
            PositionMapper positionMapper,
            OrderMapper orderMapper,
            AccountMapper accountMapper,
            AuditMapper auditMapper,
            RiskThresholds riskThresholds,
            Clock clock) {
        this.positionJpaRepository = positionJpaRepository;
        this.orderJpaRepository = orderJpaRepository;
        this.accountJpaRepository = accountJpaRepository;
        this.activityJpaRepository = activityJpaRepository;
        this.equityHistoryJpaRepository = equityHistoryJpaRepository;
        this.positionMapper = positionMapper;
        this.orderMapper = orderMapper;
        this.accountMapper = accountMapper;
        this.auditMapper = auditMapper;
        this.riskThresholds = riskThresholds;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> listOpenPositions() {
        return positionMapper.toDomainList(positionJpaRepository.findByStatusOrdered(
                PositionStatus.OPEN, PageRequest.of(0, riskThresholds.getMaxOpenPositionsPerScan())));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> listPendingOrdersForOpenPositions() {
        return orderMapper.toDomainList(orderJpaRepository.findPendingForOpenPositions(
                PageRequest.of(0, riskThresholds.getMaxPendingOrdersPerScan())));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> getAccountsByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return accountMapper.toDomainList(accountJpaRepository.findByIdIn(ids));
    }

    @Override
    @Transactional
    public Optional<Account> lockAccount(String accountId) {
        return accountJpaRepository.findByIdForUpdate(accountId).map(accountMapper::toDomain);
    }

    @Override
    @Transactional
    public boolean closePositionIfOpen(PositionClosure closure) {
        int updated = positionJpaRepository.closeIfOpen(
                closure.getPositionId(),
                closure.getExitPrice(),
                closure.getExitTimestamp(),
                closure.getRealizedPnl(),
                closure.getCloseReason(),
                closure.getTotalFees());
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean markOrderFilled(String orderId, Instant now) {
        return orderJpaRepository.markFilledIfPending(orderId, now) == 1;
    }

    @Override
    @Transactional
    public int cancelPendingOrders(String positionId, Instant now) {
        return orderJpaRepository.cancelPendingByPositionId(positionId, now);
    }

    @Override
    @Transactional
    public void updateAccount(Account account) {
        AccountEntity entity = accountJpaRepository
                .findById(account.getId())
                .orElseThrow(() -> new SettlementException(
                        ErrorCode.SETTLEMENT_FAILED,
                        "Account " + account.getId() + " disappeared during settlement",
                        Map.of("accountId", account.getId())));
        entity.setAvailableMargin(account.getAvailableMargin());
        entity.setTotalMarginRequired(account.getTotalMarginRequired());
        entity.setRealizedPnl(account.getRealizedPnl());
        entity.setTotalPnl(account.getTotalPnl());
        entity.setNetWorth(account.getNetWorth());
        entity.setUpdatedAt(clock.instant());
        accountJpaRepository.save(entity);
    }

    @Override
    @Transactional
    public boolean markAccountBreached(String accountId, String reason, Instant now) {
        return accountJpaRepository.markBreached(accountId, reason, now) == 1;
    }

    @Override
    @Transactional
    public void insertActivity(ActivityRecord record) {
        activityJpaRepository.save(auditMapper.toEntity(record));
    }

    @Override
    @Transactional
    public void insertEquityPoint(EquityPoint point) {
        equityHistoryJpaRepository.save(auditMapper.toEntity(point));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> findAccountsNeedingDayReset(Collection<AccountStatus> statuses, LocalDate today) {
        return accountMapper.toDomainList(accountJpaRepository.findNeedingDayReset(
                statuses, today, PageRequest.of(0, riskThresholds.getDailyResetBatchSize())));
    }

    @Override
    @Transactional
    public void rollDayStart(String accountId, BigDecimal baseline, LocalDate today) {
        accountJpaRepository.findById(accountId).ifPresent(entity -> {
            entity.setDayStartBalance(baseline);
            entity.setDayStartEquity(baseline);
            entity.setDayStartDate(today);
            entity.setUpdatedAt(clock.instant());
            accountJpaRepository.save(entity);
        });
    }
}
