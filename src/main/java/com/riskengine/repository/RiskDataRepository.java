package com.riskengine.repository;

import com.riskengine.domain.enums.AccountStatus;
import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.ActivityRecord;
import com.riskengine.domain.model.EquityPoint;
import com.riskengine.domain.model.Order;
import com.riskengine.domain.model.Position;
import com.riskengine.domain.model.PositionClosure;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Narrow port through which the risk engine reads and writes positions, orders and
 * accounts. The engine never talks to the database directly: the production adapter is
 * {@link JpaRiskDataRepository}, tests use an in-memory implementation.
 *
 * <p>State transitions are conditional. {@link #closePositionIfOpen} only flips an OPEN
 * position and {@link #markOrderFilled} / {@link #cancelPendingOrders} only touch PENDING
 * orders, so repeated or concurrent calls can never settle the same position twice.
 */
public interface RiskDataRepository {

    /** Open positions in stable fetch order (oldest first). */
    List<Position> listOpenPositions();

    /** Pending SL/TP orders whose owning position is open. */
    List<Order> listPendingOrdersForOpenPositions();

    List<Account> getAccountsByIds(Collection<String> ids);

    /**
     * Loads the account for a settlement. Implementations backed by a database lock the row
     * until the surrounding transaction ends.
     */
    Optional<Account> lockAccount(String accountId);

    /**
     * Atomically writes the close-only fields if, and only if, the position is still OPEN.
     *
     * @return true if this call closed the position, false if it was already closed or unknown
     */
    boolean closePositionIfOpen(PositionClosure closure);

    /** PENDING to FILLED. Returns false if the order already left PENDING. */
    boolean markOrderFilled(String orderId, Instant now);

    /** Cancels every still-PENDING order of the position and returns how many were cancelled. */
    int cancelPendingOrders(String positionId, Instant now);

    /** Persists the settlement balance fields of the account. */
    void updateAccount(Account account);

    /**
     * Terminal transition: BREACHED, inactive, with the reason recorded.
     *
     * @return false if the account was already breached or does not exist
     */
    boolean markAccountBreached(String accountId, String reason, Instant now);

    void insertActivity(ActivityRecord record);

    void insertEquityPoint(EquityPoint point);

    /** Accounts in the given statuses whose day-start baseline is missing or not from {@code today}. */
    List<Account> findAccountsNeedingDayReset(Collection<AccountStatus> statuses, LocalDate today);

    /** Sets day-start balance and equity to the given baseline, stamped with {@code today}. */
    void rollDayStart(String accountId, BigDecimal baseline, LocalDate today);
}
