package com.riskengine.repository.jpa;

import com.riskengine.domain.enums.AccountStatus;
import com.riskengine.entity.AccountEntity;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the accounts table.
 */
@Repository
public interface AccountJpaRepository extends JpaRepository<AccountEntity, String> {

    List<AccountEntity> findByIdIn(Collection<String> ids);

    /** Row lock held for the rest of the settlement transaction. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.id = :id")
    Optional<AccountEntity> findByIdForUpdate(@Param("id") String id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AccountEntity a SET a.accountStatus = com.riskengine.domain.enums.AccountStatus.BREACHED,"
            + " a.active = false, a.breachReason = :reason, a.updatedAt = :now"
            + " WHERE a.id = :id AND a.accountStatus <> com.riskengine.domain.enums.AccountStatus.BREACHED")
    int markBreached(@Param("id") String id, @Param("reason") String reason, @Param("now") Instant now);

    /** Accounts in the given statuses whose intraday baseline was not taken today. */
    @Query("SELECT a FROM AccountEntity a WHERE a.accountStatus IN :statuses"
            + " AND (a.dayStartDate IS NULL OR a.dayStartDate <> :today) ORDER BY a.id ASC")
    List<AccountEntity> findNeedingDayReset(
            @Param("statuses") Collection<AccountStatus> statuses, @Param("today") LocalDate today, Pageable pageable);
}
