package com.riskengine.repository.jpa;

import com.riskengine.entity.EquityHistoryEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the append-only equity_history table.
 */
@Repository
public interface EquityHistoryJpaRepository extends JpaRepository<EquityHistoryEntity, Long> {

    List<EquityHistoryEntity> findByAccountIdOrderByRecordedAtAsc(String accountId);
}
