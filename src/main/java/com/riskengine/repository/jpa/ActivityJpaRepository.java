package com.riskengine.repository.jpa;

import com.riskengine.entity.ActivityEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the append-only activity table.
 */
@Repository
public interface ActivityJpaRepository extends JpaRepository<ActivityEntity, Long> {

    List<ActivityEntity> findByAccountIdOrderByOccurredAtAsc(String accountId);
}
