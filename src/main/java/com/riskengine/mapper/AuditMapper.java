package com.riskengine.mapper;

import com.riskengine.domain.model.ActivityRecord;
import com.riskengine.domain.model.EquityPoint;
import com.riskengine.entity.ActivityEntity;
import com.riskengine.entity.EquityHistoryEntity;
import org.mapstruct.Mapper;

/**
 * Maps the append-only audit rows (activity feed and equity history).
 */
@Mapper
public interface AuditMapper {

    ActivityEntity toEntity(ActivityRecord record);

    EquityHistoryEntity toEntity(EquityPoint point);
}
