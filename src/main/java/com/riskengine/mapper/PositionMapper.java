package com.riskengine.mapper;

import com.riskengine.domain.model.Position;
import com.riskengine.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from PositionEntity to the Position domain model.
 * Writes go through conditional JPQL updates, never through a mapped entity.
 */
@Mapper
public interface PositionMapper {

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
