package com.riskengine.mapper;

import com.riskengine.domain.model.Order;
import com.riskengine.entity.OrderEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface OrderMapper {

    Order toDomain(OrderEntity entity);

    List<Order> toDomainList(List<OrderEntity> entities);
}
