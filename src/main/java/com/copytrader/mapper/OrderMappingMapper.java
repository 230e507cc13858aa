package com.copytrader.mapper;

import com.copytrader.domain.model.FollowerOrderLink;
import com.copytrader.entity.OrderMappingEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between FollowerOrderLink and OrderMappingEntity.
 * The entity's surrogate id is resolved by the store before saving and ignored here.
 */
@Mapper
public interface OrderMappingMapper {

    @Mapping(target = "id", ignore = true)
    OrderMappingEntity toEntity(FollowerOrderLink link);

    FollowerOrderLink toDomain(OrderMappingEntity entity);

    List<FollowerOrderLink> toDomainList(List<OrderMappingEntity> entities);
}
