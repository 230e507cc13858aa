package com.copytrader.mapper;

import com.copytrader.domain.model.BlacklistEntry;
import com.copytrader.entity.BlacklistEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface BlacklistMapper {

    @Mapping(target = "id", ignore = true)
    BlacklistEntity toEntity(BlacklistEntry entry);

    BlacklistEntry toDomain(BlacklistEntity entity);

    List<BlacklistEntry> toDomainList(List<BlacklistEntity> entities);
}
