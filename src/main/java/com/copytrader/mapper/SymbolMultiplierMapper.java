package com.copytrader.mapper;

import com.copytrader.domain.model.SymbolMultiplier;
import com.copytrader.entity.SymbolMultiplierEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface SymbolMultiplierMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "updatedAt", expression = "java(java.time.Instant.now())")
    SymbolMultiplierEntity toEntity(SymbolMultiplier symbolMultiplier);

    SymbolMultiplier toDomain(SymbolMultiplierEntity entity);

    List<SymbolMultiplier> toDomainList(List<SymbolMultiplierEntity> entities);
}
