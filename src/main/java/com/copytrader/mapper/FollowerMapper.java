package com.copytrader.mapper;

import com.copytrader.domain.model.Follower;
import com.copytrader.entity.FollowerEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper between Follower domain model and FollowerEntity. */
@Mapper
public interface FollowerMapper {

    FollowerEntity toEntity(Follower follower);

    Follower toDomain(FollowerEntity entity);

    List<Follower> toDomainList(List<FollowerEntity> entities);
}
