package com.copytrader.repository.jpa;

import com.copytrader.entity.FollowerEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FollowerJpaRepository extends JpaRepository<FollowerEntity, String> {

    List<FollowerEntity> findByEnabledTrue();

    Optional<FollowerEntity> findByAccountId(String accountId);
}
