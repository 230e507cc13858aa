package com.copytrader.repository.jpa;

import com.copytrader.entity.BlacklistEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface BlacklistJpaRepository extends JpaRepository<BlacklistEntity, Long> {

    Optional<BlacklistEntity> findByFollowerIdAndSymbol(String followerId, String symbol);

    @Transactional
    long deleteByFollowerIdAndSymbol(String followerId, String symbol);
}
