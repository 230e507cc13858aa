package com.copytrader.repository.jpa;

import com.copytrader.entity.SymbolMultiplierEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface SymbolMultiplierJpaRepository extends JpaRepository<SymbolMultiplierEntity, Long> {

    Optional<SymbolMultiplierEntity> findByFollowerIdAndSymbol(String followerId, String symbol);

    @Transactional
    long deleteByFollowerIdAndSymbol(String followerId, String symbol);
}
