package com.copytrader.repository.jpa;

import com.copytrader.entity.AuditLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Audit trail of operator decisions and blacklist changes. */
@Repository
public interface AuditLogJpaRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findTop100ByOrderByTimestampDesc();

    List<AuditLogEntity> findByFollowerIdOrderByTimestampDesc(String followerId);
}
