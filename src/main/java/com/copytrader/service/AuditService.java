package com.copytrader.service;

import com.copytrader.entity.AuditLogEntity;
import com.copytrader.mapper.JsonHelper;
import com.copytrader.repository.jpa.AuditLogJpaRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Audit trail for user decisions and configuration changes.
 *
 * <p>Every command that changes what the engine will do next (reconciliation apply or skip,
 * multiplier override, blacklist edit, queue replay or discard, engine lifecycle command) is
 * recorded here with a JSON details column. A failed audit write is logged and swallowed so
 * it never aborts the command being audited.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogJpaRepository auditLogJpaRepository;

    public AuditService(AuditLogJpaRepository auditLogJpaRepository) {
        this.auditLogJpaRepository = auditLogJpaRepository;
    }

    public void log(String eventType, String action) {
        log(eventType, null, null, action, null);
    }

    public void log(String eventType, String followerId, String symbol, String action, Map<String, Object> details) {
        AuditLogEntity auditLogEntity = AuditLogEntity.builder()
                .eventType(eventType)
                .followerId(followerId)
                .symbol(symbol)
                .action(action)
                .detailsJson(buildDetailsJson(details))
                .timestamp(Instant.now())
                .build();
        try {
            auditLogJpaRepository.save(auditLogEntity);
        } catch (RuntimeException e) {
            log.warn("Failed to write audit entry {}/{}: {}", eventType, action, e.getMessage());
        }
    }

    /** Latest hundred entries, or every entry for one follower when {@code followerId} is given. */
    public List<AuditLogEntity> recent(String followerId) {
        if (followerId == null || followerId.isBlank()) {
            return auditLogJpaRepository.findTop100ByOrderByTimestampDesc();
        }
        return auditLogJpaRepository.findByFollowerIdOrderByTimestampDesc(followerId);
    }

    private String buildDetailsJson(Map<String, Object> details) {
        try {
            return JsonHelper.detailsToJson(details);
        } catch (IllegalStateException e) {
            log.warn("Failed to serialize audit details to JSON: {}", e.getMessage());
            return null;
        }
    }
}
