package com.copytrader.reconciliation;

import com.copytrader.broker.BrokerConnectionService;
import com.copytrader.broker.BrokerSession;
import com.copytrader.domain.enums.BlacklistReason;
import com.copytrader.domain.enums.DecisionAction;
import com.copytrader.domain.enums.EngineState;
import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.enums.ReconciliationAction;
import com.copytrader.domain.enums.ReconciliationScenario;
import com.copytrader.domain.model.BrokerPosition;
import com.copytrader.domain.model.Follower;
import com.copytrader.domain.model.FollowerReconciliation;
import com.copytrader.domain.model.ReconciliationApplyResult;
import com.copytrader.domain.model.ReconciliationDecision;
import com.copytrader.domain.model.ReconciliationEntry;
import com.copytrader.domain.model.ReconciliationReport;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.domain.model.SymbolMultiplier;
import com.copytrader.engine.BlacklistRegistry;
import com.copytrader.engine.MultiplierResolver;
import com.copytrader.engine.ReplicationEngine;
import com.copytrader.event.EventPublisherHelper;
import com.copytrader.exception.BrokerException;
import com.copytrader.exception.BusinessException;
import com.copytrader.exception.ErrorCode;
import com.copytrader.notification.NotificationService;
import com.copytrader.notification.StatusNotificationSink;
import com.copytrader.service.AuditService;
import com.copytrader.service.FollowerService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One-shot comparison of master and follower positions, run between connect and replication.
 *
 * <p>{@link #compute} classifies every symbol the master holds, per follower:
 * <ul>
 *   <li>COMMON_SAME_DIRECTION -- both long or both short; proposes the inferred multiplier
 *       {@code |follower| / |master|}</li>
 *   <li>COMMON_OPPOSITE_DIRECTION -- proposes blacklisting and raises an alert</li>
 *   <li>MASTER_ONLY -- follower holds nothing; proposes blacklisting</li>
 * </ul>
 * Symbols only the follower holds are left out since the master will never trade them.
 *
 * <p>{@link #apply} writes the user-confirmed decisions to the multiplier and blacklist
 * registries, then opens the reconciliation gate and starts replication. {@link #skip} opens
 * the gate without changing anything.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private static final int MULTIPLIER_SCALE = 4;

    private final BrokerConnectionService brokerConnectionService;
    private final FollowerService followerService;
    private final MultiplierResolver multiplierResolver;
    private final BlacklistRegistry blacklistRegistry;
    private final ReplicationEngine replicationEngine;
    private final StatusNotificationSink statusNotificationSink;
    private final EventPublisherHelper eventPublisherHelper;
    private final AuditService auditService;

    public ReconciliationService(
            BrokerConnectionService brokerConnectionService,
            FollowerService followerService,
            MultiplierResolver multiplierResolver,
            BlacklistRegistry blacklistRegistry,
            ReplicationEngine replicationEngine,
            StatusNotificationSink statusNotificationSink,
            EventPublisherHelper eventPublisherHelper,
            AuditService auditService) {
        this.brokerConnectionService = brokerConnectionService;
        this.followerService = followerService;
        this.multiplierResolver = multiplierResolver;
        this.blacklistRegistry = blacklistRegistry;
        this.replicationEngine = replicationEngine;
        this.statusNotificationSink = statusNotificationSink;
        this.eventPublisherHelper = eventPublisherHelper;
        this.auditService = auditService;
    }

    /**
     * Compares master positions with each follower's. Only reads state, so repeating it with
     * unchanged positions gives the same entries. Every call re-raises the opposite-direction
     * alert for each such entry, since the operator is about to decide on it again.
     *
     * @param followerIds followers to include; null or empty means every enabled follower
     * @throws BusinessException CONFLICT if the engine is stopped
     */
    public ReconciliationReport compute(Collection<String> followerIds) {
        if (replicationEngine.getState() == EngineState.STOPPED) {
            throw BusinessException.conflict("Connect the engine before reconciling");
        }
        BrokerSession master = brokerConnectionService
                .getMasterSession()
                .orElseThrow(() -> new BrokerException("Master session is not open"));
        Map<String, Long> masterPositions = toPositionMap(master.getPositions());

        List<FollowerReconciliation> results = new ArrayList<>();
        for (Follower follower : selectFollowers(followerIds)) {
            results.add(reconcileFollower(follower, masterPositions));
        }

        log.info(
                "Reconciliation computed: masterSymbols={}, followers={}",
                masterPositions.keySet(),
                results.size());
        return ReconciliationReport.builder()
                .masterPositions(masterPositions)
                .followers(results)
                .computedAt(Instant.now())
                .build();
    }

    /**
     * Applies confirmed decisions and starts replication. All decisions are validated before
     * any is written.
     *
     * @throws BusinessException CONFLICT unless the engine is CONNECTED, VALIDATION_ERROR for
     *     a malformed decision
     */
    public ReconciliationApplyResult apply(List<ReconciliationDecision> decisions) {
        if (replicationEngine.getState() != EngineState.CONNECTED) {
            throw BusinessException.conflict(
                    "Reconciliation can only be applied while CONNECTED, engine is " + replicationEngine.getState());
        }
        List<ReconciliationDecision> safeDecisions = decisions == null ? List.of() : decisions;
        safeDecisions.forEach(this::validate);

        int overridesSet = 0;
        int overridesRemoved = 0;
        int blacklistAdded = 0;
        int blacklistRemoved = 0;
        for (ReconciliationDecision decision : safeDecisions) {
            String followerId = decision.getFollowerId();
            String symbol = decision.getSymbol();
            switch (decision.getAction()) {
                case USE_INFERRED, MANUAL -> {
                    multiplierResolver.setOverride(followerId, symbol, decision.getMultiplier());
                    overridesSet++;
                }
                case USE_DEFAULT -> {
                    if (multiplierResolver.clearOverride(followerId, symbol)) {
                        overridesRemoved++;
                    }
                }
                case KEEP -> {
                    // multiplier untouched
                }
            }
            if (decision.isBlacklist()) {
                if (blacklistRegistry.add(followerId, symbol, BlacklistReason.RECONCILIATION)) {
                    blacklistAdded++;
                }
            } else if (blacklistRegistry.remove(followerId, symbol)) {
                blacklistRemoved++;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("action", decision.getAction().name());
            details.put("blacklist", decision.isBlacklist());
            if (decision.getMultiplier() != null) {
                details.put("multiplier", decision.getMultiplier());
            }
            auditService.log("RECONCILIATION", followerId, symbol, "DECISION", details);
        }

        ReconciliationApplyResult result = ReconciliationApplyResult.builder()
                .decisionsApplied(safeDecisions.size())
                .multiplierOverridesSet(overridesSet)
                .multiplierOverridesRemoved(overridesRemoved)
                .blacklistAdded(blacklistAdded)
                .blacklistRemoved(blacklistRemoved)
                .build();
        log.info(
                "Reconciliation applied: decisions={}, overridesSet={}, overridesRemoved={}, blacklistAdded={}, blacklistRemoved={}",
                result.getDecisionsApplied(),
                overridesSet,
                overridesRemoved,
                blacklistAdded,
                blacklistRemoved);
        eventPublisherHelper.publishReconciliationApplied(this, result);

        replicationEngine.openReconciliationGate();
        replicationEngine.startReplication();
        return result;
    }

    /** Opens the gate with no changes and starts replication. */
    public void skip() {
        replicationEngine.openReconciliationGate();
        log.info("Reconciliation skipped");
        auditService.log("RECONCILIATION", "SKIP");
        eventPublisherHelper.publishReconciliationSkipped(this);
        replicationEngine.startReplication();
    }

    private FollowerReconciliation reconcileFollower(Follower follower, Map<String, Long> masterPositions) {
        FollowerReconciliation.FollowerReconciliationBuilder builder = FollowerReconciliation.builder()
                .followerId(follower.getId())
                .followerName(follower.getName())
                .baseMultiplier(follower.getBaseMultiplier());

        if (!brokerConnectionService.isFollowerConnected(follower.getId())) {
            return builder.connected(false)
                    .entries(List.of())
                    .error("Follower not connected")
                    .build();
        }

        Map<String, Long> followerPositions;
        try {
            BrokerSession session = brokerConnectionService.requireFollowerSession(follower.getId());
            followerPositions = toPositionMap(session.getPositions());
        } catch (RuntimeException e) {
            log.warn("Could not read positions for follower={}: {}", follower.getId(), e.getMessage());
            return builder.connected(true)
                    .entries(List.of())
                    .error("Position query failed: " + e.getMessage())
                    .build();
        }

        List<ReconciliationEntry> entries = new ArrayList<>();
        masterPositions.forEach((symbol, masterQuantity) -> {
            long followerQuantity = followerPositions.getOrDefault(symbol, 0L);
            ReconciliationEntry entry = classify(follower.getId(), symbol, masterQuantity, followerQuantity);
            entries.add(entry);
            if (entry.getScenario() == ReconciliationScenario.COMMON_OPPOSITE_DIRECTION) {
                notifyOppositeDirection(follower.getId(), entry);
            }
        });
        return builder.connected(true).entries(entries).build();
    }

    private ReconciliationEntry classify(String followerId, String symbol, long masterQuantity, long followerQuantity) {
        SymbolMultiplier current = multiplierResolver.resolve(followerId, symbol);
        ReconciliationEntry.ReconciliationEntryBuilder builder = ReconciliationEntry.builder()
                .symbol(symbol)
                .masterQuantity(masterQuantity)
                .followerQuantity(followerQuantity)
                .currentMultiplier(current.getMultiplier())
                .currentSource(current.getSource())
                .blacklisted(blacklistRegistry.isBlacklisted(followerId, symbol));

        if (followerQuantity == 0) {
            return builder.scenario(ReconciliationScenario.MASTER_ONLY)
                    .defaultAction(ReconciliationAction.BLACKLIST)
                    .build();
        }
        if (Long.signum(followerQuantity) != Long.signum(masterQuantity)) {
            return builder.scenario(ReconciliationScenario.COMMON_OPPOSITE_DIRECTION)
                    .defaultAction(ReconciliationAction.BLACKLIST)
                    .build();
        }
        BigDecimal inferred = BigDecimal.valueOf(Math.abs(followerQuantity))
                .divide(BigDecimal.valueOf(Math.abs(masterQuantity)), MULTIPLIER_SCALE, RoundingMode.HALF_UP);
        return builder.scenario(ReconciliationScenario.COMMON_SAME_DIRECTION)
                .inferredMultiplier(inferred)
                .defaultAction(ReconciliationAction.USE_INFERRED)
                .build();
    }

    private void notifyOppositeDirection(String followerId, ReconciliationEntry entry) {
        Instant now = Instant.now();
        statusNotificationSink.publish(StatusNotification.builder()
                .kind(NotificationKind.RECONCILIATION)
                .subjectId(followerId + ":" + entry.getSymbol())
                .followerId(followerId)
                .symbol(entry.getSymbol())
                .status(NotificationService.OPPOSITE_DIRECTION_STATUS)
                .createdAt(now)
                .updatedAt(now)
                .details(Map.of(
                        "masterQuantity", entry.getMasterQuantity(),
                        "followerQuantity", entry.getFollowerQuantity()))
                .build());
    }

    private List<Follower> selectFollowers(Collection<String> followerIds) {
        if (followerIds == null || followerIds.isEmpty()) {
            return followerService.findEnabled();
        }
        return followerIds.stream()
                .distinct()
                .map(followerService::require)
                .sorted(Comparator.comparing(Follower::getId))
                .toList();
    }

    private void validate(ReconciliationDecision decision) {
        if (decision.getFollowerId() == null || decision.getSymbol() == null || decision.getSymbol().isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Decision requires followerId and symbol");
        }
        if (decision.getAction() == null) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Decision for " + decision.getFollowerId() + "/" + decision.getSymbol() + " has no action");
        }
        followerService.require(decision.getFollowerId());
        if ((decision.getAction() == DecisionAction.USE_INFERRED || decision.getAction() == DecisionAction.MANUAL)
                && (decision.getMultiplier() == null || decision.getMultiplier().signum() <= 0)) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    decision.getAction() + " for " + decision.getFollowerId() + "/" + decision.getSymbol()
                            + " requires a positive multiplier");
        }
    }

    private static Map<String, Long> toPositionMap(List<BrokerPosition> positions) {
        Map<String, Long> map = new TreeMap<>();
        for (BrokerPosition position : positions) {
            if (position.getQuantity() != 0) {
                map.merge(position.getSymbol().trim().toUpperCase(Locale.ROOT), position.getQuantity(), Long::sum);
            }
        }
        map.values().removeIf(quantity -> quantity == 0);
        return map;
    }
}
