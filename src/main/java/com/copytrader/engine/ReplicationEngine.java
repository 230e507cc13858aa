package com.copytrader.engine;

import com.copytrader.broker.BrokerConnectionService;
import com.copytrader.broker.BrokerSession;
import com.copytrader.domain.enums.DispatchKind;
import com.copytrader.domain.enums.EngineState;
import com.copytrader.domain.enums.ErrorCategory;
import com.copytrader.domain.enums.MappingStatus;
import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.enums.QueuedActionType;
import com.copytrader.domain.model.EngineSnapshot;
import com.copytrader.domain.model.Follower;
import com.copytrader.domain.model.FollowerOrderLink;
import com.copytrader.domain.model.FollowerOrderUpdate;
import com.copytrader.domain.model.MasterOrderEvent;
import com.copytrader.domain.model.OrderMapping;
import com.copytrader.domain.model.QueuedAction;
import com.copytrader.domain.model.ReplayResult;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.event.EventPublisherHelper;
import com.copytrader.exception.BrokerException;
import com.copytrader.exception.BusinessException;
import com.copytrader.exception.FollowerUnreachableException;
import com.copytrader.notification.StatusNotificationSink;
import com.copytrader.service.AuditService;
import com.copytrader.service.FollowerService;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Orchestrates replication: drives the STOPPED, CONNECTED, REPLICATING lifecycle and fans
 * each master event out to the followers.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #connect()} opens all broker sessions and reloads live order mappings. The
 *       engine stays CONNECTED with the reconciliation gate closed.</li>
 *   <li>{@link #startReplication()} requires the gate to have been opened by a reconciliation
 *       apply or skip, then subscribes to the master session.</li>
 *   <li>{@link #stop(String)} cancels in-flight short sales, closes every session and drops
 *       tasks, queued actions and the in-memory order map.</li>
 * </ul>
 *
 * <p>Master events arrive through a {@link MasterEventIntake}, one at a time in arrival order.
 * {@link #dispatch} resolves the {@link DispatchKind} once and schedules one unit of work per
 * follower on the {@link FollowerWorkSequencer}, so a slow follower never delays the next
 * event or the other followers. A follower that is unreachable at dispatch time gets the
 * action queued instead.
 */
@Service
public class ReplicationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReplicationEngine.class);

    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private final EngineStateHolder engineStateHolder;
    private final BrokerConnectionService brokerConnectionService;
    private final FollowerService followerService;
    private final BlacklistRegistry blacklistRegistry;
    private final MultiplierResolver multiplierResolver;
    private final ActionQueue actionQueue;
    private final OrderReplicator orderReplicator;
    private final BorrowAcquisitionManager borrowAcquisitionManager;
    private final OrderMappingStore orderMappingStore;
    private final FollowerWorkSequencer followerWorkSequencer;
    private final StatusNotificationSink statusNotificationSink;
    private final EventPublisherHelper eventPublisherHelper;
    private final AuditService auditService;
    private final Set<String> ignoredRoutes;

    private final Map<String, Boolean> lastConnectivity = new ConcurrentHashMap<>();
    private volatile MasterEventIntake intake;

    public ReplicationEngine(
            EngineStateHolder engineStateHolder,
            BrokerConnectionService brokerConnectionService,
            FollowerService followerService,
            BlacklistRegistry blacklistRegistry,
            MultiplierResolver multiplierResolver,
            ActionQueue actionQueue,
            OrderReplicator orderReplicator,
            BorrowAcquisitionManager borrowAcquisitionManager,
            OrderMappingStore orderMappingStore,
            FollowerWorkSequencer followerWorkSequencer,
            StatusNotificationSink statusNotificationSink,
            EventPublisherHelper eventPublisherHelper,
            AuditService auditService,
            @Value("${copytrader.replication.ignored-routes}") List<String> ignoredRoutes) {
        this.engineStateHolder = engineStateHolder;
        this.brokerConnectionService = brokerConnectionService;
        this.followerService = followerService;
        this.blacklistRegistry = blacklistRegistry;
        this.multiplierResolver = multiplierResolver;
        this.actionQueue = actionQueue;
        this.orderReplicator = orderReplicator;
        this.borrowAcquisitionManager = borrowAcquisitionManager;
        this.orderMappingStore = orderMappingStore;
        this.followerWorkSequencer = followerWorkSequencer;
        this.statusNotificationSink = statusNotificationSink;
        this.eventPublisherHelper = eventPublisherHelper;
        this.auditService = auditService;
        this.ignoredRoutes = ignoredRoutes.stream()
                .map(route -> route.trim().toUpperCase(Locale.ROOT))
                .filter(route -> !route.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    // ---- Lifecycle ----

    /**
     * STOPPED to CONNECTED. Opens the master session and one session per enabled follower.
     *
     * @throws BusinessException CONFLICT if the engine is not stopped
     * @throws BrokerException if the master session cannot be opened; the engine stays STOPPED
     */
    public synchronized void connect() {
        if (!engineStateHolder.transition(EngineState.STOPPED, EngineState.CONNECTED)) {
            throw BusinessException.conflict("Engine is " + engineStateHolder.getState() + ", connect requires STOPPED");
        }
        try {
            List<Follower> followers = followerService.findEnabled();
            brokerConnectionService.connectAll(followers);
            for (Follower follower : followers) {
                String followerId = follower.getId();
                brokerConnectionService
                        .getFollowerSession(followerId)
                        .ifPresent(session -> session.subscribeOrderUpdates(update -> onFollowerOrderUpdate(followerId, update)));
            }
            orderMappingStore.hydrate();
            engineStateHolder.closeReconciliationGate();
            lastConnectivity.clear();
            brokerConnectionService
                    .getFollowerIds()
                    .forEach(id -> lastConnectivity.put(id, brokerConnectionService.isFollowerConnected(id)));
        } catch (RuntimeException e) {
            log.error("Connect failed, engine back to STOPPED: {}", e.getMessage());
            brokerConnectionService.disconnectAll();
            engineStateHolder.forceState(EngineState.STOPPED);
            throw e;
        }
        log.info("Engine CONNECTED: sessions={}", brokerConnectionService.getConnectionStatus());
        eventPublisherHelper.publishEngineState(this, EngineState.STOPPED, EngineState.CONNECTED, "connect");
        auditService.log("ENGINE", "CONNECT");
    }

    /** Called by reconciliation apply or skip. */
    public synchronized void openReconciliationGate() {
        if (engineStateHolder.getState() != EngineState.CONNECTED) {
            throw BusinessException.conflict(
                    "Reconciliation requires a CONNECTED engine, current state is " + engineStateHolder.getState());
        }
        engineStateHolder.openReconciliationGate();
        log.info("Reconciliation gate opened");
    }

    /**
     * CONNECTED to REPLICATING.
     *
     * @throws BusinessException CONFLICT if not connected or reconciliation has not run
     */
    public synchronized void startReplication() {
        EngineState state = engineStateHolder.getState();
        if (state == EngineState.REPLICATING) {
            throw BusinessException.conflict("Engine is already replicating");
        }
        if (state != EngineState.CONNECTED) {
            throw BusinessException.conflict("Engine is " + state + ", connect first");
        }
        if (!engineStateHolder.isReconciliationGateOpen()) {
            throw BusinessException.conflict("Reconciliation must be applied or skipped before replication starts");
        }
        BrokerSession master = brokerConnectionService
                .getMasterSession()
                .orElseThrow(() -> new BrokerException("Master session is not open"));

        MasterEventIntake started = new MasterEventIntake(this::dispatch);
        started.start();
        intake = started;
        engineStateHolder.transition(EngineState.CONNECTED, EngineState.REPLICATING);
        master.subscribeOrderEvents(started::offer);

        log.info("Engine REPLICATING");
        eventPublisherHelper.publishEngineState(
                this, EngineState.CONNECTED, EngineState.REPLICATING, "start-replication");
        auditService.log("ENGINE", "START_REPLICATION");
    }

    /** Any state to STOPPED. Stopping a stopped engine does nothing. */
    public synchronized void stop(String reason) {
        EngineState previous = engineStateHolder.forceState(EngineState.STOPPED);
        if (previous == EngineState.STOPPED) {
            log.info("Stop requested while already STOPPED");
            return;
        }
        MasterEventIntake current = intake;
        intake = null;
        if (current != null) {
            current.stop();
        }
        borrowAcquisitionManager.cancelAll(reason, SHUTDOWN_WAIT);
        if (!followerWorkSequencer.awaitIdle(SHUTDOWN_WAIT)) {
            log.warn("Replication units still running after {}s, stopping anyway", SHUTDOWN_WAIT.toSeconds());
        }
        brokerConnectionService.disconnectAll();
        actionQueue.clear();
        engineStateHolder.resetCycleState();
        engineStateHolder.closeReconciliationGate();
        lastConnectivity.clear();

        log.info("Engine STOPPED from {}: {}", previous, reason);
        eventPublisherHelper.publishEngineState(this, previous, EngineState.STOPPED, reason);
        auditService.log("ENGINE", null, null, "STOP", Map.of("reason", reason, "previous", previous.name()));
    }

    /** Tears down the cycle and connects again; reconciliation has to run before replication resumes. */
    public synchronized void restart(String reason) {
        stop(reason);
        connect();
    }

    // ---- Dispatch ----

    /** Entry point for one master event, called from the intake thread in arrival order. */
    public void dispatch(MasterOrderEvent event) {
        if (engineStateHolder.getState() != EngineState.REPLICATING) {
            log.debug("Engine not replicating, master event dropped: {}", event.getMasterOrderId());
            return;
        }
        if (isProbe(event)) {
            log.info(
                    "Probe order ignored: masterOrderId={}, route={}, symbol={}",
                    event.getMasterOrderId(),
                    event.getRoute(),
                    event.getSymbol());
            return;
        }
        DispatchKind kind = DispatchKind.of(event);
        log.info(
                "Master event: kind={}, masterOrderId={}, symbol={}, side={}, qty={}",
                kind,
                event.getMasterOrderId(),
                event.getSymbol(),
                event.getSide(),
                event.getQuantity());
        switch (kind) {
            case PLAIN_SUBMIT, SHORT_SALE_SUBMIT -> dispatchSubmit(event, kind);
            case CANCEL -> dispatchCancel(event);
            case REPLACE -> dispatchReplace(event);
        }
    }

    private void dispatchSubmit(MasterOrderEvent event, DispatchKind kind) {
        for (Follower follower : sessionFollowers()) {
            String followerId = follower.getId();
            if (blacklistRegistry.isBlacklisted(followerId, event.getSymbol())) {
                log.debug("Blacklisted, skipped: follower={}, symbol={}", followerId, event.getSymbol());
                continue;
            }
            if (!brokerConnectionService.isFollowerConnected(followerId)) {
                log.warn(
                        "Follower unreachable, submit queued: follower={}, masterOrderId={}",
                        followerId,
                        event.getMasterOrderId());
                actionQueue.enqueue(followerId, QueuedActionType.SUBMIT, event);
                orderMappingStore.recordSkipped(event, followerId);
                continue;
            }
            scheduleSubmit(event, kind, follower);
        }
    }

    private void scheduleSubmit(MasterOrderEvent event, DispatchKind kind, Follower follower) {
        long quantity =
                multiplierResolver.scaledQuantity(follower.getId(), event.getSymbol(), event.getQuantity());
        orderMappingStore.recordPending(event, follower.getId(), quantity);
        if (kind == DispatchKind.SHORT_SALE_SUBMIT) {
            followerWorkSequencer.submitStage(
                    follower.getId(),
                    event.getMasterOrderId(),
                    () -> borrowAcquisitionManager.handleShortSale(event, follower).getCompletion());
        } else {
            followerWorkSequencer.submit(
                    follower.getId(), event.getMasterOrderId(), () -> replicateSafely(event, follower));
        }
    }

    private void dispatchCancel(MasterOrderEvent event) {
        engineStateHolder.markMasterOrderCancelled(event.getMasterOrderId());
        borrowAcquisitionManager.onMasterOrderCancelled(event.getMasterOrderId());
        forEachMappedFollower(event, QueuedActionType.CANCEL, follower -> cancelSafely(event, follower));
    }

    private void dispatchReplace(MasterOrderEvent event) {
        forEachMappedFollower(event, QueuedActionType.REPLACE, follower -> replaceSafely(event, follower));
    }

    /**
     * Cancel and replace only reach followers that hold a mapping entry for the master order.
     * A live entry on a connected follower gets the action scheduled; an unreachable follower,
     * or one whose submit is still waiting in the queue, gets it queued behind that submit.
     */
    private void forEachMappedFollower(
            MasterOrderEvent event, QueuedActionType type, Consumer<Follower> action) {
        Optional<OrderMapping> mapping = orderMappingStore.find(event.getMasterOrderId());
        if (mapping.isEmpty()) {
            log.debug("No followers mapped for masterOrderId={}, {} ignored", event.getMasterOrderId(), type);
            return;
        }
        for (FollowerOrderLink link : mapping.get().allLinks()) {
            String followerId = link.getFollowerId();
            Optional<Follower> follower = followerService.find(followerId);
            if (follower.isEmpty()) {
                continue;
            }
            if (link.getStatus() == MappingStatus.SKIPPED) {
                if (actionQueue.hasPending(followerId, event.getMasterOrderId())) {
                    actionQueue.enqueue(followerId, type, event);
                }
                continue;
            }
            if (!link.getStatus().isLive()) {
                continue;
            }
            if (!brokerConnectionService.isFollowerConnected(followerId)) {
                log.warn(
                        "Follower unreachable, {} queued: follower={}, masterOrderId={}",
                        type,
                        followerId,
                        event.getMasterOrderId());
                actionQueue.enqueue(followerId, type, event);
                continue;
            }
            followerWorkSequencer.submit(followerId, event.getMasterOrderId(), () -> action.accept(follower.get()));
        }
    }

    private void replicateSafely(MasterOrderEvent event, Follower follower) {
        try {
            orderReplicator.replicate(event, follower);
        } catch (FollowerUnreachableException e) {
            queueAfterUnreachable(event, follower, QueuedActionType.SUBMIT, e);
            orderMappingStore.markStatus(
                    event.getMasterOrderId(), follower.getId(), MappingStatus.SKIPPED, e.getMessage());
        } catch (BrokerException e) {
            log.debug("Submit failure already recorded for follower={}: {}", follower.getId(), e.getMessage());
        }
    }

    private void cancelSafely(MasterOrderEvent event, Follower follower) {
        try {
            orderReplicator.cancel(event, follower);
        } catch (FollowerUnreachableException e) {
            queueAfterUnreachable(event, follower, QueuedActionType.CANCEL, e);
        } catch (BrokerException e) {
            log.debug("Cancel failure already recorded for follower={}: {}", follower.getId(), e.getMessage());
        }
    }

    private void replaceSafely(MasterOrderEvent event, Follower follower) {
        try {
            orderReplicator.replace(event, follower);
        } catch (FollowerUnreachableException e) {
            queueAfterUnreachable(event, follower, QueuedActionType.REPLACE, e);
        } catch (BrokerException e) {
            log.debug("Replace failure already recorded for follower={}: {}", follower.getId(), e.getMessage());
        }
    }

    private void queueAfterUnreachable(
            MasterOrderEvent event, Follower follower, QueuedActionType type, FollowerUnreachableException e) {
        log.warn(
                "Follower dropped before {}, action queued: follower={}, masterOrderId={}",
                type,
                follower.getId(),
                event.getMasterOrderId());
        actionQueue.enqueue(follower.getId(), type, event);
        Instant now = Instant.now();
        statusNotificationSink.publish(StatusNotification.builder()
                .kind(NotificationKind.ORDER_REPLICATION)
                .subjectId(event.getMasterOrderId())
                .followerId(follower.getId())
                .symbol(event.getSymbol())
                .status(MappingStatus.SKIPPED.name())
                .error(e.getMessage())
                .errorCategory(ErrorCategory.CONNECTIVITY)
                .createdAt(event.getReceivedAt())
                .updatedAt(now)
                .build());
    }

    private boolean isProbe(MasterOrderEvent event) {
        return event.getRoute() != null && ignoredRoutes.contains(event.getRoute().trim().toUpperCase(Locale.ROOT));
    }

    /** Enabled followers that got a session on this connect cycle. */
    private List<Follower> sessionFollowers() {
        return followerService.findEnabled().stream()
                .filter(follower -> brokerConnectionService.getFollowerSession(follower.getId()).isPresent())
                .toList();
    }

    // ---- Follower order updates ----

    void onFollowerOrderUpdate(String followerId, FollowerOrderUpdate update) {
        orderMappingStore.applyFollowerUpdate(followerId, update).ifPresent(link -> {
            log.info(
                    "Follower order {}: follower={}, masterOrderId={}, followerOrderId={}",
                    link.getStatus(),
                    followerId,
                    link.getMasterOrderId(),
                    link.getFollowerOrderId());
            statusNotificationSink.publish(StatusNotification.builder()
                    .kind(NotificationKind.ORDER_REPLICATION)
                    .subjectId(link.getMasterOrderId())
                    .followerId(followerId)
                    .symbol(link.getSymbol())
                    .status(link.getStatus().name())
                    .error(link.getError())
                    .errorCategory(link.getStatus() == MappingStatus.FAILED ? ErrorCategory.REJECTION : null)
                    .createdAt(link.getCreatedAt())
                    .updatedAt(link.getUpdatedAt())
                    .build());
        });
    }

    // ---- Reconnect detection and queue replay ----

    /** Samples follower connectivity and announces reconnected followers that have queued actions. */
    @Scheduled(fixedDelayString = "${copytrader.replication.reconnect-check-ms:1000}")
    public void checkReconnects() {
        if (engineStateHolder.getState() == EngineState.STOPPED) {
            return;
        }
        for (String followerId : brokerConnectionService.getFollowerIds()) {
            boolean connected = brokerConnectionService.isFollowerConnected(followerId);
            Boolean before = lastConnectivity.put(followerId, connected);
            if (Boolean.TRUE.equals(before) && !connected) {
                log.warn("Follower disconnected: {}", followerId);
            } else if (Boolean.FALSE.equals(before) && connected) {
                List<QueuedAction> pending = actionQueue.pending(followerId);
                log.info("Follower reconnected: {}, queued actions={}", followerId, pending.size());
                if (!pending.isEmpty()) {
                    Instant now = Instant.now();
                    statusNotificationSink.publish(StatusNotification.builder()
                            .kind(NotificationKind.QUEUED_ACTIONS_AVAILABLE)
                            .subjectId(followerId)
                            .followerId(followerId)
                            .status("RECONNECTED")
                            .createdAt(now)
                            .updatedAt(now)
                            .details(Map.of(
                                    "count",
                                    pending.size(),
                                    "actionIds",
                                    pending.stream().map(QueuedAction::getId).toList()))
                            .build());
                }
            }
        }
    }

    /**
     * Replays queued actions for a follower in enqueue order. A queued short-sale submit goes
     * through the full borrow workflow again. Submits for symbols blacklisted since queueing are
     * dropped.
     *
     * @param actionIds actions to replay; null or empty replays the whole queue
     */
    public ReplayResult replayQueuedActions(String followerId, Collection<String> actionIds) {
        if (engineStateHolder.getState() != EngineState.REPLICATING) {
            throw BusinessException.conflict("Queued actions can only be replayed while replicating");
        }
        Follower follower = followerService.require(followerId);
        if (!brokerConnectionService.isFollowerConnected(followerId)) {
            throw new FollowerUnreachableException(followerId);
        }
        List<QueuedAction> actions = actionQueue.take(followerId, actionIds);
        List<String> replayed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (QueuedAction action : actions) {
            MasterOrderEvent event = action.getMasterEvent();
            if (action.getType() == QueuedActionType.SUBMIT) {
                if (blacklistRegistry.isBlacklisted(followerId, event.getSymbol())) {
                    skipped.add(action.getId());
                    continue;
                }
                scheduleSubmit(event, DispatchKind.of(event), follower);
            } else if (action.getType() == QueuedActionType.CANCEL) {
                followerWorkSequencer.submit(
                        followerId, event.getMasterOrderId(), () -> cancelSafely(event, follower));
            } else {
                followerWorkSequencer.submit(
                        followerId, event.getMasterOrderId(), () -> replaceSafely(event, follower));
            }
            replayed.add(action.getId());
        }

        log.info("Replayed {} queued action(s) for follower={}, skipped={}", replayed.size(), followerId, skipped);
        Instant now = Instant.now();
        statusNotificationSink.publish(StatusNotification.builder()
                .kind(NotificationKind.ACTIONS_REPLAYED)
                .subjectId(followerId)
                .followerId(followerId)
                .status("REPLAYED")
                .createdAt(now)
                .updatedAt(now)
                .details(Map.of("replayed", replayed, "skipped", skipped))
                .build());
        auditService.log("QUEUE", followerId, null, "REPLAY", Map.of("replayed", replayed, "skipped", skipped));
        return ReplayResult.builder()
                .followerId(followerId)
                .replayedActionIds(replayed)
                .skippedActionIds(skipped)
                .build();
    }

    /**
     * Drops queued actions without replaying them.
     *
     * @param actionIds actions to drop; null or empty drops the whole queue
     */
    public int discardQueuedActions(String followerId, Collection<String> actionIds) {
        followerService.require(followerId);
        int discarded = actionQueue.discard(followerId, actionIds);
        auditService.log(
                "QUEUE",
                followerId,
                null,
                "DISCARD",
                Map.of("count", discarded, "requested", actionIds == null ? List.of() : List.copyOf(actionIds)));
        return discarded;
    }

    // ---- Reads ----

    public EngineSnapshot snapshot() {
        return EngineSnapshot.builder()
                .state(engineStateHolder.getState())
                .activeTasks(engineStateHolder.activeTasks())
                .orderMap(orderMappingStore.snapshot())
                .queuedActions(actionQueue.size())
                .capturedAt(Instant.now())
                .build();
    }

    public EngineState getState() {
        return engineStateHolder.getState();
    }

    public boolean isReconciliationGateOpen() {
        return engineStateHolder.isReconciliationGateOpen();
    }

    public Map<String, Boolean> getConnectionStatus() {
        return brokerConnectionService.getConnectionStatus();
    }

    public int getIntakeBacklog() {
        MasterEventIntake current = intake;
        return current == null ? 0 : current.backlog();
    }
}
