package com.copytrader.engine;

import com.copytrader.domain.enums.MappingStatus;
import com.copytrader.domain.model.FollowerOrderLink;
import com.copytrader.domain.model.FollowerOrderUpdate;
import com.copytrader.domain.model.MasterOrderEvent;
import com.copytrader.domain.model.OrderMapping;
import com.copytrader.entity.OrderMappingEntity;
import com.copytrader.mapper.OrderMappingMapper;
import com.copytrader.repository.jpa.OrderMappingJpaRepository;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Order map backed by {@link EngineStateHolder} in memory and the order_mappings table on disk.
 *
 * <p>Each change replaces the follower's link with an updated copy and writes the row
 * through. A failed write is logged and the in-memory map stays authoritative for the running
 * cycle. On connect, rows still PENDING, ACTIVE or SKIPPED are reloaded so cancel and replace
 * events arriving after a restart still resolve.
 */
@Component
public class OrderMappingStore {

    private static final Logger log = LoggerFactory.getLogger(OrderMappingStore.class);

    private static final EnumSet<MappingStatus> RELOADED_STATUSES =
            EnumSet.of(MappingStatus.PENDING, MappingStatus.ACTIVE, MappingStatus.SKIPPED);

    private final EngineStateHolder engineStateHolder;
    private final OrderMappingJpaRepository orderMappingJpaRepository;
    private final OrderMappingMapper orderMappingMapper;

    public OrderMappingStore(
            EngineStateHolder engineStateHolder,
            OrderMappingJpaRepository orderMappingJpaRepository,
            OrderMappingMapper orderMappingMapper) {
        this.engineStateHolder = engineStateHolder;
        this.orderMappingJpaRepository = orderMappingJpaRepository;
        this.orderMappingMapper = orderMappingMapper;
    }

    public int hydrate() {
        List<FollowerOrderLink> links =
                orderMappingMapper.toDomainList(orderMappingJpaRepository.findByStatusIn(RELOADED_STATUSES));
        for (FollowerOrderLink link : links) {
            engineStateHolder
                    .mappingFor(link.getMasterOrderId(), id -> new OrderMapping(id, link.getSymbol()))
                    .put(link);
        }
        log.info("Order map hydrated with {} live link(s)", links.size());
        return links.size();
    }

    public Optional<OrderMapping> find(String masterOrderId) {
        return engineStateHolder.findMapping(masterOrderId);
    }

    public Optional<FollowerOrderLink> findLink(String masterOrderId, String followerId) {
        return find(masterOrderId).flatMap(mapping -> mapping.link(followerId));
    }

    public FollowerOrderLink recordPending(MasterOrderEvent event, String followerId, long quantity) {
        return create(event, followerId, MappingStatus.PENDING, quantity);
    }

    public FollowerOrderLink recordSkipped(MasterOrderEvent event, String followerId) {
        return create(event, followerId, MappingStatus.SKIPPED, 0);
    }

    public Optional<FollowerOrderLink> markActive(
            String masterOrderId, String followerId, String followerOrderId, long quantity) {
        return update(masterOrderId, followerId, link -> link.toBuilder()
                .followerOrderId(followerOrderId)
                .quantity(quantity)
                .status(MappingStatus.ACTIVE)
                .error(null)
                .build());
    }

    public Optional<FollowerOrderLink> markStatus(
            String masterOrderId, String followerId, MappingStatus status, String error) {
        return update(masterOrderId, followerId, link -> link.toBuilder()
                .status(status)
                .error(error)
                .build());
    }

    /** A replace supersedes the follower order id under the same mapping entry. */
    public Optional<FollowerOrderLink> replaceFollowerOrderId(
            String masterOrderId, String followerId, String newFollowerOrderId, long quantity) {
        return update(masterOrderId, followerId, link -> link.toBuilder()
                .followerOrderId(newFollowerOrderId)
                .quantity(quantity)
                .build());
    }

    /**
     * Settles the link holding {@code update.followerOrderId} on the given follower. Updates
     * that do not settle a status (accepted, partial fill) or do not match a link are ignored.
     */
    public Optional<FollowerOrderLink> applyFollowerUpdate(String followerId, FollowerOrderUpdate update) {
        Optional<MappingStatus> settled = update.getState().toMappingStatus();
        if (settled.isEmpty()) {
            return Optional.empty();
        }
        for (OrderMapping mapping : engineStateHolder.getOrderMappings().values()) {
            Optional<FollowerOrderLink> link = mapping.link(followerId);
            if (link.isPresent()
                    && update.getFollowerOrderId().equals(link.get().getFollowerOrderId())
                    && link.get().getStatus().isLive()) {
                return markStatus(
                        mapping.getMasterOrderId(),
                        followerId,
                        settled.get(),
                        settled.get() == MappingStatus.FAILED ? update.getMessage() : null);
            }
        }
        return Optional.empty();
    }

    /** Master order id to follower links, for snapshot and status reads. */
    public Map<String, List<FollowerOrderLink>> snapshot() {
        Map<String, List<FollowerOrderLink>> copy = new LinkedHashMap<>();
        engineStateHolder.getOrderMappings().forEach((id, mapping) -> copy.put(id, List.copyOf(mapping.allLinks())));
        return copy;
    }

    private FollowerOrderLink create(MasterOrderEvent event, String followerId, MappingStatus status, long quantity) {
        Instant now = Instant.now();
        FollowerOrderLink link = FollowerOrderLink.builder()
                .masterOrderId(event.getMasterOrderId())
                .followerId(followerId)
                .symbol(event.getSymbol())
                .status(status)
                .quantity(quantity)
                .createdAt(now)
                .updatedAt(now)
                .build();
        engineStateHolder
                .mappingFor(event.getMasterOrderId(), id -> new OrderMapping(id, event.getSymbol()))
                .put(link);
        persist(link);
        return link;
    }

    private Optional<FollowerOrderLink> update(
            String masterOrderId, String followerId, UnaryOperator<FollowerOrderLink> change) {
        Optional<OrderMapping> mapping = find(masterOrderId);
        Optional<FollowerOrderLink> current = mapping.flatMap(m -> m.link(followerId));
        if (current.isEmpty()) {
            log.warn("No mapping entry to update: masterOrderId={}, follower={}", masterOrderId, followerId);
            return Optional.empty();
        }
        FollowerOrderLink updated = change.apply(current.get());
        updated.setUpdatedAt(Instant.now());
        mapping.get().put(updated);
        persist(updated);
        return Optional.of(updated);
    }

    private void persist(FollowerOrderLink link) {
        try {
            OrderMappingEntity entity = orderMappingMapper.toEntity(link);
            orderMappingJpaRepository
                    .findByMasterOrderIdAndFollowerId(link.getMasterOrderId(), link.getFollowerId())
                    .ifPresent(existing -> entity.setId(existing.getId()));
            orderMappingJpaRepository.save(entity);
        } catch (RuntimeException e) {
            log.error(
                    "Failed to persist order mapping: masterOrderId={}, follower={}, status={}",
                    link.getMasterOrderId(),
                    link.getFollowerId(),
                    link.getStatus(),
                    e);
        }
    }
}
