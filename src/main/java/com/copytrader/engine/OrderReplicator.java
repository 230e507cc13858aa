package com.copytrader.engine;

import com.copytrader.broker.BrokerConnectionService;
import com.copytrader.broker.BrokerSession;
import com.copytrader.domain.enums.ErrorCategory;
import com.copytrader.domain.enums.MappingStatus;
import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.model.Follower;
import com.copytrader.domain.model.FollowerOrderLink;
import com.copytrader.domain.model.FollowerOrderRequest;
import com.copytrader.domain.model.MasterOrderEvent;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.exception.BrokerException;
import com.copytrader.exception.FollowerUnreachableException;
import com.copytrader.notification.StatusNotificationSink;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one master order event into a submit, cancel or replace on one follower session.
 *
 * <p>Order type, side, prices and time-in-force are copied from the master event; only the
 * quantity is scaled through {@link MultiplierResolver}. A broker rejection marks the mapping
 * entry FAILED, emits a REJECTION notification and is rethrown to the caller. Nothing here
 * retries. An unreachable follower surfaces as {@link FollowerUnreachableException} with the
 * mapping untouched, so the caller can queue the action instead.
 */
@Component
public class OrderReplicator {

    private static final Logger log = LoggerFactory.getLogger(OrderReplicator.class);

    private final BrokerConnectionService brokerConnectionService;
    private final MultiplierResolver multiplierResolver;
    private final OrderMappingStore orderMappingStore;
    private final StatusNotificationSink statusNotificationSink;

    public OrderReplicator(
            BrokerConnectionService brokerConnectionService,
            MultiplierResolver multiplierResolver,
            OrderMappingStore orderMappingStore,
            StatusNotificationSink statusNotificationSink) {
        this.brokerConnectionService = brokerConnectionService;
        this.multiplierResolver = multiplierResolver;
        this.orderMappingStore = orderMappingStore;
        this.statusNotificationSink = statusNotificationSink;
    }

    /** Submits the master order at the follower's effective multiplier. */
    public String replicate(MasterOrderEvent event, Follower follower) {
        long quantity =
                multiplierResolver.scaledQuantity(follower.getId(), event.getSymbol(), event.getQuantity());
        return submit(event, follower, quantity);
    }

    /**
     * Submits with an already scaled quantity. Used by the borrow workflow, which scaled the
     * quantity before sizing the locate.
     *
     * @throws FollowerUnreachableException if the follower session is down
     * @throws BrokerException if the follower's broker rejects the order
     */
    public String submit(MasterOrderEvent event, Follower follower, long quantity) {
        BrokerSession session = brokerConnectionService.requireFollowerSession(follower.getId());
        FollowerOrderRequest request = FollowerOrderRequest.builder()
                .symbol(event.getSymbol())
                .side(event.getSide())
                .orderType(event.getOrderType())
                .quantity(quantity)
                .price(event.getPrice())
                .stopPrice(event.getStopPrice())
                .trailAmount(event.getTrailAmount())
                .timeInForce(event.getTimeInForce())
                .masterOrderId(event.getMasterOrderId())
                .build();

        String followerOrderId;
        try {
            followerOrderId = session.submitOrder(request);
        } catch (BrokerException e) {
            log.error(
                    "Replication rejected: follower={}, symbol={}, masterOrderId={}, qty={}, error={}",
                    follower.getId(),
                    event.getSymbol(),
                    event.getMasterOrderId(),
                    quantity,
                    e.getMessage());
            orderMappingStore.markStatus(
                    event.getMasterOrderId(), follower.getId(), MappingStatus.FAILED, e.getMessage());
            notify(event, follower.getId(), MappingStatus.FAILED, e.getMessage(), ErrorCategory.REJECTION, Map.of());
            throw e;
        }

        orderMappingStore.markActive(event.getMasterOrderId(), follower.getId(), followerOrderId, quantity);
        log.info(
                "Order replicated: follower={}, symbol={}, side={}, masterOrderId={}, followerOrderId={}, qty={}",
                follower.getId(),
                event.getSymbol(),
                event.getSide(),
                event.getMasterOrderId(),
                followerOrderId,
                quantity);
        notify(
                event,
                follower.getId(),
                MappingStatus.ACTIVE,
                null,
                null,
                Map.of("followerOrderId", followerOrderId, "quantity", quantity));
        return followerOrderId;
    }

    /**
     * Cancels the follower order mapped to the master order. Returns false when the follower
     * holds no live mapping entry for it.
     */
    public boolean cancel(MasterOrderEvent event, Follower follower) {
        Optional<FollowerOrderLink> link = orderMappingStore.findLink(event.getMasterOrderId(), follower.getId());
        if (link.isEmpty() || !link.get().getStatus().isLive()) {
            return false;
        }
        String followerOrderId = link.get().getFollowerOrderId();
        if (followerOrderId != null) {
            BrokerSession session = brokerConnectionService.requireFollowerSession(follower.getId());
            try {
                session.cancelOrder(followerOrderId);
            } catch (BrokerException e) {
                log.error(
                        "Cancel rejected: follower={}, masterOrderId={}, followerOrderId={}, error={}",
                        follower.getId(),
                        event.getMasterOrderId(),
                        followerOrderId,
                        e.getMessage());
                orderMappingStore.markStatus(
                        event.getMasterOrderId(), follower.getId(), MappingStatus.FAILED, e.getMessage());
                notify(event, follower.getId(), MappingStatus.FAILED, e.getMessage(), ErrorCategory.REJECTION, Map.of());
                throw e;
            }
        }
        orderMappingStore.markStatus(event.getMasterOrderId(), follower.getId(), MappingStatus.CANCELLED, null);
        log.info(
                "Order cancelled: follower={}, masterOrderId={}, followerOrderId={}",
                follower.getId(),
                event.getMasterOrderId(),
                followerOrderId);
        notify(event, follower.getId(), MappingStatus.CANCELLED, null, ErrorCategory.CANCELLATION, Map.of());
        return true;
    }

    /**
     * Replaces the follower order with the master's new quantity (scaled) and price. The new
     * follower order id supersedes the old one under the same mapping entry.
     */
    public Optional<String> replace(MasterOrderEvent event, Follower follower) {
        Optional<FollowerOrderLink> link = orderMappingStore.findLink(event.getMasterOrderId(), follower.getId());
        if (link.isEmpty() || !link.get().getStatus().isLive() || link.get().getFollowerOrderId() == null) {
            return Optional.empty();
        }
        long quantity =
                multiplierResolver.scaledQuantity(follower.getId(), event.getSymbol(), event.getQuantity());
        String previousId = link.get().getFollowerOrderId();
        BrokerSession session = brokerConnectionService.requireFollowerSession(follower.getId());

        String newId;
        try {
            newId = session.replaceOrder(previousId, quantity, event.getPrice());
        } catch (BrokerException e) {
            log.error(
                    "Replace rejected: follower={}, masterOrderId={}, followerOrderId={}, error={}",
                    follower.getId(),
                    event.getMasterOrderId(),
                    previousId,
                    e.getMessage());
            orderMappingStore.markStatus(
                    event.getMasterOrderId(), follower.getId(), MappingStatus.FAILED, e.getMessage());
            notify(event, follower.getId(), MappingStatus.FAILED, e.getMessage(), ErrorCategory.REJECTION, Map.of());
            throw e;
        }

        orderMappingStore.replaceFollowerOrderId(event.getMasterOrderId(), follower.getId(), newId, quantity);
        log.info(
                "Order replaced: follower={}, masterOrderId={}, {} -> {}, qty={}",
                follower.getId(),
                event.getMasterOrderId(),
                previousId,
                newId,
                quantity);
        notify(
                event,
                follower.getId(),
                MappingStatus.ACTIVE,
                null,
                null,
                Map.of("followerOrderId", newId, "replacedOrderId", previousId, "quantity", quantity));
        return Optional.of(newId);
    }

    private void notify(
            MasterOrderEvent event,
            String followerId,
            MappingStatus status,
            String error,
            ErrorCategory category,
            Map<String, Object> details) {
        statusNotificationSink.publish(StatusNotification.builder()
                .kind(NotificationKind.ORDER_REPLICATION)
                .subjectId(event.getMasterOrderId())
                .followerId(followerId)
                .symbol(event.getSymbol())
                .status(status.name())
                .error(error)
                .errorCategory(category)
                .createdAt(event.getReceivedAt())
                .updatedAt(Instant.now())
                .details(details)
                .build());
    }
}
