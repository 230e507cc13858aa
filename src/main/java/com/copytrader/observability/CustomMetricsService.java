package com.copytrader.observability;

import com.copytrader.domain.enums.MappingStatus;
import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.enums.ShortSaleStatus;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.engine.ActionQueue;
import com.copytrader.engine.EngineStateHolder;
import com.copytrader.event.ReconciliationEvent;
import com.copytrader.event.ReplicationStatusEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the replication engine.
 * <ul>
 *   <li><b>replication.orders.replicated</b> (counter): follower orders placed or replaced</li>
 *   <li><b>replication.orders.failed</b> (counter): follower submits, cancels or replaces rejected</li>
 *   <li><b>replication.actions.queued</b> (counter): actions queued for unreachable followers</li>
 *   <li><b>short_sale.tasks</b> (counter, tag outcome): short-sale tasks by terminal state</li>
 *   <li><b>reconciliation.applied</b> (counter, tag mode): gate openings by apply or skip</li>
 *   <li><b>short_sale.tasks.active</b> (gauge): in-flight short-sale tasks</li>
 *   <li><b>replication.actions.pending</b> (gauge): actions waiting in the queue</li>
 * </ul>
 * Gauges are read by Micrometer on scrape; counters follow the engine's status events.
 */
@Service
public class CustomMetricsService {

    private final Counter ordersReplicatedCounter;
    private final Counter ordersFailedCounter;
    private final Counter actionsQueuedCounter;
    private final Counter shortSaleCompletedCounter;
    private final Counter shortSaleFailedCounter;
    private final Counter shortSaleCancelledCounter;
    private final Counter reconciliationAppliedCounter;
    private final Counter reconciliationSkippedCounter;

    public CustomMetricsService(
            MeterRegistry meterRegistry, EngineStateHolder engineStateHolder, ActionQueue actionQueue) {
        this.ordersReplicatedCounter = Counter.builder("replication.orders.replicated")
                .description("Follower orders placed or replaced")
                .register(meterRegistry);
        this.ordersFailedCounter = Counter.builder("replication.orders.failed")
                .description("Follower order operations rejected by the broker")
                .register(meterRegistry);
        this.actionsQueuedCounter = Counter.builder("replication.actions.queued")
                .description("Actions queued for unreachable followers")
                .register(meterRegistry);
        this.shortSaleCompletedCounter = shortSaleCounter(meterRegistry, "completed");
        this.shortSaleFailedCounter = shortSaleCounter(meterRegistry, "failed");
        this.shortSaleCancelledCounter = shortSaleCounter(meterRegistry, "cancelled");
        this.reconciliationAppliedCounter = Counter.builder("reconciliation.applied")
                .tag("mode", "apply")
                .register(meterRegistry);
        this.reconciliationSkippedCounter = Counter.builder("reconciliation.applied")
                .tag("mode", "skip")
                .register(meterRegistry);

        meterRegistry.gauge("short_sale.tasks.active", engineStateHolder, EngineStateHolder::activeTaskCount);
        meterRegistry.gauge("replication.actions.pending", actionQueue, ActionQueue::size);
    }

    @EventListener
    @Order(20)
    public void onReplicationStatus(ReplicationStatusEvent event) {
        StatusNotification notification = event.getNotification();
        if (notification.getKind() == NotificationKind.ORDER_REPLICATION) {
            if (MappingStatus.ACTIVE.name().equals(notification.getStatus())) {
                ordersReplicatedCounter.increment();
            } else if (MappingStatus.FAILED.name().equals(notification.getStatus())) {
                ordersFailedCounter.increment();
            }
        } else if (notification.getKind() == NotificationKind.ACTION_QUEUED) {
            actionsQueuedCounter.increment();
        } else if (notification.getKind() == NotificationKind.SHORT_SALE_TASK) {
            String status = notification.getStatus();
            if (ShortSaleStatus.COMPLETED.name().equals(status)) {
                shortSaleCompletedCounter.increment();
            } else if (ShortSaleStatus.FAILED.name().equals(status)) {
                shortSaleFailedCounter.increment();
            } else if (ShortSaleStatus.CANCELLED.name().equals(status)) {
                shortSaleCancelledCounter.increment();
            }
        }
    }

    @EventListener
    @Order(20)
    public void onReconciliation(ReconciliationEvent event) {
        if (event.isSkipped()) {
            reconciliationSkippedCounter.increment();
        } else {
            reconciliationAppliedCounter.increment();
        }
    }

    private static Counter shortSaleCounter(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder("short_sale.tasks")
                .description("Short-sale tasks by terminal state")
                .tag("outcome", outcome)
                .register(meterRegistry);
    }
}
