package com.copytrader.engine;

import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.enums.QueuedActionType;
import com.copytrader.domain.model.MasterOrderEvent;
import com.copytrader.domain.model.QueuedAction;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.notification.StatusNotificationSink;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * FIFO of actions per follower, held while the follower is unreachable.
 *
 * <p>Entries leave the queue only by an explicit user decision: {@link #take} for replay or
 * {@link #discard}. Both preserve enqueue order for what they return or keep, so a replay
 * reproduces the original submit, cancel and replace sequence. The queue is memory-only and
 * is cleared when the engine stops.
 */
@Component
public class ActionQueue {

    private static final Logger log = LoggerFactory.getLogger(ActionQueue.class);

    private final StatusNotificationSink statusNotificationSink;
    private final Map<String, List<QueuedAction>> queues = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public ActionQueue(StatusNotificationSink statusNotificationSink) {
        this.statusNotificationSink = statusNotificationSink;
    }

    public QueuedAction enqueue(String followerId, QueuedActionType type, MasterOrderEvent masterEvent) {
        QueuedAction action = QueuedAction.builder()
                .id(String.format("qa-%d-%d", sequence.incrementAndGet(), System.currentTimeMillis()))
                .followerId(followerId)
                .type(type)
                .masterEvent(masterEvent)
                .enqueuedAt(Instant.now())
                .build();
        int depth;
        synchronized (this) {
            List<QueuedAction> queue = queues.computeIfAbsent(followerId, id -> new ArrayList<>());
            queue.add(action);
            depth = queue.size();
        }
        log.info(
                "Action queued: id={}, follower={}, type={}, masterOrderId={}, symbol={}, depth={}",
                action.getId(),
                followerId,
                type,
                action.getMasterOrderId(),
                action.getSymbol(),
                depth);
        statusNotificationSink.publish(StatusNotification.builder()
                .kind(NotificationKind.ACTION_QUEUED)
                .subjectId(action.getId())
                .followerId(followerId)
                .symbol(action.getSymbol())
                .status(type.name())
                .createdAt(action.getEnqueuedAt())
                .updatedAt(action.getEnqueuedAt())
                .details(Map.of("masterOrderId", action.getMasterOrderId(), "depth", depth))
                .build());
        return action;
    }

    /** Snapshot of the follower's queue in enqueue order. */
    public synchronized List<QueuedAction> pending(String followerId) {
        return List.copyOf(queues.getOrDefault(followerId, List.of()));
    }

    public synchronized Map<String, List<QueuedAction>> pendingByFollower() {
        Map<String, List<QueuedAction>> copy = new LinkedHashMap<>();
        queues.forEach((followerId, queue) -> {
            if (!queue.isEmpty()) {
                copy.put(followerId, List.copyOf(queue));
            }
        });
        return copy;
    }

    /** Removes and returns every queued action for the follower, oldest first. */
    public synchronized List<QueuedAction> drain(String followerId) {
        List<QueuedAction> queue = queues.remove(followerId);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    /**
     * Removes and returns the selected actions in enqueue order. Null or empty ids select
     * the whole queue.
     */
    public synchronized List<QueuedAction> take(String followerId, Collection<String> actionIds) {
        if (actionIds == null || actionIds.isEmpty()) {
            return drain(followerId);
        }
        return removeSelected(followerId, actionIds);
    }

    /** Drops the selected actions without replay; null or empty ids drop the whole queue. */
    public synchronized int discard(String followerId, Collection<String> actionIds) {
        List<QueuedAction> removed = take(followerId, actionIds);
        if (!removed.isEmpty()) {
            log.info(
                    "Discarded {} queued action(s) for follower={}: {}",
                    removed.size(),
                    followerId,
                    removed.stream().map(QueuedAction::getId).toList());
        }
        return removed.size();
    }

    public synchronized boolean hasPending(String followerId, String masterOrderId) {
        return queues.getOrDefault(followerId, List.of()).stream()
                .anyMatch(action -> action.getMasterOrderId().equals(masterOrderId));
    }

    public synchronized int size() {
        return queues.values().stream().mapToInt(List::size).sum();
    }

    public synchronized void clear() {
        int dropped = size();
        queues.clear();
        if (dropped > 0) {
            log.info("Action queue cleared, {} action(s) dropped", dropped);
        }
    }

    private List<QueuedAction> removeSelected(String followerId, Collection<String> actionIds) {
        List<QueuedAction> queue = queues.get(followerId);
        if (queue == null) {
            return List.of();
        }
        Set<String> wanted = new HashSet<>(actionIds);
        List<QueuedAction> removed = new ArrayList<>();
        Iterator<QueuedAction> iterator = queue.iterator();
        while (iterator.hasNext()) {
            QueuedAction action = iterator.next();
            if (wanted.contains(action.getId())) {
                removed.add(action);
                iterator.remove();
            }
        }
        if (queue.isEmpty()) {
            queues.remove(followerId);
        }
        return removed;
    }
}
