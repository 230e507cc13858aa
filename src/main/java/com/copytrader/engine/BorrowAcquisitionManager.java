package com.copytrader.engine;

import com.copytrader.broker.BrokerConnectionService;
import com.copytrader.broker.BrokerSession;
import com.copytrader.domain.enums.ErrorCategory;
import com.copytrader.domain.enums.MappingStatus;
import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.enums.QueuedActionType;
import com.copytrader.domain.enums.ShortSaleStatus;
import com.copytrader.domain.model.Follower;
import com.copytrader.domain.model.LocateResult;
import com.copytrader.domain.model.MasterOrderEvent;
import com.copytrader.domain.model.ShortSaleTask;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.exception.BrokerException;
import com.copytrader.exception.FollowerUnreachableException;
import com.copytrader.exception.LocateFailedException;
import com.copytrader.exception.ResourceNotFoundException;
import com.copytrader.notification.StatusNotificationSink;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs the borrow workflow for short sales on follower accounts.
 *
 * <p>Each call to {@link #handleShortSale} creates a {@link ShortSaleTask} and hands it to the
 * short-sale executor. The worker:
 * <ol>
 *   <li>takes the fair per-(follower, symbol) lock, held until the task is terminal</li>
 *   <li>stops if the master order is already cancelled</li>
 *   <li>CHECKING: queries the follower's sell capacity</li>
 *   <li>LOCATING, only when capacity is short: takes a slot from the global locate limiter
 *       and waits for the locate no longer than the follower's locate timeout</li>
 *   <li>re-checks cancellation, then PLACING_ORDER: submits through {@link OrderReplicator}</li>
 * </ol>
 * Every transition is published to the {@link StatusNotificationSink}. A locate that fails,
 * times out or fills short ends the task FAILED with category CAPACITY and the order is never
 * submitted. A capacity query that throws, or an unreachable session, ends it FAILED with
 * category CONNECTIVITY and queues the submit for replay.
 *
 * <p>Cancellation marks intent on the task and interrupts the worker while it is still waiting
 * on the lock, the capacity query or the locate. Once the task is placing its order the
 * cancel is refused and the submit is left to finish; the engine cancels the resulting
 * follower order instead.
 *
 * <p>Symbol locks are keyed on the trimmed, upper-cased symbol and dropped once no task holds
 * or waits for them.
 */
@Component
public class BorrowAcquisitionManager {

    private static final Logger log = LoggerFactory.getLogger(BorrowAcquisitionManager.class);

    /** States in which the worker is blocked on something cancellation may cut short. */
    private static final EnumSet<ShortSaleStatus> INTERRUPTIBLE =
            EnumSet.of(ShortSaleStatus.PENDING, ShortSaleStatus.CHECKING, ShortSaleStatus.LOCATING);

    private final BrokerConnectionService brokerConnectionService;
    private final OrderReplicator orderReplicator;
    private final MultiplierResolver multiplierResolver;
    private final EngineStateHolder engineStateHolder;
    private final OrderMappingStore orderMappingStore;
    private final ActionQueue actionQueue;
    private final StatusNotificationSink statusNotificationSink;
    private final AsyncTaskExecutor shortSaleExecutor;
    private final BigDecimal defaultMaxLocatePrice;
    private final int defaultLocateTimeoutSeconds;

    private final Semaphore locateLimiter;
    private final Map<String, SymbolLock> symbolLocks = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> runningTasks = new ConcurrentHashMap<>();
    private final AtomicLong taskSequence = new AtomicLong();

    public BorrowAcquisitionManager(
            BrokerConnectionService brokerConnectionService,
            OrderReplicator orderReplicator,
            MultiplierResolver multiplierResolver,
            EngineStateHolder engineStateHolder,
            OrderMappingStore orderMappingStore,
            ActionQueue actionQueue,
            StatusNotificationSink statusNotificationSink,
            @Qualifier("shortSaleExecutor") AsyncTaskExecutor shortSaleExecutor,
            @Value("${copytrader.short-sale.max-concurrent-locates}") int maxConcurrentLocates,
            @Value("${copytrader.short-sale.default-max-locate-price}") BigDecimal defaultMaxLocatePrice,
            @Value("${copytrader.short-sale.default-locate-timeout-seconds}") int defaultLocateTimeoutSeconds) {
        this.brokerConnectionService = brokerConnectionService;
        this.orderReplicator = orderReplicator;
        this.multiplierResolver = multiplierResolver;
        this.engineStateHolder = engineStateHolder;
        this.orderMappingStore = orderMappingStore;
        this.actionQueue = actionQueue;
        this.statusNotificationSink = statusNotificationSink;
        this.shortSaleExecutor = shortSaleExecutor;
        this.defaultMaxLocatePrice = defaultMaxLocatePrice;
        this.defaultLocateTimeoutSeconds = defaultLocateTimeoutSeconds;
        this.locateLimiter = new Semaphore(maxConcurrentLocates, true);
    }

    /**
     * Starts the borrow workflow for one follower and returns immediately. The outcome is
     * observed through status notifications or {@link ShortSaleTask#getCompletion()}.
     */
    public ShortSaleTask handleShortSale(MasterOrderEvent event, Follower follower) {
        long required =
                multiplierResolver.scaledQuantity(follower.getId(), event.getSymbol(), event.getQuantity());
        ShortSaleTask task = new ShortSaleTask(
                String.format("sst-%d-%d", taskSequence.incrementAndGet(), System.currentTimeMillis()),
                follower.getId(),
                event.getSymbol(),
                event.getMasterOrderId(),
                required);
        engineStateHolder.registerTask(task);
        log.info("Short-sale task created: {}", task);
        publish(task);

        Future<?> future = shortSaleExecutor.submit(() -> run(task, event, follower));
        runningTasks.put(task.getId(), future);
        if (task.isTerminal()) {
            runningTasks.remove(task.getId());
        }
        return task;
    }

    /**
     * Cancels a task on user request.
     *
     * @return false if the task had already reached a terminal state or is placing its order
     * @throws ResourceNotFoundException if no task has this id
     */
    public boolean cancelTask(String taskId) {
        ShortSaleTask task = engineStateHolder
                .findTask(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("ShortSaleTask", taskId));
        return cancel(task, "Cancelled by user");
    }

    /**
     * Cancels every in-flight task of a master order that was cancelled on the master
     * account. The caller marks the order cancelled first, so a task that is past
     * interruption still stops at its next checkpoint.
     *
     * @return number of tasks that were still in flight
     */
    public int onMasterOrderCancelled(String masterOrderId) {
        int cancelled = 0;
        for (ShortSaleTask task : engineStateHolder.tasksForMasterOrder(masterOrderId)) {
            if (cancel(task, "Master order cancelled")) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} short-sale task(s) for masterOrderId={}", cancelled, masterOrderId);
        }
        return cancelled;
    }

    /** Cancels all in-flight tasks and waits up to {@code wait} for them to reach a terminal state. */
    public void cancelAll(String reason, Duration wait) {
        List<ShortSaleTask> active = engineStateHolder.activeTasks();
        if (active.isEmpty()) {
            return;
        }
        log.info("Cancelling {} in-flight short-sale task(s): {}", active.size(), reason);
        active.forEach(task -> cancel(task, reason));
        CompletableFuture<?>[] completions =
                active.stream().map(ShortSaleTask::getCompletion).toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(completions).get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} short-sale task(s) still running after {}ms", engineStateHolder.activeTaskCount(), wait.toMillis());
        } catch (ExecutionException e) {
            log.warn("Short-sale task completed exceptionally during cancel-all: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public int availableLocateSlots() {
        return locateLimiter.availablePermits();
    }

    /** Number of (follower, symbol) locks currently held or awaited. */
    public int symbolLockCount() {
        return symbolLocks.size();
    }

    private boolean cancel(ShortSaleTask task, String reason) {
        if (!task.requestCancel()) {
            return false;
        }
        Future<?> future = runningTasks.get(task.getId());
        if (future != null && INTERRUPTIBLE.contains(task.getStatus())) {
            future.cancel(true);
        }
        // A task the executor never started has no worker to finish it.
        if (task.getStatus() == ShortSaleStatus.PENDING) {
            finishCancelled(task, reason);
        }
        return true;
    }

    // ---- Worker ----

    private void run(ShortSaleTask task, MasterOrderEvent event, Follower follower) {
        String lockKey = follower.getId() + "|" + BlacklistRegistry.normalize(task.getSymbol());
        ReentrantLock lock = acquireSymbolLock(lockKey);
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            releaseSymbolLock(lockKey);
            finishCancelled(task, "Cancelled while waiting for symbol lock");
            Thread.currentThread().interrupt();
            runningTasks.remove(task.getId());
            return;
        }
        try {
            execute(task, event, follower);
        } catch (InterruptedException e) {
            finishCancelled(task, "Cancelled during " + task.getStatus());
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Short-sale task {} failed unexpectedly", task.getId(), e);
            finishFailed(task, e.getMessage(), ErrorCategory.REJECTION);
        } finally {
            lock.unlock();
            releaseSymbolLock(lockKey);
            runningTasks.remove(task.getId());
        }
    }

    private ReentrantLock acquireSymbolLock(String key) {
        return symbolLocks.compute(key, (k, held) -> {
                    SymbolLock symbolLock = held != null ? held : new SymbolLock();
                    symbolLock.users++;
                    return symbolLock;
                })
                .lock;
    }

    private void releaseSymbolLock(String key) {
        symbolLocks.computeIfPresent(key, (k, held) -> --held.users == 0 ? null : held);
    }

    private void execute(ShortSaleTask task, MasterOrderEvent event, Follower follower) throws InterruptedException {
        if (cancellationRequested(task)) {
            finishCancelled(task, "Cancelled before capacity check");
            return;
        }
        if (!advance(task, ShortSaleStatus.CHECKING)) {
            return;
        }

        BrokerSession session;
        long capacity;
        try {
            session = brokerConnectionService.requireFollowerSession(follower.getId());
            capacity = session.getSellCapacity(task.getSymbol());
        } catch (FollowerUnreachableException | BrokerException e) {
            failForReplay(task, event, "Sell capacity query failed: " + e.getMessage());
            return;
        }

        long deficit = Math.max(0, task.getRequiredQuantity() - capacity);
        task.setLocateDeficit(deficit);
        log.info(
                "Sell capacity checked: task={}, follower={}, symbol={}, required={}, capacity={}, deficit={}",
                task.getId(),
                follower.getId(),
                task.getSymbol(),
                task.getRequiredQuantity(),
                capacity,
                deficit);

        if (deficit > 0) {
            if (!advance(task, ShortSaleStatus.LOCATING)) {
                return;
            }
            if (!locate(task, event, follower, session, deficit)) {
                return;
            }
        }

        if (cancellationRequested(task) || !task.beginPlacing(engineStateHolder::isMasterOrderCancelled)) {
            finishCancelled(task, "Cancelled before order placement");
            return;
        }
        publish(task);

        try {
            String followerOrderId = orderReplicator.submit(event, follower, task.getRequiredQuantity());
            task.setFollowerOrderId(followerOrderId);
            finishCompleted(task);
        } catch (FollowerUnreachableException e) {
            failForReplay(task, event, e.getMessage());
        } catch (BrokerException e) {
            finishFailed(task, e.getMessage(), ErrorCategory.REJECTION);
        }
    }

    /** Returns true when the full deficit was located. Every other outcome finishes the task. */
    private boolean locate(
            ShortSaleTask task, MasterOrderEvent event, Follower follower, BrokerSession session, long deficit)
            throws InterruptedException {
        BigDecimal maxPrice =
                follower.getMaxLocatePrice() != null ? follower.getMaxLocatePrice() : defaultMaxLocatePrice;
        Duration timeout = Duration.ofSeconds(
                follower.getLocateTimeoutSeconds() != null
                        ? follower.getLocateTimeoutSeconds()
                        : defaultLocateTimeoutSeconds);

        locateLimiter.acquire();
        CompletableFuture<LocateResult> pending = null;
        try {
            if (cancellationRequested(task)) {
                finishCancelled(task, "Cancelled before locate");
                return false;
            }
            log.info(
                    "Requesting locate: task={}, follower={}, symbol={}, qty={}, maxPrice={}, timeout={}s",
                    task.getId(),
                    follower.getId(),
                    task.getSymbol(),
                    deficit,
                    maxPrice,
                    timeout.toSeconds());
            pending = session.acquireLocate(task.getSymbol(), deficit, maxPrice, timeout);
            LocateResult result = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!result.isAccepted() || result.getFilledQuantity() < deficit) {
                LocateFailedException failure = new LocateFailedException(
                        task.getSymbol(), deficit, result.getFilledQuantity(), result.getMessage());
                finishFailed(task, failure.getMessage(), ErrorCategory.CAPACITY);
                return false;
            }
            log.info(
                    "Locate filled: task={}, symbol={}, qty={}, price={}",
                    task.getId(),
                    task.getSymbol(),
                    result.getFilledQuantity(),
                    result.getPricePerShare());
            return true;
        } catch (TimeoutException e) {
            pending.cancel(true);
            finishFailed(task, "Locate timed out after " + timeout.toSeconds() + "s", ErrorCategory.CAPACITY);
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            finishFailed(task, "Locate failed: " + cause.getMessage(), ErrorCategory.CAPACITY);
            return false;
        } catch (FollowerUnreachableException e) {
            failForReplay(task, event, e.getMessage());
            return false;
        } catch (BrokerException e) {
            finishFailed(task, "Locate failed: " + e.getMessage(), ErrorCategory.CAPACITY);
            return false;
        } catch (InterruptedException e) {
            if (pending != null) {
                pending.cancel(true);
            }
            throw e;
        } finally {
            locateLimiter.release();
        }
    }

    /** Clears the interrupt flag as it reads it; the checkpoint itself carries the cancellation. */
    private boolean cancellationRequested(ShortSaleTask task) {
        return Thread.interrupted()
                || task.isCancelRequested()
                || engineStateHolder.isMasterOrderCancelled(task.getMasterOrderId());
    }

    private boolean advance(ShortSaleTask task, ShortSaleStatus target) {
        if (!task.transitionTo(target)) {
            // Only a concurrent cancellation can already have made the task terminal.
            finishCancelled(task, "Cancelled before " + target);
            return false;
        }
        publish(task);
        return true;
    }

    // ---- Terminal transitions ----

    private void finishCompleted(ShortSaleTask task) {
        if (!task.transitionTo(ShortSaleStatus.COMPLETED)) {
            return;
        }
        log.info("Short-sale task completed: {}, followerOrderId={}", task, task.getFollowerOrderId());
        publish(task);
        task.getCompletion().complete(task);
    }

    private void finishCancelled(ShortSaleTask task, String reason) {
        if (!task.transitionTo(ShortSaleStatus.CANCELLED)) {
            return;
        }
        orderMappingStore.markStatus(task.getMasterOrderId(), task.getFollowerId(), MappingStatus.CANCELLED, null);
        log.info("Short-sale task cancelled: {}, reason={}", task, reason);
        publish(task, ErrorCategory.CANCELLATION, reason);
        task.getCompletion().complete(task);
    }

    private void finishFailed(ShortSaleTask task, String error, ErrorCategory category) {
        if (!task.fail(error, category)) {
            return;
        }
        MappingStatus mappingStatus =
                category == ErrorCategory.CONNECTIVITY ? MappingStatus.SKIPPED : MappingStatus.FAILED;
        orderMappingStore.markStatus(task.getMasterOrderId(), task.getFollowerId(), mappingStatus, error);
        log.warn("Short-sale task failed: {}, category={}, error={}", task, category, error);
        publish(task);
        task.getCompletion().complete(task);
    }

    private void failForReplay(ShortSaleTask task, MasterOrderEvent event, String error) {
        actionQueue.enqueue(task.getFollowerId(), QueuedActionType.SUBMIT, event);
        finishFailed(task, error, ErrorCategory.CONNECTIVITY);
    }

    // ---- Notifications ----

    private void publish(ShortSaleTask task) {
        publish(task, task.getErrorCategory(), null);
    }

    private void publish(ShortSaleTask task, ErrorCategory category, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("masterOrderId", task.getMasterOrderId());
        details.put("requiredQuantity", task.getRequiredQuantity());
        details.put("locateDeficit", task.getLocateDeficit());
        if (task.getFollowerOrderId() != null) {
            details.put("followerOrderId", task.getFollowerOrderId());
        }
        if (reason != null) {
            details.put("reason", reason);
        }
        statusNotificationSink.publish(StatusNotification.builder()
                .kind(NotificationKind.SHORT_SALE_TASK)
                .subjectId(task.getId())
                .followerId(task.getFollowerId())
                .symbol(task.getSymbol())
                .status(task.getStatus().name())
                .error(task.getError())
                .errorCategory(category)
                .createdAt(task.getCreatedAt())
                .updatedAt(task.getUpdatedAt())
                .details(details)
                .build());
    }

    /** Fair lock plus the number of tasks holding or waiting for it; mutated only inside map compute calls. */
    private static final class SymbolLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
