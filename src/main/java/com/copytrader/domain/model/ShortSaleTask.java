package com.copytrader.domain.model;

import com.copytrader.domain.enums.ErrorCategory;
import com.copytrader.domain.enums.ShortSaleStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import lombok.Getter;

/**
 * One short-sell replication attempt for a (follower, master order) pair.
 *
 * <p>Status changes go through {@link #transitionTo} which enforces the {@link ShortSaleStatus}
 * graph and is synchronized on the task, so a cancellation from the engine thread and a
 * transition from the worker thread never interleave. Once a terminal status is reached every
 * further transition is refused.
 *
 * <p>Tasks are memory-only. {@link #getCompletion()} completes after the terminal
 * transition has been published, which lets later work for the same master order wait for it.
 */
@Getter
public class ShortSaleTask {

    private final String id;
    private final String followerId;
    private final String symbol;
    private final String masterOrderId;
    private final long requiredQuantity;
    private final Instant createdAt;

    private volatile long locateDeficit;
    private volatile ShortSaleStatus status = ShortSaleStatus.PENDING;
    private volatile String error;
    private volatile ErrorCategory errorCategory;
    private volatile String followerOrderId;
    private volatile Instant updatedAt;
    private volatile boolean cancelRequested;

    private final List<ShortSaleStatus> history = new ArrayList<>();
    @JsonIgnore
    private final CompletableFuture<ShortSaleTask> completion = new CompletableFuture<>();

    public ShortSaleTask(String id, String followerId, String symbol, String masterOrderId, long requiredQuantity) {
        this.id = id;
        this.followerId = followerId;
        this.symbol = symbol;
        this.masterOrderId = masterOrderId;
        this.requiredQuantity = requiredQuantity;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
        this.history.add(ShortSaleStatus.PENDING);
    }

    /** Returns false, leaving the task untouched, if the transition is not allowed from the current status. */
    public synchronized boolean transitionTo(ShortSaleStatus target) {
        if (!status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        updatedAt = Instant.now();
        history.add(target);
        return true;
    }

    public synchronized boolean fail(String message, ErrorCategory category) {
        if (!transitionTo(ShortSaleStatus.FAILED)) {
            return false;
        }
        error = message;
        errorCategory = category;
        return true;
    }

    /**
     * Moves to PLACING_ORDER unless cancellation was requested for this task or its master
     * order is already known to be cancelled. Both checks happen under the task monitor.
     */
    public synchronized boolean beginPlacing(Predicate<String> masterOrderCancelled) {
        if (cancelRequested || masterOrderCancelled.test(masterOrderId)) {
            return false;
        }
        return transitionTo(ShortSaleStatus.PLACING_ORDER);
    }

    /**
     * Records cancellation intent. Refused once the task is placing its order or terminal,
     * since the follower order can no longer be stopped from here.
     */
    public synchronized boolean requestCancel() {
        if (status.isTerminal() || status == ShortSaleStatus.PLACING_ORDER) {
            return false;
        }
        cancelRequested = true;
        return true;
    }

    public void setLocateDeficit(long locateDeficit) {
        this.locateDeficit = locateDeficit;
    }

    public void setFollowerOrderId(String followerOrderId) {
        this.followerOrderId = followerOrderId;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized List<ShortSaleStatus> getHistory() {
        return List.copyOf(history);
    }

    @Override
    public String toString() {
        return String.format(
                "ShortSaleTask[id=%s, follower=%s, symbol=%s, masterOrderId=%s, qty=%d, deficit=%d, status=%s]",
                id, followerId, symbol, masterOrderId, requiredQuantity, locateDeficit, status);
    }
}
