package com.copytrader.engine;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Schedules the per-follower units of work produced by dispatch.
 *
 * <p>Units for different (follower, master order) keys run concurrently on the replication
 * executor. Units for the same key are chained, so a cancel or replace for a follower starts
 * only after the submit before it, including a short-sale task, has finished. A failed unit
 * is logged and does not break the chain.
 */
@Component
public class FollowerWorkSequencer {

    private static final Logger log = LoggerFactory.getLogger(FollowerWorkSequencer.class);

    private final Executor replicationExecutor;
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public FollowerWorkSequencer(@Qualifier("replicationExecutor") Executor replicationExecutor) {
        this.replicationExecutor = replicationExecutor;
    }

    /** Runs {@code unit} after every earlier unit for the same follower and master order. */
    public CompletableFuture<Void> submit(String followerId, String masterOrderId, Runnable unit) {
        return submitStage(followerId, masterOrderId, () -> {
            unit.run();
            return CompletableFuture.completedFuture(null);
        });
    }

    /**
     * Like {@link #submit} for units that hand their work off and finish later; the chain
     * waits for the returned stage.
     */
    public CompletableFuture<Void> submitStage(
            String followerId, String masterOrderId, Supplier<? extends CompletionStage<?>> unit) {
        String key = followerId + "|" + masterOrderId;
        CompletableFuture<Void> tail = tails.compute(key, (k, previous) -> {
            CompletableFuture<Void> start = previous != null ? previous : CompletableFuture.completedFuture(null);
            return start.thenComposeAsync(ignored -> runUnit(k, unit), replicationExecutor);
        });
        tail.whenComplete((result, error) -> tails.remove(key, tail));
        return tail;
    }

    /** Waits until every scheduled unit has finished; returns false on timeout. */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!tails.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            CompletableFuture<?>[] pending = tails.values().toArray(CompletableFuture[]::new);
            try {
                CompletableFuture.allOf(pending).get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                log.warn("Replication unit chain failed: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            // Finished tails are removed by their own completion callback.
            Thread.onSpinWait();
        }
        return true;
    }

    public int pendingKeys() {
        return tails.size();
    }

    private CompletableFuture<Void> runUnit(String key, Supplier<? extends CompletionStage<?>> unit) {
        CompletionStage<?> stage;
        try {
            stage = unit.get();
        } catch (RuntimeException e) {
            log.error("Replication unit failed: key={}, error={}", key, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return stage.toCompletableFuture().handle((result, error) -> {
            if (error != null) {
                log.error("Replication unit completed exceptionally: key={}, error={}", key, error.getMessage());
            }
            return null;
        });
    }
}
