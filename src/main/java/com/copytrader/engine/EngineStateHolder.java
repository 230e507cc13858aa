package com.copytrader.engine;

import com.copytrader.domain.enums.EngineState;
import com.copytrader.domain.model.OrderMapping;
import com.copytrader.domain.model.ShortSaleTask;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Engine state shared by the orchestrator, the borrow workflow and the order replicator:
 * lifecycle state, reconciliation gate, short-sale tasks, cancelled master orders and the
 * in-memory order map.
 *
 * <p>Lifecycle changes go through {@link #transition}, a compare-and-set on the current
 * {@link EngineState}. Everything else is a concurrent map or set that readers may iterate
 * without locking.
 */
@Component
public class EngineStateHolder {

    private final AtomicReference<EngineState> state = new AtomicReference<>(EngineState.STOPPED);
    private final AtomicBoolean reconciliationGateOpen = new AtomicBoolean(false);
    private final Map<String, ShortSaleTask> tasks = new ConcurrentHashMap<>();
    private final Set<String> cancelledMasterOrders = ConcurrentHashMap.newKeySet();
    private final Map<String, OrderMapping> orderMappings = new ConcurrentHashMap<>();

    // ---- Lifecycle ----

    public EngineState getState() {
        return state.get();
    }

    /** Moves from {@code expected} to {@code target}; returns false if the engine was elsewhere. */
    public boolean transition(EngineState expected, EngineState target) {
        return state.compareAndSet(expected, target);
    }

    /** Unconditional move, used by stop. Returns the state left behind. */
    public EngineState forceState(EngineState target) {
        return state.getAndSet(target);
    }

    public boolean isReconciliationGateOpen() {
        return reconciliationGateOpen.get();
    }

    public void openReconciliationGate() {
        reconciliationGateOpen.set(true);
    }

    public void closeReconciliationGate() {
        reconciliationGateOpen.set(false);
    }

    // ---- Short-sale tasks ----

    public void registerTask(ShortSaleTask task) {
        tasks.put(task.getId(), task);
    }

    public Optional<ShortSaleTask> findTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public List<ShortSaleTask> allTasks() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(ShortSaleTask::getCreatedAt))
                .toList();
    }

    public List<ShortSaleTask> activeTasks() {
        return allTasks().stream().filter(task -> !task.isTerminal()).toList();
    }

    public List<ShortSaleTask> tasksForMasterOrder(String masterOrderId) {
        return tasks.values().stream()
                .filter(task -> task.getMasterOrderId().equals(masterOrderId))
                .toList();
    }

    public int activeTaskCount() {
        return (int) tasks.values().stream().filter(task -> !task.isTerminal()).count();
    }

    // ---- Cancelled master orders ----

    public void markMasterOrderCancelled(String masterOrderId) {
        cancelledMasterOrders.add(masterOrderId);
    }

    public boolean isMasterOrderCancelled(String masterOrderId) {
        return cancelledMasterOrders.contains(masterOrderId);
    }

    // ---- Order map ----

    public Optional<OrderMapping> findMapping(String masterOrderId) {
        return Optional.ofNullable(orderMappings.get(masterOrderId));
    }

    public OrderMapping mappingFor(String masterOrderId, Function<String, OrderMapping> factory) {
        return orderMappings.computeIfAbsent(masterOrderId, factory);
    }

    public Map<String, OrderMapping> getOrderMappings() {
        return orderMappings;
    }

    /** Drops tasks, cancel marks and the in-memory order map. Persisted mappings are untouched. */
    public void resetCycleState() {
        tasks.clear();
        cancelledMasterOrders.clear();
        orderMappings.clear();
    }
}
