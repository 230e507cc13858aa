package com.copytrader.simulator;

import com.copytrader.broker.BrokerSession;
import com.copytrader.domain.enums.FollowerOrderState;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.model.BrokerPosition;
import com.copytrader.domain.model.FollowerOrderRequest;
import com.copytrader.domain.model.FollowerOrderUpdate;
import com.copytrader.domain.model.LocateResult;
import com.copytrader.domain.model.MasterOrderEvent;
import com.copytrader.exception.BrokerException;
import com.copytrader.exception.FollowerUnreachableException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory brokerage account implementing {@link BrokerSession}.
 *
 * <p>Keeps positions, sell capacity, locate inventory and open orders per account. A short
 * sale larger than the current sell capacity is rejected, and a successful locate adds the
 * filled shares to sell capacity, so the borrow workflow can be exercised end to end.
 *
 * <p>Besides the session contract it exposes hooks for driving a paper run: emitting master
 * order events, toggling connectivity, failing capacity queries, rejecting submissions and
 * replacing the locate behaviour.
 */
public class SimulatorBrokerSession implements BrokerSession {

    private static final Logger log = LoggerFactory.getLogger(SimulatorBrokerSession.class);

    /** Locate fee per share quoted by the simulated terminal. */
    private static final BigDecimal DEFAULT_LOCATE_PRICE = new BigDecimal("0.01");

    /** Pluggable locate behaviour, used to hold a locate open or fail it. */
    @FunctionalInterface
    public interface LocateHandler {
        CompletableFuture<LocateResult> acquire(
                String symbol, long quantity, BigDecimal maxPricePerShare, Duration timeout);
    }

    @Data
    @AllArgsConstructor
    public static class SimulatedOrder {
        private String brokerOrderId;
        private FollowerOrderRequest request;
        private FollowerOrderState state;
    }

    private final String accountId;
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicInteger orderSequence = new AtomicInteger();
    private final AtomicInteger locateCalls = new AtomicInteger();

    private final Map<String, AtomicLong> positions = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sellCapacity = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> locateInventory = new ConcurrentHashMap<>();
    private final Map<String, SimulatedOrder> orders = new ConcurrentHashMap<>();
    private final List<String> orderSequenceLog = new CopyOnWriteArrayList<>();

    private final List<Consumer<MasterOrderEvent>> orderEventListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<FollowerOrderUpdate>> orderUpdateListeners = new CopyOnWriteArrayList<>();

    private volatile BigDecimal locatePrice = DEFAULT_LOCATE_PRICE;
    private volatile boolean failCapacityQueries;
    private volatile boolean failOnConnect;
    private volatile String rejectReason;
    private volatile LocateHandler locateHandler;

    public SimulatorBrokerSession(String accountId) {
        this.accountId = accountId;
        this.locateHandler = this::defaultLocate;
    }

    @Override
    public String getAccountId() {
        return accountId;
    }

    // ---- Connection ----

    @Override
    public void connect() {
        if (failOnConnect) {
            throw new BrokerException("Simulated login failure for account " + accountId);
        }
        connected.set(true);
        log.debug("Simulator session connected: {}", accountId);
    }

    @Override
    public void disconnect() {
        connected.set(false);
        log.debug("Simulator session disconnected: {}", accountId);
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    // ---- Subscriptions ----

    @Override
    public void subscribeOrderEvents(Consumer<MasterOrderEvent> listener) {
        orderEventListeners.add(listener);
    }

    @Override
    public void subscribeOrderUpdates(Consumer<FollowerOrderUpdate> listener) {
        orderUpdateListeners.add(listener);
    }

    @Override
    public void clearSubscriptions() {
        orderEventListeners.clear();
        orderUpdateListeners.clear();
    }

    // ---- Queries ----

    @Override
    public List<BrokerPosition> getPositions() {
        requireConnected();
        List<BrokerPosition> result = new ArrayList<>();
        positions.forEach((symbol, quantity) -> {
            if (quantity.get() != 0) {
                result.add(BrokerPosition.builder()
                        .symbol(symbol)
                        .quantity(quantity.get())
                        .build());
            }
        });
        return result;
    }

    @Override
    public long getSellCapacity(String symbol) {
        requireConnected();
        if (failCapacityQueries) {
            throw new BrokerException("Simulated capacity query failure for " + symbol);
        }
        return capacity(symbol).get();
    }

    // ---- Locates ----

    @Override
    public CompletableFuture<LocateResult> acquireLocate(
            String symbol, long quantity, BigDecimal maxPricePerShare, Duration timeout) {
        requireConnected();
        locateCalls.incrementAndGet();
        return locateHandler.acquire(symbol, quantity, maxPricePerShare, timeout);
    }

    private CompletableFuture<LocateResult> defaultLocate(
            String symbol, long quantity, BigDecimal maxPricePerShare, Duration timeout) {
        if (maxPricePerShare != null && locatePrice.compareTo(maxPricePerShare) > 0) {
            return CompletableFuture.completedFuture(LocateResult.builder()
                    .symbol(symbol)
                    .requestedQuantity(quantity)
                    .filledQuantity(0)
                    .pricePerShare(locatePrice)
                    .accepted(false)
                    .message("Locate price " + locatePrice + " above limit " + maxPricePerShare)
                    .build());
        }
        AtomicLong inventory = locateInventory.get(symbol);
        long filled = quantity;
        if (inventory != null) {
            filled = Math.min(quantity, Math.max(inventory.get(), 0));
            inventory.addAndGet(-filled);
        }
        capacity(symbol).addAndGet(filled);
        return CompletableFuture.completedFuture(LocateResult.builder()
                .symbol(symbol)
                .requestedQuantity(quantity)
                .filledQuantity(filled)
                .pricePerShare(locatePrice)
                .accepted(filled > 0)
                .message(filled == quantity ? "Located" : "Partially located")
                .build());
    }

    // ---- Orders ----

    @Override
    public String submitOrder(FollowerOrderRequest request) {
        requireConnected();
        if (rejectReason != null) {
            throw new BrokerException(rejectReason);
        }
        if (request.getSide() == OrderSide.SHORT_SELL) {
            AtomicLong available = capacity(request.getSymbol());
            synchronized (available) {
                if (available.get() < request.getQuantity()) {
                    throw new BrokerException(String.format(
                            "Insufficient borrow for %s: need %d, have %d",
                            request.getSymbol(), request.getQuantity(), available.get()));
                }
                available.addAndGet(-request.getQuantity());
            }
        }
        String brokerOrderId = accountId + "-" + orderSequence.incrementAndGet();
        orders.put(brokerOrderId, new SimulatedOrder(brokerOrderId, request, FollowerOrderState.ACCEPTED));
        orderSequenceLog.add("SUBMIT " + brokerOrderId);
        log.debug(
                "Simulator submit: account={}, id={}, {} {} qty={}",
                accountId,
                brokerOrderId,
                request.getSide(),
                request.getSymbol(),
                request.getQuantity());
        return brokerOrderId;
    }

    @Override
    public void cancelOrder(String brokerOrderId) {
        requireConnected();
        SimulatedOrder order = requireOpenOrder(brokerOrderId);
        order.setState(FollowerOrderState.CANCELLED);
        orderSequenceLog.add("CANCEL " + brokerOrderId);
        publishUpdate(order, 0, "Cancelled");
    }

    @Override
    public String replaceOrder(String brokerOrderId, long quantity, BigDecimal price) {
        requireConnected();
        SimulatedOrder original = requireOpenOrder(brokerOrderId);
        original.setState(FollowerOrderState.CANCELLED);
        FollowerOrderRequest replacement = FollowerOrderRequest.builder()
                .symbol(original.getRequest().getSymbol())
                .side(original.getRequest().getSide())
                .orderType(original.getRequest().getOrderType())
                .quantity(quantity)
                .price(price)
                .stopPrice(original.getRequest().getStopPrice())
                .trailAmount(original.getRequest().getTrailAmount())
                .timeInForce(original.getRequest().getTimeInForce())
                .masterOrderId(original.getRequest().getMasterOrderId())
                .build();
        String newId = accountId + "-" + orderSequence.incrementAndGet();
        orders.put(newId, new SimulatedOrder(newId, replacement, FollowerOrderState.ACCEPTED));
        orderSequenceLog.add("REPLACE " + brokerOrderId + "->" + newId);
        return newId;
    }

    // ---- Simulation hooks ----

    /** Delivers a master order event to every subscriber, as the terminal would. */
    public void emitOrderEvent(MasterOrderEvent event) {
        orderEventListeners.forEach(listener -> listener.accept(event));
    }

    /** Fills an open order completely and moves the position. */
    public void fillOrder(String brokerOrderId) {
        SimulatedOrder order = requireOpenOrder(brokerOrderId);
        order.setState(FollowerOrderState.FILLED);
        FollowerOrderRequest request = order.getRequest();
        long signed = request.getSide() == OrderSide.BUY ? request.getQuantity() : -request.getQuantity();
        positions.computeIfAbsent(request.getSymbol(), s -> new AtomicLong()).addAndGet(signed);
        publishUpdate(order, request.getQuantity(), "Filled");
    }

    public void setConnected(boolean value) {
        connected.set(value);
    }

    public void setPosition(String symbol, long quantity) {
        positions.computeIfAbsent(symbol, s -> new AtomicLong()).set(quantity);
    }

    public void setSellCapacity(String symbol, long quantity) {
        capacity(symbol).set(quantity);
    }

    public void setLocateInventory(String symbol, long quantity) {
        locateInventory.computeIfAbsent(symbol, s -> new AtomicLong()).set(quantity);
    }

    public void setLocatePrice(BigDecimal locatePrice) {
        this.locatePrice = locatePrice;
    }

    public void setLocateHandler(LocateHandler locateHandler) {
        this.locateHandler = locateHandler != null ? locateHandler : this::defaultLocate;
    }

    public void setFailCapacityQueries(boolean failCapacityQueries) {
        this.failCapacityQueries = failCapacityQueries;
    }

    public void setFailOnConnect(boolean failOnConnect) {
        this.failOnConnect = failOnConnect;
    }

    /** Every submit is rejected with this reason while set; null accepts again. */
    public void setRejectReason(String rejectReason) {
        this.rejectReason = rejectReason;
    }

    public List<SimulatedOrder> getOrders() {
        return orders.values().stream()
                .sorted((a, b) -> Integer.compare(sequenceOf(a), sequenceOf(b)))
                .toList();
    }

    public List<String> getOrderSequenceLog() {
        return List.copyOf(orderSequenceLog);
    }

    public int getLocateCalls() {
        return locateCalls.get();
    }

    public long getCurrentSellCapacity(String symbol) {
        return capacity(symbol).get();
    }

    private AtomicLong capacity(String symbol) {
        return sellCapacity.computeIfAbsent(symbol, s -> new AtomicLong());
    }

    private SimulatedOrder requireOpenOrder(String brokerOrderId) {
        SimulatedOrder order = orders.get(brokerOrderId);
        if (order == null) {
            throw new BrokerException("Unknown order: " + brokerOrderId);
        }
        if (order.getState() != FollowerOrderState.ACCEPTED && order.getState() != FollowerOrderState.PARTIALLY_FILLED) {
            throw new BrokerException("Order not open: " + brokerOrderId + " is " + order.getState());
        }
        return order;
    }

    private void publishUpdate(SimulatedOrder order, long filledQuantity, String message) {
        FollowerOrderUpdate update = FollowerOrderUpdate.builder()
                .followerOrderId(order.getBrokerOrderId())
                .state(order.getState())
                .filledQuantity(filledQuantity)
                .message(message)
                .build();
        orderUpdateListeners.forEach(listener -> listener.accept(update));
    }

    private void requireConnected() {
        if (!connected.get()) {
            throw new FollowerUnreachableException(accountId);
        }
    }

    private static int sequenceOf(SimulatedOrder order) {
        String id = order.getBrokerOrderId();
        return Integer.parseInt(id.substring(id.lastIndexOf('-') + 1));
    }
}
