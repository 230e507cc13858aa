package com.copytrader.broker;

import com.copytrader.domain.model.BrokerPosition;
import com.copytrader.domain.model.FollowerOrderRequest;
import com.copytrader.domain.model.FollowerOrderUpdate;
import com.copytrader.domain.model.LocateResult;
import com.copytrader.domain.model.MasterOrderEvent;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Connection to one brokerage account on the broker terminal. The engine holds one session for
 * the master and one per follower and never talks to the terminal any other way.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@code SimulatorBrokerSession} -- in-memory account for paper runs and tests</li>
 * </ul>
 *
 * <p>Query and order calls may block on I/O; the engine never issues them from the master
 * event intake thread.
 */
public interface BrokerSession {

    String getAccountId();

    // ---- Connection ----

    /**
     * Opens the session.
     *
     * @throws com.copytrader.exception.BrokerException if the terminal refuses the login
     */
    void connect();

    void disconnect();

    /** Liveness flag. May flip to false at any time without a call to {@link #disconnect()}. */
    boolean isConnected();

    // ---- Subscriptions ----

    /** Registers a listener for accepted, cancelled and replaced orders on this account. */
    void subscribeOrderEvents(Consumer<MasterOrderEvent> listener);

    /** Registers a listener for status updates of orders placed on this account. */
    void subscribeOrderUpdates(Consumer<FollowerOrderUpdate> listener);

    void clearSubscriptions();

    // ---- Queries ----

    /** Current positions, signed (negative is short). */
    List<BrokerPosition> getPositions();

    /**
     * Shares of {@code symbol} this account may sell short right now without a new locate.
     *
     * @throws com.copytrader.exception.BrokerException if the query itself fails
     */
    long getSellCapacity(String symbol);

    // ---- Locates ----

    /**
     * Requests borrowable shares. The returned future completes with the locate outcome; the
     * session itself keeps retrying with the terminal until {@code timeout} elapses.
     *
     * @param maxPricePerShare highest locate fee per share the account accepts
     */
    CompletableFuture<LocateResult> acquireLocate(
            String symbol, long quantity, BigDecimal maxPricePerShare, Duration timeout);

    // ---- Orders ----

    /**
     * Submits an order.
     *
     * @return the broker-assigned order id
     * @throws com.copytrader.exception.BrokerException if the order is rejected
     * @throws com.copytrader.exception.FollowerUnreachableException if the session is down
     */
    String submitOrder(FollowerOrderRequest request);

    /**
     * @throws com.copytrader.exception.BrokerException if the cancel is rejected
     */
    void cancelOrder(String brokerOrderId);

    /**
     * Replaces an open order with a new quantity and limit price.
     *
     * @return the broker-assigned id of the replacement order
     * @throws com.copytrader.exception.BrokerException if the replace is rejected
     */
    String replaceOrder(String brokerOrderId, long quantity, BigDecimal price);
}
