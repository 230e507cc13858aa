package com.copytrader.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.copytrader.domain.enums.FollowerOrderState;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.enums.OrderType;
import com.copytrader.domain.model.BrokerPosition;
import com.copytrader.domain.model.FollowerOrderRequest;
import com.copytrader.domain.model.FollowerOrderUpdate;
import com.copytrader.domain.model.LocateResult;
import com.copytrader.exception.BrokerException;
import com.copytrader.exception.FollowerUnreachableException;
import com.copytrader.simulator.SimulatorBrokerSession;
import com.copytrader.simulator.SimulatorBrokerSessionFactory;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SimulatorBrokerSessionTest {

    private SimulatorBrokerSession session;

    @BeforeEach
    void setUp() {
        session = new SimulatorBrokerSession("ACC-F1");
        session.connect();
    }

    private static FollowerOrderRequest order(OrderSide side, long quantity) {
        return FollowerOrderRequest.builder()
                .symbol("TSLA")
                .side(side)
                .orderType(OrderType.LIMIT)
                .quantity(quantity)
                .price(new BigDecimal("200.00"))
                .masterOrderId("M1")
                .build();
    }

    @Test
    @DisplayName("a short sale beyond sell capacity is rejected")
    void shortSaleNeedsCapacity() {
        session.setSellCapacity("TSLA", 50);

        assertThatThrownBy(() -> session.submitOrder(order(OrderSide.SHORT_SELL, 100)))
                .isInstanceOf(BrokerException.class)
                .hasMessageContaining("Insufficient borrow");

        session.submitOrder(order(OrderSide.SHORT_SELL, 50));
        assertThat(session.getCurrentSellCapacity("TSLA")).isZero();
    }

    @Test
    @DisplayName("a locate adds the filled shares to sell capacity")
    void locateAddsCapacity() throws Exception {
        session.setLocateInventory("TSLA", 70);

        LocateResult result = session.acquireLocate("TSLA", 100, new BigDecimal("0.05"), Duration.ofSeconds(1))
                .get();

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getFilledQuantity()).isEqualTo(70);
        assertThat(session.getCurrentSellCapacity("TSLA")).isEqualTo(70);
        assertThat(session.getLocateCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("a locate above the price limit is refused")
    void locatePriceLimit() throws Exception {
        session.setLocatePrice(new BigDecimal("0.20"));

        LocateResult result = session.acquireLocate("TSLA", 100, new BigDecimal("0.10"), Duration.ofSeconds(1))
                .get();

        assertThat(result.isAccepted()).isFalse();
        assertThat(result.getFilledQuantity()).isZero();
    }

    @Test
    @DisplayName("fills move the position and notify subscribers")
    void fillMovesPosition() {
        List<FollowerOrderUpdate> updates = new ArrayList<>();
        session.subscribeOrderUpdates(updates::add);

        String id = session.submitOrder(order(OrderSide.BUY, 25));
        session.fillOrder(id);

        assertThat(session.getPositions())
                .extracting(BrokerPosition::getSymbol, BrokerPosition::getQuantity)
                .containsExactly(tuple("TSLA", 25L));
        assertThat(updates).singleElement().satisfies(update -> {
            assertThat(update.getFollowerOrderId()).isEqualTo(id);
            assertThat(update.getState()).isEqualTo(FollowerOrderState.FILLED);
        });
    }

    @Test
    @DisplayName("replace retires the old order and returns a new id")
    void replace() {
        String original = session.submitOrder(order(OrderSide.BUY, 25));

        String replacement = session.replaceOrder(original, 40, new BigDecimal("199.00"));

        assertThat(replacement).isNotEqualTo(original);
        assertThat(session.getOrders()).extracting(SimulatorBrokerSession.SimulatedOrder::getState)
                .containsExactly(FollowerOrderState.CANCELLED, FollowerOrderState.ACCEPTED);
        assertThatThrownBy(() -> session.cancelOrder(original)).isInstanceOf(BrokerException.class);
    }

    @Test
    @DisplayName("calls on a disconnected session report the follower unreachable")
    void disconnected() {
        session.setConnected(false);

        assertThatThrownBy(() -> session.getSellCapacity("TSLA")).isInstanceOf(FollowerUnreachableException.class);
        assertThatThrownBy(() -> session.submitOrder(order(OrderSide.BUY, 1)))
                .isInstanceOf(FollowerUnreachableException.class);
    }

    @Test
    @DisplayName("the factory keeps one session per account across reconnects")
    void factoryReusesSessions() {
        SimulatorBrokerSessionFactory factory = new SimulatorBrokerSessionFactory();

        SimulatorBrokerSession first = factory.create("ACC-F1");
        first.setPosition("AAPL", 10);

        assertThat(factory.create("ACC-F1")).isSameAs(first);
        assertThat(factory.find("ACC-F2")).isEmpty();
    }
}
