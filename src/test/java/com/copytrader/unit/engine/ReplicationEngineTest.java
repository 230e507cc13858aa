package com.copytrader.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.copytrader.domain.enums.BlacklistReason;
import com.copytrader.domain.enums.EngineState;
import com.copytrader.domain.enums.MappingStatus;
import com.copytrader.domain.enums.MasterEventType;
import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.enums.OrderType;
import com.copytrader.domain.enums.QueuedActionType;
import com.copytrader.domain.enums.ShortSaleStatus;
import com.copytrader.domain.model.Follower;
import com.copytrader.domain.model.MasterOrderEvent;
import com.copytrader.domain.model.QueuedAction;
import com.copytrader.domain.model.ReplayResult;
import com.copytrader.domain.model.ShortSaleTask;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.exception.BrokerException;
import com.copytrader.exception.BusinessException;
import com.copytrader.exception.ErrorCode;
import com.copytrader.exception.FollowerUnreachableException;
import com.copytrader.simulator.SimulatorBrokerSession;
import com.copytrader.support.EngineTestFixture;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReplicationEngineTest {

    private EngineTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineTestFixture();
        fixture.addFollower("F1", "1");
        fixture.addFollower("F2", "2");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private List<SimulatorBrokerSession.SimulatedOrder> orders(String followerId) {
        return fixture.follower(followerId).getOrders();
    }

    private void dispatchAndWait(MasterOrderEvent event) {
        fixture.emit(event);
        fixture.awaitIdle();
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("connect, reconcile, replicate, stop")
        void fullCycle() {
            fixture.replicationEngine.connect();
            assertThat(fixture.replicationEngine.getState()).isEqualTo(EngineState.CONNECTED);
            assertThat(fixture.replicationEngine.isReconciliationGateOpen()).isFalse();
            assertThat(fixture.replicationEngine.getConnectionStatus())
                    .containsEntry("master", true)
                    .containsEntry("F1", true)
                    .containsEntry("F2", true);

            fixture.reconciliationService.skip();
            assertThat(fixture.replicationEngine.getState()).isEqualTo(EngineState.REPLICATING);

            fixture.replicationEngine.stop("manual");
            assertThat(fixture.replicationEngine.getState()).isEqualTo(EngineState.STOPPED);
            assertThat(fixture.replicationEngine.getConnectionStatus()).containsEntry("master", false);
            assertThat(fixture.notifications(NotificationKind.ENGINE_STATE))
                    .extracting(StatusNotification::getStatus)
                    .containsExactly("CONNECTED", "REPLICATING", "STOPPED");
        }

        @Test
        @DisplayName("connect twice is a conflict")
        void connectTwice() {
            fixture.replicationEngine.connect();

            assertThatThrownBy(() -> fixture.replicationEngine.connect())
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.CONFLICT);
        }

        @Test
        @DisplayName("replication cannot start before connect or before reconciliation")
        void startGuards() {
            assertThatThrownBy(() -> fixture.replicationEngine.startReplication())
                    .isInstanceOf(BusinessException.class);

            fixture.replicationEngine.connect();

            assertThatThrownBy(() -> fixture.replicationEngine.startReplication())
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("Reconciliation");
        }

        @Test
        @DisplayName("starting twice is a conflict")
        void startTwice() {
            fixture.start();

            assertThatThrownBy(() -> fixture.replicationEngine.startReplication())
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("already");
        }

        @Test
        @DisplayName("a master login failure leaves the engine STOPPED")
        void masterLoginFails() {
            fixture.master().setFailOnConnect(true);

            assertThatThrownBy(() -> fixture.replicationEngine.connect()).isInstanceOf(BrokerException.class);

            assertThat(fixture.replicationEngine.getState()).isEqualTo(EngineState.STOPPED);
        }

        @Test
        @DisplayName("stop on a stopped engine is a no-op")
        void stopIdempotent() {
            fixture.replicationEngine.stop("first");
            fixture.replicationEngine.stop("second");

            assertThat(fixture.notifications(NotificationKind.ENGINE_STATE)).isEmpty();
        }

        @Test
        @DisplayName("stop drops queued actions and the in-memory order map")
        void stopClearsCycleState() {
            fixture.start();
            fixture.follower("F2").setConnected(false);
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));
            assertThat(fixture.actionQueue.size()).isEqualTo(1);

            fixture.replicationEngine.stop("end of day");

            assertThat(fixture.actionQueue.size()).isZero();
            assertThat(fixture.replicationEngine.snapshot().getOrderMap()).isEmpty();
        }

        @Test
        @DisplayName("restart reconnects and closes the reconciliation gate")
        void restart() {
            fixture.start();

            fixture.replicationEngine.restart("scheduled");

            assertThat(fixture.replicationEngine.getState()).isEqualTo(EngineState.CONNECTED);
            assertThat(fixture.replicationEngine.isReconciliationGateOpen()).isFalse();
        }
    }

    @Nested
    @DisplayName("Submit dispatch")
    class SubmitDispatch {

        @BeforeEach
        void start() {
            fixture.start();
        }

        @Test
        @DisplayName("each follower gets the order at its own multiplier")
        void scaledPerFollower() {
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));

            assertThat(orders("F1")).singleElement()
                    .satisfies(order -> assertThat(order.getRequest().getQuantity()).isEqualTo(100));
            assertThat(orders("F2")).singleElement()
                    .satisfies(order -> assertThat(order.getRequest().getQuantity()).isEqualTo(200));
            assertThat(fixture.orderMappingStore.find("M1").orElseThrow().allLinks())
                    .extracting(link -> link.getStatus())
                    .containsOnly(MappingStatus.ACTIVE);
        }

        @Test
        @DisplayName("a symbol override changes only that follower and symbol")
        void symbolOverride() {
            fixture.multiplierResolver.setOverride("F2", "AAPL", new BigDecimal("0.5"));

            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));
            dispatchAndWait(EngineTestFixture.accepted("M2", "MSFT", OrderSide.BUY, 100));

            assertThat(orders("F2"))
                    .extracting(order -> order.getRequest().getQuantity())
                    .containsExactly(50L, 200L);
        }

        @Test
        @DisplayName("a blacklisted symbol is never sent to that follower")
        void blacklisted() {
            fixture.blacklistRegistry.add("F1", "AAPL", BlacklistReason.MANUAL);

            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));

            assertThat(orders("F1")).isEmpty();
            assertThat(orders("F2")).hasSize(1);
            assertThat(fixture.orderMappingStore.findLink("M1", "F1")).isEmpty();
        }

        @Test
        @DisplayName("a disabled follower is skipped")
        void disabledFollower() {
            fixture.followerService.update(
                    "F1",
                    Follower.builder().enabled(false).build());

            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));

            assertThat(orders("F1")).isEmpty();
            assertThat(orders("F2")).hasSize(1);
        }

        @Test
        @DisplayName("an unreachable follower gets the submit queued and the others proceed")
        void unreachableQueued() {
            fixture.follower("F2").setConnected(false);

            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));

            assertThat(orders("F1")).hasSize(1);
            List<QueuedAction> queued = fixture.actionQueue.pending("F2");
            assertThat(queued).singleElement().satisfies(action -> {
                assertThat(action.getType()).isEqualTo(QueuedActionType.SUBMIT);
                assertThat(action.getMasterOrderId()).isEqualTo("M1");
            });
            assertThat(fixture.orderMappingStore.findLink("M1", "F2").orElseThrow().getStatus())
                    .isEqualTo(MappingStatus.SKIPPED);
        }

        @Test
        @DisplayName("probe orders on the reserved route are never copied")
        void probeIgnored() {
            MasterOrderEvent probe = MasterOrderEvent.builder()
                    .masterOrderId("P1")
                    .type(MasterEventType.ACCEPTED)
                    .symbol("AAPL")
                    .side(OrderSide.BUY)
                    .quantity(1)
                    .orderType(OrderType.MARKET)
                    .route("testroute")
                    .build();

            dispatchAndWait(probe);

            assertThat(orders("F1")).isEmpty();
            assertThat(orders("F2")).isEmpty();
            assertThat(fixture.orderMappingStore.find("P1")).isEmpty();
        }

        @Test
        @DisplayName("events dispatched while not replicating are dropped")
        void droppedWhenNotReplicating() {
            fixture.replicationEngine.stop("pause");
            fixture.replicationEngine.connect();

            fixture.replicationEngine.dispatch(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));
            fixture.awaitIdle();

            assertThat(orders("F1")).isEmpty();
        }

        @Test
        @DisplayName("a fill reported by the follower settles the mapping entry")
        void fillSettlesMapping() {
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));
            String followerOrderId = orders("F1").get(0).getBrokerOrderId();

            fixture.follower("F1").fillOrder(followerOrderId);

            assertThat(fixture.orderMappingStore.findLink("M1", "F1").orElseThrow().getStatus())
                    .isEqualTo(MappingStatus.FILLED);
            assertThat(fixture.orderMappingStore.findLink("M1", "F2").orElseThrow().getStatus())
                    .isEqualTo(MappingStatus.ACTIVE);
        }
    }

    @Nested
    @DisplayName("Cancel and replace dispatch")
    class CancelReplaceDispatch {

        @BeforeEach
        void start() {
            fixture.start();
        }

        @Test
        @DisplayName("cancel only reaches followers that hold a mapping entry")
        void cancelOnlyMapped() {
            fixture.blacklistRegistry.add("F1", "AAPL", BlacklistReason.MANUAL);
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));
            fixture.blacklistRegistry.remove("F1", "AAPL");

            dispatchAndWait(EngineTestFixture.cancelled("M1", "AAPL"));

            assertThat(fixture.follower("F1").getOrderSequenceLog()).isEmpty();
            assertThat(fixture.follower("F2").getOrderSequenceLog())
                    .extracting(entry -> entry.split(" ")[0])
                    .containsExactly("SUBMIT", "CANCEL");
        }

        @Test
        @DisplayName("replace carries the new scaled quantity and price")
        void replace() {
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));

            dispatchAndWait(EngineTestFixture.replaced("M1", "AAPL", OrderSide.BUY, 150, "10.50"));

            SimulatorBrokerSession.SimulatedOrder replacement = orders("F2").get(1);
            assertThat(replacement.getRequest().getQuantity()).isEqualTo(300);
            assertThat(replacement.getRequest().getPrice()).isEqualByComparingTo("10.50");
            assertThat(fixture.orderMappingStore.findLink("M1", "F2").orElseThrow().getFollowerOrderId())
                    .isEqualTo(replacement.getBrokerOrderId());
        }

        @Test
        @DisplayName("cancel for an unknown master order does nothing")
        void cancelUnknown() {
            dispatchAndWait(EngineTestFixture.cancelled("M404", "AAPL"));

            assertThat(fixture.follower("F1").getOrderSequenceLog()).isEmpty();
            assertThat(fixture.actionQueue.size()).isZero();
        }

        @Test
        @DisplayName("cancel for a follower whose submit is queued is queued behind it")
        void cancelQueuedBehindSubmit() {
            fixture.follower("F2").setConnected(false);
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));

            dispatchAndWait(EngineTestFixture.cancelled("M1", "AAPL"));

            assertThat(fixture.actionQueue.pending("F2"))
                    .extracting(QueuedAction::getType)
                    .containsExactly(QueuedActionType.SUBMIT, QueuedActionType.CANCEL);
        }

        @Test
        @DisplayName("a master cancel stops a short sale waiting on its locate")
        void cancelStopsShortSale() throws Exception {
            CountDownLatch locateStarted = new CountDownLatch(1);
            fixture.follower("F1").setLocateHandler((symbol, quantity, maxPrice, timeout) -> {
                locateStarted.countDown();
                return new CompletableFuture<>();
            });
            fixture.follower("F2").setSellCapacity("TSLA", 1_000);
            fixture.emit(EngineTestFixture.accepted("M1", "TSLA", OrderSide.SHORT_SELL, 100));
            assertThat(locateStarted.await(5, TimeUnit.SECONDS)).isTrue();
            fixture.awaitCondition(() -> orders("F2").size() == 1);

            dispatchAndWait(EngineTestFixture.cancelled("M1", "TSLA"));

            ShortSaleTask f1Task = fixture.engineStateHolder.tasksForMasterOrder("M1").stream()
                    .filter(task -> task.getFollowerId().equals("F1"))
                    .findFirst()
                    .orElseThrow();
            assertThat(f1Task.getStatus()).isEqualTo(ShortSaleStatus.CANCELLED);
            assertThat(orders("F1")).isEmpty();
            assertThat(fixture.follower("F2").getOrderSequenceLog())
                    .extracting(entry -> entry.split(" ")[0])
                    .containsExactly("SUBMIT", "CANCEL");
        }
    }

    @Nested
    @DisplayName("Queued action replay")
    class Replay {

        @BeforeEach
        void start() {
            fixture.start();
        }

        @Test
        @DisplayName("reconnect is announced and replay places the queued orders in order")
        void reconnectAndReplay() {
            SimulatorBrokerSession f2 = fixture.follower("F2");
            f2.setConnected(false);
            fixture.replicationEngine.checkReconnects();
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));
            dispatchAndWait(EngineTestFixture.accepted("M2", "MSFT", OrderSide.BUY, 10));

            f2.setConnected(true);
            fixture.replicationEngine.checkReconnects();

            StatusNotification available = fixture.notifications(NotificationKind.QUEUED_ACTIONS_AVAILABLE).get(0);
            assertThat(available.getFollowerId()).isEqualTo("F2");
            assertThat(available.getDetails()).containsEntry("count", 2);

            ReplayResult result = fixture.replicationEngine.replayQueuedActions("F2", null);
            fixture.awaitIdle();

            assertThat(result.getReplayedActionIds()).hasSize(2);
            assertThat(orders("F2"))
                    .extracting(order -> order.getRequest().getMasterOrderId())
                    .containsExactlyInAnyOrder("M1", "M2");
            assertThat(fixture.actionQueue.pending("F2")).isEmpty();
            assertThat(fixture.orderMappingStore.findLink("M1", "F2").orElseThrow().getStatus())
                    .isEqualTo(MappingStatus.ACTIVE);
        }

        @Test
        @DisplayName("a queued submit and its cancel replay in order")
        void submitThenCancel() {
            SimulatorBrokerSession f2 = fixture.follower("F2");
            f2.setConnected(false);
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));
            dispatchAndWait(EngineTestFixture.cancelled("M1", "AAPL"));
            f2.setConnected(true);

            fixture.replicationEngine.replayQueuedActions("F2", List.of());
            fixture.awaitIdle();

            assertThat(f2.getOrderSequenceLog())
                    .extracting(entry -> entry.split(" ")[0])
                    .containsExactly("SUBMIT", "CANCEL");
            assertThat(fixture.orderMappingStore.findLink("M1", "F2").orElseThrow().getStatus())
                    .isEqualTo(MappingStatus.CANCELLED);
        }

        @Test
        @DisplayName("a submit for a symbol blacklisted since queueing is skipped")
        void blacklistedSinceQueueing() {
            fixture.follower("F2").setConnected(false);
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));
            fixture.follower("F2").setConnected(true);
            fixture.blacklistRegistry.add("F2", "AAPL", BlacklistReason.MANUAL);

            ReplayResult result = fixture.replicationEngine.replayQueuedActions("F2", null);

            assertThat(result.getReplayedActionIds()).isEmpty();
            assertThat(result.getSkippedActionIds()).hasSize(1);
            assertThat(orders("F2")).isEmpty();
        }

        @Test
        @DisplayName("replay to a follower that is still down is refused and keeps the queue")
        void replayWhileDown() {
            fixture.follower("F2").setConnected(false);
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));

            assertThatThrownBy(() -> fixture.replicationEngine.replayQueuedActions("F2", null))
                    .isInstanceOf(FollowerUnreachableException.class);

            assertThat(fixture.actionQueue.pending("F2")).hasSize(1);
        }

        @Test
        @DisplayName("selected actions can be discarded")
        void discardSelected() {
            fixture.follower("F2").setConnected(false);
            dispatchAndWait(EngineTestFixture.accepted("M1", "AAPL", OrderSide.BUY, 100));
            dispatchAndWait(EngineTestFixture.accepted("M2", "MSFT", OrderSide.BUY, 100));
            String first = fixture.actionQueue.pending("F2").get(0).getId();

            int discarded = fixture.replicationEngine.discardQueuedActions("F2", List.of(first));

            assertThat(discarded).isEqualTo(1);
            assertThat(fixture.actionQueue.pending("F2"))
                    .extracting(QueuedAction::getMasterOrderId)
                    .containsExactly("M2");
        }
    }
}
