package com.copytrader.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.copytrader.domain.enums.DecisionAction;
import com.copytrader.domain.enums.EngineState;
import com.copytrader.domain.enums.MultiplierSource;
import com.copytrader.domain.enums.NotificationKind;
import com.copytrader.domain.enums.ReconciliationAction;
import com.copytrader.domain.enums.ReconciliationScenario;
import com.copytrader.domain.model.FollowerReconciliation;
import com.copytrader.domain.model.ReconciliationApplyResult;
import com.copytrader.domain.model.ReconciliationDecision;
import com.copytrader.domain.model.ReconciliationEntry;
import com.copytrader.domain.model.ReconciliationReport;
import com.copytrader.domain.model.StatusNotification;
import com.copytrader.event.ReconciliationEvent;
import com.copytrader.exception.BusinessException;
import com.copytrader.exception.ErrorCode;
import com.copytrader.exception.ResourceNotFoundException;
import com.copytrader.notification.NotificationService;
import com.copytrader.support.EngineTestFixture;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReconciliationServiceTest {

    private EngineTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineTestFixture();
        fixture.addFollower("F1", "1");
        fixture.addFollower("F2", "2");
        fixture.master().setPosition("AAPL", 100);
        fixture.master().setPosition("TSLA", -100);
        fixture.master().setPosition("MSFT", 100);
        fixture.follower("F1").setPosition("AAPL", 150);
        fixture.follower("F1").setPosition("MSFT", -50);
        fixture.follower("F1").setPosition("NVDA", 10);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private ReconciliationEntry entry(ReconciliationReport report, String followerId, String symbol) {
        return report.getFollowers().stream()
                .filter(f -> f.getFollowerId().equals(followerId))
                .flatMap(f -> f.getEntries().stream())
                .filter(e -> e.getSymbol().equals(symbol))
                .findFirst()
                .orElseThrow();
    }

    private static ReconciliationDecision decision(
            String followerId, String symbol, DecisionAction action, String multiplier, boolean blacklist) {
        return ReconciliationDecision.builder()
                .followerId(followerId)
                .symbol(symbol)
                .action(action)
                .multiplier(multiplier == null ? null : new BigDecimal(multiplier))
                .blacklist(blacklist)
                .build();
    }

    @Nested
    @DisplayName("Compute")
    class Compute {

        @BeforeEach
        void connect() {
            fixture.replicationEngine.connect();
        }

        @Test
        @DisplayName("same direction infers |follower| / |master|")
        void sameDirection() {
            ReconciliationEntry aapl = entry(fixture.reconciliationService.compute(null), "F1", "AAPL");

            assertThat(aapl.getScenario()).isEqualTo(ReconciliationScenario.COMMON_SAME_DIRECTION);
            assertThat(aapl.getInferredMultiplier()).isEqualByComparingTo("1.5");
            assertThat(aapl.getInferredMultiplier().scale()).isEqualTo(4);
            assertThat(aapl.getDefaultAction()).isEqualTo(ReconciliationAction.USE_INFERRED);
            assertThat(aapl.getCurrentMultiplier()).isEqualByComparingTo("1");
            assertThat(aapl.getCurrentSource()).isEqualTo(MultiplierSource.BASE);
        }

        @Test
        @DisplayName("a symbol the follower does not hold proposes blacklisting")
        void masterOnly() {
            ReconciliationReport report = fixture.reconciliationService.compute(null);

            ReconciliationEntry tsla = entry(report, "F1", "TSLA");
            assertThat(tsla.getScenario()).isEqualTo(ReconciliationScenario.MASTER_ONLY);
            assertThat(tsla.getDefaultAction()).isEqualTo(ReconciliationAction.BLACKLIST);
            assertThat(tsla.getInferredMultiplier()).isNull();
            assertThat(entry(report, "F2", "AAPL").getScenario()).isEqualTo(ReconciliationScenario.MASTER_ONLY);
        }

        @Test
        @DisplayName("computing twice with unchanged positions yields identical entries")
        void computeIsRepeatable() {
            ReconciliationReport first = fixture.reconciliationService.compute(null);
            ReconciliationReport second = fixture.reconciliationService.compute(null);

            assertThat(second.getFollowers()).isEqualTo(first.getFollowers());
            assertThat(second)
                    .usingRecursiveComparison()
                    .ignoringFields("computedAt")
                    .isEqualTo(first);
            assertThat(fixture.multiplierResolver.overrides("F1")).isEmpty();
            assertThat(fixture.blacklistRegistry.list("F1")).isEmpty();
            assertThat(fixture.notifications(NotificationKind.RECONCILIATION))
                    .extracting(StatusNotification::getSymbol)
                    .containsExactly("MSFT", "MSFT");
        }

        @Test
        @DisplayName("an opposite position proposes blacklisting and raises an alert")
        void oppositeDirection() {
            ReconciliationEntry msft = entry(fixture.reconciliationService.compute(null), "F1", "MSFT");

            assertThat(msft.getScenario()).isEqualTo(ReconciliationScenario.COMMON_OPPOSITE_DIRECTION);
            assertThat(msft.getDefaultAction()).isEqualTo(ReconciliationAction.BLACKLIST);
            StatusNotification alert = fixture.notifications(NotificationKind.RECONCILIATION).get(0);
            assertThat(alert.getFollowerId()).isEqualTo("F1");
            assertThat(alert.getSymbol()).isEqualTo("MSFT");
            assertThat(alert.getStatus()).isEqualTo(NotificationService.OPPOSITE_DIRECTION_STATUS);
        }

        @Test
        @DisplayName("symbols held only by the follower are left out")
        void followerOnlyExcluded() {
            ReconciliationReport report = fixture.reconciliationService.compute(null);

            assertThat(report.getMasterPositions()).containsOnlyKeys("AAPL", "MSFT", "TSLA");
            assertThat(report.getFollowers().get(0).getEntries())
                    .extracting(ReconciliationEntry::getSymbol)
                    .containsExactly("AAPL", "MSFT", "TSLA");
        }

        @Test
        @DisplayName("a disconnected follower is reported with an error")
        void disconnectedFollower() {
            fixture.follower("F2").setConnected(false);

            FollowerReconciliation f2 = fixture.reconciliationService.compute(List.of("F2")).getFollowers().get(0);

            assertThat(f2.isConnected()).isFalse();
            assertThat(f2.getEntries()).isEmpty();
            assertThat(f2.getError()).isEqualTo("Follower not connected");
        }

        @Test
        @DisplayName("an unknown follower id is not found")
        void unknownFollower() {
            assertThatThrownBy(() -> fixture.reconciliationService.compute(List.of("F9")))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("compute on a stopped engine is a conflict")
    void computeWhenStopped() {
        assertThatThrownBy(() -> fixture.reconciliationService.compute(null))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONFLICT);
    }

    @Nested
    @DisplayName("Apply")
    class Apply {

        private final List<ReconciliationDecision> decisions = List.of(
                decision("F1", "AAPL", DecisionAction.USE_INFERRED, "1.5", false),
                decision("F1", "TSLA", DecisionAction.KEEP, null, true),
                decision("F1", "MSFT", DecisionAction.KEEP, null, true),
                decision("F2", "AAPL", DecisionAction.MANUAL, "0.25", false));

        @BeforeEach
        void connect() {
            fixture.replicationEngine.connect();
        }

        @Test
        @DisplayName("writes overrides and blacklist entries, then starts replicating")
        void applyDecisions() {
            ReconciliationApplyResult result = fixture.reconciliationService.apply(decisions);

            assertThat(result.getDecisionsApplied()).isEqualTo(4);
            assertThat(result.getMultiplierOverridesSet()).isEqualTo(2);
            assertThat(result.getBlacklistAdded()).isEqualTo(2);
            assertThat(fixture.multiplierResolver.effective("F1", "AAPL")).isEqualByComparingTo("1.5");
            assertThat(fixture.multiplierResolver.effective("F2", "AAPL")).isEqualByComparingTo("0.25");
            assertThat(fixture.blacklistRegistry.isBlacklisted("F1", "TSLA")).isTrue();
            assertThat(fixture.blacklistRegistry.isBlacklisted("F1", "MSFT")).isTrue();
            assertThat(fixture.replicationEngine.getState()).isEqualTo(EngineState.REPLICATING);
            assertThat(fixture.publishedEvents).hasAtLeastOneElementOfType(ReconciliationEvent.class);
        }

        @Test
        @DisplayName("applying the same decisions again next cycle changes nothing")
        void idempotent() {
            fixture.reconciliationService.apply(decisions);
            fixture.replicationEngine.restart("next day");

            ReconciliationApplyResult second = fixture.reconciliationService.apply(decisions);

            assertThat(second.getBlacklistAdded()).isZero();
            assertThat(second.getBlacklistRemoved()).isZero();
            assertThat(fixture.multiplierResolver.overrides("F1")).hasSize(1);
            assertThat(fixture.blacklistRegistry.list("F1")).hasSize(2);
        }

        @Test
        @DisplayName("USE_DEFAULT clears an override and blacklist=false lifts an entry")
        void revert() {
            fixture.reconciliationService.apply(decisions);
            fixture.replicationEngine.restart("next day");

            ReconciliationApplyResult result = fixture.reconciliationService.apply(List.of(
                    decision("F1", "AAPL", DecisionAction.USE_DEFAULT, null, false),
                    decision("F1", "TSLA", DecisionAction.KEEP, null, false)));

            assertThat(result.getMultiplierOverridesRemoved()).isEqualTo(1);
            assertThat(result.getBlacklistRemoved()).isEqualTo(1);
            assertThat(fixture.multiplierResolver.effective("F1", "AAPL")).isEqualByComparingTo("1");
            assertThat(fixture.blacklistRegistry.isBlacklisted("F1", "TSLA")).isFalse();
        }

        @Test
        @DisplayName("a malformed decision rejects the whole batch")
        void invalidBatch() {
            List<ReconciliationDecision> batch = List.of(
                    decision("F1", "TSLA", DecisionAction.KEEP, null, true),
                    decision("F1", "AAPL", DecisionAction.USE_INFERRED, null, false));

            assertThatThrownBy(() -> fixture.reconciliationService.apply(batch))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.VALIDATION_ERROR);

            assertThat(fixture.blacklistRegistry.isBlacklisted("F1", "TSLA")).isFalse();
            assertThat(fixture.replicationEngine.getState()).isEqualTo(EngineState.CONNECTED);
        }

        @Test
        @DisplayName("apply after replication started is a conflict")
        void applyTwice() {
            fixture.reconciliationService.apply(List.of());

            assertThatThrownBy(() -> fixture.reconciliationService.apply(decisions))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.CONFLICT);
        }

        @Test
        @DisplayName("skip opens the gate without changes")
        void skip() {
            fixture.reconciliationService.skip();

            assertThat(fixture.replicationEngine.getState()).isEqualTo(EngineState.REPLICATING);
            assertThat(fixture.multiplierResolver.overrides("F1")).isEmpty();
            assertThat(fixture.blacklistRegistry.listAll()).isEmpty();
        }
    }
}
