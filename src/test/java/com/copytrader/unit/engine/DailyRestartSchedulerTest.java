package com.copytrader.unit.engine;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.copytrader.domain.enums.EngineState;
import com.copytrader.engine.DailyRestartScheduler;
import com.copytrader.engine.ReplicationEngine;
import com.copytrader.exception.BrokerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DailyRestartSchedulerTest {

    @Mock
    private ReplicationEngine replicationEngine;

    @Test
    @DisplayName("restarts a running engine")
    void restartsRunningEngine() {
        when(replicationEngine.getState()).thenReturn(EngineState.REPLICATING);

        new DailyRestartScheduler(replicationEngine, true).restart();

        verify(replicationEngine).restart("Scheduled daily restart");
    }

    @Test
    @DisplayName("leaves a stopped engine alone")
    void skipsStoppedEngine() {
        when(replicationEngine.getState()).thenReturn(EngineState.STOPPED);

        new DailyRestartScheduler(replicationEngine, true).restart();

        verify(replicationEngine, never()).restart(anyString());
    }

    @Test
    @DisplayName("does nothing when disabled")
    void disabled() {
        new DailyRestartScheduler(replicationEngine, false).restart();

        verify(replicationEngine, never()).getState();
        verify(replicationEngine, never()).restart(anyString());
    }

    @Test
    @DisplayName("a failed reconnect is logged, not thrown")
    void reconnectFailure() {
        when(replicationEngine.getState()).thenReturn(EngineState.CONNECTED);
        doThrow(new BrokerException("master login refused")).when(replicationEngine).restart(anyString());

        new DailyRestartScheduler(replicationEngine, true).restart();

        verify(replicationEngine).restart("Scheduled daily restart");
    }
}
