package com.copytrader.unit.controller;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.copytrader.api.controller.ReplicationController;
import com.copytrader.config.ApiResponseAdvice;
import com.copytrader.domain.enums.EngineState;
import com.copytrader.engine.ActionQueue;
import com.copytrader.engine.EngineStateHolder;
import com.copytrader.engine.ReplicationEngine;
import com.copytrader.exception.BrokerException;
import com.copytrader.exception.BusinessException;
import com.copytrader.exception.GlobalExceptionHandler;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ReplicationControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ReplicationEngine replicationEngine;

    @Mock
    private EngineStateHolder engineStateHolder;

    @Mock
    private ActionQueue actionQueue;

    @BeforeEach
    void setUp() {
        ReplicationController controller = new ReplicationController(replicationEngine, engineStateHolder, actionQueue);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("POST /api/engine/connect connects and reports per-account connectivity")
    void connectReportsStatus() throws Exception {
        Map<String, Boolean> connections = new LinkedHashMap<>();
        connections.put("master", true);
        connections.put("F1", true);
        connections.put("F2", false);
        when(replicationEngine.getState()).thenReturn(EngineState.CONNECTED);
        when(replicationEngine.getConnectionStatus()).thenReturn(connections);
        when(actionQueue.size()).thenReturn(2);

        mockMvc.perform(post("/api/engine/connect"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.state").value("CONNECTED"))
                .andExpect(jsonPath("$.data.reconciliationGateOpen").value(false))
                .andExpect(jsonPath("$.data.connections.master").value(true))
                .andExpect(jsonPath("$.data.connections.F2").value(false))
                .andExpect(jsonPath("$.data.queuedActions").value(2));

        verify(replicationEngine).connect();
    }

    @Test
    @DisplayName("POST /api/engine/connect maps a master login failure to 502")
    void connectFailureReturnsBadGateway() throws Exception {
        doThrow(new BrokerException("Master login failed")).when(replicationEngine).connect();

        mockMvc.perform(post("/api/engine/connect"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("BROKER_ERROR"));
    }

    @Test
    @DisplayName("POST /api/engine/start-replication before reconciliation returns 409")
    void startBeforeReconciliationConflicts() throws Exception {
        doThrow(BusinessException.conflict("Reconciliation has not been completed or skipped"))
                .when(replicationEngine)
                .startReplication();

        mockMvc.perform(post("/api/engine/start-replication"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("CONFLICT"))
                .andExpect(jsonPath("$.error.path").value("/api/engine/start-replication"));
    }

    @Test
    @DisplayName("POST /api/engine/stop passes the reason through")
    void stopPassesReason() throws Exception {
        when(replicationEngine.getState()).thenReturn(EngineState.STOPPED);

        mockMvc.perform(post("/api/engine/stop").param("reason", "maintenance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("STOPPED"));

        verify(replicationEngine).stop("maintenance");
    }

    @Test
    @DisplayName("POST /api/engine/stop uses a default reason")
    void stopUsesDefaultReason() throws Exception {
        when(replicationEngine.getState()).thenReturn(EngineState.STOPPED);

        mockMvc.perform(post("/api/engine/stop")).andExpect(status().isOk());

        verify(replicationEngine).stop("Stopped by user");
    }

    @Test
    @DisplayName("GET /api/engine/status reports active short-sale tasks and backlog")
    void statusReportsCounters() throws Exception {
        when(replicationEngine.getState()).thenReturn(EngineState.REPLICATING);
        when(replicationEngine.isReconciliationGateOpen()).thenReturn(true);
        when(engineStateHolder.activeTaskCount()).thenReturn(3);
        when(replicationEngine.getIntakeBacklog()).thenReturn(5);

        mockMvc.perform(get("/api/engine/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("REPLICATING"))
                .andExpect(jsonPath("$.data.reconciliationGateOpen").value(true))
                .andExpect(jsonPath("$.data.activeShortSaleTasks").value(3))
                .andExpect(jsonPath("$.data.intakeBacklog").value(5));
    }
}
