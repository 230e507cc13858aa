package com.copytrader.api.controller;

import com.copytrader.api.dto.response.EngineStatusResponse;
import com.copytrader.domain.model.EngineSnapshot;
import com.copytrader.engine.ActionQueue;
import com.copytrader.engine.EngineStateHolder;
import com.copytrader.engine.ReplicationEngine;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Engine lifecycle commands and status reads.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/engine/connect -- STOPPED to CONNECTED</li>
 *   <li>POST /api/engine/start-replication -- CONNECTED to REPLICATING, after reconciliation</li>
 *   <li>POST /api/engine/stop -- any state to STOPPED</li>
 *   <li>GET /api/engine/status -- state, gate and per-account connectivity</li>
 *   <li>GET /api/engine/snapshot -- active short-sale tasks and the order map</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/engine")
public class ReplicationController {

    private static final Logger log = LoggerFactory.getLogger(ReplicationController.class);

    private final ReplicationEngine replicationEngine;
    private final EngineStateHolder engineStateHolder;
    private final ActionQueue actionQueue;

    public ReplicationController(
            ReplicationEngine replicationEngine, EngineStateHolder engineStateHolder, ActionQueue actionQueue) {
        this.replicationEngine = replicationEngine;
        this.engineStateHolder = engineStateHolder;
        this.actionQueue = actionQueue;
    }

    @PostMapping("/connect")
    public ResponseEntity<EngineStatusResponse> connect() {
        log.info("Connect requested");
        replicationEngine.connect();
        return ResponseEntity.ok(status());
    }

    @PostMapping("/start-replication")
    public ResponseEntity<EngineStatusResponse> startReplication() {
        log.info("Start replication requested");
        replicationEngine.startReplication();
        return ResponseEntity.ok(status());
    }

    @PostMapping("/stop")
    public ResponseEntity<EngineStatusResponse> stop(
            @RequestParam(defaultValue = "Stopped by user") String reason) {
        log.info("Stop requested: {}", reason);
        replicationEngine.stop(reason);
        return ResponseEntity.ok(status());
    }

    @GetMapping("/status")
    public ResponseEntity<EngineStatusResponse> getStatus() {
        return ResponseEntity.ok(status());
    }

    @GetMapping("/snapshot")
    public ResponseEntity<EngineSnapshot> getSnapshot() {
        return ResponseEntity.ok(replicationEngine.snapshot());
    }

    private EngineStatusResponse status() {
        Map<String, Boolean> connections = replicationEngine.getConnectionStatus();
        return EngineStatusResponse.builder()
                .state(replicationEngine.getState())
                .reconciliationGateOpen(replicationEngine.isReconciliationGateOpen())
                .connections(connections)
                .activeShortSaleTasks(engineStateHolder.activeTaskCount())
                .queuedActions(actionQueue.size())
                .intakeBacklog(replicationEngine.getIntakeBacklog())
                .build();
    }
}
