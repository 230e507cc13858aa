package com.copytrader.api.controller;

import com.copytrader.api.dto.request.MasterEventRequest;
import com.copytrader.domain.model.BrokerPosition;
import com.copytrader.domain.model.MasterOrderEvent;
import com.copytrader.mapper.RequestMapper;
import com.copytrader.simulator.SimulatorBrokerSession;
import com.copytrader.simulator.SimulatorBrokerSessionFactory;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Drives the simulated broker terminal for paper runs.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/simulator/master/events -- emit a master order event</li>
 *   <li>PUT /api/simulator/{accountId}/positions/{symbol}?quantity= -- set a signed position</li>
 *   <li>PUT /api/simulator/{accountId}/capacity/{symbol}?quantity= -- set sell capacity</li>
 *   <li>PUT /api/simulator/{accountId}/connected?value= -- toggle connectivity</li>
 *   <li>POST /api/simulator/{accountId}/orders/{orderId}/fill -- fill an open order</li>
 *   <li>GET /api/simulator/{accountId}/positions -- current positions</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/simulator")
public class SimulatorController {

    private static final Logger log = LoggerFactory.getLogger(SimulatorController.class);

    private final SimulatorBrokerSessionFactory simulatorBrokerSessionFactory;
    private final RequestMapper requestMapper;
    private final String masterAccountId;

    public SimulatorController(
            SimulatorBrokerSessionFactory simulatorBrokerSessionFactory,
            RequestMapper requestMapper,
            @Value("${copytrader.master.account-id}") String masterAccountId) {
        this.simulatorBrokerSessionFactory = simulatorBrokerSessionFactory;
        this.requestMapper = requestMapper;
        this.masterAccountId = masterAccountId;
    }

    @PostMapping("/master/events")
    public ResponseEntity<MasterOrderEvent> emitMasterEvent(@RequestBody @Valid MasterEventRequest request) {
        MasterOrderEvent event = requestMapper.toMasterEvent(request);
        log.info("Simulated master event: {} {} {}", event.getType(), event.getMasterOrderId(), event.getSymbol());
        session(masterAccountId).emitOrderEvent(event);
        return ResponseEntity.ok(event);
    }

    @GetMapping("/{accountId}/positions")
    public ResponseEntity<List<BrokerPosition>> positions(@PathVariable String accountId) {
        return ResponseEntity.ok(session(accountId).getPositions());
    }

    @PutMapping("/{accountId}/positions/{symbol}")
    public ResponseEntity<Map<String, Object>> setPosition(
            @PathVariable String accountId, @PathVariable String symbol, @RequestParam long quantity) {
        session(accountId).setPosition(symbol, quantity);
        return ResponseEntity.ok(Map.of("accountId", accountId, "symbol", symbol, "quantity", quantity));
    }

    @PutMapping("/{accountId}/capacity/{symbol}")
    public ResponseEntity<Map<String, Object>> setSellCapacity(
            @PathVariable String accountId, @PathVariable String symbol, @RequestParam long quantity) {
        session(accountId).setSellCapacity(symbol, quantity);
        return ResponseEntity.ok(Map.of("accountId", accountId, "symbol", symbol, "sellCapacity", quantity));
    }

    @PutMapping("/{accountId}/connected")
    public ResponseEntity<Map<String, Object>> setConnected(
            @PathVariable String accountId, @RequestParam boolean value) {
        session(accountId).setConnected(value);
        log.info("Simulated connectivity change: account={}, connected={}", accountId, value);
        return ResponseEntity.ok(Map.of("accountId", accountId, "connected", value));
    }

    @PostMapping("/{accountId}/orders/{orderId}/fill")
    public ResponseEntity<Map<String, Object>> fill(@PathVariable String accountId, @PathVariable String orderId) {
        session(accountId).fillOrder(orderId);
        return ResponseEntity.ok(Map.of("accountId", accountId, "orderId", orderId, "state", "FILLED"));
    }

    private SimulatorBrokerSession session(String accountId) {
        return simulatorBrokerSessionFactory.create(accountId);
    }
}
