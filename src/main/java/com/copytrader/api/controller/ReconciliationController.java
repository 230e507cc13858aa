package com.copytrader.api.controller;

import com.copytrader.api.dto.request.ReconciliationApplyRequest;
import com.copytrader.domain.model.ReconciliationApplyResult;
import com.copytrader.domain.model.ReconciliationReport;
import com.copytrader.mapper.RequestMapper;
import com.copytrader.reconciliation.ReconciliationService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reconciliation gate between connect and replication.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/reconcile?followerIds=a,b -- compute entries, optionally for a subset</li>
 *   <li>POST /api/reconcile/apply -- apply confirmed decisions and start replication</li>
 *   <li>POST /api/reconcile/skip -- start replication without changes</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/reconcile")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final RequestMapper requestMapper;

    public ReconciliationController(ReconciliationService reconciliationService, RequestMapper requestMapper) {
        this.reconciliationService = reconciliationService;
        this.requestMapper = requestMapper;
    }

    @GetMapping
    public ResponseEntity<ReconciliationReport> compute(@RequestParam(required = false) List<String> followerIds) {
        return ResponseEntity.ok(reconciliationService.compute(followerIds));
    }

    @PostMapping("/apply")
    public ResponseEntity<ReconciliationApplyResult> apply(@RequestBody @Valid ReconciliationApplyRequest request) {
        return ResponseEntity.ok(reconciliationService.apply(requestMapper.toDecisions(request.getDecisions())));
    }

    @PostMapping("/skip")
    public ResponseEntity<Map<String, String>> skip() {
        reconciliationService.skip();
        return ResponseEntity.ok(Map.of("message", "Reconciliation skipped, replication started"));
    }
}
