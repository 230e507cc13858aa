package com.copytrader.api.controller;

import com.copytrader.entity.AuditLogEntity;
import com.copytrader.service.AuditService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Audit trail, newest first, optionally narrowed to one follower. */
@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @GetMapping
    public ResponseEntity<List<AuditLogEntity>> recent(@RequestParam(required = false) String followerId) {
        return ResponseEntity.ok(auditService.recent(followerId));
    }
}
