package com.copytrader.api.controller;

import com.copytrader.api.dto.request.FollowerRequest;
import com.copytrader.domain.model.Follower;
import com.copytrader.mapper.RequestMapper;
import com.copytrader.service.AuditService;
import com.copytrader.service.FollowerService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Follower registry. Changes take effect for dispatch immediately; session changes (a newly
 * registered or re-enabled follower) take effect on the next connect.
 */
@RestController
@RequestMapping("/api/followers")
public class FollowerController {

    private final FollowerService followerService;
    private final RequestMapper requestMapper;
    private final AuditService auditService;

    public FollowerController(FollowerService followerService, RequestMapper requestMapper, AuditService auditService) {
        this.followerService = followerService;
        this.requestMapper = requestMapper;
        this.auditService = auditService;
    }

    @GetMapping
    public ResponseEntity<List<Follower>> list() {
        return ResponseEntity.ok(followerService.findAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Follower> get(@PathVariable String id) {
        return ResponseEntity.ok(followerService.require(id));
    }

    @PostMapping
    public ResponseEntity<Follower> register(@RequestBody @Valid FollowerRequest request) {
        Follower created = followerService.register(requestMapper.toFollower(request));
        auditService.log("FOLLOWER", created.getId(), null, "REGISTER", Map.of("accountId", created.getAccountId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{id}")
    public ResponseEntity<Follower> update(@PathVariable String id, @RequestBody @Valid FollowerRequest request) {
        Follower updated = followerService.update(id, requestMapper.toFollower(request));
        auditService.log(
                "FOLLOWER",
                id,
                null,
                "UPDATE",
                Map.of("enabled", updated.isEnabled(), "baseMultiplier", updated.getBaseMultiplier()));
        return ResponseEntity.ok(updated);
    }
}
