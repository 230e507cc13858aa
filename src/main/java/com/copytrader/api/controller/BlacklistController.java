package com.copytrader.api.controller;

import com.copytrader.api.dto.request.BlacklistRequest;
import com.copytrader.domain.enums.BlacklistReason;
import com.copytrader.domain.model.BlacklistEntry;
import com.copytrader.engine.BlacklistRegistry;
import com.copytrader.service.AuditService;
import com.copytrader.service.FollowerService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Per-follower symbol blacklist. */
@RestController
@RequestMapping("/api/blacklist")
public class BlacklistController {

    private final BlacklistRegistry blacklistRegistry;
    private final FollowerService followerService;
    private final AuditService auditService;

    public BlacklistController(
            BlacklistRegistry blacklistRegistry, FollowerService followerService, AuditService auditService) {
        this.blacklistRegistry = blacklistRegistry;
        this.followerService = followerService;
        this.auditService = auditService;
    }

    @GetMapping
    public ResponseEntity<List<BlacklistEntry>> list(@RequestParam(required = false) String followerId) {
        return ResponseEntity.ok(followerId == null ? blacklistRegistry.listAll() : blacklistRegistry.list(followerId));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> add(@RequestBody @Valid BlacklistRequest request) {
        followerService.require(request.getFollowerId());
        BlacklistReason reason = request.getReason() != null ? request.getReason() : BlacklistReason.MANUAL;
        boolean added = blacklistRegistry.add(request.getFollowerId(), request.getSymbol(), reason);
        if (added) {
            auditService.log(
                    "BLACKLIST", request.getFollowerId(), request.getSymbol(), "ADD", Map.of("reason", reason.name()));
        }
        return ResponseEntity.ok(Map.of("added", added));
    }

    @DeleteMapping("/{followerId}/{symbol}")
    public ResponseEntity<Map<String, Object>> remove(@PathVariable String followerId, @PathVariable String symbol) {
        boolean removed = blacklistRegistry.remove(followerId, symbol);
        if (removed) {
            auditService.log("BLACKLIST", followerId, symbol, "REMOVE", null);
        }
        return ResponseEntity.ok(Map.of("removed", removed));
    }
}
