package com.copytrader.api.controller;

import com.copytrader.api.dto.request.MultiplierOverrideRequest;
import com.copytrader.domain.model.SymbolMultiplier;
import com.copytrader.engine.MultiplierResolver;
import com.copytrader.service.AuditService;
import com.copytrader.service.FollowerService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Symbol multiplier overrides per follower.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/multipliers/{followerId} -- overrides of a follower</li>
 *   <li>GET /api/multipliers/{followerId}/{symbol} -- effective multiplier and its source</li>
 *   <li>PUT /api/multipliers/{followerId}/{symbol} -- set override</li>
 *   <li>DELETE /api/multipliers/{followerId}/{symbol} -- clear override</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/multipliers")
public class MultiplierController {

    private final MultiplierResolver multiplierResolver;
    private final FollowerService followerService;
    private final AuditService auditService;

    public MultiplierController(
            MultiplierResolver multiplierResolver, FollowerService followerService, AuditService auditService) {
        this.multiplierResolver = multiplierResolver;
        this.followerService = followerService;
        this.auditService = auditService;
    }

    @GetMapping("/{followerId}")
    public ResponseEntity<List<SymbolMultiplier>> list(@PathVariable String followerId) {
        followerService.require(followerId);
        return ResponseEntity.ok(multiplierResolver.overrides(followerId));
    }

    @GetMapping("/{followerId}/{symbol}")
    public ResponseEntity<SymbolMultiplier> effective(@PathVariable String followerId, @PathVariable String symbol) {
        followerService.require(followerId);
        return ResponseEntity.ok(multiplierResolver.resolve(followerId, symbol));
    }

    @PutMapping("/{followerId}/{symbol}")
    public ResponseEntity<SymbolMultiplier> setOverride(
            @PathVariable String followerId,
            @PathVariable String symbol,
            @RequestBody @Valid MultiplierOverrideRequest request) {
        followerService.require(followerId);
        SymbolMultiplier override = multiplierResolver.setOverride(followerId, symbol, request.getMultiplier());
        auditService.log(
                "MULTIPLIER", followerId, override.getSymbol(), "SET", Map.of("multiplier", request.getMultiplier()));
        return ResponseEntity.ok(override);
    }

    @DeleteMapping("/{followerId}/{symbol}")
    public ResponseEntity<Map<String, Object>> clearOverride(
            @PathVariable String followerId, @PathVariable String symbol) {
        followerService.require(followerId);
        boolean cleared = multiplierResolver.clearOverride(followerId, symbol);
        if (cleared) {
            auditService.log("MULTIPLIER", followerId, symbol, "CLEAR", null);
        }
        return ResponseEntity.ok(Map.of("cleared", cleared));
    }
}
