package com.copytrader.api.controller;

import com.copytrader.api.dto.request.QueueActionRequest;
import com.copytrader.domain.model.QueuedAction;
import com.copytrader.domain.model.ReplayResult;
import com.copytrader.engine.ActionQueue;
import com.copytrader.engine.ReplicationEngine;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Actions queued for followers that were unreachable at dispatch time.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/queue -- pending actions of every follower</li>
 *   <li>GET /api/queue/{followerId} -- pending actions of one follower, oldest first</li>
 *   <li>POST /api/queue/{followerId}/replay -- replay selected actions (all when none given)</li>
 *   <li>POST /api/queue/{followerId}/discard -- drop selected actions (all when none given)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/queue")
public class QueueController {

    private final ActionQueue actionQueue;
    private final ReplicationEngine replicationEngine;

    public QueueController(ActionQueue actionQueue, ReplicationEngine replicationEngine) {
        this.actionQueue = actionQueue;
        this.replicationEngine = replicationEngine;
    }

    @GetMapping
    public ResponseEntity<Map<String, List<QueuedAction>>> listAll() {
        return ResponseEntity.ok(actionQueue.pendingByFollower());
    }

    @GetMapping("/{followerId}")
    public ResponseEntity<List<QueuedAction>> list(@PathVariable String followerId) {
        return ResponseEntity.ok(actionQueue.pending(followerId));
    }

    @PostMapping("/{followerId}/replay")
    public ResponseEntity<ReplayResult> replay(
            @PathVariable String followerId, @RequestBody(required = false) QueueActionRequest request) {
        return ResponseEntity.ok(replicationEngine.replayQueuedActions(followerId, actionIds(request)));
    }

    @PostMapping("/{followerId}/discard")
    public ResponseEntity<Map<String, Object>> discard(
            @PathVariable String followerId, @RequestBody(required = false) QueueActionRequest request) {
        int discarded = replicationEngine.discardQueuedActions(followerId, actionIds(request));
        return ResponseEntity.ok(Map.of("followerId", followerId, "discarded", discarded));
    }

    private static List<String> actionIds(QueueActionRequest request) {
        return request == null ? null : request.getActionIds();
    }
}
