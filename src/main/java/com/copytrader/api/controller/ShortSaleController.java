package com.copytrader.api.controller;

import com.copytrader.domain.model.ShortSaleTask;
import com.copytrader.engine.BorrowAcquisitionManager;
import com.copytrader.engine.EngineStateHolder;
import com.copytrader.exception.ResourceNotFoundException;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Short-sale tasks of the current connect cycle: list, inspect and cancel. */
@RestController
@RequestMapping("/api/short-sales")
public class ShortSaleController {

    private final EngineStateHolder engineStateHolder;
    private final BorrowAcquisitionManager borrowAcquisitionManager;

    public ShortSaleController(
            EngineStateHolder engineStateHolder, BorrowAcquisitionManager borrowAcquisitionManager) {
        this.engineStateHolder = engineStateHolder;
        this.borrowAcquisitionManager = borrowAcquisitionManager;
    }

    /** Active tasks by default; {@code ?all=true} includes terminal ones. */
    @GetMapping
    public ResponseEntity<List<ShortSaleTask>> list(@RequestParam(defaultValue = "false") boolean all) {
        return ResponseEntity.ok(all ? engineStateHolder.allTasks() : engineStateHolder.activeTasks());
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<ShortSaleTask> get(@PathVariable String taskId) {
        return ResponseEntity.ok(engineStateHolder
                .findTask(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("ShortSaleTask", taskId)));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String taskId) {
        boolean cancelled = borrowAcquisitionManager.cancelTask(taskId);
        return ResponseEntity.ok(Map.of("taskId", taskId, "cancelled", cancelled));
    }
}
