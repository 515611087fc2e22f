package com.paywatch.api.controller;

import com.paywatch.monitoring.MonitoringTaskSnapshot;
import com.paywatch.monitoring.PaymentMonitorScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /api/v1/monitoring/tasks: read-only diagnostics of active monitoring tasks.
 */
@RestController
@RequestMapping("/api/v1/monitoring")
@RequiredArgsConstructor
public class MonitoringController {

    private final PaymentMonitorScheduler scheduler;

    @GetMapping("/tasks")
    public ResponseEntity<List<MonitoringTaskSnapshot>> tasks() {
        return ResponseEntity.ok(scheduler.activeTasks());
    }
}
