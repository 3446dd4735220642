package com.demo.churn.controller;

import com.demo.churn.controller.dto.PredictionDtos.OutcomeRequest;
import com.demo.churn.service.alert.Alert;
import com.demo.churn.service.alert.AlertEngine;
import com.demo.churn.service.monitoring.MonitoringService;
import com.demo.churn.service.monitoring.MonitoringSnapshot;
import com.demo.churn.service.monitoring.PredictionMonitor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MonitoringController {

    private final PredictionMonitor monitor;
    private final MonitoringService monitoring;
    private final AlertEngine alerts;

    /** Ground truth for an earlier prediction; unknown ids are reported back, not rejected. */
    @PostMapping("/monitoring/outcomes")
    public Map<String, Object> outcome(@Valid @RequestBody OutcomeRequest req) {
        boolean accepted = monitor.recordOutcome(req.predictionId, req.churned);
        return Map.of("predictionId", req.predictionId, "accepted", accepted);
    }

    /** Closes the current window now instead of waiting for the schedule. */
    @PostMapping("/monitoring/snapshots")
    public MonitoringSnapshot closeWindow() {
        return monitoring.closeWindow();
    }

    @GetMapping("/monitoring/snapshots")
    public List<MonitoringSnapshot> snapshots() {
        return monitor.history();
    }

    @GetMapping("/monitoring/summary")
    public Map<String, Object> summary() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("trailing", monitor.trailingSummary());
        out.put("openWindowVolume", monitor.currentVolume());
        out.put("openWindowDrift", monitor.driftScore());
        out.put("activeAlerts", alerts.active().size());
        return out;
    }

    @GetMapping("/alerts")
    public List<Alert> alerts(@RequestParam(defaultValue = "false") boolean active) {
        return active ? alerts.active() : alerts.history();
    }
}
