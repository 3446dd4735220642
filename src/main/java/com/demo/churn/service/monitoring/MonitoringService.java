package com.demo.churn.service.monitoring;

import com.demo.churn.service.alert.Alert;
import com.demo.churn.service.alert.AlertEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/** Closes monitoring windows on schedule or on demand and feeds them to the alert engine. */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitoringService {

    private final PredictionMonitor monitor;
    private final AlertEngine alerts;

    @Scheduled(cron = "${churn.monitoring.snapshot-cron:0 0 0 * * *}")
    public void scheduledSnapshot() {
        closeWindow();
    }

    public MonitoringSnapshot closeWindow() {
        MonitoringSnapshot snapshot = monitor.snapshot();
        List<Alert> opened = alerts.evaluate(snapshot, monitor.history());
        if (!opened.isEmpty()) {
            log.warn("{} alert(s) opened by window ending {}", opened.size(), snapshot.getWindowEnd());
        }
        return snapshot;
    }
}
