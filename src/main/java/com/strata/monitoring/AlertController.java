package com.strata.monitoring;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final FailureAlertMonitor alertMonitor;

    public AlertController(FailureAlertMonitor alertMonitor) {
        this.alertMonitor = alertMonitor;
    }

    @GetMapping
    public List<Alert> listRecentAlerts() {
        return alertMonitor.recentAlerts();
    }

    @PostMapping("/check")
    public ResponseEntity<Alert> checkFailureRate() {
        return alertMonitor.checkFailureRate()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
