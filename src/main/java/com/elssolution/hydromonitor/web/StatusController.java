package com.elssolution.hydromonitor.web;

import com.elssolution.hydromonitor.alerts.AlertService;
import com.elssolution.hydromonitor.domain.AlertSettings;
import com.elssolution.hydromonitor.domain.AlertSettingsUpdate;
import com.elssolution.hydromonitor.domain.SystemStatus;
import com.elssolution.hydromonitor.service.SensorDataService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class StatusController {

    private final AlertService alerts;

    private final SensorDataService data;

    public StatusController(AlertService alerts, SensorDataService data) {
        this.alerts = alerts;
        this.data = data;
    }

    @GetMapping("/system-status")
    public SystemStatus getStatus() {
        return data.getSystemStatus();
    }

    @GetMapping("/alert-settings")
    public AlertSettings getAlertSettings() {
        return data.getAlertSettings();
    }

    @PutMapping("/alert-settings")
    public AlertSettings updateAlertSettings(@RequestBody AlertSettingsUpdate body) {
        if (body == null) throw new IllegalArgumentException("alert settings body is required");
        return data.updateAlertSettings(body);
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }
}
