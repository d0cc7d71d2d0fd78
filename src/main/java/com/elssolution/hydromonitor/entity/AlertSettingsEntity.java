package com.elssolution.hydromonitor.entity;

import com.elssolution.hydromonitor.domain.AlertSettings;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "alert_settings")
@Data
@NoArgsConstructor
public class AlertSettingsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private boolean temperatureAlerts = true;
    private boolean phAlerts = true;
    private boolean tdsLevelAlerts = false;

    public AlertSettings toSettings() {
        return new AlertSettings(temperatureAlerts, phAlerts, tdsLevelAlerts);
    }

    public AlertSettingsEntity apply(AlertSettings s) {
        this.temperatureAlerts = s.isTemperatureAlerts();
        this.phAlerts = s.isPhAlerts();
        this.tdsLevelAlerts = s.isTdsLevelAlerts();
        return this;
    }
}
