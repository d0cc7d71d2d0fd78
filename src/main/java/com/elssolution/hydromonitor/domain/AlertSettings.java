package com.elssolution.hydromonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class AlertSettings {
    boolean temperatureAlerts;
    boolean phAlerts;
    boolean tdsLevelAlerts;

    public static AlertSettings defaults() {
        return new AlertSettings(true, true, false);
    }

    public AlertSettings merge(AlertSettingsUpdate u) {
        if (u == null) return this;
        return new AlertSettings(
                u.getTemperatureAlerts() != null ? u.getTemperatureAlerts() : temperatureAlerts,
                u.getPhAlerts() != null ? u.getPhAlerts() : phAlerts,
                u.getTdsLevelAlerts() != null ? u.getTdsLevelAlerts() : tdsLevelAlerts);
    }
}
