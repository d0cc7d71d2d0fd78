package com.elssolution.hydromonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial alert-settings update; also the PUT body of /api/alert-settings. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertSettingsUpdate {
    private Boolean temperatureAlerts;
    private Boolean phAlerts;
    private Boolean tdsLevelAlerts;
}
