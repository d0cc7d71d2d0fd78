package com.elssolution.hydromonitor.health;

import com.elssolution.hydromonitor.domain.ConnectionStatus;
import com.elssolution.hydromonitor.domain.SystemStatus;
import com.elssolution.hydromonitor.service.SensorDataService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

/** UP when the remote service answered last time and the store is usable; DEGRADED otherwise (still serving). */
@Component("hydroMonitor")
public class HydroMonitorHealth implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");

    private final SensorDataService data;

    public HydroMonitorHealth(SensorDataService data) { this.data = data; }

    @Override public Health health() {
        SystemStatus s = data.getSystemStatus();
        boolean storeOk = data.isStoreHealthy();
        boolean remoteOk = s.getConnectionStatus() == ConnectionStatus.CONNECTED;

        return Health.status(storeOk && remoteOk ? Status.UP : DEGRADED)
                .withDetail("connectionStatus", s.getConnectionStatus())
                .withDetail("storeHealthy", storeOk)
                .withDetail("dataPoints", s.getDataPoints())
                .withDetail("lastUpdate", String.valueOf(s.getLastUpdate()))
                .withDetail("uptime", s.getUptime())
                .build();
    }
}
