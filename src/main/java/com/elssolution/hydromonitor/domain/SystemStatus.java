package com.elssolution.hydromonitor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class SystemStatus {
    ConnectionStatus connectionStatus;
    Instant lastUpdate;
    long dataPoints;
    double cpuUsage;       // %
    double memoryUsage;    // % of max heap
    double storageUsage;   // % of the working directory's volume
    String uptime;         // e.g. "3d 14h 22m"

    /** Merge: null fields in the update keep the current value; lastUpdate is always refreshed. */
    public SystemStatus merge(SystemStatusUpdate u, Instant now) {
        if (u == null) return toBuilder().lastUpdate(now).build();
        return toBuilder()
                .connectionStatus(u.getConnectionStatus() != null ? u.getConnectionStatus() : connectionStatus)
                .dataPoints(u.getDataPoints() != null ? u.getDataPoints() : dataPoints)
                .cpuUsage(u.getCpuUsage() != null ? u.getCpuUsage() : cpuUsage)
                .memoryUsage(u.getMemoryUsage() != null ? u.getMemoryUsage() : memoryUsage)
                .storageUsage(u.getStorageUsage() != null ? u.getStorageUsage() : storageUsage)
                .uptime(u.getUptime() != null ? u.getUptime() : uptime)
                .lastUpdate(now)
                .build();
    }
}
