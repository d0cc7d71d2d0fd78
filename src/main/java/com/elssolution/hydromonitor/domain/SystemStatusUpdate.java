package com.elssolution.hydromonitor.domain;

import lombok.Builder;
import lombok.Value;

/** Partial status update. Unset (null) fields are left untouched. */
@Value
@Builder
public class SystemStatusUpdate {
    ConnectionStatus connectionStatus;
    Long dataPoints;
    Double cpuUsage;
    Double memoryUsage;
    Double storageUsage;
    String uptime;

    public static SystemStatusUpdate connection(ConnectionStatus s) {
        return SystemStatusUpdate.builder().connectionStatus(s).build();
    }

    public static SystemStatusUpdate dataPoints(long count) {
        return SystemStatusUpdate.builder().dataPoints(count).build();
    }
}
