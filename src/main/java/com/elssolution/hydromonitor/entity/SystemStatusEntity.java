package com.elssolution.hydromonitor.entity;

import com.elssolution.hydromonitor.domain.ConnectionStatus;
import com.elssolution.hydromonitor.domain.SystemStatus;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Singleton row; the service keeps at most one. */
@Entity
@Table(name = "system_status")
@Data
@NoArgsConstructor
public class SystemStatusEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "connection_status", nullable = false, length = 16)
    private ConnectionStatus connectionStatus = ConnectionStatus.CONNECTED;

    @Column(name = "last_update", nullable = false)
    private Instant lastUpdate;

    @Column(name = "data_points", nullable = false)
    private long dataPoints;

    private double cpuUsage;
    private double memoryUsage;
    private double storageUsage;

    @Column(length = 32)
    private String uptime;

    public SystemStatus toStatus() {
        return SystemStatus.builder()
                .connectionStatus(connectionStatus)
                .lastUpdate(lastUpdate)
                .dataPoints(dataPoints)
                .cpuUsage(cpuUsage)
                .memoryUsage(memoryUsage)
                .storageUsage(storageUsage)
                .uptime(uptime)
                .build();
    }

    /** Copies every field of the status into this row (id untouched). */
    public SystemStatusEntity apply(SystemStatus s) {
        this.connectionStatus = s.getConnectionStatus();
        this.lastUpdate = s.getLastUpdate();
        this.dataPoints = s.getDataPoints();
        this.cpuUsage = s.getCpuUsage();
        this.memoryUsage = s.getMemoryUsage();
        this.storageUsage = s.getStorageUsage();
        this.uptime = s.getUptime();
        return this;
    }
}
