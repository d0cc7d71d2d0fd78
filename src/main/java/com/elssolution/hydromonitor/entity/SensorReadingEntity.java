package com.elssolution.hydromonitor.entity;

import com.elssolution.hydromonitor.domain.SensorReading;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "sensor_readings", indexes = @Index(name = "idx_sensor_readings_ts", columnList = "timestamp"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SensorReadingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private double temperature;

    @Column(nullable = false)
    private double ph;

    @Column(name = "tds_level", nullable = false)
    private double tdsLevel;

    /** New row; id is assigned by the store. */
    public static SensorReadingEntity of(Instant timestamp, double temperature, double ph, double tdsLevel) {
        return new SensorReadingEntity(null, timestamp, timestamp, temperature, ph, tdsLevel);
    }

    public SensorReading toReading() {
        return SensorReading.builder()
                .id(id)
                .timestamp(timestamp)
                .createdAt(createdAt)
                .temperature(temperature)
                .ph(ph)
                .tdsLevel(tdsLevel)
                .build();
    }
}
