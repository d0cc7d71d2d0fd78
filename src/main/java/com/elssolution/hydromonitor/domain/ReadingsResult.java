package com.elssolution.hydromonitor.domain;

import lombok.Value;

import java.util.List;

@Value
public class ReadingsResult {
    List<SensorReading> readings;
    Provenance provenance;

    public static ReadingsResult of(List<SensorReading> readings, Provenance provenance) {
        return new ReadingsResult(List.copyOf(readings), provenance);
    }

    public boolean isDegraded() {
        return provenance == Provenance.SYNTHETIC;
    }
}
