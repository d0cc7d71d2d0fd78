package com.elssolution.hydromonitor.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/** Immutable reading: one temperature / pH / TDS sample at a point in time. */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class SensorReading {
    String id;
    Instant timestamp;
    Instant createdAt;
    double temperature;
    double ph;
    double tdsLevel;
}
