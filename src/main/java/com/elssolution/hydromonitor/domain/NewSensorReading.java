package com.elssolution.hydromonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Fields of a manually entered reading. Boxed so a missing JSON field shows up as null. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NewSensorReading {
    private Double temperature;
    private Double ph;
    private Double tdsLevel;

    /** @throws IllegalArgumentException when a field is missing or not a finite number */
    public void validate() {
        requireFinite("temperature", temperature);
        requireFinite("ph", ph);
        requireFinite("tdsLevel", tdsLevel);
    }

    private static void requireFinite(String name, Double v) {
        if (v == null || !Double.isFinite(v)) {
            throw new IllegalArgumentException(name + " must be a finite number");
        }
    }
}
