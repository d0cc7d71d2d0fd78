package com.elssolution.hydromonitor.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Values decoded from a device hex payload. Superset across device families;
 * a field is null when the family does not carry it.
 */
@Value
@Builder
public class DecodedPayload {
    Double ph;
    Double ec;
    Double temperature;
    Double tdsLevel;
    Double moisture;
    Double humidity;
    Double light;

    /** TDS if the device reports it, else EC, else 0. */
    public double tdsOrEc() {
        if (tdsLevel != null) return tdsLevel;
        return ec != null ? ec : 0.0;
    }
}
