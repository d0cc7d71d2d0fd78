package com.elssolution.hydromonitor.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceGaugesTest {

    private final ResourceGauges gauges = new ResourceGauges();

    @Test
    void uptime_is_human_readable() {
        assertThat(ResourceGauges.humanUptime(0)).isEqualTo("0h 0m");
        assertThat(ResourceGauges.humanUptime(59_999)).isEqualTo("0h 0m");
        assertThat(ResourceGauges.humanUptime((2 * 60 + 5) * 60_000L)).isEqualTo("2h 5m");
        assertThat(ResourceGauges.humanUptime(((3 * 24 + 14) * 60 + 22) * 60_000L)).isEqualTo("3d 14h 22m");
    }

    @Test
    void percentages_stay_in_range() {
        assertThat(gauges.cpuUsage()).isBetween(0.0, 100.0);
        assertThat(gauges.memoryUsage()).isBetween(0.0, 100.0);
        assertThat(gauges.storageUsage()).isBetween(0.0, 100.0);
        assertThat(gauges.uptime()).matches("(\\d+d )?\\d+h \\d+m");
    }
}
