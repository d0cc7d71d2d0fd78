package com.elssolution.hydromonitor.service;

import com.elssolution.hydromonitor.domain.SensorReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Plausible hydroponic samples for when neither the remote service nor the store can answer.
 * Five readings one minute apart, newest at now - 1 min.
 */
@Slf4j
@Component
public class FallbackDataGenerator {

    static final int SAMPLE_COUNT = 5;

    // temperature (°C), pH, TDS (ppm); newest first
    private static final double[][] SAMPLES = {
            {24.2, 6.1, 950},
            {24.8, 6.0, 920},
            {25.1, 5.9, 980},
            {25.3, 6.2, 960},
            {24.9, 6.0, 940},
    };

    public List<SensorReading> sampleReadings(Instant now) {
        Instant base = now.truncatedTo(ChronoUnit.MILLIS);
        List<SensorReading> out = new ArrayList<>(SAMPLE_COUNT);
        for (int i = 0; i < SAMPLES.length; i++) {
            Instant ts = base.minus(Duration.ofMinutes(i + 1L));
            out.add(SensorReading.builder()
                    .id(SyntheticIds.next(SyntheticIds.SAMPLE, base.toEpochMilli() - i))
                    .timestamp(ts)
                    .createdAt(ts)
                    .temperature(SAMPLES[i][0])
                    .ph(SAMPLES[i][1])
                    .tdsLevel(SAMPLES[i][2])
                    .build());
        }
        return out;
    }

    /**
     * Fills the buffer with samples only when it is empty, so readings that were
     * pushed there by the remote or manual paths are never replaced.
     * Caller holds the buffer's monitor.
     *
     * @return true if samples were added
     */
    public boolean populateIfEmpty(Deque<SensorReading> buffer) {
        if (!buffer.isEmpty()) return false;
        buffer.addAll(sampleReadings(Instant.now()));
        log.info("Fallback buffer initialized with {} sample readings", SAMPLE_COUNT);
        return true;
    }
}
