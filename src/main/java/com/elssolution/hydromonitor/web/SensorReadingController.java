package com.elssolution.hydromonitor.web;

import com.elssolution.hydromonitor.domain.NewSensorReading;
import com.elssolution.hydromonitor.domain.ReadingsResult;
import com.elssolution.hydromonitor.domain.SensorReading;
import com.elssolution.hydromonitor.service.SensorDataService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class SensorReadingController {

    /** Which tier answered: FRESH, STALE_CACHE, STALE_STORAGE or SYNTHETIC. */
    static final String PROVENANCE_HEADER = "X-Data-Provenance";
    static final int MAX_LIMIT = 1000;

    private final SensorDataService data;

    public SensorReadingController(SensorDataService data) {
        this.data = data;
    }

    @GetMapping("/sensor-readings")
    public ResponseEntity<List<SensorReading>> getReadings(
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        ReadingsResult r = data.readLatest(Math.min(limit, MAX_LIMIT));
        return ResponseEntity.ok()
                .header(PROVENANCE_HEADER, r.getProvenance().name())
                .body(r.getReadings());
    }

    @GetMapping("/sensor-readings/latest")
    public ResponseEntity<SensorReading> getLatest() {
        ReadingsResult r = data.readLatest(1);
        SensorReading latest = r.getReadings().isEmpty() ? null : r.getReadings().get(0);
        return ResponseEntity.ok()
                .header(PROVENANCE_HEADER, r.getProvenance().name())
                .body(latest);
    }

    @GetMapping("/sensor-readings/range")
    public List<SensorReading> getRange(@RequestParam("startTime") String startTime,
                                        @RequestParam("endTime") String endTime) {
        return data.getSensorReadingsByTimeRange(parseInstant(startTime), parseInstant(endTime));
    }

    @PostMapping("/sensor-readings")
    public ResponseEntity<SensorReading> create(@RequestBody NewSensorReading body) {
        SensorReading created = data.createSensorReading(body);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    /** Forces a read cycle (remote fetch unless inside the cache window). */
    @PostMapping("/sync")
    public Map<String, Object> sync() {
        ReadingsResult r = data.readLatest(1);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("latestReading", r.getReadings().isEmpty() ? null : r.getReadings().get(0));
        out.put("provenance", r.getProvenance());
        out.put("connectionStatus", data.getSystemStatus().getConnectionStatus());
        return out;
    }

    /** ISO instant ("...Z") or an offset date-time ("...+07:00"). */
    static Instant parseInstant(String raw) {
        String s = raw == null ? "" : raw.trim();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(s).toInstant();
        }
    }
}
