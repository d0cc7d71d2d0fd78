package com.elssolution.hydromonitor.service;

import com.elssolution.hydromonitor.domain.ReadingsResult;
import com.elssolution.hydromonitor.domain.SensorReading;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background driver: runs the read path on a fixed delay so the store keeps filling
 * even when nobody has the dashboard open. Also probes the store while it is marked down.
 */
@Slf4j
@Component
@Getter @Setter
public class SensorPollingService {

    private final SensorDataService data;
    private final ScheduledExecutorService scheduler;

    @Value("${hydro.poll.enabled:true}")
    private boolean enabled;

    /** Seconds between two poll cycles. */
    @Value("${hydro.poll.periodSeconds:10}")
    private int periodSeconds;

    @Value("${hydro.poll.initialDelaySeconds:5}")
    private int initialDelaySeconds;

    private volatile long lastPollMs = 0L;
    private volatile ScheduledFuture<?> handle;

    public SensorPollingService(SensorDataService data, ScheduledExecutorService scheduler) {
        this.data = data;
        this.scheduler = scheduler;
    }

    @PostConstruct
    void startPolling() {
        if (!enabled) {
            log.info("Sensor polling disabled (hydro.poll.enabled=false)");
            return;
        }
        if (periodSeconds < 1) {
            log.warn("hydro.poll.periodSeconds < 1 ({}). Using 10.", periodSeconds);
            periodSeconds = 10;
        }
        handle = scheduler.scheduleWithFixedDelay(this::pollOnceSafe,
                Math.max(0, initialDelaySeconds), periodSeconds, TimeUnit.SECONDS);
        log.info("Sensor polling: every={}s, initialDelay={}s", periodSeconds, initialDelaySeconds);
    }

    @PreDestroy
    void stopPolling() {
        ScheduledFuture<?> h = handle;
        if (h != null) h.cancel(false);
    }

    /** One cycle; never throws so the schedule keeps running. */
    void pollOnceSafe() {
        try {
            if (!data.isStoreHealthy()) data.probeStorage();

            ReadingsResult r = data.readLatest(1);
            lastPollMs = System.currentTimeMillis();
            if (log.isDebugEnabled()) {
                SensorReading latest = r.getReadings().isEmpty() ? null : r.getReadings().get(0);
                log.debug("poll: provenance={} storeHealthy={} latest={}", r.getProvenance(), data.isStoreHealthy(), latest);
            }
        } catch (Exception e) {
            log.warn("Sensor polling failed: {}", e.getMessage());
        }
    }
}
