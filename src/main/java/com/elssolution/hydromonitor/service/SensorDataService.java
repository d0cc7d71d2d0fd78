package com.elssolution.hydromonitor.service;

import com.elssolution.hydromonitor.alerts.AlertService;
import com.elssolution.hydromonitor.domain.*;
import com.elssolution.hydromonitor.entity.AlertSettingsEntity;
import com.elssolution.hydromonitor.entity.SensorReadingEntity;
import com.elssolution.hydromonitor.entity.SystemStatusEntity;
import com.elssolution.hydromonitor.integration.remote.RemoteFetchException;
import com.elssolution.hydromonitor.integration.remote.RemoteReadingClient;
import com.elssolution.hydromonitor.repository.AlertSettingsRepository;
import com.elssolution.hydromonitor.repository.SensorReadingRepository;
import com.elssolution.hydromonitor.repository.SystemStatusRepository;
import jakarta.annotation.PostConstruct;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Read/write entry point for sensor data, shared by the REST layer and the poller.
 *
 * Tiers, in order of preference:
 *   1. remote device service (at most one fetch per cache window),
 *   2. durable store (JPA),
 *   3. in-memory fallback buffer, seeded with sample readings.
 *
 * Nothing here throws to the caller except for invalid input: storage and remote failures
 * are absorbed, flip the store-health flag where relevant, and degrade to the next tier.
 *
 * Locking: the refresh decision + remote fetch run under {@code refreshLock};
 * the fallback buffer and the in-memory status/settings have their own monitors.
 * Lock order is refreshLock -> statusLock, never the reverse.
 */
@Slf4j
@Service
public class SensorDataService {

    /** Outcome of the refresh step of a read. */
    enum Refresh { CACHE_HIT, FRESH, FAILED }

    private final SensorReadingRepository readingRepo;
    private final SystemStatusRepository statusRepo;
    private final AlertSettingsRepository settingsRepo;
    private final RemoteReadingClient remote;
    private final FallbackDataGenerator fallbackGenerator;
    private final ResourceGauges gauges;
    private final AlertService alerts;

    // === Config ===
    /** Minimum gap between two remote fetches (ms). */
    @Setter
    @Value("${hydro.cache.timeoutMs:10000}")
    private long cacheTimeoutMs = 10_000;

    /** "development" persists a sample row when the store is empty. */
    @Setter
    @Value("${hydro.runMode:production}")
    private String runMode = "production";

    /** Max readings kept in the in-memory buffer; oldest dropped first. */
    @Setter
    @Value("${hydro.fallback.capacity:500}")
    private int fallbackCapacity = 500;

    // === Shared state ===
    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile long lastExternalFetchTime = 0L;   // written under refreshLock
    private volatile boolean storeHealthy = true;

    private final Deque<SensorReading> fallbackBuffer = new ArrayDeque<>(); // newest first, guarded by itself
    private final Object statusLock = new Object();
    private SystemStatus memoryStatus;       // guarded by statusLock
    private AlertSettings memorySettings;    // guarded by statusLock

    public SensorDataService(SensorReadingRepository readingRepo,
                             SystemStatusRepository statusRepo,
                             AlertSettingsRepository settingsRepo,
                             RemoteReadingClient remote,
                             FallbackDataGenerator fallbackGenerator,
                             ResourceGauges gauges,
                             AlertService alerts) {
        this.readingRepo = readingRepo;
        this.statusRepo = statusRepo;
        this.settingsRepo = settingsRepo;
        this.remote = remote;
        this.fallbackGenerator = fallbackGenerator;
        this.gauges = gauges;
        this.alerts = alerts;

        this.memoryStatus = defaultStatus(ConnectionStatus.ERROR, Instant.now());
        this.memorySettings = AlertSettings.defaults();
        synchronized (fallbackBuffer) {
            fallbackGenerator.populateIfEmpty(fallbackBuffer);
        }
    }

    /** Startup probe: make sure the singleton rows exist; any failure means fallback mode. */
    @PostConstruct
    void initializeDefaults() {
        if (fallbackCapacity < FallbackDataGenerator.SAMPLE_COUNT) {
            log.warn("hydro.fallback.capacity too small ({}). Using {}.", fallbackCapacity, FallbackDataGenerator.SAMPLE_COUNT);
            fallbackCapacity = FallbackDataGenerator.SAMPLE_COUNT;
        }
        try {
            if (statusRepo.findFirstByOrderByIdAsc().isEmpty()) {
                statusRepo.save(new SystemStatusEntity().apply(defaultStatus(ConnectionStatus.CONNECTED, Instant.now())));
            }
            if (settingsRepo.findFirstByOrderByIdAsc().isEmpty()) {
                settingsRepo.save(new AlertSettingsEntity().apply(AlertSettings.defaults()));
            }
            markStoreHealthy();
            log.info("Durable store reachable; cacheTimeoutMs={} runMode={} fallbackCapacity={}",
                    cacheTimeoutMs, runMode, fallbackCapacity);
        } catch (RuntimeException e) {
            markStoreFailed("startup probe", e);
            log.warn("Running in fallback mode without database persistence");
        }
    }

    // ---------------------- Readings ----------------------

    /** Most recent readings, newest first, at most {@code limit}. */
    public List<SensorReading> getSensorReadings(int limit) {
        return readLatest(limit).getReadings();
    }

    /**
     * Same as {@link #getSensorReadings(int)} but also says which tier answered.
     *
     * @throws IllegalArgumentException if limit &lt; 1
     */
    public ReadingsResult readLatest(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1, got " + limit);

        Refresh refresh = Refresh.FAILED;
        try {
            refresh = refresh();

            if (storeHealthy) {
                List<SensorReading> rows = readingRepo.findAllByOrderByTimestampDesc(PageRequest.of(0, limit))
                        .stream().map(SensorReadingEntity::toReading).toList();
                markStoreHealthy();
                if (!rows.isEmpty()) {
                    return ReadingsResult.of(rows, provenance(refresh, true));
                }
                if (isDevelopment()) {
                    SensorReadingEntity sample = readingRepo.save(
                            SensorReadingEntity.of(nowMillis(), 25.5, 6.8, 450));
                    log.info("Store empty, persisted one sample reading {} (development only)", sample.getId());
                    return ReadingsResult.of(List.of(sample.toReading()), Provenance.SYNTHETIC);
                }
                log.info("Store empty, serving in-memory fallback");
                return ReadingsResult.of(fallbackSnapshot(limit), Provenance.SYNTHETIC);
            }

            return fromBuffer(refresh, limit);

        } catch (RuntimeException e) {
            markStoreFailed("read latest", e);
            return fromBuffer(refresh, limit);
        }
    }

    /**
     * Readings with start &lt;= timestamp &lt;= end, oldest first.
     *
     * @throws IllegalArgumentException if a bound is missing or start is after end
     */
    public List<SensorReading> getSensorReadingsByTimeRange(Instant start, Instant end) {
        if (start == null || end == null) throw new IllegalArgumentException("start and end are required");
        if (start.isAfter(end)) throw new IllegalArgumentException("start must not be after end");

        try {
            refresh();
            if (storeHealthy) {
                List<SensorReading> rows = readingRepo.findByTimestampBetweenOrderByTimestampAsc(start, end)
                        .stream().map(SensorReadingEntity::toReading).toList();
                markStoreHealthy();
                return rows;
            }
        } catch (RuntimeException e) {
            markStoreFailed("range query", e);
        }
        return fallbackInRange(start, end);
    }

    /**
     * Manual insert; never calls the remote service.
     *
     * @throws IllegalArgumentException when a field is missing or not finite
     */
    public SensorReading createSensorReading(NewSensorReading fields) {
        if (fields == null) throw new IllegalArgumentException("reading fields are required");
        fields.validate();

        Instant now = nowMillis();
        if (storeHealthy) {
            try {
                SensorReading saved = readingRepo.save(
                        SensorReadingEntity.of(now, fields.getTemperature(), fields.getPh(), fields.getTdsLevel()))
                        .toReading();
                markStoreHealthy();
                refreshDataPoints();
                return saved;
            } catch (RuntimeException e) {
                markStoreFailed("create reading", e);
            }
        }

        SensorReading inMemory = SensorReading.builder()
                .id(SyntheticIds.next(SyntheticIds.MEMORY, now.toEpochMilli()))
                .timestamp(now)
                .createdAt(now)
                .temperature(fields.getTemperature())
                .ph(fields.getPh())
                .tdsLevel(fields.getTdsLevel())
                .build();
        pushFallback(inMemory);
        return inMemory;
    }

    // ---------------------- Refresh (cache / remote / store write) ----------------------

    /**
     * Decides whether this request fetches from the remote service, and if so stores the result.
     * Serialized so two concurrent callers cannot both fetch inside one cache window.
     */
    Refresh refresh() {
        refreshLock.lock();
        try {
            long now = System.currentTimeMillis();

            if (now - lastExternalFetchTime < cacheTimeoutMs) {
                if (!storeHealthy) return Refresh.CACHE_HIT; // the buffer already holds the last fetch
                try {
                    if (readingRepo.findFirstByOrderByTimestampDesc().isPresent()) {
                        markStoreHealthy();
                        return Refresh.CACHE_HIT;
                    }
                } catch (RuntimeException e) {
                    markStoreFailed("cache read", e);
                    return Refresh.CACHE_HIT;
                }
                // store healthy but empty: fetch anyway
            }

            Optional<SensorReading> fetched;
            try {
                fetched = remote.fetchLatestReading();
            } catch (RemoteFetchException e) {
                log.warn("remote_fetch_failed kind={} status={} msg={}", e.getKind(), e.getStatusCode(), e.getMessage());
                fetched = Optional.empty();
            }

            if (fetched.isEmpty()) {
                updateSystemStatus(SystemStatusUpdate.connection(ConnectionStatus.ERROR));
                return Refresh.FAILED;
            }

            lastExternalFetchTime = now;
            SensorReading remoteReading = fetched.get();
            updateSystemStatus(SystemStatusUpdate.connection(ConnectionStatus.CONNECTED));

            Instant fetchedAt = Instant.ofEpochMilli(now);
            if (storeHealthy) {
                try {
                    SensorReadingEntity saved = readingRepo.save(SensorReadingEntity.of(fetchedAt,
                            remoteReading.getTemperature(), remoteReading.getPh(), remoteReading.getTdsLevel()));
                    markStoreHealthy();
                    refreshDataPoints();
                    log.info("Fetched and stored reading {} (remote id {})", saved.getId(), remoteReading.getId());
                    return Refresh.FRESH;
                } catch (RuntimeException e) {
                    markStoreFailed("store write", e);
                }
            }

            pushFallback(remoteReading.toBuilder()
                    .id(SyntheticIds.next(SyntheticIds.EXTERNAL, now))
                    .timestamp(fetchedAt)
                    .createdAt(fetchedAt)
                    .build());
            log.info("Fetched reading kept in memory only (store unavailable)");
            return Refresh.FRESH;

        } catch (RuntimeException unexpected) {
            markStoreFailed("refresh", unexpected);
            return Refresh.FAILED;
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Buffer answer. A cache hit only counts as STALE_CACHE when the buffer head is a real
     * reading (fetched or entered by hand); generated samples are always SYNTHETIC.
     */
    private ReadingsResult fromBuffer(Refresh refresh, int limit) {
        List<SensorReading> served = fallbackSnapshot(limit);
        if (refresh == Refresh.FRESH) return ReadingsResult.of(served, Provenance.FRESH);
        boolean realHead = !served.isEmpty() && isRealReading(served.get(0));
        return ReadingsResult.of(served,
                refresh == Refresh.CACHE_HIT && realHead ? Provenance.STALE_CACHE : Provenance.SYNTHETIC);
    }

    private static boolean isRealReading(SensorReading r) {
        String id = r.getId();
        return id != null && (id.startsWith(SyntheticIds.EXTERNAL + "_") || id.startsWith(SyntheticIds.MEMORY + "_"));
    }

    private static Provenance provenance(Refresh refresh, boolean fromStore) {
        return switch (refresh) {
            case FRESH -> Provenance.FRESH;
            case CACHE_HIT -> Provenance.STALE_CACHE;
            case FAILED -> fromStore ? Provenance.STALE_STORAGE : Provenance.SYNTHETIC;
        };
    }

    private void refreshDataPoints() {
        try {
            updateSystemStatus(SystemStatusUpdate.dataPoints(readingRepo.count()));
        } catch (RuntimeException e) {
            markStoreFailed("count readings", e);
        }
    }

    // ---------------------- System status ----------------------

    /** Always tries the store (a success re-arms store health); falls back to the in-memory copy. */
    public SystemStatus getSystemStatus() {
        try {
            SystemStatus s;
            synchronized (statusLock) {
                s = statusRepo.findFirstByOrderByIdAsc()
                        .orElseGet(() -> statusRepo.save(new SystemStatusEntity()
                                .apply(defaultStatus(ConnectionStatus.CONNECTED, Instant.now()))))
                        .toStatus();
            }
            markStoreHealthy();
            return s;
        } catch (RuntimeException e) {
            markStoreFailed("status read", e);
            synchronized (statusLock) {
                return memoryStatus;
            }
        }
    }

    /** Merge update: null fields keep their value. Gauges not given by the caller are re-sampled. */
    public SystemStatus updateSystemStatus(SystemStatusUpdate update) {
        SystemStatusUpdate u = withGauges(update);
        Instant now = Instant.now();
        synchronized (statusLock) {
            memoryStatus = memoryStatus.merge(u, now);
            if (!storeHealthy) return memoryStatus;

            try {
                SystemStatusEntity row = statusRepo.findFirstByOrderByIdAsc()
                        .orElseGet(() -> new SystemStatusEntity().apply(defaultStatus(ConnectionStatus.CONNECTED, now)));
                SystemStatus merged = row.toStatus().merge(u, now);
                SystemStatus saved = statusRepo.save(row.apply(merged)).toStatus();
                markStoreHealthy();
                memoryStatus = saved;
                return saved;
            } catch (RuntimeException e) {
                markStoreFailed("status write", e);
                return memoryStatus;
            }
        }
    }

    // ---------------------- Alert settings ----------------------

    public AlertSettings getAlertSettings() {
        try {
            AlertSettings s = settingsRepo.findFirstByOrderByIdAsc()
                    .map(AlertSettingsEntity::toSettings)
                    .orElseGet(AlertSettings::defaults);
            markStoreHealthy();
            return s;
        } catch (RuntimeException e) {
            markStoreFailed("settings read", e);
            synchronized (statusLock) {
                return memorySettings;
            }
        }
    }

    public AlertSettings updateAlertSettings(AlertSettingsUpdate update) {
        synchronized (statusLock) {
            memorySettings = memorySettings.merge(update);
            if (!storeHealthy) return memorySettings;

            try {
                AlertSettingsEntity row = settingsRepo.findFirstByOrderByIdAsc()
                        .orElseGet(() -> new AlertSettingsEntity().apply(AlertSettings.defaults()));
                AlertSettings saved = settingsRepo.save(row.apply(row.toSettings().merge(update))).toSettings();
                markStoreHealthy();
                memorySettings = saved;
                return saved;
            } catch (RuntimeException e) {
                markStoreFailed("settings write", e);
                return memorySettings;
            }
        }
    }

    // ---------------------- Store health ----------------------

    public boolean isStoreHealthy() {
        return storeHealthy;
    }

    /** Cheap round-trip used by the poller while the store is marked down. */
    public boolean probeStorage() {
        if (storeHealthy) return true;
        try {
            long rows = readingRepo.count();
            markStoreHealthy();
            log.info("Durable store is back ({} readings)", rows);
            return true;
        } catch (RuntimeException e) {
            if (log.isDebugEnabled()) log.debug("store probe failed: {}", e.getMessage());
            return false;
        }
    }

    private void markStoreFailed(String op, RuntimeException e) {
        storeHealthy = false;
        log.warn("store_unavailable op={} err={}", op, e.toString());
        alerts.raise("STORAGE_DOWN", op + ": " + e.getMessage(), AlertService.Severity.WARN);
    }

    private void markStoreHealthy() {
        if (!storeHealthy) {
            storeHealthy = true;
            alerts.resolve("STORAGE_DOWN");
        }
    }

    // ---------------------- Fallback buffer ----------------------

    private void pushFallback(SensorReading r) {
        synchronized (fallbackBuffer) {
            fallbackGenerator.populateIfEmpty(fallbackBuffer);
            fallbackBuffer.addFirst(r);
            while (fallbackBuffer.size() > fallbackCapacity) fallbackBuffer.removeLast();
        }
    }

    private List<SensorReading> fallbackSnapshot(int limit) {
        synchronized (fallbackBuffer) {
            fallbackGenerator.populateIfEmpty(fallbackBuffer);
            return fallbackBuffer.stream().limit(limit).toList();
        }
    }

    private List<SensorReading> fallbackInRange(Instant start, Instant end) {
        synchronized (fallbackBuffer) {
            fallbackGenerator.populateIfEmpty(fallbackBuffer);
            return fallbackBuffer.stream()
                    .filter(r -> !r.getTimestamp().isBefore(start) && !r.getTimestamp().isAfter(end))
                    .sorted(Comparator.comparing(SensorReading::getTimestamp))
                    .toList();
        }
    }

    // ---------------------- helpers ----------------------

    private SystemStatus defaultStatus(ConnectionStatus cs, Instant now) {
        return SystemStatus.builder()
                .connectionStatus(cs)
                .lastUpdate(now)
                .dataPoints(0)
                .cpuUsage(gauges.cpuUsage())
                .memoryUsage(gauges.memoryUsage())
                .storageUsage(gauges.storageUsage())
                .uptime(gauges.uptime())
                .build();
    }

    private SystemStatusUpdate withGauges(SystemStatusUpdate u) {
        SystemStatusUpdate src = (u == null) ? SystemStatusUpdate.builder().build() : u;
        return SystemStatusUpdate.builder()
                .connectionStatus(src.getConnectionStatus())
                .dataPoints(src.getDataPoints())
                .cpuUsage(src.getCpuUsage() != null ? src.getCpuUsage() : gauges.cpuUsage())
                .memoryUsage(src.getMemoryUsage() != null ? src.getMemoryUsage() : gauges.memoryUsage())
                .storageUsage(src.getStorageUsage() != null ? src.getStorageUsage() : gauges.storageUsage())
                .uptime(src.getUptime() != null ? src.getUptime() : gauges.uptime())
                .build();
    }

    private boolean isDevelopment() {
        return "development".equalsIgnoreCase(runMode) || "dev".equalsIgnoreCase(runMode);
    }

    private static Instant nowMillis() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
