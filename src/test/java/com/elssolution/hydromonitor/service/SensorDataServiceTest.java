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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SensorDataServiceTest {

    private SensorReadingRepository readingRepo;
    private SystemStatusRepository statusRepo;
    private AlertSettingsRepository settingsRepo;
    private RemoteReadingClient remote;
    private AlertService alerts;
    private SensorDataService service;

    private final AtomicInteger ids = new AtomicInteger();
    private SensorReadingEntity storedRow;

    @BeforeEach
    void setUp() {
        readingRepo = mock(SensorReadingRepository.class);
        statusRepo = mock(SystemStatusRepository.class);
        settingsRepo = mock(AlertSettingsRepository.class);
        remote = mock(RemoteReadingClient.class);
        alerts = new AlertService();

        storedRow = SensorReadingEntity.of(Instant.parse("2026-10-19T08:00:00Z"), 24.0, 6.3, 900);
        storedRow.setId("db-0");

        service = new SensorDataService(readingRepo, statusRepo, settingsRepo, remote,
                new FallbackDataGenerator(), new ResourceGauges(), alerts);
    }

    // ---------------------- cache window ----------------------

    @Test
    void two_reads_inside_the_cache_window_fetch_once() throws Exception {
        storeUp();
        when(remote.fetchLatestReading()).thenReturn(Optional.of(remoteReading()));

        ReadingsResult first = service.readLatest(10);
        ReadingsResult second = service.readLatest(10);

        verify(remote, times(1)).fetchLatestReading();
        assertThat(first.getProvenance()).isEqualTo(Provenance.FRESH);
        assertThat(second.getProvenance()).isEqualTo(Provenance.STALE_CACHE);
        verify(readingRepo, times(1)).save(any(SensorReadingEntity.class));
    }

    @Test
    void expired_cache_window_fetches_again() throws Exception {
        storeUp();
        service.setCacheTimeoutMs(0);
        when(remote.fetchLatestReading()).thenReturn(Optional.of(remoteReading()));

        service.readLatest(1);
        service.readLatest(1);

        verify(remote, times(2)).fetchLatestReading();
    }

    @Test
    void empty_store_inside_the_window_still_fetches() throws Exception {
        storeUp();
        when(readingRepo.findFirstByOrderByTimestampDesc()).thenReturn(Optional.empty());
        when(remote.fetchLatestReading()).thenReturn(Optional.of(remoteReading()));

        service.readLatest(1);
        service.readLatest(1);

        verify(remote, times(2)).fetchLatestReading();
    }

    @Test
    void concurrent_reads_share_one_fetch() throws Exception {
        storeUp();
        when(remote.fetchLatestReading()).thenAnswer(inv -> {
            Thread.sleep(200);
            return Optional.of(remoteReading());
        });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<ReadingsResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return service.readLatest(5);
                }));
            }
            go.countDown();
            for (Future<ReadingsResult> f : results) {
                assertThat(f.get(5, TimeUnit.SECONDS).getReadings()).isNotEmpty();
            }
        } finally {
            pool.shutdownNow();
        }

        verify(remote, times(1)).fetchLatestReading();
    }

    // ---------------------- fetch outcomes ----------------------

    @Test
    void fetched_reading_is_stored_with_fetch_time_and_status_connected() throws Exception {
        storeUp();
        SensorReading r = remoteReading().toBuilder().timestamp(Instant.parse("2020-01-01T00:00:00Z")).build();
        when(remote.fetchLatestReading()).thenReturn(Optional.of(r));

        Instant before = Instant.now().minusMillis(1);
        service.readLatest(1);

        verify(readingRepo).save(argThat((SensorReadingEntity e) ->
                e.getTemperature() == 25.0 && e.getPh() == 6.56 && e.getTdsLevel() == 94.0
                        && !e.getTimestamp().isBefore(before)));
        verify(statusRepo, atLeastOnce()).save(argThat((SystemStatusEntity s) ->
                s.getConnectionStatus() == ConnectionStatus.CONNECTED));
    }

    @Test
    void failed_fetch_with_rows_in_store_is_stale_storage() throws Exception {
        storeUp();
        when(remote.fetchLatestReading())
                .thenThrow(new RemoteFetchException(RemoteFetchException.Kind.TIMEOUT, "timed out", null));

        ReadingsResult r = service.readLatest(10);

        assertThat(r.getProvenance()).isEqualTo(Provenance.STALE_STORAGE);
        assertThat(r.getReadings()).extracting(SensorReading::getId).containsExactly("db-0");
        assertThat(service.isStoreHealthy()).isTrue();
        verify(statusRepo, atLeastOnce()).save(argThat((SystemStatusEntity s) ->
                s.getConnectionStatus() == ConnectionStatus.ERROR));
    }

    @Test
    void unusable_remote_body_counts_as_a_failed_fetch() throws Exception {
        storeUp();
        when(remote.fetchLatestReading()).thenReturn(Optional.empty());

        assertThat(service.readLatest(1).getProvenance()).isEqualTo(Provenance.STALE_STORAGE);
        verify(readingRepo, never()).save(any(SensorReadingEntity.class));
    }

    @Test
    void empty_store_in_production_serves_synthetic_samples() throws Exception {
        storeUp();
        when(readingRepo.findAllByOrderByTimestampDesc(any(Pageable.class))).thenReturn(List.of());
        when(remote.fetchLatestReading()).thenReturn(Optional.empty());

        ReadingsResult r = service.readLatest(50);

        assertThat(r.getProvenance()).isEqualTo(Provenance.SYNTHETIC);
        assertThat(r.isDegraded()).isTrue();
        assertThat(r.getReadings()).hasSize(FallbackDataGenerator.SAMPLE_COUNT)
                .allMatch(x -> x.getId().startsWith("sample_"));
        verify(readingRepo, never()).save(any(SensorReadingEntity.class));
    }

    @Test
    void empty_store_in_development_persists_one_sample() throws Exception {
        storeUp();
        service.setRunMode("development");
        when(readingRepo.findAllByOrderByTimestampDesc(any(Pageable.class))).thenReturn(List.of());
        when(remote.fetchLatestReading()).thenReturn(Optional.empty());

        ReadingsResult r = service.readLatest(50);

        assertThat(r.getReadings()).hasSize(1);
        SensorReading sample = r.getReadings().get(0);
        assertThat(sample.getTemperature()).isEqualTo(25.5);
        assertThat(sample.getPh()).isEqualTo(6.8);
        assertThat(sample.getTdsLevel()).isEqualTo(450.0);
        verify(readingRepo).save(any(SensorReadingEntity.class));
    }

    @Test
    void limit_below_one_is_rejected() {
        assertThatThrownBy(() -> service.readLatest(0)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(remote, readingRepo);
    }

    // ---------------------- storage down ----------------------

    @Test
    void storage_failure_switches_every_path_to_memory() throws Exception {
        storeDown();
        when(remote.fetchLatestReading()).thenReturn(Optional.of(remoteReading()));

        ReadingsResult first = service.readLatest(10);

        assertThat(service.isStoreHealthy()).isFalse();
        assertThat(alerts.isActive("STORAGE_DOWN")).isTrue();
        assertThat(first.getProvenance()).isEqualTo(Provenance.FRESH);
        SensorReading newest = first.getReadings().get(0);
        assertThat(newest.getId()).startsWith("external_");
        assertThat(newest.getTemperature()).isEqualTo(25.0);
        // 5 samples behind the fetched reading
        assertThat(first.getReadings()).hasSize(1 + FallbackDataGenerator.SAMPLE_COUNT);

        clearInvocations(readingRepo, statusRepo, settingsRepo, remote);

        ReadingsResult cached = service.readLatest(10);
        SensorReading created = service.createSensorReading(new NewSensorReading(21.0, 6.5, 800.0));
        List<SensorReading> afterCreate = service.getSensorReadings(1);
        SystemStatus status = service.updateSystemStatus(SystemStatusUpdate.dataPoints(7));
        AlertSettings settings = service.updateAlertSettings(AlertSettingsUpdate.builder().phAlerts(false).build());

        assertThat(cached.getProvenance()).isEqualTo(Provenance.STALE_CACHE);
        assertThat(created.getId()).startsWith("memory_");
        assertThat(afterCreate).containsExactly(created);
        assertThat(status.getDataPoints()).isEqualTo(7);
        assertThat(status.getConnectionStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(settings.isPhAlerts()).isFalse();
        assertThat(settings.isTemperatureAlerts()).isTrue();
        verifyNoInteractions(readingRepo, statusRepo, settingsRepo, remote);
    }

    @Test
    void cache_hit_served_from_samples_only_is_synthetic() throws Exception {
        storeUp();
        when(remote.fetchLatestReading()).thenReturn(Optional.of(remoteReading()));
        assertThat(service.readLatest(10).getProvenance()).isEqualTo(Provenance.FRESH);

        // the fetched reading went to the store, so the buffer still holds only samples
        when(readingRepo.findFirstByOrderByTimestampDesc())
                .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        ReadingsResult second = service.readLatest(10);

        verify(remote, times(1)).fetchLatestReading();
        assertThat(service.isStoreHealthy()).isFalse();
        assertThat(second.getProvenance()).isEqualTo(Provenance.SYNTHETIC);
        assertThat(second.getReadings()).allMatch(r -> r.getId().startsWith("sample_"));
    }

    @Test
    void cache_hit_on_a_manual_reading_in_memory_is_stale_cache() throws Exception {
        storeDown();
        when(remote.fetchLatestReading()).thenReturn(Optional.of(remoteReading()));
        service.readLatest(1);
        SensorReading manual = service.createSensorReading(new NewSensorReading(20.5, 6.4, 700.0));

        ReadingsResult r = service.readLatest(1);

        assertThat(r.getProvenance()).isEqualTo(Provenance.STALE_CACHE);
        assertThat(r.getReadings()).containsExactly(manual);
    }

    @Test
    void create_round_trips_through_memory_when_store_is_down() throws Exception {
        storeDown();
        when(remote.fetchLatestReading())
                .thenThrow(new RemoteFetchException(RemoteFetchException.Kind.TRANSPORT, "refused", null));

        SensorReading created = service.createSensorReading(new NewSensorReading(22.5, 6.1, 640.0));
        ReadingsResult r = service.readLatest(1);

        assertThat(r.getReadings()).containsExactly(created);
        assertThat(r.getProvenance()).isEqualTo(Provenance.SYNTHETIC);
    }

    @Test
    void fallback_buffer_is_capped() throws Exception {
        storeDown();
        service.setFallbackCapacity(8);
        for (int i = 0; i < 20; i++) {
            service.createSensorReading(new NewSensorReading(20.0 + i, 6.0, 500.0));
        }
        when(remote.fetchLatestReading()).thenReturn(Optional.empty());

        List<SensorReading> all = service.getSensorReadings(100);

        assertThat(all).hasSize(8);
        assertThat(all.get(0).getTemperature()).isEqualTo(39.0);
    }

    @Test
    void range_query_on_fallback_is_filtered_and_ascending() throws Exception {
        storeDown();
        when(remote.fetchLatestReading()).thenReturn(Optional.empty());
        service.createSensorReading(new NewSensorReading(21.0, 6.5, 800.0));

        Instant now = Instant.now();
        List<SensorReading> window = service.getSensorReadingsByTimeRange(
                now.minus(Duration.ofSeconds(150)), now.plusSeconds(1));

        // samples at -1 and -2 min plus the manual one
        assertThat(window).hasSize(3);
        assertThat(window).isSortedAccordingTo((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
        assertThat(window.get(2).getId()).startsWith("memory_");
    }

    @Test
    void range_bounds_are_validated() {
        Instant now = Instant.now();
        assertThatThrownBy(() -> service.getSensorReadingsByTimeRange(now, now.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.getSensorReadingsByTimeRange(null, now))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void range_query_hits_the_store_when_healthy() throws Exception {
        storeUp();
        when(remote.fetchLatestReading()).thenReturn(Optional.empty());
        Instant start = Instant.parse("2026-10-19T07:00:00Z");
        Instant end = Instant.parse("2026-10-19T09:00:00Z");
        when(readingRepo.findByTimestampBetweenOrderByTimestampAsc(start, end)).thenReturn(List.of(storedRow));

        assertThat(service.getSensorReadingsByTimeRange(start, end))
                .extracting(SensorReading::getId).containsExactly("db-0");
    }

    @Test
    void invalid_manual_reading_is_rejected_before_touching_storage() {
        assertThatThrownBy(() -> service.createSensorReading(new NewSensorReading(Double.NaN, 6.0, 500.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("temperature");
        assertThatThrownBy(() -> service.createSensorReading(new NewSensorReading(20.0, null, 500.0)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(readingRepo, statusRepo, remote);
    }

    // ---------------------- status & settings ----------------------

    @Test
    void status_update_keeps_fields_it_does_not_name() {
        storeUp();
        SystemStatusEntity row = new SystemStatusEntity();
        row.setId(1L);
        row.apply(SystemStatus.builder()
                .connectionStatus(ConnectionStatus.CONNECTED)
                .lastUpdate(Instant.parse("2020-01-01T00:00:00Z"))
                .dataPoints(42)
                .uptime("1h 2m")
                .build());
        when(statusRepo.findFirstByOrderByIdAsc()).thenReturn(Optional.of(row));

        SystemStatus s = service.updateSystemStatus(SystemStatusUpdate.connection(ConnectionStatus.ERROR));

        assertThat(s.getConnectionStatus()).isEqualTo(ConnectionStatus.ERROR);
        assertThat(s.getDataPoints()).isEqualTo(42);
        assertThat(s.getLastUpdate()).isAfter(Instant.parse("2020-01-01T00:00:00Z"));
    }

    @Test
    void status_read_creates_the_default_row_and_rearms_store_health() {
        storeDown();
        service.createSensorReading(new NewSensorReading(21.0, 6.5, 800.0));
        assertThat(service.isStoreHealthy()).isFalse();

        reset(statusRepo);
        when(statusRepo.findFirstByOrderByIdAsc()).thenReturn(Optional.empty());
        when(statusRepo.save(any(SystemStatusEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        SystemStatus s = service.getSystemStatus();

        assertThat(s.getConnectionStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(s.getDataPoints()).isZero();
        assertThat(service.isStoreHealthy()).isTrue();
        assertThat(alerts.isActive("STORAGE_DOWN")).isFalse();
    }

    @Test
    void settings_default_when_no_row_exists() {
        storeUp();
        assertThat(service.getAlertSettings()).isEqualTo(AlertSettings.defaults());
    }

    @Test
    void probe_brings_the_store_back() {
        storeDown();
        service.createSensorReading(new NewSensorReading(21.0, 6.5, 800.0));
        assertThat(service.probeStorage()).isFalse();

        reset(readingRepo);
        when(readingRepo.count()).thenReturn(3L);

        assertThat(service.probeStorage()).isTrue();
        assertThat(service.isStoreHealthy()).isTrue();
    }

    @Test
    void startup_probe_failure_means_fallback_mode() {
        storeDown();

        service.initializeDefaults();

        assertThat(service.isStoreHealthy()).isFalse();
        assertThat(service.getSensorReadings(3)).hasSize(3);
    }

    // ---------------------- fixtures ----------------------

    private SensorReading remoteReading() {
        return SensorReading.builder()
                .id("r-1")
                .timestamp(Instant.now())
                .createdAt(Instant.now())
                .temperature(25.0)
                .ph(6.56)
                .tdsLevel(94.0)
                .build();
    }

    private void storeUp() {
        when(readingRepo.save(any(SensorReadingEntity.class))).thenAnswer(inv -> {
            SensorReadingEntity e = inv.getArgument(0);
            if (e.getId() == null) e.setId("db-" + ids.incrementAndGet());
            return e;
        });
        when(readingRepo.count()).thenReturn(1L);
        when(readingRepo.findFirstByOrderByTimestampDesc()).thenReturn(Optional.of(storedRow));
        when(readingRepo.findAllByOrderByTimestampDesc(any(Pageable.class))).thenReturn(List.of(storedRow));
        when(statusRepo.save(any(SystemStatusEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        when(settingsRepo.save(any(AlertSettingsEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private void storeDown() {
        DataAccessResourceFailureException down = new DataAccessResourceFailureException("Connection refused");
        when(readingRepo.save(any(SensorReadingEntity.class))).thenThrow(down);
        when(readingRepo.count()).thenThrow(down);
        when(readingRepo.findFirstByOrderByTimestampDesc()).thenThrow(down);
        when(readingRepo.findAllByOrderByTimestampDesc(any(Pageable.class))).thenThrow(down);
        when(readingRepo.findByTimestampBetweenOrderByTimestampAsc(any(), any())).thenThrow(down);
        when(statusRepo.findFirstByOrderByIdAsc()).thenThrow(down);
        when(statusRepo.save(any(SystemStatusEntity.class))).thenThrow(down);
        when(settingsRepo.findFirstByOrderByIdAsc()).thenThrow(down);
        when(settingsRepo.save(any(AlertSettingsEntity.class))).thenThrow(down);
    }
}
