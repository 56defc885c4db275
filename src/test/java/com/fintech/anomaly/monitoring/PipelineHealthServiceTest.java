package com.fintech.anomaly.monitoring;

import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.SeriesKey;
import com.fintech.anomaly.ingestion.DegradationRegistry;
import com.fintech.anomaly.retention.RetentionManager;
import com.fintech.anomaly.scoring.AnomalyScoringEngine;
import com.fintech.anomaly.storage.AnomalySink;
import com.fintech.anomaly.storage.BarStore;
import com.fintech.anomaly.universe.ActiveUniverse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("PipelineHealthService Tests")
class PipelineHealthServiceTest {

    private static final long NOW = 1_733_100_000_000L;

    private BarStore barStore;
    private AnomalySink anomalySink;
    private ActiveUniverse activeUniverse;
    private AnomalyScoringEngine scoringEngine;
    private RetentionManager retentionManager;
    private DegradationRegistry degradationRegistry;
    private PipelineHealthService healthService;

    @BeforeEach
    void setUp() {
        barStore = mock(BarStore.class);
        anomalySink = mock(AnomalySink.class);
        activeUniverse = mock(ActiveUniverse.class);
        scoringEngine = mock(AnomalyScoringEngine.class);
        retentionManager = mock(RetentionManager.class);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        degradationRegistry = new DegradationRegistry(clock, new SimpleMeterRegistry());

        healthService = new PipelineHealthService(barStore, anomalySink, activeUniverse, scoringEngine,
            retentionManager, degradationRegistry, clock);
    }

    @Test
    @DisplayName("Reports figures from every component")
    void testHealth() {
        when(barStore.isHealthy()).thenReturn(true);
        when(barStore.count()).thenReturn(2_400L);
        when(barStore.oldestOpenTime()).thenReturn(Optional.of(NOW - 3_600_000L));
        when(barStore.estimatedSizeBytes()).thenReturn(480_000L);
        when(anomalySink.count()).thenReturn(12L);
        when(activeUniverse.size()).thenReturn(150);
        when(scoringEngine.getLastScoringPassTime()).thenReturn(NOW - 1_000L);
        when(retentionManager.getLastSweepTime()).thenReturn(NOW - 60_000L);
        when(retentionManager.getConsecutiveFailures()).thenReturn(0);
        degradationRegistry.markDegraded(new SeriesKey("ETHUSDT", Interval.M15), "timeout");
        degradationRegistry.markDegraded(new SeriesKey("BTCUSDT", Interval.M15), "timeout");

        PipelineHealth health = healthService.health();

        assertThat(health.storeHealthy()).isTrue();
        assertThat(health.storedRowCount()).isEqualTo(2_400);
        assertThat(health.oldestBarAgeMs()).isEqualTo(3_600_000);
        assertThat(health.activeUniverseSize()).isEqualTo(150);
        assertThat(health.lastScoringPassTime()).isEqualTo(NOW - 1_000L);
        assertThat(health.lastRetentionSweepTime()).isEqualTo(NOW - 60_000L);
        assertThat(health.anomalyCount()).isEqualTo(12);
        assertThat(health.estimatedStoreBytes()).isEqualTo(480_000);
        assertThat(health.degradedSeries()).containsExactly("BTCUSDT/15m", "ETHUSDT/15m");
    }

    @Test
    @DisplayName("Empty store reports zero age")
    void testEmptyStore() {
        when(barStore.isHealthy()).thenReturn(true);
        when(barStore.oldestOpenTime()).thenReturn(Optional.empty());

        PipelineHealth health = healthService.health();

        assertThat(health.storedRowCount()).isZero();
        assertThat(health.oldestBarAgeMs()).isZero();
        assertThat(health.degradedSeries()).isEmpty();
    }

    @Test
    @DisplayName("Unhealthy store skips store queries")
    void testUnhealthyStore() {
        when(barStore.isHealthy()).thenReturn(false);
        when(retentionManager.getConsecutiveFailures()).thenReturn(3);

        PipelineHealth health = healthService.health();

        assertThat(health.storeHealthy()).isFalse();
        assertThat(health.storedRowCount()).isEqualTo(-1);
        assertThat(health.anomalyCount()).isEqualTo(-1);
        assertThat(health.consecutiveRetentionFailures()).isEqualTo(3);
        verify(barStore, never()).count();
        verify(anomalySink, never()).count();
    }

    @Test
    @DisplayName("Actuator indicator is DOWN when the store is unhealthy")
    void testHealthIndicator() {
        PipelineHealthIndicator indicator = new PipelineHealthIndicator(healthService);

        when(barStore.isHealthy()).thenReturn(true);
        when(barStore.oldestOpenTime()).thenReturn(Optional.empty());
        Health up = indicator.health();
        assertThat(up.getStatus()).isEqualTo(Status.UP);
        assertThat(up.getDetails()).containsKeys("storedRowCount", "degradedSeries", "activeUniverseSize");

        when(barStore.isHealthy()).thenReturn(false);
        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
