package com.fintech.anomaly.scoring;

import com.fintech.anomaly.TestBars;
import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.AnomalyRecord;
import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.domain.BarKey;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.SeriesKey;
import com.fintech.anomaly.ingestion.DegradationRegistry;
import com.fintech.anomaly.storage.AnomalySink;
import com.fintech.anomaly.storage.BarStore;
import com.fintech.anomaly.storage.StoreWriteFailedException;
import com.fintech.anomaly.universe.ActiveUniverse;
import com.fintech.anomaly.window.WindowManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AnomalyScoringEngine} with a mocked store and sink and the real
 * window manager and scorer.
 */
@DisplayName("AnomalyScoringEngine Tests")
class AnomalyScoringEngineTest {

    private static final int W = 16;
    private static final String BTC = "BTCUSDT";
    private static final long STEP = Interval.M15.toMillis();
    private static final long NOW = TestBars.BASE_TIME + 100 * STEP;

    private BarStore barStore;
    private AnomalySink anomalySink;
    private DegradationRegistry degradationRegistry;
    private AnomalyProperties properties;
    private AnomalyScoringEngine engine;

    private List<Bar> window;
    private Bar spike;

    @BeforeEach
    void setUp() {
        barStore = mock(BarStore.class);
        anomalySink = mock(AnomalySink.class);
        properties = new AnomalyProperties();
        properties.getScoring().setWindowSize(W);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        degradationRegistry = new DegradationRegistry(clock, new SimpleMeterRegistry());
        engine = newEngine(clock);

        double a = 0.01 * Math.sqrt(15.0 / 16.0);
        window = TestBars.series(BTC, Interval.M15, TestBars.BASE_TIME, 1000.0,
            TestBars.alternatingCloses(100.0, a, W));
        Bar last = window.get(W);
        spike = TestBars.closed(BTC, Interval.M15, last.openTime() + STEP, last.close() * 1.03, 1000.0);

        when(barStore.find(spike.key())).thenReturn(Optional.of(spike));
        when(barStore.queryWindowBefore(eq(BTC), eq(Interval.M15), eq(spike.openTime()), anyInt()))
            .thenReturn(window);
        when(anomalySink.upsert(any())).thenReturn(true);
    }

    private AnomalyScoringEngine newEngine(Clock clock) {
        return new AnomalyScoringEngine(
            barStore,
            new WindowManager(barStore, properties),
            new AnomalyScorer(properties),
            anomalySink,
            new ActiveUniverse(),
            degradationRegistry,
            properties,
            clock,
            new SimpleMeterRegistry()
        );
    }

    @Test
    @DisplayName("Scoring pass writes the anomaly of a finalized spike bar")
    void testScoringPass() {
        engine.onBarFinalized(spike.key());

        int written = engine.runScoringPass();

        ArgumentCaptor<AnomalyRecord> captor = ArgumentCaptor.forClass(AnomalyRecord.class);
        verify(anomalySink).upsert(captor.capture());
        assertThat(written).isEqualTo(1);
        assertThat(captor.getValue().timestamp()).isEqualTo(spike.openTime());
        assertThat(captor.getValue().detectedAt()).isEqualTo(NOW);
        assertThat(captor.getValue().isAnomaly()).isTrue();
        assertThat(engine.getPendingCount()).isZero();
        assertThat(engine.getLastScoringPassTime()).isEqualTo(NOW);
        assertThat(engine.getAnomaliesDetected()).isEqualTo(1);
    }

    @Test
    @DisplayName("Scoring the same bar twice writes one record")
    void testIdempotentScoring() {
        when(anomalySink.upsert(any())).thenReturn(true, false);

        assertThat(engine.score(spike)).isPresent();
        assertThat(engine.score(spike)).isEmpty();

        assertThat(engine.getAnomaliesDetected()).isEqualTo(1);
        assertThat(engine.getBarsScored()).isEqualTo(2);
    }

    @Test
    @DisplayName("Duplicate finalization events collapse into one pending entry")
    void testPendingDeduplicated() {
        engine.onBarFinalized(spike.key());
        engine.onBarFinalized(spike.key());

        assertThat(engine.getPendingCount()).isEqualTo(1);
        engine.runScoringPass();
        verify(anomalySink, times(1)).upsert(any());
    }

    @Test
    @DisplayName("Insufficient window emits nothing")
    void testInsufficientWindow() {
        when(barStore.queryWindowBefore(eq(BTC), eq(Interval.M15), eq(spike.openTime()), anyInt()))
            .thenReturn(window.subList(0, W - 1));

        assertThat(engine.score(spike)).isEmpty();

        verify(anomalySink, never()).upsert(any());
    }

    @Test
    @DisplayName("Non-anomalous bars are written only under ALL_SCORED")
    void testPersistPolicy() {
        Bar quiet = TestBars.closed(BTC, Interval.M15, spike.openTime(), window.get(W).close(), 1000.0);

        assertThat(engine.score(quiet)).isEmpty();
        verify(anomalySink, never()).upsert(any());

        properties.getScoring().setPersistPolicy(PersistPolicy.ALL_SCORED);
        AnomalyScoringEngine allScored = newEngine(Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));

        Optional<AnomalyRecord> record = allScored.score(quiet);
        assertThat(record).isPresent();
        assertThat(record.get().compositeScore()).isZero();
    }

    @Test
    @DisplayName("Degraded series are skipped")
    void testDegradedSkipped() {
        degradationRegistry.markDegraded(new SeriesKey(BTC, Interval.M15), "backfill failed");
        engine.onBarFinalized(spike.key());

        assertThat(engine.runScoringPass()).isZero();

        verify(barStore, never()).find(any());
    }

    @Test
    @DisplayName("A failing bar does not stop the pass")
    void testErrorIsolation() {
        BarKey broken = new BarKey("ETHUSDT", Interval.M15, spike.openTime() - STEP);
        when(barStore.find(broken)).thenThrow(new IllegalStateException("boom"));
        engine.onBarFinalized(broken);
        engine.onBarFinalized(spike.key());

        assertThat(engine.runScoringPass()).isEqualTo(1);
    }

    @Test
    @DisplayName("A bar whose record write fails is scored again on the next pass")
    void testWriteFailureRetried() {
        when(anomalySink.upsert(any()))
            .thenThrow(new StoreWriteFailedException("Anomaly write failed", new RuntimeException("db down")))
            .thenReturn(true);
        engine.onBarFinalized(spike.key());

        assertThat(engine.runScoringPass()).isZero();
        assertThat(engine.getPendingCount()).isEqualTo(1);

        assertThat(engine.runScoringPass()).isEqualTo(1);
        assertThat(engine.getPendingCount()).isZero();
        assertThat(engine.getAnomaliesDetected()).isEqualTo(1);
        verify(anomalySink, times(2)).upsert(any());
    }

    @Test
    @DisplayName("A bar that keeps failing is dropped after max attempts")
    void testWriteFailureGivesUp() {
        properties.getScoring().setMaxAttempts(3);
        engine = newEngine(Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
        when(anomalySink.upsert(any()))
            .thenThrow(new StoreWriteFailedException("Anomaly write failed", new RuntimeException("db down")));
        engine.onBarFinalized(spike.key());

        for (int pass = 0; pass < 5; pass++) {
            engine.runScoringPass();
        }

        verify(anomalySink, times(3)).upsert(any());
        assertThat(engine.getPendingCount()).isZero();
    }

    @Test
    @DisplayName("Missing bars are not scored")
    void testMissingBar() {
        BarKey missing = new BarKey(BTC, Interval.M15, spike.openTime() + STEP);
        when(barStore.find(missing)).thenReturn(Optional.empty());
        engine.onBarFinalized(missing);

        assertThat(engine.runScoringPass()).isZero();
        verify(anomalySink, never()).upsert(any());
    }

    @Test
    @DisplayName("Pass scores bars in open-time order")
    void testOrdering() {
        List<Long> scored = new ArrayList<>();
        Bar earlier = TestBars.closed(BTC, Interval.M15, spike.openTime() - STEP, 100.0, 1000.0);
        when(barStore.find(earlier.key())).thenAnswer(inv -> {
            scored.add(earlier.openTime());
            return Optional.of(earlier);
        });
        when(barStore.find(spike.key())).thenAnswer(inv -> {
            scored.add(spike.openTime());
            return Optional.of(spike);
        });

        engine.onBarFinalized(spike.key());
        engine.onBarFinalized(earlier.key());
        engine.runScoringPass();

        assertThat(scored).containsExactly(earlier.openTime(), spike.openTime());
    }
}
