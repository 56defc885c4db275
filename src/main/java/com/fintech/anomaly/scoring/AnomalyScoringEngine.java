package com.fintech.anomaly.scoring;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.AnomalyRecord;
import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.domain.BarKey;
import com.fintech.anomaly.domain.SeriesKey;
import com.fintech.anomaly.ingestion.DegradationRegistry;
import com.fintech.anomaly.storage.AnomalySink;
import com.fintech.anomaly.storage.BarStore;
import com.fintech.anomaly.universe.ActiveUniverse;
import com.fintech.anomaly.window.WindowManager;
import com.fintech.anomaly.window.WindowSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scores newly closed bars against the window of closed bars preceding them.
 *
 * The ingestion path enqueues the key of each bar the first time it becomes final; the
 * periodic scoring pass drains the queue in open-time order. A bar whose scoring throws is
 * queued again for the next pass, up to maxAttempts passes. Scoring a bar twice is
 * harmless since the sink ignores an existing key.
 */
@Component
public class AnomalyScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScoringEngine.class);

    private final BarStore barStore;
    private final WindowManager windowManager;
    private final AnomalyScorer scorer;
    private final AnomalySink anomalySink;
    private final ActiveUniverse activeUniverse;
    private final DegradationRegistry degradationRegistry;
    private final PersistPolicy persistPolicy;
    private final int maxAttempts;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Set<BarKey> pending = ConcurrentHashMap.newKeySet();
    private final Map<BarKey, Integer> failedAttempts = new ConcurrentHashMap<>();

    private final AtomicLong barsScored = new AtomicLong(0);
    private final AtomicLong anomaliesDetected = new AtomicLong(0);
    private final AtomicLong insufficientWindow = new AtomicLong(0);
    private final AtomicLong skippedDegraded = new AtomicLong(0);
    private final AtomicLong scoringErrors = new AtomicLong(0);
    private final AtomicLong scoringDropped = new AtomicLong(0);
    private final AtomicLong lastScoringPassTime = new AtomicLong(0);

    public AnomalyScoringEngine(
            BarStore barStore,
            WindowManager windowManager,
            AnomalyScorer scorer,
            AnomalySink anomalySink,
            ActiveUniverse activeUniverse,
            DegradationRegistry degradationRegistry,
            AnomalyProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.barStore = barStore;
        this.windowManager = windowManager;
        this.scorer = scorer;
        this.anomalySink = anomalySink;
        this.activeUniverse = activeUniverse;
        this.degradationRegistry = degradationRegistry;
        this.persistPolicy = properties.getScoring().getPersistPolicy();
        this.maxAttempts = properties.getScoring().getMaxAttempts();
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("scoring.bars.scored", barsScored);
        meterRegistry.gauge("scoring.anomalies.detected", anomaliesDetected);
        meterRegistry.gauge("scoring.window.insufficient", insufficientWindow);
        meterRegistry.gauge("scoring.skipped.degraded", skippedDegraded);
        meterRegistry.gauge("scoring.errors", scoringErrors);
        meterRegistry.gauge("scoring.dropped", scoringDropped);
        meterRegistry.gaugeCollectionSize("scoring.pending", Tags.empty(), pending);
    }

    /**
     * Queues a newly finalized bar for the next scoring pass.
     */
    public void onBarFinalized(BarKey key) {
        pending.add(key);
    }

    @Scheduled(
        fixedDelayString = "${anomaly.scoring.pass-interval-ms:60000}",
        initialDelayString = "${anomaly.scoring.initial-delay-ms:30000}"
    )
    public void scheduledScoringPass() {
        try {
            runScoringPass();
        } catch (Exception e) {
            log.error("Scoring pass failed", e);
        }
    }

    /**
     * Drains the pending queue in open-time order and scores each bar.
     *
     * @return number of anomaly records written
     */
    public int runScoringPass() {
        Timer.Sample sample = Timer.start(meterRegistry);
        List<BarKey> batch = new ArrayList<>(pending);
        pending.removeAll(batch);
        batch.sort(Comparator.comparingLong(BarKey::openTime).thenComparing(Comparator.naturalOrder()));

        int written = 0;
        for (BarKey key : batch) {
            try {
                if (degradationRegistry.isDegraded(SeriesKey.of(key))) {
                    failedAttempts.remove(key);
                    skippedDegraded.incrementAndGet();
                    log.debug("Skipping degraded series: key={}", key);
                    continue;
                }
                Optional<Bar> bar = barStore.find(key);
                if (bar.isEmpty() || !bar.get().isFinal()) {
                    failedAttempts.remove(key);
                    log.debug("Finalized bar not found, skipping: key={}", key);
                    continue;
                }
                if (score(bar.get()).isPresent()) {
                    written++;
                }
                failedAttempts.remove(key);
            } catch (Exception e) {
                scoringErrors.incrementAndGet();
                requeueOrDrop(key, e);
            }
        }

        lastScoringPassTime.set(clock.millis());
        sample.stop(meterRegistry.timer("scoring.pass.duration"));
        if (!batch.isEmpty()) {
            log.info("Scoring pass completed: bars={}, recordsWritten={}", batch.size(), written);
        }
        return written;
    }

    private void requeueOrDrop(BarKey key, Exception cause) {
        int attempts = failedAttempts.merge(key, 1, Integer::sum);
        if (attempts < maxAttempts) {
            pending.add(key);
            log.warn("Failed to score bar, retrying next pass: key={}, attempt={}/{}, error={}",
                key, attempts, maxAttempts, cause.getMessage());
        } else {
            failedAttempts.remove(key);
            scoringDropped.incrementAndGet();
            log.error("Failed to score bar, giving up: key={}, attempts={}", key, attempts, cause);
        }
    }

    /**
     * Scores one closed bar and writes the record according to the persist policy.
     * Idempotent: scoring the same bar again writes nothing new.
     *
     * @return the record if it was newly written
     */
    public Optional<AnomalyRecord> score(Bar bar) {
        Optional<WindowSummary> window = windowManager.summarizeBefore(
            bar.instrument(), bar.interval(), bar.openTime());
        if (window.isEmpty()) {
            insufficientWindow.incrementAndGet();
            return Optional.empty();
        }

        AnomalyRecord record = scorer.score(
            bar, window.get(), activeUniverse.quoteVolume24h(bar.instrument()), clock.millis());
        barsScored.incrementAndGet();

        if (!record.isAnomaly() && persistPolicy == PersistPolicy.ANOMALIES_ONLY) {
            return Optional.empty();
        }
        if (!anomalySink.upsert(record)) {
            return Optional.empty();
        }
        if (record.isAnomaly()) {
            anomaliesDetected.incrementAndGet();
        }
        return Optional.of(record);
    }

    /** Time of the last completed scoring pass (epoch millis), 0 if none yet. */
    public long getLastScoringPassTime() {
        return lastScoringPassTime.get();
    }

    public int getPendingCount() {
        return pending.size();
    }

    public long getBarsScored() {
        return barsScored.get();
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected.get();
    }
}
