package com.fintech.anomaly.ingestion;

import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.domain.BarUpdate;
import com.fintech.anomaly.domain.UpsertResult;
import com.fintech.anomaly.scoring.AnomalyScoringEngine;
import com.fintech.anomaly.storage.BarStore;
import com.fintech.anomaly.storage.StoreWriteFailedException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Applies live bar updates to the bar store.
 *
 * Invalid updates are dropped. A replayed update for a closed bar is rejected by the
 * store and only counted. The first time a bar becomes final the scoring engine is told,
 * so each closed bar is scored once.
 */
@Component
public class BarIngestionService {

    private static final Logger log = LoggerFactory.getLogger(BarIngestionService.class);

    private final BarStore barStore;
    private final AnomalyScoringEngine scoringEngine;
    private final MeterRegistry meterRegistry;

    private final AtomicLong updatesProcessed = new AtomicLong(0);
    private final AtomicLong invalidUpdatesDropped = new AtomicLong(0);
    private final AtomicLong writeFailures = new AtomicLong(0);
    private final Map<UpsertResult, AtomicLong> resultCounts = new EnumMap<>(UpsertResult.class);

    public BarIngestionService(BarStore barStore, AnomalyScoringEngine scoringEngine, MeterRegistry meterRegistry) {
        this.barStore = barStore;
        this.scoringEngine = scoringEngine;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("ingestion.updates.processed", updatesProcessed);
        meterRegistry.gauge("ingestion.updates.invalid.dropped", invalidUpdatesDropped);
        meterRegistry.gauge("ingestion.updates.write.failures", writeFailures);
        for (UpsertResult result : UpsertResult.values()) {
            AtomicLong counter = new AtomicLong(0);
            resultCounts.put(result, counter);
            meterRegistry.gauge("ingestion.upsert.results", Tags.of("result", result.name()), counter);
        }
    }

    /**
     * Applies one update.
     *
     * @return the store outcome, empty if the update was invalid or the write failed
     */
    public Optional<UpsertResult> apply(BarUpdate update) {
        if (!update.isValid()) {
            invalidUpdatesDropped.incrementAndGet();
            log.warn("Invalid bar update received, skipping: {}", update);
            return Optional.empty();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Bar bar = update.toBar();
            UpsertResult result = barStore.upsert(bar);
            resultCounts.get(result).incrementAndGet();
            updatesProcessed.incrementAndGet();

            if (result == UpsertResult.REJECTED_FINAL) {
                log.debug("Update for closed bar rejected: key={}", bar.key());
            } else if (result.closedBar()) {
                scoringEngine.onBarFinalized(bar.key());
            }
            return Optional.of(result);

        } catch (StoreWriteFailedException e) {
            // Next update for the same key replaces the lost one
            writeFailures.incrementAndGet();
            log.warn("Dropping bar update after store failure: instrument={}, interval={}, openTime={}",
                update.instrument(), update.interval(), update.openTime());
            return Optional.empty();

        } finally {
            sample.stop(meterRegistry.timer("ingestion.update.processing.time"));
        }
    }

    public long getUpdatesProcessed() {
        return updatesProcessed.get();
    }

    public long getInvalidUpdatesDropped() {
        return invalidUpdatesDropped.get();
    }

    public long getWriteFailures() {
        return writeFailures.get();
    }

    public long getResultCount(UpsertResult result) {
        return resultCounts.get(result).get();
    }
}
