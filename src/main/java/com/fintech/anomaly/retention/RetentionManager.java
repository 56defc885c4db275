package com.fintech.anomaly.retention;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.storage.AnomalySink;
import com.fintech.anomaly.storage.BarStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the bar store and anomaly sink bounded.
 *
 * Each sweep, in order: drop bars and anomaly records older than maxAge, trim every
 * series to maxRowsPerSeries, evict the oldest bars until the store is within both
 * maxTotalRows and maxStorageMb, and trim anomaly records to maxAnomalyRows.
 *
 * A failed sweep is logged and counted; the consecutive failure count is reported
 * through pipeline health.
 */
@Component
public class RetentionManager {

    private static final Logger log = LoggerFactory.getLogger(RetentionManager.class);

    private final BarStore barStore;
    private final AnomalySink anomalySink;
    private final AnomalyProperties.Retention config;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final AtomicLong lastSweepTime = new AtomicLong(0);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong barsDeleted = new AtomicLong(0);

    public RetentionManager(
            BarStore barStore,
            AnomalySink anomalySink,
            AnomalyProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.barStore = barStore;
        this.anomalySink = anomalySink;
        this.config = properties.getRetention();
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("retention.bars.deleted", barsDeleted);
        meterRegistry.gauge("retention.consecutive.failures", consecutiveFailures);
    }

    @Scheduled(
        fixedDelayString = "${anomaly.retention.sweep-interval-ms:3600000}",
        initialDelayString = "${anomaly.retention.initial-delay-ms:60000}"
    )
    public void scheduledSweep() {
        sweep();
    }

    /**
     * Runs one sweep. Never throws; failures are reported in the returned report.
     */
    public SweepReport sweep() {
        Timer.Sample sample = Timer.start(meterRegistry);
        long now = clock.millis();
        long cutoff = now - config.getMaxAge().toMillis();

        long byAge = 0;
        long bySeriesCap = 0;
        long byGlobalCap = 0;
        long anomalies = 0;
        boolean success = true;

        try {
            byAge = barStore.deleteOlderThan(cutoff);
            anomalies += anomalySink.deleteOlderThan(cutoff);
            bySeriesCap = barStore.deleteExcessPerSeries(config.getMaxRowsPerSeries());
            byGlobalCap = barStore.deleteOldestUntilWithinCap(config.getMaxTotalRows(), config.maxStorageBytes());
            anomalies += anomalySink.deleteOldestUntilWithinCap(config.getMaxAnomalyRows());

            consecutiveFailures.set(0);
            lastSweepTime.set(now);
        } catch (Exception e) {
            success = false;
            int failures = consecutiveFailures.incrementAndGet();
            log.error("Retention sweep failed: consecutiveFailures={}", failures, e);
        } finally {
            sample.stop(meterRegistry.timer("retention.sweep.duration"));
        }

        long remaining = safeCount();
        SweepReport report = new SweepReport(byAge, bySeriesCap, byGlobalCap, anomalies, remaining, success);
        barsDeleted.addAndGet(report.totalBarsDeleted());

        if (report.totalBarsDeleted() > 0 || anomalies > 0) {
            log.info("Retention sweep: byAge={}, bySeriesCap={}, byGlobalCap={}, anomalies={}, remainingBars={}",
                byAge, bySeriesCap, byGlobalCap, anomalies, remaining);
        } else {
            log.debug("Retention sweep: nothing to delete, remainingBars={}", remaining);
        }
        return report;
    }

    private long safeCount() {
        try {
            return barStore.count();
        } catch (Exception e) {
            log.warn("Could not count bars after sweep: {}", e.getMessage());
            return -1;
        }
    }

    /** Time of the last successful sweep (epoch millis), 0 if none yet. */
    public long getLastSweepTime() {
        return lastSweepTime.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }
}
