package com.fintech.anomaly.ingestion;

import com.fintech.anomaly.domain.SeriesKey;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Series whose backfill failed. A degraded series is excluded from scoring and is
 * backfilled again on the next universe refresh.
 */
@Component
public class DegradationRegistry {

    private static final Logger log = LoggerFactory.getLogger(DegradationRegistry.class);

    private final Map<SeriesKey, Degradation> degraded = new ConcurrentHashMap<>();
    private final Clock clock;

    public DegradationRegistry(Clock clock, MeterRegistry meterRegistry) {
        this.clock = clock;
        meterRegistry.gaugeMapSize("ingestion.series.degraded", Tags.empty(), degraded);
    }

    public void markDegraded(SeriesKey series, String reason) {
        Degradation previous = degraded.put(series, new Degradation(reason, clock.millis()));
        if (previous == null) {
            log.warn("Series degraded: series={}, reason={}", series, reason);
        }
    }

    public void clear(SeriesKey series) {
        if (degraded.remove(series) != null) {
            log.info("Series recovered: series={}", series);
        }
    }

    public boolean isDegraded(SeriesKey series) {
        return degraded.containsKey(series);
    }

    public Map<SeriesKey, Degradation> snapshot() {
        return Map.copyOf(degraded);
    }

    public int size() {
        return degraded.size();
    }

    /**
     * @param reason Last failure message
     * @param since Time the series was (last) marked degraded, epoch millis
     */
    public record Degradation(String reason, long since) {
    }
}
