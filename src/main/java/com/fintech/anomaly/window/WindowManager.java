package com.fintech.anomaly.window;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.storage.BarStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Read-side window derivation. Holds no state; every call re-reads the store.
 */
@Component
public class WindowManager {

    private static final Logger log = LoggerFactory.getLogger(WindowManager.class);

    private final BarStore barStore;
    private final int windowSize;

    public WindowManager(BarStore barStore, AnomalyProperties properties) {
        this.barStore = barStore;
        this.windowSize = properties.getScoring().getWindowSize();
    }

    /**
     * Summarizes the latest W closed bars, empty while fewer than W exist.
     */
    public Optional<WindowSummary> summarize(String instrument, Interval interval) {
        return logIfInsufficient(instrument, interval,
            WindowStatistics.compute(barStore.queryWindow(instrument, interval, windowSize + 1), windowSize));
    }

    /**
     * Summarizes the W closed bars preceding the bar opened at {@code openTime},
     * empty while fewer than W exist.
     */
    public Optional<WindowSummary> summarizeBefore(String instrument, Interval interval, long openTime) {
        return logIfInsufficient(instrument, interval,
            WindowStatistics.compute(
                barStore.queryWindowBefore(instrument, interval, openTime, windowSize + 1), windowSize));
    }

    public int getWindowSize() {
        return windowSize;
    }

    private Optional<WindowSummary> logIfInsufficient(String instrument, Interval interval,
                                                      Optional<WindowSummary> summary) {
        if (summary.isEmpty() && log.isDebugEnabled()) {
            log.debug("Insufficient window: instrument={}, interval={}, required={}",
                instrument, interval, windowSize);
        }
        return summary;
    }
}
