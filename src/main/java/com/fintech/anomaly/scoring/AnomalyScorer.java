package com.fintech.anomaly.scoring;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.AnomalyReason;
import com.fintech.anomaly.domain.AnomalyRecord;
import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.window.WindowSummary;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Scores one closed bar against the window of closed bars preceding it.
 *
 * <p>Each dimension (return, quote volume, volatility proxy) gets a z-score against the
 * window. A dimension triggers when |z| reaches its threshold; the price dimension also
 * needs |return| at or above the configured floor. The composite score is the weighted
 * sum of |z| over triggered dimensions, so it is zero when nothing triggers.
 *
 * <p>Stateless and side-effect free.
 */
@Component
public class AnomalyScorer {

    private final AnomalyProperties.Scoring config;

    public AnomalyScorer(AnomalyProperties properties) {
        this.config = properties.getScoring();
    }

    public AnomalyRecord score(Bar bar, WindowSummary window, double quoteVolume24h, long detectedAt) {
        double currentReturn = bar.simpleReturn(window.lastClose());
        double currentVolume = bar.quoteVolume();
        double currentVolatility = bar.volatilityProxy();

        double priceZ = window.returnStats().zScore(currentReturn);
        double volumeZ = window.volumeStats().zScore(currentVolume);
        double volatilityZ = window.volatilityStats().zScore(currentVolatility);

        Set<AnomalyReason> reasons = EnumSet.noneOf(AnomalyReason.class);
        double composite = 0.0;

        if (Math.abs(priceZ) >= config.getPriceZThreshold()
                && Math.abs(currentReturn) >= config.getMinAbsReturn()) {
            reasons.add(AnomalyReason.PRICE);
            composite += config.getPriceWeight() * Math.abs(priceZ);
        }
        if (Math.abs(volumeZ) >= config.getVolumeZThreshold()) {
            reasons.add(AnomalyReason.VOLUME);
            composite += config.getVolumeWeight() * Math.abs(volumeZ);
        }
        if (Math.abs(volatilityZ) >= config.getVolatilityZThreshold()) {
            reasons.add(AnomalyReason.VOLATILITY);
            composite += config.getVolatilityWeight() * Math.abs(volatilityZ);
        }

        return new AnomalyRecord(
            bar.instrument(),
            bar.interval(),
            bar.openTime(),
            bar.close(),
            currentReturn,
            currentVolume,
            currentVolatility,
            priceZ,
            volumeZ,
            volatilityZ,
            returnPercentile(window.returns(), currentReturn),
            composite,
            reasons,
            quoteVolume24h,
            detectedAt
        );
    }

    /**
     * Percentage of window |returns| strictly below |current|. Informational only.
     */
    static double returnPercentile(double[] windowReturns, double current) {
        if (windowReturns.length == 0) {
            return 0.0;
        }
        double magnitude = Math.abs(current);
        int below = 0;
        for (double value : windowReturns) {
            if (Math.abs(value) < magnitude) {
                below++;
            }
        }
        return 100.0 * below / windowReturns.length;
    }
}
