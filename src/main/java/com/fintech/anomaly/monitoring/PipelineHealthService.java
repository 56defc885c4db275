package com.fintech.anomaly.monitoring;

import com.fintech.anomaly.ingestion.DegradationRegistry;
import com.fintech.anomaly.retention.RetentionManager;
import com.fintech.anomaly.scoring.AnomalyScoringEngine;
import com.fintech.anomaly.storage.AnomalySink;
import com.fintech.anomaly.storage.BarStore;
import com.fintech.anomaly.universe.ActiveUniverse;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Assembles {@link PipelineHealth} from the components that own each figure.
 */
@Service
public class PipelineHealthService {

    private final BarStore barStore;
    private final AnomalySink anomalySink;
    private final ActiveUniverse activeUniverse;
    private final AnomalyScoringEngine scoringEngine;
    private final RetentionManager retentionManager;
    private final DegradationRegistry degradationRegistry;
    private final Clock clock;

    public PipelineHealthService(
            BarStore barStore,
            AnomalySink anomalySink,
            ActiveUniverse activeUniverse,
            AnomalyScoringEngine scoringEngine,
            RetentionManager retentionManager,
            DegradationRegistry degradationRegistry,
            Clock clock) {
        this.barStore = barStore;
        this.anomalySink = anomalySink;
        this.activeUniverse = activeUniverse;
        this.scoringEngine = scoringEngine;
        this.retentionManager = retentionManager;
        this.degradationRegistry = degradationRegistry;
        this.clock = clock;
    }

    public PipelineHealth health() {
        boolean storeHealthy = barStore.isHealthy();
        long rows = storeHealthy ? barStore.count() : -1;
        long oldestAge = storeHealthy
            ? barStore.oldestOpenTime().map(oldest -> Math.max(0, clock.millis() - oldest)).orElse(0L)
            : 0L;
        List<String> degraded = degradationRegistry.snapshot().keySet().stream()
            .map(Object::toString)
            .sorted()
            .toList();

        return new PipelineHealth(
            rows,
            oldestAge,
            activeUniverse.size(),
            scoringEngine.getLastScoringPassTime(),
            retentionManager.getLastSweepTime(),
            storeHealthy ? anomalySink.count() : -1,
            storeHealthy ? barStore.estimatedSizeBytes() : -1,
            degraded,
            retentionManager.getConsecutiveFailures(),
            storeHealthy
        );
    }
}
