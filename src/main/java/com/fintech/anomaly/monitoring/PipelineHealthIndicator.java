package com.fintech.anomaly.monitoring;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health contributor ("pipeline"). DOWN when the bar store does not answer.
 */
@Component("pipeline")
public class PipelineHealthIndicator implements HealthIndicator {

    private final PipelineHealthService healthService;

    public PipelineHealthIndicator(PipelineHealthService healthService) {
        this.healthService = healthService;
    }

    @Override
    public Health health() {
        PipelineHealth health = healthService.health();
        Health.Builder builder = health.storeHealthy() ? Health.up() : Health.down();
        return builder
            .withDetail("storedRowCount", health.storedRowCount())
            .withDetail("oldestBarAgeMs", health.oldestBarAgeMs())
            .withDetail("activeUniverseSize", health.activeUniverseSize())
            .withDetail("lastScoringPassTime", health.lastScoringPassTime())
            .withDetail("lastRetentionSweepTime", health.lastRetentionSweepTime())
            .withDetail("anomalyCount", health.anomalyCount())
            .withDetail("estimatedStoreBytes", health.estimatedStoreBytes())
            .withDetail("degradedSeries", health.degradedSeries())
            .withDetail("consecutiveRetentionFailures", health.consecutiveRetentionFailures())
            .build();
    }
}
