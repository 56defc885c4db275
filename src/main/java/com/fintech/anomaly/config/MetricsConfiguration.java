package com.fintech.anomaly.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration: common tags and percentile distribution for timers.
 *
 * Timers in this service measure store writes, scoring passes and retention sweeps,
 * so SLO buckets run from 1 ms to 30 s rather than the microsecond range.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "market-anomaly-service",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    // Only timers get percentiles; gauges and counters pass through
                    if (id.getType() == Meter.Type.TIMER) {
                        return DistributionStatisticConfig.builder()
                            .percentiles(0.5, 0.95, 0.99)
                            .percentilePrecision(2)
                            .serviceLevelObjectives(
                                Duration.ofMillis(1).toNanos(),
                                Duration.ofMillis(5).toNanos(),
                                Duration.ofMillis(25).toNanos(),
                                Duration.ofMillis(100).toNanos(),
                                Duration.ofMillis(500).toNanos(),
                                Duration.ofSeconds(2).toNanos(),
                                Duration.ofSeconds(10).toNanos(),
                                Duration.ofSeconds(30).toNanos()
                            )
                            .percentilesHistogram(true)
                            .expiry(Duration.ofMinutes(2))
                            .bufferLength(3)
                            .build()
                            .merge(config);
                    }
                    return config;
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
