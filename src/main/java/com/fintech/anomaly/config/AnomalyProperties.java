package com.fintech.anomaly.config;

import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.scoring.PersistPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Externalized configuration for the market anomaly service.
 * Maps to 'anomaly.*' properties in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyProperties {

    @Valid
    private Universe universe = new Universe();

    @Valid
    private Ingestion ingestion = new Ingestion();

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private Retention retention = new Retention();

    private Simulation simulation = new Simulation();

    /**
     * Bars older than maxAge are evicted, so maxAge must cover a full scoring window
     * of the longest subscribed interval or no series would ever become ready.
     */
    @AssertTrue(message = "anomaly.retention.max-age must exceed window-size x longest subscribed interval")
    public boolean isRetentionCoveringWindow() {
        if (retention.getMaxAge() == null || ingestion.getIntervals() == null || ingestion.getIntervals().isEmpty()) {
            return true;
        }
        long longest = ingestion.subscribedIntervals().stream()
            .mapToLong(Interval::toMillis)
            .max()
            .orElse(0L);
        return retention.getMaxAge().toMillis() > (long) scoring.getWindowSize() * longest;
    }

    /**
     * The per-series trim keeps maxRowsPerSeries bars; a window needs W + 1 closed bars.
     */
    @AssertTrue(message = "anomaly.retention.max-rows-per-series must exceed anomaly.scoring.window-size")
    public boolean isSeriesCapCoveringWindow() {
        return retention.getMaxRowsPerSeries() > scoring.getWindowSize();
    }

    @Data
    public static class Universe {
        /** Maximum number of instruments kept after ranking by 24h quote volume. */
        @Min(1)
        private int topN = 150;

        /** Instruments below this 24h quote volume are ignored. */
        @DecimalMin("0.0")
        private double minQuoteVolume = 5000.0;

        /** Only symbols ending with this suffix are eligible; blank accepts any. */
        private String quoteAssetSuffix = "USDT";

        private long refreshIntervalMs = 180_000L;
        private long initialDelayMs = 5_000L;
    }

    @Data
    public static class Ingestion {
        @NotEmpty
        private List<String> intervals = List.of("15m");

        @Valid
        private DisruptorConfig disruptor = new DisruptorConfig();

        @Valid
        private Reconnect reconnect = new Reconnect();

        @Valid
        private Backfill backfill = new Backfill();

        /** Resolves the configured interval codes. */
        public List<Interval> subscribedIntervals() {
            return intervals.stream().map(Interval::fromCode).toList();
        }

        @Data
        public static class DisruptorConfig {
            /** Must be a power of two. */
            @Min(2)
            private int bufferSize = 8192;
            private String waitStrategy = "BLOCKING";

            /** Consumers are sharded by instrument, one consumer thread per shard. */
            @Min(1)
            private int numConsumers = 4;

            /** Bounded back-pressure before an update is dropped on a full ring buffer. */
            private long publishTimeoutMs = 100L;
            private long shutdownTimeoutMs = 5_000L;
        }

        @Data
        public static class Reconnect {
            @Min(1)
            private long initialBackoffMs = 1_000L;

            @DecimalMin("1.0")
            private double multiplier = 2.0;

            @DecimalMin("0.0")
            @DecimalMax(value = "1.0", inclusive = false)
            private double randomizationFactor = 0.5;

            @Min(1)
            private long maxBackoffMs = 60_000L;
        }

        @Data
        public static class Backfill {
            @Min(1)
            private int threads = 4;

            @Min(1)
            private int queueCapacity = 1_000;
        }
    }

    @Data
    public static class Scoring {
        /** Number of closed bars (W) forming the baseline window. */
        @Min(3)
        private int windowSize = 16;

        @DecimalMin("0.0")
        private double priceZThreshold = 2.5;

        @DecimalMin("0.0")
        private double volumeZThreshold = 2.0;

        @DecimalMin("0.0")
        private double volatilityZThreshold = 2.0;

        /** Price dimension additionally needs |return| at or above this floor. */
        @DecimalMin("0.0")
        private double minAbsReturn = 0.005;

        @DecimalMin("0.0")
        private double priceWeight = 0.4;

        @DecimalMin("0.0")
        private double volumeWeight = 0.3;

        @DecimalMin("0.0")
        private double volatilityWeight = 0.3;

        @NotNull
        private PersistPolicy persistPolicy = PersistPolicy.ANOMALIES_ONLY;

        /** Passes a finalized bar is attempted before it is dropped after repeated failures. */
        @Min(1)
        private int maxAttempts = 5;

        private long passIntervalMs = 60_000L;
        private long initialDelayMs = 30_000L;
    }

    @Data
    public static class Retention {
        @NotNull
        private Duration maxAge = Duration.ofHours(24);

        @Min(1)
        private int maxRowsPerSeries = 10_000;

        @Min(1)
        private long maxTotalRows = 2_000_000L;

        @Min(1)
        private long maxStorageMb = 100L;

        /** Used to estimate store size as rows x averageRowBytes. */
        @Min(1)
        private long averageRowBytes = 200L;

        @Min(1)
        private long maxAnomalyRows = 100_000L;

        @Min(1)
        private int deleteBatchSize = 1_000;

        private long sweepIntervalMs = 3_600_000L;
        private long initialDelayMs = 60_000L;

        public long maxStorageBytes() {
            return maxStorageMb * 1024L * 1024L;
        }
    }

    @Data
    public static class Simulation {
        private boolean enabled = false;
        private List<String> instruments = List.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "XRPUSDT", "DOGEUSDT");
        private long updateFrequencyMs = 1_000L;

        /** Probability per bar close that the bar carries a price/volume spike. */
        private double spikeProbability = 0.02;

        /** Probability per tick that a subscription drops its connection. */
        private double disconnectProbability = 0.0005;
    }
}
