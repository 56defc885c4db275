package com.fintech.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Market Anomaly Service
 *
 * Tracks the most liquid instruments of a market, keeps a bounded rolling history of
 * OHLCV bars per instrument and flags bars whose return, volume or range deviate
 * from the recent window.
 *
 * Key Features:
 * - Universe selection by 24h quote volume, refreshed on a schedule
 * - Live bar ingestion through an LMAX Disruptor ring buffer, sharded per instrument
 * - Backfill with retry and timeout (Resilience4j)
 * - Rolling z-score scoring with a composite anomaly score
 * - Age, per-series and global retention of the relational bar store
 * - Prometheus metrics and a pipeline health indicator
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class MarketAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketAnomalyApplication.class, args);
    }
}
