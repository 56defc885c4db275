package com.fintech.anomaly.ingestion;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.BarUpdate;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.SeriesKey;
import com.fintech.anomaly.domain.UpsertResult;
import com.fintech.anomaly.feed.MarketDataClient;
import com.fintech.anomaly.storage.BarStore;
import com.fintech.anomaly.storage.StoreException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fills the scoring window of a series from historical data when a subscription starts.
 *
 * Only final bars are written, through insert-if-absent, so history never overwrites a
 * row already written by the live feed. Each fetch is bounded by the "backfill"
 * TimeLimiter and retried by the "backfill" Retry; when retries are exhausted the series
 * is marked degraded.
 */
@Service
public class BackfillService {

    private static final Logger log = LoggerFactory.getLogger(BackfillService.class);

    static final String RESILIENCE_INSTANCE = "backfill";

    private final MarketDataClient marketDataClient;
    private final BarStore barStore;
    private final DegradationRegistry degradationRegistry;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final Executor backfillExecutor;
    private final Executor marketDataExecutor;
    private final int windowSize;

    private final Set<SeriesKey> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicLong barsInserted = new AtomicLong(0);
    private final AtomicLong backfillsCompleted = new AtomicLong(0);
    private final AtomicLong backfillsFailed = new AtomicLong(0);

    public BackfillService(
            MarketDataClient marketDataClient,
            BarStore barStore,
            DegradationRegistry degradationRegistry,
            RetryRegistry retryRegistry,
            TimeLimiterRegistry timeLimiterRegistry,
            @Qualifier("backfillExecutor") Executor backfillExecutor,
            @Qualifier("marketDataExecutor") Executor marketDataExecutor,
            AnomalyProperties properties,
            MeterRegistry meterRegistry) {
        this.marketDataClient = marketDataClient;
        this.barStore = barStore;
        this.degradationRegistry = degradationRegistry;
        this.retry = retryRegistry.retry(RESILIENCE_INSTANCE);
        this.timeLimiter = timeLimiterRegistry.timeLimiter(RESILIENCE_INSTANCE);
        this.backfillExecutor = backfillExecutor;
        this.marketDataExecutor = marketDataExecutor;
        this.windowSize = properties.getScoring().getWindowSize();

        meterRegistry.gauge("backfill.bars.inserted", barsInserted);
        meterRegistry.gauge("backfill.completed", backfillsCompleted);
        meterRegistry.gauge("backfill.failed", backfillsFailed);

        retry.getEventPublisher()
            .onRetry(event -> log.warn("Backfill fetch retry: attempt={}, cause={}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * Schedules a backfill on the backfill executor. At most one backfill per series runs
     * at a time; a request for a series already in flight completes immediately with 0.
     *
     * @return future of the number of bars inserted; completes exceptionally with
     *         {@link BackfillFailedException} when retries are exhausted
     */
    public CompletableFuture<Integer> backfillAsync(String instrument, Interval interval) {
        SeriesKey series = new SeriesKey(instrument, interval);
        if (!inFlight.add(series)) {
            log.debug("Backfill already in flight: series={}", series);
            return CompletableFuture.completedFuture(0);
        }

        try {
            return CompletableFuture.supplyAsync(() -> backfill(instrument, interval), backfillExecutor)
                .whenComplete((inserted, ex) -> inFlight.remove(series));
        } catch (RejectedExecutionException e) {
            inFlight.remove(series);
            degradationRegistry.markDegraded(series, "backfill queue full");
            log.warn("Backfill rejected, queue full: series={}", series);
            return CompletableFuture.failedFuture(new BackfillFailedException(series, e));
        }
    }

    /**
     * Runs a backfill on the calling thread.
     *
     * @return number of bars inserted, 0 when the window is already full
     * @throws BackfillFailedException when the historical fetch exhausts its retries
     */
    public int backfill(String instrument, Interval interval) {
        SeriesKey series = new SeriesKey(instrument, interval);

        long closed = barStore.countClosed(instrument, interval);
        if (closed >= windowSize) {
            log.debug("Window already full, skipping backfill: series={}, closedBars={}", series, closed);
            degradationRegistry.clear(series);
            return 0;
        }

        List<BarUpdate> history;
        try {
            history = retry.executeCallable(() -> timeLimiter.executeFutureSupplier(
                () -> CompletableFuture.supplyAsync(
                    () -> marketDataClient.fetchRecentBars(instrument, interval, windowSize),
                    marketDataExecutor)));
        } catch (Exception e) {
            backfillsFailed.incrementAndGet();
            degradationRegistry.markDegraded(series, e.getMessage());
            log.error("Backfill failed after retries: series={}", series, e);
            throw new BackfillFailedException(series, e);
        }

        int inserted = 0;
        int skipped = 0;
        try {
            for (BarUpdate update : history == null ? List.<BarUpdate>of() : history) {
                // The still-open bar belongs to the live feed
                if (!update.isFinal() || !update.isValid()) {
                    continue;
                }
                UpsertResult result = barStore.insertIfAbsent(update.toBar());
                if (result.applied()) {
                    inserted++;
                } else {
                    skipped++;
                }
            }
        } catch (StoreException e) {
            backfillsFailed.incrementAndGet();
            degradationRegistry.markDegraded(series, e.getMessage());
            throw new BackfillFailedException(series, e);
        }

        barsInserted.addAndGet(inserted);
        backfillsCompleted.incrementAndGet();
        degradationRegistry.clear(series);
        log.info("Backfill completed: series={}, fetched={}, inserted={}, skippedExisting={}",
            series, history == null ? 0 : history.size(), inserted, skipped);
        return inserted;
    }

    public long getBarsInserted() {
        return barsInserted.get();
    }

    public long getBackfillsFailed() {
        return backfillsFailed.get();
    }
}
