package com.fintech.anomaly.ingestion;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.BarUpdate;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.SeriesKey;
import com.fintech.anomaly.feed.BarStreamClient;
import com.fintech.anomaly.feed.BarUpdateListener;
import com.fintech.anomaly.feed.FeedDisconnectedException;
import com.fintech.anomaly.feed.FeedSubscription;
import com.fintech.anomaly.universe.UniverseChange;
import com.fintech.anomaly.universe.UniverseChangeListener;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps one live subscription per (instrument, interval) of the active universe.
 *
 * <ul>
 *   <li>Added instruments are subscribed on every configured interval and backfilled.</li>
 *   <li>Removed instruments are unsubscribed; their bars are left to retention.</li>
 *   <li>Retained instruments whose backfill failed are backfilled again.</li>
 *   <li>A dropped subscription is re-established after a capped, jittered exponential
 *       backoff on the task scheduler. The attempt counter resets on the first update.</li>
 * </ul>
 *
 * Feed callbacks only hand updates to the ring buffer and never block on the store.
 */
@Component
public class IngestionPipeline implements UniverseChangeListener {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final BarStreamClient streamClient;
    private final BarUpdateEventPublisher publisher;
    private final BackfillService backfillService;
    private final DegradationRegistry degradationRegistry;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final List<Interval> intervals;
    private final IntervalFunction reconnectBackoff;

    private final Map<SeriesKey, SeriesFeed> feeds = new ConcurrentHashMap<>();
    private final AtomicLong reconnectsScheduled = new AtomicLong(0);
    private final AtomicLong subscribeFailures = new AtomicLong(0);

    private volatile boolean running = true;

    public IngestionPipeline(
            BarStreamClient streamClient,
            BarUpdateEventPublisher publisher,
            BackfillService backfillService,
            DegradationRegistry degradationRegistry,
            TaskScheduler taskScheduler,
            Clock clock,
            AnomalyProperties properties,
            MeterRegistry meterRegistry) {
        this.streamClient = streamClient;
        this.publisher = publisher;
        this.backfillService = backfillService;
        this.degradationRegistry = degradationRegistry;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.intervals = properties.getIngestion().subscribedIntervals();

        AnomalyProperties.Ingestion.Reconnect reconnect = properties.getIngestion().getReconnect();
        this.reconnectBackoff = IntervalFunction.ofExponentialRandomBackoff(
            reconnect.getInitialBackoffMs(),
            reconnect.getMultiplier(),
            reconnect.getRandomizationFactor(),
            reconnect.getMaxBackoffMs()
        );

        meterRegistry.gaugeMapSize("ingestion.subscriptions.active", Tags.empty(), feeds);
        meterRegistry.gauge("ingestion.reconnects.scheduled", reconnectsScheduled);
        meterRegistry.gauge("ingestion.subscribe.failures", subscribeFailures);

        log.info("Ingestion pipeline configured: intervals={}", intervals);
    }

    @Override
    public void onUniverseChange(UniverseChange change) {
        if (!running) {
            return;
        }

        for (String instrument : change.removed()) {
            for (Interval interval : intervals) {
                closeFeed(new SeriesKey(instrument, interval));
            }
        }

        for (String instrument : change.added()) {
            for (Interval interval : intervals) {
                openFeed(new SeriesKey(instrument, interval));
            }
        }

        for (String instrument : change.retained()) {
            for (Interval interval : intervals) {
                SeriesKey series = new SeriesKey(instrument, interval);
                if (!feeds.containsKey(series)) {
                    openFeed(series);
                } else if (degradationRegistry.isDegraded(series)) {
                    log.info("Retrying backfill for degraded series: series={}", series);
                    startBackfill(series);
                }
            }
        }
    }

    private void openFeed(SeriesKey series) {
        SeriesFeed feed = new SeriesFeed(series);
        if (feeds.putIfAbsent(series, feed) != null) {
            return;
        }
        subscribe(feed);
    }

    private void closeFeed(SeriesKey series) {
        SeriesFeed feed = feeds.remove(series);
        if (feed != null) {
            feed.deactivate();
            log.info("Unsubscribed: series={}", series);
        }
    }

    private void subscribe(SeriesFeed feed) {
        if (!running || !feed.active) {
            return;
        }
        int generation = feed.generation.incrementAndGet();
        try {
            FeedSubscription subscription = streamClient.subscribe(
                feed.series.instrument(), feed.series.interval(), new SeriesListener(feed, generation));
            feed.replaceSubscription(subscription);
            log.info("Subscribed: series={}, attempt={}", feed.series, feed.attempts.get());
            startBackfill(feed.series);
        } catch (RuntimeException e) {
            subscribeFailures.incrementAndGet();
            log.warn("Subscribe failed: series={}, cause={}", feed.series, e.getMessage());
            scheduleReconnect(feed);
        }
    }

    private void startBackfill(SeriesKey series) {
        backfillService.backfillAsync(series.instrument(), series.interval())
            .exceptionally(ex -> {
                log.warn("Backfill incomplete, series stays degraded until next refresh: series={}, cause={}",
                    series, ex.getMessage());
                return 0;
            });
    }

    /**
     * Schedules a resubscription; never blocks the calling feed thread.
     */
    void scheduleReconnect(SeriesFeed feed) {
        if (!running || !feed.active) {
            return;
        }
        int attempt = feed.attempts.incrementAndGet();
        long delayMs = reconnectBackoff.apply(attempt);
        reconnectsScheduled.incrementAndGet();
        log.info("Reconnect scheduled: series={}, attempt={}, delayMs={}", feed.series, attempt, delayMs);
        feed.pendingReconnect = taskScheduler.schedule(
            () -> subscribe(feed), clock.instant().plusMillis(delayMs));
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        log.info("Stopping ingestion pipeline: {} subscriptions", feeds.size());
        for (SeriesKey series : Set.copyOf(feeds.keySet())) {
            closeFeed(series);
        }
    }

    public Set<SeriesKey> getSubscribedSeries() {
        return Set.copyOf(feeds.keySet());
    }

    public long getReconnectsScheduled() {
        return reconnectsScheduled.get();
    }

    /** Reconnect attempts since the last update for the series, -1 if not subscribed. */
    public int getReconnectAttempts(SeriesKey series) {
        SeriesFeed feed = feeds.get(series);
        return feed == null ? -1 : feed.attempts.get();
    }

    /**
     * Subscription state of one series.
     */
    static final class SeriesFeed {
        final SeriesKey series;
        final AtomicInteger attempts = new AtomicInteger(0);
        final AtomicInteger generation = new AtomicInteger(0);
        volatile boolean active = true;
        volatile FeedSubscription subscription;
        volatile ScheduledFuture<?> pendingReconnect;

        SeriesFeed(SeriesKey series) {
            this.series = series;
        }

        synchronized void replaceSubscription(FeedSubscription next) {
            FeedSubscription previous = subscription;
            subscription = next;
            if (previous != null && previous != next) {
                previous.close();
            }
            if (!active) {
                next.close();
            }
        }

        synchronized void deactivate() {
            active = false;
            ScheduledFuture<?> pending = pendingReconnect;
            if (pending != null) {
                pending.cancel(false);
            }
            if (subscription != null) {
                subscription.close();
            }
        }
    }

    /**
     * Listener bound to one subscription attempt; callbacks of superseded attempts are ignored.
     */
    private final class SeriesListener implements BarUpdateListener {
        private final SeriesFeed feed;
        private final int generation;

        SeriesListener(SeriesFeed feed, int generation) {
            this.feed = feed;
            this.generation = generation;
        }

        @Override
        public void onBar(BarUpdate update) {
            if (!feed.active || feed.generation.get() != generation) {
                return;
            }
            feed.attempts.set(0);
            publisher.publish(update);
        }

        @Override
        public void onDisconnect(FeedDisconnectedException cause) {
            if (!feed.active || feed.generation.get() != generation) {
                return;
            }
            log.warn("Feed disconnected: series={}, cause={}", feed.series, cause.getMessage());
            scheduleReconnect(feed);
        }
    }
}
