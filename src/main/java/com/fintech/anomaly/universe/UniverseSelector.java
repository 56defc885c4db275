package com.fintech.anomaly.universe;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.MarketTicker;
import com.fintech.anomaly.feed.MarketDataClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically re-selects the tracked instruments from the market snapshot: liquidity
 * floor, quote-asset suffix, descending 24h quote volume (ties by name), top N.
 *
 * <p>A failed or empty snapshot never shrinks the universe; the previous one is kept and
 * the refresh reports {@link UniverseChange.Status#DATA_UNAVAILABLE}.
 */
@Component
public class UniverseSelector {

    private static final Logger log = LoggerFactory.getLogger(UniverseSelector.class);

    private final MarketDataClient marketDataClient;
    private final ActiveUniverse activeUniverse;
    private final List<UniverseChangeListener> listeners;
    private final AnomalyProperties.Universe config;
    private final Clock clock;

    private final AtomicLong refreshCounter = new AtomicLong(0);
    private final AtomicLong unavailableCounter = new AtomicLong(0);

    public UniverseSelector(
            MarketDataClient marketDataClient,
            ActiveUniverse activeUniverse,
            List<UniverseChangeListener> listeners,
            AnomalyProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.marketDataClient = marketDataClient;
        this.activeUniverse = activeUniverse;
        this.listeners = List.copyOf(listeners);
        this.config = properties.getUniverse();
        this.clock = clock;

        meterRegistry.gauge("universe.refresh.total", refreshCounter);
        meterRegistry.gauge("universe.refresh.unavailable", unavailableCounter);
        meterRegistry.gauge("universe.size", activeUniverse, ActiveUniverse::size);
    }

    @Scheduled(
        fixedDelayString = "${anomaly.universe.refresh-interval-ms:180000}",
        initialDelayString = "${anomaly.universe.initial-delay-ms:5000}"
    )
    public void scheduledRefresh() {
        refresh();
    }

    /**
     * Runs one refresh and notifies every listener of the outcome.
     */
    public UniverseChange refresh() {
        refreshCounter.incrementAndGet();
        Set<String> previous = new LinkedHashSet<>(activeUniverse.instruments());

        UniverseChange change;
        try {
            change = select(previous);
        } catch (Exception e) {
            log.warn("Market snapshot unavailable, keeping universe of {} instruments: {}",
                previous.size(), e.getMessage());
            change = UniverseChange.unavailable(previous);
        }

        if (change.status() == UniverseChange.Status.DATA_UNAVAILABLE) {
            unavailableCounter.incrementAndGet();
        }
        notifyListeners(change);
        return change;
    }

    private UniverseChange select(Set<String> previous) {
        List<MarketTicker> tickers = marketDataClient.fetchMarketSnapshot();
        if (tickers == null || tickers.isEmpty()) {
            log.warn("Empty market snapshot, keeping universe of {} instruments", previous.size());
            return UniverseChange.unavailable(previous);
        }

        String suffix = config.getQuoteAssetSuffix() == null
            ? ""
            : config.getQuoteAssetSuffix().trim().toUpperCase(Locale.ROOT);

        Map<String, Double> selected = new LinkedHashMap<>();
        tickers.stream()
            .filter(t -> t.instrument() != null && !t.instrument().isBlank())
            .filter(t -> Double.isFinite(t.quoteVolume24h()) && t.quoteVolume24h() >= config.getMinQuoteVolume())
            .filter(t -> suffix.isEmpty() || t.instrument().toUpperCase(Locale.ROOT).endsWith(suffix))
            .sorted(Comparator.comparingDouble(MarketTicker::quoteVolume24h).reversed()
                .thenComparing(MarketTicker::instrument))
            .forEach(t -> selected.putIfAbsent(t.instrument().toUpperCase(Locale.ROOT), t.quoteVolume24h()));

        if (selected.isEmpty()) {
            log.warn("No instrument passed the filters ({} tickers, minQuoteVolume={}, suffix={}), keeping universe",
                tickers.size(), config.getMinQuoteVolume(), suffix);
            return UniverseChange.unavailable(previous);
        }

        Map<String, Double> top = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : selected.entrySet()) {
            if (top.size() >= config.getTopN()) {
                break;
            }
            top.put(entry.getKey(), entry.getValue());
        }

        activeUniverse.replace(new ActiveUniverse.Snapshot(List.copyOf(top.keySet()), top, clock.millis()));

        Set<String> added = new LinkedHashSet<>(top.keySet());
        added.removeAll(previous);
        Set<String> removed = new LinkedHashSet<>(previous);
        removed.removeAll(top.keySet());
        Set<String> retained = new LinkedHashSet<>(previous);
        retained.retainAll(top.keySet());

        log.info("Universe refreshed: size={}, added={}, removed={}, retained={}",
            top.size(), added.size(), removed.size(), retained.size());
        return new UniverseChange(added, removed, retained, UniverseChange.Status.UPDATED);
    }

    private void notifyListeners(UniverseChange change) {
        for (UniverseChangeListener listener : listeners) {
            try {
                listener.onUniverseChange(change);
            } catch (Exception e) {
                log.error("Universe listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
