package com.fintech.anomaly.feed.simulation;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.BarUpdate;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.MarketTicker;
import com.fintech.anomaly.feed.BarStreamClient;
import com.fintech.anomaly.feed.BarUpdateListener;
import com.fintech.anomaly.feed.FeedDisconnectedException;
import com.fintech.anomaly.feed.FeedSubscription;
import com.fintech.anomaly.feed.MarketDataClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulates an exchange for local runs and demonstrations.
 *
 * Generates bars from a random walk with:
 * - Per-instrument volatility
 * - Occasional spike bars (large move and volume burst)
 * - Random subscription drops, to exercise reconnects
 * - Synthetic history for backfill and a 24h volume snapshot for universe selection
 *
 * Disabled unless 'anomaly.simulation.enabled' is true.
 */
@Component
@ConditionalOnProperty(name = "anomaly.simulation.enabled", havingValue = "true")
public class SimulatedMarketFeed implements BarStreamClient, MarketDataClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMarketFeed.class);

    private static final Map<String, Double> INITIAL_PRICES = Map.of(
        "BTCUSDT", 64000.0,
        "ETHUSDT", 3100.0,
        "SOLUSDT", 145.0,
        "XRPUSDT", 0.52,
        "DOGEUSDT", 0.12
    );

    // Relative move per tick
    private static final Map<String, Double> VOLATILITIES = Map.of(
        "BTCUSDT", 0.0002,
        "ETHUSDT", 0.0003,
        "SOLUSDT", 0.0005,
        "XRPUSDT", 0.0006,
        "DOGEUSDT", 0.0008
    );

    private static final double SPIKE_VOLUME_MULTIPLIER = 8.0;
    private static final double SPIKE_MIN_MOVE = 0.01;
    private static final double SPIKE_MAX_MOVE = 0.04;

    private final AnomalyProperties.Simulation config;
    private final Clock clock;
    private final Map<String, Double> currentPrices = new ConcurrentHashMap<>();
    private final Map<Long, SimulatedSubscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong subscriptionIds = new AtomicLong(0);
    private final AtomicLong updatesGenerated = new AtomicLong(0);

    public SimulatedMarketFeed(AnomalyProperties properties, Clock clock) {
        this.config = properties.getSimulation();
        this.clock = clock;
        for (String instrument : config.getInstruments()) {
            String symbol = instrument.toUpperCase(Locale.ROOT);
            currentPrices.put(symbol, INITIAL_PRICES.getOrDefault(symbol, 100.0));
        }
        log.info("Market simulation enabled for {} instruments", currentPrices.size());
    }

    @Override
    public FeedSubscription subscribe(String instrument, Interval interval, BarUpdateListener listener) {
        currentPrices.putIfAbsent(instrument, INITIAL_PRICES.getOrDefault(instrument, 100.0));
        long id = subscriptionIds.incrementAndGet();
        SimulatedSubscription subscription = new SimulatedSubscription(id, instrument, interval, listener);
        subscriptions.put(id, subscription);
        log.debug("Simulated subscription opened: instrument={}, interval={}", instrument, interval);
        return subscription;
    }

    @Override
    public List<BarUpdate> fetchRecentBars(String instrument, Interval interval, int limit) {
        double price = currentPrices.getOrDefault(instrument, INITIAL_PRICES.getOrDefault(instrument, 100.0));
        long currentOpen = interval.alignTimestamp(clock.millis());
        double volatility = VOLATILITIES.getOrDefault(instrument, 0.0005) * 10;
        ThreadLocalRandom random = ThreadLocalRandom.current();

        // Walk backwards from the current price, newest bar first
        List<BarUpdate> bars = new ArrayList<>(limit);
        double close = price;
        for (int i = 1; i <= limit; i++) {
            long openTime = currentOpen - i * interval.toMillis();
            double open = close * (1 + random.nextDouble(-volatility, volatility));
            double high = Math.max(open, close) * (1 + random.nextDouble(0, volatility));
            double low = Math.min(open, close) * (1 - random.nextDouble(0, volatility));
            double volume = random.nextDouble(50, 150);
            bars.add(new BarUpdate(instrument, interval, openTime, interval.closeTime(openTime),
                open, high, low, close, volume, volume * close, random.nextLong(100, 1000), true));
            close = open;
        }
        bars.sort(Comparator.comparingLong(BarUpdate::openTime));
        return bars;
    }

    @Override
    public List<MarketTicker> fetchMarketSnapshot() {
        List<MarketTicker> tickers = new ArrayList<>();
        for (Map.Entry<String, Double> entry : currentPrices.entrySet()) {
            // Notional turnover roughly proportional to price level
            double quoteVolume = 1_000_000.0 * Math.max(1.0, Math.log10(entry.getValue() + 10))
                * ThreadLocalRandom.current().nextDouble(0.8, 1.2);
            tickers.add(new MarketTicker(entry.getKey(), quoteVolume));
        }
        return tickers;
    }

    /**
     * Advances the random walk and pushes an update to every open subscription.
     */
    @Scheduled(fixedRateString = "${anomaly.simulation.update-frequency-ms:1000}")
    public void generateMarketData() {
        long now = clock.millis();
        for (String instrument : currentPrices.keySet()) {
            updatePrice(instrument);
        }
        for (SimulatedSubscription subscription : subscriptions.values()) {
            if (ThreadLocalRandom.current().nextDouble() < config.getDisconnectProbability()) {
                subscription.drop();
                continue;
            }
            subscription.tick(now, currentPrices.get(subscription.instrument));
        }
        long generated = updatesGenerated.get();
        if (generated > 0 && generated % 10_000 == 0) {
            log.info("Generated {} simulated bar updates", generated);
        }
    }

    private void updatePrice(String instrument) {
        double currentPrice = currentPrices.get(instrument);
        double maxChange = currentPrice * VOLATILITIES.getOrDefault(instrument, 0.0005);
        double newPrice = currentPrice + ThreadLocalRandom.current().nextDouble(-maxChange, maxChange);
        if (newPrice <= 0) {
            newPrice = currentPrice;
        }
        currentPrices.put(instrument, newPrice);
    }

    public long getUpdatesGenerated() {
        return updatesGenerated.get();
    }

    public int getOpenSubscriptions() {
        return subscriptions.size();
    }

    /**
     * One simulated stream; accumulates the current bar and closes it when its window ends.
     */
    private final class SimulatedSubscription implements FeedSubscription {

        private final long id;
        private final String instrument;
        private final Interval interval;
        private final BarUpdateListener listener;

        private volatile boolean open = true;

        private long openTime = -1;
        private double openPrice;
        private double high;
        private double low;
        private double close;
        private double volume;
        private long trades;
        private boolean spike;

        SimulatedSubscription(long id, String instrument, Interval interval, BarUpdateListener listener) {
            this.id = id;
            this.instrument = instrument;
            this.interval = interval;
            this.listener = listener;
        }

        synchronized void tick(long now, double price) {
            if (!open) {
                return;
            }
            long windowStart = interval.alignTimestamp(now);
            if (openTime >= 0 && windowStart != openTime) {
                emit(true);
                openTime = -1;
            }
            if (openTime < 0) {
                start(windowStart, close > 0 ? close : price);
                price = currentPrices.get(instrument);
            }

            high = Math.max(high, price);
            low = Math.min(low, price);
            close = price;
            volume += ThreadLocalRandom.current().nextDouble(0.5, 1.5) * (spike ? SPIKE_VOLUME_MULTIPLIER : 1.0);
            trades += ThreadLocalRandom.current().nextLong(1, 20);
            emit(false);
        }

        private void start(long windowStart, double price) {
            openTime = windowStart;
            openPrice = price;
            high = price;
            low = price;
            close = price;
            volume = 0.0;
            trades = 0;
            spike = ThreadLocalRandom.current().nextDouble() < config.getSpikeProbability();
            if (spike) {
                // Level shift of the shared walk, so the jump persists past this bar
                double move = ThreadLocalRandom.current().nextDouble(SPIKE_MIN_MOVE, SPIKE_MAX_MOVE)
                    * (ThreadLocalRandom.current().nextBoolean() ? 1 : -1);
                currentPrices.computeIfPresent(instrument, (k, p) -> p * (1 + move));
                log.debug("Simulating spike bar: instrument={}, interval={}, openTime={}", instrument, interval, windowStart);
            }
        }

        private void emit(boolean isFinal) {
            updatesGenerated.incrementAndGet();
            listener.onBar(new BarUpdate(instrument, interval, openTime, interval.closeTime(openTime),
                openPrice, high, low, close, volume, volume * close, trades, isFinal));
        }

        void drop() {
            if (!open) {
                return;
            }
            close();
            log.info("Simulated disconnect: instrument={}, interval={}", instrument, interval);
            listener.onDisconnect(new FeedDisconnectedException(instrument, interval, "Simulated connection drop"));
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
            subscriptions.remove(id);
        }
    }
}
