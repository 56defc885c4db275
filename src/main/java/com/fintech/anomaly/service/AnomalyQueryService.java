package com.fintech.anomaly.service;

import com.fintech.anomaly.domain.AnomalyRecord;
import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.storage.AnomalyQuery;
import com.fintech.anomaly.storage.AnomalySink;
import com.fintech.anomaly.storage.BarStore;
import com.fintech.anomaly.window.WindowManager;
import com.fintech.anomaly.window.WindowSummary;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Read side for anomaly records, stored bars and current baseline windows.
 *
 * Responsibilities:
 * - Input validation and defaults
 * - Circuit breaker around store reads
 * - Metrics and logging
 */
@Service
public class AnomalyQueryService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyQueryService.class);

    static final int DEFAULT_LIMIT = 100;
    static final int DEFAULT_TOP_LIMIT = 20;
    static final int MAX_LIMIT = 1000;
    static final int DEFAULT_LOOKBACK_HOURS = 24;
    static final int MAX_LOOKBACK_HOURS = 24 * 30;

    private static final Pattern INSTRUMENT_PATTERN = Pattern.compile("^[A-Z0-9]{2,30}$");

    private final AnomalySink anomalySink;
    private final BarStore barStore;
    private final WindowManager windowManager;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    private final AtomicLong validationErrors = new AtomicLong(0);
    private final AtomicLong serviceErrors = new AtomicLong(0);

    public AnomalyQueryService(
            AnomalySink anomalySink,
            BarStore barStore,
            WindowManager windowManager,
            CircuitBreakerRegistry circuitBreakerRegistry,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.anomalySink = anomalySink;
        this.barStore = barStore;
        this.windowManager = windowManager;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("database");
        this.clock = clock;

        meterRegistry.gauge("anomaly.query.validation.errors", validationErrors);
        meterRegistry.gauge("anomaly.query.errors", serviceErrors);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Anomaly records, newest first, without a time bound.
     *
     * @param instrument optional instrument filter
     * @param minScore minimum composite score, default 0
     * @param anomalyOnly exclude zero-score records, default false
     * @param limit maximum records, default 100, at most 1000
     * @throws ValidationException on invalid input
     * @throws ServiceException if the store cannot be read
     */
    public List<AnomalyRecord> queryAnomalies(String instrument, Double minScore, Boolean anomalyOnly, Integer limit) {
        return queryAnomalies(instrument, minScore, anomalyOnly, null, limit);
    }

    /**
     * Anomaly records of the last {@code lookbackHours} hours, newest first.
     * A null lookback applies no time bound.
     */
    public List<AnomalyRecord> queryAnomalies(
            String instrument,
            Double minScore,
            Boolean anomalyOnly,
            Integer lookbackHours,
            Integer limit) {

        String normalized = normalizeInstrument(instrument, false);
        double score = minScore == null ? 0.0 : minScore;
        if (!Double.isFinite(score) || score < 0) {
            throw validationError("minScore must be a non-negative number");
        }
        long since = lookbackHours == null ? 0L : sinceHours(lookbackHours);

        AnomalyQuery query = new AnomalyQuery(
            normalized,
            score,
            Boolean.TRUE.equals(anomalyOnly),
            since,
            validateLimit(limit, DEFAULT_LIMIT)
        );
        return execute("queryAnomalies", () -> anomalySink.query(query));
    }

    /**
     * Highest-scoring anomalies of the last {@code lookbackHours} hours (default 24).
     */
    public List<AnomalyRecord> topAnomalies(Integer lookbackHours, Integer limit) {
        long since = sinceHours(lookbackHours == null ? DEFAULT_LOOKBACK_HOURS : lookbackHours);
        int validated = validateLimit(limit, DEFAULT_TOP_LIMIT);
        return execute("topAnomalies", () -> anomalySink.top(since, validated));
    }

    /**
     * Most recent stored bars of a series (closed or not), oldest first.
     */
    public List<Bar> recentBars(String instrument, String intervalCode, Integer limit) {
        String normalized = normalizeInstrument(instrument, true);
        Interval interval = parseInterval(intervalCode);
        int validated = validateLimit(limit, DEFAULT_LIMIT);
        return execute("recentBars", () -> barStore.queryRecent(normalized, interval, validated));
    }

    /**
     * Baseline window over the latest closed bars of a series, empty until the series
     * holds a full window.
     */
    public Optional<WindowSummary> currentWindow(String instrument, String intervalCode) {
        String normalized = normalizeInstrument(instrument, true);
        Interval interval = parseInterval(intervalCode);
        return execute("currentWindow", () -> windowManager.summarize(normalized, interval));
    }

    public int getWindowSize() {
        return windowManager.getWindowSize();
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    private <T> T execute(String operation, Supplier<T> query) {
        try {
            return circuitBreaker.executeSupplier(query);
        } catch (CallNotPermittedException e) {
            log.error("Circuit breaker OPEN - rejecting {}", operation);
            throw new ServiceException("Database circuit breaker is open. System is recovering from errors.", e);
        } catch (Exception e) {
            serviceErrors.incrementAndGet();
            log.error("Store error during {}", operation, e);
            throw new ServiceException("Failed to read from store", e);
        }
    }

    private String normalizeInstrument(String instrument, boolean required) {
        if (instrument == null || instrument.isBlank()) {
            if (required) {
                throw validationError("Instrument cannot be null or blank");
            }
            return null;
        }
        String normalized = instrument.trim().toUpperCase(Locale.ROOT);
        if (!INSTRUMENT_PATTERN.matcher(normalized).matches()) {
            throw validationError("Invalid instrument: " + instrument);
        }
        return normalized;
    }

    private Interval parseInterval(String intervalCode) {
        try {
            return Interval.fromCode(intervalCode == null ? Interval.M15.code() : intervalCode);
        } catch (IllegalArgumentException e) {
            throw validationError(e.getMessage());
        }
    }

    private int validateLimit(Integer limit, int defaultLimit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw validationError("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }

    private long sinceHours(int hours) {
        if (hours < 1 || hours > MAX_LOOKBACK_HOURS) {
            throw validationError("hours must be between 1 and " + MAX_LOOKBACK_HOURS);
        }
        return clock.millis() - Duration.ofHours(hours).toMillis();
    }

    private ValidationException validationError(String message) {
        validationErrors.incrementAndGet();
        return new ValidationException(message);
    }

    /**
     * Business logic validation exception.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Service layer exception (wraps store/infrastructure errors).
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
