package com.fintech.anomaly.api;

import com.fintech.anomaly.domain.AnomalyRecord;
import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.ingestion.BarIngestionService;
import com.fintech.anomaly.ingestion.BarUpdateEventPublisher;
import com.fintech.anomaly.monitoring.PipelineHealth;
import com.fintech.anomaly.monitoring.PipelineHealthService;
import com.fintech.anomaly.service.AnomalyQueryService;
import com.fintech.anomaly.universe.ActiveUniverse;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API for querying scored bars and pipeline state.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Anomalies", description = "Scored market anomalies and bar history")
public class AnomalyController {

    private static final Logger log = LoggerFactory.getLogger(AnomalyController.class);

    private final AnomalyQueryService queryService;
    private final ActiveUniverse activeUniverse;
    private final PipelineHealthService healthService;
    private final BarIngestionService ingestionService;
    private final BarUpdateEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public AnomalyController(
            AnomalyQueryService queryService,
            ActiveUniverse activeUniverse,
            PipelineHealthService healthService,
            BarIngestionService ingestionService,
            BarUpdateEventPublisher eventPublisher,
            MeterRegistry meterRegistry) {
        this.queryService = queryService;
        this.activeUniverse = activeUniverse;
        this.healthService = healthService;
        this.ingestionService = ingestionService;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /api/v1/anomalies
     *
     * @param instrument optional instrument filter (e.g., "BTCUSDT")
     * @param minScore minimum composite score
     * @param anomalyOnly exclude records with a zero composite score
     * @param hours optional lookback in hours
     * @param limit maximum number of records
     */
    @Operation(
        summary = "Query scored bars",
        description = """
            Returns scored bars newest first, optionally filtered by instrument,
            minimum composite score and lookback window.

            **Example Request:**
            ```
            GET /api/v1/anomalies?instrument=BTCUSDT&minScore=1.5&hours=6&limit=50
            ```
            """,
        tags = {"Anomalies"}
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successfully retrieved anomaly records",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        [
                          {
                            "instrument": "BTCUSDT",
                            "interval": "15m",
                            "timestamp": 1733529300000,
                            "closePrice": 64850.5,
                            "currentReturn": 0.031,
                            "priceZScore": 3.4,
                            "volumeZScore": 2.7,
                            "volatilityZScore": 1.1,
                            "returnPercentile": 100.0,
                            "compositeScore": 2.17,
                            "reasons": ["price", "volume"]
                          }
                        ]
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Anomaly store unavailable",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/anomalies")
    public ResponseEntity<List<AnomalyResponse>> getAnomalies(
            @Parameter(description = "Instrument filter", example = "BTCUSDT")
            @RequestParam(required = false)
            String instrument,

            @Parameter(description = "Minimum composite score", example = "1.0")
            @RequestParam(required = false)
            @PositiveOrZero(message = "minScore must be zero or positive")
            Double minScore,

            @Parameter(description = "Only return records with a positive composite score")
            @RequestParam(defaultValue = "false")
            boolean anomalyOnly,

            @Parameter(description = "Lookback window in hours", example = "24")
            @RequestParam(required = false)
            @Min(value = 1, message = "hours must be at least 1")
            @Max(value = 720, message = "hours must be at most 720")
            Integer hours,

            @Parameter(description = "Maximum number of records (1-1000)", example = "100")
            @RequestParam(required = false)
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = 1000, message = "limit must be at most 1000")
            Integer limit) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<AnomalyRecord> records = queryService.queryAnomalies(instrument, minScore, anomalyOnly, hours, limit);
            log.debug("Anomaly query: instrument={}, minScore={}, anomalyOnly={}, hours={}, results={}",
                instrument, minScore, anomalyOnly, hours, records.size());
            return ResponseEntity.ok(records.stream().map(AnomalyResponse::from).toList());
        } finally {
            sample.stop(meterRegistry.timer("api.anomalies.request.time", "endpoint", "anomalies"));
        }
    }

    @Operation(
        summary = "Top anomalies",
        description = "Highest composite scores within the lookback window (default 24 hours).",
        tags = {"Anomalies"}
    )
    @GetMapping("/anomalies/top")
    public ResponseEntity<List<AnomalyResponse>> getTopAnomalies(
            @Parameter(description = "Lookback window in hours", example = "24")
            @RequestParam(required = false)
            @Min(value = 1, message = "hours must be at least 1")
            @Max(value = 720, message = "hours must be at most 720")
            Integer hours,

            @Parameter(description = "Maximum number of records (1-1000)", example = "20")
            @RequestParam(required = false)
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = 1000, message = "limit must be at most 1000")
            Integer limit) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<AnomalyRecord> records = queryService.topAnomalies(hours, limit);
            return ResponseEntity.ok(records.stream().map(AnomalyResponse::from).toList());
        } finally {
            sample.stop(meterRegistry.timer("api.anomalies.request.time", "endpoint", "top"));
        }
    }

    @Operation(
        summary = "Recent bars of a series",
        description = "Most recent stored bars of one instrument and interval, oldest first. Includes the open bar.",
        tags = {"Anomalies"}
    )
    @GetMapping("/instruments/{instrument}/bars")
    public ResponseEntity<List<BarResponse>> getRecentBars(
            @Parameter(description = "Instrument", example = "BTCUSDT", required = true)
            @PathVariable
            String instrument,

            @Parameter(description = "Bar interval", example = "15m")
            @RequestParam(defaultValue = "15m")
            String interval,

            @Parameter(description = "Maximum number of bars (1-1000)", example = "100")
            @RequestParam(required = false)
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = 1000, message = "limit must be at most 1000")
            Integer limit) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<Bar> bars = queryService.recentBars(instrument, interval, limit);
            return ResponseEntity.ok(bars.stream().map(BarResponse::from).toList());
        } finally {
            sample.stop(meterRegistry.timer("api.anomalies.request.time", "endpoint", "bars"));
        }
    }

    @Operation(
        summary = "Current baseline window",
        description = "Return, quote volume and volatility statistics over the latest closed bars of a series; "
            + "the next closed bar is scored against this window. ready is false until the series holds a full window.",
        tags = {"Anomalies"}
    )
    @GetMapping("/instruments/{instrument}/window")
    public ResponseEntity<WindowResponse> getCurrentWindow(
            @Parameter(description = "Instrument", example = "BTCUSDT", required = true)
            @PathVariable
            String instrument,

            @Parameter(description = "Bar interval", example = "15m")
            @RequestParam(defaultValue = "15m")
            String interval) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return ResponseEntity.ok(WindowResponse.from(
                instrument.trim().toUpperCase(Locale.ROOT),
                interval,
                queryService.getWindowSize(),
                queryService.currentWindow(instrument, interval)));
        } finally {
            sample.stop(meterRegistry.timer("api.anomalies.request.time", "endpoint", "window"));
        }
    }

    /**
     * GET /api/v1/universe
     *
     * Returns the active universe ranked by 24h quote volume.
     */
    @Operation(
        summary = "Active universe",
        description = "Instruments currently monitored, ranked by 24h quote volume.",
        tags = {"Monitoring"}
    )
    @GetMapping("/universe")
    public ResponseEntity<UniverseResponse> getUniverse() {
        ActiveUniverse.Snapshot snapshot = activeUniverse.snapshot();
        return ResponseEntity.ok(new UniverseResponse(
            snapshot.instruments().size(),
            snapshot.refreshedAt(),
            snapshot.instruments(),
            snapshot.quoteVolumes()
        ));
    }

    @Operation(
        summary = "Pipeline status",
        description = "Store size, universe size, degraded series and last pass times.",
        tags = {"Monitoring"}
    )
    @GetMapping("/status")
    public ResponseEntity<PipelineHealth> getStatus() {
        return ResponseEntity.ok(healthService.health());
    }

    @Operation(
        summary = "Ingestion counters",
        description = "Updates processed, invalid updates dropped, store write failures and ring buffer drops.",
        tags = {"Monitoring"}
    )
    @GetMapping("/metrics/ingestion")
    public ResponseEntity<IngestionMetrics> getIngestionMetrics() {
        return ResponseEntity.ok(new IngestionMetrics(
            ingestionService.getUpdatesProcessed(),
            ingestionService.getInvalidUpdatesDropped(),
            ingestionService.getWriteFailures(),
            eventPublisher.getEventsPublished(),
            eventPublisher.getRingBufferEventsDropped(),
            eventPublisher.getRemainingCapacity(),
            queryService.getCircuitBreakerState()
        ));
    }

    @Schema(description = "Active universe snapshot")
    public record UniverseResponse(
        @Schema(example = "150") int size,
        @Schema(description = "Last successful refresh (epoch millis)") long refreshedAt,
        List<String> instruments,
        Map<String, Double> quoteVolume24h
    ) {}

    @Schema(description = "Ingestion counters")
    public record IngestionMetrics(
        long updatesProcessed,
        long invalidUpdatesDropped,
        long storeWriteFailures,
        long eventsPublished,
        long ringBufferEventsDropped,
        long ringBufferRemainingCapacity,
        @Schema(example = "CLOSED") String storeCircuitBreakerState
    ) {}
}
