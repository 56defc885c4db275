package com.fintech.anomaly.cucumber;

import com.fintech.anomaly.StubFeedConfiguration;
import com.fintech.anomaly.StubMarketFeed;
import com.fintech.anomaly.TestBars;
import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.AnomalyReason;
import com.fintech.anomaly.domain.AnomalyRecord;
import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.domain.BarKey;
import com.fintech.anomaly.domain.BarUpdate;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.MarketTicker;
import com.fintech.anomaly.domain.SeriesKey;
import com.fintech.anomaly.domain.UpsertResult;
import com.fintech.anomaly.ingestion.BarIngestionService;
import com.fintech.anomaly.ingestion.IngestionPipeline;
import com.fintech.anomaly.retention.RetentionManager;
import com.fintech.anomaly.retention.SweepReport;
import com.fintech.anomaly.scoring.AnomalyScoringEngine;
import com.fintech.anomaly.storage.AnomalyQuery;
import com.fintech.anomaly.storage.AnomalySink;
import com.fintech.anomaly.storage.BarStore;
import com.fintech.anomaly.storage.jpa.AnomalyJpaRepository;
import com.fintech.anomaly.storage.jpa.BarJpaRepository;
import com.fintech.anomaly.universe.ActiveUniverse;
import com.fintech.anomaly.universe.UniverseSelector;
import io.cucumber.datatable.DataTable;
import io.cucumber.java.Before;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.CucumberContextConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Step definitions for the anomaly detection features.
 *
 * Runs against the full application context with the stub exchange and its own H2
 * database. Updates go through {@link BarIngestionService} on the calling thread so each
 * step observes its own writes.
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@Import(StubFeedConfiguration.class)
@TestPropertySource(properties = "spring.datasource.url=jdbc:h2:mem:anomaly_bdd;DB_CLOSE_DELAY=-1")
public class AnomalyDetectionSteps {

    private static final double QUOTE_VOLUME = 1_000_000.0;

    @Autowired
    private BarIngestionService ingestionService;

    @Autowired
    private AnomalyScoringEngine scoringEngine;

    @Autowired
    private BarStore barStore;

    @Autowired
    private AnomalySink anomalySink;

    @Autowired
    private BarJpaRepository barRepository;

    @Autowired
    private AnomalyJpaRepository anomalyRepository;

    @Autowired
    private UniverseSelector universeSelector;

    @Autowired
    private ActiveUniverse activeUniverse;

    @Autowired
    private IngestionPipeline ingestionPipeline;

    @Autowired
    private StubMarketFeed stubFeed;

    private final Map<SeriesKey, Bar> lastBars = new HashMap<>();
    private Optional<UpsertResult> lastResult = Optional.empty();
    private List<Bar> recentBeforeSweep = List.of();
    private long sweepCutoff;

    @Before
    public void setUp() {
        lastBars.clear();
        lastResult = Optional.empty();
        stubFeed.reset();
        anomalyRepository.deleteAll();
        barRepository.deleteAll();
        // Drain keys queued by an earlier scenario
        scoringEngine.runScoringPass();
    }

    // ================ Background Steps ================

    @Given("the market anomaly service is running")
    public void theMarketAnomalyServiceIsRunning() {
        assertThat(ingestionService).isNotNull();
        assertThat(scoringEngine).isNotNull();
        assertThat(barStore.isHealthy()).isTrue();
    }

    @Given("the bar store is empty")
    public void theBarStoreIsEmpty() {
        assertThat(barStore.count()).isZero();
        assertThat(anomalySink.count()).isZero();
    }

    // ================ Given Steps ================

    @Given("{int} closed {string} {word} bars with return mean 0.0 and standard deviation {double}")
    public void closedBarsWithReturnStdDev(int count, String instrument, String intervalCode, double stdDev) {
        Interval interval = Interval.fromCode(intervalCode);
        int returns = count - 1;
        // Alternating +a / -a over an even number of returns has mean 0
        double a = returns > 1 ? stdDev * Math.sqrt((returns - 1.0) / returns) : stdDev;
        double[] closes = TestBars.alternatingCloses(100.0, a, returns);

        for (Bar bar : TestBars.series(instrument, interval, TestBars.BASE_TIME, QUOTE_VOLUME, closes)) {
            assertThat(ingestionService.apply(BarUpdate.of(bar))).contains(UpsertResult.INSERTED_FINAL);
            lastBars.put(new SeriesKey(instrument, interval), bar);
        }
    }

    @Given("{string} {word} bars covering the last {int} hours")
    public void barsCoveringTheLastHours(String instrument, String intervalCode, int hours) {
        Interval interval = Interval.fromCode(intervalCode);
        long currentOpen = interval.alignTimestamp(System.currentTimeMillis());
        long count = Duration.ofHours(hours).toMillis() / interval.toMillis();
        for (int i = 1; i <= count; i++) {
            barStore.upsert(TestBars.closed(instrument, interval, currentOpen - i * interval.toMillis(),
                100.0 + i, QUOTE_VOLUME));
        }
    }

    @Given("the exchange reports 24h quote volumes")
    public void theExchangeReportsQuoteVolumes(DataTable table) {
        List<MarketTicker> tickers = new ArrayList<>();
        for (Map<String, String> row : table.asMaps()) {
            tickers.add(new MarketTicker(row.get("instrument"), Double.parseDouble(row.get("quoteVolume"))));
        }
        stubFeed.setSnapshot(tickers);
    }

    @Given("the exchange holds {int} closed {string} {word} bars of history")
    public void theExchangeHoldsHistory(int count, String instrument, String intervalCode) {
        Interval interval = Interval.fromCode(intervalCode);
        long currentOpen = interval.alignTimestamp(System.currentTimeMillis());
        List<BarUpdate> history = new ArrayList<>();
        for (int i = count; i >= 1; i--) {
            history.add(TestBars.update(instrument, interval, currentOpen - i * interval.toMillis(), 100.0 + i, true));
        }
        stubFeed.setHistory(instrument, interval, history);
    }

    // ================ When Steps ================

    @When("the next {string} {word} bar updates and then closes with return {double}")
    public void theNextBarUpdatesAndCloses(String instrument, String intervalCode, double ret) {
        Interval interval = Interval.fromCode(intervalCode);
        Bar last = lastBar(instrument, interval);
        long openTime = last.openTime() + interval.toMillis();

        Optional<UpsertResult> inProgress = ingestionService.apply(
            BarUpdate.of(TestBars.open(instrument, interval, openTime, last.close(), QUOTE_VOLUME / 2)));
        assertThat(inProgress).contains(UpsertResult.INSERTED);

        closeNextBar(instrument, interval, openTime, last.close() * (1 + ret));
    }

    @When("the next {string} {word} bar closes with return {double}")
    public void theNextBarCloses(String instrument, String intervalCode, double ret) {
        Interval interval = Interval.fromCode(intervalCode);
        Bar last = lastBar(instrument, interval);
        closeNextBar(instrument, interval, last.openTime() + interval.toMillis(), last.close() * (1 + ret));
    }

    @When("a scoring pass runs")
    public void aScoringPassRuns() {
        scoringEngine.runScoringPass();
    }

    @When("a replayed final update for the last {string} {word} bar arrives with close {double}")
    public void aReplayedFinalUpdateArrives(String instrument, String intervalCode, double close) {
        Bar last = lastBar(instrument, Interval.fromCode(intervalCode));
        lastResult = ingestionService.apply(BarUpdate.of(
            TestBars.closed(instrument, last.interval(), last.openTime(), close, QUOTE_VOLUME * 3)));
    }

    @When("a retention sweep runs with a maximum age of {int} hours")
    public void aRetentionSweepRuns(int hours) {
        Instant now = Instant.now();
        AnomalyProperties properties = new AnomalyProperties();
        properties.getRetention().setMaxAge(Duration.ofHours(hours));
        sweepCutoff = now.toEpochMilli() - Duration.ofHours(hours).toMillis();
        recentBeforeSweep = allBars().stream().filter(bar -> bar.openTime() >= sweepCutoff).toList();

        RetentionManager retentionManager = new RetentionManager(barStore, anomalySink, properties,
            Clock.fixed(now, ZoneOffset.UTC), new SimpleMeterRegistry());
        SweepReport report = retentionManager.sweep();

        assertThat(report.success()).isTrue();
        assertThat(report.barsDeletedByAge()).isPositive();
    }

    @When("the universe is refreshed")
    public void theUniverseIsRefreshed() {
        universeSelector.refresh();
    }

    // ================ Then Steps ================

    @Then("an anomaly record exists for the last {string} {word} bar")
    public void anAnomalyRecordExists(String instrument, String intervalCode) {
        assertThat(recordForLastBar(instrument, Interval.fromCode(intervalCode))).isPresent();
    }

    @Then("no anomaly record exists for the last {string} {word} bar")
    public void noAnomalyRecordExists(String instrument, String intervalCode) {
        assertThat(recordForLastBar(instrument, Interval.fromCode(intervalCode))).isEmpty();
    }

    @Then("its reasons are {string}")
    public void itsReasonsAre(String reasons) {
        AnomalyRecord record = latestRecord();
        List<String> expected = Arrays.asList(reasons.split(","));
        assertThat(record.reasons()).extracting(AnomalyReason::tag).containsExactlyInAnyOrderElementsOf(expected);
    }

    @Then("its price z-score is about {double}")
    public void itsPriceZScoreIsAbout(double z) {
        assertThat(latestRecord().priceZScore()).isCloseTo(z, within(1e-6));
    }

    @Then("its composite score is positive")
    public void itsCompositeScoreIsPositive() {
        assertThat(latestRecord().compositeScore()).isPositive();
        assertThat(latestRecord().isAnomaly()).isTrue();
    }

    @Then("the update is rejected")
    public void theUpdateIsRejected() {
        assertThat(lastResult).contains(UpsertResult.REJECTED_FINAL);
    }

    @Then("the last {string} {word} bar is unchanged")
    public void theLastBarIsUnchanged(String instrument, String intervalCode) {
        Bar expected = lastBar(instrument, Interval.fromCode(intervalCode));
        Bar stored = barStore.find(expected.key()).orElseThrow();
        assertThat(stored.close()).isEqualTo(expected.close());
        assertThat(stored.quoteVolume()).isEqualTo(expected.quoteVolume());
        assertThat(stored.isFinal()).isTrue();
    }

    @Then("no {string} bar older than {int} hours remains")
    public void noBarOlderThanRemains(String instrument, int hours) {
        assertThat(allBars())
            .isNotEmpty()
            .allSatisfy(bar -> assertThat(bar.openTime()).isGreaterThanOrEqualTo(sweepCutoff));
    }

    @Then("every {string} bar from the last {int} hours remains")
    public void everyRecentBarRemains(String instrument, int hours) {
        assertThat(allBars()).containsExactlyInAnyOrderElementsOf(recentBeforeSweep);
    }

    @Then("the active universe is {string}")
    public void theActiveUniverseIs(String instruments) {
        assertThat(activeUniverse.instruments()).containsExactlyElementsOf(Arrays.asList(instruments.split(",")));
    }

    @Then("{string} {word} is subscribed")
    public void isSubscribed(String instrument, String intervalCode) {
        Interval interval = Interval.fromCode(intervalCode);
        assertThat(stubFeed.isSubscribed(instrument, interval)).isTrue();
        assertThat(ingestionPipeline.getSubscribedSeries()).contains(new SeriesKey(instrument, interval));
    }

    @Then("{string} {word} is not subscribed")
    public void isNotSubscribed(String instrument, String intervalCode) {
        Interval interval = Interval.fromCode(intervalCode);
        assertThat(stubFeed.isSubscribed(instrument, interval)).isFalse();
        assertThat(ingestionPipeline.getSubscribedSeries()).doesNotContain(new SeriesKey(instrument, interval));
    }

    @Then("{int} closed {string} {word} bars are stored within {int} seconds")
    public void closedBarsAreStoredWithin(int count, String instrument, String intervalCode, int seconds)
            throws InterruptedException {
        Interval interval = Interval.fromCode(intervalCode);
        long deadline = System.currentTimeMillis() + seconds * 1000L;
        while (barStore.countClosed(instrument, interval) < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(barStore.countClosed(instrument, interval)).isEqualTo(count);
    }

    // ================ Helpers ================

    private void closeNextBar(String instrument, Interval interval, long openTime, double close) {
        Bar bar = TestBars.closed(instrument, interval, openTime, close, QUOTE_VOLUME);
        Optional<UpsertResult> result = ingestionService.apply(BarUpdate.of(bar));
        assertThat(result).isPresent();
        assertThat(result.get().closedBar()).isTrue();
        lastBars.put(new SeriesKey(instrument, interval), bar);
    }

    private Bar lastBar(String instrument, Interval interval) {
        Bar last = lastBars.get(new SeriesKey(instrument, interval));
        assertThat(last).as("no bar ingested yet for %s/%s", instrument, interval).isNotNull();
        return last;
    }

    private Optional<AnomalyRecord> recordForLastBar(String instrument, Interval interval) {
        BarKey key = lastBar(instrument, interval).key();
        return anomalySink.query(new AnomalyQuery(instrument, 0.0, false, 0L, 1000)).stream()
            .filter(record -> record.key().equals(key))
            .findFirst();
    }

    private AnomalyRecord latestRecord() {
        List<AnomalyRecord> records = anomalySink.query(new AnomalyQuery(null, 0.0, false, 0L, 1));
        assertThat(records).isNotEmpty();
        return records.get(0);
    }

    private List<Bar> allBars() {
        List<Bar> bars = new ArrayList<>();
        for (SeriesKey series : List.of(new SeriesKey("SOLUSDT", Interval.M15))) {
            bars.addAll(barStore.queryRecent(series.instrument(), series.interval(), 1000));
        }
        return bars;
    }
}
