package com.fintech.anomaly.storage.jpa;

import com.fintech.anomaly.TestBars;
import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.domain.BarKey;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.UpsertResult;
import com.fintech.anomaly.storage.StoreWriteFailedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the relational bar store on an in-memory H2 database.
 * Runs outside a test transaction so every write commits as it does in production.
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("JPA Bar Store Tests")
class JpaBarStoreTest {

    private static final String BTC = "BTCUSDT";
    private static final String ETH = "ETHUSDT";
    private static final long T0 = TestBars.BASE_TIME;
    private static final long STEP = Interval.M15.toMillis();

    @Autowired
    private BarJpaRepository jpaRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private JpaBarStore store;

    @BeforeEach
    void setUp() {
        jpaRepository.deleteAll();
        AnomalyProperties properties = new AnomalyProperties();
        properties.getRetention().setDeleteBatchSize(7);
        properties.getRetention().setAverageRowBytes(200);
        store = new JpaBarStore(jpaRepository, transactionManager, properties, new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("Should insert, update and finalize a bar")
    void testUpsertLifecycle() {
        assertThat(store.upsert(TestBars.open(BTC, Interval.M15, T0, 100.0, 1000.0)))
            .isEqualTo(UpsertResult.INSERTED);
        assertThat(store.upsert(TestBars.open(BTC, Interval.M15, T0, 101.0, 1500.0)))
            .isEqualTo(UpsertResult.UPDATED);
        assertThat(store.upsert(TestBars.closed(BTC, Interval.M15, T0, 102.0, 2000.0)))
            .isEqualTo(UpsertResult.FINALIZED);

        Bar stored = store.find(new BarKey(BTC, Interval.M15, T0)).orElseThrow();
        assertThat(stored.close()).isEqualTo(102.0);
        assertThat(stored.quoteVolume()).isEqualTo(2000.0);
        assertThat(stored.isFinal()).isTrue();
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Final bars are immutable")
    void testFinalBarImmutable() {
        store.upsert(TestBars.closed(BTC, Interval.M15, T0, 100.0, 1000.0));

        assertThat(store.upsert(TestBars.closed(BTC, Interval.M15, T0, 200.0, 9000.0)))
            .isEqualTo(UpsertResult.REJECTED_FINAL);
        assertThat(store.upsert(TestBars.open(BTC, Interval.M15, T0, 300.0, 9000.0)))
            .isEqualTo(UpsertResult.REJECTED_FINAL);

        Bar stored = store.find(new BarKey(BTC, Interval.M15, T0)).orElseThrow();
        assertThat(stored.close()).isEqualTo(100.0);
        assertThat(stored.quoteVolume()).isEqualTo(1000.0);
    }

    @Test
    @DisplayName("A bar first seen closed is reported as newly final")
    void testInsertedFinal() {
        UpsertResult result = store.upsert(TestBars.closed(BTC, Interval.M15, T0, 100.0, 1000.0));

        assertThat(result).isEqualTo(UpsertResult.INSERTED_FINAL);
        assertThat(result.closedBar()).isTrue();
    }

    @Test
    @DisplayName("Backfill never overwrites an existing row")
    void testInsertIfAbsent() {
        store.upsert(TestBars.open(BTC, Interval.M15, T0, 100.0, 1000.0));

        assertThat(store.insertIfAbsent(TestBars.closed(BTC, Interval.M15, T0, 90.0, 500.0)))
            .isEqualTo(UpsertResult.SKIPPED_EXISTING);
        assertThat(store.insertIfAbsent(TestBars.closed(BTC, Interval.M15, T0 + STEP, 90.0, 500.0)))
            .isEqualTo(UpsertResult.INSERTED_FINAL);

        Bar live = store.find(new BarKey(BTC, Interval.M15, T0)).orElseThrow();
        assertThat(live.close()).isEqualTo(100.0);
        assertThat(live.isFinal()).isFalse();
    }

    @Test
    @DisplayName("Concurrent writers on one key leave exactly one row")
    void testConcurrentUpsert() throws Exception {
        int writers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<UpsertResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                double close = 100.0 + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        return store.upsert(TestBars.open(BTC, Interval.M15, T0, close, 1000.0));
                    } catch (StoreWriteFailedException e) {
                        return null;
                    }
                }));
            }
            start.countDown();

            List<UpsertResult> results = new ArrayList<>();
            for (Future<UpsertResult> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            assertThat(results).containsOnlyOnce(UpsertResult.INSERTED);
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.count()).isEqualTo(1);
        assertThat(store.find(new BarKey(BTC, Interval.M15, T0))).isPresent();
    }

    @Test
    @DisplayName("Window queries return closed bars oldest first")
    void testQueryWindow() {
        for (int i = 0; i < 5; i++) {
            store.upsert(TestBars.closed(BTC, Interval.M15, T0 + i * STEP, 100.0 + i, 1000.0));
        }
        store.upsert(TestBars.open(BTC, Interval.M15, T0 + 5 * STEP, 200.0, 1000.0));
        store.upsert(TestBars.closed(ETH, Interval.M15, T0, 3000.0, 1000.0));

        List<Bar> window = store.queryWindow(BTC, Interval.M15, 3);
        assertThat(window).extracting(Bar::close).containsExactly(102.0, 103.0, 104.0);

        List<Bar> before = store.queryWindowBefore(BTC, Interval.M15, T0 + 3 * STEP, 10);
        assertThat(before).extracting(Bar::close).containsExactly(100.0, 101.0, 102.0);

        List<Bar> recent = store.queryRecent(BTC, Interval.M15, 2);
        assertThat(recent).extracting(Bar::close).containsExactly(104.0, 200.0);

        assertThat(store.countClosed(BTC, Interval.M15)).isEqualTo(5);
        assertThat(store.queryWindow(BTC, Interval.M15, 0)).isEmpty();
    }

    @Test
    @DisplayName("Retention by age deletes bars opened before the cutoff")
    void testDeleteOlderThan() {
        // Three hours of 15m bars
        for (int i = 0; i < 12; i++) {
            store.upsert(TestBars.closed(BTC, Interval.M15, T0 + i * STEP, 100.0, 1000.0));
        }
        long now = T0 + 12 * STEP;
        long cutoff = now - Interval.H1.toMillis();

        long deleted = store.deleteOlderThan(cutoff);

        assertThat(deleted).isEqualTo(8);
        assertThat(store.count()).isEqualTo(4);
        assertThat(store.oldestOpenTime()).contains(cutoff);
    }

    @Test
    @DisplayName("Per-series cap keeps the newest bars of each series")
    void testDeleteExcessPerSeries() {
        for (int i = 0; i < 10; i++) {
            store.upsert(TestBars.closed(BTC, Interval.M15, T0 + i * STEP, 100.0 + i, 1000.0));
        }
        for (int i = 0; i < 3; i++) {
            store.upsert(TestBars.closed(ETH, Interval.M15, T0 + i * STEP, 3000.0, 1000.0));
        }

        long deleted = store.deleteExcessPerSeries(4);

        assertThat(deleted).isEqualTo(6);
        assertThat(store.queryRecent(BTC, Interval.M15, 100))
            .extracting(Bar::close).containsExactly(106.0, 107.0, 108.0, 109.0);
        assertThat(store.queryRecent(ETH, Interval.M15, 100)).hasSize(3);
    }

    @Test
    @DisplayName("Global cap evicts the oldest bars first, down to exactly the cap")
    void testDeleteOldestUntilWithinCap() {
        for (int i = 0; i < 20; i++) {
            String instrument = i % 2 == 0 ? BTC : ETH;
            store.upsert(TestBars.closed(instrument, Interval.M15, T0 + i * STEP, 100.0, 1000.0));
        }

        long deleted = store.deleteOldestUntilWithinCap(15, Long.MAX_VALUE);

        assertThat(deleted).isEqualTo(5);
        assertThat(store.count()).isEqualTo(15);
        assertThat(store.oldestOpenTime()).contains(T0 + 5 * STEP);
    }

    @Test
    @DisplayName("Byte cap is converted to rows with the average row size")
    void testByteCap() {
        for (int i = 0; i < 10; i++) {
            store.upsert(TestBars.closed(BTC, Interval.M15, T0 + i * STEP, 100.0, 1000.0));
        }

        long deleted = store.deleteOldestUntilWithinCap(1_000, 6 * 200);

        assertThat(deleted).isEqualTo(4);
        assertThat(store.count()).isEqualTo(6);
        assertThat(store.estimatedSizeBytes()).isEqualTo(6 * 200);
    }

    @Test
    @DisplayName("No eviction when within cap")
    void testWithinCap() {
        store.upsert(TestBars.closed(BTC, Interval.M15, T0, 100.0, 1000.0));

        assertThat(store.deleteOldestUntilWithinCap(10, Long.MAX_VALUE)).isZero();
        assertThat(store.deleteExcessPerSeries(10)).isZero();
        assertThat(store.deleteOlderThan(T0)).isZero();
        assertThat(store.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Empty store reports no oldest bar")
    void testEmptyStore() {
        assertThat(store.count()).isZero();
        assertThat(store.oldestOpenTime()).isEmpty();
        assertThat(store.find(new BarKey(BTC, Interval.M15, T0))).isEmpty();
    }
}
