package com.fintech.anomaly.ingestion;

import com.fintech.anomaly.TestBars;
import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.BarUpdate;
import com.fintech.anomaly.domain.Interval;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * Tests for {@link BarUpdateEventPublisher} with a running Disruptor.
 */
@DisplayName("BarUpdateEventPublisher Tests")
class BarUpdateEventPublisherTest {

    private static final List<String> INSTRUMENTS = List.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "XRPUSDT", "DOGEUSDT");
    private static final int UPDATES_PER_INSTRUMENT = 500;

    private BarIngestionService ingestionService;
    private Map<String, List<Double>> applied;
    private CountDownLatch latch;
    private BarUpdateEventPublisher publisher;

    @BeforeEach
    void setUp() {
        ingestionService = mock(BarIngestionService.class);
        applied = new ConcurrentHashMap<>();
        latch = new CountDownLatch(INSTRUMENTS.size() * UPDATES_PER_INSTRUMENT);

        doAnswer(inv -> {
            BarUpdate update = inv.getArgument(0);
            // Only the owning shard thread appends to an instrument's list
            applied.computeIfAbsent(update.instrument(), k -> new ArrayList<>()).add(update.close());
            latch.countDown();
            return Optional.empty();
        }).when(ingestionService).apply(any(BarUpdate.class));

        AnomalyProperties properties = new AnomalyProperties();
        properties.getIngestion().getDisruptor().setBufferSize(1024);
        properties.getIngestion().getDisruptor().setNumConsumers(3);
        properties.getIngestion().getDisruptor().setPublishTimeoutMs(5_000);

        publisher = new BarUpdateEventPublisher(ingestionService, properties, new SimpleMeterRegistry());
        publisher.start();
    }

    @AfterEach
    void tearDown() {
        publisher.shutdown();
    }

    @Test
    @DisplayName("Updates of one instrument are applied in delivery order")
    void testPerInstrumentOrdering() throws Exception {
        List<Thread> producers = new ArrayList<>();
        for (String instrument : INSTRUMENTS) {
            Thread producer = new Thread(() -> {
                for (int i = 0; i < UPDATES_PER_INSTRUMENT; i++) {
                    publisher.publish(TestBars.update(instrument, Interval.M15, TestBars.BASE_TIME, 1.0 + i, false));
                }
            });
            producers.add(producer);
            producer.start();
        }
        for (Thread producer : producers) {
            producer.join();
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        for (String instrument : INSTRUMENTS) {
            List<Double> closes = applied.get(instrument);
            assertThat(closes).hasSize(UPDATES_PER_INSTRUMENT);
            for (int i = 0; i < UPDATES_PER_INSTRUMENT; i++) {
                assertThat(closes.get(i)).isEqualTo(1.0 + i);
            }
        }
        assertThat(publisher.getEventsPublished()).isEqualTo((long) INSTRUMENTS.size() * UPDATES_PER_INSTRUMENT);
        assertThat(publisher.getRingBufferEventsDropped()).isZero();
    }

    @Test
    @DisplayName("A failing update does not stop the consumer")
    void testConsumerSurvivesFailure() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        doAnswer(inv -> {
            BarUpdate update = inv.getArgument(0);
            if (update.close() == 1.0) {
                throw new IllegalStateException("boom");
            }
            done.countDown();
            return Optional.empty();
        }).when(ingestionService).apply(any(BarUpdate.class));

        publisher.publish(TestBars.update("BTCUSDT", Interval.M15, TestBars.BASE_TIME, 1.0, false));
        publisher.publish(TestBars.update("BTCUSDT", Interval.M15, TestBars.BASE_TIME, 2.0, false));

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Publishing after shutdown drops the update")
    void testPublishAfterShutdown() {
        publisher.shutdown();

        boolean published = publisher.publish(TestBars.update("BTCUSDT", Interval.M15, TestBars.BASE_TIME, 1.0, false));

        assertThat(published).isFalse();
        assertThat(publisher.getRingBufferEventsDropped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Shard assignment is stable and case-insensitive")
    void testShardOf() {
        int shard = BarUpdateEventPublisher.shardOf("BTCUSDT", 4);

        assertThat(shard).isBetween(0, 3);
        assertThat(BarUpdateEventPublisher.shardOf("btcusdt", 4)).isEqualTo(shard);
        assertThat(BarUpdateEventPublisher.shardOf("BTCUSDT", 4)).isEqualTo(shard);
        assertThat(BarUpdateEventPublisher.shardOf(null, 4)).isZero();
        assertThat(BarUpdateEventPublisher.shardOf("BTCUSDT", 1)).isZero();
    }
}
