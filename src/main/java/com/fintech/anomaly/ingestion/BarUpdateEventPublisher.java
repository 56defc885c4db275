package com.fintech.anomaly.ingestion;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.BarUpdate;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

/**
 * Bounded hand-off between feed callback threads and the bar store, built on an
 * LMAX Disruptor ring buffer.
 *
 * Consumers are sharded by instrument: every handler sees every sequence but applies only
 * the updates of its own shard, so updates of one instrument are applied in delivery order
 * by a single thread while different instruments proceed in parallel.
 *
 * A full ring buffer blocks the publisher for at most {@code publishTimeoutMs}, then the
 * update is dropped and counted.
 */
@Component
public class BarUpdateEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(BarUpdateEventPublisher.class);

    private static final long PARK_NANOS = TimeUnit.MICROSECONDS.toNanos(50);

    private final BarIngestionService ingestionService;
    private final AnomalyProperties.Ingestion.DisruptorConfig config;

    private final AtomicLong eventsPublished = new AtomicLong(0);
    private final AtomicLong ringBufferEventsDropped = new AtomicLong(0);

    private volatile boolean running;
    private Disruptor<BarUpdateEvent> disruptor;
    private RingBuffer<BarUpdateEvent> ringBuffer;
    private int shards;

    public BarUpdateEventPublisher(
            BarIngestionService ingestionService,
            AnomalyProperties properties,
            MeterRegistry meterRegistry) {
        this.ingestionService = ingestionService;
        this.config = properties.getIngestion().getDisruptor();

        meterRegistry.gauge("disruptor.ringbuffer.events.published", eventsPublished);
        meterRegistry.gauge("disruptor.ringbuffer.events.dropped", ringBufferEventsDropped);
    }

    @PostConstruct
    public void start() {
        int bufferSize = config.getBufferSize();
        shards = Math.max(1, config.getNumConsumers());

        EventFactory<BarUpdateEvent> eventFactory = BarUpdateEvent::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("bar-update-consumer-" + counter.incrementAndGet());
                thread.setDaemon(false);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy();

        disruptor = new Disruptor<>(
            eventFactory,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,
            waitStrategy
        );

        @SuppressWarnings("unchecked")
        EventHandler<BarUpdateEvent>[] handlers = new EventHandler[shards];
        for (int i = 0; i < shards; i++) {
            final int shard = i;
            handlers[i] = (event, sequence, endOfBatch) -> {
                if (event.shard != shard) {
                    return;
                }
                BarUpdate update = event.update;
                event.update = null;
                if (update != null) {
                    ingestionService.apply(update);
                    if (endOfBatch && log.isTraceEnabled()) {
                        log.trace("Shard {} processed update at sequence {}, end of batch", shard, sequence);
                    }
                }
            };
        }
        disruptor.handleEventsWith(handlers);

        // Log and continue: one bad update must not stop the consumer
        disruptor.setDefaultExceptionHandler(new ExceptionHandler<BarUpdateEvent>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, BarUpdateEvent event) {
                log.error("Exception processing bar update at sequence {}", sequence, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during Disruptor startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during Disruptor shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();
        running = true;

        log.info("Disruptor started: bufferSize={}, shards={}, waitStrategy={}",
            bufferSize, shards, waitStrategy.getClass().getSimpleName());
    }

    /**
     * Publishes an update, waiting at most the configured publish timeout for capacity.
     *
     * @return true if published, false if dropped (buffer full or publisher stopped)
     */
    public boolean publish(BarUpdate update) {
        if (!running) {
            ringBufferEventsDropped.incrementAndGet();
            return false;
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getPublishTimeoutMs());
        while (true) {
            try {
                long sequence = ringBuffer.tryNext();
                try {
                    BarUpdateEvent event = ringBuffer.get(sequence);
                    event.update = update;
                    event.shard = shardOf(update.instrument(), shards);
                } finally {
                    ringBuffer.publish(sequence);
                }
                eventsPublished.incrementAndGet();
                return true;

            } catch (InsufficientCapacityException e) {
                if (System.nanoTime() >= deadline) {
                    long dropped = ringBufferEventsDropped.incrementAndGet();
                    if (dropped == 1 || dropped % 1000 == 0) {
                        log.warn("Ring buffer full, dropping bar update: instrument={}, totalDropped={}",
                            update.instrument(), dropped);
                    }
                    return false;
                }
                LockSupport.parkNanos(PARK_NANOS);
            }
        }
    }

    /**
     * Shard of an instrument. Stable for the lifetime of the process.
     */
    static int shardOf(String instrument, int shards) {
        if (instrument == null) {
            return 0;
        }
        return Math.floorMod(instrument.toUpperCase(Locale.ROOT).hashCode(), shards);
    }

    /**
     * Stops accepting updates and drains the ring buffer, waiting at most the configured
     * shutdown timeout for in-flight writes.
     */
    @PreDestroy
    public void shutdown() {
        if (disruptor == null || !running) {
            return;
        }
        running = false;
        log.info("Shutting down Disruptor...");
        try {
            disruptor.shutdown(config.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS);
            log.info("Disruptor shutdown complete");
        } catch (TimeoutException e) {
            log.warn("Disruptor did not drain within {}ms, halting", config.getShutdownTimeoutMs());
            disruptor.halt();
        }
    }

    private WaitStrategy createWaitStrategy() {
        String strategy = config.getWaitStrategy();

        return switch (strategy.toUpperCase(Locale.ROOT)) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * Ring buffer slot. Pre-allocated; {@code update} is cleared by the owning shard.
     */
    private static class BarUpdateEvent {
        volatile BarUpdate update;
        volatile int shard;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public long getEventsPublished() {
        return eventsPublished.get();
    }

    public long getRingBufferEventsDropped() {
        return ringBufferEventsDropped.get();
    }
}
