package com.fintech.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for historical backfill fetches, kept off the feed and consumer threads.
     */
    @Bean(name = "backfillExecutor")
    public ThreadPoolTaskExecutor backfillExecutor(AnomalyProperties properties) {
        AnomalyProperties.Ingestion.Backfill backfill = properties.getIngestion().getBackfill();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(backfill.getThreads());
        executor.setMaxPoolSize(backfill.getThreads());
        executor.setQueueCapacity(backfill.getQueueCapacity());
        executor.setThreadNamePrefix("backfill-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * Runs historical fetches so the backfill thread can enforce a timeout on them.
     */
    @Bean(name = "marketDataExecutor")
    public ThreadPoolTaskExecutor marketDataExecutor(AnomalyProperties properties) {
        int threads = properties.getIngestion().getBackfill().getThreads();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getIngestion().getBackfill().getQueueCapacity());
        executor.setThreadNamePrefix("market-data-");
        executor.initialize();
        return executor;
    }
}
