package com.williamcallahan.flowindex.config;

import com.williamcallahan.flowindex.service.ContentHasher;
import com.williamcallahan.flowindex.service.ImageDescriptionCache;
import com.williamcallahan.flowindex.service.ProcessingTracker;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared ingestion state and the bounded worker pool that runs ingestion jobs.
 */
@Configuration
@EnableScheduling
public class IngestionInfrastructureConfig {

    private static final String WORKER_THREAD_PREFIX = "ingest-";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ImageDescriptionCache imageDescriptionCache(ContentHasher hasher, AppProperties appProperties) {
        return new ImageDescriptionCache(hasher, appProperties.getIngestion().getImageCacheCapacity());
    }

    @Bean
    public ProcessingTracker processingTracker(Clock clock) {
        return new ProcessingTracker(clock);
    }

    /**
     * Fixed-size pool; submissions beyond the queue capacity are rejected rather than run on
     * the caller thread.
     */
    @Bean(name = "ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor(AppProperties appProperties) {
        IngestionProperties ingestion = appProperties.getIngestion();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(ingestion.getWorkerThreads());
        executor.setMaxPoolSize(ingestion.getWorkerThreads());
        executor.setQueueCapacity(ingestion.getQueueCapacity());
        executor.setThreadNamePrefix(WORKER_THREAD_PREFIX);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
