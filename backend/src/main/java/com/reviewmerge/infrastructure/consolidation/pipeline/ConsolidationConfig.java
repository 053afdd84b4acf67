package com.reviewmerge.infrastructure.consolidation.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class ConsolidationConfig {

    @Value("${consolidation.parallel:true}")
    private boolean parallel;

    @Value("${consolidation.executor.threads:4}")
    private int threads;

    /**
     * Worker pool for the independent merge stages. With parallel disabled a single worker runs
     * the stages one at a time.
     * <p>
     * This is the application's only {@code Executor} bean, so Boot's {@code applicationTaskExecutor}
     * is not created. Nothing here uses {@code @Async}.
     */
    @Bean(name = "consolidationExecutor", destroyMethod = "shutdown")
    public ExecutorService consolidationExecutor() {
        if (!parallel) {
            log.info("[Consolidation] Parallel stages disabled, using a single worker");
            return Executors.newSingleThreadExecutor();
        }
        log.info("[Consolidation] Stage pool with {} threads", threads);
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    public Clock consolidationClock() {
        return Clock.systemUTC();
    }
}
