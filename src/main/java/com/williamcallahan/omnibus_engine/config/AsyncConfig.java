/**
 * Thread pools for omnibus work
 *
 * @author William Callahan
 *
 * Features:
 * - Dedicated bounded pool for slicing works out of omnibus files
 * - Pool size follows configuration or the number of available processors
 * - Descriptive thread naming for easier debugging
 * - Fallback to caller thread when saturated (CallerRunsPolicy)
 */

package com.williamcallahan.omnibus_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Executor running archive slicing off the request thread
     *
     * @param properties omnibus configuration, {@code app.omnibus.extraction.pool-size} sets the pool size
     * @return Configured AsyncTaskExecutor for extraction tasks
     */
    @Bean("omnibusExtractionExecutor")
    public AsyncTaskExecutor omnibusExtractionExecutor(OmnibusConfigurationProperties properties) {
        int configured = properties.getExtraction().getPoolSize();
        int processors = Runtime.getRuntime().availableProcessors();
        int poolSize = configured > 0 ? configured : Math.max(2, processors);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100); // Slicing is I/O and CPU bound, keep the backlog short
        executor.setThreadNamePrefix("omnibus-extract-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        logger.info("Omnibus extraction executor started with {} threads", poolSize);
        return executor;
    }
}
