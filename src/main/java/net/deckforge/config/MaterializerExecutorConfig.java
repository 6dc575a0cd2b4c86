package net.deckforge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool used by the asset materializer
 *
 * Features:
 * - Fixed pool sized by {@code deckforge.worker-count}
 * - Unbounded queue so a whole batch can be submitted at once
 * - Waits for in-flight assets on shutdown so no write is cut off mid-rename
 */
@Configuration
public class MaterializerExecutorConfig {

    /**
     * Creates the bounded executor that runs one asset per task.
     *
     * @param properties build configuration carrying the worker count
     * @return Configured AsyncTaskExecutor for asset materialization
     */
    @Bean("assetMaterializerExecutor")
    public AsyncTaskExecutor assetMaterializerExecutor(DeckForgeProperties properties) {
        int workers = Math.max(1, properties.getWorkerCount());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("asset-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
