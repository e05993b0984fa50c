package com.motif.integration.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor configuration for the parallel branch stage.
 *
 * Branch work is blocking HTTP I/O; the pool bounds how many downstream calls
 * the service keeps in flight at once across all runs.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final PipelineConfig pipelineConfig;

    // ==================== Executor Beans ====================

    /**
     * Executor for secondary-graph and mining branches.
     */
    @Bean(name = "branchExecutor")
    public ThreadPoolTaskExecutor branchExecutor() {
        var branches = pipelineConfig.getBranches();
        log.info("Initializing branch executor: core={}, max={}, queue={}",
                branches.getCoreSize(), branches.getMaxSize(), branches.getQueueCapacity());
        return createPlatformThreadPool("branch-",
                branches.getCoreSize(), branches.getMaxSize(), branches.getQueueCapacity());
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                             int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(Math.max(coreSize, maxSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
