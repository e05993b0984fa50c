package com.motif.integration.service.api.health;

import com.motif.integration.service.pipeline.PipelineCoordinator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Health indicator for pipeline activity.
 *
 * Reports in-flight runs and branch executor load. Goes DOWN only when the
 * branch queue is full, since new runs would then fail their branch stage.
 */
@Component
public class PipelineActivityHealthIndicator implements HealthIndicator {

    private final PipelineCoordinator coordinator;
    private final ThreadPoolTaskExecutor branchExecutor;

    public PipelineActivityHealthIndicator(PipelineCoordinator coordinator,
                                           @Qualifier("branchExecutor") ThreadPoolTaskExecutor branchExecutor) {
        this.coordinator = coordinator;
        this.branchExecutor = branchExecutor;
    }

    @Override
    public Health health() {
        var queue = branchExecutor.getThreadPoolExecutor().getQueue();
        int queueSize = queue.size();
        int queueCapacity = queueSize + queue.remainingCapacity();
        boolean saturated = queue.remainingCapacity() == 0;

        Health.Builder builder = saturated
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("activeRuns", coordinator.getActiveRunCount())
                .withDetail("activeBranches", branchExecutor.getActiveCount())
                .withDetail("branchPoolSize", branchExecutor.getPoolSize())
                .withDetail("branchQueueSize", queueSize)
                .withDetail("branchQueueCapacity", queueCapacity)
                .build();
    }
}
