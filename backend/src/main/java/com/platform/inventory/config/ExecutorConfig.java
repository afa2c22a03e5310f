package com.platform.inventory.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for reconciliation work.
 */
@Configuration
public class ExecutorConfig {
    
    /**
     * Runs whole reconciliation passes. One pass per provider at a time,
     * passes for different providers in parallel.
     */
    @Bean
    public ThreadPoolTaskExecutor reconciliationJobExecutor(
            @Value("${inventory.reconciliation.executor.job-pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("reconcile-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
    
    /**
     * Runs local inventory queries alongside the remote listing call.
     */
    @Bean
    public ThreadPoolTaskExecutor inventoryQueryExecutor(
            @Value("${inventory.reconciliation.executor.query-pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("inventory-query-");
        executor.initialize();
        return executor;
    }
}
