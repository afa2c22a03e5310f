package com.platform.inventory.reconciliation;

import com.platform.inventory.job.ReconciliationJobService;
import com.platform.inventory.model.Provider;
import com.platform.inventory.observability.MetricsRegistry;
import com.platform.inventory.provider.ProviderRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically reconciles every active provider.
 * 
 * Providers are processed one after another. A provider whose pass is already
 * in flight (for example a manual run) is skipped for this cycle. A failing
 * provider never stops the cycle.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "inventory.reconciliation.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationScheduler {
    
    private final ProviderRegistry providerRegistry;
    private final ReconciliationJobService jobService;
    private final MetricsRegistry metricsRegistry;
    
    public ReconciliationScheduler(
            ProviderRegistry providerRegistry,
            ReconciliationJobService jobService,
            MetricsRegistry metricsRegistry) {
        this.providerRegistry = providerRegistry;
        this.jobService = jobService;
        this.metricsRegistry = metricsRegistry;
    }
    
    @PostConstruct
    public void init() {
        log.info("Reconciliation scheduler initialized");
    }
    
    @Scheduled(
        fixedDelayString = "${inventory.reconciliation.scheduler.interval-ms:300000}",
        initialDelayString = "${inventory.reconciliation.scheduler.initial-delay-ms:60000}")
    public void reconcileAll() {
        long cycleId = System.currentTimeMillis();
        MDC.put("reconciliationCycleId", String.valueOf(cycleId));
        
        try {
            List<Provider> providers = providerRegistry.listActive();
            log.debug("Starting reconciliation cycle over {} providers", providers.size());
            
            int failures = 0;
            for (Provider provider : providers) {
                try {
                    jobService.runIfIdle(provider.id());
                } catch (RuntimeException e) {
                    failures++;
                    metricsRegistry.incrementCounter("inventory.scheduler.error", "provider", provider.name());
                    log.warn("Scheduled reconciliation of provider {} failed: {}", provider.name(), e.getMessage());
                }
            }
            
            if (failures > 0) {
                log.info("Reconciliation cycle complete: providers={}, failures={}", providers.size(), failures);
            }
        } catch (RuntimeException e) {
            log.error("Reconciliation cycle aborted: {}", e.getMessage(), e);
        } finally {
            MDC.remove("reconciliationCycleId");
        }
    }
}
