package com.platform.inventory.reconciliation;

import com.platform.inventory.inventory.LocalStateRepository;
import com.platform.inventory.model.LocalInstance;
import com.platform.inventory.model.Provider;
import com.platform.inventory.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Removes orphaned instances one at a time, each in its own short transaction.
 * 
 * Per orphan:
 * 1. Count its port mappings
 * 2. Delete its port mappings (best effort: failure is a warning, cleanup continues)
 * 3. Soft-delete the instance row (failure rolls back this orphan only)
 * 
 * A failed orphan is logged and skipped. Nothing thrown for a single orphan
 * stops the rest of the batch.
 */
@Slf4j
@Component
public class OrphanCleaner {
    
    private final LocalStateRepository localStateRepository;
    private final MetricsRegistry metricsRegistry;
    private final ApplicationEventPublisher eventPublisher;
    
    public OrphanCleaner(
            LocalStateRepository localStateRepository,
            MetricsRegistry metricsRegistry,
            ApplicationEventPublisher eventPublisher) {
        this.localStateRepository = localStateRepository;
        this.metricsRegistry = metricsRegistry;
        this.eventPublisher = eventPublisher;
    }
    
    public CleanupResult clean(Provider provider, List<LocalInstance> orphans, CancellationToken cancellationToken) {
        int processed = 0;
        int cleanedPortMappings = 0;
        int warnings = 0;
        List<String> cleanedNames = new ArrayList<>();
        List<String> failedNames = new ArrayList<>();
        boolean cancelled = false;
        
        for (int i = 0; i < orphans.size(); i++) {
            if (cancellationToken.isCancelled()) {
                log.info("Cleanup cancelled for provider {}, abandoning {} remaining orphans",
                    provider.name(), orphans.size() - i);
                cancelled = true;
                break;
            }
            
            LocalInstance orphan = orphans.get(i);
            MDC.put("instanceId", String.valueOf(orphan.id()));
            try {
                OrphanOutcome outcome = cleanOne(provider, orphan);
                
                processed++;
                cleanedPortMappings += outcome.portMappingsRemoved();
                cleanedNames.add(orphan.name());
                if (outcome.portMappingWarning()) {
                    warnings++;
                }
                metricsRegistry.recordOrphanCleaned(provider.name(), outcome.portMappingsRemoved());
                
                log.info("Cleaned orphaned instance {} ({}), removed {} port mappings",
                    orphan.id(), orphan.name(), outcome.portMappingsRemoved());
            } catch (RuntimeException e) {
                failedNames.add(orphan.name());
                metricsRegistry.recordOrphanCleanupFailure(provider.name());
                log.error("Cleanup transaction for orphaned instance {} ({}) rolled back: {}",
                    orphan.id(), orphan.name(), e.getMessage(), e);
            } finally {
                MDC.remove("instanceId");
            }
        }
        
        return new CleanupResult(processed, processed, cleanedPortMappings,
            cleanedNames, failedNames, warnings, cancelled);
    }
    
    private OrphanOutcome cleanOne(Provider provider, LocalInstance orphan) {
        OrphanOutcome[] outcome = new OrphanOutcome[1];
        
        localStateRepository.inTransaction(tx -> {
            long portCount = tx.countPortMappings(orphan.id());
            int removed = 0;
            boolean warning = false;
            
            try {
                removed = tx.deletePortMappings(orphan.id());
            } catch (RuntimeException e) {
                warning = true;
                onPortMappingFailure(provider, orphan, portCount, e);
            }
            
            tx.softDeleteInstance(orphan);
            outcome[0] = new OrphanOutcome(removed, warning);
        });
        
        return outcome[0];
    }
    
    private void onPortMappingFailure(Provider provider, LocalInstance orphan, long portCount, RuntimeException e) {
        log.warn("Failed to delete {} port mappings of orphaned instance {} ({}), continuing with instance cleanup: {}",
            portCount, orphan.id(), orphan.name(), e.getMessage());
        metricsRegistry.recordPortMappingCleanupWarning(provider.name());
        eventPublisher.publishEvent(new CleanupWarningEvent(
            provider.id(),
            provider.name(),
            orphan.id(),
            orphan.name(),
            portCount,
            e.getMessage(),
            Instant.now()
        ));
    }
    
    private record OrphanOutcome(int portMappingsRemoved, boolean portMappingWarning) {
    }
}
