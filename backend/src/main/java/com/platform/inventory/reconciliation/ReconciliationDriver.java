package com.platform.inventory.reconciliation;

import com.platform.inventory.error.QueryException;
import com.platform.inventory.error.ResourceNotFoundException;
import com.platform.inventory.inventory.LocalStateRepository;
import com.platform.inventory.job.CompletionSink;
import com.platform.inventory.job.ProgressSink;
import com.platform.inventory.model.LocalInstance;
import com.platform.inventory.model.Provider;
import com.platform.inventory.model.RemoteInstance;
import com.platform.inventory.observability.MetricsRegistry;
import com.platform.inventory.provider.ProviderRegistry;
import com.platform.inventory.provider.RemoteStateLister;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one reconciliation pass for one provider.
 * 
 * Flow: load provider -> check connection -> list remote and local state (concurrently)
 * -> detect orphans -> clean them up -> summarize.
 * 
 * Connectivity and query failures fail the whole pass before anything is cleaned.
 * Per-orphan failures never do. Cancellation stops the pass early and keeps whatever
 * was already committed.
 * 
 * Passes for the same provider must not overlap; callers serialize them.
 */
@Slf4j
@Service
public class ReconciliationDriver {
    
    private final ProviderRegistry providerRegistry;
    private final RemoteStateLister remoteStateLister;
    private final LocalStateRepository localStateRepository;
    private final DriftDetector driftDetector;
    private final OrphanCleaner orphanCleaner;
    private final ProgressSink progressSink;
    private final CompletionSink completionSink;
    private final ReconciliationHistory history;
    private final MetricsRegistry metricsRegistry;
    private final Tracer tracer;
    private final Executor queryExecutor;
    
    public ReconciliationDriver(
            ProviderRegistry providerRegistry,
            RemoteStateLister remoteStateLister,
            LocalStateRepository localStateRepository,
            DriftDetector driftDetector,
            OrphanCleaner orphanCleaner,
            ProgressSink progressSink,
            CompletionSink completionSink,
            ReconciliationHistory history,
            MetricsRegistry metricsRegistry,
            Tracer tracer,
            @Qualifier("inventoryQueryExecutor") Executor queryExecutor) {
        this.providerRegistry = providerRegistry;
        this.remoteStateLister = remoteStateLister;
        this.localStateRepository = localStateRepository;
        this.driftDetector = driftDetector;
        this.orphanCleaner = orphanCleaner;
        this.progressSink = progressSink;
        this.completionSink = completionSink;
        this.history = history;
        this.metricsRegistry = metricsRegistry;
        this.tracer = tracer;
        this.queryExecutor = queryExecutor;
    }
    
    /**
     * Reconcile the provider's local inventory against what the provider reports.
     *
     * @throws ResourceNotFoundException if the provider does not exist or is not active
     * @throws com.platform.inventory.error.ConnectivityException if the provider cannot be reached
     * @throws QueryException if the local inventory cannot be read
     */
    public ReconciliationResult reconcile(String jobId, long providerId, CancellationToken cancellationToken) {
        Instant startedAt = Instant.now();
        String providerName = String.valueOf(providerId);
        
        Span span = tracer.spanBuilder("inventory.reconcile")
            .setAttribute("job.id", jobId)
            .setAttribute("provider.id", providerId)
            .startSpan();
        MDC.put("jobId", jobId);
        MDC.put("providerId", String.valueOf(providerId));
        
        try (Scope ignored = span.makeCurrent()) {
            progressSink.reportProgress(jobId, 5, "Starting reconciliation");
            
            progressSink.reportProgress(jobId, 10, "Loading provider");
            Provider provider = providerRegistry.findActive(providerId)
                .orElseThrow(() -> ResourceNotFoundException.provider(providerId));
            providerName = provider.name();
            
            log.info("Starting reconciliation of provider {} ({})", provider.name(), provider.id());
            
            ReconciliationResult result = run(jobId, provider, cancellationToken, startedAt);
            
            span.setAttribute("inventory.checked", result.checkedCount());
            span.setAttribute("inventory.orphans", result.orphanCount());
            span.setAttribute("inventory.cleaned", result.cleanedInstanceCount());
            
            history.record(result);
            metricsRegistry.recordReconciliationPass(provider.name(),
                result.outcome().name().toLowerCase(), result.durationMs());
            completionSink.reportCompletion(jobId, true, result.summary(), null);
            
            log.info("Reconciliation of provider {} finished: checked={}, orphans={}, cleanedInstances={}, cleanedPortMappings={}, outcome={}",
                provider.name(), result.checkedCount(), result.orphanCount(),
                result.cleanedInstanceCount(), result.cleanedPortMappingCount(), result.outcome());
            return result;
            
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.error("Reconciliation of provider {} failed: {}", providerName, e.getMessage(), e);
            
            ReconciliationResult failed = ReconciliationResult.failed(
                jobId, providerId, providerName, e.getMessage(), startedAt);
            history.record(failed);
            metricsRegistry.recordReconciliationPass(providerName, "failed", failed.durationMs());
            completionSink.reportCompletion(jobId, false, null, e);
            throw e;
        } finally {
            span.end();
            MDC.remove("jobId");
            MDC.remove("providerId");
        }
    }
    
    private ReconciliationResult run(String jobId, Provider provider, CancellationToken cancellationToken, Instant startedAt) {
        progressSink.reportProgress(jobId, 20, "Checking connection to provider " + provider.name());
        remoteStateLister.checkConnection(provider);
        
        progressSink.reportProgress(jobId, 30, "Listing instances of provider " + provider.name());
        CompletableFuture<List<LocalInstance>> localFuture = CompletableFuture.supplyAsync(
            () -> localStateRepository.findNonTerminalInstances(provider.id()), queryExecutor);
        
        List<RemoteInstance> remoteInstances;
        try {
            remoteInstances = remoteStateLister.listInstances(provider, cancellationToken);
        } catch (CancellationException e) {
            log.info("Reconciliation of provider {} cancelled before listing", provider.name());
            return cancelledBeforeCleanup(jobId, provider, startedAt);
        }
        List<LocalInstance> localInstances = awaitLocal(localFuture, provider);
        
        log.debug("Provider {}: {} remote instances, {} local instances",
            provider.name(), remoteInstances.size(), localInstances.size());
        
        DriftReport drift = driftDetector.detect(remoteInstances, localInstances);
        if (!drift.duplicateRemoteNames().isEmpty()) {
            log.warn("Provider {} reported duplicate instance names {}; matching by name cannot tell them apart",
                provider.name(), drift.duplicateRemoteNames());
            metricsRegistry.recordDuplicateRemoteNames(provider.name(), drift.duplicateRemoteNames().size());
        }
        
        int orphanCount = drift.orphans().size();
        metricsRegistry.recordOrphansDetected(provider.name(), orphanCount);
        progressSink.reportProgress(jobId, 60, String.format("Found %d orphaned instances", orphanCount));
        
        CleanupResult cleanup = CleanupResult.empty();
        if (drift.hasOrphans()) {
            log.info("Provider {} has {} orphaned instances", provider.name(), orphanCount);
            cleanup = orphanCleaner.clean(provider, drift.orphans(), cancellationToken);
        } else {
            log.debug("Provider {} has no orphaned instances", provider.name());
        }
        
        progressSink.reportProgress(jobId, 90, "Cleanup finished, building report");
        
        ReconciliationResult.Outcome outcome = cleanup.cancelled()
            ? ReconciliationResult.Outcome.CANCELLED
            : ReconciliationResult.Outcome.COMPLETED;
        
        return new ReconciliationResult(
            jobId,
            provider.id(),
            provider.name(),
            outcome,
            drift.checkedCount(),
            orphanCount,
            cleanup.processedCount(),
            cleanup.cleanedInstances(),
            cleanup.cleanedPortMappings(),
            cleanup.cleanedInstanceNames(),
            cleanup.failedInstanceNames(),
            drift.duplicateRemoteNames(),
            buildSummary(provider, drift, cleanup),
            null,
            startedAt,
            Instant.now()
        );
    }
    
    private List<LocalInstance> awaitLocal(CompletableFuture<List<LocalInstance>> localFuture, Provider provider) {
        try {
            return localFuture.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new QueryException("Failed to query instances for provider " + provider.name(), e.getCause());
        }
    }
    
    private ReconciliationResult cancelledBeforeCleanup(String jobId, Provider provider, Instant startedAt) {
        return new ReconciliationResult(
            jobId,
            provider.id(),
            provider.name(),
            ReconciliationResult.Outcome.CANCELLED,
            0, 0, 0, 0, 0,
            List.of(), List.of(), List.of(),
            String.format("Provider %s: reconciliation cancelled before any instance was checked.", provider.name()),
            null,
            startedAt,
            Instant.now()
        );
    }
    
    static String buildSummary(Provider provider, DriftReport drift, CleanupResult cleanup) {
        StringBuilder summary = new StringBuilder();
        summary.append(String.format("Provider %s: checked %d instances", provider.name(), drift.checkedCount()));
        
        if (!drift.hasOrphans()) {
            summary.append(", no orphaned instances found.");
            return summary.toString();
        }
        
        if (cleanup.cancelled()) {
            summary.append(String.format(", found %d orphaned instances; stopped early after cleaning %d instances and %d port mappings.",
                drift.orphans().size(), cleanup.cleanedInstances(), cleanup.cleanedPortMappings()));
        } else {
            summary.append(String.format(", found %d orphaned instances, cleaned %d instances and %d port mappings.",
                drift.orphans().size(), cleanup.cleanedInstances(), cleanup.cleanedPortMappings()));
        }
        
        if (!cleanup.cleanedInstanceNames().isEmpty()) {
            summary.append(" Cleaned instances: ").append(String.join(", ", cleanup.cleanedInstanceNames())).append('.');
        }
        if (!cleanup.failedInstanceNames().isEmpty()) {
            summary.append(" Failed to clean: ").append(String.join(", ", cleanup.failedInstanceNames())).append('.');
        }
        if (cleanup.warningCount() > 0) {
            summary.append(String.format(" Port mappings of %d instances could not be removed.", cleanup.warningCount()));
        }
        return summary.toString();
    }
}
