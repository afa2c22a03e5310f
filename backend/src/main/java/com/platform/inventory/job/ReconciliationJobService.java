package com.platform.inventory.job;

import com.platform.inventory.error.ReconciliationConflictException;
import com.platform.inventory.error.ResourceNotFoundException;
import com.platform.inventory.provider.ProviderRegistry;
import com.platform.inventory.reconciliation.CancellationToken;
import com.platform.inventory.reconciliation.ReconciliationDriver;
import com.platform.inventory.reconciliation.ReconciliationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Starts reconciliation passes as background jobs.
 * 
 * At most one pass per provider is in flight at a time. Passes for different
 * providers run in parallel on the job executor.
 */
@Slf4j
@Service
public class ReconciliationJobService {
    
    private final ReconciliationDriver driver;
    private final ProviderRegistry providerRegistry;
    private final JobStatusTracker jobStatusTracker;
    private final Executor jobExecutor;
    
    private final Map<Long, RunningJob> inFlight = new ConcurrentHashMap<>();
    
    public ReconciliationJobService(
            ReconciliationDriver driver,
            ProviderRegistry providerRegistry,
            JobStatusTracker jobStatusTracker,
            @Qualifier("reconciliationJobExecutor") Executor jobExecutor) {
        this.driver = driver;
        this.providerRegistry = providerRegistry;
        this.jobStatusTracker = jobStatusTracker;
        this.jobExecutor = jobExecutor;
    }
    
    /**
     * Queue a pass for the provider.
     *
     * @return the new job's id
     * @throws ResourceNotFoundException if the provider is unknown or inactive
     * @throws ReconciliationConflictException if a pass for the provider is already running
     */
    public String submit(long providerId) {
        if (providerRegistry.findActive(providerId).isEmpty()) {
            throw ResourceNotFoundException.provider(providerId);
        }
        
        RunningJob job = claim(providerId);
        if (job == null) {
            RunningJob running = inFlight.get(providerId);
            throw new ReconciliationConflictException(providerId, running != null ? running.jobId() : "unknown");
        }
        
        jobStatusTracker.register(job.jobId(), providerId);
        try {
            jobExecutor.execute(() -> run(providerId, job));
        } catch (TaskRejectedException e) {
            inFlight.remove(providerId, job);
            jobStatusTracker.reportCompletion(job.jobId(), false, null, e);
            throw e;
        }
        
        log.info("Submitted reconciliation job {} for provider {}", job.jobId(), providerId);
        return job.jobId();
    }
    
    /**
     * Run a pass on the calling thread unless one is already in flight.
     * Used by the scheduler, which must not queue behind a manual run.
     */
    public Optional<ReconciliationResult> runIfIdle(long providerId) {
        RunningJob job = claim(providerId);
        if (job == null) {
            log.debug("Skipping scheduled reconciliation of provider {}: pass already in flight", providerId);
            return Optional.empty();
        }
        
        jobStatusTracker.register(job.jobId(), providerId);
        return Optional.of(execute(providerId, job));
    }
    
    /**
     * Request cooperative cancellation of a running job.
     *
     * @return true if the job was in flight and has been signalled
     */
    public boolean cancel(String jobId) {
        JobStatus status = jobStatusTracker.get(jobId);
        
        RunningJob job = inFlight.get(status.providerId());
        if (job == null || !job.jobId().equals(jobId)) {
            log.debug("Cancel requested for job {} which is not running", jobId);
            return false;
        }
        
        job.token().cancel();
        jobStatusTracker.markCancelRequested(jobId);
        log.info("Cancellation requested for job {} (provider {})", jobId, status.providerId());
        return true;
    }
    
    public boolean isRunning(long providerId) {
        return inFlight.containsKey(providerId);
    }
    
    private RunningJob claim(long providerId) {
        RunningJob candidate = new RunningJob(UUID.randomUUID().toString(), new CancellationToken());
        RunningJob existing = inFlight.putIfAbsent(providerId, candidate);
        return existing == null ? candidate : null;
    }
    
    private void run(long providerId, RunningJob job) {
        try {
            execute(providerId, job);
        } catch (RuntimeException e) {
            // Already logged and reported to the completion sink by the driver
            log.debug("Job {} ended with {}", job.jobId(), e.getClass().getSimpleName());
        }
    }
    
    private ReconciliationResult execute(long providerId, RunningJob job) {
        try {
            return driver.reconcile(job.jobId(), providerId, job.token());
        } finally {
            inFlight.remove(providerId, job);
        }
    }
    
    private record RunningJob(String jobId, CancellationToken token) {
    }
}
