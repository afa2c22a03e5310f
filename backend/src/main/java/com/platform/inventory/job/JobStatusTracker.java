package com.platform.inventory.job;

import com.platform.inventory.error.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory job status store. Receives progress and completion reports from
 * reconciliation passes and serves them to API callers.
 * 
 * Finished jobs beyond {@link #MAX_FINISHED_JOBS} are pruned oldest first.
 */
@Slf4j
@Component
public class JobStatusTracker implements ProgressSink, CompletionSink {
    
    static final int MAX_FINISHED_JOBS = 200;
    
    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();
    private final Queue<String> finishedOrder = new ConcurrentLinkedQueue<>();
    
    public JobStatus register(String jobId, long providerId) {
        JobStatus status = JobStatus.queued(jobId, providerId);
        jobs.put(jobId, status);
        return status;
    }
    
    public JobStatus get(String jobId) {
        JobStatus status = jobs.get(jobId);
        if (status == null) {
            throw ResourceNotFoundException.job(jobId);
        }
        return status;
    }
    
    void markCancelRequested(String jobId) {
        jobs.computeIfPresent(jobId, (id, status) -> status.withCancelRequested());
    }
    
    @Override
    public void reportProgress(String jobId, int percent, String message) {
        jobs.computeIfPresent(jobId, (id, status) -> status.withProgress(percent, message));
        log.debug("Job {} at {}%: {}", jobId, percent, message);
    }
    
    @Override
    public void reportCompletion(String jobId, boolean success, String summary, Throwable error) {
        String errorMessage = error != null ? error.getMessage() : null;
        JobStatus updated = jobs.computeIfPresent(jobId,
            (id, status) -> status.withCompletion(success, summary, errorMessage));
        
        if (updated == null) {
            log.warn("Completion reported for unknown job {}", jobId);
            return;
        }
        log.info("Job {} finished: success={}", jobId, success);
        finishedOrder.add(jobId);
        prune();
    }
    
    private void prune() {
        while (finishedOrder.size() > MAX_FINISHED_JOBS) {
            String oldest = finishedOrder.poll();
            if (oldest == null) {
                return;
            }
            jobs.remove(oldest);
        }
    }
}
