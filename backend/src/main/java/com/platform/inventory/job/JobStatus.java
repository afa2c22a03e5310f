package com.platform.inventory.job;

import java.time.Instant;

/**
 * Snapshot of a reconciliation job as seen by API callers.
 */
public record JobStatus(
    String jobId,
    long providerId,
    State state,
    int progress,
    String message,
    String summary,
    String error,
    boolean cancelRequested,
    Instant createdAt,
    Instant updatedAt
) {
    
    public enum State {
        QUEUED,
        RUNNING,
        SUCCEEDED,
        FAILED
    }
    
    public static JobStatus queued(String jobId, long providerId) {
        Instant now = Instant.now();
        return new JobStatus(jobId, providerId, State.QUEUED, 0, "Queued", null, null, false, now, now);
    }
    
    public boolean isFinished() {
        return state == State.SUCCEEDED || state == State.FAILED;
    }
    
    JobStatus withProgress(int percent, String newMessage) {
        return new JobStatus(jobId, providerId, State.RUNNING, Math.max(progress, percent), newMessage,
            summary, error, cancelRequested, createdAt, Instant.now());
    }
    
    JobStatus withCompletion(boolean success, String newSummary, String newError) {
        return new JobStatus(jobId, providerId, success ? State.SUCCEEDED : State.FAILED, 100,
            success ? "Completed" : "Failed", newSummary, newError, cancelRequested, createdAt, Instant.now());
    }
    
    JobStatus withCancelRequested() {
        return new JobStatus(jobId, providerId, state, progress, message,
            summary, error, true, createdAt, Instant.now());
    }
}
