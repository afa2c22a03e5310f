package com.platform.inventory.job;

/**
 * Receives coarse progress milestones of a running job.
 * Purely observational: nothing reported here affects the job.
 */
public interface ProgressSink {
    
    void reportProgress(String jobId, int percent, String message);
}
