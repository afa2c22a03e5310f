package com.platform.inventory.job;

/**
 * Notified exactly once when a job finishes, whether it succeeded or failed.
 */
public interface CompletionSink {
    
    /**
     * @param summary summary of a successful job, null on failure
     * @param error   cause of a failed job, null on success
     */
    void reportCompletion(String jobId, boolean success, String summary, Throwable error);
}
