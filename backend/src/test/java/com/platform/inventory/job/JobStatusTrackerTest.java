package com.platform.inventory.job;

import com.platform.inventory.error.ResourceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusTrackerTest {
    
    private final JobStatusTracker tracker = new JobStatusTracker();
    
    @Test
    @DisplayName("Should track progress and completion of a job")
    void shouldTrackLifecycle() {
        tracker.register("j1", 1L);
        
        tracker.reportProgress("j1", 30, "Listing instances");
        assertThat(tracker.get("j1").state()).isEqualTo(JobStatus.State.RUNNING);
        assertThat(tracker.get("j1").progress()).isEqualTo(30);
        assertThat(tracker.get("j1").message()).isEqualTo("Listing instances");
        
        tracker.reportCompletion("j1", true, "all good", null);
        JobStatus status = tracker.get("j1");
        assertThat(status.state()).isEqualTo(JobStatus.State.SUCCEEDED);
        assertThat(status.progress()).isEqualTo(100);
        assertThat(status.summary()).isEqualTo("all good");
        assertThat(status.error()).isNull();
    }
    
    @Test
    @DisplayName("Should record the error of a failed job")
    void shouldRecordFailure() {
        tracker.register("j1", 1L);
        
        tracker.reportCompletion("j1", false, null, new IllegalStateException("provider down"));
        
        assertThat(tracker.get("j1").state()).isEqualTo(JobStatus.State.FAILED);
        assertThat(tracker.get("j1").error()).isEqualTo("provider down");
    }
    
    @Test
    @DisplayName("Should never move progress backwards")
    void shouldKeepProgressMonotonic() {
        tracker.register("j1", 1L);
        tracker.reportProgress("j1", 60, "Found 2 orphaned instances");
        
        tracker.reportProgress("j1", 20, "late report");
        
        assertThat(tracker.get("j1").progress()).isEqualTo(60);
    }
    
    @Test
    @DisplayName("Should ignore reports for unknown jobs")
    void shouldIgnoreUnknownJobs() {
        tracker.reportProgress("nope", 10, "x");
        tracker.reportCompletion("nope", true, "x", null);
        
        assertThatThrownBy(() -> tracker.get("nope")).isInstanceOf(ResourceNotFoundException.class);
    }
    
    @Test
    @DisplayName("Should prune the oldest finished jobs")
    void shouldPruneFinishedJobs() {
        tracker.register("running", 1L);
        for (int i = 0; i < JobStatusTracker.MAX_FINISHED_JOBS + 5; i++) {
            String jobId = "j" + i;
            tracker.register(jobId, 2L);
            tracker.reportCompletion(jobId, true, "done", null);
        }
        
        assertThat(tracker.get("running").state()).isEqualTo(JobStatus.State.QUEUED);
        assertThat(tracker.get("j" + (JobStatusTracker.MAX_FINISHED_JOBS + 4)).isFinished()).isTrue();
        assertThatThrownBy(() -> tracker.get("j0")).isInstanceOf(ResourceNotFoundException.class);
    }
}
