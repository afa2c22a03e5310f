package com.platform.inventory.api;

import com.platform.inventory.job.JobStatus;
import com.platform.inventory.job.JobStatusTracker;
import com.platform.inventory.job.ReconciliationJobService;
import com.platform.inventory.reconciliation.ReconciliationHistory;
import com.platform.inventory.reconciliation.ReconciliationResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for reconciliation jobs and their history.
 */
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {
    
    private final ReconciliationJobService jobService;
    private final JobStatusTracker jobStatusTracker;
    private final ReconciliationHistory history;
    
    public ReconciliationController(
            ReconciliationJobService jobService,
            JobStatusTracker jobStatusTracker,
            ReconciliationHistory history) {
        this.jobService = jobService;
        this.jobStatusTracker = jobStatusTracker;
        this.history = history;
    }
    
    @PostMapping("/providers/{providerId}/sync")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, String> triggerSync(@PathVariable long providerId) {
        String jobId = jobService.submit(providerId);
        return Map.of("jobId", jobId);
    }
    
    @GetMapping("/jobs/{jobId}")
    public JobStatus getJob(@PathVariable String jobId) {
        return jobStatusTracker.get(jobId);
    }
    
    @PostMapping("/jobs/{jobId}/cancel")
    public Map<String, Object> cancelJob(@PathVariable String jobId) {
        boolean signalled = jobService.cancel(jobId);
        return Map.of("jobId", jobId, "cancelled", signalled);
    }
    
    @GetMapping("/history")
    public List<ReconciliationResult> getHistory(@RequestParam(required = false) Long providerId) {
        if (providerId != null) {
            return history.forProvider(providerId);
        }
        return history.all();
    }
}
