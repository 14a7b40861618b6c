package com.platform.datakeeper.api;

import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.ValidationException;
import com.platform.datakeeper.job.Job;
import com.platform.datakeeper.job.JobFilter;
import com.platform.datakeeper.job.JobLedger;
import com.platform.datakeeper.job.JobStatus;
import lombok.AllArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only job ledger API for dashboards.
 */
@RestController
@RequestMapping("/api/jobs")
@AllArgsConstructor
public class JobController {
    
    private final JobLedger ledger;
    
    @GetMapping
    public List<Job> list(
            @RequestParam(required = false) String policyId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "100") int limit) {
        return ledger.list(new JobFilter(policyId, parseStatus(status), Math.min(limit, 1000)));
    }
    
    @GetMapping("/{id}")
    public Job get(@PathVariable String id) {
        return ledger.get(id);
    }
    
    private static JobStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return JobStatus.fromDbValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_FIELD_VALUE, "status", status,
                "status must be one of added, scheduled, running, success, failed");
        }
    }
}
