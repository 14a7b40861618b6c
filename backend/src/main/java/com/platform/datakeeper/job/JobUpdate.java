package com.platform.datakeeper.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.datakeeper.action.Outcome;

import java.time.Instant;

/**
 * {@code job_update} event published on every ledger change.
 *
 * @param outcome present on success transitions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobUpdate(
    String id,
    String policyId,
    String operation,
    String status,
    Instant lastRunTime,
    String lastError,
    Outcome outcome
) {
    
    public static JobUpdate of(Job job, Outcome outcome) {
        return new JobUpdate(
            job.getId(),
            job.getPolicyId(),
            job.getOperation(),
            job.getStatus().dbValue(),
            job.getLastRunTime(),
            job.getLastError(),
            outcome);
    }
}
