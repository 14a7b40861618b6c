package com.platform.datakeeper.error;

import com.platform.datakeeper.job.JobStatus;

/**
 * A job status change that is not the immediate successor of the current status,
 * or that lost a race against a concurrent transition. The job is left unchanged.
 */
public class InvalidTransitionException extends DataKeeperException {
    
    private final String jobId;
    private final JobStatus from;
    private final JobStatus to;
    
    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(ErrorCode.INVALID_TRANSITION,
            String.format("Invalid transition for job %s: %s -> %s", jobId, from, to));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }
    
    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to, String reason) {
        super(ErrorCode.INVALID_TRANSITION,
            String.format("Invalid transition for job %s: %s -> %s (%s)", jobId, from, to, reason));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }
    
    public String getJobId() {
        return jobId;
    }
    
    public JobStatus getFrom() {
        return from;
    }
    
    public JobStatus getTo() {
        return to;
    }
}
