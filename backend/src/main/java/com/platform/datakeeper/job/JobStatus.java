package com.platform.datakeeper.job;

import java.util.Locale;

/**
 * Job lifecycle: {@code added -> scheduled -> running -> success | failed}.
 * No stage is skipped and nothing moves backward.
 */
public enum JobStatus {
    ADDED,
    SCHEDULED,
    RUNNING,
    SUCCESS,
    FAILED;
    
    /**
     * Whether {@code next} is an immediate successor of this status.
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case ADDED -> next == SCHEDULED;
            case SCHEDULED -> next == RUNNING;
            case RUNNING -> next == SUCCESS || next == FAILED;
            case SUCCESS, FAILED -> false;
        };
    }
    
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
    
    /**
     * Not yet terminal; a trigger with such a job is still busy.
     */
    public boolean isInFlight() {
        return !isTerminal();
    }
    
    /**
     * Value stored in the {@code job.status} column.
     */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    public static JobStatus fromDbValue(String value) {
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
