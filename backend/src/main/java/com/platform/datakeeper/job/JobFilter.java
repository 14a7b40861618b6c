package com.platform.datakeeper.job;

/**
 * Ledger query. Null fields do not filter.
 */
public record JobFilter(
    String policyId,
    JobStatus status,
    int limit
) {
    
    public static final int DEFAULT_LIMIT = 100;
    
    public JobFilter {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }
    
    public static JobFilter all() {
        return new JobFilter(null, null, DEFAULT_LIMIT);
    }
}
