package com.platform.datakeeper.job;

import com.platform.datakeeper.policy.ActionSpec;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One durable unit of work: one action of one policy against one data unit.
 * Only {@link JobLedger} creates or changes jobs.
 */
@Value
@Builder(toBuilder = true)
public class Job {
    
    String id;
    String policyId;
    String name;
    
    /**
     * Action kind, resolved against the plugin registry.
     */
    String operation;
    
    String filetypes;
    String triggerType;
    TriggerSnapshot triggerSpec;
    
    /**
     * Policy id plus trigger index; at most one job per key is in flight.
     */
    String triggerKey;
    
    String unitPath;
    ActionSpec actionSpec;
    JobStatus status;
    String lastError;
    Instant createdAt;
    Instant lastRunTime;
}
