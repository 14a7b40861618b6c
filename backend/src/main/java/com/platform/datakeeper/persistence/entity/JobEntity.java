package com.platform.datakeeper.persistence.entity;

import com.platform.datakeeper.job.JobStatus;
import com.platform.datakeeper.persistence.JsonColumns;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for jobs. Rows are removed by the database when the owning policy is deleted.
 */
@Entity
@Table(name = "job", indexes = {
    @Index(name = "idx_job_policy", columnList = "policy_id"),
    @Index(name = "idx_job_trigger_status", columnList = "trigger_key, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "policy_id", length = 64, nullable = false, updatable = false)
    private String policyId;
    
    @Column(nullable = false)
    private String name;
    
    @Column(length = 64, nullable = false)
    private String operation;
    
    @Column(length = 255)
    private String filetypes;
    
    @Column(name = "trigger_type", length = 32, nullable = false)
    private String triggerType;
    
    /**
     * Serialized TriggerSnapshot as JSON.
     */
    @Column(name = "trigger_spec", nullable = false)
    private String triggerSpecJson;
    
    @Column(name = "trigger_key", length = 128, nullable = false)
    private String triggerKey;
    
    @Column(name = "unit_path", length = 1024)
    private String unitPath;
    
    /**
     * Serialized ActionSpec as JSON.
     */
    @Column(name = "action_spec", nullable = false)
    private String actionSpecJson;
    
    @Convert(converter = JobStatusConverter.class)
    @Column(length = 16, nullable = false)
    private JobStatus status;
    
    @Column(name = "last_error", length = 4096)
    private String lastError;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "last_run_time")
    private Instant lastRunTime;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        JsonColumns.requireObject("trigger_spec", triggerSpecJson);
        JsonColumns.requireObject("action_spec", actionSpecJson);
    }
}
