package com.platform.datakeeper.persistence.entity;

import com.platform.datakeeper.persistence.JsonColumns;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.type.NumericBooleanConverter;

import java.time.Instant;

/**
 * JPA entity for policies.
 * Selector sets, operations, triggers and actions are stored as JSON arrays.
 */
@Entity
@Table(name = "policy")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyEntity {
    
    @Id
    @Column(length = 64)
    private String id;
    
    @Column(nullable = false, unique = true)
    private String name;
    
    @Column(name = "policy_file", length = 1024)
    private String policyFile;
    
    @Convert(converter = NumericBooleanConverter.class)
    @Column(name = "is_enabled", nullable = false)
    private boolean enabled;
    
    @Column(length = 32, nullable = false)
    private String strategy;
    
    @Column(name = "data_type", nullable = false)
    private String dataTypeJson;
    
    @Column(name = "tags", nullable = false)
    private String tagsJson;
    
    @Column(name = "paths", nullable = false)
    private String pathsJson;
    
    @Column(name = "operations", nullable = false)
    private String operationsJson;
    
    @Column(name = "triggers", nullable = false)
    private String triggersJson;
    
    @Column(name = "actions", nullable = false)
    private String actionsJson;
    
    @Column(length = 2048)
    private String description;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        validateJson();
    }
    
    @PreUpdate
    protected void onUpdate() {
        validateJson();
    }
    
    private void validateJson() {
        JsonColumns.requireArray("data_type", dataTypeJson);
        JsonColumns.requireArray("tags", tagsJson);
        JsonColumns.requireArray("paths", pathsJson);
        JsonColumns.requireArray("operations", operationsJson);
        JsonColumns.requireArray("triggers", triggersJson);
        JsonColumns.requireArray("actions", actionsJson);
    }
}
