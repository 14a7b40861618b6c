package com.platform.datakeeper.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.ValidationException;
import com.platform.datakeeper.job.Job;
import com.platform.datakeeper.job.TriggerSnapshot;
import com.platform.datakeeper.persistence.entity.JobEntity;
import com.platform.datakeeper.persistence.entity.PolicyEntity;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.Policy;
import com.platform.datakeeper.policy.Selector;
import com.platform.datakeeper.policy.TriggerSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bidirectional mappers between domain objects and JPA entities.
 */
@Slf4j
@Component
public class EntityMappers {
    
    private static final TypeReference<List<TriggerSpec>> TRIGGER_LIST = new TypeReference<>() {};
    private static final TypeReference<List<ActionSpec>> ACTION_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    
    private final ObjectMapper objectMapper;
    
    public EntityMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    // ==================== Policy ====================
    
    public PolicyEntity toEntity(Policy domain) {
        return PolicyEntity.builder()
            .id(domain.getId())
            .name(domain.getName())
            .policyFile(domain.getPolicyFile())
            .enabled(domain.isEnabled())
            .strategy(domain.getStrategy())
            .dataTypeJson(write(sorted(domain.getSelector().dataTypes()), STRING_LIST))
            .tagsJson(write(sorted(domain.getSelector().tags()), STRING_LIST))
            .pathsJson(write(sorted(domain.getSelector().paths()), STRING_LIST))
            .operationsJson(write(domain.getOperations(), STRING_LIST))
            .triggersJson(write(domain.getTriggers(), TRIGGER_LIST))
            .actionsJson(write(domain.getActions(), ACTION_LIST))
            .description(domain.getDescription())
            .createdAt(domain.getCreatedAt())
            .updatedAt(domain.getUpdatedAt())
            .build();
    }
    
    public Policy toDomain(PolicyEntity entity) {
        Selector selector = new Selector(
            Set.copyOf(read(entity.getDataTypeJson(), STRING_LIST)),
            Set.copyOf(read(entity.getTagsJson(), STRING_LIST)),
            Set.copyOf(read(entity.getPathsJson(), STRING_LIST)));
        
        return Policy.builder()
            .id(entity.getId())
            .name(entity.getName())
            .description(entity.getDescription())
            .policyFile(entity.getPolicyFile())
            .enabled(entity.isEnabled())
            .strategy(entity.getStrategy())
            .selector(selector)
            .operations(read(entity.getOperationsJson(), STRING_LIST))
            .triggers(read(entity.getTriggersJson(), TRIGGER_LIST))
            .actions(read(entity.getActionsJson(), ACTION_LIST))
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }
    
    // ==================== Job ====================
    
    public JobEntity toEntity(Job domain) {
        return JobEntity.builder()
            .id(domain.getId())
            .policyId(domain.getPolicyId())
            .name(domain.getName())
            .operation(domain.getOperation())
            .filetypes(domain.getFiletypes())
            .triggerType(domain.getTriggerType())
            .triggerSpecJson(write(domain.getTriggerSpec()))
            .triggerKey(domain.getTriggerKey())
            .unitPath(domain.getUnitPath())
            .actionSpecJson(write(domain.getActionSpec(), new TypeReference<ActionSpec>() {}))
            .status(domain.getStatus())
            .lastError(domain.getLastError())
            .createdAt(domain.getCreatedAt())
            .lastRunTime(domain.getLastRunTime())
            .build();
    }
    
    public Job toDomain(JobEntity entity) {
        return Job.builder()
            .id(entity.getId())
            .policyId(entity.getPolicyId())
            .name(entity.getName())
            .operation(entity.getOperation())
            .filetypes(entity.getFiletypes())
            .triggerType(entity.getTriggerType())
            .triggerSpec(read(entity.getTriggerSpecJson(), new TypeReference<TriggerSnapshot>() {}))
            .triggerKey(entity.getTriggerKey())
            .unitPath(entity.getUnitPath())
            .actionSpec(read(entity.getActionSpecJson(), new TypeReference<ActionSpec>() {}))
            .status(entity.getStatus())
            .lastError(entity.getLastError())
            .createdAt(entity.getCreatedAt())
            .lastRunTime(entity.getLastRunTime())
            .build();
    }
    
    // ==================== JSON helpers ====================
    
    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, null, null,
                "Failed to serialize " + value.getClass().getSimpleName() + ": " + e.getOriginalMessage());
        }
    }
    
    private <T> String write(T value, TypeReference<T> type) {
        try {
            return objectMapper.writerFor(type).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, null, null,
                "Failed to serialize " + type.getType() + ": " + e.getOriginalMessage());
        }
    }
    
    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Stored JSON does not match {}: {}", type.getType(), json);
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, null, json,
                "Failed to deserialize " + type.getType() + ": " + e.getOriginalMessage());
        }
    }
    
    private static List<String> sorted(Set<String> values) {
        return List.copyOf(new TreeSet<>(values));
    }
}
