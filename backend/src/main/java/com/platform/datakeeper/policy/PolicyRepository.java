package com.platform.datakeeper.policy;

import com.platform.datakeeper.persistence.EntityMappers;
import com.platform.datakeeper.persistence.entity.PolicyEntity;
import com.platform.datakeeper.persistence.repository.PolicyJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for policies.
 * Delegates to JPA repository for persistent storage.
 */
@Component
public class PolicyRepository {
    
    private final PolicyJpaRepository jpaRepository;
    private final EntityMappers entityMappers;
    
    public PolicyRepository(PolicyJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }
    
    /**
     * Upserts the loaded policies and disables stored ones that are no longer declared.
     * Jobs of retired policies stay as history.
     */
    @Transactional
    public void replaceAll(Collection<Policy> policies, Collection<String> retiredIds) {
        for (Policy policy : policies) {
            jpaRepository.save(entityMappers.toEntity(policy));
        }
        for (String id : retiredIds) {
            jpaRepository.findById(id).ifPresent(entity -> {
                entity.setEnabled(false);
                jpaRepository.save(entity);
            });
        }
    }
    
    /**
     * Find policy by name.
     */
    public Optional<Policy> findByName(String name) {
        return jpaRepository.findByName(name)
            .map(entityMappers::toDomain);
    }
    
    public List<String> findAllIds() {
        return jpaRepository.findAll().stream()
            .map(PolicyEntity::getId)
            .toList();
    }
    
    /**
     * Delete policy by ID. The database removes its jobs.
     */
    public boolean deleteById(String id) {
        return jpaRepository.deletePolicy(id) > 0;
    }
    
    /**
     * Count total policies.
     */
    public long count() {
        return jpaRepository.count();
    }
}
