package com.platform.datakeeper.persistence.repository;

import com.platform.datakeeper.persistence.entity.PolicyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Spring Data JPA repository for policies.
 */
@Repository
public interface PolicyJpaRepository extends JpaRepository<PolicyEntity, String> {
    
    /**
     * Find policy by unique name.
     */
    Optional<PolicyEntity> findByName(String name);
    
    /**
     * Bulk delete so the database cascade removes the policy's jobs.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM PolicyEntity p WHERE p.id = :id")
    int deletePolicy(@Param("id") String id);
}
