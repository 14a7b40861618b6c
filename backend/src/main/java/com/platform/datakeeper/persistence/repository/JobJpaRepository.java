package com.platform.datakeeper.persistence.repository;

import com.platform.datakeeper.job.JobStatus;
import com.platform.datakeeper.persistence.entity.JobEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for jobs.
 * Status changes go through the conditional updates below, never through entity saves.
 */
@Repository
public interface JobJpaRepository extends JpaRepository<JobEntity, String> {
    
    /**
     * Moves a job from {@code from} to {@code to} if it is still in {@code from}.
     *
     * @return 1 if this caller won the transition, 0 otherwise
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE JobEntity j SET j.status = :to, j.lastError = :error " +
           "WHERE j.id = :id AND j.status = :from")
    int compareAndSetStatus(@Param("id") String id,
                            @Param("from") JobStatus from,
                            @Param("to") JobStatus to,
                            @Param("error") String error);
    
    /**
     * Like {@link #compareAndSetStatus} and also stamps {@code last_run_time}.
     * Used for {@code scheduled -> running}.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE JobEntity j SET j.status = :to, j.lastRunTime = :now " +
           "WHERE j.id = :id AND j.status = :from")
    int compareAndSetRunning(@Param("id") String id,
                             @Param("from") JobStatus from,
                             @Param("to") JobStatus to,
                             @Param("now") Instant now);
    
    long countByTriggerKeyAndStatusIn(String triggerKey, Collection<JobStatus> statuses);
    
    boolean existsByTriggerKey(String triggerKey);
    
    List<JobEntity> findByStatusOrderByCreatedAtAsc(JobStatus status);
    
    List<JobEntity> findByPolicyIdOrderByCreatedAtAsc(String policyId);
    
    long countByPolicyId(String policyId);
    
    long countByStatus(JobStatus status);
    
    @Query("SELECT j FROM JobEntity j " +
           "WHERE (:policyId IS NULL OR j.policyId = :policyId) " +
           "AND (:status IS NULL OR j.status = :status) " +
           "ORDER BY j.createdAt DESC, j.id")
    List<JobEntity> search(@Param("policyId") String policyId,
                           @Param("status") JobStatus status,
                           Pageable pageable);
}
