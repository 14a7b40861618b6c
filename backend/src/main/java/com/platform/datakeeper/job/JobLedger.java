package com.platform.datakeeper.job;

import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.error.InvalidTransitionException;
import com.platform.datakeeper.error.ResourceNotFoundException;
import com.platform.datakeeper.error.ValidationException;
import com.platform.datakeeper.observability.MetricsRegistry;
import com.platform.datakeeper.persistence.EntityMappers;
import com.platform.datakeeper.persistence.entity.JobEntity;
import com.platform.datakeeper.persistence.repository.JobJpaRepository;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.Policy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Durable job state machine and the single source of truth for job existence and status.
 * 
 * Every transition is a conditional update keyed on the current status, so of two
 * callers racing on the same job exactly one succeeds; the other gets
 * {@link InvalidTransitionException} and the row is left as the winner wrote it.
 */
@Slf4j
@Service
public class JobLedger {
    
    private static final Set<JobStatus> IN_FLIGHT = EnumSet.of(JobStatus.ADDED, JobStatus.SCHEDULED, JobStatus.RUNNING);
    
    private final JobJpaRepository jobRepository;
    private final EntityMappers mappers;
    private final JobUpdatePublisher publisher;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    public JobLedger(
            JobJpaRepository jobRepository,
            EntityMappers mappers,
            JobUpdatePublisher publisher,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.mappers = mappers;
        this.publisher = publisher;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }
    
    /**
     * Creates a job in {@code added} for one action of {@code policy} against {@code unit}.
     */
    public Job create(Policy policy, String triggerKey, TriggerSnapshot trigger, ActionSpec action, DataUnit unit) {
        Job job = Job.builder()
            .id(UUID.randomUUID().toString())
            .policyId(policy.getId())
            .name(policy.getName() + ":" + action.kind())
            .operation(action.kind())
            .filetypes(unit.dataType())
            .triggerType(trigger.trigger().triggerType())
            .triggerSpec(trigger)
            .triggerKey(triggerKey)
            .unitPath(unit.path())
            .actionSpec(action)
            .status(JobStatus.ADDED)
            .createdAt(clock.instant())
            .build();
        
        jobRepository.save(mappers.toEntity(job));
        
        log.info("[AUDIT] Job {} created for policy '{}' ({} on {})",
            job.getId(), policy.getName(), job.getOperation(), job.getUnitPath());
        metricsRegistry.recordJobTransition(job.getOperation(), "none", JobStatus.ADDED);
        publisher.publish(JobUpdate.of(job, null));
        return job;
    }
    
    /**
     * Moves a job to {@code to}.
     *
     * @param error required when {@code to} is {@code failed}, stored verbatim
     * @throws InvalidTransitionException if {@code to} is not the immediate successor
     *         of the current status, or another caller changed the job first
     */
    public Job transition(String jobId, JobStatus to, String error) {
        return transition(jobId, to, error, null);
    }
    
    /**
     * Marks a running job successful and attaches the action outcome to the published update.
     */
    public Job complete(String jobId, Outcome outcome) {
        return transition(jobId, JobStatus.SUCCESS, null, outcome);
    }
    
    private Job transition(String jobId, JobStatus to, String error, Outcome outcome) {
        JobEntity current = jobRepository.findById(jobId)
            .orElseThrow(() -> ResourceNotFoundException.job(jobId));
        JobStatus from = current.getStatus();
        
        if (!from.canTransitionTo(to)) {
            log.warn("Invalid job transition rejected: {} -> {} for job {}", from, to, jobId);
            metricsRegistry.incrementCounter("datakeeper.job.invalid_transitions", "to", to.dbValue());
            throw new InvalidTransitionException(jobId, from, to);
        }
        if (to == JobStatus.FAILED && (error == null || error.isBlank())) {
            throw new ValidationException("error", "an error message is required when failing a job");
        }
        
        int updated = to == JobStatus.RUNNING
            ? jobRepository.compareAndSetRunning(jobId, from, to, clock.instant())
            : jobRepository.compareAndSetStatus(jobId, from, to, to == JobStatus.FAILED ? error : null);
        
        if (updated == 0) {
            JobStatus actual = jobRepository.findById(jobId).map(JobEntity::getStatus).orElse(null);
            throw new InvalidTransitionException(jobId, actual, to, "job changed concurrently");
        }
        
        Job job = mappers.toDomain(jobRepository.findById(jobId)
            .orElseThrow(() -> ResourceNotFoundException.job(jobId)));
        
        if (to == JobStatus.FAILED) {
            log.info("[AUDIT] Job {} transition: {} -> {} (error: {})", jobId, from.dbValue(), to.dbValue(), error);
        } else {
            log.info("[AUDIT] Job {} transition: {} -> {}", jobId, from.dbValue(), to.dbValue());
        }
        
        metricsRegistry.recordJobTransition(job.getOperation(), from, to);
        publisher.publish(JobUpdate.of(job, outcome));
        return job;
    }
    
    public Job get(String jobId) {
        return jobRepository.findById(jobId)
            .map(mappers::toDomain)
            .orElseThrow(() -> ResourceNotFoundException.job(jobId));
    }
    
    /**
     * Jobs matching the filter, newest first.
     */
    public List<Job> list(JobFilter filter) {
        return jobRepository.search(filter.policyId(), filter.status(), PageRequest.of(0, filter.limit()))
            .stream()
            .map(mappers::toDomain)
            .toList();
    }
    
    /**
     * Whether a job for the trigger is still added, scheduled or running.
     */
    public boolean hasInFlight(String triggerKey) {
        return jobRepository.countByTriggerKeyAndStatusIn(triggerKey, IN_FLIGHT) > 0;
    }
    
    /**
     * Whether the trigger has ever produced a job, whatever its status.
     */
    public boolean hasAnyJob(String triggerKey) {
        return jobRepository.existsByTriggerKey(triggerKey);
    }
    
    /**
     * Jobs in the given status, oldest first.
     */
    public List<Job> listByStatus(JobStatus status) {
        return jobRepository.findByStatusOrderByCreatedAtAsc(status).stream()
            .map(mappers::toDomain)
            .toList();
    }
    
    public long countByStatus(JobStatus status) {
        return jobRepository.countByStatus(status);
    }
}
