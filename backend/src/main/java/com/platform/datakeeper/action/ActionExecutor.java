package com.platform.datakeeper.action;

import com.platform.datakeeper.data.DataStoreAdapter;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.error.ActionExecutionException;
import com.platform.datakeeper.error.DataKeeperException;
import com.platform.datakeeper.error.InvalidTransitionException;
import com.platform.datakeeper.job.Job;
import com.platform.datakeeper.job.JobLedger;
import com.platform.datakeeper.job.JobStatus;
import com.platform.datakeeper.lifecycle.FatalErrorHandler;
import com.platform.datakeeper.observability.MetricsRegistry;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.Policy;
import com.platform.datakeeper.policy.PolicyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Locale;

/**
 * Runs one scheduled job: claims it ({@code scheduled -> running}), invokes the plugin
 * for its action kind and reports the result to the ledger.
 * 
 * Every failure inside the plugin is converted here to an {@link ActionExecutionException}
 * and recorded as a {@code failed} job; nothing escapes to the caller. Losing the claim
 * race to another worker is not an error.
 */
@Slf4j
@Service
public class ActionExecutor {
    
    private final JobLedger ledger;
    private final ActionPluginRegistry plugins;
    private final DataStoreAdapter store;
    private final PolicyRegistry policyRegistry;
    private final MetricsRegistry metricsRegistry;
    private final FatalErrorHandler fatalErrorHandler;
    private final Clock clock;
    
    public ActionExecutor(
            JobLedger ledger,
            ActionPluginRegistry plugins,
            DataStoreAdapter store,
            PolicyRegistry policyRegistry,
            MetricsRegistry metricsRegistry,
            FatalErrorHandler fatalErrorHandler,
            Clock clock) {
        this.ledger = ledger;
        this.plugins = plugins;
        this.store = store;
        this.policyRegistry = policyRegistry;
        this.metricsRegistry = metricsRegistry;
        this.fatalErrorHandler = fatalErrorHandler;
        this.clock = clock;
    }
    
    /**
     * Worker entry point.
     *
     * @return the outcome, or null if the job failed or was claimed by someone else
     */
    public Outcome run(Job job) {
        MDC.put("jobId", job.getId());
        MDC.put("policyId", job.getPolicyId());
        
        try {
            try {
                ledger.transition(job.getId(), JobStatus.RUNNING, null);
            } catch (InvalidTransitionException e) {
                log.debug("Job {} already claimed ({}), skipping", job.getId(), e.getMessage());
                return null;
            }
            
            long start = System.nanoTime();
            try {
                Outcome outcome = execute(job);
                long durationMs = (System.nanoTime() - start) / 1_000_000;
                ledger.complete(job.getId(), outcome);
                metricsRegistry.recordActionOutcome(job.getOperation(), 
                    outcome.disposition().name().toLowerCase(Locale.ROOT), durationMs);
                return outcome;
            } catch (ActionExecutionException e) {
                long durationMs = (System.nanoTime() - start) / 1_000_000;
                log.warn("Job {} ({} on {}) failed: {}", job.getId(), job.getOperation(), job.getUnitPath(), 
                    e.toLedgerMessage());
                ledger.transition(job.getId(), JobStatus.FAILED, e.toLedgerMessage());
                metricsRegistry.recordActionOutcome(job.getOperation(), "failed", durationMs);
                return null;
            }
        } catch (DataAccessException e) {
            fatalErrorHandler.onLedgerFailure("job " + job.getId(), e);
            return null;
        } finally {
            MDC.remove("jobId");
            MDC.remove("policyId");
        }
    }
    
    /**
     * Invokes the plugin for the job's action, converting any failure to
     * {@link ActionExecutionException}.
     */
    public Outcome execute(Job job) {
        try {
            DataUnit unit = store.find(job.getUnitPath())
                .orElseThrow(() -> ActionExecutionException.io("data unit no longer exists: " + job.getUnitPath(), null));
            ActionPlugin plugin = plugins.require(job.getOperation());
            
            ActionContext context = new ActionContext(
                job.getId(),
                store,
                clock.instant(),
                baseRetention(job.getPolicyId()),
                job.getTriggerSpec() != null ? job.getTriggerSpec().window() : null);
            
            return plugin.execute(unit, job.getActionSpec(), context);
            
        } catch (ActionExecutionException e) {
            throw e;
        } catch (IOException e) {
            throw ActionExecutionException.io(describe(e), e);
        } catch (UncheckedIOException e) {
            throw ActionExecutionException.io(describe(e.getCause()), e);
        } catch (DataKeeperException | IllegalArgumentException e) {
            throw ActionExecutionException.constraint(describe(e));
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error in {} plugin for job {}", job.getOperation(), job.getId(), e);
            throw ActionExecutionException.format(describe(e));
        }
    }
    
    private ActionSpec.Retention baseRetention(String policyId) {
        Policy policy = policyRegistry.snapshot().byId().get(policyId);
        return policy == null ? null : policy.baseRetention();
    }
    
    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
