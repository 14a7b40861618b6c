package com.platform.datakeeper.lifecycle;

import com.platform.datakeeper.job.Job;
import com.platform.datakeeper.job.JobLedger;
import com.platform.datakeeper.job.JobStatus;
import com.platform.datakeeper.observability.MetricsRegistry;
import com.platform.datakeeper.scheduler.JobDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks up jobs a previous run created but never handed to a worker, once policies
 * are loaded.
 *
 * Recovery Logic:
 * 1. {@code added} jobs are moved to {@code scheduled}
 * 2. every {@code scheduled} job is handed to the worker pool again, oldest first
 *
 * {@code running} jobs are left alone.
 */
@Slf4j
@Component
@Order(1)
public class ScheduledJobRecovery implements ApplicationRunner {

    private final JobLedger ledger;
    private final JobDispatcher dispatcher;
    private final MetricsRegistry metricsRegistry;

    public ScheduledJobRecovery(JobLedger ledger, JobDispatcher dispatcher, MetricsRegistry metricsRegistry) {
        this.ledger = ledger;
        this.dispatcher = dispatcher;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void run(ApplicationArguments args) {
        recover();
    }

    /**
     * @return number of jobs handed to the worker pool
     */
    public int recover() {
        for (Job job : ledger.listByStatus(JobStatus.ADDED)) {
            apply(job, () -> ledger.transition(job.getId(), JobStatus.SCHEDULED, null));
        }

        List<Job> scheduled = ledger.listByStatus(JobStatus.SCHEDULED);
        int dispatched = 0;
        for (Job job : scheduled) {
            if (apply(job, () -> dispatcher.dispatch(job))) {
                dispatched++;
            }
        }

        if (!scheduled.isEmpty()) {
            log.info("Startup recovery: {} of {} scheduled jobs dispatched", dispatched, scheduled.size());
            metricsRegistry.incrementCounter("datakeeper.recovery.dispatched", "count", String.valueOf(dispatched));
        } else {
            log.info("Startup recovery: no unfinished jobs");
        }
        return dispatched;
    }

    private static boolean apply(Job job, Runnable step) {
        MDC.put("jobId", job.getId());
        try {
            step.run();
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to recover job {}: {}", job.getId(), e.getMessage(), e);
            return false;
        } finally {
            MDC.remove("jobId");
        }
    }
}
