package com.platform.datakeeper.scheduler;

import com.platform.datakeeper.action.ActionExecutor;
import com.platform.datakeeper.config.DataKeeperConfig;
import com.platform.datakeeper.job.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands scheduled jobs to the worker pool.
 */
@Slf4j
@Component
public class JobDispatcher {
    
    private final Executor executor;
    private final ActionExecutor actionExecutor;
    
    public JobDispatcher(
            @Qualifier(DataKeeperConfig.JOB_EXECUTOR) Executor executor,
            ActionExecutor actionExecutor) {
        this.executor = executor;
        this.actionExecutor = actionExecutor;
    }
    
    public void dispatch(Job job) {
        try {
            executor.execute(() -> actionExecutor.run(job));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected job {}; it stays scheduled until the next startup recovery", job.getId());
        }
    }
}
