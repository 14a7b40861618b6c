package com.platform.datakeeper.lifecycle;

import com.platform.datakeeper.config.DataKeeperConfig;
import com.platform.datakeeper.config.DataKeeperProperties;
import com.platform.datakeeper.job.JobLedger;
import com.platform.datakeeper.job.JobStatus;
import com.platform.datakeeper.observability.MetricsRegistry;
import com.platform.datakeeper.scheduler.TriggerScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.user.SimpUserRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown manager.
 * 
 * Order:
 * 1. Stop creating jobs
 * 2. Notify WebSocket clients
 * 3. Drain the worker pool (running jobs finish, up to the shutdown timeout)
 * 4. Report jobs left in flight
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {
    
    public static final String SYSTEM_TOPIC = "/topic/system";
    
    private final TriggerScheduler triggerScheduler;
    private final ThreadPoolTaskExecutor jobExecutor;
    private final SimpMessagingTemplate messagingTemplate;
    private final SimpUserRegistry userRegistry;
    private final JobLedger ledger;
    private final MetricsRegistry metricsRegistry;
    private final Duration shutdownTimeout;
    
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    public GracefulShutdownManager(
            TriggerScheduler triggerScheduler,
            @Qualifier(DataKeeperConfig.JOB_EXECUTOR) ThreadPoolTaskExecutor jobExecutor,
            SimpMessagingTemplate messagingTemplate,
            SimpUserRegistry userRegistry,
            JobLedger ledger,
            MetricsRegistry metricsRegistry,
            DataKeeperProperties properties) {
        this.triggerScheduler = triggerScheduler;
        this.jobExecutor = jobExecutor;
        this.messagingTemplate = messagingTemplate;
        this.userRegistry = userRegistry;
        this.ledger = ledger;
        this.metricsRegistry = metricsRegistry;
        this.shutdownTimeout = properties.getScheduler().getShutdownTimeout();
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }
    
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
    
    public synchronized void performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        
        Instant started = Instant.now();
        log.info("========== GRACEFUL SHUTDOWN INITIATED ==========");
        
        try {
            log.info("[1/4] Stopping trigger scheduler...");
            triggerScheduler.stopAccepting();
            
            log.info("[2/4] Notifying WebSocket clients...");
            notifyWebSocketClients();
            
            log.info("[3/4] Draining job workers...");
            drainWorkers();
            
            log.info("[4/4] Checking ledger...");
            reportInFlight();
            
            metricsRegistry.incrementCounter("datakeeper.lifecycle.shutdown", "status", "complete");
            log.info("========== GRACEFUL SHUTDOWN COMPLETE ({} ms) ==========",
                Duration.between(started, Instant.now()).toMillis());
        } catch (RuntimeException e) {
            log.error("Error during graceful shutdown", e);
        }
    }
    
    private void notifyWebSocketClients() {
        int sessionCount = userRegistry.getUserCount();
        if (sessionCount == 0) {
            return;
        }
        log.info("Notifying {} WebSocket sessions of shutdown", sessionCount);
        try {
            messagingTemplate.convertAndSend(SYSTEM_TOPIC, new ShutdownNotification(
                "SERVER_SHUTDOWN", "Scheduler is shutting down", shutdownTimeout.toSeconds()));
        } catch (RuntimeException e) {
            log.warn("Error notifying WebSocket clients: {}", e.getMessage());
        }
    }
    
    private void drainWorkers() {
        ThreadPoolExecutor pool = jobExecutor.getThreadPoolExecutor();
        pool.shutdown();
        try {
            if (pool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("All job workers finished");
            } else {
                log.warn("Timeout waiting for job workers, {} still active", pool.getActiveCount());
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for job workers");
        }
    }
    
    private void reportInFlight() {
        try {
            long running = ledger.countByStatus(JobStatus.RUNNING);
            long scheduled = ledger.countByStatus(JobStatus.SCHEDULED);
            if (running > 0 || scheduled > 0) {
                log.warn("Jobs left in flight: {} running, {} scheduled", running, scheduled);
            }
        } catch (RuntimeException e) {
            log.warn("Could not read job ledger during shutdown: {}", e.getMessage());
        }
    }
    
    public record ShutdownNotification(String type, String message, long gracePeriodSeconds) {}
}
