package com.platform.datakeeper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.datakeeper.data.DataStoreAdapter;
import com.platform.datakeeper.data.FileSystemDataStore;
import com.platform.datakeeper.policy.PolicyDocumentParser;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

/**
 * Core beans of the engine.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DataKeeperProperties.class)
public class DataKeeperConfig {
    
    public static final String JOB_EXECUTOR = "jobExecutor";
    
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    /**
     * Workers that run actions, separate from the scheduling thread so a slow
     * action never delays trigger evaluation.
     */
    @Bean(name = JOB_EXECUTOR)
    public ThreadPoolTaskExecutor jobExecutor(DataKeeperProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getScheduler().getWorkerThreads());
        executor.setMaxPoolSize(properties.getScheduler().getWorkerThreads());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("dk-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getScheduler().getShutdownTimeout().toSeconds());
        executor.initialize();
        
        log.info("Job worker pool initialized with {} threads", properties.getScheduler().getWorkerThreads());
        return executor;
    }
    
    /**
     * Bounds every metric source read; a timeout skips that trigger for the tick.
     */
    @Bean
    public TimeLimiter intakeTimeLimiter(DataKeeperProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
            .timeoutDuration(properties.getScheduler().getMetricTimeout())
            .cancelRunningFuture(true)
            .build();
        return TimeLimiter.of("metric-intake", config);
    }
    
    /**
     * One breaker per metric source; an open breaker skips the source without waiting
     * for its timeout.
     */
    @Bean
    public CircuitBreakerRegistry intakeCircuitBreakers() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .slidingWindowSize(5)
            .minimumNumberOfCalls(3)
            .failureRateThreshold(60)
            .waitDurationInOpenState(Duration.ofMinutes(2))
            .build();
        return CircuitBreakerRegistry.of(config);
    }
    
    @Bean
    public PolicyDocumentParser policyDocumentParser(ObjectMapper objectMapper) {
        return new PolicyDocumentParser(objectMapper);
    }
    
    @Bean
    @ConditionalOnMissingBean(DataStoreAdapter.class)
    public DataStoreAdapter dataStoreAdapter(ObjectMapper objectMapper) {
        return new FileSystemDataStore(objectMapper);
    }
}
