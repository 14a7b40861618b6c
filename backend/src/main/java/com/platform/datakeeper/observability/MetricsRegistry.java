package com.platform.datakeeper.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for application metrics: scheduler ticks, trigger firings,
 * job transitions and action outcomes.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }
    
    /**
     * Increment a counter.
     */
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k -> 
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    public void recordTriggerFired(String policyName, String triggerType) {
        incrementCounter("datakeeper.trigger.fired", "policy", policyName, "type", triggerType);
    }
    
    public void recordTriggerSkipped(String policyName, String reason) {
        incrementCounter("datakeeper.trigger.skipped", "policy", policyName, "reason", reason);
    }
    
    /**
     * Record a job status change.
     */
    public void recordJobTransition(String operation, Object fromStatus, Object toStatus) {
        String from = fromStatus != null ? fromStatus.toString() : "none";
        String to = toStatus != null ? toStatus.toString() : "unknown";
        
        incrementCounter("datakeeper.job.transition", 
            "operation", operation, 
            "from", from, 
            "to", to);
        
        log.debug("Recorded job transition for {}: {} -> {}", operation, from, to);
    }
    
    /**
     * Record the duration and disposition of an executed action.
     */
    public void recordActionOutcome(String kind, String disposition, long durationMs) {
        incrementCounter("datakeeper.action.outcome", "kind", kind, "disposition", disposition);
        
        timers.computeIfAbsent(kind, k -> 
            Timer.builder("datakeeper.action.duration")
                .tag("kind", kind)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry))
            .record(Duration.ofMillis(durationMs));
    }
}
