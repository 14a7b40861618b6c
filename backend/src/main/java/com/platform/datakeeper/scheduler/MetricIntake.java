package com.platform.datakeeper.scheduler;

import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.IntakeException;
import com.platform.datakeeper.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects the metric snapshot condition triggers evaluate against.
 * 
 * Values pushed through the intake API are merged with reads from every
 * {@link MetricSource}. Each read runs under a time limit and a per-source circuit
 * breaker; a failed source is reported in the snapshot and never blocks the tick.
 */
@Slf4j
@Component
public class MetricIntake {
    
    private final List<MetricSource> sources;
    private final TimeLimiter timeLimiter;
    private final CircuitBreakerRegistry circuitBreakers;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final Map<String, Double> pushed = new ConcurrentHashMap<>();
    private final ExecutorService readers;
    
    public MetricIntake(
            List<MetricSource> sources,
            TimeLimiter timeLimiter,
            CircuitBreakerRegistry circuitBreakers,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.sources = sources;
        this.timeLimiter = timeLimiter;
        this.circuitBreakers = circuitBreakers;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        
        AtomicInteger counter = new AtomicInteger();
        this.readers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "dk-intake-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
    
    /**
     * Records externally supplied values; they are used from the next evaluation on.
     */
    public void push(Map<String, Double> values) {
        pushed.putAll(values);
        log.debug("Metric intake received {}", values.keySet());
    }
    
    public MetricSnapshot collect() {
        Map<String, Double> values = new HashMap<>(pushed);
        Map<String, String> failures = new LinkedHashMap<>();
        
        for (MetricSource source : sources) {
            try {
                values.putAll(read(source));
            } catch (IntakeException e) {
                log.warn("Metric source '{}' skipped this tick: {}", source.name(), e.getMessage());
                metricsRegistry.incrementCounter("datakeeper.intake.failures", "source", source.name());
                failures.put(source.name(), e.getMessage());
            }
        }
        
        return new MetricSnapshot(values, failures, clock.instant());
    }
    
    private Map<String, Double> read(MetricSource source) {
        CircuitBreaker breaker = circuitBreakers.circuitBreaker(source.name());
        try {
            return breaker.executeCallable(() -> timeLimiter.executeFutureSupplier(
                () -> CompletableFuture.supplyAsync(source::read, readers)));
        } catch (CallNotPermittedException e) {
            throw new IntakeException(ErrorCode.INTAKE_UNAVAILABLE, source.name(),
                "circuit open for metric source '" + source.name() + "'");
        } catch (TimeoutException e) {
            throw IntakeException.timeout(source.name());
        } catch (IntakeException e) {
            throw e;
        } catch (Exception e) {
            Throwable cause = e.getCause() instanceof IntakeException ? e.getCause() : e;
            if (cause instanceof IntakeException intake) {
                throw intake;
            }
            throw IntakeException.unavailable(source.name(), e);
        }
    }
    
    @PreDestroy
    public void shutdown() {
        readers.shutdownNow();
    }
}
