package com.platform.datakeeper.scheduler;

import com.platform.datakeeper.config.DataKeeperProperties;
import com.platform.datakeeper.data.DataStoreAdapter;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.error.IntakeException;
import com.platform.datakeeper.error.ValidationException;
import com.platform.datakeeper.job.EventWindow;
import com.platform.datakeeper.job.Job;
import com.platform.datakeeper.job.JobLedger;
import com.platform.datakeeper.job.JobStatus;
import com.platform.datakeeper.job.TriggerSnapshot;
import com.platform.datakeeper.lifecycle.FatalErrorHandler;
import com.platform.datakeeper.observability.MetricsRegistry;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.ConditionParser;
import com.platform.datakeeper.policy.CronExpressions;
import com.platform.datakeeper.policy.Policy;
import com.platform.datakeeper.policy.PolicyCondition;
import com.platform.datakeeper.policy.PolicyRegistry;
import com.platform.datakeeper.policy.SelectorMatcher;
import com.platform.datakeeper.policy.TriggerSpec;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns policy triggers into jobs.
 * 
 * A periodic tick evaluates cron, fixed-date, interval and condition triggers against
 * the current policy snapshot. On-demand and event triggers fire from the intake
 * surface. Each firing discovers the units the policy governs and creates one job
 * per action and unit, in policy, action and unit order; new jobs go straight to
 * {@code scheduled} and are handed to the worker pool.
 * 
 * A trigger that still has a job in flight does not fire again; its occurrence is
 * consumed and the next one is awaited. Condition triggers are edge-triggered.
 */
@Slf4j
@Service
public class TriggerScheduler implements SchedulingConfigurer {
    
    private final PolicyRegistry policyRegistry;
    private final JobLedger ledger;
    private final DataStoreAdapter store;
    private final JobDispatcher dispatcher;
    private final MetricIntake metricIntake;
    private final MetricsRegistry metricsRegistry;
    private final MeterRegistry meterRegistry;
    private final FatalErrorHandler fatalErrorHandler;
    private final DataKeeperProperties properties;
    private final Clock clock;
    
    private final Map<String, TriggerState> states = new ConcurrentHashMap<>();
    
    // Metrics
    private final AtomicLong tickCount = new AtomicLong(0);
    private final AtomicLong firedCount = new AtomicLong(0);
    private final AtomicLong jobsCreated = new AtomicLong(0);
    private final AtomicLong skippedCount = new AtomicLong(0);
    private final AtomicLong intakeFailures = new AtomicLong(0);
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private volatile Instant lastTick;
    
    public TriggerScheduler(
            PolicyRegistry policyRegistry,
            JobLedger ledger,
            DataStoreAdapter store,
            JobDispatcher dispatcher,
            MetricIntake metricIntake,
            MetricsRegistry metricsRegistry,
            MeterRegistry meterRegistry,
            FatalErrorHandler fatalErrorHandler,
            DataKeeperProperties properties,
            Clock clock) {
        this.policyRegistry = policyRegistry;
        this.ledger = ledger;
        this.store = store;
        this.dispatcher = dispatcher;
        this.metricIntake = metricIntake;
        this.metricsRegistry = metricsRegistry;
        this.meterRegistry = meterRegistry;
        this.fatalErrorHandler = fatalErrorHandler;
        this.properties = properties;
        this.clock = clock;
    }
    
    @PostConstruct
    public void init() {
        Gauge.builder("datakeeper.scheduler.ticks", tickCount, AtomicLong::get)
            .description("Total scheduler ticks")
            .register(meterRegistry);
        
        Gauge.builder("datakeeper.scheduler.fired", firedCount, AtomicLong::get)
            .description("Total trigger firings")
            .register(meterRegistry);
        
        Gauge.builder("datakeeper.scheduler.jobs_created", jobsCreated, AtomicLong::get)
            .description("Total jobs created")
            .register(meterRegistry);
        
        log.info("Trigger scheduler initialized (enabled={}, interval={})", 
            properties.getScheduler().isEnabled(), properties.getScheduler().getInterval());
    }
    
    /**
     * Registers the tick with a cadence re-read after every run, so an interval changed
     * by a policy reload applies from the next tick.
     */
    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Trigger scheduler disabled, no periodic ticks");
            return;
        }
        registrar.addTriggerTask(this::scheduledTick, context -> {
            Instant last = context.lastCompletion();
            return (last == null ? clock.instant() : last).plus(currentInterval());
        });
    }
    
    public Duration currentInterval() {
        Duration fromDocument = policyRegistry.snapshot().settings().evaluationInterval();
        return fromDocument != null ? fromDocument : properties.getScheduler().getInterval();
    }
    
    /**
     * Periodic entry point: picks up policy file changes, then evaluates.
     */
    public void scheduledTick() {
        if (!accepting.get()) {
            return;
        }
        try {
            policyRegistry.reloadIfChanged();
            tick(clock.instant());
        } catch (DataAccessException e) {
            fatalErrorHandler.onLedgerFailure("tick", e);
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }
    
    /**
     * One evaluation of all polled triggers at {@code now}.
     *
     * @return jobs created by this tick
     */
    public List<Job> tick(Instant now) {
        long tickId = tickCount.incrementAndGet();
        MDC.put("tickId", String.valueOf(tickId));
        lastTick = now;
        
        List<Job> created = new ArrayList<>();
        MetricSnapshot metrics = null;
        PolicyRegistry.Snapshot snapshot = policyRegistry.snapshot();
        
        try {
            pruneStates(snapshot);
            for (Policy policy : snapshot.policies()) {
                MDC.put("policyId", policy.getId());
                try {
                    if (metrics == null && hasConditionTrigger(policy)) {
                        metrics = metricIntake.collect();
                    }
                    created.addAll(evaluate(policy, snapshot, metrics, now));
                } catch (DataAccessException e) {
                    throw e;
                } catch (RuntimeException e) {
                    metricsRegistry.recordTriggerSkipped(policy.getName(), "error");
                    log.error("Evaluation of policy '{}' failed, continuing with the next policy: {}", 
                        policy.getName(), e.getMessage(), e);
                }
            }
            
            if (!created.isEmpty()) {
                log.info("Tick {} complete: {} jobs created", tickId, created.size());
            }
            return created;
        } finally {
            MDC.remove("tickId");
            MDC.remove("policyId");
        }
    }
    
    private List<Job> evaluate(Policy policy, PolicyRegistry.Snapshot snapshot, MetricSnapshot metrics, Instant now) {
        List<Job> created = new ArrayList<>();
        List<TriggerSpec> triggers = policy.getTriggers();
        
        for (int i = 0; i < triggers.size(); i++) {
            TriggerSpec trigger = triggers.get(i);
            if (!trigger.isPolled()) {
                continue;
            }
            
            String key = policy.triggerKey(i);
            TriggerState state = stateFor(key, trigger, snapshot.loadedAt(), now);
            
            boolean due;
            if (trigger instanceof TriggerSpec.Condition condition) {
                try {
                    due = evaluateCondition(state, condition, metrics);
                } catch (IntakeException e) {
                    intakeFailures.incrementAndGet();
                    metricsRegistry.recordTriggerSkipped(policy.getName(), "intake");
                    log.warn("Condition trigger {} of policy '{}' skipped this tick: {}", 
                        i, policy.getName(), e.getMessage());
                    continue;
                }
            } else {
                due = isDue(key, state, trigger, now);
            }
            
            if (due) {
                MDC.put("trigger", key);
                try {
                    created.addAll(fire(policy, i, TriggerSnapshot.of(trigger, now)));
                } finally {
                    MDC.remove("trigger");
                }
            }
        }
        return created;
    }
    
    private static boolean hasConditionTrigger(Policy policy) {
        return policy.getTriggers().stream().anyMatch(TriggerSpec.Condition.class::isInstance);
    }
    
    /**
     * Forgets triggers that are no longer part of the loaded policies.
     */
    private void pruneStates(PolicyRegistry.Snapshot snapshot) {
        Set<String> active = new HashSet<>();
        for (Policy policy : snapshot.policies()) {
            for (int i = 0; i < policy.getTriggers().size(); i++) {
                active.add(policy.triggerKey(i));
            }
        }
        if (states.keySet().retainAll(active)) {
            log.debug("Dropped scheduling state of removed triggers, {} tracked", states.size());
        }
    }
    
    /**
     * Fires the policy's on-demand trigger.
     *
     * @throws ValidationException if the policy declares no on-demand trigger
     */
    public FireResult fireOnDemand(String policyId) {
        Policy policy = policyRegistry.get(policyId);
        List<TriggerSpec> triggers = policy.getTriggers();
        
        for (int i = 0; i < triggers.size(); i++) {
            if (triggers.get(i) instanceof TriggerSpec.OnDemand) {
                MDC.put("trigger", policy.triggerKey(i));
                try {
                    log.info("On-demand trigger invoked for policy '{}'", policy.getName());
                    List<Job> jobs = fire(policy, i, TriggerSnapshot.of(triggers.get(i), clock.instant()));
                    return FireResult.of(policy, i, jobs);
                } finally {
                    MDC.remove("trigger");
                }
            }
        }
        throw new ValidationException("policyId", policyId, "policy '" + policy.getName() + "' has no on-demand trigger");
    }
    
    /**
     * Fires every event trigger whose source and filter match the event. The protected
     * window travels with the jobs' trigger snapshot.
     */
    public List<FireResult> onEvent(ExternalEvent event) {
        List<FireResult> results = new ArrayList<>();
        MDC.put("trigger", "event:" + event.source());
        
        try {
            for (Policy policy : policyRegistry.snapshot().policies()) {
                List<TriggerSpec> triggers = policy.getTriggers();
                for (int i = 0; i < triggers.size(); i++) {
                    if (!(triggers.get(i) instanceof TriggerSpec.Event spec) || !matchesEvent(spec, event)) {
                        continue;
                    }
                    EventWindow window = new EventWindow(
                        event.source(), event.positionM(), event.eventTime(), spec.radiusKm(), spec.windowSeconds());
                    TriggerSnapshot snapshot = new TriggerSnapshot(spec, clock.instant(), window);
                    
                    log.info("Event from '{}' at {} m fires trigger {} of policy '{}'", 
                        event.source(), event.positionM(), i, policy.getName());
                    results.add(FireResult.of(policy, i, fire(policy, i, snapshot)));
                }
            }
        } finally {
            MDC.remove("trigger");
        }
        return results;
    }
    
    /**
     * Metric values supplied from outside; condition triggers see them from the next tick.
     */
    public void onMetrics(Map<String, Double> values) {
        metricIntake.push(values);
    }
    
    /**
     * Creates, schedules and dispatches the jobs of one firing.
     * Disabled policies and triggers with a job in flight produce nothing.
     */
    synchronized List<Job> fire(Policy policy, int triggerIndex, TriggerSnapshot snapshot) {
        String key = policy.triggerKey(triggerIndex);
        
        if (!accepting.get()) {
            log.debug("Shutting down, trigger {} produces no jobs", key);
            return List.of();
        }
        if (!policy.isEnabled()) {
            log.debug("Policy '{}' is disabled, trigger {} produces no jobs", policy.getName(), key);
            metricsRegistry.recordTriggerSkipped(policy.getName(), "disabled");
            return List.of();
        }
        if (ledger.hasInFlight(key)) {
            log.info("Trigger {} of policy '{}' still has a job in flight, not firing again", key, policy.getName());
            skippedCount.incrementAndGet();
            metricsRegistry.recordTriggerSkipped(policy.getName(), "in_flight");
            return List.of();
        }
        
        List<DataUnit> units;
        try {
            units = store.discover(policy.getSelector().paths()).stream()
                .filter(unit -> SelectorMatcher.matches(policy.getSelector(), unit))
                .toList();
        } catch (IOException | RuntimeException e) {
            log.warn("Data discovery failed for policy '{}', skipping this firing: {}", policy.getName(), e.getMessage());
            metricsRegistry.recordTriggerSkipped(policy.getName(), "discovery");
            return List.of();
        }
        
        firedCount.incrementAndGet();
        metricsRegistry.recordTriggerFired(policy.getName(), snapshot.trigger().triggerType());
        
        List<Job> jobs = new ArrayList<>();
        for (ActionSpec action : policy.getActions()) {
            for (DataUnit unit : units) {
                Job job = ledger.create(policy, key, snapshot, action, unit);
                jobs.add(ledger.transition(job.getId(), JobStatus.SCHEDULED, null));
            }
        }
        jobsCreated.addAndGet(jobs.size());
        
        log.info("[AUDIT] Policy '{}' trigger {} ({}) fired: {} units, {} jobs",
            policy.getName(), key, snapshot.trigger().triggerType(), units.size(), jobs.size());
        
        jobs.forEach(dispatcher::dispatch);
        return jobs;
    }
    
    private TriggerState stateFor(String key, TriggerSpec trigger, Instant loadedAt, Instant now) {
        Instant reference = loadedAt != null && !loadedAt.isAfter(now) ? loadedAt : now;
        return states.compute(key, (k, existing) -> 
            existing != null && existing.spec.equals(trigger) ? existing : new TriggerState(trigger, reference));
    }
    
    private boolean isDue(String key, TriggerState state, TriggerSpec trigger, Instant now) {
        if (trigger instanceof TriggerSpec.Cron cron) {
            if (state.nextFire == null) {
                state.nextFire = CronExpressions.next(cron.expression(), state.reference);
            }
            if (state.nextFire == null || now.isBefore(state.nextFire)) {
                return false;
            }
            // missed occurrences collapse into this one
            state.nextFire = CronExpressions.next(cron.expression(), now);
            return true;
        }
        if (trigger instanceof TriggerSpec.FixedDate date) {
            if (state.retired || now.isBefore(date.at())) {
                return false;
            }
            state.retired = true;
            // a ledger entry means the date already fired before a restart
            if (ledger.hasAnyJob(key)) {
                log.info("Fixed-date trigger {} already fired, retired", key);
                return false;
            }
            return true;
        }
        if (trigger instanceof TriggerSpec.Interval interval) {
            Instant base = state.lastFired != null ? state.lastFired : state.reference;
            if (now.isBefore(base.plus(interval.every()))) {
                return false;
            }
            state.lastFired = now;
            return true;
        }
        return false;
    }
    
    private boolean evaluateCondition(TriggerState state, TriggerSpec.Condition condition, MetricSnapshot metrics) {
        if (state.condition == null) {
            state.condition = ConditionParser.parse(condition.expression());
        }
        metrics.requireAvailable(state.condition.paths());
        
        boolean value = state.condition.evaluate(metrics.values());
        boolean rising = value && !state.lastConditionValue;
        state.lastConditionValue = value;
        return rising;
    }
    
    private static boolean matchesEvent(TriggerSpec.Event spec, ExternalEvent event) {
        if (!"*".equals(spec.source()) && !spec.source().equals(event.source())) {
            return false;
        }
        if (spec.filter() == null) {
            return true;
        }
        return ConditionParser.parse(spec.filter()).evaluate(event.conditionContext());
    }
    
    /**
     * Stops creating jobs; jobs already dispatched keep running.
     */
    public void stopAccepting() {
        if (accepting.compareAndSet(true, false)) {
            log.info("Trigger scheduler no longer accepting work");
        }
    }
    
    public boolean isAccepting() {
        return accepting.get();
    }
    
    public SchedulerStats getStats() {
        return new SchedulerStats(
            properties.getScheduler().isEnabled(),
            currentInterval(),
            tickCount.get(),
            firedCount.get(),
            jobsCreated.get(),
            skippedCount.get(),
            intakeFailures.get(),
            lastTick,
            policyRegistry.snapshot().policies().size(),
            states.size(),
            ledger.countByStatus(JobStatus.RUNNING)
        );
    }
    
    /**
     * Per-trigger scheduling memory: {@code idle -> due -> fired -> idle}.
     */
    static final class TriggerState {
        final TriggerSpec spec;
        final Instant reference;
        Instant nextFire;
        Instant lastFired;
        boolean retired;
        boolean lastConditionValue;
        PolicyCondition condition;
        
        TriggerState(TriggerSpec spec, Instant reference) {
            this.spec = spec;
            this.reference = reference;
        }
    }
    
    public record FireResult(String policyId, String triggerKey, int jobsCreated, List<String> jobIds) {
        static FireResult of(Policy policy, int triggerIndex, List<Job> jobs) {
            return new FireResult(policy.getId(), policy.triggerKey(triggerIndex), jobs.size(),
                jobs.stream().map(Job::getId).toList());
        }
    }
    
    public record SchedulerStats(
        boolean enabled,
        Duration interval,
        long ticks,
        long firings,
        long jobsCreated,
        long skippedInFlight,
        long intakeFailures,
        Instant lastTick,
        int activePolicies,
        int trackedTriggers,
        long runningJobs
    ) {}
}
