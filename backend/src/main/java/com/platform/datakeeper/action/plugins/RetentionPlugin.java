package com.platform.datakeeper.action.plugins;

import com.platform.datakeeper.action.ActionContext;
import com.platform.datakeeper.action.ActionPlugin;
import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.action.Outcome.Disposition;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.RetentionRule;
import com.platform.datakeeper.policy.TimeUnitSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Age-based deletion with exceptions.
 * 
 * The first exception whose condition holds replaces the base threshold; a threshold of
 * {@code -1} keeps the unit forever. Below the threshold but within {@code warning_time}
 * of it, the outcome is a warning and nothing is deleted. The {@code dry-run} strategy
 * reports deletion candidates without deleting them.
 */
@Slf4j
@Component
public class RetentionPlugin implements ActionPlugin {
    
    @Override
    public String kind() {
        return ActionSpec.RETENTION;
    }
    
    @Override
    public Outcome execute(DataUnit unit, ActionSpec spec, ActionContext context) throws IOException {
        return apply(unit, (ActionSpec.Retention) spec, context);
    }
    
    /**
     * Retention decision and effect for one unit; shared with the window-based actions
     * for the data they do not protect.
     */
    static Outcome apply(DataUnit unit, ActionSpec.Retention spec, ActionContext context) throws IOException {
        Decision decision = decide(unit, spec, context.now());
        long bytes = context.store().sizeOf(unit);
        
        return switch (decision.disposition()) {
            case DELETED -> {
                if ("dry-run".equals(spec.strategy())) {
                    log.info("[dry-run] Would delete {} ({})", unit.path(), decision.reason());
                    yield new Outcome(List.of("retention-dry-run"), bytes, bytes, Disposition.WOULD_DELETE, decision.reason());
                }
                context.store().delete(unit);
                log.info("Deleted {} ({})", unit.path(), decision.reason());
                yield new Outcome(List.of("delete"), bytes, 0, Disposition.DELETED, decision.reason());
            }
            case WARNED -> {
                log.warn("Retention warning for {}: {}", unit.path(), decision.reason());
                yield new Outcome(List.of(), bytes, bytes, Disposition.WARNED, decision.reason());
            }
            default -> Outcome.retained(bytes, decision.reason());
        };
    }
    
    /**
     * Pure retention decision: {@code DELETED}, {@code WARNED} or {@code RETAINED}.
     */
    public static Decision decide(DataUnit unit, ActionSpec.Retention spec, Instant now) {
        long threshold = spec.retentionTime();
        TimeUnitSpec unitOfTime = spec.timeUnit();
        String source = "base retention";
        
        for (RetentionRule rule : spec.exceptions()) {
            if (rule.compiled().evaluate(unit.conditionContext())) {
                threshold = rule.retentionTime();
                unitOfTime = rule.timeUnit() != null ? rule.timeUnit() : spec.timeUnit();
                source = "exception '" + rule.condition() + "'";
                break;
            }
        }
        
        if (threshold == RetentionRule.NEVER_DELETE) {
            return new Decision(Disposition.RETAINED, "never deleted by " + source);
        }
        
        Duration age = Duration.between(unit.timestamp(), now);
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        Duration limit = unitOfTime.toDuration(threshold);
        String ageText = String.format("age %.2f %s, limit %d %s (%s)", 
            unitOfTime.amountOf(age), unitOfTime.name().toLowerCase(Locale.ROOT), threshold, 
            unitOfTime.name().toLowerCase(Locale.ROOT), source);
        
        if (age.compareTo(limit) >= 0) {
            return new Decision(Disposition.DELETED, ageText);
        }
        
        if (spec.warningTime() > 0) {
            Duration warnFrom = limit.minus(spec.timeUnit().toDuration(spec.warningTime()));
            if (age.compareTo(warnFrom) >= 0) {
                return new Decision(Disposition.WARNED, "deletion due in " 
                    + limit.minus(age).toSeconds() + "s, " + ageText);
            }
        }
        
        return new Decision(Disposition.RETAINED, ageText);
    }
    
    public record Decision(Disposition disposition, String reason) {}
}
