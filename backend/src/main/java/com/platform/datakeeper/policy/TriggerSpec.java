package com.platform.datakeeper.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Duration;
import java.time.Instant;

/**
 * Declared trigger of a policy. Closed set of variants; the JSON form (property {@code kind})
 * is the snapshot stored on the policy and job rows.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TriggerSpec.OnDemand.class, name = "on-demand"),
    @JsonSubTypes.Type(value = TriggerSpec.Cron.class, name = "cron"),
    @JsonSubTypes.Type(value = TriggerSpec.FixedDate.class, name = "date"),
    @JsonSubTypes.Type(value = TriggerSpec.Interval.class, name = "interval"),
    @JsonSubTypes.Type(value = TriggerSpec.Condition.class, name = "condition"),
    @JsonSubTypes.Type(value = TriggerSpec.Event.class, name = "event")
})
public interface TriggerSpec {
    
    /**
     * Value persisted in {@code job.trigger_type}.
     */
    String triggerType();
    
    /**
     * Whether the scheduler tick evaluates this trigger. On-demand and event triggers
     * only fire from the intake surface.
     */
    @JsonIgnore
    default boolean isPolled() {
        return true;
    }
    
    record OnDemand(String apiPath) implements TriggerSpec {
        @Override
        public String triggerType() {
            return "on-demand";
        }
        
        @Override
        @JsonIgnore
        public boolean isPolled() {
            return false;
        }
    }
    
    /**
     * @param expression six-field Spring cron expression (five-field input is normalized on load)
     */
    record Cron(String expression) implements TriggerSpec {
        @Override
        public String triggerType() {
            return "schedule";
        }
    }
    
    record FixedDate(Instant at) implements TriggerSpec {
        @Override
        public String triggerType() {
            return "schedule";
        }
    }
    
    record Interval(Duration every) implements TriggerSpec {
        @Override
        public String triggerType() {
            return "schedule";
        }
    }
    
    record Condition(String expression) implements TriggerSpec {
        @Override
        public String triggerType() {
            return "condition";
        }
    }
    
    /**
     * Geofence/event trigger. Events from {@code source} that satisfy {@code filter}
     * (optional) fire the trigger; the protected window is {@code ±radiusKm} along the
     * fiber and {@code ±windowSeconds} around the event time.
     */
    record Event(String source, double radiusKm, long windowSeconds, String filter) implements TriggerSpec {
        @Override
        public String triggerType() {
            return "event";
        }
        
        @Override
        @JsonIgnore
        public boolean isPolled() {
            return false;
        }
    }
}
