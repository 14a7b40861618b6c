package com.platform.datakeeper.policy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

/**
 * Declared action of a policy. {@link #kind()} is the name the plugin registry resolves.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ActionSpec.Retention.class, name = ActionSpec.RETENTION),
    @JsonSubTypes.Type(value = ActionSpec.Transform.class, name = ActionSpec.TRANSFORM),
    @JsonSubTypes.Type(value = ActionSpec.Roi.class, name = ActionSpec.ROI),
    @JsonSubTypes.Type(value = ActionSpec.TimeWindow.class, name = ActionSpec.TIME_WINDOW),
    @JsonSubTypes.Type(value = ActionSpec.EventProximity.class, name = ActionSpec.EVENT_PROXIMITY)
})
public interface ActionSpec {
    
    String RETENTION = "retention";
    String TRANSFORM = "transform";
    String ROI = "roi";
    String TIME_WINDOW = "time-window";
    String EVENT_PROXIMITY = "event-proximity";
    
    String kind();
    
    /**
     * @param strategy {@code default}, {@code none} or {@code dry-run}
     * @param retentionTime age threshold in {@code timeUnit}; {@code -1} never deletes
     * @param warningTime units before the threshold at which a warning is emitted; {@code 0} disables
     */
    record Retention(
        String strategy,
        TimeUnitSpec timeUnit,
        long retentionTime,
        long warningTime,
        List<RetentionRule> exceptions
    ) implements ActionSpec {
        
        public Retention {
            exceptions = exceptions == null ? List.of() : List.copyOf(exceptions);
        }
        
        @Override
        public String kind() {
            return RETENTION;
        }
    }
    
    record Transform(
        List<String> operations,
        boolean preserveOriginal,
        List<DownsampleMethod> methods
    ) implements ActionSpec {
        
        public Transform {
            operations = operations == null ? List.of() : List.copyOf(operations);
            methods = methods == null ? List.of() : List.copyOf(methods);
        }
        
        @Override
        public String kind() {
            return TRANSFORM;
        }
    }
    
    /**
     * @param channels channel selection expression, see {@code ChannelSelection}
     */
    record Roi(String channels) implements ActionSpec {
        @Override
        public String kind() {
            return ROI;
        }
    }
    
    record TimeWindow(Instant from, Instant to) implements ActionSpec {
        @Override
        public String kind() {
            return TIME_WINDOW;
        }
    }
    
    /**
     * Either bound may be null, in which case the firing event's window applies.
     */
    record EventProximity(Double radiusKm, Long windowSeconds, String eventSource) implements ActionSpec {
        @Override
        public String kind() {
            return EVENT_PROXIMITY;
        }
    }
}
