package com.platform.datakeeper.action.plugins;

import com.platform.datakeeper.action.ActionContext;
import com.platform.datakeeper.action.ActionPlugin;
import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.data.SampleMatrix;
import com.platform.datakeeper.error.ActionExecutionException;
import com.platform.datakeeper.job.EventWindow;
import com.platform.datakeeper.policy.ActionSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Protects the part of a unit near an external event and hands the unit to the
 * policy's base retention.
 * 
 * Channel {@code c} sits at {@code channel_origin_m + c * channel_spacing_m} along the
 * fiber; sample {@code t} at {@code timestamp + t / sample_rate_hz}. Channels within
 * {@code radius_km} of the event position and samples within {@code window_seconds}
 * of the event time are written to a new unit before base retention runs on the source.
 */
@Slf4j
@Component
public class EventProximityPlugin implements ActionPlugin {
    
    @Override
    public String kind() {
        return ActionSpec.EVENT_PROXIMITY;
    }
    
    @Override
    public Outcome execute(DataUnit unit, ActionSpec spec, ActionContext context) throws IOException {
        ActionSpec.EventProximity proximity = (ActionSpec.EventProximity) spec;
        EventWindow window = effectiveWindow(proximity, context.eventWindow());
        
        if (window == null) {
            log.debug("No event attached to job {}, applying base retention only", context.jobId());
            return baseRetention(unit, context, List.of(), 0, null);
        }
        
        long bytesBefore = context.store().sizeOf(unit);
        SampleMatrix data = context.store().read(unit);
        
        double sampleRate = requireAttribute(unit, DataUnit.SAMPLE_RATE_HZ);
        double spacing = requireAttribute(unit, DataUnit.CHANNEL_SPACING_M);
        double origin = unit.attributeAsDouble(DataUnit.CHANNEL_ORIGIN_M, 0.0);
        
        List<Integer> channels = new ArrayList<>();
        for (int c = 0; c < data.channels(); c++) {
            double position = origin + c * spacing;
            if (position >= window.fromM() && position <= window.toM()) {
                channels.add(c);
            }
        }
        
        int firstSample = sampleIndexAtOrAfter(unit.timestamp(), window.from(), sampleRate);
        int endSample = Math.min(data.samples(), sampleIndexAtOrBefore(unit.timestamp(), window.to(), sampleRate) + 1);
        firstSample = Math.max(0, firstSample);
        
        if (channels.isEmpty() || firstSample >= endSample) {
            return baseRetention(unit, context, List.of(), 0, 
                "event at " + window.positionM() + " m / " + window.eventTime() + " outside unit");
        }
        
        SampleMatrix protectedPart = data
            .sliceSamples(firstSample, endSample)
            .selectChannels(channels.stream().mapToInt(Integer::intValue).toArray());
        
        Instant sliceStart = unit.timestamp().plusNanos((long) (firstSample / sampleRate * 1_000_000_000L));
        Map<String, Object> attributes = Map.of(
            DataUnit.CHANNEL_ORIGIN_M, origin + channels.get(0) * spacing,
            "timestamp", sliceStart.toString(),
            "event_source", window.source() == null ? "unknown" : window.source(),
            "event_time", window.eventTime().toString());
        
        DataUnit written = context.store().write(unit, "event_" + window.eventTime().getEpochSecond(),
            protectedPart, attributes, false);
        long protectedBytes = context.store().sizeOf(written);
        
        log.info("Protected {} channels x {} samples of {} around event at {} m into {}",
            protectedPart.channels(), protectedPart.samples(), unit.path(), window.positionM(), written.path());
        
        Outcome base = baseRetention(unit, context, List.of("event-extract"), protectedBytes, written.path());
        return new Outcome(base.appliedOps(), bytesBefore, base.bytesAfter(), 
            base.disposition() == Outcome.Disposition.RETAINED ? Outcome.Disposition.EXTRACTED : base.disposition(),
            base.detail());
    }
    
    private Outcome baseRetention(DataUnit unit, ActionContext context, List<String> priorOps,
                                  long extraBytes, String detail) throws IOException {
        Outcome base = context.baseRetention() == null
            ? Outcome.retained(context.store().sizeOf(unit), "policy has no base retention")
            : RetentionPlugin.apply(unit, context.baseRetention(), context);
        
        List<String> ops = new ArrayList<>(priorOps);
        ops.addAll(base.appliedOps());
        String combinedDetail = detail == null ? base.detail() : detail + "; " + base.detail();
        return new Outcome(ops, base.bytesBefore(), base.bytesAfter() + extraBytes, base.disposition(), combinedDetail);
    }
    
    /**
     * The action's own radius and window override the firing event's.
     */
    static EventWindow effectiveWindow(ActionSpec.EventProximity spec, EventWindow fired) {
        if (fired == null) {
            return null;
        }
        if (spec.eventSource() != null && fired.source() != null && !spec.eventSource().equals(fired.source())) {
            return null;
        }
        return new EventWindow(
            fired.source(),
            fired.positionM(),
            fired.eventTime(),
            spec.radiusKm() != null ? spec.radiusKm() : fired.radiusKm(),
            spec.windowSeconds() != null ? spec.windowSeconds() : fired.windowSeconds());
    }
    
    private static int sampleIndexAtOrAfter(Instant start, Instant at, double sampleRate) {
        double seconds = Duration.between(start, at).toNanos() / 1_000_000_000.0;
        return (int) Math.ceil(seconds * sampleRate);
    }
    
    private static int sampleIndexAtOrBefore(Instant start, Instant at, double sampleRate) {
        double seconds = Duration.between(start, at).toNanos() / 1_000_000_000.0;
        return (int) Math.floor(seconds * sampleRate);
    }
    
    private static double requireAttribute(DataUnit unit, String key) {
        double value = unit.attributeAsDouble(key, Double.NaN);
        if (Double.isNaN(value) || value <= 0) {
            throw ActionExecutionException.constraint(unit.path() + ": attribute '" + key + "' missing or not positive");
        }
        return value;
    }
}
