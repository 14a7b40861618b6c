package com.platform.datakeeper.action.plugins;

import com.platform.datakeeper.action.ActionContext;
import com.platform.datakeeper.action.ActionPlugin;
import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.data.SampleMatrix;
import com.platform.datakeeper.error.ActionExecutionException;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.ChannelSelection;
import com.platform.datakeeper.policy.DownsampleMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Temporal/spatial downsampling. Methods run in declaration order, each on the
 * previous result; {@code apply_to_channels} narrows the channels before reduction.
 * With {@code preserve_original=false} the result replaces the source.
 */
@Slf4j
@Component
public class DownsamplePlugin implements ActionPlugin {
    
    @Override
    public String kind() {
        return ActionSpec.TRANSFORM;
    }
    
    @Override
    public Outcome execute(DataUnit unit, ActionSpec spec, ActionContext context) throws IOException {
        ActionSpec.Transform transform = (ActionSpec.Transform) spec;
        long bytesBefore = context.store().sizeOf(unit);
        
        SampleMatrix data = context.store().read(unit);
        Map<String, Object> attributes = new HashMap<>();
        double sampleRate = unit.attributeAsDouble(DataUnit.SAMPLE_RATE_HZ, Double.NaN);
        double spacing = unit.attributeAsDouble(DataUnit.CHANNEL_SPACING_M, Double.NaN);
        List<String> applied = new ArrayList<>();
        
        for (DownsampleMethod method : transform.methods()) {
            int[] channels;
            try {
                channels = ChannelSelection.resolve(method.applyToChannels(), unit.attributes(), data.channels());
            } catch (IllegalArgumentException e) {
                throw ActionExecutionException.constraint(unit.path() + ": " + e.getMessage());
            }
            if (channels.length == 0) {
                throw ActionExecutionException.constraint(unit.path() + ": channel selection is empty");
            }
            if (channels.length != data.channels()) {
                data = data.selectChannels(channels);
            }
            
            data = Downsampler.reduce(data, method.dimension(), method.algorithm(), method.factor());
            
            if (method.dimension() == DownsampleMethod.Dimension.TEMPORAL) {
                sampleRate = sampleRate / method.factor();
            } else {
                spacing = spacing * method.factor();
            }
            applied.add(method.dimension().name().toLowerCase(Locale.ROOT) + "-"
                + method.algorithm().name().toLowerCase(Locale.ROOT) + "-x" + method.factor());
        }
        
        if (!Double.isNaN(sampleRate)) {
            attributes.put(DataUnit.SAMPLE_RATE_HZ, sampleRate);
        }
        if (!Double.isNaN(spacing)) {
            attributes.put(DataUnit.CHANNEL_SPACING_M, spacing);
        }
        attributes.put("downsampled", String.join(",", applied));
        
        boolean replace = !transform.preserveOriginal();
        DataUnit written = context.store().write(unit, "downsampled", data, attributes, replace);
        long bytesAfter = replace 
            ? context.store().sizeOf(written) 
            : bytesBefore + context.store().sizeOf(written);
        
        log.info("Downsampled {} -> {} ({} x {}, {})", unit.path(), written.path(), 
            data.samples(), data.channels(), String.join(", ", applied));
        return new Outcome(applied, bytesBefore, bytesAfter, Outcome.Disposition.TRANSFORMED, written.path());
    }
}
