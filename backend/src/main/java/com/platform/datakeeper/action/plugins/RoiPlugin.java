package com.platform.datakeeper.action.plugins;

import com.platform.datakeeper.action.ActionContext;
import com.platform.datakeeper.action.ActionPlugin;
import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.data.SampleMatrix;
import com.platform.datakeeper.error.ActionExecutionException;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.ChannelSelection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Copies a channel range into a new unit next to the source. The source is untouched.
 */
@Slf4j
@Component
public class RoiPlugin implements ActionPlugin {
    
    @Override
    public String kind() {
        return ActionSpec.ROI;
    }
    
    @Override
    public Outcome execute(DataUnit unit, ActionSpec spec, ActionContext context) throws IOException {
        ActionSpec.Roi roi = (ActionSpec.Roi) spec;
        long bytesBefore = context.store().sizeOf(unit);
        SampleMatrix data = context.store().read(unit);
        
        int[] channels;
        try {
            channels = ChannelSelection.resolve(roi.channels(), unit.attributes(), data.channels());
        } catch (IllegalArgumentException e) {
            throw ActionExecutionException.constraint(unit.path() + ": " + e.getMessage());
        }
        if (channels.length == 0) {
            throw ActionExecutionException.constraint(unit.path() + ": empty channel range");
        }
        
        int first = channels[0];
        int last = channels[channels.length - 1];
        double spacing = unit.attributeAsDouble(DataUnit.CHANNEL_SPACING_M, Double.NaN);
        double origin = unit.attributeAsDouble(DataUnit.CHANNEL_ORIGIN_M, 0.0);
        
        Map<String, Object> attributes = Double.isNaN(spacing)
            ? Map.of("roi_channels", roi.channels())
            : Map.of("roi_channels", roi.channels(), DataUnit.CHANNEL_ORIGIN_M, origin + first * spacing);
        
        DataUnit written = context.store().write(unit, "roi_" + first + "-" + last,
            data.selectChannels(channels), attributes, false);
        
        log.info("Extracted channels {}..{} of {} into {}", first, last, unit.path(), written.path());
        return new Outcome(List.of("roi-extract"), bytesBefore, bytesBefore + context.store().sizeOf(written),
            Outcome.Disposition.EXTRACTED, written.path());
    }
}
