package com.platform.datakeeper.action.plugins;

import com.platform.datakeeper.action.ActionContext;
import com.platform.datakeeper.action.ActionPlugin;
import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.policy.ActionSpec;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Keeps units whose timestamp lies in {@code [from, to]}; others get the policy's base retention.
 */
@Component
public class TimeWindowPlugin implements ActionPlugin {
    
    @Override
    public String kind() {
        return ActionSpec.TIME_WINDOW;
    }
    
    @Override
    public Outcome execute(DataUnit unit, ActionSpec spec, ActionContext context) throws IOException {
        ActionSpec.TimeWindow window = (ActionSpec.TimeWindow) spec;
        
        boolean inside = !unit.timestamp().isBefore(window.from()) && !unit.timestamp().isAfter(window.to());
        if (inside) {
            return Outcome.retained(context.store().sizeOf(unit), 
                "inside window " + window.from() + " .. " + window.to());
        }
        if (context.baseRetention() == null) {
            return Outcome.retained(context.store().sizeOf(unit), "outside window, policy has no base retention");
        }
        return RetentionPlugin.apply(unit, context.baseRetention(), context);
    }
}
