package com.platform.datakeeper.policy;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A named lifecycle rule: which data it governs ({@link Selector}), when it acts
 * ({@link TriggerSpec}) and what it does ({@link ActionSpec}).
 * 
 * Instances are immutable; a reload produces new instances with the same ids.
 */
@Value
@Builder(toBuilder = true)
public class Policy {
    
    String id;
    String name;
    String description;
    String policyFile;
    boolean enabled;
    
    /**
     * Default retention strategy when an action does not name one.
     */
    @Builder.Default
    String strategy = "default";
    
    Selector selector;
    
    @Builder.Default
    List<String> operations = List.of();
    
    @Builder.Default
    List<TriggerSpec> triggers = List.of();
    
    @Builder.Default
    List<ActionSpec> actions = List.of();
    
    Instant createdAt;
    Instant updatedAt;
    
    /**
     * Stable key of the trigger at {@code index}, used for duplicate suppression.
     */
    public String triggerKey(int index) {
        return id + "#" + index;
    }
    
    /**
     * The first retention action, applied to data that time-window and
     * event-proximity actions do not protect.
     */
    public ActionSpec.Retention baseRetention() {
        for (ActionSpec action : actions) {
            if (action instanceof ActionSpec.Retention retention) {
                return retention;
            }
        }
        return null;
    }
}
