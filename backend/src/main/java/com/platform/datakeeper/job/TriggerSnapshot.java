package com.platform.datakeeper.job;

import com.platform.datakeeper.policy.TriggerSpec;

import java.time.Instant;

/**
 * What fired a job, stored verbatim in {@code job.trigger_spec}.
 *
 * @param window set only for event triggers
 */
public record TriggerSnapshot(
    TriggerSpec trigger,
    Instant firedAt,
    EventWindow window
) {
    
    public static TriggerSnapshot of(TriggerSpec trigger, Instant firedAt) {
        return new TriggerSnapshot(trigger, firedAt, null);
    }
}
