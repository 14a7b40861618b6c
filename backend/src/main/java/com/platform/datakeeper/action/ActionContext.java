package com.platform.datakeeper.action;

import com.platform.datakeeper.data.DataStoreAdapter;
import com.platform.datakeeper.job.EventWindow;
import com.platform.datakeeper.policy.ActionSpec;

import java.time.Instant;

/**
 * What a plugin may use besides the unit and its spec.
 *
 * @param baseRetention the owning policy's first retention action, null if it has none
 * @param eventWindow window of the event that fired the job, null for other triggers
 */
public record ActionContext(
    String jobId,
    DataStoreAdapter store,
    Instant now,
    ActionSpec.Retention baseRetention,
    EventWindow eventWindow
) {
}
