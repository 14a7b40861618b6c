package com.platform.datakeeper.scheduler;

import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.IntakeException;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Metric values for one tick, plus the sources that could not be read.
 */
public record MetricSnapshot(
    Map<String, Double> values,
    Map<String, String> failures,
    Instant takenAt
) {
    
    public MetricSnapshot {
        values = Map.copyOf(values);
        failures = Map.copyOf(failures);
    }
    
    /**
     * Fails when a needed metric is absent while some source is down, since the
     * missing value may belong to that source.
     *
     * @throws IntakeException to skip the dependent trigger this tick
     */
    public void requireAvailable(Collection<String> paths) {
        if (failures.isEmpty()) {
            return;
        }
        for (String path : paths) {
            if (!values.containsKey(path)) {
                throw new IntakeException(ErrorCode.INTAKE_UNAVAILABLE, String.join(",", failures.keySet()),
                    "metric '" + path + "' unavailable: " + failures);
            }
        }
    }
}
