package com.platform.datakeeper.scheduler;

import java.util.Map;

/**
 * External metric feed read by condition triggers (e.g. storage utilization).
 * Reads are bounded by the intake time limit; implementations may block.
 */
public interface MetricSource {
    
    String name();
    
    /**
     * Current values keyed by dotted metric name ({@code storage.utilization}).
     *
     * @throws com.platform.datakeeper.error.IntakeException when the feed is unreachable or malformed
     */
    Map<String, Double> read();
}
