package com.platform.datakeeper.policy;

/**
 * One reduction step of a transform action.
 *
 * @param factor group size, always positive
 * @param applyToChannels channel selection expression, {@code all} when omitted
 */
public record DownsampleMethod(
    Dimension dimension,
    Aggregation algorithm,
    int factor,
    String applyToChannels
) {
    
    public enum Dimension {
        TEMPORAL,
        SPATIAL
    }
    
    public enum Aggregation {
        MEAN,
        SUM
    }
}
