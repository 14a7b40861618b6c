package com.platform.datakeeper.action.plugins;

import com.platform.datakeeper.data.SampleMatrix;
import com.platform.datakeeper.policy.DownsampleMethod.Aggregation;
import com.platform.datakeeper.policy.DownsampleMethod.Dimension;

/**
 * Group-and-combine reduction along time (rows) or space (columns).
 * 
 * Consecutive runs of {@code factor} samples or channels form one output value.
 * A remainder shorter than {@code factor} at the tail is combined as a short group,
 * so {@code n} inputs always give {@code ceil(n / factor)} outputs; its mean is over
 * the members it actually has.
 */
public final class Downsampler {
    
    private Downsampler() {
    }
    
    public static int groupCount(int length, int factor) {
        if (factor <= 0) {
            throw new IllegalArgumentException("factor must be positive, got " + factor);
        }
        return (length + factor - 1) / factor;
    }
    
    public static SampleMatrix reduce(SampleMatrix input, Dimension dimension, Aggregation aggregation, int factor) {
        return dimension == Dimension.TEMPORAL 
            ? temporal(input, aggregation, factor) 
            : spatial(input, aggregation, factor);
    }
    
    public static SampleMatrix temporal(SampleMatrix input, Aggregation aggregation, int factor) {
        int groups = groupCount(input.samples(), factor);
        double[][] out = new double[groups][input.channels()];
        
        for (int g = 0; g < groups; g++) {
            int start = g * factor;
            int end = Math.min(start + factor, input.samples());
            for (int c = 0; c < input.channels(); c++) {
                double sum = 0;
                for (int t = start; t < end; t++) {
                    sum += input.get(t, c);
                }
                out[g][c] = combine(sum, end - start, aggregation);
            }
        }
        return new SampleMatrix(out);
    }
    
    public static SampleMatrix spatial(SampleMatrix input, Aggregation aggregation, int factor) {
        int groups = groupCount(input.channels(), factor);
        double[][] out = new double[input.samples()][groups];
        
        for (int t = 0; t < input.samples(); t++) {
            for (int g = 0; g < groups; g++) {
                int start = g * factor;
                int end = Math.min(start + factor, input.channels());
                double sum = 0;
                for (int c = start; c < end; c++) {
                    sum += input.get(t, c);
                }
                out[t][g] = combine(sum, end - start, aggregation);
            }
        }
        return new SampleMatrix(out);
    }
    
    private static double combine(double sum, int size, Aggregation aggregation) {
        return aggregation == Aggregation.MEAN ? sum / size : sum;
    }
}
