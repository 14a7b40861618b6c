package com.platform.datakeeper.data;

/**
 * Dense samples of one unit: row = time sample, column = channel.
 */
public final class SampleMatrix {
    
    private final double[][] values;
    private final int channels;
    
    public SampleMatrix(double[][] values) {
        this.values = values;
        this.channels = values.length == 0 ? 0 : values[0].length;
        for (double[] row : values) {
            if (row.length != channels) {
                throw new IllegalArgumentException("ragged sample matrix: expected "
                    + channels + " channels, got " + row.length);
            }
        }
    }
    
    public int samples() {
        return values.length;
    }
    
    public int channels() {
        return channels;
    }
    
    public double get(int sample, int channel) {
        return values[sample][channel];
    }
    
    public double[] row(int sample) {
        return values[sample].clone();
    }
    
    /**
     * Keeps the given channels, in the given order.
     */
    public SampleMatrix selectChannels(int[] selected) {
        double[][] out = new double[values.length][selected.length];
        for (int t = 0; t < values.length; t++) {
            for (int c = 0; c < selected.length; c++) {
                out[t][c] = values[t][selected[c]];
            }
        }
        return new SampleMatrix(out);
    }
    
    /**
     * Keeps samples in {@code [from, to)}.
     */
    public SampleMatrix sliceSamples(int from, int to) {
        double[][] out = new double[Math.max(0, to - from)][];
        for (int t = from; t < to; t++) {
            out[t - from] = values[t].clone();
        }
        return new SampleMatrix(out);
    }
}
