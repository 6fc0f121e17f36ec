package com.neuro.sgraph.api;

import java.util.Arrays;

/**
 * An immutable chunk of multichannel samples, laid out channels x time.
 *
 * The layout is fixed for the whole process: axis 0 is the channel, axis 1
 * ({@link #TIME_AXIS}) is the sample. Every node output, and every block a
 * source receives, uses this convention.
 *
 * Ownership:
 * A block never changes after construction. Nodes produce a new block on every
 * update instead of writing into the previous one, so a listener that keeps a
 * reference past the next tick still sees the values it was given. Data
 * entering through {@link #of(double[][])} is copied; {@link #wrap(double[][])}
 * takes ownership of the caller's array and is meant for producers that have
 * just allocated it.
 */
public final class SignalBlock {
    public static final int TIME_AXIS = 1;

    /** The "nothing to emit" value. */
    public static final SignalBlock EMPTY = new SignalBlock(new double[0][0], 0);

    private final double[][] data;
    private final int sampleCount;

    private SignalBlock(double[][] data, int sampleCount) {
        this.data = data;
        this.sampleCount = sampleCount;
    }

    /** Copies the given channels x time array into a new block. */
    public static SignalBlock of(double[][] data) {
        double[][] copy = new double[data.length][];
        for (int c = 0; c < data.length; c++)
            copy[c] = data[c].clone();
        return wrap(copy);
    }

    /**
     * Wraps an array without copying it. The caller must not write to the array
     * afterwards.
     */
    public static SignalBlock wrap(double[][] data) {
        if (data.length == 0)
            return EMPTY;
        int samples = data[0].length;
        for (int c = 1; c < data.length; c++) {
            if (data[c].length != samples)
                throw new NodeValidationException("Ragged block: channel 0 has " + samples
                        + " samples but channel " + c + " has " + data[c].length);
        }
        return new SignalBlock(data, samples);
    }

    public static SignalBlock zeros(int channels, int samples) {
        return wrap(new double[channels][samples]);
    }

    public int channelCount() {
        return data.length;
    }

    public int sampleCount() {
        return sampleCount;
    }

    /** True when the block carries no samples at all. */
    public boolean isEmpty() {
        return data.length == 0 || sampleCount == 0;
    }

    public double valueAt(int channel, int sample) {
        return data[channel][sample];
    }

    /** Returns a copy of one channel's samples. */
    public double[] channel(int channel) {
        return data[channel].clone();
    }

    /** Returns a deep copy of the samples. */
    public double[][] toArray() {
        double[][] copy = new double[data.length][];
        for (int c = 0; c < data.length; c++)
            copy[c] = data[c].clone();
        return copy;
    }

    public static boolean isNullOrEmpty(SignalBlock block) {
        return block == null || block.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignalBlock other))
            return false;
        return sampleCount == other.sampleCount && Arrays.deepEquals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(data);
    }

    @Override
    public String toString() {
        return "SignalBlock[" + channelCount() + "x" + sampleCount + "]";
    }
}
