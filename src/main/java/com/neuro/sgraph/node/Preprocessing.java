package com.neuro.sgraph.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.NodeValidationException;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.api.UpstreamSaver;

/**
 * Watches the first seconds of the stream and flags noisy channels.
 *
 * Data is passed through untouched. While collecting, running per-channel
 * means and mean squares are accumulated over the first
 * {@code collectForSeconds x samplingRate} samples. On the update after enough
 * samples have been seen, the sample standard deviation of every channel is
 * computed and channels whose deviation is an outlier (iterative z-score,
 * threshold {@value #OUTLIER_THRESHOLD}) are reported as bad.
 *
 * Formula (running statistics over n old and m new samples):
 * mean' = (mean * n + sum(x)) / (n + m)
 * meanSq' = (meanSq * n + sum(x^2)) / (n + m)
 * std = sqrt(n / (n - 1) * (meanSq - mean^2))
 */
public class Preprocessing extends ProcessorNode {
    public static final String COLLECT_FOR_SECONDS = "collectForSeconds";
    public static final double OUTLIER_THRESHOLD = 3.0;
    private static final int OUTLIER_MAX_ITERATIONS = 2;

    private static final Set<String> RESET_TRIGGERS = Set.of(COLLECT_FOR_SECONDS);
    private static final Map<String, UpstreamSaver> UPSTREAM_TRIGGERS = Map.of(SourceNode.CHANNEL_INFO,
            info -> info == null ? null : ((ChannelInfo) info).channelNames());

    private double collectForSeconds;

    private ChannelInfo channelInfo;
    private long samplesCollected;
    private long samplesToBeCollected;
    private boolean enoughCollected;
    private double[] means;
    private double[] meanSquares;
    private List<Integer> badChannelIndices = List.of();

    public Preprocessing(String name, double collectForSeconds) {
        super(name);
        try (SuppressionScope ignored = suppressResets()) {
            setCollectForSeconds(collectForSeconds);
        }
    }

    public Preprocessing(String name) {
        this(name, 60);
    }

    public double getCollectForSeconds() {
        return collectForSeconds;
    }

    public void setCollectForSeconds(double seconds) {
        if (!(seconds > 0) || Double.isInfinite(seconds))
            throw new NodeValidationException("collectForSeconds must be a positive number, got " + seconds);
        this.collectForSeconds = seconds;
        attributeChanged(COLLECT_FOR_SECONDS);
    }

    public long getSamplesCollected() {
        return samplesCollected;
    }

    public boolean isEnoughCollected() {
        return enoughCollected;
    }

    public List<Integer> getBadChannelIndices() {
        return badChannelIndices;
    }

    /** Names of the channels flagged as outliers, in channel order. */
    public List<String> getDetectedBadChannels() {
        List<String> names = new ArrayList<>(badChannelIndices.size());
        for (int i : badChannelIndices)
            names.add(channelInfo.channelNames().get(i));
        return Collections.unmodifiableList(names);
    }

    @Override
    protected Set<String> resetTriggers() {
        return RESET_TRIGGERS;
    }

    @Override
    protected Map<String, UpstreamSaver> upstreamReinitTriggers() {
        return UPSTREAM_TRIGGERS;
    }

    @Override
    protected void onInitialize() {
        channelInfo = findUpstreamAttribute(SourceNode.CHANNEL_INFO, ChannelInfo.class);
        resetStatistics();
    }

    @Override
    protected void onUpdate() {
        SignalBlock in = input();
        if (samplesCollected < samplesToBeCollected) {
            updateStatistics(in);
        } else if (!enoughCollected) {
            enoughCollected = true;
            badChannelIndices = findOutliers(standardDeviations());
            if (!badChannelIndices.isEmpty())
                log.warn("{} detected bad channels {}", name(), getDetectedBadChannels());
        }
        setOutput(in);
    }

    @Override
    protected boolean onReset() {
        resetStatistics();
        return true;
    }

    @Override
    protected void onInputHistoryInvalidation() {
        resetStatistics();
    }

    private void resetStatistics() {
        int channels = channelInfo.channelCount();
        samplesToBeCollected = (long) Math.ceil(collectForSeconds * channelInfo.samplingRate());
        samplesCollected = 0;
        enoughCollected = false;
        means = new double[channels];
        meanSquares = new double[channels];
        badChannelIndices = List.of();
    }

    private void updateStatistics(SignalBlock in) {
        if (in.channelCount() != means.length)
            throw new IllegalStateException(name() + " expected " + means.length + " channels, got "
                    + in.channelCount());
        long n = samplesCollected;
        int m = in.sampleCount();
        for (int c = 0; c < means.length; c++) {
            double sum = 0, sumSq = 0;
            for (int t = 0; t < m; t++) {
                double x = in.valueAt(c, t);
                sum += x;
                sumSq += x * x;
            }
            means[c] = (means[c] * n + sum) / (n + m);
            meanSquares[c] = (meanSquares[c] * n + sumSq) / (n + m);
        }
        samplesCollected += m;
    }

    private double[] standardDeviations() {
        long n = samplesCollected;
        double[] std = new double[means.length];
        if (n < 2)
            return std;
        for (int c = 0; c < std.length; c++) {
            double variance = (double) n / (n - 1) * (meanSquares[c] - means[c] * means[c]);
            std[c] = Math.sqrt(Math.max(variance, 0));
        }
        return std;
    }

    /** Indices whose |z-score| exceeds the threshold, re-scored without earlier outliers. */
    static List<Integer> findOutliers(double[] values) {
        boolean[] bad = new boolean[values.length];
        for (int iter = 0; iter < OUTLIER_MAX_ITERATIONS; iter++) {
            double sum = 0;
            int count = 0;
            for (int i = 0; i < values.length; i++) {
                if (!bad[i]) {
                    sum += values[i];
                    count++;
                }
            }
            if (count < 2)
                break;
            double mean = sum / count, sq = 0;
            for (int i = 0; i < values.length; i++)
                if (!bad[i])
                    sq += (values[i] - mean) * (values[i] - mean);
            double std = Math.sqrt(sq / count);
            if (std == 0)
                break;

            boolean found = false;
            for (int i = 0; i < values.length; i++) {
                if (!bad[i] && Math.abs(values[i] - mean) / std > OUTLIER_THRESHOLD) {
                    bad[i] = true;
                    found = true;
                }
            }
            if (!found)
                break;
        }
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < bad.length; i++)
            if (bad[i])
                out.add(i);
        return Collections.unmodifiableList(out);
    }
}
