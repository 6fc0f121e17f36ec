package com.neuro.sgraph.node;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.NodeValidationException;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.api.UpstreamSaver;

/**
 * Amplitude envelope of every channel by exponential smoothing of the
 * rectified signal.
 *
 * Formula (per channel, sample by sample):
 * y[t] = factor * y[t-1] + (1 - factor) * |x[t]|
 *
 * The smoother state survives across ticks; it is zeroed when the input
 * history is invalidated. Changing the method or the factor rebuilds the node.
 */
public class EnvelopeExtractor extends ProcessorNode {
    public static final String METHOD = "method";
    public static final String FACTOR = "factor";
    public static final String EXPONENTIAL_SMOOTHING = "Exponential smoothing";
    public static final List<String> SUPPORTED_METHODS = List.of(EXPONENTIAL_SMOOTHING);

    private static final Set<String> RESET_TRIGGERS = Set.of(METHOD, FACTOR);
    private static final Map<String, UpstreamSaver> UPSTREAM_TRIGGERS = Map.of(SourceNode.CHANNEL_INFO,
            info -> info == null ? null : ((ChannelInfo) info).channelCount());

    private String method = EXPONENTIAL_SMOOTHING;
    private double factor;
    private double[] state;

    public EnvelopeExtractor(String name, double factor) {
        super(name);
        try (SuppressionScope ignored = suppressResets()) {
            setFactor(factor);
        }
    }

    public EnvelopeExtractor(String name) {
        this(name, 0.9);
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        if (!SUPPORTED_METHODS.contains(method))
            throw new NodeValidationException("Method " + method + " is not supported. Use one of: "
                    + SUPPORTED_METHODS);
        this.method = method;
        attributeChanged(METHOD);
    }

    public double getFactor() {
        return factor;
    }

    public void setFactor(double factor) {
        if (!(factor > 0 && factor < 1))
            throw new NodeValidationException("Factor must be a number between 0 and 1, got " + factor);
        this.factor = factor;
        attributeChanged(FACTOR);
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
        ChannelInfo info = findUpstreamAttribute(SourceNode.CHANNEL_INFO, ChannelInfo.class);
        state = new double[info.channelCount()];
    }

    @Override
    protected void onUpdate() {
        SignalBlock in = input();
        if (in.channelCount() != state.length)
            throw new IllegalStateException(name() + " expected " + state.length + " channels, got "
                    + in.channelCount());

        int samples = in.sampleCount();
        double[][] out = new double[state.length][samples];
        for (int c = 0; c < state.length; c++) {
            double y = state[c];
            for (int t = 0; t < samples; t++) {
                y = factor * y + (1.0 - factor) * Math.abs(in.valueAt(c, t));
                out[c][t] = y;
            }
            state[c] = y;
        }
        setOutput(SignalBlock.wrap(out));
    }

    @Override
    protected boolean onReset() {
        requestReinitialize();
        initialize();
        return true;
    }

    @Override
    protected void onInputHistoryInvalidation() {
        Arrays.fill(state, 0.0);
    }
}
