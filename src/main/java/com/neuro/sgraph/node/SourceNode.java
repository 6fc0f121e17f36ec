package com.neuro.sgraph.node;

import java.util.Map;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.Node;
import com.neuro.sgraph.api.NodeValidationException;
import com.neuro.sgraph.api.ProtocolViolationException;
import com.neuro.sgraph.api.UpstreamSaver;

/**
 * A node that reads data from outside the pipeline.
 *
 * Sources have no upstream. Their {@link #onInitialize()} must publish a
 * channel descriptor through {@link #publishChannelInfo(ChannelInfo)}; the
 * descriptor is checked right after and a missing, empty or inconsistent one
 * leaves the source uninitialized. Downstream nodes find it under the
 * {@value #CHANNEL_INFO} attribute.
 *
 * A reset of a source is a full reinitialization, and always invalidates the
 * history of everything downstream.
 */
public abstract non-sealed class SourceNode extends AbstractNode {
    public static final String CHANNEL_INFO = "channelInfo";

    private ChannelInfo channelInfo;

    protected SourceNode(String name) {
        super(name);
    }

    /** Makes {@code info} visible to downstream nodes. Call from onInitialize(). */
    protected final void publishChannelInfo(ChannelInfo info) {
        this.channelInfo = info;
    }

    /** The descriptor published by the last successful initialization, or null. */
    public final ChannelInfo channelInfo() {
        return channelInfo;
    }

    /** Sampling rate of the published descriptor. */
    public final double frequency() {
        if (channelInfo == null)
            throw new IllegalStateException(name() + " has not published a channel descriptor yet");
        return channelInfo.samplingRate();
    }

    /** False once the source will not produce any more data. */
    public boolean isAlive() {
        return true;
    }

    @Override
    public void setUpstream(Node value) {
        if (value != null)
            throw new ProtocolViolationException("Source " + name() + " cannot have an upstream");
        super.setUpstream(null);
    }

    @Override
    protected final Map<String, UpstreamSaver> upstreamReinitTriggers() {
        return Map.of();
    }

    @Override
    protected final void prepareInitialization() {
        channelInfo = null;
    }

    @Override
    protected final void checkInitialization() {
        String hint = " Check the onInitialize() method";
        if (channelInfo == null)
            throw new NodeValidationException(name() + " node has empty channelInfo attribute." + hint);
        try {
            channelInfo.checkConsistency();
        } catch (NodeValidationException e) {
            channelInfo = null;
            throw new NodeValidationException(
                    "The channelInfo attribute of " + name() + " node is not self-consistent." + hint, e);
        }
    }

    /** There is nothing to reset: go ahead and initialize. */
    @Override
    protected boolean onReset() {
        requestReinitialize();
        initialize();
        return true;
    }

    @Override
    protected void onInputHistoryInvalidation() {
    }

    @Override
    public boolean exposesAttribute(String attribute) {
        return CHANNEL_INFO.equals(attribute);
    }

    @Override
    public Object attributeValue(String attribute) {
        if (CHANNEL_INFO.equals(attribute))
            return channelInfo;
        return super.attributeValue(attribute);
    }
}
