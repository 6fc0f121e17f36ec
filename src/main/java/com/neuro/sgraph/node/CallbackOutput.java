package com.neuro.sgraph.node;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.api.UpstreamSaver;

/**
 * Hands every non-empty upstream block to a consumer, typically a renderer.
 *
 * The consumer receives the block by reference; blocks are immutable, so it
 * may keep them. When the upstream channel descriptor changes, the node
 * reinitializes and the optional descriptor consumer is told first.
 */
public class CallbackOutput extends OutputNode {
    private static final Map<String, UpstreamSaver> UPSTREAM_TRIGGERS = Map.of(SourceNode.CHANNEL_INFO,
            UpstreamSaver.IDENTITY);

    private final Consumer<SignalBlock> sink;
    private final Consumer<ChannelInfo> channelInfoListener;

    public CallbackOutput(String name, Consumer<SignalBlock> sink, Consumer<ChannelInfo> channelInfoListener) {
        super(name);
        this.sink = Objects.requireNonNull(sink, "sink");
        this.channelInfoListener = channelInfoListener;
    }

    public CallbackOutput(String name, Consumer<SignalBlock> sink) {
        this(name, sink, null);
    }

    @Override
    protected Set<String> resetTriggers() {
        return Set.of();
    }

    @Override
    protected Map<String, UpstreamSaver> upstreamReinitTriggers() {
        return UPSTREAM_TRIGGERS;
    }

    @Override
    protected void onInitialize() {
        ChannelInfo info = findUpstreamAttribute(SourceNode.CHANNEL_INFO, ChannelInfo.class);
        if (channelInfoListener != null)
            channelInfoListener.accept(info);
    }

    @Override
    protected void onUpdate() {
        sink.accept(input());
    }

    @Override
    protected boolean onReset() {
        return false;
    }

    @Override
    protected void onInputHistoryInvalidation() {
    }
}
