package com.neuro.sgraph.node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Set;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.NodeValidationException;
import com.neuro.sgraph.api.SignalBlock;

/**
 * A source fed by the caller.
 *
 * Blocks are queued with {@link #push(SignalBlock)} and emitted one per
 * update, oldest first; an update with nothing queued emits the empty block.
 * This is the hand-off point for acquisition code (a device driver, a file
 * reader, a ring buffer consumer) that lives outside the pipeline.
 *
 * Changing the channel descriptor schedules a reset, which for a source means
 * a full reinitialization; blocks already queued with a channel count that no
 * longer matches are dropped at that point.
 */
public class StreamSource extends SourceNode {
    private static final Set<String> RESET_TRIGGERS = Set.of(CHANNEL_INFO);

    private final Deque<SignalBlock> queue = new ArrayDeque<>();
    private ChannelInfo configuredInfo;
    private boolean closed;

    public StreamSource(String name, ChannelInfo channelInfo) {
        super(name);
        this.configuredInfo = Objects.requireNonNull(channelInfo, "channelInfo");
    }

    public ChannelInfo getConfiguredChannelInfo() {
        return configuredInfo;
    }

    public void setChannelInfo(ChannelInfo channelInfo) {
        this.configuredInfo = Objects.requireNonNull(channelInfo, "channelInfo");
        attributeChanged(CHANNEL_INFO);
    }

    /**
     * Queues a block for a later update.
     *
     * @throws NodeValidationException if the block's channel count does not
     *                                 match the configured descriptor.
     * @throws IllegalStateException   if the source was closed.
     */
    public void push(SignalBlock block) {
        if (closed)
            throw new IllegalStateException("Source " + name() + " is closed");
        if (block.isEmpty())
            return;
        if (block.channelCount() != configuredInfo.channelCount())
            throw new NodeValidationException("Block has " + block.channelCount() + " channels but " + name()
                    + " is configured for " + configuredInfo.channelCount());
        queue.addLast(block);
    }

    /** Number of blocks waiting to be emitted. */
    public int pending() {
        return queue.size();
    }

    /** Stops accepting blocks. The source dies once the queue is drained. */
    public void close() {
        closed = true;
    }

    @Override
    public boolean isAlive() {
        return !closed || !queue.isEmpty();
    }

    @Override
    protected Set<String> resetTriggers() {
        return RESET_TRIGGERS;
    }

    @Override
    protected void onInitialize() {
        int channels = configuredInfo.channelCount();
        int before = queue.size();
        queue.removeIf(b -> b.channelCount() != channels);
        if (queue.size() != before)
            log.warn("Dropped {} queued blocks of {} that no longer match {} channels", before - queue.size(),
                    name(), channels);
        publishChannelInfo(configuredInfo);
    }

    @Override
    protected void onUpdate() {
        SignalBlock next = queue.pollFirst();
        setOutput(next == null ? SignalBlock.EMPTY : next);
    }
}
