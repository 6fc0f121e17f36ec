package com.neuro.sgraph.node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.NodeValidationException;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.api.UpstreamSaver;

/**
 * Keeps the most recent blocks that reached it, up to {@code capacity}.
 *
 * Stands in for a file writer or a plotting buffer: whatever consumes the
 * recording reads {@link #getRecorded()} between ticks. A change of the
 * upstream channel layout starts a new recording; a history invalidation is
 * counted as a discontinuity but keeps what was recorded.
 */
public class RecordingOutput extends OutputNode {
    public static final String CAPACITY = "capacity";

    private static final Set<String> RESET_TRIGGERS = Set.of(CAPACITY);
    private static final Map<String, UpstreamSaver> UPSTREAM_TRIGGERS = Map.of(SourceNode.CHANNEL_INFO,
            info -> info == null ? null : ((ChannelInfo) info).channelNames());

    private final Deque<SignalBlock> recorded = new ArrayDeque<>();
    private int capacity;
    private ChannelInfo channelInfo;
    private long blocksReceived;
    private int discontinuities;

    public RecordingOutput(String name, int capacity) {
        super(name);
        try (SuppressionScope ignored = suppressResets()) {
            setCapacity(capacity);
        }
    }

    public RecordingOutput(String name) {
        this(name, 1024);
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        if (capacity <= 0)
            throw new NodeValidationException("Capacity must be positive, got " + capacity);
        this.capacity = capacity;
        attributeChanged(CAPACITY);
    }

    /** Recorded blocks, oldest first. */
    public List<SignalBlock> getRecorded() {
        return List.copyOf(recorded);
    }

    public SignalBlock getLastBlock() {
        SignalBlock last = recorded.peekLast();
        return last == null ? SignalBlock.EMPTY : last;
    }

    public long getBlocksReceived() {
        return blocksReceived;
    }

    public int getDiscontinuities() {
        return discontinuities;
    }

    /** Descriptor of the channels being recorded, as seen at initialization. */
    public ChannelInfo getChannelInfo() {
        return channelInfo;
    }

    /** Concatenates the recorded blocks along the time axis. */
    public SignalBlock concatenated() {
        if (recorded.isEmpty())
            return SignalBlock.EMPTY;
        int channels = recorded.peekFirst().channelCount();
        int total = 0;
        for (SignalBlock b : recorded)
            total += b.sampleCount();
        double[][] out = new double[channels][total];
        int offset = 0;
        for (SignalBlock b : recorded) {
            for (int c = 0; c < channels; c++)
                System.arraycopy(b.channel(c), 0, out[c], offset, b.sampleCount());
            offset += b.sampleCount();
        }
        return SignalBlock.wrap(out);
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
        recorded.clear();
        blocksReceived = 0;
        discontinuities = 0;
    }

    @Override
    protected void onUpdate() {
        recorded.addLast(input());
        blocksReceived++;
        trim();
    }

    @Override
    protected boolean onReset() {
        trim();
        return false;
    }

    @Override
    protected void onInputHistoryInvalidation() {
        discontinuities++;
    }

    private void trim() {
        while (recorded.size() > capacity)
            recorded.pollFirst();
    }

    @Override
    public String toString() {
        List<String> shapes = new ArrayList<>();
        for (SignalBlock b : recorded)
            shapes.add(b.channelCount() + "x" + b.sampleCount());
        return super.toString() + shapes;
    }
}
