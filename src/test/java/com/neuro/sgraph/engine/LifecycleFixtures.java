package com.neuro.sgraph.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.ChannelType;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.api.UpstreamSaver;
import com.neuro.sgraph.node.OutputNode;
import com.neuro.sgraph.node.ProcessorNode;
import com.neuro.sgraph.node.SourceNode;

/**
 * Hook-counting nodes shared by the lifecycle tests. Every hook call is
 * appended to a common journal as "name:hook".
 */
final class LifecycleFixtures {
    private LifecycleFixtures() {
    }

    static ChannelInfo info(int channels) {
        String[] names = new String[channels];
        for (int i = 0; i < channels; i++)
            names[i] = "Ch" + i;
        return ChannelInfo.of(100, ChannelType.EEG, names);
    }

    static final UpstreamSaver CHANNEL_COUNT = v -> v == null ? null : ((ChannelInfo) v).channelCount();

    static class QueueSource extends SourceNode {
        final List<String> journal;
        final Deque<SignalBlock> queue = new ArrayDeque<>();
        ChannelInfo info;
        int inits, updates;

        QueueSource(String name, ChannelInfo info, List<String> journal) {
            super(name);
            this.info = info;
            this.journal = journal;
        }

        void setInfo(ChannelInfo info) {
            this.info = info;
            attributeChanged(CHANNEL_INFO);
        }

        void enqueue(SignalBlock block) {
            queue.addLast(block);
        }

        @Override
        protected Set<String> resetTriggers() {
            return Set.of(CHANNEL_INFO);
        }

        @Override
        protected void onInitialize() {
            inits++;
            journal.add(name() + ":init");
            publishChannelInfo(info);
        }

        @Override
        protected void onUpdate() {
            updates++;
            journal.add(name() + ":update");
            SignalBlock next = queue.pollFirst();
            setOutput(next);
        }
    }

    /** Passes its input through; "gain" is a reset trigger, "label" is not. */
    static class IdentityProcessor extends ProcessorNode {
        static final String GAIN = "gain";
        static final String LABEL = "label";

        final List<String> journal;
        int inits, updates, resets, historyFlushes;
        boolean resetInvalidatesHistory;
        double gain = 1;
        String label = "";
        RuntimeException failOnUpdate;
        // Gains the hooks write through setGain, when set.
        Double gainOnInitialize;
        Double gainOnReset;
        String trackedAttribute = SourceNode.CHANNEL_INFO;

        IdentityProcessor(String name, List<String> journal) {
            super(name);
            this.journal = journal;
        }

        void setGain(double gain) {
            this.gain = gain;
            attributeChanged(GAIN);
        }

        void setLabel(String label) {
            this.label = label;
            attributeChanged(LABEL);
        }

        @Override
        protected Set<String> resetTriggers() {
            return Set.of(GAIN);
        }

        @Override
        protected Map<String, UpstreamSaver> upstreamReinitTriggers() {
            return Map.of(trackedAttribute, CHANNEL_COUNT);
        }

        @Override
        protected void onInitialize() {
            inits++;
            journal.add(name() + ":init");
            if (gainOnInitialize != null)
                setGain(gainOnInitialize);
        }

        @Override
        protected void onUpdate() {
            updates++;
            journal.add(name() + ":update");
            if (failOnUpdate != null)
                throw failOnUpdate;
            setOutput(input());
        }

        @Override
        protected boolean onReset() {
            resets++;
            journal.add(name() + ":reset");
            if (gainOnReset != null)
                setGain(gainOnReset);
            return resetInvalidatesHistory;
        }

        @Override
        protected void onInputHistoryInvalidation() {
            historyFlushes++;
            journal.add(name() + ":history");
        }
    }

    static class CountingOutput extends OutputNode {
        final List<String> journal;
        final List<SignalBlock> received = new ArrayList<>();
        int inits, resets, historyFlushes;

        CountingOutput(String name, List<String> journal) {
            super(name);
            this.journal = journal;
        }

        @Override
        protected Set<String> resetTriggers() {
            return Set.of();
        }

        @Override
        protected Map<String, UpstreamSaver> upstreamReinitTriggers() {
            return Map.of(SourceNode.CHANNEL_INFO, CHANNEL_COUNT);
        }

        @Override
        protected void onInitialize() {
            inits++;
            journal.add(name() + ":init");
        }

        @Override
        protected void onUpdate() {
            journal.add(name() + ":update");
            received.add(input());
        }

        @Override
        protected boolean onReset() {
            resets++;
            return false;
        }

        @Override
        protected void onInputHistoryInvalidation() {
            historyFlushes++;
            journal.add(name() + ":history");
        }
    }
}
