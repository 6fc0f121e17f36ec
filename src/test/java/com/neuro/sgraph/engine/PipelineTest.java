package com.neuro.sgraph.engine;

import static com.neuro.sgraph.engine.LifecycleFixtures.info;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.neuro.sgraph.api.NodeState;
import com.neuro.sgraph.api.PipelineListener;
import com.neuro.sgraph.api.ProtocolViolationException;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.engine.LifecycleFixtures.CountingOutput;
import com.neuro.sgraph.engine.LifecycleFixtures.IdentityProcessor;
import com.neuro.sgraph.engine.LifecycleFixtures.QueueSource;

public class PipelineTest {

    private List<String> journal;
    private Pipeline pipeline;
    private QueueSource source;
    private IdentityProcessor processorA;
    private CountingOutput outputB;

    @Before
    public void setUp() {
        journal = new ArrayList<>();
        source = new QueueSource("src", info(2), journal);
        processorA = new IdentityProcessor("A", journal);
        outputB = new CountingOutput("B", journal);

        pipeline = new Pipeline();
        pipeline.setSource(source);
        pipeline.addProcessor(processorA);
        pipeline.addOutput(outputB);
    }

    @Test
    public void testWiring() {
        assertSame(source, processorA.upstream());
        assertSame(processorA, outputB.upstream());
        assertEquals(List.of(processorA), pipeline.graph().listenersOf(source));
        assertEquals(List.of(source, processorA, outputB), pipeline.allNodes());
        assertSame(outputB, pipeline.node("B"));
        assertNull(pipeline.node("missing"));
    }

    @Test
    public void testSourceProcessorOutputScenario() {
        pipeline.initializeAll();
        assertEquals(List.of("src:init", "A:init", "B:init"), journal);
        for (var node : pipeline.allNodes())
            assertEquals(node.name(), NodeState.READY, node.state());

        // Two 2x10 zero blocks through the identity processor.
        source.enqueue(SignalBlock.zeros(2, 10));
        source.enqueue(SignalBlock.zeros(2, 10));
        pipeline.tick();
        pipeline.tick();
        assertEquals(2, outputB.received.size());
        for (SignalBlock b : outputB.received)
            assertEquals(SignalBlock.zeros(2, 10), b);

        // A local reset of A must not reinitialize B.
        processorA.setGain(2.0);
        assertEquals(NodeState.PENDING_RESET, processorA.state());
        source.enqueue(SignalBlock.zeros(2, 10));
        pipeline.tick();
        assertEquals(1, processorA.resets);
        assertTrue(processorA.output().isEmpty());

        source.enqueue(SignalBlock.zeros(2, 10));
        pipeline.tick();
        assertEquals(3, outputB.received.size());
        assertEquals(1, outputB.inits);
        assertEquals(0, outputB.historyFlushes);
        assertEquals(NodeState.READY, outputB.state());

        // Replacing the source schedules a reinitialization of A right away.
        QueueSource replacement = new QueueSource("src2", info(2), journal);
        pipeline.setSource(replacement);
        assertSame(replacement, pipeline.getSource());
        assertSame(replacement, processorA.upstream());
        assertEquals(NodeState.PENDING_REINITIALIZE, processorA.state());
        assertSame(processorA, outputB.upstream());
    }

    @Test
    public void testRecoveryAfterSourceReplacement() {
        pipeline.initializeAll();
        QueueSource replacement = new QueueSource("src2", info(2), journal);
        pipeline.setSource(replacement);

        pipeline.initializeAll();
        assertEquals(1, replacement.inits);
        assertEquals(2, processorA.inits);
        assertEquals(NodeState.READY, processorA.state());
        // B only learns that its input history was cut.
        assertEquals(NodeState.HISTORY_INVALIDATED, outputB.state());

        replacement.enqueue(SignalBlock.zeros(2, 4));
        replacement.enqueue(SignalBlock.zeros(2, 4));
        pipeline.tick();
        pipeline.tick();
        assertEquals(1, outputB.inits);
        assertEquals(1, outputB.historyFlushes);
        assertEquals(1, outputB.received.size());
    }

    @Test
    public void testAddProcessorKeepsFloatingOutputsAtTail() {
        IdentityProcessor second = new IdentityProcessor("A2", journal);
        pipeline.addProcessor(second);
        assertSame(processorA, second.upstream());
        assertSame(second, outputB.upstream());
        assertTrue(pipeline.graph().listenersOf(processorA).contains(second));
        assertFalse(pipeline.graph().listenersOf(processorA).contains(outputB));
    }

    @Test
    public void testOutputWithExplicitParentStaysAttached() {
        CountingOutput raw = new CountingOutput("raw", journal);
        pipeline.addOutput(raw, source);
        pipeline.addProcessor(new IdentityProcessor("A2", journal));
        assertSame(source, raw.upstream());
        assertEquals("A2", outputB.upstream().name());
    }

    @Test
    public void testProcessorWithUpstreamKeepsIt() {
        IdentityProcessor branch = new IdentityProcessor("branch", journal);
        branch.setUpstream(source);
        pipeline.addProcessor(branch);
        assertSame(source, branch.upstream());
        assertEquals(List.of(processorA, branch), pipeline.getProcessors());
    }

    @Test
    public void testChainBuiltBeforeJoiningPipeline() {
        QueueSource eeg = new QueueSource("eeg", info(2), journal);
        IdentityProcessor first = new IdentityProcessor("first", journal);
        IdentityProcessor second = new IdentityProcessor("second", journal);
        second.setUpstream(first);

        Pipeline p = new Pipeline();
        p.setSource(eeg);
        p.addProcessor(first);
        p.addProcessor(second);
        CountingOutput sink = new CountingOutput("sink", journal);
        p.addOutput(sink);

        assertSame(eeg, first.upstream());
        assertSame(first, second.upstream());
        assertSame(second, sink.upstream());
        assertSame(p.graph(), second.graph());
        assertEquals(4, p.graph().size());

        p.initializeAll();
        eeg.enqueue(SignalBlock.zeros(2, 3));
        p.tick();
        assertEquals(1, sink.received.size());
    }

    @Test
    public void testRejectedOutputLeavesPipelineUnchanged() {
        Pipeline other = new Pipeline();
        QueueSource foreign = new QueueSource("foreign", info(2), journal);
        other.setSource(foreign);

        CountingOutput stray = new CountingOutput("stray", journal);
        try {
            pipeline.addOutput(stray, foreign);
            fail("Expected ProtocolViolationException");
        } catch (ProtocolViolationException e) {
            assertTrue(e.getMessage().contains("another pipeline"));
        }
        assertEquals(List.of(outputB), pipeline.getOutputs());
        assertFalse(pipeline.graph().contains(stray));

        pipeline.addProcessor(new IdentityProcessor("A2", journal));
        assertEquals("A2", outputB.upstream().name());
    }

    @Test
    public void testReplacedSourceLeavesGraph() {
        QueueSource replacement = new QueueSource("src2", info(2), journal);
        pipeline.setSource(replacement);
        assertFalse(pipeline.graph().contains(source));
        assertNull(source.graph());
        assertEquals(List.of(replacement, processorA, outputB), pipeline.graph().topologicalOrder());
    }

    @Test
    public void testReplacedSourceStaysWhileOutputReadsIt() {
        CountingOutput raw = new CountingOutput("raw", journal);
        pipeline.addOutput(raw, source);
        pipeline.setSource(new QueueSource("src2", info(2), journal));
        assertTrue(pipeline.graph().contains(source));
        assertSame(source, raw.upstream());
    }

    @Test(expected = ProtocolViolationException.class)
    public void testDuplicateProcessorRejected() {
        pipeline.addProcessor(processorA);
    }

    @Test(expected = ProtocolViolationException.class)
    public void testDuplicateOutputRejected() {
        pipeline.addOutput(outputB);
    }

    @Test(expected = ProtocolViolationException.class)
    public void testOutputCannotReadFromOutput() {
        pipeline.addOutput(new CountingOutput("C", journal), outputB);
    }

    @Test
    public void testInitializeAllWithoutSourceFails() {
        try {
            new Pipeline().initializeAll();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("No source"));
        }
    }

    @Test
    public void testFrequency() {
        pipeline.initializeAll();
        assertEquals(100.0, pipeline.frequency(), 0.0);
    }

    @Test(expected = IllegalStateException.class)
    public void testFrequencyWithoutSource() {
        new Pipeline().frequency();
    }

    @Test
    public void testTickReportsToListener() {
        RecordingListener listener = new RecordingListener();
        pipeline.setListener(listener);
        pipeline.initializeAll();
        source.enqueue(SignalBlock.zeros(2, 3));

        assertEquals(3, pipeline.tick());
        assertEquals(List.of("start:1", "src", "A", "B", "end:1:3"), listener.events);
        assertEquals(1, pipeline.epoch());
        assertEquals(3, pipeline.lastUpdatedCount());
    }

    @Test
    public void testNodeFailureIsReportedAndRethrown() {
        RecordingListener listener = new RecordingListener();
        pipeline.setListener(listener);
        pipeline.initializeAll();
        ArithmeticException boom = new ArithmeticException("boom");
        processorA.failOnUpdate = boom;
        source.enqueue(SignalBlock.zeros(2, 3));

        try {
            pipeline.tick();
            fail("Expected the node failure to propagate");
        } catch (ArithmeticException e) {
            assertSame(boom, e);
        }
        assertEquals(List.of("start:1", "src", "error:A:boom", "end:1:1"), listener.events);
        assertTrue(processorA.isInitialized());
        assertTrue(processorA.output().isEmpty());
        assertTrue(outputB.received.isEmpty());

        // The next block goes through normally once the fault is gone.
        processorA.failOnUpdate = null;
        source.enqueue(SignalBlock.zeros(2, 3));
        pipeline.tick();
        assertEquals(1, outputB.received.size());
    }

    @Test
    public void testRunStopsWhenSourceDies() {
        QueueSource finite = new QueueSource("finite", info(2), journal) {
            @Override
            public boolean isAlive() {
                return !queue.isEmpty();
            }
        };
        pipeline.setSource(finite);
        pipeline.initializeAll();
        finite.enqueue(SignalBlock.zeros(2, 1));
        finite.enqueue(SignalBlock.zeros(2, 1));
        pipeline.run();
        assertEquals(2, outputB.received.size());
        assertEquals(2, pipeline.epoch());
    }

    static final class RecordingListener implements PipelineListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onTickStart(long epoch) {
            events.add("start:" + epoch);
        }

        @Override
        public void onNodeUpdated(long epoch, int index, String nodeName, NodeState state, long durationNanos) {
            events.add(nodeName);
        }

        @Override
        public void onNodeError(long epoch, int index, String nodeName, Throwable error) {
            events.add("error:" + nodeName + ":" + error.getMessage());
        }

        @Override
        public void onTickEnd(long epoch, int nodesUpdated) {
            events.add("end:" + epoch + ":" + nodesUpdated);
        }
    }
}
