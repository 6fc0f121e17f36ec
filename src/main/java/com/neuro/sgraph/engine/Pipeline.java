package com.neuro.sgraph.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.neuro.sgraph.api.Node;
import com.neuro.sgraph.api.NodeState;
import com.neuro.sgraph.api.PipelineListener;
import com.neuro.sgraph.api.ProtocolViolationException;
import com.neuro.sgraph.node.OutputNode;
import com.neuro.sgraph.node.ProcessorNode;
import com.neuro.sgraph.node.SourceNode;

import lombok.extern.log4j.Log4j2;

/**
 * Connects a source to a sequence of processors and a set of outputs, and
 * drives them.
 *
 * Sample usage:
 *
 * <pre>
 * Pipeline pipeline = new Pipeline();
 * pipeline.setSource(new StreamSource("eeg", info));
 * pipeline.addProcessor(new Preprocessing("prep", 10));
 * pipeline.addProcessor(new EnvelopeExtractor("envelope", 0.95));
 * pipeline.addOutput(new RecordingOutput("recorder"));
 * pipeline.initializeAll();
 * ...
 * pipeline.tick();
 * </pre>
 *
 * <h3>Wiring</h3>
 * Processors form a chain behind the source. Outputs attach either to an
 * explicit parent or, when added without one, "float" on whatever node is
 * currently last before the outputs, and are re-pointed whenever the chain
 * changes.
 *
 * <h3>Ticking</h3>
 * {@link #tick()} calls update() on every node once, source first, so each
 * node reads the output its upstream produced in the same tick. The pipeline
 * has no clock of its own; a timer or a ring buffer consumer calls tick().
 * Errors thrown by a node are reported to the listener and rethrown
 * unchanged; the nodes after it are not updated in that tick.
 */
@Log4j2
public final class Pipeline {
    private final NodeGraph graph = new NodeGraph(true);

    private SourceNode source;
    private final List<ProcessorNode> processors = new ArrayList<>();
    private final List<OutputNode> outputs = new ArrayList<>();
    // Parent requested for each output; null means "follow the chain tail".
    private final List<Node> inputsOfOutputs = new ArrayList<>();

    private long epoch;
    private int lastUpdatedCount;
    private PipelineListener listener;

    public void setListener(PipelineListener listener) {
        this.listener = listener;
    }

    public SourceNode getSource() {
        return source;
    }

    /**
     * Replaces the source. The first processor (or, without processors, every
     * floating output) is rewired to it. The old source leaves the graph once
     * nothing reads from it any more.
     */
    public void setSource(SourceNode newSource) {
        SourceNode old = this.source;
        graph.register(newSource);
        this.source = newSource;
        if (!processors.isEmpty())
            processors.get(0).setUpstream(newSource);
        reconnectOutputsToLastNode();
        if (old != null && old != newSource && graph.listenersOf(old).isEmpty())
            graph.remove(old);
        log.info("Source set to {}", newSource.name());
    }

    /**
     * Appends a processor to the chain. A processor that already has an
     * upstream keeps it; otherwise it is connected to the current chain tail.
     *
     * @throws ProtocolViolationException if this instance was already added.
     */
    public void addProcessor(ProcessorNode processor) {
        if (containsInstance(processors, processor))
            throw new ProtocolViolationException("Trying to add a " + processor.getClass().getSimpleName()
                    + " that has already been added");

        Node tail = lastNodeBeforeOutputs();
        graph.register(processor);
        if (processor.upstream() == null && tail != null)
            processor.setUpstream(tail);
        processors.add(processor);
        reconnectOutputsToLastNode();
    }

    /** Adds an output that follows the chain tail. */
    public void addOutput(OutputNode output) {
        addOutput(output, null);
    }

    /**
     * Adds an output.
     *
     * @param parent The node to read from, or null to follow whatever node is
     *               last before the outputs, now and after later edits.
     * @throws ProtocolViolationException if this instance was already added,
     *                                    or if the parent is an output or
     *                                    belongs to another pipeline. The
     *                                    pipeline is left unchanged.
     */
    public void addOutput(OutputNode output, Node parent) {
        if (containsInstance(outputs, output))
            throw new ProtocolViolationException("Trying to add a " + output.getClass().getSimpleName()
                    + " that has already been added");
        if (parent instanceof OutputNode)
            throw new ProtocolViolationException("Output " + output.name() + " cannot read from another output");
        if (parent != null && parent.graph() != null && parent.graph() != graph && parent.graph().isOwned())
            throw new ProtocolViolationException("Output " + output.name() + " cannot read from "
                    + parent.name() + ", which belongs to another pipeline");

        Node target = parent != null ? parent : lastNodeBeforeOutputs();
        graph.register(output);
        if (target != null)
            output.setUpstream(target);
        outputs.add(output);
        inputsOfOutputs.add(parent);
    }

    /**
     * Initializes every node in source-to-output order. Nodes that are
     * uninitialized or waiting for a reinitialization are initialized; on a
     * fresh pipeline this leaves every node ready with nothing pending. Nodes
     * that were already initialized and only learn of a cut in their input
     * history handle it on their next non-empty update.
     */
    public void initializeAll() {
        if (source == null)
            throw new IllegalStateException("No source has been set in the pipeline");
        log.info("Initialize");
        long start = System.nanoTime();
        for (Node node : allNodes()) {
            if (!node.isInitialized() || node.state() == NodeState.PENDING_REINITIALIZE)
                node.initialize();
        }
        log.info("Finish initialization in {} ms", String.format("%.1f", (System.nanoTime() - start) / 1e6));
    }

    /**
     * Runs one update pass over every node, source first.
     *
     * @return The number of nodes updated.
     */
    public int tick() {
        epoch++;
        final PipelineListener l = this.listener;
        final boolean hasListener = l != null;
        if (hasListener)
            l.onTickStart(epoch);

        List<Node> nodes = allNodes();
        int updated = 0;
        try {
            for (int i = 0; i < nodes.size(); i++) {
                Node node = nodes.get(i);
                long nodeStart = hasListener ? System.nanoTime() : 0;
                try {
                    node.update();
                } catch (RuntimeException | Error e) {
                    if (hasListener)
                        l.onNodeError(epoch, i, node.name(), e);
                    throw e;
                }
                updated++;
                if (hasListener)
                    l.onNodeUpdated(epoch, i, node.name(), node.state(), System.nanoTime() - nodeStart);
            }
        } finally {
            lastUpdatedCount = updated;
            if (hasListener)
                l.onTickEnd(epoch, updated);
        }
        return updated;
    }

    /** Ticks until the source reports it is no longer alive. */
    public void run() {
        if (source == null)
            throw new IllegalStateException("No source has been set in the pipeline");
        while (source.isAlive())
            tick();
    }

    /** Sampling rate of the source's channel descriptor. */
    public double frequency() {
        if (source == null)
            throw new IllegalStateException("No source has been set in the pipeline");
        return source.frequency();
    }

    /** Source, processors and outputs, in update order. */
    public List<Node> allNodes() {
        List<Node> all = new ArrayList<>(1 + processors.size() + outputs.size());
        if (source != null)
            all.add(source);
        all.addAll(processors);
        all.addAll(outputs);
        return all;
    }

    public List<ProcessorNode> getProcessors() {
        return Collections.unmodifiableList(processors);
    }

    public List<OutputNode> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    /** Finds a node by name, or returns null. */
    public Node node(String name) {
        for (Node n : allNodes())
            if (n.name().equals(name))
                return n;
        return null;
    }

    public NodeGraph graph() {
        return graph;
    }

    public long epoch() {
        return epoch;
    }

    public int lastUpdatedCount() {
        return lastUpdatedCount;
    }

    private Node lastNodeBeforeOutputs() {
        return processors.isEmpty() ? source : processors.get(processors.size() - 1);
    }

    private void reconnectOutputsToLastNode() {
        Node last = lastNodeBeforeOutputs();
        for (int i = 0; i < outputs.size(); i++) {
            Node requested = inputsOfOutputs.get(i);
            Node target = requested != null ? requested : last;
            if (target != null)
                outputs.get(i).setUpstream(target);
        }
    }

    private static boolean containsInstance(List<? extends Node> list, Node node) {
        for (Node n : list)
            if (n == node)
                return true;
        return false;
    }
}
