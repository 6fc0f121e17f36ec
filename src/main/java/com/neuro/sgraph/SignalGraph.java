package com.neuro.sgraph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;

import com.neuro.sgraph.api.Node;
import com.neuro.sgraph.api.PipelineListener;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.engine.Pipeline;
import com.neuro.sgraph.io.PipelineCompiler;
import com.neuro.sgraph.io.PipelineDefinition;
import com.neuro.sgraph.io.PipelineLoader;
import com.neuro.sgraph.node.StreamSource;
import com.neuro.sgraph.util.CompositePipelineListener;
import com.neuro.sgraph.util.LatencyTrackingListener;
import com.neuro.sgraph.util.PipelineExplain;
import com.neuro.sgraph.wiring.StreamingPipeline;

import lombok.extern.log4j.Log4j2;

/**
 * A high-level wrapper that builds a pipeline from a JSON definition and
 * drives it.
 * <p>
 * This class handles:
 * <ul>
 * <li>Parsing JSON pipeline definitions</li>
 * <li>Compiling them with {@link PipelineCompiler}</li>
 * <li>Feeding blocks into the stream source and ticking</li>
 * <li>Attaching listeners through one composite</li>
 * </ul>
 *
 * Single-threaded: use {@link #streaming(int)} to drive the pipeline from an
 * acquisition thread instead.
 */
@Log4j2
public class SignalGraph {
    private final String name;
    private final Pipeline pipeline;
    private final Map<String, Node> nodes;
    private final Map<String, String> logicalTypes;
    private final CompositePipelineListener compositeListener = new CompositePipelineListener();

    /**
     * Creates a new SignalGraph from a JSON file path.
     *
     * @param jsonPath Path to the JSON pipeline definition.
     */
    public SignalGraph(Path jsonPath) {
        this(load(jsonPath));
    }

    public SignalGraph(PipelineDefinition definition) {
        var compiled = new PipelineCompiler().compile(definition);
        this.name = compiled.name();
        this.pipeline = compiled.pipeline();
        this.nodes = compiled.nodesByName();
        this.logicalTypes = compiled.logicalTypes();
        this.pipeline.setListener(compositeListener);
    }

    /**
     * Creates a SignalGraph from a JSON definition on the classpath.
     */
    public static SignalGraph fromResource(String resource) {
        try {
            return new SignalGraph(PipelineLoader.parseResource(resource));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load pipeline definition from " + resource, e);
        }
    }

    private static PipelineDefinition load(Path jsonPath) {
        try {
            return PipelineLoader.parseFile(jsonPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load pipeline definition from " + jsonPath, e);
        }
    }

    public String getName() {
        return name;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    /**
     * Registers a listener to monitor ticks. Adds to the composite rather than
     * replacing listeners already attached.
     */
    public void addListener(PipelineListener listener) {
        compositeListener.add(listener);
    }

    /**
     * Enables latency tracking.
     * Use the returned listener to read or dump statistics.
     */
    public LatencyTrackingListener enableLatencyTracking() {
        var latencyListener = new LatencyTrackingListener();
        compositeListener.add(latencyListener);
        return latencyListener;
    }

    /** Initializes every node, source first. */
    public SignalGraph initialize() {
        pipeline.initializeAll();
        log.info("Pipeline {} ready:\n{}", name, explain().dumpTopology());
        return this;
    }

    /**
     * Queues a block in the stream source. Does not tick; call {@link #tick()}
     * once per pushed block.
     */
    public void push(SignalBlock block) {
        source().push(block);
    }

    /**
     * Runs one tick.
     *
     * @return Number of nodes updated.
     */
    public int tick() {
        return pipeline.tick();
    }

    /** Pushes a block and ticks once. */
    public int process(SignalBlock block) {
        push(block);
        return tick();
    }

    /**
     * Retrieves a node by name.
     *
     * @param name The name of the node in the JSON definition.
     * @param <T>  The expected type of the node.
     * @return The node, or null if not found.
     */
    @SuppressWarnings("unchecked")
    public <T extends Node> T node(String name) {
        return (T) nodes.get(name);
    }

    public PipelineExplain explain() {
        return new PipelineExplain(pipeline, logicalTypes);
    }

    /** Wraps this pipeline in a ring buffer. The caller owns start and stop. */
    public StreamingPipeline streaming(int bufferSize) {
        return new StreamingPipeline(pipeline, bufferSize);
    }

    private StreamSource source() {
        if (!(pipeline.getSource() instanceof StreamSource s))
            throw new IllegalStateException("Pipeline " + name + " is not fed by a stream source");
        return s;
    }
}
