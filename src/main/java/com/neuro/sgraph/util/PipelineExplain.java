package com.neuro.sgraph.util;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.neuro.sgraph.api.Node;
import com.neuro.sgraph.engine.NodeGraph;
import com.neuro.sgraph.engine.Pipeline;
import com.neuro.sgraph.node.SourceNode;

/**
 * Diagnostic utility for inspecting pipeline state and topology.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error logs.
 * Do <b>not</b> use on the hot path (allocates strings, iterates collections).
 */
public final class PipelineExplain {
    private final Pipeline pipeline;
    private final Map<String, String> logicalTypes;

    public PipelineExplain(Pipeline pipeline) {
        this(pipeline, Collections.emptyMap());
    }

    public PipelineExplain(Pipeline pipeline, Map<String, String> logicalTypes) {
        this.pipeline = pipeline;
        this.logicalTypes = logicalTypes;
    }

    /**
     * Dumps detailed state of a single node.
     *
     * @throws IllegalArgumentException if the pipeline has no such node.
     */
    public String explainNode(String nodeName) {
        Node node = pipeline.node(nodeName);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        NodeGraph graph = pipeline.graph();
        Node up = node.upstream();
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Type: ").append(typeOf(node)).append('\n')
                .append("  State: ").append(node.state()).append('\n')
                .append("  Upstream: ").append(up == null ? "-" : up.name()).append('\n')
                .append("  Output: ").append(node.output()).append('\n');
        if (node instanceof SourceNode src && src.channelInfo() != null)
            sb.append("  Channels: ").append(src.channelInfo().channelCount())
                    .append(" @ ").append(src.channelInfo().samplingRate()).append(" Hz\n");
        List<Node> listeners = graph.listenersOf(node);
        sb.append("  Listeners (").append(listeners.size()).append("): ");
        for (int i = 0; i < listeners.size(); i++) {
            sb.append(listeners.get(i).name());
            if (i < listeners.size() - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Returns summary of the last tick.
     */
    public String explainLastTick() {
        return "Epoch: " + pipeline.epoch() + ", Updated: " + pipeline.lastUpdatedCount() + "/"
                + pipeline.allNodes().size();
    }

    /**
     * Dumps every node in topological order with its listeners.
     */
    public String dumpTopology() {
        NodeGraph graph = pipeline.graph();
        List<Node> order = graph.topologicalOrder();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Pipeline (").append(order.size()).append(" nodes):\n");
        for (int i = 0; i < order.size(); i++) {
            Node node = order.get(i);
            sb.append("  [").append(i).append("] ").append(node.name());
            if (node instanceof SourceNode)
                sb.append(" (SRC)");
            sb.append(" [").append(node.state()).append(']');
            List<Node> listeners = graph.listenersOf(node);
            if (!listeners.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < listeners.size(); j++) {
                    sb.append(listeners.get(j).name());
                    if (j < listeners.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private String typeOf(Node node) {
        String type = logicalTypes.get(node.name());
        return type != null ? type : node.getClass().getSimpleName();
    }
}
