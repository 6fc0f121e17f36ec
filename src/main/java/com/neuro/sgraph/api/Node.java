package com.neuro.sgraph.api;

import com.neuro.sgraph.engine.NodeGraph;

/**
 * One stage of a processing chain: a source, a processor, or an output.
 *
 * This interface is everything the pipeline and the graph registry need from
 * a node. They never look at concrete node types; the lifecycle itself lives
 * in {@link com.neuro.sgraph.node.AbstractNode}.
 *
 * Key Responsibilities:
 *
 * 1. Lifecycle: update() resolves any pending initialize / reset / history
 * invalidation first and only computes when nothing is pending.
 *
 * 2. Wiring: a node has at most one upstream and is told about upstream
 * changes through receiveMessage(). Listener bookkeeping is kept in the
 * {@link NodeGraph} the node belongs to.
 *
 * 3. Attribute lookup: downstream nodes find upstream attributes (for example
 * the channel descriptor) by name, walking up the chain until a node exposes
 * the attribute.
 */
public interface Node {

    /** Human-readable name, unique within a pipeline. */
    String name();

    /**
     * Advances the node by one tick.
     *
     * Consistency Warning:
     * Must be called after the upstream node's update() in the same tick,
     * otherwise this node computes from the previous tick's upstream output.
     */
    void update();

    /**
     * Runs the initialization path directly, outside of update().
     *
     * @throws ProtocolViolationException if the node is initialized and has no
     *                                    pending reinitialization.
     */
    void initialize();

    /**
     * Returns the block produced by the last update, or {@link SignalBlock#EMPTY}.
     * Valid until this node's next update; never null.
     */
    SignalBlock output();

    boolean isInitialized();

    NodeState state();

    /** Returns the upstream node, or null for sources and unwired nodes. */
    Node upstream();

    /**
     * Connects this node to a new upstream (or disconnects it when null).
     * A changed upstream invalidates everything this node derived from the old
     * one.
     */
    void setUpstream(Node upstream);

    /** Called by the graph registry to deliver a message from the upstream node. */
    void receiveMessage(Message message);

    /** Returns the registry this node belongs to, or null if it was never wired. */
    NodeGraph graph();

    /**
     * Called by {@link NodeGraph} only. A node belongs to at most one live
     * graph; null detaches it after {@link NodeGraph#remove(Node)}.
     */
    void bindGraph(NodeGraph graph);

    /** True if this node itself answers attributeValue(name). */
    boolean exposesAttribute(String name);

    /** Value of an exposed attribute; undefined for attributes not exposed. */
    Object attributeValue(String name);
}
