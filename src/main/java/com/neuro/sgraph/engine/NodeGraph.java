package com.neuro.sgraph.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.neuro.sgraph.api.Message;
import com.neuro.sgraph.api.Node;
import com.neuro.sgraph.api.ProtocolViolationException;

import lombok.extern.log4j.Log4j2;

/**
 * Registry of nodes and the upstream/listener edges between them.
 *
 * Nodes do not hold references to their listeners. Instead every node gets an
 * integer handle here, and the edges are kept as adjacency data:
 * <ul>
 * <li><b>upstream:</b> handle of each node's single upstream, or -1.</li>
 * <li><b>listeners:</b> insertion-ordered handles of the nodes that chose a
 * given node as their upstream.</li>
 * </ul>
 *
 * Keeping the edges in one place lets the registry refuse cycles at wiring
 * time, deliver messages to listeners in a deterministic order, and produce a
 * topological order of the whole graph.
 *
 * <h3>Ownership</h3>
 * A graph created by a {@link Pipeline} is owned by it. Nodes wired together
 * outside a pipeline get a standalone graph on demand; when one of those nodes
 * later joins another graph, the whole standalone graph is absorbed, edges and
 * listener order included. Nodes of two owned graphs are never joined.
 */
@Log4j2
public final class NodeGraph {
    private static final int NONE = -1;

    private final List<Node> nodes = new ArrayList<>();
    private final Map<Node, Integer> handles = new IdentityHashMap<>();
    private final List<Integer> upstreamOf = new ArrayList<>();
    private final List<Set<Integer>> listenersOf = new ArrayList<>();

    private final boolean owned;
    private boolean retired;

    /** Creates a standalone graph. */
    public NodeGraph() {
        this(false);
    }

    NodeGraph(boolean owned) {
        this.owned = owned;
    }

    /** True if this graph belongs to a pipeline and cannot be absorbed. */
    public boolean isOwned() {
        return owned;
    }

    /** True once this graph has been absorbed into another one. */
    public boolean isRetired() {
        return retired;
    }

    /**
     * Adds a node to this graph. Registering a node twice is a no-op. A node
     * that sits in a standalone graph brings that whole graph along.
     *
     * @return The node's handle.
     * @throws ProtocolViolationException if the node belongs to a graph owned
     *                                    by another pipeline.
     */
    public int register(Node node) {
        Integer existing = handles.get(node);
        if (existing != null)
            return existing;
        NodeGraph theirs = node.graph();
        if (theirs != null && theirs != this) {
            if (theirs.isOwned())
                throw new ProtocolViolationException("Node " + node.name() + " already belongs to another graph");
            absorb(theirs);
            return handles.get(node);
        }

        int handle = nodes.size();
        nodes.add(node);
        handles.put(node, handle);
        upstreamOf.add(NONE);
        listenersOf.add(new LinkedHashSet<>());
        node.bindGraph(this);
        return handle;
    }

    /**
     * Moves every node of a standalone graph into this one. Handles of the
     * moved nodes are shifted; edges and listener order are kept.
     */
    public void absorb(NodeGraph other) {
        if (other == this)
            return;
        if (other.owned)
            throw new ProtocolViolationException("Cannot absorb a graph owned by a pipeline");
        if (other.retired)
            throw new IllegalStateException("Graph was already absorbed");

        int offset = nodes.size();
        for (int i = 0; i < other.nodes.size(); i++) {
            Node n = other.nodes.get(i);
            nodes.add(n);
            handles.put(n, offset + i);
            int up = other.upstreamOf.get(i);
            upstreamOf.add(up == NONE ? NONE : up + offset);
            Set<Integer> ls = new LinkedHashSet<>();
            for (int h : other.listenersOf.get(i))
                ls.add(h + offset);
            listenersOf.add(ls);
        }
        other.retired = true;
        for (Node n : other.nodes)
            n.bindGraph(this);
        log.debug("Absorbed {} nodes from a standalone graph", other.nodes.size());

        other.nodes.clear();
        other.handles.clear();
        other.upstreamOf.clear();
        other.listenersOf.clear();
    }

    /**
     * Takes a node out of this graph, disconnecting it from its upstream.
     *
     * @throws ProtocolViolationException if other nodes still read from it.
     */
    public void remove(Node node) {
        int h = handle(node);
        if (!listenersOf.get(h).isEmpty())
            throw new ProtocolViolationException("Cannot remove " + node.name() + " while other nodes read from it");

        int up = upstreamOf.get(h);
        if (up != NONE)
            listenersOf.get(up).remove(h);
        nodes.remove(h);
        upstreamOf.remove(h);
        listenersOf.remove(h);
        handles.remove(node);

        for (int i = h; i < nodes.size(); i++)
            handles.put(nodes.get(i), i);
        for (int i = 0; i < upstreamOf.size(); i++) {
            int u = upstreamOf.get(i);
            if (u > h)
                upstreamOf.set(i, u - 1);
        }
        for (int i = 0; i < listenersOf.size(); i++) {
            Set<Integer> shifted = new LinkedHashSet<>();
            for (int l : listenersOf.get(i))
                shifted.add(l > h ? l - 1 : l);
            listenersOf.set(i, shifted);
        }
        node.bindGraph(null);
        log.debug("Removed {} from the graph", node.name());
    }

    public boolean contains(Node node) {
        return handles.containsKey(node);
    }

    public int handle(Node node) {
        Integer h = handles.get(node);
        if (h == null)
            throw new IllegalArgumentException("Unknown node: " + node.name());
        return h;
    }

    public Node node(int handle) {
        return nodes.get(handle);
    }

    public int size() {
        return nodes.size();
    }

    /** Returns the upstream of a registered node, or null. */
    public Node upstreamOf(Node node) {
        int up = upstreamOf.get(handle(node));
        return up == NONE ? null : nodes.get(up);
    }

    /** Returns the listeners of a node in the order they were connected. */
    public List<Node> listenersOf(Node node) {
        Set<Integer> ls = listenersOf.get(handle(node));
        List<Node> out = new ArrayList<>(ls.size());
        for (int h : ls)
            out.add(nodes.get(h));
        return Collections.unmodifiableList(out);
    }

    /**
     * Replaces the upstream of {@code child}.
     *
     * The child is deregistered from its previous upstream's listeners and, if
     * {@code parent} is not null, registered with the new one and immediately
     * sent {@link Message#STRUCTURAL_CHANGE}.
     *
     * @throws ProtocolViolationException if the edge would create a cycle.
     */
    public void connect(Node child, Node parent) {
        int c = register(child);
        int p = parent == null ? NONE : register(parent);

        if (p != NONE && reaches(p, c))
            throw new ProtocolViolationException("Connecting " + child.name() + " to " + parent.name()
                    + " would create a cycle");

        int previous = upstreamOf.get(c);
        if (previous == p)
            return;
        if (previous != NONE)
            listenersOf.get(previous).remove(c);

        upstreamOf.set(c, p);
        if (p == NONE) {
            log.debug("Disconnected {} from its upstream", child.name());
            return;
        }
        listenersOf.get(p).add(c);
        log.debug("Connected {} -> {}", parent.name(), child.name());
        child.receiveMessage(Message.STRUCTURAL_CHANGE);
    }

    /** Delivers a message from {@code sender} to each of its listeners, synchronously. */
    public void deliver(Node sender, Message message) {
        for (int h : List.copyOf(listenersOf.get(handle(sender))))
            nodes.get(h).receiveMessage(message);
    }

    // True if walking up from 'from' reaches 'target' (or from == target).
    private boolean reaches(int from, int target) {
        int cur = from;
        int steps = 0;
        while (cur != NONE) {
            if (cur == target)
                return true;
            cur = upstreamOf.get(cur);
            if (++steps > nodes.size())
                throw new IllegalStateException("Upstream chain is cyclic at node " + nodes.get(from).name());
        }
        return false;
    }

    /**
     * Orders every registered node so that each node comes after its upstream.
     * Ties are broken by registration order.
     * <p>
     * Uses Kahn's algorithm.
     */
    public List<Node> topologicalOrder() {
        int n = nodes.size();
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++)
            if (upstreamOf.get(i) != NONE)
                inDegree[i]++;

        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                queue[tail++] = i;

        List<Node> order = new ArrayList<>(n);
        while (head < tail) {
            int curr = queue[head++];
            order.add(nodes.get(curr));
            for (int child : listenersOf.get(curr))
                if (--inDegree[child] == 0)
                    queue[tail++] = child;
        }
        if (order.size() != n)
            throw new IllegalStateException("Cycle detected! Ordered " + order.size() + " of " + n);
        return order;
    }
}
