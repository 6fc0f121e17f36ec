package com.neuro.sgraph.node;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.neuro.sgraph.api.Message;
import com.neuro.sgraph.api.Node;
import com.neuro.sgraph.api.NodeState;
import com.neuro.sgraph.api.NodeValidationException;
import com.neuro.sgraph.api.ProtocolViolationException;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.api.UpstreamSaver;
import com.neuro.sgraph.engine.NodeGraph;

/**
 * Lifecycle engine shared by every node.
 *
 * A node is always in one of two states, uninitialized or initialized, with
 * three independent kinds of outstanding work that can be raised at any time:
 * <ul>
 * <li><b>reinitialize:</b> something upstream changed in a way this node
 * depends on structurally (or the upstream itself was replaced).</li>
 * <li><b>reset:</b> one of this node's own reset-triggering attributes was
 * written.</li>
 * <li><b>history invalidated:</b> upstream says its new outputs do not
 * continue its old ones.</li>
 * </ul>
 *
 * <h3>Update algorithm</h3>
 * Every call to {@link #update()} resolves at most one kind of work, in order
 * of disruptiveness:
 * <ol>
 * <li>If upstream sent a change message, compare the tracked upstream
 * attributes with the snapshot taken at initialization; on drift, schedule a
 * reinitialization.</li>
 * <li>Uninitialized or reinitialize pending: run {@link #onInitialize()}.</li>
 * <li>Nothing pending: run {@link #onUpdate()}.</li>
 * <li>Otherwise: {@link #reset()} if pending, then
 * {@link #handleInputHistoryInvalidation()} if still pending.</li>
 * </ol>
 * Work is never done at the moment a flag is raised; it waits for the next
 * update.
 *
 * <h3>Subclassing</h3>
 * The three roles ({@link SourceNode}, {@link ProcessorNode},
 * {@link OutputNode}) are the only direct subclasses. Concrete nodes extend a
 * role, implement the four hooks and declare two fixed sets: the attributes
 * whose local change requires a reset, and the upstream attributes whose drift
 * requires a reinitialization. Each reset-sensitive attribute gets an explicit
 * setter that ends with {@link #attributeChanged(String)}.
 */
public abstract sealed class AbstractNode implements Node permits SourceNode, ProcessorNode, OutputNode {
    protected final Logger log = LogManager.getLogger(getClass());

    private final String name;
    private NodeGraph graph;
    private SignalBlock output = SignalBlock.EMPTY;

    private boolean initialized;
    private boolean upstreamChanged;
    private boolean pendingReinitialize;
    private boolean pendingReset;
    private boolean inputHistoryInvalid;

    private Map<String, Object> upstreamSnapshot = Map.of();
    private int suppressionDepth;

    protected AbstractNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    // ── Declarations ────────────────────────────────────────────────

    /** Attributes of this node whose change schedules a reset. */
    protected abstract Set<String> resetTriggers();

    /**
     * Upstream attributes whose drift schedules a reinitialization, each with
     * the saver that reduces it to a comparable snapshot.
     */
    protected abstract Map<String, UpstreamSaver> upstreamReinitTriggers();

    // ── Hooks ───────────────────────────────────────────────────────

    /**
     * Prepares everything for the first update. If called again, must remove
     * all traces of the past.
     */
    protected abstract void onInitialize();

    /** Computes a new output from the current upstream output. */
    protected abstract void onUpdate();

    /**
     * Reacts to a change of one of {@link #resetTriggers()}.
     *
     * @return true if listeners should forget everything that came before,
     *         false if the change is strictly local.
     */
    protected abstract boolean onReset();

    /** Drops whatever state depends on previous inputs. */
    protected abstract void onInputHistoryInvalidation();

    /** Role hook run before {@link #onInitialize()}. */
    protected void prepareInitialization() {
    }

    /** Role hook run after {@link #onInitialize()}; throwing keeps the node uninitialized. */
    protected void checkInitialization() {
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Override
    public void update() {
        long start = System.nanoTime();
        output = SignalBlock.EMPTY;

        if (upstreamChanged) {
            if (initialized && !pendingReinitialize && changeRequiresReinitialization())
                pendingReinitialize = true;
            upstreamChanged = false;
        }

        if (!initialized || pendingReinitialize) {
            initialize();
        } else if (!hasPendingWork()) {
            onUpdate();
        } else {
            if (pendingReset)
                reset();
            if (inputHistoryInvalid)
                handleInputHistoryInvalidation();
        }

        if (log.isDebugEnabled())
            log.debug("Updated {} in {} ms", name, String.format("%.3f", (System.nanoTime() - start) / 1e6));
    }

    @Override
    public final void initialize() {
        if (initialized && !pendingReinitialize)
            throw new ProtocolViolationException(
                    "Trying to initialize " + name + " even though there is no indication for it");

        long start = System.nanoTime();
        try (SuppressionScope ignored = suppressResets()) {
            log.info("Initializing the {} node", name);
            initialized = false;
            prepareInitialization();
            onInitialize();
            checkInitialization();
            upstreamSnapshot = captureUpstreamSnapshot();
            initialized = true;

            pendingReinitialize = false;
            pendingReset = false;
            inputHistoryInvalid = false;
            upstreamChanged = false;
            log.info("Finished initialization of {} in {} ms", name,
                    String.format("%.1f", (System.nanoTime() - start) / 1e6));
        }
        deliver(Message.STRUCTURAL_CHANGE);
    }

    /**
     * Runs {@link #onReset()} and tells listeners what happened.
     *
     * @throws ProtocolViolationException if no reset is pending.
     */
    public final void reset() {
        if (!pendingReset)
            throw new ProtocolViolationException("Trying to reset " + name + " even though there is no indication for it");

        boolean historyInvalid;
        try (SuppressionScope ignored = suppressResets()) {
            log.info("Resetting the {} node because of attribute changes", name);
            historyInvalid = onReset();
            pendingReset = false;
        }
        deliver(Message.of(true, historyInvalid));
    }

    /**
     * Runs {@link #onInputHistoryInvalidation()} and passes the invalidation on.
     *
     * @throws ProtocolViolationException if the input history is still valid.
     */
    public final void handleInputHistoryInvalidation() {
        if (!inputHistoryInvalid)
            throw new ProtocolViolationException(
                    "Trying to flush history of " + name + " even though there is no indication for it");

        try (SuppressionScope ignored = suppressResets()) {
            log.info("Resetting the {} node because history is no longer valid", name);
            onInputHistoryInvalidation();
            inputHistoryInvalid = false;
        }
        deliver(Message.STRUCTURAL_CHANGE);
    }

    private boolean hasPendingWork() {
        return pendingReinitialize || pendingReset || inputHistoryInvalid;
    }

    // ── Attribute changes ───────────────────────────────────────────

    /**
     * Entry point for every setter of this node. Schedules a reset if the
     * attribute is reset-triggering, unless called from inside a hook.
     */
    protected final void attributeChanged(String attribute) {
        if (suppressionDepth > 0 || !resetTriggers().contains(attribute))
            return;
        if (!pendingReset)
            log.debug("{} of {} changed, scheduling a reset", attribute, name);
        pendingReset = true;
    }

    /** Schedules a full reinitialization on the next update. */
    protected final void requestReinitialize() {
        pendingReinitialize = true;
    }

    /**
     * Opens a scope in which attribute writes do not schedule resets. Every
     * hook already runs inside one.
     */
    protected final SuppressionScope suppressResets() {
        suppressionDepth++;
        return () -> suppressionDepth--;
    }

    /** Closing the scope re-enables reset scheduling. */
    @FunctionalInterface
    public interface SuppressionScope extends AutoCloseable {
        @Override
        void close();
    }

    // ── Upstream tracking ───────────────────────────────────────────

    private Map<String, Object> captureUpstreamSnapshot() {
        Map<String, UpstreamSaver> tracked = upstreamReinitTriggers();
        if (tracked.isEmpty())
            return Map.of();
        Map<String, Object> snapshot = new HashMap<>(tracked.size() * 2);
        for (Map.Entry<String, UpstreamSaver> e : tracked.entrySet())
            snapshot.put(e.getKey(), e.getValue().save(findUpstreamAttribute(e.getKey())));
        return snapshot;
    }

    // Compares the live upstream values with the ones saved at initialization.
    private boolean changeRequiresReinitialization() {
        Map<String, UpstreamSaver> tracked = upstreamReinitTriggers();
        for (Map.Entry<String, Object> e : upstreamSnapshot.entrySet()) {
            Object current = tracked.get(e.getKey()).save(findUpstreamAttribute(e.getKey()));
            if (!Objects.equals(e.getValue(), current)) {
                log.info("Upstream {} of {} changed, scheduling reinitialization", e.getKey(), name);
                return true;
            }
        }
        return false;
    }

    /**
     * Walks up the chain until a node exposes {@code attribute}.
     *
     * @throws NodeValidationException if no predecessor exposes it.
     */
    protected final Object findUpstreamAttribute(String attribute) {
        Node current = upstream();
        while (current != null) {
            if (current.exposesAttribute(attribute))
                return current.attributeValue(attribute);
            current = current.upstream();
        }
        throw new NodeValidationException(
                "None of the predecessors of a " + name + " node contains attribute " + attribute);
    }

    protected final <T> T findUpstreamAttribute(String attribute, Class<T> type) {
        Object value = findUpstreamAttribute(attribute);
        if (value != null && !type.isInstance(value))
            throw new NodeValidationException("Upstream attribute " + attribute + " of " + name + " is a "
                    + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        return type.cast(value);
    }

    @Override
    public boolean exposesAttribute(String attribute) {
        return false;
    }

    @Override
    public Object attributeValue(String attribute) {
        throw new IllegalArgumentException(name + " does not expose attribute " + attribute);
    }

    // ── Wiring ──────────────────────────────────────────────────────

    @Override
    public Node upstream() {
        return graph == null ? null : graph.upstreamOf(this);
    }

    @Override
    public void setUpstream(Node value) {
        if (upstream() == value)
            return;
        resolveGraph(value).connect(this, value);
        if (initialized)
            pendingReinitialize = true;
    }

    // Picks the graph the edge lives in; NodeGraph.register absorbs a standalone one.
    private NodeGraph resolveGraph(Node value) {
        NodeGraph theirs = value == null ? null : value.graph();
        NodeGraph g;
        if (graph == null)
            g = theirs != null ? theirs : new NodeGraph();
        else if (theirs == null || theirs == graph || !theirs.isOwned())
            g = graph;
        else if (!graph.isOwned())
            g = theirs;
        else
            throw new ProtocolViolationException(name + " and " + value.name() + " belong to different graphs");

        g.register(this);
        if (value != null)
            g.register(value);
        return g;
    }

    @Override
    public NodeGraph graph() {
        return graph;
    }

    @Override
    public void bindGraph(NodeGraph newGraph) {
        if (graph != null && newGraph != null && graph != newGraph && !graph.isRetired())
            throw new ProtocolViolationException("Node " + name + " already belongs to another graph");
        graph = newGraph;
    }

    @Override
    public void receiveMessage(Message message) {
        upstreamChanged |= message.changed();
        inputHistoryInvalid |= message.historyInvalid();
    }

    private void deliver(Message message) {
        if (graph != null)
            graph.deliver(this, message);
    }

    // ── State access ────────────────────────────────────────────────

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final SignalBlock output() {
        return output;
    }

    protected final void setOutput(SignalBlock block) {
        output = block == null ? SignalBlock.EMPTY : block;
    }

    /** The upstream node's current output, or the empty block. */
    protected final SignalBlock input() {
        Node up = upstream();
        return up == null ? SignalBlock.EMPTY : up.output();
    }

    @Override
    public final boolean isInitialized() {
        return initialized;
    }

    public final boolean isPendingReinitialize() {
        return pendingReinitialize;
    }

    public final boolean isPendingReset() {
        return pendingReset;
    }

    public final boolean isInputHistoryInvalid() {
        return inputHistoryInvalid;
    }

    @Override
    public final NodeState state() {
        if (!initialized)
            return NodeState.UNINITIALIZED;
        if (pendingReinitialize)
            return NodeState.PENDING_REINITIALIZE;
        if (pendingReset)
            return NodeState.PENDING_RESET;
        if (inputHistoryInvalid)
            return NodeState.HISTORY_INVALIDATED;
        return NodeState.READY;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", " + state() + "]";
    }
}
