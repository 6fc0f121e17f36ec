package com.neuro.sgraph.api;

/**
 * Observability interface for monitoring pipeline ticks.
 *
 * Implementations are registered with a Pipeline and receive callbacks while
 * it drives its nodes. Typical uses are profiling (tick latency), debugging
 * (which node failed) and metrics.
 *
 * Performance Warning:
 * Callbacks run synchronously on the thread that ticks the pipeline. Anything
 * slow done here delays every node that comes after it.
 */
public interface PipelineListener {

    /**
     * Called immediately before a tick begins.
     *
     * @param epoch The incrementing tick number.
     */
    void onTickStart(long epoch);

    /**
     * Called after a node's update() returned normally.
     *
     * @param epoch         Current tick number.
     * @param index         Position of the node in source-to-output order.
     * @param nodeName      Name of the node.
     * @param state         State of the node after the update.
     * @param durationNanos Time spent in update().
     */
    void onNodeUpdated(long epoch, int index, String nodeName, NodeState state, long durationNanos);

    /**
     * Called when a node's update() throws. The pipeline rethrows the error
     * after this callback returns.
     */
    void onNodeError(long epoch, int index, String nodeName, Throwable error);

    /**
     * Called when the tick is over, whether or not it failed.
     *
     * @param epoch        Current tick number.
     * @param nodesUpdated Number of nodes whose update() returned normally.
     */
    void onTickEnd(long epoch, int nodesUpdated);
}
