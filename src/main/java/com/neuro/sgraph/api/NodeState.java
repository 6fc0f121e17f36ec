package com.neuro.sgraph.api;

/**
 * Coarse lifecycle state of a node, derived from its flags in the same
 * priority order the update path resolves them.
 */
public enum NodeState {
    /** onInitialize has never completed, or the last attempt failed. */
    UNINITIALIZED,
    /** Initialized, but the next update will rebuild everything. */
    PENDING_REINITIALIZE,
    /** Initialized, a reset-triggering attribute changed. */
    PENDING_RESET,
    /** Initialized, the input time series lost its continuity. */
    HISTORY_INVALIDATED,
    /** Initialized with no outstanding work; the next update computes. */
    READY
}
