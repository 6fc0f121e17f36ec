package com.neuro.sgraph.api;

/**
 * Thrown when a caller bypasses the node lifecycle or wiring protocol.
 *
 * This is a programming error and is never recovered from: resetting a node
 * that has no pending reset, adding the same node twice to a pipeline, or
 * wiring an upstream edge that would close a cycle.
 */
public class ProtocolViolationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public ProtocolViolationException(String message) {
        super(message);
    }
}
