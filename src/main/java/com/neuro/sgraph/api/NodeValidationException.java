package com.neuro.sgraph.api;

/**
 * Thrown when a node is handed a value outside its declared domain, or when a
 * node finishes initialization in a state downstream nodes cannot rely on
 * (for example a source without a consistent channel descriptor).
 *
 * The node stays non-functional until the offending value is corrected.
 */
public class NodeValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public NodeValidationException(String message) {
        super(message);
    }

    public NodeValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
