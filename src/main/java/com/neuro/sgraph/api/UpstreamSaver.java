package com.neuro.sgraph.api;

/**
 * Reduces an upstream attribute value to something that can be compared with
 * {@code equals} across updates.
 *
 * Nodes that track a mutable or rich upstream attribute (a channel descriptor,
 * for example) only care about part of it. Saving the whole object would
 * trigger a reinitialization on every cosmetic change; saving only the part
 * the node depends on does not.
 */
@FunctionalInterface
public interface UpstreamSaver {

    /** Keeps the value as-is. Suitable for immutable values. */
    UpstreamSaver IDENTITY = value -> value;

    /**
     * @param value The live upstream attribute value, possibly null.
     * @return A comparable snapshot of the part this node depends on.
     */
    Object save(Object value);
}
