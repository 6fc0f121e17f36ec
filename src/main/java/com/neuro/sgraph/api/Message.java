package com.neuro.sgraph.api;

/**
 * A signal delivered from a node to its listeners right after that node has
 * (re)initialized, reset, or dropped its history.
 *
 * The two fields are independent:
 * - changed: the producing node (or something above it) has changed in a way
 * the listener may need to react to.
 * - historyInvalid: outputs produced from now on must not be treated as a
 * continuation of the outputs produced before.
 *
 * Messages are immutable and carry no reference to their sender, so the same
 * instance can be fanned out to every listener.
 *
 * @param changed        true if the sender has changed since its last message.
 * @param historyInvalid true if listeners must forget time-series continuity.
 */
public record Message(boolean changed, boolean historyInvalid) {

    /** Sent on initialization and to a node that just gained a new upstream. */
    public static final Message STRUCTURAL_CHANGE = new Message(true, true);

    /** Sent by a reset whose effects are strictly local to the sender. */
    public static final Message LOCAL_CHANGE = new Message(true, false);

    public static Message of(boolean changed, boolean historyInvalid) {
        if (changed)
            return historyInvalid ? STRUCTURAL_CHANGE : LOCAL_CHANGE;
        return new Message(false, historyInvalid);
    }
}
