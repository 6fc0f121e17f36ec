package com.neuro.sgraph.wiring;

import com.neuro.sgraph.api.SignalBlock;

/**
 * A mutable holder for one acquired block, used within the LMAX Disruptor
 * RingBuffer.
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every block that passes through it. The block itself is immutable, so the
 * producer hands over a reference and the consumer drops it once the block is
 * queued in the source.
 *
 * Fields:
 * - block: The samples, channels x time.
 * - tickEnd: Forces the pipeline to tick right after this event, even if more
 * events are waiting in the ring buffer.
 * - sequenceId: Producer-side counter, for correlation in logs.
 */
public final class SignalEvent {
    private SignalBlock block;
    private boolean tickEnd;
    private long sequenceId;

    /**
     * Configures the event.
     *
     * @param block   The acquired samples.
     * @param tickEnd If true, forces a tick after this event.
     * @param seqId   The sequence ID.
     */
    public void set(SignalBlock block, boolean tickEnd, long seqId) {
        this.block = block;
        this.tickEnd = tickEnd;
        this.sequenceId = seqId;
    }

    public SignalBlock block() {
        return block;
    }

    public boolean isTickEnd() {
        return tickEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        block = null;
        tickEnd = false;
        sequenceId = 0;
    }
}
