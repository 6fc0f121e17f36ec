package com.neuro.sgraph.wiring;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.lmax.disruptor.EventHandler;
import com.neuro.sgraph.engine.Pipeline;
import com.neuro.sgraph.node.StreamSource;
import com.neuro.sgraph.util.ErrorRateLimiter;

/**
 * Disruptor EventHandler that feeds acquired blocks into a pipeline and ticks
 * it.
 *
 * Runs on the single consumer thread; every node of the pipeline is only
 * ever touched from here.
 *
 * Key Responsibilities:
 * 1. Event Translation: Reads SignalEvents from the ring buffer and queues
 * their blocks in the {@link StreamSource}.
 * 2. Tick Trigger: Decides when to drain the source by ticking.
 *
 * Batching:
 * While the Disruptor reports more events waiting (endOfBatch false), blocks
 * are only queued. At the end of a batch, or on an event flagged tickEnd, the
 * pipeline is ticked once per queued block, so no block is skipped and every
 * node sees them in order.
 *
 * A failing tick is logged (rate-limited) and not rethrown, to keep the
 * consumer thread alive. The node that failed stays initialized and the
 * next block is processed normally.
 */
public final class PipelinePublisher implements EventHandler<SignalEvent> {
    private static final Logger log = LogManager.getLogger(PipelinePublisher.class);

    private final Pipeline pipeline;
    private final StreamSource source;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private PostTickCallback postTick;
    private long failures;

    public PipelinePublisher(Pipeline pipeline) {
        this.pipeline = pipeline;
        if (!(pipeline.getSource() instanceof StreamSource s))
            throw new IllegalArgumentException("PipelinePublisher needs a pipeline fed by a StreamSource, got "
                    + pipeline.getSource());
        this.source = s;
    }

    /**
     * Sets a callback to be invoked after every drained batch.
     */
    public void setPostTickCallback(PostTickCallback cb) {
        this.postTick = cb;
    }

    /**
     * Process a single event from the ring buffer.
     *
     * @param event      The event carried by the ring buffer.
     * @param sequence   The sequence ID of the event.
     * @param endOfBatch Flag indicating if this is the last event in the current
     *                   batch.
     */
    @Override
    public void onEvent(SignalEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.block() != null)
                source.push(event.block());
        } catch (RuntimeException e) {
            failures++;
            errLimiter.log("Rejected block " + event.sequenceId() + ": " + e.getMessage(), e);
            return;
        } finally {
            boolean tickEnd = event.isTickEnd();
            event.clear();
            if (tickEnd || endOfBatch)
                drain();
        }
    }

    private void drain() {
        int ticks = 0, updated = 0;
        while (source.pending() > 0) {
            int before = source.pending();
            ticks++;
            try {
                updated += pipeline.tick();
            } catch (RuntimeException e) {
                failures++;
                errLimiter.log("Pipeline tick " + pipeline.epoch() + " failed: " + e.getMessage(), e);
                // The source itself failed before taking a block; retrying would spin.
                if (source.pending() >= before)
                    break;
            }
        }
        if (ticks > 0 && postTick != null)
            postTick.onTicked(pipeline.epoch(), ticks, updated);
    }

    /** Number of rejected blocks and failed ticks so far. */
    public long failures() {
        return failures;
    }

    /**
     * Callback interface for post-tick actions.
     */
    @FunctionalInterface
    public interface PostTickCallback {
        /**
         * Called after all queued blocks have been ticked through.
         *
         * @param epoch        The pipeline epoch after the last tick.
         * @param ticks        Number of ticks run for this batch.
         * @param nodesUpdated Total node updates across those ticks.
         */
        void onTicked(long epoch, int ticks, int nodesUpdated);
    }
}
