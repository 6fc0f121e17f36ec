package com.neuro.sgraph.util;

import java.util.Arrays;

import com.neuro.sgraph.api.NodeState;
import com.neuro.sgraph.api.PipelineListener;

import lombok.extern.log4j.Log4j2;

/**
 * Fans every callback out to several {@link PipelineListener}s, in the order
 * they were added.
 *
 * A listener that throws is logged and skipped for that callback only: the
 * listeners after it still run, and the exception never reaches the pipeline.
 * In particular a failing listener cannot replace the node error that
 * {@link com.neuro.sgraph.engine.Pipeline#tick()} is about to rethrow.
 */
@Log4j2
public class CompositePipelineListener implements PipelineListener {
    private final ErrorRateLimiter errorLimiter = new ErrorRateLimiter(log, 1000);
    private volatile PipelineListener[] listeners = new PipelineListener[0];
    private long failures;

    public synchronized void add(PipelineListener listener) {
        PipelineListener[] old = listeners;
        PipelineListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    /** Number of callbacks that threw since construction. */
    public long failures() {
        return failures;
    }

    @Override
    public void onTickStart(long epoch) {
        for (PipelineListener l : listeners) {
            try {
                l.onTickStart(epoch);
            } catch (RuntimeException e) {
                failed(l, "onTickStart", e);
            }
        }
    }

    @Override
    public void onNodeUpdated(long epoch, int index, String nodeName, NodeState state, long durationNanos) {
        for (PipelineListener l : listeners) {
            try {
                l.onNodeUpdated(epoch, index, nodeName, state, durationNanos);
            } catch (RuntimeException e) {
                failed(l, "onNodeUpdated", e);
            }
        }
    }

    @Override
    public void onNodeError(long epoch, int index, String nodeName, Throwable error) {
        for (PipelineListener l : listeners) {
            try {
                l.onNodeError(epoch, index, nodeName, error);
            } catch (RuntimeException e) {
                failed(l, "onNodeError", e);
            }
        }
    }

    @Override
    public void onTickEnd(long epoch, int nodesUpdated) {
        for (PipelineListener l : listeners) {
            try {
                l.onTickEnd(epoch, nodesUpdated);
            } catch (RuntimeException e) {
                failed(l, "onTickEnd", e);
            }
        }
    }

    private void failed(PipelineListener listener, String callback, RuntimeException e) {
        failures++;
        errorLimiter.log("Listener " + listener.getClass().getName() + " failed in " + callback, e);
    }
}
