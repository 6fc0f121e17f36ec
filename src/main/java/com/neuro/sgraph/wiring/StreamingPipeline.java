package com.neuro.sgraph.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.engine.Pipeline;

import lombok.extern.log4j.Log4j2;

/**
 * Runs a pipeline behind an LMAX Disruptor ring buffer.
 *
 * Acquisition threads call {@link #publish(SignalBlock)}; a single daemon
 * consumer thread queues the blocks in the pipeline's source and ticks it
 * through a {@link PipelinePublisher}. The pipeline must not be touched from
 * any other thread while the ring buffer is running.
 *
 * Sample usage:
 *
 * <pre>
 * StreamingPipeline streaming = new StreamingPipeline(pipeline, 1024);
 * streaming.start();
 * streaming.publish(block);
 * ...
 * streaming.stop();
 * </pre>
 */
@Log4j2
public final class StreamingPipeline {
    private final Pipeline pipeline;
    private final PipelinePublisher publisher;
    private final Disruptor<SignalEvent> disruptor;
    private RingBuffer<SignalEvent> ringBuffer;
    private long nextSequenceId;

    /**
     * @param bufferSize Ring buffer size, a power of two.
     */
    public StreamingPipeline(Pipeline pipeline, int bufferSize) {
        if (Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("Ring buffer size must be a power of two, got " + bufferSize);
        this.pipeline = pipeline;
        this.publisher = new PipelinePublisher(pipeline);
        this.disruptor = new Disruptor<>(
                SignalEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(publisher);
    }

    public PipelinePublisher publisher() {
        return publisher;
    }

    /**
     * Initializes the pipeline, if needed, and starts the consumer thread.
     */
    public synchronized void start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Already started");
        if (!pipeline.getSource().isInitialized())
            pipeline.initializeAll();
        ringBuffer = disruptor.start();
        log.info("Streaming started, ring buffer size {}", ringBuffer.getBufferSize());
    }

    public void publish(SignalBlock block) {
        publish(block, false);
    }

    /**
     * Hands a block to the consumer thread.
     *
     * @param tickEnd If true, the pipeline ticks right after this block even
     *                when more are waiting.
     */
    public synchronized void publish(SignalBlock block, boolean tickEnd) {
        if (ringBuffer == null)
            throw new IllegalStateException("Not started");
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(block, tickEnd, nextSequenceId++);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Waits until every published block has been processed, then stops the
     * consumer thread.
     */
    public synchronized void stop() {
        if (ringBuffer == null)
            return;
        disruptor.shutdown();
        ringBuffer = null;
        log.info("Streaming stopped after {} blocks, {} failures", nextSequenceId, publisher.failures());
    }
}
