package com.neuro.sgraph.util;

import static org.junit.Assert.*;

import org.junit.Test;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.ChannelType;
import com.neuro.sgraph.api.SignalBlock;
import com.neuro.sgraph.engine.Pipeline;
import com.neuro.sgraph.node.EnvelopeExtractor;
import com.neuro.sgraph.node.RecordingOutput;
import com.neuro.sgraph.node.StreamSource;

public class LatencyTrackingListenerTest {

    @Test
    public void testTracksTicks() {
        StreamSource source = new StreamSource("eeg", ChannelInfo.of(100, ChannelType.EEG, "Cz"));
        Pipeline pipeline = new Pipeline();
        pipeline.setSource(source);
        pipeline.addProcessor(new EnvelopeExtractor("env"));
        pipeline.addOutput(new RecordingOutput("rec"));
        LatencyTrackingListener latency = new LatencyTrackingListener();
        pipeline.setListener(latency);
        pipeline.initializeAll();

        for (int i = 0; i < 5; i++) {
            source.push(SignalBlock.zeros(1, 32));
            pipeline.tick();
        }

        assertEquals(5, latency.totalTicks());
        assertEquals(0, latency.failedTicks());
        assertEquals(3, latency.lastNodesUpdated());
        assertTrue(latency.minLatencyNanos() <= latency.maxLatencyNanos());
        assertTrue(latency.avgLatencyNanos() >= latency.minLatencyNanos());
        assertTrue(latency.dump().contains("Tick"));

        latency.reset();
        assertEquals(0, latency.totalTicks());
        assertEquals(0, latency.minLatencyNanos());
        assertEquals(0.0, latency.avgLatencyNanos(), 0.0);
    }

    @Test
    public void testCountsFailedTicks() {
        LatencyTrackingListener latency = new LatencyTrackingListener();
        latency.onTickStart(1);
        latency.onNodeError(1, 0, "env", new IllegalStateException("bad input"));
        latency.onTickEnd(1, 0);
        latency.onTickStart(2);
        latency.onTickEnd(2, 3);
        assertEquals(2, latency.totalTicks());
        assertEquals(1, latency.failedTicks());
    }
}
