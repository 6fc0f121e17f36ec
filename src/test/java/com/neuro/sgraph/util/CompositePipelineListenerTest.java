package com.neuro.sgraph.util;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.neuro.sgraph.api.NodeState;
import com.neuro.sgraph.api.PipelineListener;

public class CompositePipelineListenerTest {

    private static PipelineListener recorder(String id, List<String> out) {
        return new PipelineListener() {
            @Override
            public void onTickStart(long epoch) {
                out.add(id + ":start");
            }

            @Override
            public void onNodeUpdated(long epoch, int index, String nodeName, NodeState state, long durationNanos) {
                out.add(id + ":" + nodeName);
            }

            @Override
            public void onNodeError(long epoch, int index, String nodeName, Throwable error) {
                out.add(id + ":error");
            }

            @Override
            public void onTickEnd(long epoch, int nodesUpdated) {
                out.add(id + ":end");
            }
        };
    }

    @Test
    public void testFansOutInOrder() {
        List<String> events = new ArrayList<>();
        CompositePipelineListener composite = new CompositePipelineListener();
        composite.add(recorder("a", events));
        composite.add(recorder("b", events));
        assertEquals(2, composite.size());

        composite.onTickStart(1);
        composite.onNodeUpdated(1, 0, "src", NodeState.READY, 10);
        composite.onNodeError(1, 1, "env", new RuntimeException());
        composite.onTickEnd(1, 1);

        assertEquals(List.of("a:start", "b:start", "a:src", "b:src", "a:error", "b:error", "a:end", "b:end"),
                events);
    }

    @Test
    public void testFailingListenerDoesNotStopTheOthers() {
        List<String> events = new ArrayList<>();
        CompositePipelineListener composite = new CompositePipelineListener();
        composite.add(new PipelineListener() {
            @Override
            public void onTickStart(long epoch) {
                throw new IllegalStateException("broken dashboard");
            }

            @Override
            public void onNodeUpdated(long epoch, int index, String nodeName, NodeState state, long durationNanos) {
            }

            @Override
            public void onNodeError(long epoch, int index, String nodeName, Throwable error) {
                throw new IllegalStateException("broken dashboard");
            }

            @Override
            public void onTickEnd(long epoch, int nodesUpdated) {
            }
        });
        composite.add(recorder("b", events));

        composite.onTickStart(1);
        composite.onNodeError(1, 0, "src", new RuntimeException("device lost"));
        composite.onTickEnd(1, 0);

        assertEquals(List.of("b:start", "b:error", "b:end"), events);
        assertEquals(2, composite.failures());
    }

    @Test
    public void testEmptyCompositeIsNoOp() {
        CompositePipelineListener composite = new CompositePipelineListener();
        composite.onTickStart(1);
        composite.onTickEnd(1, 0);
        assertEquals(0, composite.size());
    }
}
