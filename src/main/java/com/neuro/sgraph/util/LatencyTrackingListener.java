package com.neuro.sgraph.util;

import com.neuro.sgraph.api.NodeState;
import com.neuro.sgraph.api.PipelineListener;

import lombok.extern.log4j.Log4j2;

/**
 * Tracks how long pipeline ticks take.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average time per tick (in nanoseconds).</li>
 * <li><b>Throughput:</b> Total number of ticks and failed ticks.</li>
 * <li><b>Workload:</b> Number of nodes updated in the last tick.</li>
 * </ul>
 *
 * <p>
 * Node errors are logged through an {@link ErrorRateLimiter} so a node that
 * fails on every tick does not flood the log.
 */
@Log4j2
public final class LatencyTrackingListener implements PipelineListener {
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private long tickStartNanos, lastLatencyNanos;
    private long totalTicks, totalLatencyNanos, failedTicks;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastNodesUpdated;
    private boolean currentTickFailed;

    @Override
    public void onTickStart(long epoch) {
        currentTickFailed = false;
        tickStartNanos = System.nanoTime();
    }

    @Override
    public void onNodeUpdated(long epoch, int index, String nodeName, NodeState state, long durationNanos) {
        // Per-node timing is not needed for tick latency.
    }

    @Override
    public void onNodeError(long epoch, int index, String nodeName, Throwable error) {
        currentTickFailed = true;
        errLimiter.log(String.format("Pipeline failure at node '%s': %s", nodeName, error.getMessage()), null);
    }

    @Override
    public void onTickEnd(long epoch, int n) {
        lastLatencyNanos = System.nanoTime() - tickStartNanos;
        lastNodesUpdated = n;
        totalTicks++;
        if (currentTickFailed)
            failedTicks++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public double lastLatencyMicros() {
        return lastLatencyNanos / 1000.0;
    }

    public int lastNodesUpdated() {
        return lastNodesUpdated;
    }

    public long totalTicks() {
        return totalTicks;
    }

    public long failedTicks() {
        return failedTicks;
    }

    public double avgLatencyNanos() {
        return totalTicks > 0 ? (double) totalLatencyNanos / totalTicks : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalTicks = 0;
        failedTicks = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %10s | %10s | %10s | %10s | %10s%n", "Metric", "Ticks", "Failed",
                "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("--------------------------------------------------------------------------------\n");
        sb.append(String.format("%-12s | %10d | %10d | %10.2f | %10.2f | %10.2f%n",
                "Tick",
                totalTicks,
                failedTicks,
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        return sb.toString();
    }
}
