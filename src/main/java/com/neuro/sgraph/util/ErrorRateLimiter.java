package com.neuro.sgraph.util;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.Logger;

/**
 * Limits how often an error is logged.
 *
 * A pipeline ticking at acquisition rate can fail on every tick for minutes
 * while a device is misconfigured; this keeps such a failure to one line per
 * interval. Suppressed occurrences are counted and reported with the next
 * line that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    /** @return true if the message was logged, false if it was throttled. */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long skipped = suppressed.getAndSet(0);
            if (skipped > 0)
                logger.error("{} ({} similar errors suppressed)", message, skipped, t);
            else
                logger.error(message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
