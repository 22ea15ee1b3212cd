package com.workflow.bsp.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging so a persistently failing subscriber or task
 * cannot flood the log. Errors inside the quiet interval are counted and the
 * count is reported with the next message that gets through.
 */
public class ErrorRateLimiter {
    private static final long UNSET = Long.MIN_VALUE;

    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(UNSET);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was written, false if it was suppressed. */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // Check-and-set so only one thread logs per interval
        if ((last != UNSET && now - last < minIntervalNanos) || !lastLogTime.compareAndSet(last, now)) {
            suppressed.incrementAndGet();
            return false;
        }
        long skipped = suppressed.getAndSet(0);
        if (skipped > 0)
            logger.error("{} ({} similar errors suppressed)", message, skipped, t);
        else
            logger.error(message, t);
        return true;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
