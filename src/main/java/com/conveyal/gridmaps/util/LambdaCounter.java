package com.conveyal.gridmaps.util;

import org.slf4j.Logger;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts iterations and logs progress from inside lambda expressions, including those within parallel streams.
 * An effectively final instance can have its increment method called from any thread; the count is atomic and a
 * message is logged each time it passes a multiple of the log frequency.
 */
public class LambdaCounter {

    private final Logger logger;

    private final AtomicInteger count = new AtomicInteger();

    private final int total;

    private final int logFrequency;

    private final String message;

    /**
     * Create a counter that will log the number of iterations out of a specified total.
     * It expects a message string with two {} placeholders. The first is the count and the second is the total.
     */
    public LambdaCounter (Logger logger, int total, int logFrequency, String message) {
        if (logFrequency < 1) {
            throw new IllegalArgumentException("Log frequency must be positive.");
        }
        this.logger = logger;
        this.total = total;
        this.logFrequency = logFrequency;
        this.message = message;
    }

    public void increment () {
        int n = count.incrementAndGet();
        if (n % logFrequency == 0) {
            log(message, n);
        }
    }

    public int getCount () {
        return count.get();
    }

    public void done () {
        log("Done. " + message, count.get());
    }

    private void log (String msg, int n) {
        logger.info(msg, n, total);
    }

}
