package org.example.blueprint.config;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Spaces calls to the generation API at least {@code 1 / callsPerSecond} apart, across every
 * thread sharing this instance. One instance per batch run.
 */
public class GenerationRateLimiter {

    private final long minIntervalNanos;
    private final ReentrantLock lock = new ReentrantLock(true);

    // guarded by lock
    private long lastPermitNanos;
    private boolean permitted;

    public GenerationRateLimiter(double callsPerSecond) {
        this.minIntervalNanos = callsPerSecond > 0
                ? (long) Math.ceil(TimeUnit.SECONDS.toNanos(1) / callsPerSecond)
                : 0L;
    }

    public static GenerationRateLimiter unlimited() {
        return new GenerationRateLimiter(0);
    }

    public boolean isEnabled() {
        return minIntervalNanos > 0;
    }

    public long getMinIntervalNanos() {
        return minIntervalNanos;
    }

    /**
     * Blocks until the caller may issue its call. Waiting callers queue on a fair lock, so the
     * interval between two permits is measured from the previous permit, not from the request.
     *
     * @return the {@link System#nanoTime()} value at which the permit was granted
     */
    public long acquire() throws InterruptedException {
        if (minIntervalNanos == 0) {
            return System.nanoTime();
        }
        lock.lockInterruptibly();
        try {
            long now = System.nanoTime();
            if (permitted) {
                long earliest = lastPermitNanos + minIntervalNanos;
                while (now - earliest < 0) {
                    TimeUnit.NANOSECONDS.sleep(earliest - now);
                    now = System.nanoTime();
                }
            }
            lastPermitNanos = now;
            permitted = true;
            return now;
        } finally {
            lock.unlock();
        }
    }
}
