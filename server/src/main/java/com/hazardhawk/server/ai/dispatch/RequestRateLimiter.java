package com.hazardhawk.server.ai.dispatch;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum interval of {@code 1000 / targetFps} ms between accepted invocations,
 * measured from the moment the previous invocation was accepted. One limiter is shared by every
 * request of a coordinator, whatever its origin.
 */
public class RequestRateLimiter {

    private final long intervalNanos;
    private final LongSupplier nanoClock;

    // fair, so blocked callers are admitted in arrival order
    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile boolean admittedAny;
    private volatile long nextSlotNanos;

    public RequestRateLimiter(double targetFps) {
        this(targetFps, System::nanoTime);
    }

    public RequestRateLimiter(double targetFps, LongSupplier nanoClock) {
        if (!(targetFps > 0) || Double.isInfinite(targetFps)) {
            throw new IllegalArgumentException("targetFps must be a positive number, got " + targetFps);
        }
        this.intervalNanos = Math.round(TimeUnit.SECONDS.toNanos(1) / targetFps);
        this.nanoClock = nanoClock;
    }

    /**
     * Claims the current slot if the interval has elapsed. Never blocks; returns false while
     * another caller is waiting in {@link #acquire()}.
     */
    public boolean shouldProcessNow() {
        if (!lock.tryLock()) {
            return false;
        }
        try {
            long now = nanoClock.getAsLong();
            if (admittedAny && now - nextSlotNanos < 0) {
                return false;
            }
            admit(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public long timeUntilNextSlotMs() {
        if (!admittedAny) {
            return 0;
        }
        long remaining = nextSlotNanos - nanoClock.getAsLong();
        return remaining <= 0 ? 0 : TimeUnit.NANOSECONDS.toMillis(remaining + TimeUnit.MILLISECONDS.toNanos(1) - 1);
    }

    /**
     * Blocks until the interval since the last accepted invocation has elapsed, then accepts
     * this one. Waiters queue in arrival order, so each waits at most one interval per caller
     * ahead of it.
     *
     * @return milliseconds spent waiting
     */
    public long acquire() throws InterruptedException {
        long start = nanoClock.getAsLong();
        lock.lockInterruptibly();
        try {
            long now = nanoClock.getAsLong();
            while (admittedAny && now - nextSlotNanos < 0) {
                TimeUnit.NANOSECONDS.sleep(nextSlotNanos - now);
                now = nanoClock.getAsLong();
            }
            admit(now);
            return TimeUnit.NANOSECONDS.toMillis(now - start);
        } finally {
            lock.unlock();
        }
    }

    private void admit(long now) {
        admittedAny = true;
        nextSlotNanos = now + intervalNanos;
    }

    public long getIntervalMs() {
        return TimeUnit.NANOSECONDS.toMillis(intervalNanos);
    }
}
