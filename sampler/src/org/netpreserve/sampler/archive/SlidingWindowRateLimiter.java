package org.netpreserve.sampler.archive;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Allows at most {@code calls} grants within any sliding window of length {@code period}.
 * <p>
 * The times of the most recent grants are kept in a queue. A caller is admitted once the oldest of them has left the
 * window. The lock is fair so waiting callers are admitted roughly in arrival order and none starve.
 */
public class SlidingWindowRateLimiter implements RateLimiter {
    private final int calls;
    private final long periodNanos;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition windowAdvanced = lock.newCondition();
    private final Deque<Long> grants = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int calls, Duration period) {
        if (calls <= 0) throw new IllegalArgumentException("calls must be positive");
        if (period.isNegative() || period.isZero()) throw new IllegalArgumentException("period must be positive");
        this.calls = calls;
        this.periodNanos = period.toNanos();
    }

    @Override
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                long now = System.nanoTime();
                while (!grants.isEmpty() && now - grants.peekFirst() >= periodNanos) {
                    grants.pollFirst();
                }
                if (grants.size() < calls) {
                    grants.addLast(now);
                    windowAdvanced.signal();
                    return;
                }
                long waitNanos = grants.peekFirst() + periodNanos - now;
                windowAdvanced.await(waitNanos, TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    public int calls() {
        return calls;
    }

    public Duration period() {
        return Duration.ofNanos(periodNanos);
    }
}
