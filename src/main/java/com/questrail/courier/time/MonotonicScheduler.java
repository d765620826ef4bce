package com.questrail.courier.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deferred execution surface used by strategies that must not block a thread
 * while a request sleeps (thread-offload in particular).
 *
 * <p>Deadlines are expressed in monotonic nanoseconds from a
 * {@link MonotonicClock}; wall-clock instants are never accepted.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          task to run
     */
    void scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task after a relative delay measured on {@code clock}.
     */
    default void scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
