package com.questrail.courier.ratelimit;

import com.questrail.courier.time.MonotonicClock;
import com.questrail.courier.time.SystemMonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-window limiter: at most {@code calls} permits per {@code period},
 * windows measured on a monotonic clock. Thread-safe.
 */
public final class RateLimiter
{
    private final int calls;
    private final long periodNanos;
    private final MonotonicClock clock;

    private long windowStart;
    private int used;

    public RateLimiter(int calls, Duration period) {
        this(calls, period, SystemMonotonicClock.INSTANCE);
    }

    public RateLimiter(int calls, Duration period, MonotonicClock clock) {
        Objects.requireNonNull(period, "period");
        if (calls < 1) {
            throw new IllegalArgumentException("calls must be >= 1");
        }
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive");
        }
        this.calls = calls;
        this.periodNanos = period.toNanos();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.windowStart = clock.nowNanos();
    }

    /**
     * Take a permit from the current window if one is left.
     */
    public synchronized boolean tryAcquire() {
        roll();
        if (used < calls) {
            used++;
            return true;
        }
        return false;
    }

    /**
     * Time until the current window closes and permits are restored.
     */
    public synchronized Duration untilNextWindow() {
        roll();
        long remaining = windowStart + periodNanos - clock.nowNanos();
        return Duration.ofNanos(Math.max(0, remaining));
    }

    private void roll() {
        long now = clock.nowNanos();
        long elapsed = now - windowStart;
        if (elapsed >= periodNanos) {
            // align to the period grid so windows do not drift
            windowStart = now - (elapsed % periodNanos);
            used = 0;
        }
    }
}
