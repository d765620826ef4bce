package com.questrail.courier.time;

import java.time.Duration;

/**
 * Monotonic clock that only moves when a test moves it. Starts at zero.
 *
 * <p>Retry budgets, rate-limit windows and scheduler deadlines read this
 * clock, so tests can step through seconds of backoff instantly.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private long now;

    @Override
    public synchronized long nowNanos() {
        return now;
    }

    public synchronized void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Monotonic time cannot move backwards: " + delta);
        }
        now = Math.addExact(now, delta.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
