package com.questrail.courier.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every delay the execution framework reasons about:
 * retry backoff, stop-after-delay budgets and rate limit windows.
 *
 * <h2>Binding invariant</h2>
 * Elapsed-time decisions MUST use a monotonic source. Wall-clock time
 * ({@code Instant.now()}) is reserved for observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful relative to each other.</p>
     */
    long nowNanos();
}
