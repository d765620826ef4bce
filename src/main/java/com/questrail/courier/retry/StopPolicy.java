package com.questrail.courier.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides when to give up retrying. Elapsed time is measured on a monotonic
 * clock from the first attempt.
 */
@FunctionalInterface
public interface StopPolicy
{
    boolean shouldStop(int attempts, Duration elapsed);

    /**
     * Stop once {@code maxAttempts} attempts have been made.
     */
    static StopPolicy afterAttempt(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        return (attempts, elapsed) -> attempts >= maxAttempts;
    }

    /**
     * Stop once {@code budget} has elapsed since the first attempt.
     */
    static StopPolicy afterDelay(Duration budget) {
        Objects.requireNonNull(budget, "budget");
        return (attempts, elapsed) -> elapsed.compareTo(budget) >= 0;
    }

    static StopPolicy never() {
        return (attempts, elapsed) -> false;
    }

    default StopPolicy or(StopPolicy other) {
        Objects.requireNonNull(other, "other");
        return (attempts, elapsed) -> shouldStop(attempts, elapsed) || other.shouldStop(attempts, elapsed);
    }
}
