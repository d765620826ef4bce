package com.questrail.courier.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Delay before the next attempt.
 */
@FunctionalInterface
public interface Backoff
{
    /**
     * @param attempt number of attempts made so far (1 after the first failure)
     */
    Duration nextDelay(int attempt);

    static Backoff fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative");
        }
        return attempt -> delay;
    }

    /**
     * {@code base * multiplier^(attempt - 1)}, never more than {@code cap}.
     */
    static Backoff exponential(Duration base, double multiplier, Duration cap) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(cap, "cap");
        if (base.isNegative() || cap.isNegative()) {
            throw new IllegalArgumentException("base and cap must be non-negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        return attempt -> {
            double nanos = base.toNanos() * Math.pow(multiplier, Math.max(0, attempt - 1));
            if (nanos >= cap.toNanos()) {
                return cap;
            }
            return Duration.ofNanos((long) nanos);
        };
    }

    /**
     * Full jitter: a uniformly random delay between zero and {@code inner}'s.
     *
     * @param random values in {@code [0, 1)}
     */
    static Backoff jittered(Backoff inner, DoubleSupplier random) {
        Objects.requireNonNull(inner, "inner");
        Objects.requireNonNull(random, "random");
        return attempt -> {
            long ceiling = inner.nextDelay(attempt).toNanos();
            return Duration.ofNanos((long) (ceiling * random.getAsDouble()));
        };
    }

    static Backoff jittered(Duration base, double multiplier, Duration cap) {
        return jittered(exponential(base, multiplier, cap), () -> ThreadLocalRandom.current().nextDouble());
    }
}
