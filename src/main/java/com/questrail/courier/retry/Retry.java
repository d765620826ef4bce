package com.questrail.courier.retry;

import com.questrail.courier.exceptions.ExceptionKind;
import com.questrail.courier.time.MonotonicClock;
import com.questrail.courier.time.SystemMonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry
 * =============================================================================
 * Immutable retry policy. Each request gets its own {@link RetryTemplate}
 * from {@link #newTemplate()}, since templates count attempts.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>condition: any {@link ExceptionKind#BASE_CLIENT_EXCEPTION}</li>
 *   <li>backoff: jittered exponential from 100 ms, doubling, capped at 10 s</li>
 *   <li>stop: after 5 attempts</li>
 * </ul>
 *
 * <pre>{@code
 * Retry<BufferedResponse> retry = Retry.<BufferedResponse>builder()
 *         .when(RetryCondition.raises(ExceptionKind.CONNECTION_ERROR))
 *         .stop(StopPolicy.afterAttempt(3))
 *         .build();
 * context = new ExecutionContext<>(client, client.io(), retry.newTemplate(), request);
 * }</pre>
 */
public final class Retry<R>
{
    private final RetryCondition<R> condition;
    private final Backoff backoff;
    private final StopPolicy stop;
    private final MonotonicClock clock;

    private Retry(Builder<R> builder) {
        this.condition = Objects.requireNonNull(builder.condition, "condition");
        this.backoff = Objects.requireNonNull(builder.backoff, "backoff");
        this.stop = Objects.requireNonNull(builder.stop, "stop");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    public RetryTemplate<R> newTemplate() {
        return new RetryTemplate<>(condition, backoff, stop, clock);
    }

    public static final class Builder<R> {
        private RetryCondition<R> condition = RetryCondition.raises(ExceptionKind.BASE_CLIENT_EXCEPTION);
        private Backoff backoff = Backoff.jittered(Duration.ofMillis(100), 2.0, Duration.ofSeconds(10));
        private StopPolicy stop = StopPolicy.afterAttempt(5);
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder<R> when(RetryCondition<R> condition) {
            this.condition = condition;
            return this;
        }

        public Builder<R> backoff(Backoff backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder<R> stop(StopPolicy stop) {
            this.stop = stop;
            return this;
        }

        public Builder<R> clock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Retry<R> build() {
            return new Retry<>(this);
        }
    }
}
