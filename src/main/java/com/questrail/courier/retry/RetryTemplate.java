package com.questrail.courier.retry;

import com.questrail.courier.api.Request;
import com.questrail.courier.io.Failure;
import com.questrail.courier.io.RequestTemplate;
import com.questrail.courier.io.Transition;
import com.questrail.courier.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-request retry hooks.
 *
 * <ul>
 *   <li>Counts attempts in {@code beforeRequest}; the first one starts the
 *       elapsed-time budget.</li>
 *   <li>A matching failure or response turns into a sleep for the backoff
 *       delay, after which the request is prepared and sent again.</li>
 *   <li>Once the stop policy says so, the hook returns nothing and the
 *       default outcome (finish or fail) applies.</li>
 * </ul>
 *
 * Not thread-safe; one instance per execution.
 */
public final class RetryTemplate<R> implements RequestTemplate<R>
{
    private static final Logger log = LoggerFactory.getLogger(RetryTemplate.class);

    private final RetryCondition<R> condition;
    private final Backoff backoff;
    private final StopPolicy stop;
    private final MonotonicClock clock;

    private int attempts;
    private long firstAttemptNanos;

    RetryTemplate(RetryCondition<R> condition, Backoff backoff, StopPolicy stop, MonotonicClock clock) {
        this.condition = condition;
        this.backoff = backoff;
        this.stop = stop;
        this.clock = clock;
    }

    /**
     * Attempts made so far.
     */
    public int attempts() {
        return attempts;
    }

    @Override
    public Optional<Transition<R>> beforeRequest(Request request) {
        if (attempts == 0) {
            firstAttemptNanos = clock.nowNanos();
        }
        attempts++;
        return Optional.empty();
    }

    @Override
    public Optional<Transition<R>> afterResponse(Request request, R response) {
        if (!condition.matchesResponse(response)) {
            return Optional.empty();
        }
        return retry(request, "response " + response);
    }

    @Override
    public Optional<Transition<R>> afterException(Request request, Failure failure) {
        if (!condition.matchesFailure(failure)) {
            return Optional.empty();
        }
        return retry(request, failure.toString());
    }

    private Optional<Transition<R>> retry(Request request, String reason) {
        Duration elapsed = Duration.ofNanos(clock.nowNanos() - firstAttemptNanos);
        if (stop.shouldStop(attempts, elapsed)) {
            log.debug("Giving up on {} {} after {} attempt(s): {}", request.method(), request.url(), attempts, reason);
            return Optional.empty();
        }

        Duration delay = backoff.nextDelay(attempts);
        log.debug("Retrying {} {} in {} ms (attempt {} failed: {})",
                request.method(), request.url(), delay.toMillis(), attempts, reason);
        return Optional.of(Transition.sleep(delay));
    }
}
