package com.questrail.courier.ratelimit;

import com.questrail.courier.api.Request;
import com.questrail.courier.io.RequestTemplate;
import com.questrail.courier.io.Transition;
import com.questrail.courier.time.MonotonicClock;
import com.questrail.courier.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * RateLimitTemplate
 * =============================================================================
 * Limits how often requests are sent, per group of requests.
 *
 * <p>Every request passing through {@code beforeRequest} takes a permit from
 * its group's {@link RateLimiter}. Without one it either sleeps until the
 * group's window opens (then tries again) or, with {@code raiseOnLimit}, fails
 * with {@link RateLimitExceededException}.</p>
 *
 * <p>Unlike retry templates, one instance is meant to be shared by all
 * requests it limits; it is thread-safe.</p>
 */
public final class RateLimitTemplate<R> implements RequestTemplate<R>
{
    private static final Logger log = LoggerFactory.getLogger(RateLimitTemplate.class);

    /** Groups requests by scheme, host and port of their URL. */
    public static final Function<Request, String> BY_HOST_AND_PORT = RateLimitTemplate::hostAndPort;

    /** One limiter for everything. */
    public static final Function<Request, String> GLOBAL = request -> "*";

    private final int calls;
    private final Duration period;
    private final boolean raiseOnLimit;
    private final Function<Request, String> grouping;
    private final MonotonicClock clock;
    private final ConcurrentMap<String, RateLimiter> limiters = new ConcurrentHashMap<>();

    public RateLimitTemplate(int calls, Duration period) {
        this(calls, period, false, BY_HOST_AND_PORT, SystemMonotonicClock.INSTANCE);
    }

    public RateLimitTemplate(int calls,
                             Duration period,
                             boolean raiseOnLimit,
                             Function<Request, String> grouping,
                             MonotonicClock clock)
    {
        Objects.requireNonNull(period, "period");
        if (calls < 1) {
            throw new IllegalArgumentException("calls must be >= 1");
        }
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive");
        }
        this.calls = calls;
        this.period = period;
        this.raiseOnLimit = raiseOnLimit;
        this.grouping = Objects.requireNonNull(grouping, "grouping");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<Transition<R>> beforeRequest(Request request) {
        String group = grouping.apply(request);
        RateLimiter limiter = limiters.computeIfAbsent(group, g -> new RateLimiter(calls, period, clock));
        if (limiter.tryAcquire()) {
            return Optional.empty();
        }

        Duration wait = limiter.untilNextWindow();
        if (raiseOnLimit) {
            return Optional.of(Transition.fail(new RateLimitExceededException(group, wait)));
        }
        log.debug("Rate limit reached for {}; sleeping {} ms", group, wait.toMillis());
        return Optional.of(Transition.sleep(wait));
    }

    private static String hostAndPort(Request request) {
        try {
            URI uri = new URI(request.url());
            return uri.getScheme() + "://" + uri.getHost() + ":" + uri.getPort();
        }
        catch (URISyntaxException e) {
            // unparseable URLs fail later in the adapter; group them by text
            return request.url();
        }
    }
}
