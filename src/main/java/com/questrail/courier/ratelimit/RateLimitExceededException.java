package com.questrail.courier.ratelimit;

import com.questrail.courier.exceptions.ClientException;

import java.time.Duration;

/**
 * A request was refused locally because its rate limit window is exhausted.
 */
public final class RateLimitExceededException extends ClientException
{
    private final Duration retryAfter;

    public RateLimitExceededException(String group, Duration retryAfter) {
        super("Rate limit exceeded for " + group + "; next window opens in " + retryAfter.toMillis() + " ms");
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
