package com.questrail.courier.io;

import com.questrail.courier.api.Request;

import java.util.Optional;

/**
 * RequestTemplate
 * =============================================================================
 * Hooks for managing the lifecycle of a request.
 *
 * <p>To change the behavior of one stage, override the matching hook and
 * return the intended {@link Transition}. Returning {@link Optional#empty()}
 * keeps the default: send after {@code beforeRequest}, finish after
 * {@code afterResponse}, fail after {@code afterException}. Conditional
 * overrides (retry while fewer than N attempts were made) simply return
 * empty once the condition stops holding.</p>
 *
 * <p>Templates are owned by the caller. Templates that keep per-request state
 * (attempt counters) must not be shared between concurrent executions.</p>
 */
public interface RequestTemplate<R>
{
    /**
     * Consulted in {@code Prepared}, before the request is sent.
     */
    default Optional<Transition<R>> beforeRequest(Request request) {
        return Optional.empty();
    }

    /**
     * Consulted after a successful send, before the response is committed.
     */
    default Optional<Transition<R>> afterResponse(Request request, R response) {
        return Optional.empty();
    }

    /**
     * Consulted after a failed send, before the failure is committed.
     * Local recovery (retry, backoff) belongs here.
     */
    default Optional<Transition<R>> afterException(Request request, Failure failure) {
        return Optional.empty();
    }

    /**
     * A template that never overrides anything.
     */
    static <R> RequestTemplate<R> defaults() {
        return new RequestTemplate<>() { };
    }
}
