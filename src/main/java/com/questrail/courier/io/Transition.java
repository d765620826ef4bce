package com.questrail.courier.io;

import com.questrail.courier.api.Request;

import java.time.Duration;
import java.util.Objects;

/**
 * Transition
 * -----------------------------------------------------------------------------
 * An explicit lifecycle redirection returned by a {@link RequestTemplate} hook.
 *
 * <p>The machine interprets a transition by invoking the matching method on
 * the current {@link RequestState}; a transition the state does not allow
 * raises {@link IllegalRequestStateTransition}.</p>
 */
public sealed interface Transition<R>
        permits Transition.Prepare, Transition.Send, Transition.Sleep, Transition.Finish, Transition.Fail
{
    RequestState<R> applyTo(RequestState<R> state);

    /** Go back to {@code Prepared} with the given (possibly modified) request. */
    static <R> Transition<R> prepare(Request request) {
        return new Prepare<>(request);
    }

    /** Send the given request now, skipping further preparation. */
    static <R> Transition<R> send(Request request) {
        return new Send<>(request);
    }

    /** Pause, then prepare the same request again. */
    static <R> Transition<R> sleep(Duration duration) {
        return new Sleep<>(duration);
    }

    /** Complete with a synthesized response. */
    static <R> Transition<R> finish(R response) {
        return new Finish<>(response);
    }

    static <R> Transition<R> fail(Failure failure) {
        return new Fail<>(failure);
    }

    static <R> Transition<R> fail(Throwable error) {
        return new Fail<>(Failure.of(error));
    }

    record Prepare<R>(Request request) implements Transition<R> {
        public Prepare {
            Objects.requireNonNull(request, "request");
        }

        @Override
        public RequestState<R> applyTo(RequestState<R> state) {
            return state.prepare(request);
        }
    }

    record Send<R>(Request request) implements Transition<R> {
        public Send {
            Objects.requireNonNull(request, "request");
        }

        @Override
        public RequestState<R> applyTo(RequestState<R> state) {
            return state.send(request);
        }
    }

    record Sleep<R>(Duration duration) implements Transition<R> {
        public Sleep {
            Objects.requireNonNull(duration, "duration");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("duration must be non-negative");
            }
        }

        @Override
        public RequestState<R> applyTo(RequestState<R> state) {
            return state.sleep(duration);
        }
    }

    record Finish<R>(R response) implements Transition<R> {
        @Override
        public RequestState<R> applyTo(RequestState<R> state) {
            return state.finish(response);
        }
    }

    record Fail<R>(Failure failure) implements Transition<R> {
        public Fail {
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public RequestState<R> applyTo(RequestState<R> state) {
            return state.fail(failure);
        }
    }
}
