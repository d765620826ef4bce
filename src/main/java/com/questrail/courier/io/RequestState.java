package com.questrail.courier.io;

import com.questrail.courier.api.Request;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * RequestState
 * =============================================================================
 * One state of a single request's lifecycle.
 *
 * <pre>
 *   Created --prepare--> Prepared --send--> Sending --(success)--> Finished
 *                                             Sending --(failure)--> Failed
 *   {Prepared, Sending} --sleep--> Sleeping --(elapsed)--> Prepared
 * </pre>
 *
 * <h2>Transitions</h2>
 * Each transition method returns the next state without side effects. A state
 * overrides only the transitions valid from it; every other transition throws
 * {@link IllegalRequestStateTransition}. {@link Finished} and {@link Failed}
 * are terminal and allow none.
 *
 * <h2>Stepping</h2>
 * {@link ExecutionContext} calls {@code execute} on its current state to take
 * one step. A state consults its {@link RequestTemplate} hook, falls back to
 * the default transition when the hook returns nothing, and asks the context
 * to install the result. States are immutable apart from the dispatch guard
 * that stops {@link Sending} and {@link Sleeping} from dispatching twice.
 *
 * @param <R> response type
 */
public abstract sealed class RequestState<R>
        permits RequestState.Created, RequestState.Prepared, RequestState.Sending,
                RequestState.Sleeping, RequestState.Finished, RequestState.Failed
{
    private final Request request;

    private RequestState(Request request) {
        this.request = Objects.requireNonNull(request, "request");
    }

    /**
     * The initial state of a new execution.
     */
    public static <R> RequestState<R> created(Request request) {
        return new Created<>(request);
    }

    /**
     * The request this state holds (pending, in flight, or the one that
     * produced the terminal outcome).
     */
    public Request request() {
        return request;
    }

    public boolean isTerminal() {
        return false;
    }

    public String name() {
        return getClass().getSimpleName();
    }

    public RequestState<R> prepare(Request request) {
        throw new IllegalRequestStateTransition(this, "prepare");
    }

    public RequestState<R> send(Request request) {
        throw new IllegalRequestStateTransition(this, "send");
    }

    public RequestState<R> sleep(Duration duration) {
        throw new IllegalRequestStateTransition(this, "sleep");
    }

    public RequestState<R> finish(R response) {
        throw new IllegalRequestStateTransition(this, "finish");
    }

    public RequestState<R> fail(Failure failure) {
        throw new IllegalRequestStateTransition(this, "fail");
    }

    abstract Step<R> execute(ExecutionContext<R, ?, ?> context);

    /**
     * Apply the hook's transition if it returned one, otherwise the default.
     * A hook that throws fails the request; an illegal transition propagates.
     */
    final RequestState<R> decide(Supplier<Optional<Transition<R>>> hook,
                                 Supplier<RequestState<R>> fallback)
    {
        Optional<Transition<R>> override;
        try {
            override = hook.get();
        }
        catch (IllegalRequestStateTransition e) {
            throw e;
        }
        catch (RuntimeException e) {
            return fail(Failure.of(e));
        }

        if (override != null && override.isPresent()) {
            return override.get().applyTo(this);
        }
        return fallback.get();
    }

    @Override
    public String toString() {
        return name() + "[" + request.method() + " " + request.url() + "]";
    }

    public static final class Created<R> extends RequestState<R> {

        Created(Request request) {
            super(request);
        }

        @Override
        public RequestState<R> prepare(Request request) {
            return new Prepared<>(request);
        }

        @Override
        Step<R> execute(ExecutionContext<R, ?, ?> context) {
            context.advance(this, prepare(request()));
            return Step.ready();
        }
    }

    public static final class Prepared<R> extends RequestState<R> {

        Prepared(Request request) {
            super(request);
        }

        @Override
        public RequestState<R> prepare(Request request) {
            return new Prepared<>(request);
        }

        @Override
        public RequestState<R> send(Request request) {
            return new Sending<>(request);
        }

        @Override
        public RequestState<R> sleep(Duration duration) {
            return new Sleeping<>(request(), duration);
        }

        @Override
        public RequestState<R> finish(R response) {
            return new Finished<>(request(), response);
        }

        @Override
        public RequestState<R> fail(Failure failure) {
            return new Failed<>(request(), failure);
        }

        @Override
        Step<R> execute(ExecutionContext<R, ?, ?> context) {
            RequestState<R> next = decide(
                    () -> context.template().beforeRequest(request()),
                    () -> send(request()));
            context.advance(this, next);
            return Step.ready();
        }
    }

    /**
     * The request is in flight. {@code afterResponse} and {@code afterException}
     * are consulted from here, so their overrides are transitions out of
     * {@code Sending}.
     */
    public static final class Sending<R> extends RequestState<R> {

        private final AtomicReference<CompletableFuture<Void>> dispatched = new AtomicReference<>();

        Sending(Request request) {
            super(request);
        }

        @Override
        public RequestState<R> prepare(Request request) {
            return new Prepared<>(request);
        }

        @Override
        public RequestState<R> sleep(Duration duration) {
            return new Sleeping<>(request(), duration);
        }

        @Override
        public RequestState<R> finish(R response) {
            return new Finished<>(request(), response);
        }

        @Override
        public RequestState<R> fail(Failure failure) {
            return new Failed<>(request(), failure);
        }

        @Override
        Step<R> execute(ExecutionContext<R, ?, ?> context) {
            CompletableFuture<Void> resumption = new CompletableFuture<>();
            if (!dispatched.compareAndSet(null, resumption)) {
                return new Step.Pending<>(dispatched.get());
            }

            Request request = request();
            context.send(request, new SendCallback<>() {
                @Override
                public void onSuccess(R response) {
                    context.resume(Sending.this, resumption, () -> decide(
                            () -> context.template().afterResponse(request, response),
                            () -> finish(response)));
                }

                @Override
                public void onFailure(Failure failure) {
                    context.resume(Sending.this, resumption, () -> decide(
                            () -> context.template().afterException(request, failure),
                            () -> fail(failure)));
                }
            });
            return new Step.Pending<>(resumption);
        }
    }

    public static final class Sleeping<R> extends RequestState<R> {

        private final Duration duration;
        private final AtomicReference<CompletableFuture<Void>> dispatched = new AtomicReference<>();

        Sleeping(Request request, Duration duration) {
            super(request);
            this.duration = Objects.requireNonNull(duration, "duration");
        }

        public Duration duration() {
            return duration;
        }

        @Override
        public RequestState<R> prepare(Request request) {
            return new Prepared<>(request);
        }

        @Override
        public RequestState<R> fail(Failure failure) {
            return new Failed<>(request(), failure);
        }

        @Override
        Step<R> execute(ExecutionContext<R, ?, ?> context) {
            CompletableFuture<Void> resumption = new CompletableFuture<>();
            if (!dispatched.compareAndSet(null, resumption)) {
                return new Step.Pending<>(dispatched.get());
            }

            context.sleep(duration, new SleepCallback() {
                @Override
                public void onSuccess() {
                    context.resume(Sleeping.this, resumption, () -> prepare(request()));
                }

                @Override
                public void onFailure(Failure failure) {
                    context.resume(Sleeping.this, resumption, () -> fail(failure));
                }
            });
            return new Step.Pending<>(resumption);
        }

        @Override
        public String toString() {
            return super.toString() + "(" + duration.toMillis() + "ms)";
        }
    }

    public static final class Finished<R> extends RequestState<R> {

        private final R response;

        Finished(Request request, R response) {
            super(request);
            this.response = response;
        }

        public R response() {
            return response;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        Step<R> execute(ExecutionContext<R, ?, ?> context) {
            return new Step.Done<>(context.finish(response));
        }
    }

    public static final class Failed<R> extends RequestState<R> {

        private final Failure failure;

        Failed(Request request, Failure failure) {
            super(request);
            this.failure = Objects.requireNonNull(failure, "failure");
        }

        public Failure failure() {
            return failure;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        Step<R> execute(ExecutionContext<R, ?, ?> context) {
            context.fail(request(), failure);
            throw new IllegalStateException(
                    "Execution strategy did not propagate failure " + failure, failure.value());
        }
    }
}
