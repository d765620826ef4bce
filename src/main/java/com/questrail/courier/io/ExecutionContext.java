package com.questrail.courier.io;

import com.questrail.courier.api.Client;
import com.questrail.courier.api.Request;
import com.questrail.courier.observability.ExecutionErrorEvent;
import com.questrail.courier.observability.ExecutionListener;
import com.questrail.courier.observability.NullExecutionListener;
import com.questrail.courier.observability.StateTransitionEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * ExecutionContext
 * =============================================================================
 * Drives one request through its {@link RequestState} lifecycle.
 *
 * <p>A context binds a client adapter, the {@link ExecutionStrategy} that can
 * drive it, the caller's {@link RequestTemplate} and the request. It owns
 * exactly one live state at a time.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * var context = new ExecutionContext<>(client, client.io(), template, request);
 * BufferedResponse response = context.start();
 * }</pre>
 * Callers that need control over stepping call {@link #execute()} until it
 * returns {@link Step.Done}, waiting on each {@link Step.Pending#resumption()}.
 *
 * <h2>Concurrency</h2>
 * State replacement is a compare-and-swap against the state the step started
 * from. Two threads stepping the same context concurrently are detected and
 * fail with {@link IllegalStateException}; they are never merged.
 *
 * @param <R> response type
 * @param <C> client adapter shape
 * @param <O> what {@link #start()} returns
 */
public final class ExecutionContext<R, C extends Client<R>, O> implements Executable<R>
{
    private final C client;
    private final ExecutionStrategy<R, C, O> strategy;
    private final RequestTemplate<R> template;
    private final ExecutionListener listener;
    private final AtomicReference<RequestState<R>> state;

    public ExecutionContext(C client,
                            ExecutionStrategy<R, C, O> strategy,
                            RequestTemplate<R> template,
                            Request request)
    {
        this(client, strategy, template, request, NullExecutionListener.INSTANCE);
    }

    public ExecutionContext(C client,
                            ExecutionStrategy<R, C, O> strategy,
                            RequestTemplate<R> template,
                            Request request,
                            ExecutionListener listener)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.template = Objects.requireNonNull(template, "template");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.state = new AtomicReference<>(
                RequestState.created(Objects.requireNonNull(request, "request")));
    }

    public C client() {
        return client;
    }

    public ExecutionStrategy<R, C, O> strategy() {
        return strategy;
    }

    public RequestTemplate<R> template() {
        return template;
    }

    /**
     * Snapshot of the current state.
     */
    public RequestState<R> state() {
        return state.get();
    }

    /**
     * Take exactly one step.
     *
     * @throws IllegalRequestStateTransition if a template requested a transition
     *         the current state does not allow
     */
    @Override
    public Step<R> execute() {
        RequestState<R> current = state.get();
        try {
            return current.execute(this);
        }
        catch (IllegalRequestStateTransition e) {
            reportDefect(current.request(), e);
            throw e;
        }
    }

    /**
     * Hand this context to its strategy and return the strategy's result.
     */
    public O start() {
        return strategy.execute(this);
    }

    // ---------------------------------------------------------------------
    // State machine callbacks
    // ---------------------------------------------------------------------

    void advance(RequestState<R> expected, RequestState<R> next) {
        if (!state.compareAndSet(expected, next)) {
            throw new IllegalStateException(
                    "Request state changed concurrently: expected " + expected + " but found " + state.get());
        }
        listener.onStateTransition(new StateTransitionEvent(Instant.now(), expected, next));
    }

    /**
     * Complete an asynchronous step: compute the next state, install it, then
     * release whoever is waiting on the resumption. Any error ends up on the
     * resumption instead of the strategy's callback thread.
     */
    void resume(RequestState<R> expected, CompletableFuture<Void> resumption, Supplier<RequestState<R>> next) {
        try {
            advance(expected, next.get());
            resumption.complete(null);
        }
        catch (IllegalRequestStateTransition e) {
            reportDefect(expected.request(), e);
            resumption.completeExceptionally(e);
        }
        catch (RuntimeException | Error e) {
            resumption.completeExceptionally(e);
        }
    }

    void send(Request request, SendCallback<R> callback) {
        strategy.send(client, request, callback);
    }

    void sleep(Duration duration, SleepCallback callback) {
        strategy.sleep(duration, callback);
    }

    R finish(R response) {
        return strategy.finish(response);
    }

    void fail(Request request, Failure failure) {
        listener.onError(new ExecutionErrorEvent(Instant.now(), request, failure.toString(), failure.value()));
        strategy.fail(failure);
    }

    private void reportDefect(Request request, IllegalRequestStateTransition e) {
        listener.onError(new ExecutionErrorEvent(Instant.now(), request, e.getMessage(), e));
    }

    @Override
    public String toString() {
        return "ExecutionContext[" + state.get() + "]";
    }
}
