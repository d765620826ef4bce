package com.questrail.courier.io;

import com.questrail.courier.api.Client;
import com.questrail.courier.api.Request;

import java.time.Duration;

/**
 * ExecutionStrategy
 * =============================================================================
 * The concurrency model a request execution runs under.
 *
 * <p>The request state machine is written once; everything that depends on
 * <em>where</em> and <em>when</em> code runs is delegated to exactly these five
 * operations. A strategy is paired with the client adapter shape it can drive
 * ({@code C}) and determines what {@link #execute(Executable)} hands back to
 * the caller ({@code O}): the response itself, a future or an event-loop
 * promise.</p>
 *
 * <h2>Callback contract</h2>
 * <ul>
 *   <li>{@link #send} never throws a transport failure past its boundary; it
 *       invokes exactly one of {@link SendCallback#onSuccess} and
 *       {@link SendCallback#onFailure}, exactly once.</li>
 *   <li>{@link #sleep} invokes {@link SleepCallback#onSuccess} once the delay
 *       has elapsed, without blocking any shared thread unless the model is
 *       blocking.</li>
 * </ul>
 *
 * @param <R> the response type of the paired client adapter
 * @param <C> the client adapter shape this strategy drives
 * @param <O> what {@link #execute(Executable)} returns
 */
public interface ExecutionStrategy<R, C extends Client<R>, O>
{
    /**
     * Perform one request/response exchange and continue via the callback.
     */
    void send(C client, Request request, SendCallback<R> callback);

    /**
     * Pause for the given duration, then continue via the callback.
     */
    void sleep(Duration duration, SleepCallback callback);

    /**
     * Transform the terminal response. The identity by default.
     */
    default R finish(R response) {
        return response;
    }

    /**
     * Propagate a terminal failure in the concurrency model's idiom.
     * This method never returns normally.
     */
    default void fail(Failure failure) {
        throw failure.propagate();
    }

    /**
     * Drive an executable until it is done.
     */
    O execute(Executable<R> executable);

    /**
     * Capture a send failure, translating it through the client's exception
     * table when the adapter let a native transport exception slip through.
     */
    static Failure failureOf(Client<?> client, Throwable error) {
        Throwable cause = Failure.unwrap(error);
        if (client.exceptions().recognizes(cause)) {
            return Failure.of(client.exceptions().translate(cause));
        }
        return Failure.of(cause);
    }
}
