package com.questrail.courier.io.netty;

import com.questrail.courier.api.AsyncClient;
import com.questrail.courier.api.Request;
import com.questrail.courier.io.Executable;
import com.questrail.courier.io.ExecutionStrategy;
import com.questrail.courier.io.Failure;
import com.questrail.courier.io.SendCallback;
import com.questrail.courier.io.SleepCallback;
import com.questrail.courier.io.StepDriver;
import io.netty.channel.EventLoop;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * CooperativeStrategy
 * =============================================================================
 * Single-threaded cooperative execution on one Netty {@link EventLoop}.
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>Every step, send continuation and sleep wake-up runs on the bound loop,
 *       so a request's state is only ever touched by that thread.</li>
 *   <li>Sleeps use {@link EventLoop#schedule}; nothing blocks the loop.</li>
 *   <li>{@link #execute(Executable)} returns a promise of the same loop.</li>
 * </ul>
 *
 * <p>Netty types do not leave this package except for the returned
 * {@link Future}, which is the cooperative model's native handle.</p>
 */
public final class CooperativeStrategy<R> implements ExecutionStrategy<R, AsyncClient<R>, Future<R>>
{
    private final EventLoop eventLoop;

    public CooperativeStrategy(EventLoop eventLoop) {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    }

    public EventLoop eventLoop() {
        return eventLoop;
    }

    @Override
    public void send(AsyncClient<R> client, Request request, SendCallback<R> callback) {
        CompletionStage<R> pending;
        try {
            pending = client.send(request);
        }
        catch (RuntimeException e) {
            callback.onFailure(ExecutionStrategy.failureOf(client, e));
            return;
        }

        pending.whenComplete((response, error) -> onLoop(() -> {
            if (error != null) {
                callback.onFailure(ExecutionStrategy.failureOf(client, error));
            }
            else {
                callback.onSuccess(response);
            }
        }));
    }

    @Override
    public void sleep(Duration duration, SleepCallback callback) {
        try {
            eventLoop.schedule(() -> callback.onSuccess(), duration.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (RejectedExecutionException e) {
            callback.onFailure(Failure.of(e));
        }
    }

    @Override
    public Future<R> execute(Executable<R> executable) {
        Promise<R> promise = eventLoop.newPromise();
        StepDriver.drive(executable, eventLoop, promise::trySuccess, promise::tryFailure);
        return promise;
    }

    private void onLoop(Runnable task) {
        if (eventLoop.inEventLoop()) {
            task.run();
            return;
        }
        try {
            eventLoop.execute(task);
        }
        catch (RejectedExecutionException e) {
            // loop already terminated; nobody else can run the continuation
            task.run();
        }
    }
}
