package com.questrail.courier.io;

import com.questrail.courier.api.BlockingClient;
import com.questrail.courier.api.Request;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Synchronous execution: every operation runs on the calling thread, sleeps
 * block it, and {@link #execute(Executable)} returns the terminal response or
 * throws the terminal failure.
 */
public final class BlockingStrategy<R> implements ExecutionStrategy<R, BlockingClient<R>, R>
{
    /**
     * Blocking pause. Replaceable so tests can run without real delays.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;

        Sleeper THREAD = d -> Thread.sleep(d.toMillis(), d.toNanosPart() % 1_000_000);
    }

    private final Sleeper sleeper;

    public BlockingStrategy() {
        this(Sleeper.THREAD);
    }

    public BlockingStrategy(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public void send(BlockingClient<R> client, Request request, SendCallback<R> callback) {
        R response;
        try {
            response = client.send(request);
        }
        catch (RuntimeException e) {
            callback.onFailure(ExecutionStrategy.failureOf(client, e));
            return;
        }
        // outside the try: a callback error is not a send failure
        callback.onSuccess(response);
    }

    @Override
    public void sleep(Duration duration, SleepCallback callback) {
        try {
            sleeper.sleep(duration);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            callback.onFailure(Failure.of(e));
            return;
        }
        callback.onSuccess();
    }

    @Override
    public R execute(Executable<R> executable) {
        while (true) {
            Step<R> step = executable.execute();
            if (step instanceof Step.Done<R> done) {
                return done.response();
            }

            Step.Pending<R> pending = (Step.Pending<R>) step;
            try {
                pending.resumption().toCompletableFuture().join();
            }
            catch (CompletionException | CancellationException e) {
                throw Failure.of(e).propagate();
            }
        }
    }
}
