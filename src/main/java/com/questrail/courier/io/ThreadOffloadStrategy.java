package com.questrail.courier.io;

import com.questrail.courier.api.AsyncClient;
import com.questrail.courier.api.Request;
import com.questrail.courier.time.MonotonicClock;
import com.questrail.courier.time.MonotonicScheduler;
import com.questrail.courier.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * ThreadOffloadStrategy
 * =============================================================================
 * Runs every step and every callback on a worker pool so the caller is never
 * blocked; {@link #execute(Executable)} returns a future of the terminal
 * response.
 *
 * <p>Sleeps are scheduled on a {@link MonotonicScheduler} and resume on a
 * worker; no worker is held while a request sleeps. Terminal handling
 * ({@code finish}/{@code fail}) is that of {@link BlockingStrategy}: the
 * failure thrown there completes the returned future exceptionally.</p>
 *
 * <p>An optional admission hook sees each execution's result future before
 * the first step is scheduled. The owner of the worker pool uses it to keep
 * the pool alive until every admitted execution has settled; throwing from
 * the hook refuses the execution.</p>
 */
public final class ThreadOffloadStrategy<R> implements ExecutionStrategy<R, AsyncClient<R>, CompletableFuture<R>>
{
    private static final Logger log = LoggerFactory.getLogger(ThreadOffloadStrategy.class);

    private final BlockingStrategy<R> terminal = new BlockingStrategy<>();
    private final Executor workers;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Consumer<CompletableFuture<?>> admission;

    public ThreadOffloadStrategy(Executor workers, MonotonicScheduler scheduler) {
        this(workers, scheduler, SystemMonotonicClock.INSTANCE);
    }

    public ThreadOffloadStrategy(Executor workers, MonotonicScheduler scheduler, MonotonicClock clock) {
        this(workers, scheduler, clock, result -> { });
    }

    public ThreadOffloadStrategy(Executor workers,
                                 MonotonicScheduler scheduler,
                                 MonotonicClock clock,
                                 Consumer<CompletableFuture<?>> admission)
    {
        this.workers = Objects.requireNonNull(workers, "workers");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.admission = Objects.requireNonNull(admission, "admission");
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

        pending.whenComplete((response, error) -> dispatch(() -> {
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
            scheduler.scheduleAfter(duration, clock, () -> dispatch(callback::onSuccess));
        }
        catch (RejectedExecutionException e) {
            callback.onFailure(Failure.of(e));
        }
    }

    @Override
    public R finish(R response) {
        return terminal.finish(response);
    }

    @Override
    public void fail(Failure failure) {
        terminal.fail(failure);
    }

    @Override
    public CompletableFuture<R> execute(Executable<R> executable) {
        CompletableFuture<R> result = new CompletableFuture<>();
        admission.accept(result);
        StepDriver.drive(executable, workers, result::complete, result::completeExceptionally);
        return result;
    }

    private void dispatch(Runnable task) {
        try {
            workers.execute(task);
        }
        catch (RejectedExecutionException e) {
            // pool shutting down; run inline so the execution still resolves
            log.debug("Worker pool rejected callback, running it on the completing thread");
            task.run();
        }
    }
}
