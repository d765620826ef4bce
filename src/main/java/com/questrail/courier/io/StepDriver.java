package com.questrail.courier.io;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Drives an {@link Executable} without blocking: every step is submitted to an
 * executor, and a pending step schedules the next one when its resumption
 * completes. Steps of one executable never overlap.
 */
public final class StepDriver
{
    private StepDriver() {
    }

    public static <R> CompletableFuture<R> drive(Executable<R> executable, Executor executor) {
        CompletableFuture<R> result = new CompletableFuture<>();
        drive(executable, executor, result::complete, result::completeExceptionally);
        return result;
    }

    /**
     * @param onDone  receives the terminal response
     * @param onError receives the terminal failure, unwrapped from completion wrappers
     */
    public static <R> void drive(Executable<R> executable,
                                 Executor executor,
                                 Consumer<? super R> onDone,
                                 Consumer<? super Throwable> onError)
    {
        new Loop<>(
                Objects.requireNonNull(executable, "executable"),
                Objects.requireNonNull(executor, "executor"),
                Objects.requireNonNull(onDone, "onDone"),
                Objects.requireNonNull(onError, "onError")
        ).schedule();
    }

    private static final class Loop<R> {
        private final Executable<R> executable;
        private final Executor executor;
        private final Consumer<? super R> onDone;
        private final Consumer<? super Throwable> onError;

        Loop(Executable<R> executable, Executor executor,
             Consumer<? super R> onDone, Consumer<? super Throwable> onError)
        {
            this.executable = executable;
            this.executor = executor;
            this.onDone = onDone;
            this.onError = onError;
        }

        void schedule() {
            try {
                executor.execute(this::step);
            }
            catch (RejectedExecutionException e) {
                onError.accept(e);
            }
        }

        private void step() {
            Step<R> step;
            try {
                step = executable.execute();
            }
            catch (RuntimeException | Error e) {
                onError.accept(Failure.unwrap(e));
                return;
            }

            if (step instanceof Step.Done<R> done) {
                onDone.accept(done.response());
                return;
            }

            ((Step.Pending<R>) step).resumption().whenComplete((ignored, error) -> {
                if (error != null) {
                    onError.accept(Failure.unwrap(error));
                }
                else {
                    schedule();
                }
            });
        }
    }
}
