package com.questrail.courier.io;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Outcome of one {@link Executable#execute()} call.
 *
 * <ul>
 *   <li>{@link Pending}: more steps follow; take the next one once
 *       {@link Pending#resumption()} completes. An exceptional resumption
 *       ends the execution with that exception.</li>
 *   <li>{@link Done}: the execution reached its terminal result.</li>
 * </ul>
 */
public sealed interface Step<R> permits Step.Pending, Step.Done
{
    static <R> Step<R> ready() {
        return new Pending<>(CompletableFuture.completedFuture(null));
    }

    record Pending<R>(CompletionStage<Void> resumption) implements Step<R> {
        public Pending {
            Objects.requireNonNull(resumption, "resumption");
        }
    }

    record Done<R>(R response) implements Step<R> {
    }
}
