package com.questrail.courier.io;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * The normalized representation of any failure once it has crossed the
 * client adapter boundary: exception type, exception value and a snapshot
 * of its stack trace.
 */
public record Failure(Class<? extends Throwable> type, Throwable value, List<StackTraceElement> trace)
{
    public Failure {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        trace = List.copyOf(Objects.requireNonNull(trace, "trace"));
    }

    /**
     * Capture a failure, looking through future-completion wrappers.
     */
    public static Failure of(Throwable error) {
        Throwable cause = unwrap(Objects.requireNonNull(error, "error"));
        return new Failure(cause.getClass(), cause, Arrays.asList(cause.getStackTrace()));
    }

    /**
     * @return {@code true} if the failure is an instance of {@code kind}
     */
    public boolean is(Class<? extends Throwable> kind) {
        return kind.isInstance(value);
    }

    /**
     * The exception to throw when this failure becomes terminal.
     * Unchecked values are thrown as they are, errors are rethrown directly,
     * checked values are carried by a {@link CompletionException}.
     */
    public RuntimeException propagate() {
        if (value instanceof RuntimeException runtime) {
            return runtime;
        }
        if (value instanceof Error error) {
            throw error;
        }
        return new CompletionException(value);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public String toString() {
        return "Failure[" + type.getSimpleName() + ": " + value.getMessage() + "]";
    }
}
