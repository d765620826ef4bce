package com.questrail.courier.client.netty;

import com.questrail.courier.api.AsyncResponse;
import com.questrail.courier.api.Response;
import io.netty.util.concurrent.BlockingOperationException;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * ThreadedResponse
 * =============================================================================
 * Synchronous view of an {@link AsyncResponse} for callbacks that were written
 * for blocking clients.
 *
 * <p>Reading an asynchronous field ({@link #body()}, {@link #text()}) resolves
 * it on a bounded resolver executor and blocks only the calling thread until
 * the value is there. The event loops keep running; calling a field from one
 * of them would deadlock, so that fails fast with
 * {@link BlockingOperationException}.</p>
 */
public final class ThreadedResponse implements Response
{
    private final AsyncResponse delegate;
    private final EventExecutorGroup loops;
    private final Executor resolver;

    public ThreadedResponse(AsyncResponse delegate, EventExecutorGroup loops, Executor resolver) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.loops = Objects.requireNonNull(loops, "loops");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * The asynchronous response this proxy reads from.
     */
    public AsyncResponse unwrap() {
        return delegate;
    }

    @Override
    public int status() {
        return delegate.status();
    }

    @Override
    public Map<String, List<String>> headers() {
        return delegate.headers();
    }

    @Override
    public byte[] body() {
        return resolve(delegate::body);
    }

    @Override
    public String text() {
        return resolve(delegate::text);
    }

    private <T> T resolve(Supplier<CompletionStage<T>> field) {
        for (EventExecutor loop : loops) {
            if (loop.inEventLoop()) {
                throw new BlockingOperationException(
                        "ThreadedResponse fields block; read them from the AsyncResponse on an event loop");
            }
        }

        CompletableFuture<T> value = CompletableFuture.supplyAsync(field, resolver)
                .thenCompose(stage -> stage);
        try {
            return value.get();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while reading response");
            cancelled.initCause(e);
            throw cancelled;
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }

    @Override
    public String toString() {
        return "ThreadedResponse[" + delegate + "]";
    }
}
