package com.questrail.courier.client;

import com.questrail.courier.api.AsyncClient;
import com.questrail.courier.api.BlockingClient;
import com.questrail.courier.api.Request;
import com.questrail.courier.exceptions.ExceptionTable;
import com.questrail.courier.exceptions.UnavailableRuntimeException;
import com.questrail.courier.io.ThreadOffloadStrategy;
import com.questrail.courier.time.MonotonicScheduler;
import com.questrail.courier.time.ScheduledExecutorScheduler;
import com.questrail.courier.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * ThreadOffloadClient
 * =============================================================================
 * Asynchronous adapter that runs a {@link BlockingClient} on a worker pool.
 *
 * <p>Every {@link #send} and {@link #applyCallback} is submitted to the pool
 * and returns immediately with a future. Failures are the delegate's, so
 * {@link #exceptions()} is the delegate's table.</p>
 *
 * <h2>Shutdown</h2>
 * {@link #close()} stops accepting new work at once, but closes the delegate
 * only after every future already handed out has resolved, including the
 * results of executions started on a strategy from {@link #io()}. A pool this
 * adapter created is shut down at the same point; a caller's pool never is.
 *
 * <p>An owned pool is fixed in size, so a burst of slow requests queues
 * instead of growing one thread per request.</p>
 */
public final class ThreadOffloadClient<R> implements AsyncClient<R>
{
    private static final Logger log = LoggerFactory.getLogger(ThreadOffloadClient.class);

    /** Size of the pool created when the caller does not supply one. */
    public static final int DEFAULT_WORKER_THREADS = 8;

    private final BlockingClient<R> delegate;
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final Set<CompletableFuture<?>> outstanding = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService timer;
    private boolean closed;
    private boolean released;

    /**
     * Offload the default synchronous adapter.
     */
    public static ThreadOffloadClient<BufferedResponse> create() {
        return new ThreadOffloadClient<>(new HttpComponentsClient());
    }

    /**
     * Offload {@code delegate} onto a pool of {@link #DEFAULT_WORKER_THREADS}
     * owned by this adapter.
     */
    public ThreadOffloadClient(BlockingClient<R> delegate) {
        this(delegate, DEFAULT_WORKER_THREADS);
    }

    /**
     * Offload {@code delegate} onto a pool of {@code workerThreads} owned by
     * this adapter.
     */
    public ThreadOffloadClient(BlockingClient<R> delegate, int workerThreads) {
        this(delegate, ownedPool(workerThreads), true);
    }

    /**
     * Offload {@code delegate} onto a caller-owned pool.
     *
     * @throws UnavailableRuntimeException if the pool is already shut down
     */
    public ThreadOffloadClient(BlockingClient<R> delegate, ExecutorService workers) {
        this(delegate, workers, false);
    }

    private ThreadOffloadClient(BlockingClient<R> delegate, ExecutorService workers, boolean ownsWorkers) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.ownsWorkers = ownsWorkers;

        if (workers.isShutdown()) {
            throw new UnavailableRuntimeException("Worker pool is shut down; thread offloading is unavailable");
        }
    }

    public BlockingClient<R> delegate() {
        return delegate;
    }

    /**
     * A strategy that steps requests on this adapter's worker pool and
     * schedules sleeps on a timer owned by this adapter. Executions it
     * starts count as outstanding work until their result settles, and are
     * refused once the adapter is closed.
     */
    public ThreadOffloadStrategy<R> io() {
        return io(new ScheduledExecutorScheduler(timer(), SystemMonotonicClock.INSTANCE));
    }

    public ThreadOffloadStrategy<R> io(MonotonicScheduler scheduler) {
        return new ThreadOffloadStrategy<>(workers, scheduler, SystemMonotonicClock.INSTANCE, this::admit);
    }

    @Override
    public ExceptionTable exceptions() {
        return delegate.exceptions();
    }

    @Override
    public CompletionStage<R> send(Request request) {
        Objects.requireNonNull(request, "request");
        return submit(() -> delegate.send(request));
    }

    @Override
    public <T> CompletionStage<T> applyCallback(Function<? super R, ? extends T> callback, R response) {
        Objects.requireNonNull(callback, "callback");
        return submit(() -> delegate.applyCallback(callback, response));
    }

    /**
     * Number of futures handed out, and executions started through
     * {@link #io()}, that have not resolved yet.
     */
    public int outstanding() {
        return outstanding.size();
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        log.debug("ThreadOffloadClient closing with {} outstanding request(s)", outstanding.size());
        releaseWhenIdle();
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        CompletableFuture<T> future;
        synchronized (this) {
            ensureOpen();
            try {
                future = CompletableFuture.supplyAsync(task, workers);
            }
            catch (RejectedExecutionException e) {
                return CompletableFuture.failedFuture(e);
            }
            outstanding.add(future);
        }
        settleLater(future);
        return future;
    }

    private void admit(CompletableFuture<?> execution) {
        synchronized (this) {
            ensureOpen();
            outstanding.add(execution);
        }
        settleLater(execution);
    }

    private void settleLater(CompletableFuture<?> future) {
        future.whenComplete((ignored, error) -> {
            outstanding.remove(future);
            releaseWhenIdle();
        });
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ThreadOffloadClient is closed");
        }
    }

    private void releaseWhenIdle() {
        ScheduledExecutorService timerToStop;
        synchronized (this) {
            if (!closed || released || !outstanding.isEmpty()) {
                return;
            }
            released = true;
            timerToStop = timer;
        }

        delegate.close();
        if (timerToStop != null) {
            timerToStop.shutdownNow();
        }
        if (ownsWorkers) {
            workers.shutdown();
        }
        log.debug("ThreadOffloadClient released its delegate");
    }

    private synchronized ScheduledExecutorService timer() {
        if (released) {
            throw new IllegalStateException("ThreadOffloadClient is closed");
        }
        if (timer == null) {
            timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("courier-offload-timer"));
        }
        return timer;
    }

    private static ExecutorService ownedPool(int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, was " + workerThreads);
        }
        return Executors.newFixedThreadPool(workerThreads, daemonThreads("courier-offload"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
