package com.questrail.courier.client;

import com.questrail.courier.api.AsyncClient;
import com.questrail.courier.api.BlockingClient;
import com.questrail.courier.api.FakeBlockingClient;
import com.questrail.courier.api.Request;
import com.questrail.courier.exceptions.ConnectionException;
import com.questrail.courier.exceptions.ExceptionTable;
import com.questrail.courier.exceptions.UnavailableRuntimeException;
import com.questrail.courier.io.ExecutionContext;
import com.questrail.courier.io.RequestTemplate;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class ThreadOffloadClientTest {

    private static final Request REQUEST = Request.of("GET", "http://localhost/offload");

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not reached in time");
            }
            Thread.sleep(5);
        }
    }

    /**
     * Blocking client whose sends wait for {@link #open}.
     */
    private static final class GatedClient implements BlockingClient<String> {
        final CountDownLatch gate = new CountDownLatch(1);
        final AtomicInteger entered = new AtomicInteger();
        final Set<String> threads = ConcurrentHashMap.newKeySet();
        volatile int closes;

        @Override
        public String send(Request request) {
            entered.incrementAndGet();
            threads.add(Thread.currentThread().getName());
            try {
                gate.await(5, TimeUnit.SECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "gated " + request.url();
        }

        void open() {
            gate.countDown();
        }

        @Override
        public ExceptionTable exceptions() {
            return FakeBlockingClient.TABLE;
        }

        @Override
        public void close() {
            closes++;
        }
    }

    @Test
    void sendRunsDelegateOnAWorker() throws Exception {
        BlockingClient<String> recordingThread = new BlockingClient<>() {
            @Override
            public String send(Request request) {
                return Thread.currentThread().getName();
            }

            @Override
            public ExceptionTable exceptions() {
                return FakeBlockingClient.TABLE;
            }

            @Override
            public void close() {
            }
        };

        try (ThreadOffloadClient<String> client = new ThreadOffloadClient<>(recordingThread)) {
            String thread = client.send(REQUEST).toCompletableFuture().get(5, TimeUnit.SECONDS);

            assertTrue(thread.startsWith("courier-offload-"));
        }
    }

    @Test
    void delegateFailureFailsTheFuture() {
        FakeBlockingClient<String> delegate = new FakeBlockingClient<String>().raise(new ConnectionException("refused"));

        try (ThreadOffloadClient<String> client = new ThreadOffloadClient<>(delegate)) {
            CompletableFuture<String> future = client.send(REQUEST).toCompletableFuture();

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ConnectionException.class, e.getCause());
        }
    }

    @Test
    void exceptionTableIsTheDelegates() {
        ExceptionTable table = ExceptionTable.builder("custom").root(IOException.class).build();

        try (ThreadOffloadClient<String> client = new ThreadOffloadClient<>(new FakeBlockingClient<>(table))) {
            assertSame(table, client.exceptions());
        }
    }

    @Test
    void applyCallbackRunsOnAWorker() throws Exception {
        try (ThreadOffloadClient<String> client = new ThreadOffloadClient<>(new FakeBlockingClient<String>())) {
            String result = client.applyCallback(r -> r + "@" + Thread.currentThread().getName(), "resp")
                    .toCompletableFuture().get(5, TimeUnit.SECONDS);

            assertTrue(result.startsWith("resp@courier-offload-"));
        }
    }

    @Test
    void shutDownPoolIsUnavailable() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        pool.shutdown();

        assertThrows(UnavailableRuntimeException.class,
                () -> new ThreadOffloadClient<>(new FakeBlockingClient<String>(), pool));
    }

    @Test
    void closeWaitsForOutstandingRequestsBeforeClosingDelegate() throws Exception {
        GatedClient delegate = new GatedClient();
        ThreadOffloadClient<String> client = new ThreadOffloadClient<>(delegate);

        CompletableFuture<String> inFlight = client.send(REQUEST).toCompletableFuture();
        assertEquals(1, client.outstanding());

        client.close();
        assertEquals(0, delegate.closes);
        assertThrows(IllegalStateException.class, () -> client.send(REQUEST));

        delegate.open();
        assertEquals("gated http://localhost/offload", inFlight.get(5, TimeUnit.SECONDS));
        awaitCondition(() -> delegate.closes == 1);
        assertEquals(0, client.outstanding());

        client.close();
        assertEquals(1, delegate.closes);
    }

    @Test
    void idleCloseReleasesDelegateImmediately() {
        FakeBlockingClient<String> delegate = new FakeBlockingClient<>();
        ThreadOffloadClient<String> client = new ThreadOffloadClient<>(delegate);

        client.close();

        assertEquals(1, delegate.closeCount());
    }

    @Test
    void callerPoolIsNotShutDown() {
        ExecutorService pool = Executors.newFixedThreadPool(1);
        try {
            new ThreadOffloadClient<>(new FakeBlockingClient<String>(), pool).close();

            assertFalse(pool.isShutdown());
        }
        finally {
            pool.shutdownNow();
        }
    }

    @Test
    void executesThroughTheStateMachine() throws Exception {
        FakeBlockingClient<String> delegate = new FakeBlockingClient<String>().respond("offloaded");

        try (ThreadOffloadClient<String> client = new ThreadOffloadClient<>(delegate)) {
            ExecutionContext<String, AsyncClient<String>, CompletableFuture<String>> context =
                    new ExecutionContext<>(client, client.io(), RequestTemplate.defaults(), REQUEST);

            assertEquals("offloaded", context.start().get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void ownedPoolQueuesABurstInsteadOfGrowing() throws Exception {
        GatedClient delegate = new GatedClient();
        List<CompletableFuture<String>> sends = new ArrayList<>();

        try (ThreadOffloadClient<String> client = new ThreadOffloadClient<>(delegate)) {
            for (int i = 0; i < 200; i++) {
                sends.add(client.send(REQUEST).toCompletableFuture());
            }
            awaitCondition(() -> delegate.entered.get() == ThreadOffloadClient.DEFAULT_WORKER_THREADS);
            Thread.sleep(50);
            assertEquals(ThreadOffloadClient.DEFAULT_WORKER_THREADS, delegate.entered.get());

            delegate.open();
            CompletableFuture.allOf(sends.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);
        }

        assertEquals(200, delegate.entered.get());
        assertTrue(delegate.threads.size() <= ThreadOffloadClient.DEFAULT_WORKER_THREADS,
                "distinct worker threads: " + delegate.threads.size());
    }

    @Test
    void explicitPoolSizeBoundsWorkers() throws Exception {
        GatedClient delegate = new GatedClient();
        delegate.open();
        List<CompletableFuture<String>> sends = new ArrayList<>();

        try (ThreadOffloadClient<String> client = new ThreadOffloadClient<>(delegate, 2)) {
            for (int i = 0; i < 50; i++) {
                sends.add(client.send(REQUEST).toCompletableFuture());
            }
            CompletableFuture.allOf(sends.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);
        }

        assertTrue(delegate.threads.size() <= 2, "distinct worker threads: " + delegate.threads.size());
    }

    @Test
    void nonPositivePoolSizeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ThreadOffloadClient<>(new FakeBlockingClient<String>(), 0));
    }

    @Test
    void closeMidExecutionLetsTheExecutionFinish() throws Exception {
        GatedClient delegate = new GatedClient();
        ThreadOffloadClient<String> client = new ThreadOffloadClient<>(delegate);
        ExecutionContext<String, AsyncClient<String>, CompletableFuture<String>> context =
                new ExecutionContext<>(client, client.io(), RequestTemplate.defaults(), REQUEST);

        CompletableFuture<String> result = context.start();
        awaitCondition(() -> delegate.entered.get() == 1);
        assertEquals(2, client.outstanding());

        client.close();
        delegate.open();

        assertEquals("gated http://localhost/offload", result.get(5, TimeUnit.SECONDS));
        awaitCondition(() -> delegate.closes == 1);
        assertEquals(0, client.outstanding());
    }

    @Test
    void executionStartedAfterCloseIsRefused() {
        ThreadOffloadClient<String> client = new ThreadOffloadClient<>(new FakeBlockingClient<String>());
        ExecutionContext<String, AsyncClient<String>, CompletableFuture<String>> context =
                new ExecutionContext<>(client, client.io(), RequestTemplate.defaults(), REQUEST);

        client.close();

        assertThrows(IllegalStateException.class, context::start);
    }
}
