package com.questrail.courier.client.netty;

import com.questrail.courier.api.AsyncResponse;
import com.questrail.courier.exceptions.ConnectionException;
import io.netty.channel.DefaultEventLoopGroup;
import io.netty.util.concurrent.BlockingOperationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ThreadedResponseTest {

    private final DefaultEventLoopGroup loops = new DefaultEventLoopGroup(1);
    private final ExecutorService caller = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        caller.shutdownNow();
        loops.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    /**
     * Async response whose body completes when the test says so.
     */
    private static final class PendingResponse implements AsyncResponse {
        final CompletableFuture<byte[]> body = new CompletableFuture<>();

        @Override
        public int status() {
            return 201;
        }

        @Override
        public Map<String, List<String>> headers() {
            return Map.of("Content-Type", List.of("text/plain"));
        }

        @Override
        public CompletionStage<byte[]> body() {
            return body;
        }

        @Override
        public CompletionStage<String> text() {
            return body.thenApply(bytes -> new String(bytes, StandardCharsets.UTF_8));
        }
    }

    @Test
    void headIsAvailableWithoutBlocking() {
        PendingResponse async = new PendingResponse();
        ThreadedResponse response = new ThreadedResponse(async, loops, loops);

        assertEquals(201, response.status());
        assertEquals(List.of("text/plain"), response.headers().get("Content-Type"));
        assertSame(async, response.unwrap());
    }

    @Test
    void fieldBlocksCallerUntilBodyArrives() throws Exception {
        PendingResponse async = new PendingResponse();
        ThreadedResponse response = new ThreadedResponse(async, loops, loops);

        Future<String> text = caller.submit(response::text);
        Thread.sleep(50);
        assertFalse(text.isDone());

        // the loop keeps serving other work while the caller waits
        io.netty.util.concurrent.Future<String> loopTask = loops.next().submit(() -> "loop free");
        assertTrue(loopTask.await(1, TimeUnit.SECONDS));
        assertEquals("loop free", loopTask.getNow());
        assertFalse(text.isDone());

        async.body.complete("payload".getBytes(StandardCharsets.UTF_8));

        assertEquals("payload", text.get(5, TimeUnit.SECONDS));
        assertArrayEquals("payload".getBytes(StandardCharsets.UTF_8), response.body());
    }

    @Test
    void bodyFailureIsRethrownUnwrapped() {
        PendingResponse async = new PendingResponse();
        async.body.completeExceptionally(new ConnectionException("reset"));
        ThreadedResponse response = new ThreadedResponse(async, loops, loops);

        assertThrows(ConnectionException.class, response::body);
    }

    @Test
    void readingOnAnEventLoopFailsFast() throws InterruptedException {
        PendingResponse async = new PendingResponse();
        ThreadedResponse response = new ThreadedResponse(async, loops, loops);

        io.netty.util.concurrent.Future<String> onLoop = loops.next().submit(response::text);

        assertTrue(onLoop.await(5, TimeUnit.SECONDS));
        assertInstanceOf(BlockingOperationException.class, onLoop.cause());
    }
}
