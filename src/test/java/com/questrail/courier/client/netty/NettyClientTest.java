package com.questrail.courier.client.netty;

import com.questrail.courier.api.AsyncClient;
import com.questrail.courier.api.AsyncResponse;
import com.questrail.courier.api.Request;
import com.questrail.courier.api.RequestOptions;
import com.questrail.courier.api.Response;
import com.questrail.courier.client.ClientSettings;
import com.questrail.courier.client.LoopbackServer;
import com.questrail.courier.exceptions.ConnectionException;
import com.questrail.courier.exceptions.InvalidUrlException;
import com.questrail.courier.exceptions.ServerTimeoutException;
import com.questrail.courier.exceptions.UnavailableRuntimeException;
import com.questrail.courier.io.ExecutionContext;
import com.questrail.courier.io.RequestTemplate;
import io.netty.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class NettyClientTest {

    private LoopbackServer server;
    private NettyClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new LoopbackServer();
        client = new NettyClient(ClientSettings.builder()
                .withConnectTimeout(Duration.ofSeconds(2))
                .withResponseTimeout(Duration.ofMillis(300))
                .build());
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    private AsyncResponse get(String path) throws Exception {
        return client.send(Request.of("GET", server.url(path))).toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    @Test
    void headArrivesFirstAndBodyIsAnAsynchronousField() throws Exception {
        Request request = new Request("GET", server.url("/echo"), Map.of(
                RequestOptions.QUERY, Map.of("q", "a b"),
                RequestOptions.HEADERS, Map.of("X-Probe", "yes")));

        AsyncResponse response = client.send(request).toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals(200, response.status());
        assertEquals("GET q=a+b yes", response.text().toCompletableFuture().get(5, TimeUnit.SECONDS));
        assertEquals(13, response.body().toCompletableFuture().get(5, TimeUnit.SECONDS).length);
    }

    @Test
    void sendsConfiguredUserAgent() throws Exception {
        AsyncResponse response = get("/echo");

        String agent = response.headers().entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase("X-Seen-Agent"))
                .map(e -> e.getValue().get(0))
                .findFirst()
                .orElseThrow();
        assertEquals(ClientSettings.DEFAULT_USER_AGENT, agent);
    }

    @Test
    void errorStatusIsStillAResponse() throws Exception {
        assertEquals(404, get("/status/404").status());
    }

    @Test
    void refusedConnectionFailsWithConnectionError() throws IOException {
        CompletableFuture<AsyncResponse> pending =
                client.send(Request.of("GET", LoopbackServer.refusedUrl())).toCompletableFuture();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ConnectionException.class, e.getCause());
    }

    @Test
    void silentServerFailsWithServerTimeout() {
        CompletableFuture<AsyncResponse> pending =
                client.send(Request.of("GET", server.url("/slow"))).toCompletableFuture();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ServerTimeoutException.class, e.getCause());
    }

    @Test
    void invalidUrlFailsTheStage() {
        CompletableFuture<AsyncResponse> pending =
                client.send(Request.of("GET", "mailto:someone@example.com")).toCompletableFuture();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(InvalidUrlException.class, e.getCause());
    }

    @Test
    void asyncCallbackIsPassedThrough() {
        AsyncCallback<String> callback = AsyncResponse::text;

        assertSame(callback, client.<String>wrapCallback(callback));
    }

    @Test
    void blockingCallbackRunsOffTheLoopAgainstAThreadedResponse() throws Exception {
        AsyncResponse response = get("/echo");
        AtomicReference<Response> seen = new AtomicReference<>();
        Function<Response, String> blocking = r -> {
            seen.set(r);
            return r.text() + "@" + Thread.currentThread().getName();
        };

        String result = client.<String>call(blocking, response).toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals("GET null null", result.substring(0, result.indexOf('@')));
        assertTrue(result.substring(result.indexOf('@') + 1).startsWith("courier-callback"));
        assertInstanceOf(ThreadedResponse.class, seen.get());
    }

    @Test
    void returningTheProxyYieldsTheUnderlyingResponse() throws Exception {
        AsyncResponse response = get("/echo");
        Function<Response, Response> identity = r -> r;

        Object result = client.call(identity, response).toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertSame(response, result);
    }

    @Test
    void missingCodecMakesClientUnavailable() {
        assertThrows(UnavailableRuntimeException.class,
                () -> new NettyClient(ClientSettings.defaults(), NettySession::create, className -> false));
    }

    @Test
    void ownedSessionIsClosedWithTheClient() {
        NettyClient owned = new NettyClient(ClientSettings.defaults());
        NettySession session = owned.session();

        assertTrue(owned.ownsSession());
        owned.close();
        owned.close();

        assertTrue(session.isClosed());
        assertThrows(IllegalStateException.class, owned::session);
    }

    @Test
    void borrowedSessionOutlivesTheClient() {
        NettySession shared = NettySession.create(ClientSettings.defaults());
        try {
            NettyClient borrowed = new NettyClient(shared);

            assertFalse(borrowed.ownsSession());
            borrowed.close();

            assertFalse(shared.isClosed());
        }
        finally {
            shared.close();
        }
    }

    @Test
    void executesCooperativelyOnTheSessionLoop() throws Exception {
        ExecutionContext<AsyncResponse, AsyncClient<AsyncResponse>, Future<AsyncResponse>> context =
                new ExecutionContext<>(client, client.io(), RequestTemplate.defaults(),
                        Request.of("GET", server.url("/echo")));

        Future<AsyncResponse> result = context.start();

        assertTrue(result.await(5, TimeUnit.SECONDS));
        assertTrue(result.isSuccess(), () -> String.valueOf(result.cause()));
        assertEquals("GET null null", result.getNow().text().toCompletableFuture().get(5, TimeUnit.SECONDS));
    }
}
