package com.questrail.courier.client.netty;

import com.questrail.courier.api.AsyncClient;
import com.questrail.courier.api.AsyncResponse;
import com.questrail.courier.api.Request;
import com.questrail.courier.api.RequestOptions;
import com.questrail.courier.api.Response;
import com.questrail.courier.client.ClientSettings;
import com.questrail.courier.exceptions.ExceptionKind;
import com.questrail.courier.exceptions.ExceptionTable;
import com.questrail.courier.exceptions.UnavailableRuntimeException;
import com.questrail.courier.io.netty.CooperativeStrategy;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelException;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoop;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.CodecException;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.NotSslRecordException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * NettyClient
 * =============================================================================
 * Cooperative client adapter over Netty's HTTP/1.1 codec.
 *
 * <h2>Exchange model</h2>
 * <ul>
 *   <li>One connection per request ({@code Connection: close}).</li>
 *   <li>{@link #send} completes as soon as the response head arrives; the body
 *       is an asynchronous field of the returned {@link AsyncResponse}.</li>
 *   <li>All I/O and all stage completions happen on the session's event
 *       loops. Nothing in this class blocks a loop.</li>
 * </ul>
 *
 * <h2>Callbacks</h2>
 * Response callbacks written for blocking clients must not run on a loop.
 * {@link #wrapCallback} leaves an {@link AsyncCallback} alone and moves any
 * other callback onto the session's bounded worker pool, handing it a
 * {@link ThreadedResponse}.
 *
 * <h2>Netty containment rule</h2>
 * Netty buffers never leave this package; response content is copied into
 * {@code byte[]} before anyone else sees it.
 */
public final class NettyClient implements AsyncClient<AsyncResponse>
{
    private static final Logger log = LoggerFactory.getLogger(NettyClient.class);

    static final String CODEC_CLASS = "io.netty.handler.codec.http.HttpClientCodec";

    private static final ExceptionTable EXCEPTIONS = ExceptionTable.builder("netty")
            .root(IOException.class)
            .root(ChannelException.class)
            .root(CodecException.class)
            .unwrapping(DecoderException.class)
            .map(io.netty.channel.ConnectTimeoutException.class, ExceptionKind.CONNECTION_TIMEOUT)
            .map(ConnectException.class, ExceptionKind.CONNECTION_ERROR)
            .map(UnknownHostException.class, ExceptionKind.CONNECTION_ERROR)
            .map(ClosedChannelException.class, ExceptionKind.CONNECTION_ERROR)
            .map(ReadTimeoutException.class, ExceptionKind.SERVER_TIMEOUT)
            .map(SSLException.class, ExceptionKind.SSL_ERROR)
            .map(NotSslRecordException.class, ExceptionKind.SSL_ERROR)
            .map(MalformedURLException.class, ExceptionKind.INVALID_URL)
            .map(URISyntaxException.class, ExceptionKind.INVALID_URL)
            .build();

    private final ClientSettings settings;
    private final Function<ClientSettings, NettySession> sessionFactory;
    private final boolean ownsSession;

    private NettySession session;
    private boolean closed;

    public NettyClient() {
        this(ClientSettings.defaults());
    }

    /**
     * Adapter that creates its session on first use and closes it in
     * {@link #close()}.
     *
     * @throws UnavailableRuntimeException if Netty's HTTP codec is missing
     */
    public NettyClient(ClientSettings settings) {
        this(settings, NettySession::create, RuntimeProbe.CLASSPATH);
    }

    /**
     * Adapter over a caller-owned session.
     */
    public NettyClient(NettySession session) {
        requireRuntime(RuntimeProbe.CLASSPATH);
        this.session = Objects.requireNonNull(session, "session");
        this.settings = session.settings();
        this.sessionFactory = null;
        this.ownsSession = false;
    }

    NettyClient(ClientSettings settings, Function<ClientSettings, NettySession> sessionFactory, RuntimeProbe probe) {
        requireRuntime(probe);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.ownsSession = true;
    }

    private static void requireRuntime(RuntimeProbe probe) {
        if (!probe.isAvailable(CODEC_CLASS)) {
            throw new UnavailableRuntimeException(
                    "Netty HTTP codec (" + CODEC_CLASS + ") is not on the class path; add io.netty:netty-codec-http");
        }
    }

    public static ExceptionTable exceptionTable() {
        return EXCEPTIONS;
    }

    @Override
    public ExceptionTable exceptions() {
        return EXCEPTIONS;
    }

    public synchronized NettySession session() {
        if (closed) {
            throw new IllegalStateException("NettyClient is closed");
        }
        if (session == null) {
            session = sessionFactory.apply(settings);
        }
        return session;
    }

    public boolean ownsSession() {
        return ownsSession;
    }

    /**
     * A strategy bound to one of the session's event loops.
     */
    public CooperativeStrategy<AsyncResponse> io() {
        return new CooperativeStrategy<>(session().next());
    }

    @Override
    public CompletionStage<AsyncResponse> send(Request request) {
        Objects.requireNonNull(request, "request");
        CompletableFuture<AsyncResponse> head = new CompletableFuture<>();

        URI uri;
        try {
            uri = validate(RequestOptions.target(request));
        }
        catch (URISyntaxException | MalformedURLException e) {
            head.completeExceptionally(EXCEPTIONS.translate(e));
            return head;
        }

        NettySession current = session();
        boolean tls = "https".equalsIgnoreCase(uri.getScheme());
        String host = uri.getHost();
        int port = uri.getPort() != -1 ? uri.getPort() : (tls ? 443 : 80);
        ResponseHandler handler = new ResponseHandler(head, EXCEPTIONS);
        ClientSettings config = current.settings();

        Bootstrap bootstrap = new Bootstrap()
                .group(current.group())
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, config.connectTimeout().toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (tls) {
                            p.addLast("ssl", current.sslContext().newHandler(ch.alloc(), host, port));
                        }
                        if (!config.responseTimeout().isZero()) {
                            p.addLast("timeout", new ReadTimeoutHandler(config.responseTimeout().toMillis(), TimeUnit.MILLISECONDS));
                        }
                        p.addLast("codec", new HttpClientCodec());
                        p.addLast("response", handler);
                    }
                });

        FullHttpRequest message = toNetty(request, uri, config);
        try {
            bootstrap.connect(host, port).addListener((ChannelFutureListener) connected -> {
                if (!connected.isSuccess()) {
                    message.release();
                    handler.fail(connected.cause());
                    return;
                }
                ChannelFuture written = connected.channel().writeAndFlush(message);
                written.addListener((ChannelFutureListener) w -> {
                    if (!w.isSuccess()) {
                        handler.fail(w.cause());
                        w.channel().close();
                    }
                });
            });
        }
        catch (RejectedExecutionException e) {
            message.release();
            handler.fail(new ClosedChannelException());
        }

        log.trace("Sent {} {}", request.method(), uri);
        return head;
    }

    /**
     * Run a callback on an event loop of this client's session.
     */
    @Override
    public <T> CompletionStage<T> applyCallback(Function<? super AsyncResponse, ? extends T> callback, AsyncResponse response) {
        Objects.requireNonNull(callback, "callback");
        CompletableFuture<T> result = new CompletableFuture<>();
        EventLoop loop = session().next();
        try {
            loop.execute(() -> {
                try {
                    result.complete(callback.apply(response));
                }
                catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        }
        catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Apply any response callback the way this client wants it run: an
     * {@link AsyncCallback} on the loop, anything else through
     * {@link #threadedCallback}.
     */
    public <T> CompletionStage<T> call(Function<?, ?> callback, AsyncResponse response) {
        AsyncCallback<T> wrapped = wrapCallback(callback);
        return applyCallback(wrapped, response).thenCompose(stage -> stage);
    }

    /**
     * An {@link AsyncCallback} is returned unchanged; any other callback is
     * taken to be a blocking {@code Function<Response, T>} and wrapped by
     * {@link #threadedCallback}.
     */
    @SuppressWarnings("unchecked")
    public <T> AsyncCallback<T> wrapCallback(Function<?, ?> callback) {
        Objects.requireNonNull(callback, "callback");
        if (callback instanceof AsyncCallback<?> async) {
            return (AsyncCallback<T>) async;
        }
        return threadedCallback((Function<? super Response, ? extends T>) callback);
    }

    /**
     * Wrap a blocking callback: the body is read on the loop, then the
     * callback runs on the session's worker pool against a
     * {@link ThreadedResponse} whose fields resolve on the loops. A callback
     * that returns the proxy itself yields the underlying {@link AsyncResponse}.
     */
    @SuppressWarnings("unchecked")
    public <T> AsyncCallback<T> threadedCallback(Function<? super Response, ? extends T> callback) {
        Objects.requireNonNull(callback, "callback");
        return response -> {
            NettySession current = session();
            return response.body().thenComposeAsync(ignored -> {
                ThreadedResponse proxy = new ThreadedResponse(response, current.group(), current.group());
                Object result = callback.apply(proxy);
                if (result instanceof ThreadedResponse threaded) {
                    result = threaded.unwrap();
                }
                return CompletableFuture.completedFuture((T) result);
            }, current.workers());
        };
    }

    @Override
    public void close() {
        NettySession toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = ownsSession ? session : null;
            session = null;
        }
        if (toClose != null) {
            toClose.close();
        }
    }

    private static URI validate(String target) throws URISyntaxException, MalformedURLException {
        URI uri = new URI(target);
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new MalformedURLException("Unsupported or missing URL scheme: " + target);
        }
        if (uri.getHost() == null) {
            throw new MalformedURLException("Missing host: " + target);
        }
        return uri;
    }

    private static FullHttpRequest toNetty(Request request, URI uri, ClientSettings settings) {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }

        byte[] body = RequestOptions.body(request);
        FullHttpRequest message = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                HttpMethod.valueOf(request.method().toUpperCase(Locale.ROOT)),
                path,
                Unpooled.wrappedBuffer(body));

        String hostHeader = uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
        message.headers()
                .set(HttpHeaderNames.HOST, hostHeader)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE)
                .set(HttpHeaderNames.USER_AGENT, settings.userAgent());
        settings.defaultHeaders().forEach((name, value) -> message.headers().set(name, value));
        RequestOptions.headers(request).forEach((name, value) -> message.headers().set(name, value));

        if (body.length > 0 || request.options().containsKey(RequestOptions.BODY)) {
            message.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.length);
        }
        return message;
    }
}
