package com.questrail.courier.client.netty;

import com.questrail.courier.client.ClientSettings;
import com.questrail.courier.exceptions.ExceptionKind;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettySession
 * =============================================================================
 * The transport session of {@link NettyClient}: event loops, TLS context and
 * the bounded worker pool that runs synchronous callbacks off the loops.
 *
 * <p>Whoever creates a session closes it. A {@link NettyClient} built around
 * an existing session leaves it open.</p>
 */
public final class NettySession implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettySession.class);

    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final ExecutorService workers;
    private final ClientSettings settings;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public NettySession(EventLoopGroup group, SslContext sslContext, int workerThreads, ClientSettings settings) {
        this.group = Objects.requireNonNull(group, "group");
        this.sslContext = Objects.requireNonNull(sslContext, "sslContext");
        this.settings = Objects.requireNonNull(settings, "settings");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
        this.workers = Executors.newFixedThreadPool(workerThreads, new DefaultThreadFactory("courier-callback", true));
    }

    /**
     * Build a session with its own event loops, sized from {@code settings}.
     */
    public static NettySession create(ClientSettings settings) {
        Objects.requireNonNull(settings, "settings");
        SslContext ssl;
        try {
            ssl = SslContextBuilder.forClient().build();
        }
        catch (SSLException e) {
            throw ExceptionKind.SSL_ERROR.wrap(e);
        }

        EventLoopGroup group = new NioEventLoopGroup(settings.ioThreads(), new DefaultThreadFactory("courier-netty", true));
        log.debug("Created Netty session with {} event loop(s)", settings.ioThreads());
        return new NettySession(group, ssl, Math.max(2, settings.ioThreads()), settings);
    }

    public EventLoopGroup group() {
        return group;
    }

    /**
     * One of this session's event loops, round robin.
     */
    public EventLoop next() {
        return group.next();
    }

    public SslContext sslContext() {
        return sslContext;
    }

    /**
     * Bounded pool for work that must not run on an event loop.
     */
    public ExecutorService workers() {
        return workers;
    }

    public ClientSettings settings() {
        return settings;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        workers.shutdown();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        log.debug("Closed Netty session");
    }
}
