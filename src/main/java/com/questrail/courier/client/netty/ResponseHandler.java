package com.questrail.courier.client.netty;

import com.questrail.courier.api.AsyncResponse;
import com.questrail.courier.exceptions.ExceptionTable;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.LastHttpContent;

import java.io.ByteArrayOutputStream;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.CompletableFuture;

/**
 * ResponseHandler
 * -----------------------------------------------------------------------------
 * Collects one HTTP response from a connection.
 *
 * <p>The response head completes {@code head}; content is copied into a plain
 * byte array (no {@link ByteBuf} leaves the pipeline) and completes the body
 * stage on the last chunk, after which the connection is closed. Any failure
 * before that point fails whichever stage is still open, translated through
 * the client's exception table.</p>
 */
final class ResponseHandler extends SimpleChannelInboundHandler<HttpObject>
{
    private final CompletableFuture<AsyncResponse> head;
    private final CompletableFuture<byte[]> body = new CompletableFuture<>();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ExceptionTable exceptions;

    ResponseHandler(CompletableFuture<AsyncResponse> head, ExceptionTable exceptions) {
        this.head = head;
        this.exceptions = exceptions;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, HttpObject msg) {
        if (msg instanceof HttpResponse response) {
            Map<String, List<String>> headers = new LinkedHashMap<>();
            for (Entry<String, String> header : response.headers()) {
                headers.computeIfAbsent(header.getKey(), k -> new ArrayList<>()).add(header.getValue());
            }
            head.complete(new NettyAsyncResponse(
                    response.status().code(),
                    headers,
                    HttpUtil.getCharset(response, StandardCharsets.UTF_8),
                    body));
        }

        if (msg instanceof HttpContent content) {
            ByteBuf data = content.content();
            byte[] bytes = new byte[data.readableBytes()];
            data.getBytes(data.readerIndex(), bytes);
            buffer.writeBytes(bytes);

            if (msg instanceof LastHttpContent) {
                body.complete(buffer.toByteArray());
                ctx.close();
            }
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (!body.isDone()) {
            fail(new ClosedChannelException());
        }
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        fail(cause);
        ctx.close();
    }

    /**
     * Fail the exchange, e.g. when connecting or writing the request failed.
     */
    void fail(Throwable cause) {
        RuntimeException translated = exceptions.translate(cause);
        head.completeExceptionally(translated);
        body.completeExceptionally(translated);
    }
}
