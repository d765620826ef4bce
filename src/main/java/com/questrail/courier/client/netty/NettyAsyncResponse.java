package com.questrail.courier.client.netty;

import com.questrail.courier.api.AsyncResponse;

import java.nio.charset.Charset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Response head received from a Netty channel, with the body still arriving.
 * The body stage completes on the channel's event loop.
 */
final class NettyAsyncResponse implements AsyncResponse
{
    private final int status;
    private final Map<String, List<String>> headers;
    private final Charset charset;
    private final CompletableFuture<byte[]> body;

    NettyAsyncResponse(int status, Map<String, List<String>> headers, Charset charset, CompletableFuture<byte[]> body) {
        this.status = status;
        this.headers = Map.copyOf(headers);
        this.charset = charset;
        this.body = body;
    }

    @Override
    public int status() {
        return status;
    }

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }

    @Override
    public CompletionStage<byte[]> body() {
        return body.thenApply(byte[]::clone);
    }

    @Override
    public CompletionStage<String> text() {
        return body.thenApply(bytes -> new String(bytes, charset));
    }

    @Override
    public String toString() {
        return "NettyAsyncResponse[status=" + status + (body.isDone() ? ", complete]" : ", streaming]");
    }
}
