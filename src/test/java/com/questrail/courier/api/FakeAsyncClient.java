package com.questrail.courier.api;

import com.questrail.courier.exceptions.ExceptionTable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Asynchronous client whose sends stay pending until the test completes them.
 */
public final class FakeAsyncClient<R> implements AsyncClient<R> {

    private final List<Request> sent = new ArrayList<>();
    private final List<CompletableFuture<R>> pending = new ArrayList<>();

    @Override
    public synchronized CompletionStage<R> send(Request request) {
        sent.add(request);
        CompletableFuture<R> future = new CompletableFuture<>();
        pending.add(future);
        return future;
    }

    @Override
    public <T> CompletionStage<T> applyCallback(Function<? super R, ? extends T> callback, R response) {
        return CompletableFuture.completedFuture(callback.apply(response));
    }

    public synchronized List<Request> sent() {
        return new ArrayList<>(sent);
    }

    /**
     * The future of the n-th send (0-based).
     */
    public synchronized CompletableFuture<R> send(int index) {
        return pending.get(index);
    }

    @Override
    public ExceptionTable exceptions() {
        return FakeBlockingClient.TABLE;
    }

    @Override
    public void close() {
    }
}
