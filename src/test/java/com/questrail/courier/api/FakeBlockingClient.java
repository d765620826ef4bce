package com.questrail.courier.api;

import com.questrail.courier.exceptions.ExceptionTable;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Scripted blocking client. Each send consumes the next scripted outcome; once
 * the script runs dry the last outcome repeats.
 */
public final class FakeBlockingClient<R> implements BlockingClient<R> {

    public static final ExceptionTable TABLE = ExceptionTable.builder("fake")
            .root(IOException.class)
            .build();

    private final ExceptionTable table;
    private final Deque<Supplier<R>> script = new ArrayDeque<>();
    private final List<Request> sent = new ArrayList<>();
    private Supplier<R> last;
    private int closeCount;

    public FakeBlockingClient() {
        this(TABLE);
    }

    public FakeBlockingClient(ExceptionTable table) {
        this.table = table;
    }

    public synchronized FakeBlockingClient<R> respond(R response) {
        script.add(() -> response);
        return this;
    }

    public synchronized FakeBlockingClient<R> raise(RuntimeException failure) {
        script.add(() -> {
            throw failure;
        });
        return this;
    }

    @Override
    public R send(Request request) {
        Supplier<R> next;
        synchronized (this) {
            sent.add(request);
            next = script.isEmpty() ? last : script.poll();
            last = next;
        }
        if (next == null) {
            throw new IllegalStateException("No scripted outcome for " + request);
        }
        return next.get();
    }

    public synchronized List<Request> sent() {
        return new ArrayList<>(sent);
    }

    @Override
    public ExceptionTable exceptions() {
        return table;
    }

    @Override
    public synchronized void close() {
        closeCount++;
    }

    public synchronized int closeCount() {
        return closeCount;
    }
}
