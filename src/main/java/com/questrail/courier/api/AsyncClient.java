package com.questrail.courier.api;

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * A client adapter whose send returns immediately with a pending result.
 *
 * <p>Failures complete the returned stage exceptionally with a
 * {@link com.questrail.courier.exceptions.ClientException}; the stage may be
 * completed on a worker or event-loop thread chosen by the adapter.</p>
 */
public interface AsyncClient<R> extends Client<R>
{
    CompletionStage<R> send(Request request);

    /**
     * Apply a caller transform to a response where this adapter's model
     * wants it executed (a worker thread, an event loop).
     */
    <T> CompletionStage<T> applyCallback(Function<? super R, ? extends T> callback, R response);
}
