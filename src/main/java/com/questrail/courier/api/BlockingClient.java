package com.questrail.courier.api;

import java.util.function.Function;

/**
 * A client adapter whose send blocks the calling thread.
 */
public interface BlockingClient<R> extends Client<R>
{
    /**
     * Perform exactly one request/response exchange.
     *
     * @throws com.questrail.courier.exceptions.ClientException on transport failure
     */
    R send(Request request);

    /**
     * Apply a caller transform to a response on the calling thread.
     */
    default <T> T applyCallback(Function<? super R, ? extends T> callback, R response) {
        return callback.apply(response);
    }
}
