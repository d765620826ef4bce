package com.questrail.courier.api;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * A response whose head is known but whose body is still arriving.
 *
 * <p>{@link #body()} and {@link #text()} are asynchronous fields: each call
 * returns a stage that completes once the full body has been received.</p>
 */
public interface AsyncResponse
{
    int status();

    Map<String, List<String>> headers();

    CompletionStage<byte[]> body();

    CompletionStage<String> text();
}
