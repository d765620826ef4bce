package com.questrail.courier.client.netty;

import com.questrail.courier.api.AsyncResponse;

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * A response callback that is already non-blocking: it reads asynchronous
 * fields through their stages and never waits on them.
 *
 * <p>{@link NettyClient#wrapCallback} passes these through untouched; any
 * other callback is assumed to block and is moved off the event loop.</p>
 */
@FunctionalInterface
public interface AsyncCallback<T> extends Function<AsyncResponse, CompletionStage<T>>
{
}
