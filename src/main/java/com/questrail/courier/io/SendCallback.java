package com.questrail.courier.io;

/**
 * Continues a request execution after a send. A strategy invokes exactly one
 * of the two methods, exactly once.
 */
public interface SendCallback<R>
{
    /**
     * @param response the adapter's response
     */
    void onSuccess(R response);

    /**
     * @param failure the translated transport failure
     */
    void onFailure(Failure failure);
}
