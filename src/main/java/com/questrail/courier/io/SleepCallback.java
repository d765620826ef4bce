package com.questrail.courier.io;

/**
 * Continues a request execution after an intended pause.
 */
public interface SleepCallback
{
    void onSuccess();

    /**
     * The pause could not complete (interrupted, scheduler gone).
     */
    void onFailure(Failure failure);
}
