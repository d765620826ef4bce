package com.questrail.courier.exceptions;

/**
 * A client adapter or execution strategy was requested whose runtime support
 * (Netty's HTTP codec, a live worker pool) is not available.
 *
 * <p>Always raised at construction time, never on first use.</p>
 */
public final class UnavailableRuntimeException extends UnsupportedOperationException
{
    public UnavailableRuntimeException(String message) {
        super(message);
    }
}
