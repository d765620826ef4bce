package com.questrail.courier.exceptions;

/**
 * Establishing the connection took longer than the configured connect timeout.
 */
public final class ConnectionTimeoutException extends ConnectionException
{
    public ConnectionTimeoutException(String message) {
        super(message);
    }

    public ConnectionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ExceptionKind kind() {
        return ExceptionKind.CONNECTION_TIMEOUT;
    }
}
