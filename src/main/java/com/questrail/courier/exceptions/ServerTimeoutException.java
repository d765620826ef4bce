package com.questrail.courier.exceptions;

/**
 * The connection was established but the server did not answer in time.
 */
public final class ServerTimeoutException extends ClientException
{
    public ServerTimeoutException(String message) {
        super(message);
    }

    public ServerTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ExceptionKind kind() {
        return ExceptionKind.SERVER_TIMEOUT;
    }
}
