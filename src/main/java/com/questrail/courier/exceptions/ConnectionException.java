package com.questrail.courier.exceptions;

/**
 * The remote endpoint could not be reached, or the connection broke before a
 * response was received.
 */
public class ConnectionException extends ClientException
{
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ExceptionKind kind() {
        return ExceptionKind.CONNECTION_ERROR;
    }
}
