package com.questrail.courier.exceptions;

/**
 * TLS negotiation or record processing failed.
 */
public final class SslException extends ConnectionException
{
    public SslException(String message) {
        super(message);
    }

    public SslException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ExceptionKind kind() {
        return ExceptionKind.SSL_ERROR;
    }
}
