package com.questrail.courier.exceptions;

/**
 * The request target is not a usable absolute http(s) URL.
 */
public final class InvalidUrlException extends ClientException
{
    public InvalidUrlException(String message) {
        super(message);
    }

    public InvalidUrlException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ExceptionKind kind() {
        return ExceptionKind.INVALID_URL;
    }
}
