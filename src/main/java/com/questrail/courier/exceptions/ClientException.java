package com.questrail.courier.exceptions;

/**
 * Root of the transport-independent failure taxonomy.
 *
 * <p>Every failure that crosses a client adapter boundary is an instance of
 * this class or one of its subclasses; catching {@code ClientException}
 * catches every transport failure regardless of which HTTP library produced
 * it. The native exception, when there is one, is kept as the cause.</p>
 */
public class ClientException extends RuntimeException
{
    public ClientException(String message) {
        super(message);
    }

    public ClientException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The taxonomy kind this exception represents.
     */
    public ExceptionKind kind() {
        return ExceptionKind.BASE_CLIENT_EXCEPTION;
    }
}
