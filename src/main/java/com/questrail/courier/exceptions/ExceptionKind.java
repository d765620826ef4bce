package com.questrail.courier.exceptions;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * ExceptionKind
 * =============================================================================
 * The shared, transport-independent failure categories.
 *
 * <pre>
 *   BASE_CLIENT_EXCEPTION
 *    ├── CONNECTION_ERROR
 *    │    ├── CONNECTION_TIMEOUT
 *    │    └── SSL_ERROR
 *    ├── SERVER_TIMEOUT
 *    └── INVALID_URL
 * </pre>
 *
 * <p>The kind hierarchy mirrors the {@link ClientException} class hierarchy,
 * so "is-a" questions can be answered either with {@code instanceof} on the
 * exception or with {@link #isSubKindOf(ExceptionKind)} on the kind.</p>
 */
public enum ExceptionKind
{
    BASE_CLIENT_EXCEPTION(null, ClientException.class, ClientException::new),
    CONNECTION_ERROR(BASE_CLIENT_EXCEPTION, ConnectionException.class, ConnectionException::new),
    CONNECTION_TIMEOUT(CONNECTION_ERROR, ConnectionTimeoutException.class, ConnectionTimeoutException::new),
    SSL_ERROR(CONNECTION_ERROR, SslException.class, SslException::new),
    SERVER_TIMEOUT(BASE_CLIENT_EXCEPTION, ServerTimeoutException.class, ServerTimeoutException::new),
    INVALID_URL(BASE_CLIENT_EXCEPTION, InvalidUrlException.class, InvalidUrlException::new);

    private final ExceptionKind parent;
    private final Class<? extends ClientException> type;
    private final BiFunction<String, Throwable, ? extends ClientException> factory;

    ExceptionKind(ExceptionKind parent,
                  Class<? extends ClientException> type,
                  BiFunction<String, Throwable, ? extends ClientException> factory)
    {
        this.parent = parent;
        this.type = type;
        this.factory = factory;
    }

    /**
     * The exception class callers catch for this kind.
     */
    public Class<? extends ClientException> type() {
        return type;
    }

    /**
     * @return {@code true} if this kind equals {@code other} or descends from it
     */
    public boolean isSubKindOf(ExceptionKind other) {
        Objects.requireNonNull(other, "other");
        for (ExceptionKind k = this; k != null; k = k.parent) {
            if (k == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * Create an exception of this kind wrapping a native transport failure.
     */
    public ClientException wrap(Throwable nativeError) {
        Objects.requireNonNull(nativeError, "nativeError");
        String message = nativeError.getMessage() != null
                ? nativeError.getMessage()
                : nativeError.getClass().getName();
        return factory.apply(message, nativeError);
    }
}
