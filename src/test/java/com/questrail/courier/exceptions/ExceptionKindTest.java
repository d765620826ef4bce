package com.questrail.courier.exceptions;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionKindTest {

    @Test
    void kindHierarchyMatchesClassHierarchy() {
        for (ExceptionKind kind : ExceptionKind.values()) {
            for (ExceptionKind other : ExceptionKind.values()) {
                assertEquals(
                        other.type().isAssignableFrom(kind.type()),
                        kind.isSubKindOf(other),
                        kind + " vs " + other);
            }
        }
    }

    @Test
    void everyKindIsABaseClientException() {
        for (ExceptionKind kind : ExceptionKind.values()) {
            assertTrue(kind.isSubKindOf(ExceptionKind.BASE_CLIENT_EXCEPTION));
        }
    }

    @Test
    void wrapKeepsNativeCauseAndReportsKind() {
        IOException cause = new IOException("refused");

        ClientException wrapped = ExceptionKind.CONNECTION_TIMEOUT.wrap(cause);

        assertInstanceOf(ConnectionTimeoutException.class, wrapped);
        assertInstanceOf(ConnectionException.class, wrapped);
        assertSame(cause, wrapped.getCause());
        assertEquals("refused", wrapped.getMessage());
        assertEquals(ExceptionKind.CONNECTION_TIMEOUT, wrapped.kind());
    }

    @Test
    void wrapWithoutMessageUsesTypeName() {
        ClientException wrapped = ExceptionKind.SSL_ERROR.wrap(new IOException());

        assertEquals(IOException.class.getName(), wrapped.getMessage());
        assertEquals(ExceptionKind.SSL_ERROR, wrapped.kind());
    }

    @Test
    void siblingsAreNotSubKinds() {
        assertFalse(ExceptionKind.SERVER_TIMEOUT.isSubKindOf(ExceptionKind.CONNECTION_ERROR));
        assertFalse(ExceptionKind.CONNECTION_ERROR.isSubKindOf(ExceptionKind.CONNECTION_TIMEOUT));
        assertFalse(ExceptionKind.INVALID_URL.isSubKindOf(ExceptionKind.SSL_ERROR));
    }

    @Test
    void unavailableRuntimeIsUnsupportedOperation() {
        assertInstanceOf(UnsupportedOperationException.class, new UnavailableRuntimeException("no netty"));
    }
}
