package com.questrail.courier.api;

import com.questrail.courier.exceptions.ExceptionTable;

/**
 * Client
 * =============================================================================
 * Common contract of every client adapter: one transport, one session, one
 * exception table.
 *
 * <h2>Session ownership</h2>
 * An adapter constructed around a caller-supplied session never closes it.
 * An adapter that built its own session (lazily, on first use) closes it in
 * {@link #close()}, exactly once.
 *
 * <h2>Exception containment</h2>
 * Native transport exceptions MUST NOT escape an adapter. Failures surface as
 * {@link com.questrail.courier.exceptions.ClientException} subclasses, and
 * {@link #exceptions()} is the only sanctioned way for calling code to reason
 * about failure kinds.
 *
 * <p>The two send shapes live in {@link BlockingClient} and {@link AsyncClient}.</p>
 *
 * @param <R> the response type this adapter produces
 */
public interface Client<R> extends AutoCloseable
{
    /**
     * This adapter's translation table.
     */
    ExceptionTable exceptions();

    /**
     * Release the session if, and only if, this adapter created it.
     * Idempotent.
     */
    @Override
    void close();
}
