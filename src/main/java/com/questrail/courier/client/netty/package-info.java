/**
 * Netty-backed cooperative client adapter.
 *
 * <h2>Netty containment rule</h2>
 * Netty buffers and channels MUST NOT escape this package. Responses are
 * exposed through {@link com.questrail.courier.api.AsyncResponse} with content
 * copied into {@code byte[]}.
 */
package com.questrail.courier.client.netty;
