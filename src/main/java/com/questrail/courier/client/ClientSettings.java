package com.questrail.courier.client;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ClientSettings
 * -----------------------------------------------------------------------------
 * Settings a client adapter uses when it builds its own transport session.
 *
 * <p>Adapters constructed around a caller-supplied session ignore these;
 * the caller configured that session already.</p>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: maximum time to establish a connection
 *       (TCP and TLS handshake).</li>
 *   <li><b>responseTimeout</b>: maximum inactivity while waiting for response
 *       data. {@link Duration#ZERO} disables the limit.</li>
 *   <li><b>userAgent</b>: {@code User-Agent} sent when a request sets none.</li>
 *   <li><b>defaultHeaders</b>: headers added to every request unless the
 *       request overrides them.</li>
 *   <li><b>ioThreads</b>: event loop threads for cooperative sessions.</li>
 * </ul>
 */
public record ClientSettings(
        Duration connectTimeout,
        Duration responseTimeout,
        String userAgent,
        Map<String, String> defaultHeaders,
        int ioThreads
) {
    public static final String DEFAULT_USER_AGENT = "courier/0.1";

    public ClientSettings {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        Objects.requireNonNull(userAgent, "userAgent");
        defaultHeaders = Map.copyOf(Objects.requireNonNull(defaultHeaders, "defaultHeaders"));

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (responseTimeout.isNegative()) {
            throw new IllegalArgumentException("responseTimeout must be non-negative");
        }
        if (ioThreads < 1) {
            throw new IllegalArgumentException("ioThreads must be >= 1");
        }
    }

    public static ClientSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withConnectTimeout(connectTimeout)
                .withResponseTimeout(responseTimeout)
                .withUserAgent(userAgent)
                .withDefaultHeaders(defaultHeaders)
                .withIoThreads(ioThreads);
    }

    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration responseTimeout = Duration.ofSeconds(30);
        private String userAgent = DEFAULT_USER_AGENT;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private int ioThreads = 1;

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public Builder withUserAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder withDefaultHeader(String name, String value) {
            this.defaultHeaders.put(name, value);
            return this;
        }

        public Builder withDefaultHeaders(Map<String, String> headers) {
            this.defaultHeaders.clear();
            this.defaultHeaders.putAll(headers);
            return this;
        }

        public Builder withIoThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        public ClientSettings build() {
            return new ClientSettings(connectTimeout, responseTimeout, userAgent, defaultHeaders, ioThreads);
        }
    }
}
