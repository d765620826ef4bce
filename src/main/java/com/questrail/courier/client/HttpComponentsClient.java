package com.questrail.courier.client;

import com.questrail.courier.api.BlockingClient;
import com.questrail.courier.api.Request;
import com.questrail.courier.api.RequestOptions;
import com.questrail.courier.exceptions.ExceptionKind;
import com.questrail.courier.exceptions.ExceptionTable;
import com.questrail.courier.io.BlockingStrategy;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.HttpHostConnectException;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.NoHttpResponseException;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.support.ClassicRequestBuilder;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * HttpComponentsClient
 * =============================================================================
 * Synchronous client adapter over Apache HttpClient 5 (classic I/O).
 *
 * <h2>Session</h2>
 * <ul>
 *   <li>Constructed with a {@link CloseableHttpClient}: the caller owns it and
 *       {@link #close()} leaves it open.</li>
 *   <li>Constructed with {@link ClientSettings} (or nothing): the session is
 *       built on first use and closed by {@link #close()}, once.</li>
 * </ul>
 *
 * <h2>Responses</h2>
 * Each exchange is fully buffered into a {@link BufferedResponse} before the
 * connection is released, so the response stays usable after the session is
 * closed.
 */
public final class HttpComponentsClient implements BlockingClient<BufferedResponse>
{
    private static final Logger log = LoggerFactory.getLogger(HttpComponentsClient.class);

    private static final ExceptionTable EXCEPTIONS = ExceptionTable.builder("httpclient5")
            .root(IOException.class)
            .map(ConnectTimeoutException.class, ExceptionKind.CONNECTION_TIMEOUT)
            .map(HttpHostConnectException.class, ExceptionKind.CONNECTION_ERROR)
            .map(ConnectException.class, ExceptionKind.CONNECTION_ERROR)
            .map(UnknownHostException.class, ExceptionKind.CONNECTION_ERROR)
            .map(NoHttpResponseException.class, ExceptionKind.CONNECTION_ERROR)
            .map(SocketTimeoutException.class, ExceptionKind.SERVER_TIMEOUT)
            .map(SSLException.class, ExceptionKind.SSL_ERROR)
            .map(MalformedURLException.class, ExceptionKind.INVALID_URL)
            .map(URISyntaxException.class, ExceptionKind.INVALID_URL)
            .build();

    private final ClientSettings settings;
    private final Function<ClientSettings, CloseableHttpClient> sessionFactory;
    private final boolean ownsSession;

    private CloseableHttpClient session;
    private boolean closed;

    /**
     * Adapter that builds its own session from default settings.
     */
    public HttpComponentsClient() {
        this(ClientSettings.defaults());
    }

    /**
     * Adapter that builds, and later closes, its own session.
     */
    public HttpComponentsClient(ClientSettings settings) {
        this(settings, HttpComponentsClient::create);
    }

    /**
     * Adapter over a caller-owned session. {@link #close()} never closes it.
     */
    public HttpComponentsClient(CloseableHttpClient session) {
        this.settings = ClientSettings.defaults();
        this.sessionFactory = null;
        this.session = Objects.requireNonNull(session, "session");
        this.ownsSession = false;
    }

    HttpComponentsClient(ClientSettings settings, Function<ClientSettings, CloseableHttpClient> sessionFactory) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.ownsSession = true;
    }

    /**
     * The translation table for Apache HttpClient 5 failures.
     */
    public static ExceptionTable exceptionTable() {
        return EXCEPTIONS;
    }

    /**
     * Build a session configured from {@code settings}.
     */
    public static CloseableHttpClient create(ClientSettings settings) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(settings.connectTimeout().toMillis()))
                .setSocketTimeout(timeout(settings.responseTimeout()))
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(timeout(settings.responseTimeout()))
                .build();

        List<Header> headers = new ArrayList<>();
        settings.defaultHeaders().forEach((name, value) -> headers.add(new BasicHeader(name, value)));

        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .setDefaultRequestConfig(requestConfig)
                .setDefaultHeaders(headers)
                .setUserAgent(settings.userAgent())
                .build();
    }

    /**
     * A strategy that drives this adapter on the calling thread.
     */
    public BlockingStrategy<BufferedResponse> io() {
        return new BlockingStrategy<>();
    }

    @Override
    public ExceptionTable exceptions() {
        return EXCEPTIONS;
    }

    /**
     * The transport session, created now if this adapter owns it and has not
     * needed it yet.
     */
    public synchronized CloseableHttpClient session() {
        if (closed) {
            throw new IllegalStateException("HttpComponentsClient is closed");
        }
        if (session == null) {
            session = sessionFactory.apply(settings);
            log.debug("Created HttpClient session (connectTimeout={}, responseTimeout={})",
                    settings.connectTimeout(), settings.responseTimeout());
        }
        return session;
    }

    public boolean ownsSession() {
        return ownsSession;
    }

    @Override
    public BufferedResponse send(Request request) {
        Objects.requireNonNull(request, "request");
        try {
            URI uri = validate(RequestOptions.target(request));

            ClassicRequestBuilder builder = ClassicRequestBuilder.create(request.method()).setUri(uri);
            RequestOptions.headers(request).forEach(builder::setHeader);
            if (request.options().containsKey(RequestOptions.BODY)) {
                builder.setEntity(new ByteArrayEntity(RequestOptions.body(request), ContentType.DEFAULT_BINARY));
            }

            return session().execute(builder.build(), HttpComponentsClient::buffer);
        }
        catch (IOException | URISyntaxException e) {
            throw EXCEPTIONS.translate(e);
        }
    }

    @Override
    public void close() {
        CloseableHttpClient toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = ownsSession ? session : null;
            session = null;
        }

        if (toClose == null) {
            return;
        }
        try {
            toClose.close();
            log.debug("Closed HttpClient session");
        }
        catch (IOException e) {
            log.warn("Failed to close HttpClient session: {}", e.getMessage(), e);
        }
    }

    private static URI validate(String target) throws URISyntaxException, MalformedURLException {
        URI uri = new URI(target);
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new MalformedURLException("Unsupported or missing URL scheme: " + target);
        }
        if (uri.getHost() == null) {
            throw new MalformedURLException("Missing host: " + target);
        }
        return uri;
    }

    private static BufferedResponse buffer(ClassicHttpResponse response) throws IOException {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Header header : response.getHeaders()) {
            headers.computeIfAbsent(header.getName(), k -> new ArrayList<>()).add(header.getValue());
        }

        HttpEntity entity = response.getEntity();
        byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
        return new BufferedResponse(response.getCode(), headers, body, charsetOf(entity));
    }

    private static Charset charsetOf(HttpEntity entity) {
        if (entity == null || entity.getContentType() == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            Charset charset = ContentType.parse(entity.getContentType()).getCharset();
            return charset != null ? charset : StandardCharsets.UTF_8;
        }
        catch (RuntimeException e) {
            log.debug("Unparseable content type '{}', assuming UTF-8", entity.getContentType());
            return StandardCharsets.UTF_8;
        }
    }

    private static Timeout timeout(Duration duration) {
        return duration.isZero() ? Timeout.DISABLED : Timeout.ofMilliseconds(duration.toMillis());
    }
}
