package com.questrail.courier.api;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Option keys understood by the bundled client adapters, plus the helpers they
 * share to read them. The execution machine itself ignores all of these.
 */
public final class RequestOptions
{
    /** {@code Map<String, String>} of request headers. */
    public static final String HEADERS = "headers";

    /** {@code Map<String, String>} of query parameters appended to the URL. */
    public static final String QUERY = "query";

    /** Request body as {@code String} (UTF-8) or {@code byte[]}. */
    public static final String BODY = "body";

    private RequestOptions() {
    }

    public static Map<String, String> headers(Request request) {
        return stringMap(request, HEADERS);
    }

    public static byte[] body(Request request) {
        Object body = request.options().get(BODY);
        if (body == null) {
            return new byte[0];
        }
        if (body instanceof byte[] bytes) {
            return bytes.clone();
        }
        if (body instanceof String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }
        throw new IllegalArgumentException("Unsupported body type " + body.getClass().getName());
    }

    /**
     * The request URL with {@link #QUERY} parameters appended.
     * Parameters are URL-encoded; an existing query string is kept.
     */
    public static String target(Request request) {
        Map<String, String> query = stringMap(request, QUERY);
        if (query.isEmpty()) {
            return request.url();
        }
        String encoded = query.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        String separator = request.url().contains("?") ? "&" : "?";
        return request.url() + separator + encoded;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static Map<String, String> stringMap(Request request, String key) {
        Object value = request.options().get(key);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("Option '" + key + "' must be a Map");
        }
        Map<String, String> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put(
                Objects.toString(k),
                Objects.toString(v)));
        return result;
    }
}
