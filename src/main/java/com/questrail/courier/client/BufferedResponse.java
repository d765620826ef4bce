package com.questrail.courier.client;

import com.questrail.courier.api.Response;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully received response. Header names keep the case they arrived with.
 */
public record BufferedResponse(int status, Map<String, List<String>> headers, byte[] body, Charset charset)
        implements Response
{
    public BufferedResponse {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(charset, "charset");
        headers = Map.copyOf(headers);
        body = body.clone();
    }

    public BufferedResponse(int status, Map<String, List<String>> headers, byte[] body) {
        this(status, headers, body, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    @Override
    public String text() {
        return new String(body, charset);
    }

    /**
     * First value of a header, matched case-insensitively.
     */
    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }

    @Override
    public String toString() {
        return "BufferedResponse[status=" + status + ", " + body.length + " bytes]";
    }
}
