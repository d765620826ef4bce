package com.questrail.courier.api;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Request
 * -----------------------------------------------------------------------------
 * The opaque request value shuttled between execution stages.
 *
 * <p>The execution machine never looks inside a request; only client adapters
 * interpret {@link #method()}, {@link #url()} and the keyword
 * {@link #options()} (see {@link RequestOptions} for the keys the bundled
 * adapters understand). Requests are immutable once created, so a retry that
 * wants a different request must build a new one.</p>
 */
public record Request(String method, String url, Map<String, Object> options)
{
    public Request {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        options = copyOptions(Objects.requireNonNull(options, "options"));
    }

    public static Request of(String method, String url) {
        return new Request(method, url, Map.of());
    }

    /**
     * Typed view of one option.
     *
     * @throws IllegalArgumentException if the option is present with another type
     */
    public <T> Optional<T> option(String key, Class<T> type) {
        Object value = options.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                    "Option '" + key + "' is a " + value.getClass().getName() + ", expected " + type.getName());
        }
        return Optional.of(type.cast(value));
    }

    /**
     * Returns a copy of this request with one option replaced.
     */
    public Request withOption(String key, Object value) {
        Map<String, Object> updated = new HashMap<>(options);
        updated.put(key, value);
        return new Request(method, url, updated);
    }

    // byte[] bodies and header/query maps are copied one level deep
    private static Map<String, Object> copyOptions(Map<String, Object> options) {
        Map<String, Object> copy = new HashMap<>(options);
        copy.replaceAll((key, value) -> {
            if (value instanceof byte[] bytes) {
                return bytes.clone();
            }
            if (value instanceof Map<?, ?> nested) {
                return Collections.unmodifiableMap(new LinkedHashMap<>(nested));
            }
            return value;
        });
        return Map.copyOf(copy);
    }
}
