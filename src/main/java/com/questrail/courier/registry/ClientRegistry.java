package com.questrail.courier.registry;

import com.questrail.courier.api.Client;
import com.questrail.courier.client.HttpComponentsClient;
import com.questrail.courier.client.netty.NettyClient;
import com.questrail.courier.client.netty.NettySession;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * ClientRegistry
 * =============================================================================
 * Resolves whatever a caller configured as "the client" into a client adapter.
 *
 * <h2>Resolution order for {@link #getClient(Object)}</h2>
 * <ol>
 *   <li>{@code null}: the default client.</li>
 *   <li>A {@link Client} instance: itself.</li>
 *   <li>A {@link Client} class: a new instance from its no-arg constructor.</li>
 *   <li>Anything else: the first registered {@link Handler} that recognises
 *       it. Built in: an Apache {@link CloseableHttpClient} becomes an
 *       {@link HttpComponentsClient}, a {@link NettySession} becomes a
 *       {@link NettyClient}. Both adapters leave the caller's session open.</li>
 * </ol>
 * An unrecognised key resolves to {@link Optional#empty()}.
 *
 * <p>{@link #defaultRegistry()} is the only process-wide mutable state in the
 * library. Registration and default replacement are thread-safe.</p>
 */
public final class ClientRegistry
{
    private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);

    private static final ClientRegistry DEFAULT = new ClientRegistry();

    /**
     * Turns a key into a client adapter, or declines it.
     */
    @FunctionalInterface
    public interface Handler {
        Optional<Client<?>> resolve(Object key);
    }

    private final List<Handler> handlers = new CopyOnWriteArrayList<>();
    private volatile Object defaultClient = (Supplier<Client<?>>) HttpComponentsClient::new;

    public ClientRegistry() {
        register(CloseableHttpClient.class, HttpComponentsClient::new);
        register(NettySession.class, NettyClient::new);
    }

    public static ClientRegistry defaultRegistry() {
        return DEFAULT;
    }

    public void register(Handler handler) {
        handlers.add(Objects.requireNonNull(handler, "handler"));
    }

    /**
     * Register a handler for keys of one type.
     */
    public <K> void register(Class<K> keyType, Function<? super K, ? extends Client<?>> factory) {
        Objects.requireNonNull(keyType, "keyType");
        Objects.requireNonNull(factory, "factory");
        register(key -> keyType.isInstance(key)
                ? Optional.of(factory.apply(keyType.cast(key)))
                : Optional.empty());
    }

    /**
     * Set the default client: either a value or a {@link Supplier} that is
     * asked each time the default is needed.
     */
    public void setDefaultClient(Object client) {
        this.defaultClient = client;
    }

    /**
     * The default client value, or the result of the default supplier.
     */
    public Object getDefaultClient() {
        Object current = defaultClient;
        if (current instanceof Supplier<?> supplier) {
            return supplier.get();
        }
        return current;
    }

    public Optional<Client<?>> getClient(Object key) {
        if (key == null) {
            Object fallback = getDefaultClient();
            return fallback == null ? Optional.empty() : getClient(fallback);
        }
        if (key instanceof Client<?> client) {
            return Optional.of(client);
        }
        if (key instanceof Class<?> type && Client.class.isAssignableFrom(type)) {
            return Optional.of(instantiate(type));
        }
        for (Handler handler : handlers) {
            Optional<Client<?>> resolved = handler.resolve(key);
            if (resolved != null && resolved.isPresent()) {
                return resolved;
            }
        }
        log.debug("No client adapter registered for {}", key.getClass().getName());
        return Optional.empty();
    }

    private static Client<?> instantiate(Class<?> type) {
        try {
            return (Client<?>) type.getDeclaredConstructor().newInstance();
        }
        catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(type.getName() + " has no no-arg constructor", e);
        }
        catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Failed to create " + type.getName(), cause);
        }
        catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create " + type.getName(), e);
        }
    }
}
