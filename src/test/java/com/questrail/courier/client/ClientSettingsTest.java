package com.questrail.courier.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClientSettingsTest {

    @Test
    void defaultsAreUsable() {
        ClientSettings settings = ClientSettings.defaults();

        assertEquals(Duration.ofSeconds(10), settings.connectTimeout());
        assertEquals(Duration.ofSeconds(30), settings.responseTimeout());
        assertEquals(ClientSettings.DEFAULT_USER_AGENT, settings.userAgent());
        assertTrue(settings.defaultHeaders().isEmpty());
        assertEquals(1, settings.ioThreads());
    }

    @Test
    void toBuilderRoundTripsEveryField() {
        ClientSettings original = ClientSettings.builder()
                .withConnectTimeout(Duration.ofMillis(250))
                .withResponseTimeout(Duration.ZERO)
                .withUserAgent("probe/1")
                .withDefaultHeader("Accept", "application/json")
                .withIoThreads(3)
                .build();

        assertEquals(original, original.toBuilder().build());
    }

    @Test
    void zeroResponseTimeoutIsAllowed() {
        assertDoesNotThrow(() -> ClientSettings.builder().withResponseTimeout(Duration.ZERO).build());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> ClientSettings.builder().withConnectTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> ClientSettings.builder().withResponseTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> ClientSettings.builder().withIoThreads(0).build());
        assertThrows(NullPointerException.class,
                () -> ClientSettings.builder().withUserAgent(null).build());
    }

    @Test
    void defaultHeadersAreCopied() {
        ClientSettings.Builder builder = ClientSettings.builder().withDefaultHeader("X-Trace", "1");
        ClientSettings settings = builder.build();
        builder.withDefaultHeaders(Map.of("X-Other", "2"));

        assertEquals(Map.of("X-Trace", "1"), settings.defaultHeaders());
        assertThrows(UnsupportedOperationException.class, () -> settings.defaultHeaders().put("A", "b"));
    }
}
