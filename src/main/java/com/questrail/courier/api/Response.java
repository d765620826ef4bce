package com.questrail.courier.api;

import java.util.List;
import java.util.Map;

/**
 * A response whose fields are all available synchronously.
 */
public interface Response
{
    int status();

    /**
     * Header names as received; values in arrival order.
     */
    Map<String, List<String>> headers();

    byte[] body();

    String text();
}
