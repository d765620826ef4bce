package com.questrail.courier.observability;

import com.questrail.courier.api.Request;

import java.time.Instant;

/**
 * Record representing a terminal failure or template defect in a request execution.
 */
public record ExecutionErrorEvent(
    Instant timestamp,
    Request request,
    String message,
    Throwable cause
) {
}
