package com.questrail.courier.observability;

import com.questrail.courier.io.RequestState;

import java.time.Instant;
import java.util.Objects;

/**
 * One request state replacement. The timestamp is wall-clock and
 * observational only.
 */
public record StateTransitionEvent(
    Instant timestamp,
    RequestState<?> from,
    RequestState<?> to
) {
    public StateTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public boolean isTerminal() {
        return to.isTerminal();
    }
}
