package com.questrail.courier.observability;

import com.questrail.courier.io.IllegalRequestStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ExecutionListener that emits logs via SLF4J.
 */
public final class Slf4jExecutionListener implements ExecutionListener {
    private static final Logger log = LoggerFactory.getLogger(Slf4jExecutionListener.class);

    @Override
    public void onStateTransition(StateTransitionEvent event) {
        if (event.isTerminal()) {
            log.debug("Request {} {}: {} -> {}",
                event.to().request().method(),
                event.to().request().url(),
                event.from().name(),
                event.to().name());
        }
        else {
            log.trace("Request state: {} -> {}", event.from(), event.to());
        }
    }

    @Override
    public void onError(ExecutionErrorEvent event) {
        if (event.cause() instanceof IllegalRequestStateTransition) {
            log.error("Request template defect: {}", event.message(), event.cause());
        }
        else {
            log.warn("Request {} {} failed: {}",
                event.request().method(),
                event.request().url(),
                event.message());
        }
    }
}
