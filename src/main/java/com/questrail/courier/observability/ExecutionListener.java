package com.questrail.courier.observability;

/**
 * Receives observability events from request executions.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on whatever thread the execution strategy is
 * stepping on (caller, worker or event loop); implementations must be
 * thread-safe and must not block.</p>
 */
public interface ExecutionListener {
    /**
     * Called after a request state has been replaced.
     * @param event the transition details
     */
    void onStateTransition(StateTransitionEvent event);

    /**
     * Called when an execution fails terminally or a template requests an
     * illegal transition.
     * @param event the error details
     */
    void onError(ExecutionErrorEvent event);
}
