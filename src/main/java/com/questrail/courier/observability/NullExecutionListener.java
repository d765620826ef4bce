package com.questrail.courier.observability;

/**
 * No-op implementation of ExecutionListener.
 */
public final class NullExecutionListener implements ExecutionListener {
    public static final NullExecutionListener INSTANCE = new NullExecutionListener();

    private NullExecutionListener() {}

    @Override
    public void onStateTransition(StateTransitionEvent event) {}

    @Override
    public void onError(ExecutionErrorEvent event) {}
}
