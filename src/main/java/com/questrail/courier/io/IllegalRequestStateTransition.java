package com.questrail.courier.io;

/**
 * A transition was attempted that the current request state does not allow.
 *
 * <p>This indicates a defect (usually a {@link RequestTemplate} returning a
 * transition that is unreachable from the state it was consulted in), not a
 * runtime or network condition. It is never retried and never routed through
 * {@link RequestTemplate#afterException}.</p>
 */
public final class IllegalRequestStateTransition extends IllegalStateException
{
    private final transient RequestState<?> state;
    private final String transition;

    public IllegalRequestStateTransition(RequestState<?> state, String transition) {
        super("Illegal transition [" + transition + "] from request state [" + state
                + "]: this is possibly due to a badly designed RequestTemplate.");
        this.state = state;
        this.transition = transition;
    }

    public RequestState<?> state() {
        return state;
    }

    public String transition() {
        return transition;
    }
}
