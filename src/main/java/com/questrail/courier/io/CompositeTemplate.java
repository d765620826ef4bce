package com.questrail.courier.io;

import com.questrail.courier.api.Request;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Chains several templates: each hook returns the first non-empty transition,
 * consulting templates in the order given.
 */
public final class CompositeTemplate<R> implements RequestTemplate<R>
{
    private final List<RequestTemplate<R>> templates;

    public CompositeTemplate(List<? extends RequestTemplate<R>> templates) {
        this.templates = List.copyOf(templates);
    }

    @SafeVarargs
    public static <R> CompositeTemplate<R> of(RequestTemplate<R>... templates) {
        return new CompositeTemplate<>(List.of(templates));
    }

    @Override
    public Optional<Transition<R>> beforeRequest(Request request) {
        return first(t -> t.beforeRequest(request));
    }

    @Override
    public Optional<Transition<R>> afterResponse(Request request, R response) {
        return first(t -> t.afterResponse(request, response));
    }

    @Override
    public Optional<Transition<R>> afterException(Request request, Failure failure) {
        return first(t -> t.afterException(request, failure));
    }

    private Optional<Transition<R>> first(Function<RequestTemplate<R>, Optional<Transition<R>>> hook) {
        for (RequestTemplate<R> template : templates) {
            Optional<Transition<R>> transition = hook.apply(template);
            if (transition != null && transition.isPresent()) {
                return transition;
            }
        }
        return Optional.empty();
    }
}
