package com.questrail.courier.retry;

import com.questrail.courier.exceptions.ClientException;
import com.questrail.courier.exceptions.ExceptionKind;
import com.questrail.courier.io.Failure;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides which outcomes of an attempt are worth another attempt.
 */
public interface RetryCondition<R>
{
    default boolean matchesFailure(Failure failure) {
        return false;
    }

    default boolean matchesResponse(R response) {
        return false;
    }

    /**
     * Retry failures of the given taxonomy kind or any of its sub-kinds.
     */
    static <R> RetryCondition<R> raises(ExceptionKind kind) {
        Objects.requireNonNull(kind, "kind");
        return new RetryCondition<>() {
            @Override
            public boolean matchesFailure(Failure failure) {
                return failure.value() instanceof ClientException e && e.kind().isSubKindOf(kind);
            }
        };
    }

    /**
     * Retry failures that are instances of {@code type}.
     */
    static <R> RetryCondition<R> raises(Class<? extends Throwable> type) {
        Objects.requireNonNull(type, "type");
        return new RetryCondition<>() {
            @Override
            public boolean matchesFailure(Failure failure) {
                return failure.is(type);
            }
        };
    }

    /**
     * Retry responses the predicate accepts, e.g. {@code r -> r.status() == 503}.
     */
    static <R> RetryCondition<R> response(Predicate<? super R> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new RetryCondition<>() {
            @Override
            public boolean matchesResponse(R response) {
                return predicate.test(response);
            }
        };
    }

    default RetryCondition<R> or(RetryCondition<R> other) {
        Objects.requireNonNull(other, "other");
        RetryCondition<R> self = this;
        return new RetryCondition<>() {
            @Override
            public boolean matchesFailure(Failure failure) {
                return self.matchesFailure(failure) || other.matchesFailure(failure);
            }

            @Override
            public boolean matchesResponse(R response) {
                return self.matchesResponse(response) || other.matchesResponse(response);
            }
        };
    }
}
