package com.questrail.courier.exceptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ExceptionTable
 * =============================================================================
 * Per-transport translation of native exceptions into the shared taxonomy.
 *
 * <h2>Rule evaluation</h2>
 * A table is an explicit list of {@code (native type -> kind)} rules, evaluated
 * most-specific-first: {@link Builder#build()} orders rules so that a native
 * subclass is always consulted before any of its superclasses, whatever order
 * they were declared in.
 *
 * <h2>Polymorphism</h2>
 * If native X is-a native Y, the kind chosen for X must be a sub-kind of the
 * kind chosen for Y. {@link Builder#build()} rejects tables that break this,
 * so a handler written for Y's kind also catches X.
 *
 * <h2>Fallback</h2>
 * A failure matching no rule but still belonging to the transport (an instance
 * of one of its root types) becomes {@link ExceptionKind#BASE_CLIENT_EXCEPTION}.
 *
 * <p>Tables are independent of each other; two transports never share rules.</p>
 */
public final class ExceptionTable
{
    /**
     * One translation rule.
     */
    public record Rule(Class<? extends Throwable> nativeType, ExceptionKind kind) {
        public Rule {
            Objects.requireNonNull(nativeType, "nativeType");
            Objects.requireNonNull(kind, "kind");
        }
    }

    private final String transport;
    private final List<Class<? extends Throwable>> roots;
    private final List<Class<? extends Throwable>> wrappers;
    private final List<Rule> rules;

    private ExceptionTable(String transport,
                           List<Class<? extends Throwable>> roots,
                           List<Class<? extends Throwable>> wrappers,
                           List<Rule> rules)
    {
        this.transport = transport;
        this.roots = List.copyOf(roots);
        this.wrappers = List.copyOf(wrappers);
        this.rules = List.copyOf(rules);
    }

    public static Builder builder(String transport) {
        return new Builder(transport);
    }

    /**
     * Name of the transport this table belongs to (diagnostic only).
     */
    public String transport() {
        return transport;
    }

    /**
     * Rules in evaluation order (most specific first).
     */
    public List<Rule> rules() {
        return rules;
    }

    /**
     * Determine the taxonomy kind of a failure.
     *
     * @return the kind, or empty if the failure does not belong to this transport
     */
    public Optional<ExceptionKind> kindOf(Throwable error) {
        Objects.requireNonNull(error, "error");

        if (error instanceof ClientException translated) {
            return Optional.of(translated.kind());
        }

        // bounded: cause chains can be cyclic
        Throwable candidate = error;
        for (int depth = 0; depth < 8 && candidate != null; depth++) {
            Optional<ExceptionKind> matched = match(candidate);
            if (matched.isPresent()) {
                return matched;
            }
            candidate = isWrapper(candidate) ? candidate.getCause() : null;
        }

        if (isTransportRelated(error)) {
            return Optional.of(ExceptionKind.BASE_CLIENT_EXCEPTION);
        }
        return Optional.empty();
    }

    /**
     * @return {@code true} if {@link #kindOf(Throwable)} would classify the failure
     */
    public boolean recognizes(Throwable error) {
        return kindOf(error).isPresent();
    }

    /**
     * Translate a native failure into its taxonomy exception.
     *
     * <p>Callers only route transport failures here, so an unrecognised
     * failure still becomes the root kind. An exception that is already a
     * {@link ClientException} is returned unchanged.</p>
     */
    public ClientException translate(Throwable error) {
        Objects.requireNonNull(error, "error");
        if (error instanceof ClientException translated) {
            return translated;
        }
        ExceptionKind kind = kindOf(error).orElse(ExceptionKind.BASE_CLIENT_EXCEPTION);
        return kind.wrap(error);
    }

    private boolean isTransportRelated(Throwable error) {
        for (Class<? extends Throwable> root : roots) {
            if (root.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    private Optional<ExceptionKind> match(Throwable error) {
        for (Rule rule : rules) {
            if (rule.nativeType().isInstance(error)) {
                return Optional.of(rule.kind());
            }
        }
        return Optional.empty();
    }

    private boolean isWrapper(Throwable error) {
        for (Class<? extends Throwable> wrapper : wrappers) {
            if (wrapper.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ExceptionTable[" + transport + ", " + rules.size() + " rules]";
    }

    public static final class Builder
    {
        private final String transport;
        private final List<Class<? extends Throwable>> roots = new ArrayList<>();
        private final List<Class<? extends Throwable>> wrappers = new ArrayList<>();
        private final List<Rule> rules = new ArrayList<>();

        private Builder(String transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        /**
         * Declare a root of the transport's own exception hierarchy.
         * Unmatched instances translate to the base kind.
         */
        public Builder root(Class<? extends Throwable> root) {
            roots.add(Objects.requireNonNull(root, "root"));
            return this;
        }

        /**
         * Declare a wrapper type whose cause should be matched instead of the
         * wrapper itself (e.g. a codec exception carrying a TLS failure).
         */
        public Builder unwrapping(Class<? extends Throwable> wrapper) {
            wrappers.add(Objects.requireNonNull(wrapper, "wrapper"));
            return this;
        }

        public Builder map(Class<? extends Throwable> nativeType, ExceptionKind kind) {
            for (Rule existing : rules) {
                if (existing.nativeType().equals(nativeType)) {
                    throw new IllegalArgumentException("Duplicate rule for " + nativeType.getName());
                }
            }
            rules.add(new Rule(nativeType, kind));
            return this;
        }

        public ExceptionTable build() {
            List<Rule> ordered = new ArrayList<>(rules);
            // deeper class = more specific; List.sort is stable for equal depths
            ordered.sort(Comparator.comparingInt((Rule r) -> depth(r.nativeType())).reversed());

            for (Rule specific : ordered) {
                for (Rule general : ordered) {
                    if (specific == general || !general.nativeType().isAssignableFrom(specific.nativeType())) {
                        continue;
                    }
                    if (!specific.kind().isSubKindOf(general.kind())) {
                        throw new IllegalArgumentException(
                                "Rule " + specific.nativeType().getSimpleName() + " -> " + specific.kind()
                                        + " breaks polymorphism with " + general.nativeType().getSimpleName()
                                        + " -> " + general.kind());
                    }
                }
            }

            return new ExceptionTable(transport, roots, wrappers, ordered);
        }

        private static int depth(Class<?> type) {
            int depth = 0;
            for (Class<?> c = type; c != null; c = c.getSuperclass()) {
                depth++;
            }
            return depth;
        }
    }
}
