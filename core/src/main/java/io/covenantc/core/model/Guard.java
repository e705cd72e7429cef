package io.covenantc.core.model;

import io.covenantc.core.spi.Clause;
import java.util.Objects;

/**
 * A named function producing the {@link Clause} that must hold before a branch's templates may
 * execute. The {@link Policy} decides whether the clause is computed once per contract instance
 * per compilation session ({@link Policy#CACHE}) or on every evaluation ({@link Policy#FRESH}).
 *
 * <p>
 * Guards are compared by identity: the session memo keys a cached clause on the guard object, so
 * a guard should be declared once (typically as a constant) and reused.
 *
 * @param <C> the contract instance type
 */
public final class Guard<C> {

    /** Caching policy of a guard. */
    public enum Policy {
        /** Evaluated at most once per contract instance per session; the result is reused. */
        CACHE,
        /** Evaluated on every call. */
        FRESH
    }

    /**
     * The clause-producing function. May perform external effects such as a remote lookup, but
     * MUST NOT mutate the contract instance.
     *
     * @param <C> the contract instance type
     */
    @FunctionalInterface
    public interface ClauseFunction<C> {
        Clause apply(C self, CompilationContext context);
    }

    private final String name;
    private final Policy policy;
    private final ClauseFunction<C> function;

    private Guard(String name, Policy policy, ClauseFunction<C> function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("guard name must not be null or blank");
        }
        this.name = name;
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.function = Objects.requireNonNull(function, "function must not be null");
    }

    /** Creates a guard whose clause is memoized per contract instance per session. */
    public static <C> Guard<C> cache(String name, ClauseFunction<C> function) {
        return new Guard<>(name, Policy.CACHE, function);
    }

    /** Creates a guard whose clause is recomputed on every evaluation. */
    public static <C> Guard<C> fresh(String name, ClauseFunction<C> function) {
        return new Guard<>(name, Policy.FRESH, function);
    }

    public String name() {
        return name;
    }

    public Policy policy() {
        return policy;
    }

    public boolean isCached() {
        return policy == Policy.CACHE;
    }

    /**
     * Invokes the underlying function directly, bypassing any memo. The compiler goes through
     * {@code CompilationSession#evaluate} instead.
     */
    public Clause compute(C self, CompilationContext context) {
        Clause clause = function.apply(self, context);
        if (clause == null) {
            throw new IllegalStateException("guard '" + name + "' returned a null clause");
        }
        return clause;
    }

    @Override
    public String toString() {
        return "Guard[" + name + ", " + policy + "]";
    }
}
